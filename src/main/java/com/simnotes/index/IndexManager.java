package com.simnotes.index;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simnotes.SimNotesException;
import com.simnotes.embedding.EmbeddingService;
import com.simnotes.embedding.EmbeddingServiceException;
import com.simnotes.notify.NotificationLevel;
import com.simnotes.notify.NotificationSink;
import com.simnotes.store.Point;
import com.simnotes.store.PointId;
import com.simnotes.store.ScoredPoint;
import com.simnotes.store.VectorStore;
import com.simnotes.vault.Document;
import com.simnotes.vault.DocumentEventKind;
import com.simnotes.vault.DocumentEventListener;
import com.simnotes.vault.DocumentSource;

/**
 * Keeps the vector store in step with the vault and answers similar-note queries.
 *
 * <p>Index and delete failures are logged, reported to the notification sink and recorded in the ledger;
 * they are never retried and never thrown. Query failures surface as {@link QueryException}. Operations on
 * the same path are serialized; operations on different paths may run concurrently.
 */
public class IndexManager implements DocumentEventListener {
    private static final Logger log = LoggerFactory.getLogger(IndexManager.class);
    private static final int LOCK_STRIPES = 64;

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final DocumentSource documentSource;
    private final IndexLedger ledger;
    private final NotificationSink notifications;
    private final IndexSettings settings;
    private final PathLocks locks = new PathLocks(LOCK_STRIPES);
    private final String target;

    public IndexManager(
            EmbeddingService embeddingService,
            VectorStore vectorStore,
            DocumentSource documentSource,
            IndexLedger ledger,
            NotificationSink notifications,
            IndexSettings settings) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.documentSource = documentSource;
        this.ledger = ledger;
        this.notifications = notifications;
        this.settings = settings;
        this.target = vectorStore.location() + "#" + settings.collection();
    }

    public void bootstrap() {
        boolean created = vectorStore.ensureCollection(settings.collection(), embeddingService.dimension(), settings.distance());
        if (created) {
            int invalidated = ledger.invalidateTarget(target);
            if (invalidated > 0) {
                log.info("Collection {} was created empty; {} ledger entries marked stale", settings.collection(), invalidated);
            }
        }
    }

    public IndexOutcome onCreateOrModify(Document document) {
        String path = document.path();
        ReentrantLock lock = locks.lockFor(path);
        lock.lock();
        try {
            String fingerprint = IndexLedger.fingerprint(document.content());
            if (settings.skipUnchanged() && ledger.isCurrent(path, fingerprint, embeddingService.version(), target)) {
                log.debug("index.skip path={} reason=unchanged", path);
                return IndexOutcome.SKIPPED;
            }
            ledger.markStale(path);
            PointId pointId = PointIds.pointId(path);
            try {
                float[] vector = embeddingService.embed(document.content());
                if (vector.length != embeddingService.dimension()) {
                    throw new EmbeddingServiceException("Embedding for %s has %d dimensions, collection expects %d"
                            .formatted(path, vector.length, embeddingService.dimension()));
                }
                vectorStore.upsert(settings.collection(), Point.forPath(pointId, vector, path));
                ledger.markIndexed(path, pointId, fingerprint, embeddingService.version(), target);
                log.debug("index.ok path={} pointId={}", path, pointId);
                return IndexOutcome.INDEXED;
            } catch (SimNotesException e) {
                ledger.markFailed(path, pointId, e.getMessage());
                log.error("Error processing note {}: {}", path, e.getMessage(), e);
                publish(NotificationLevel.ERROR, "Failed to process note: " + path);
                return IndexOutcome.FAILED;
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean onDelete(String path) {
        ReentrantLock lock = locks.lockFor(path);
        lock.lock();
        try {
            PointId pointId = PointIds.pointId(path);
            try {
                vectorStore.delete(settings.collection(), pointId);
            } catch (SimNotesException e) {
                ledger.markFailed(path, pointId, e.getMessage());
                log.error("Error deleting embedding for {}: {}", path, e.getMessage(), e);
                publish(NotificationLevel.ERROR, "Failed to delete embedding for: " + path);
                return false;
            }
            ledger.remove(path);
            log.debug("delete.ok path={} pointId={}", path, pointId);
            publish(NotificationLevel.INFO, "Embedding deleted for: " + path);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onEvent(DocumentEventKind kind, String path) {
        if (kind == DocumentEventKind.DELETE) {
            onDelete(path);
            return;
        }
        // read under the path lock so a delete arriving meanwhile cannot be overtaken by this upsert
        ReentrantLock lock = locks.lockFor(path);
        lock.lock();
        try {
            Document document;
            try {
                document = documentSource.load(path);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Unable to read note {} after {} event: {}", path, kind, e.getMessage());
                publish(NotificationLevel.ERROR, "Failed to process note: " + path);
                return;
            }
            onCreateOrModify(document);
        } finally {
            lock.unlock();
        }
    }

    public SimilarityResult query(String path) {
        Document document;
        try {
            document = documentSource.load(path);
        } catch (IOException | IllegalArgumentException e) {
            throw new QueryException("Failed to read note " + path + ": " + e.getMessage(), e);
        }
        return query(document);
    }

    public SimilarityResult query(Document document) {
        return query(document, settings.limit(), settings.scoreThreshold());
    }

    public SimilarityResult query(Document document, int limit, double scoreThreshold) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        String path = document.path();
        PointId self = PointIds.pointId(path);
        List<ScoredPoint> hits;
        try {
            float[] vector = embeddingService.embed(document.content());
            // one extra hit leaves room for the note's own point
            hits = vectorStore.search(settings.collection(), vector, limit + 1, scoreThreshold);
        } catch (SimNotesException e) {
            throw new QueryException("Failed to find similar notes for " + path + ": " + e.getMessage(), e);
        }
        float threshold = (float) scoreThreshold;
        List<SimilarNote> matches = hits.stream()
                .filter(hit -> hit.path() != null)
                .filter(hit -> !hit.id().equals(self) && !hit.path().equals(path))
                .filter(hit -> hit.score() >= threshold)
                .sorted(Comparator.comparing(ScoredPoint::score).reversed())
                .limit(limit)
                .map(hit -> new SimilarNote(hit.path(), hit.score()))
                .toList();
        if (matches.isEmpty()) {
            log.debug("query.empty path={} threshold={}", path, scoreThreshold);
            return SimilarityResult.empty(path);
        }
        return new SimilarityResult(path, matches);
    }

    public IndexLedger ledger() {
        return ledger;
    }

    public IndexSettings settings() {
        return settings;
    }

    private void publish(NotificationLevel level, String message) {
        try {
            notifications.notify(level, message);
        } catch (RuntimeException e) {
            log.warn("Notification sink rejected message '{}': {}", message, e.getMessage());
        }
    }
}
