package com.simnotes.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.simnotes.notify.NotificationLevel;
import com.simnotes.store.Distance;
import com.simnotes.store.LocalJsonVectorStore;
import com.simnotes.store.PointId;
import com.simnotes.store.StoreQueryException;
import com.simnotes.store.StoreWriteException;
import com.simnotes.support.FixedEmbeddingService;
import com.simnotes.support.InMemoryDocumentSource;
import com.simnotes.support.RecordingNotificationSink;
import com.simnotes.vault.Document;
import com.simnotes.vault.DocumentEventKind;

class IndexManagerTest {
    private static final IndexSettings SETTINGS = new IndexSettings("notes", Distance.COSINE, 5, 0.70, true);

    private FixedEmbeddingService embeddings;
    private LocalJsonVectorStore store;
    private InMemoryDocumentSource source;
    private IndexLedger ledger;
    private RecordingNotificationSink notifications;
    private IndexManager manager;

    @BeforeEach
    void setUp() {
        embeddings = new FixedEmbeddingService(3)
                .vector("apple", 1f, 0f, 0f)
                .vector("apple fruit", 0.9f, 0.1f, 0f)
                .vector("tax return", 0f, 0f, 1f);
        store = new LocalJsonVectorStore();
        source = new InMemoryDocumentSource();
        ledger = new IndexLedger();
        notifications = new RecordingNotificationSink();
        manager = newManager(store, SETTINGS);
        manager.bootstrap();
    }

    private IndexManager newManager(LocalJsonVectorStore vectorStore, IndexSettings settings) {
        return new IndexManager(embeddings, vectorStore, source, ledger, notifications, settings);
    }

    @Test
    void shouldFindSimilarNoteAndExcludeQueryNote() {
        manager.onCreateOrModify(new Document("a.md", "apple"));
        manager.onCreateOrModify(new Document("b.md", "apple fruit"));
        manager.onCreateOrModify(new Document("c.md", "tax return"));

        SimilarityResult result = manager.query(new Document("a.md", "apple"));

        assertEquals("a.md", result.queryPath());
        assertEquals(1, result.matches().size());
        assertEquals("b.md", result.matches().get(0).path());
        assertTrue(result.matches().get(0).score() > 0.99f);
        assertFalse(result.contains("a.md"));
    }

    @Test
    void shouldReportEmptyResultWhenNothingClearsThreshold() {
        manager.onCreateOrModify(new Document("a.md", "apple"));
        manager.onCreateOrModify(new Document("c.md", "tax return"));

        SimilarityResult result = manager.query(new Document("a.md", "apple"));

        assertTrue(result.isEmpty());
    }

    @Test
    void shouldSkipUnchangedContentAndKeepSinglePoint() {
        Document note = new Document("a.md", "apple");

        assertEquals(IndexOutcome.INDEXED, manager.onCreateOrModify(note));
        assertEquals(IndexOutcome.SKIPPED, manager.onCreateOrModify(note));

        assertEquals(1, embeddings.calls());
        assertEquals(1, store.size("notes"));
        assertEquals(IndexStatus.INDEXED, ledger.status("a.md"));
    }

    @Test
    void shouldOverwriteSamePointWhenSkipDisabled() {
        IndexManager eager = newManager(store, new IndexSettings("notes", Distance.COSINE, 5, 0.70, false));
        Document note = new Document("a.md", "apple");

        assertEquals(IndexOutcome.INDEXED, eager.onCreateOrModify(note));
        assertEquals(IndexOutcome.INDEXED, eager.onCreateOrModify(note));

        assertEquals(2, embeddings.calls());
        assertEquals(1, store.size("notes"));
    }

    @Test
    void shouldReindexWhenContentOrEmbeddingVersionChanges() {
        manager.onCreateOrModify(new Document("a.md", "apple"));

        assertEquals(IndexOutcome.INDEXED, manager.onCreateOrModify(new Document("a.md", "apple fruit")));
        embeddings.version("fixed-v2");
        assertEquals(IndexOutcome.INDEXED, manager.onCreateOrModify(new Document("a.md", "apple fruit")));

        assertEquals(1, store.size("notes"));
        assertEquals("fixed-v2", ledger.entry("a.md").orElseThrow().embeddingVersion());
        assertEquals(PointIds.pointId("a.md").value(), ledger.entry("a.md").orElseThrow().pointId());
    }

    @Test
    void shouldRecordFailureAndNotifyWhenEmbeddingFails() {
        embeddings.failFor("broken");

        IndexOutcome outcome = manager.onCreateOrModify(new Document("x.md", "broken"));

        assertEquals(IndexOutcome.FAILED, outcome);
        assertEquals(IndexStatus.FAILED, ledger.status("x.md"));
        assertEquals(0, store.size("notes"));
        assertEquals(List.of("Failed to process note: x.md"), notifications.texts(NotificationLevel.ERROR));

        embeddings.recover("broken");
        assertEquals(IndexOutcome.INDEXED, manager.onCreateOrModify(new Document("x.md", "broken")));
        assertEquals(IndexStatus.INDEXED, ledger.status("x.md"));
    }

    @Test
    void shouldRejectEmbeddingWithWrongDimension() {
        embeddings.vector("short", 1f, 0f);

        assertEquals(IndexOutcome.FAILED, manager.onCreateOrModify(new Document("s.md", "short")));
        assertEquals(0, store.size("notes"));
        assertTrue(ledger.entry("s.md").orElseThrow().lastError().contains("2 dimensions"));
    }

    @Test
    void shouldMarkPreviouslyIndexedNoteFailedWhenUpdateFails() {
        manager.onCreateOrModify(new Document("a.md", "apple"));
        embeddings.failFor("apple v2");

        manager.onCreateOrModify(new Document("a.md", "apple v2"));

        LedgerEntry entry = ledger.entry("a.md").orElseThrow();
        assertEquals(IndexStatus.FAILED, entry.status());
        assertEquals(IndexLedger.fingerprint("apple"), entry.fingerprint());
        assertEquals(1, store.size("notes"));
    }

    @Test
    void shouldDeletePointAndLedgerEntry() {
        manager.onCreateOrModify(new Document("a.md", "apple"));

        assertTrue(manager.onDelete("a.md"));

        assertEquals(0, store.size("notes"));
        assertEquals(IndexStatus.UNINDEXED, ledger.status("a.md"));
        assertTrue(notifications.contains("Embedding deleted for: a.md"));
        assertTrue(manager.onDelete("never-indexed.md"));
    }

    @Test
    void shouldNeverReturnDeletedNoteFromLaterQueries() {
        manager.onCreateOrModify(new Document("a.md", "apple"));
        manager.onCreateOrModify(new Document("b.md", "apple fruit"));
        assertTrue(manager.query(new Document("q.md", "apple")).contains("b.md"));

        manager.onDelete("b.md");

        SimilarityResult afterDelete = manager.query(new Document("q.md", "apple fruit"), 5, 0.0);
        assertFalse(afterDelete.contains("b.md"));
        assertTrue(afterDelete.contains("a.md"));
    }

    @Test
    void shouldMarkFailedWhenDeleteFails() {
        IndexManager failing = newManager(new FailingDeleteStore(), SETTINGS);
        failing.bootstrap();
        failing.onCreateOrModify(new Document("a.md", "apple"));

        assertFalse(failing.onDelete("a.md"));

        assertEquals(IndexStatus.FAILED, ledger.status("a.md"));
        assertTrue(notifications.contains("Failed to delete embedding for: a.md"));
    }

    @Test
    void shouldHonourLimitAndOrderByScore() {
        embeddings.vector("query", 1f, 0f, 0f);
        for (int k = 1; k <= 6; k++) {
            embeddings.vector("near " + k, 1f, k * 0.05f, 0f);
            manager.onCreateOrModify(new Document("n" + k + ".md", "near " + k));
        }

        SimilarityResult result = manager.query(new Document("q.md", "query"), 3, 0.70);

        assertEquals(List.of("n1.md", "n2.md", "n3.md"), result.matches().stream().map(SimilarNote::path).toList());
        assertTrue(result.matches().get(0).score() >= result.matches().get(1).score());
    }

    @Test
    void shouldReturnFullLimitEvenWhenQueryNoteIsIndexed() {
        embeddings.vector("query", 1f, 0f, 0f);
        manager.onCreateOrModify(new Document("q.md", "query"));
        for (int k = 1; k <= 3; k++) {
            embeddings.vector("near " + k, 1f, k * 0.05f, 0f);
            manager.onCreateOrModify(new Document("n" + k + ".md", "near " + k));
        }

        SimilarityResult result = manager.query(new Document("q.md", "query"), 3, 0.70);

        assertEquals(3, result.matches().size());
        assertFalse(result.contains("q.md"));
    }

    @Test
    void shouldApplyScoreThresholdInclusively() {
        embeddings.vector("diagonal", 1f, 1f, 0f);
        manager.onCreateOrModify(new Document("d.md", "diagonal"));

        assertTrue(manager.query(new Document("q.md", "apple"), 5, 0.70).contains("d.md"));
        assertTrue(manager.query(new Document("q.md", "apple"), 5, 0.71).isEmpty());
    }

    @Test
    void shouldKeepScoreExactlyAtThreshold() {
        IndexManager dot = newManager(new LocalJsonVectorStore(), new IndexSettings("notes", Distance.DOT, 5, 0.70, true));
        dot.bootstrap();
        embeddings.vector("boundary", 0.7f, 0f, 0f);
        dot.onCreateOrModify(new Document("edge.md", "boundary"));

        SimilarityResult result = dot.query(new Document("q.md", "apple"), 5, 0.70);

        assertEquals(List.of(new SimilarNote("edge.md", 0.7f)), result.matches());
    }

    @Test
    void shouldReindexUnchangedNotesIntoRenamedCollection() {
        manager.onCreateOrModify(new Document("a.md", "apple"));
        IndexManager renamed = newManager(store, new IndexSettings("renamed", Distance.COSINE, 5, 0.70, true));
        renamed.bootstrap();

        assertEquals(IndexOutcome.INDEXED, renamed.onCreateOrModify(new Document("a.md", "apple")));
        assertEquals(1, store.size("renamed"));
        assertEquals(IndexOutcome.SKIPPED, renamed.onCreateOrModify(new Document("a.md", "apple")));
    }

    @Test
    void shouldReindexUnchangedNotesWhenCollectionWasRecreated(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("vectors.json");
        IndexManager first = newManager(LocalJsonVectorStore.open(file), SETTINGS);
        first.bootstrap();
        first.onCreateOrModify(new Document("a.md", "apple"));
        Files.delete(file);

        LocalJsonVectorStore recreated = LocalJsonVectorStore.open(file);
        IndexManager second = newManager(recreated, SETTINGS);
        second.bootstrap();

        assertEquals(IndexStatus.STALE, ledger.status("a.md"));
        assertEquals(IndexOutcome.INDEXED, second.onCreateOrModify(new Document("a.md", "apple")));
        assertEquals(1, recreated.size("notes"));
    }

    @Test
    void shouldWrapQueryFailures() {
        embeddings.failFor("broken");
        assertThrows(QueryException.class, () -> manager.query(new Document("x.md", "broken")));

        IndexManager unbootstrapped = newManager(new LocalJsonVectorStore(), SETTINGS);
        QueryException error = assertThrows(QueryException.class, () -> unbootstrapped.query(new Document("a.md", "apple")));
        assertTrue(error.getCause() instanceof StoreQueryException);

        assertThrows(QueryException.class, () -> manager.query("missing.md"));
    }

    @Test
    void shouldHandleVaultEvents() {
        source.put("a.md", "apple");
        manager.onEvent(DocumentEventKind.CREATE, "a.md");
        assertEquals(IndexStatus.INDEXED, ledger.status("a.md"));

        source.put("a.md", "apple fruit");
        manager.onEvent(DocumentEventKind.MODIFY, "a.md");
        assertEquals(IndexLedger.fingerprint("apple fruit"), ledger.entry("a.md").orElseThrow().fingerprint());

        source.remove("a.md");
        manager.onEvent(DocumentEventKind.DELETE, "a.md");
        assertEquals(0, store.size("notes"));
        assertEquals(IndexStatus.UNINDEXED, ledger.status("a.md"));
    }

    @Test
    void shouldNotifyWhenEventNoteCannotBeRead() {
        source.put("locked.md", "apple").unreadable("locked.md");

        manager.onEvent(DocumentEventKind.MODIFY, "locked.md");

        assertEquals(List.of("Failed to process note: locked.md"), notifications.texts(NotificationLevel.ERROR));
        assertEquals(0, store.size("notes"));
    }

    @Test
    void shouldKeepOnePointPerPathUnderConcurrentUpdates() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IndexOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 40; i++) {
                String path = "n" + (i % 4) + ".md";
                String content = "revision " + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return manager.onCreateOrModify(new Document(path, content));
                }));
            }
            start.countDown();
            for (Future<IndexOutcome> future : futures) {
                assertEquals(IndexOutcome.INDEXED, future.get());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(4, store.size("notes"));
        assertEquals(4, ledger.entriesWithStatus(IndexStatus.INDEXED).size());
    }

    @Test
    void shouldSurviveNotificationSinkFailure() {
        IndexManager noisy = new IndexManager(embeddings.failFor("broken"), store, source, ledger, (level, message) -> {
            throw new IllegalStateException("sink offline");
        }, SETTINGS);

        assertEquals(IndexOutcome.FAILED, noisy.onCreateOrModify(new Document("x.md", "broken")));
        assertTrue(noisy.onDelete("x.md"));
    }

    private static final class FailingDeleteStore extends LocalJsonVectorStore {
        @Override
        public synchronized void delete(String collection, PointId id) {
            throw new StoreWriteException("Failed to delete embedding " + id + ": HTTP 503 Service Unavailable");
        }
    }
}
