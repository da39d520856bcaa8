package com.simnotes.index;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simnotes.notify.NotificationLevel;
import com.simnotes.notify.NotificationSink;
import com.simnotes.vault.Document;
import com.simnotes.vault.DocumentSource;

public class BulkReindexer {
    private static final Logger log = LoggerFactory.getLogger(BulkReindexer.class);

    private final IndexManager indexManager;
    private final DocumentSource documentSource;
    private final NotificationSink notifications;
    private final int parallelism;
    private final int progressInterval;

    public BulkReindexer(IndexManager indexManager, DocumentSource documentSource, NotificationSink notifications) {
        this(indexManager, documentSource, notifications, 1, 10);
    }

    public BulkReindexer(
            IndexManager indexManager,
            DocumentSource documentSource,
            NotificationSink notifications,
            int parallelism,
            int progressInterval) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be positive");
        }
        this.indexManager = indexManager;
        this.documentSource = documentSource;
        this.notifications = notifications;
        this.parallelism = parallelism;
        this.progressInterval = progressInterval;
    }

    public ReindexReport reindexVault() throws IOException {
        return reindexVault(ReindexProgressListener.NONE);
    }

    /**
     * Re-indexes every note the source lists, then deletes points for ledger paths that no longer exist.
     */
    public ReindexReport reindexVault(ReindexProgressListener listener) throws IOException {
        List<String> paths = documentSource.listPaths();
        List<PendingDocument> pending = paths.stream()
                .map(path -> new PendingDocument(path, () -> documentSource.load(path)))
                .toList();
        Set<String> present = new HashSet<>(paths);
        List<String> vanished = indexManager.ledger().paths().stream()
                .filter(path -> !present.contains(path))
                .toList();
        return run(pending, vanished, listener);
    }

    public ReindexReport reindexAll(List<Document> documents) {
        return reindexAll(documents, ReindexProgressListener.NONE);
    }

    public ReindexReport reindexAll(List<Document> documents, ReindexProgressListener listener) {
        List<PendingDocument> pending = documents.stream()
                .map(document -> new PendingDocument(document.path(), () -> document))
                .toList();
        return run(pending, List.of(), listener);
    }

    private ReindexReport run(List<PendingDocument> pending, List<String> vanished, ReindexProgressListener listener) {
        long start = System.nanoTime();
        int total = pending.size();
        Counters counters = new Counters();

        publish(NotificationLevel.INFO, "Processing %d notes...".formatted(total));
        listener.onStart(total);

        List<Callable<Void>> tasks = new ArrayList<>(total);
        for (PendingDocument document : pending) {
            tasks.add(() -> {
                process(document, counters);
                int done = counters.completed.incrementAndGet();
                if (done % progressInterval == 0) {
                    publish(NotificationLevel.INFO, "Processed %d/%d notes".formatted(done, total));
                    listener.onProgress(done, total);
                }
                return null;
            });
        }
        execute(tasks);

        int removed = 0;
        for (String path : vanished) {
            if (indexManager.onDelete(path)) {
                removed++;
            } else {
                counters.recordFailure(path);
            }
        }

        ReindexReport report = new ReindexReport(
                total,
                counters.indexed.get(),
                counters.skipped.get(),
                counters.failed.get(),
                removed,
                counters.failedPaths.stream().sorted().toList(),
                Duration.ofNanos(System.nanoTime() - start));
        log.info("Reindex finished: total={}, indexed={}, skipped={}, failed={}, removed={}, elapsedMs={}",
                report.totalDocuments(),
                report.indexedDocuments(),
                report.skippedDocuments(),
                report.failedDocuments(),
                report.removedDocuments(),
                report.elapsed().toMillis());
        publish(report.hasFailures() ? NotificationLevel.WARN : NotificationLevel.INFO,
                "All notes processed! indexed=%d skipped=%d failed=%d removed=%d".formatted(
                        report.indexedDocuments(),
                        report.skippedDocuments(),
                        report.failedDocuments(),
                        report.removedDocuments()));
        listener.onComplete(report);
        return report;
    }

    private void execute(List<Callable<Void>> tasks) {
        if (parallelism == 1) {
            for (Callable<Void> task : tasks) {
                try {
                    task.call();
                } catch (Exception e) {
                    log.error("Reindex task failed unexpectedly", e);
                    throw new IllegalStateException("Reindex task failed unexpectedly", e);
                }
            }
            return;
        }
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            for (Future<Void> future : executor.invokeAll(tasks)) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.error("Reindex task failed unexpectedly", e.getCause());
                    throw new IllegalStateException("Reindex task failed unexpectedly", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Reindex interrupted; remaining notes were not processed");
        } finally {
            executor.shutdownNow();
        }
    }

    private void process(PendingDocument pending, Counters counters) {
        IndexOutcome outcome;
        try {
            outcome = indexManager.onCreateOrModify(pending.loader().load());
        } catch (IOException | RuntimeException e) {
            log.error("Error processing note {}: {}", pending.path(), e.getMessage(), e);
            publish(NotificationLevel.ERROR, "Failed to process note: " + pending.path());
            outcome = IndexOutcome.FAILED;
        }
        switch (outcome) {
            case INDEXED -> counters.indexed.incrementAndGet();
            case SKIPPED -> counters.skipped.incrementAndGet();
            case FAILED -> counters.recordFailure(pending.path());
        }
    }

    private void publish(NotificationLevel level, String message) {
        try {
            notifications.notify(level, message);
        } catch (RuntimeException e) {
            log.warn("Notification sink rejected message '{}': {}", message, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface DocumentLoader {
        Document load() throws IOException;
    }

    private record PendingDocument(String path, DocumentLoader loader) {
    }

    private static final class Counters {
        private final AtomicInteger completed = new AtomicInteger();
        private final AtomicInteger indexed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final Queue<String> failedPaths = new ConcurrentLinkedQueue<>();

        private void recordFailure(String path) {
            failed.incrementAndGet();
            failedPaths.add(path);
        }
    }
}
