package com.simnotes;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simnotes.embedding.EmbeddingService;
import com.simnotes.embedding.EmbeddingServices;
import com.simnotes.index.BulkReindexer;
import com.simnotes.index.CheckpointingEventListener;
import com.simnotes.index.IndexLedger;
import com.simnotes.index.IndexManager;
import com.simnotes.index.IndexOutcome;
import com.simnotes.index.IndexSettings;
import com.simnotes.index.IndexStatus;
import com.simnotes.index.LedgerEntry;
import com.simnotes.index.QueryException;
import com.simnotes.index.ReindexReport;
import com.simnotes.index.SimilarNote;
import com.simnotes.index.SimilarityResult;
import com.simnotes.notify.ConsoleNotificationSink;
import com.simnotes.notify.LoggingNotificationSink;
import com.simnotes.notify.NotificationSink;
import com.simnotes.runtime.AppConfig;
import com.simnotes.runtime.ConfigLoader;
import com.simnotes.store.StoreInitException;
import com.simnotes.store.VectorStore;
import com.simnotes.store.VectorStores;
import com.simnotes.vault.Document;
import com.simnotes.vault.FileSystemDocumentSource;
import com.simnotes.vault.VaultWatcher;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "sim-notes",
        mixinStandardHelpOptions = true,
        version = "sim-notes 0.1.0",
        description = "Index a vault of notes by meaning and find the notes most similar to a given one.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "reindex")
    Mode mode;

    @Option(names = "--vault", description = "Root directory of the note vault", defaultValue = ".")
    Path vaultPath;

    @Option(names = "--path", description = "Vault-relative note path for index, delete and similar modes")
    String notePath;

    @Option(names = "--ledger-path", description = "Path of the index ledger JSON (overrides index.ledgerPath)")
    Path ledgerPath;

    @Option(names = "--limit", description = "Maximum number of similar notes (overrides query.limit)")
    Integer limit;

    @Option(names = "--threshold", description = "Minimum similarity score (overrides query.scoreThreshold)")
    Double threshold;

    @Option(names = "--force", description = "Re-embed notes even when the ledger says they are unchanged")
    boolean force;

    @Option(names = "--log-notices", description = "Send operator notices to the log instead of stdout")
    boolean logNotices;

    private final OkHttpClient httpClient;
    private NotificationSink notifications;
    private final Map<String, String> environment;

    enum Mode {
        bootstrap,
        index,
        reindex,
        delete,
        similar,
        watch,
        status
    }

    public Main() {
        this(new OkHttpClient(), new ConsoleNotificationSink(), System.getenv());
    }

    Main(OkHttpClient httpClient, NotificationSink notifications, Map<String, String> environment) {
        this.httpClient = httpClient;
        this.notifications = notifications;
        this.environment = environment;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (logNotices) {
            notifications = new LoggingNotificationSink();
        }
        AppConfig config;
        try {
            config = new ConfigLoader(environment).load(configPath);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration in {}: {}", configPath, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        if (requiresNotePath() && (notePath == null || notePath.isBlank())) {
            log.error("--path is required in {} mode", mode);
            return EXIT_USAGE_ERROR;
        }

        Path ledgerFile = ledgerPath != null ? ledgerPath : Path.of(config.getIndex().getLedgerPath());
        IndexLedger ledger = IndexLedger.load(ledgerFile);
        if (mode == Mode.status) {
            printStatus(ledger);
            return EXIT_OK;
        }

        EmbeddingService embeddingService = EmbeddingServices.create(config.getEmbedding(), httpClient);
        VectorStore vectorStore = VectorStores.create(config.getStore(), httpClient);
        FileSystemDocumentSource documentSource = new FileSystemDocumentSource(vaultPath, config.getIndex().getExtensions());
        IndexManager indexManager = new IndexManager(
                embeddingService,
                vectorStore,
                documentSource,
                ledger,
                notifications,
                IndexSettings.fromConfig(config).withSkipUnchanged(!force && config.getIndex().isSkipUnchanged()));

        log.info("Starting sim-notes in {} mode", mode);
        log.info("Using config file: {}", configPath);
        log.info("Vault={} collection={} embedding={} store={}",
                documentSource.root(),
                config.getStore().getCollection(),
                embeddingService,
                vectorStore);

        try {
            indexManager.bootstrap();
        } catch (StoreInitException e) {
            log.error("Error ensuring collection exists", e);
            notifications.error("Failed to initialize collection " + config.getStore().getCollection());
            return EXIT_FAILURE;
        }

        try {
            return switch (mode) {
                case bootstrap -> EXIT_OK;
                case index -> runIndex(indexManager, documentSource);
                case delete -> indexManager.onDelete(notePath) ? EXIT_OK : EXIT_FAILURE;
                case reindex -> runReindex(indexManager, documentSource, config);
                case similar -> runSimilar(indexManager, documentSource, config);
                case watch -> runWatch(indexManager, documentSource, ledger, ledgerFile);
                case status -> EXIT_OK;
            };
        } finally {
            ledger.save(ledgerFile);
        }
    }

    private boolean requiresNotePath() {
        return mode == Mode.index || mode == Mode.delete || mode == Mode.similar;
    }

    private int runIndex(IndexManager indexManager, FileSystemDocumentSource documentSource) {
        Document document;
        try {
            document = documentSource.load(notePath);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Unable to read note {}: {}", notePath, e.getMessage());
            notifications.error("Failed to process note: " + notePath);
            return EXIT_FAILURE;
        }
        return indexManager.onCreateOrModify(document) == IndexOutcome.FAILED ? EXIT_FAILURE : EXIT_OK;
    }

    private int runReindex(IndexManager indexManager, FileSystemDocumentSource documentSource, AppConfig config) throws IOException {
        BulkReindexer reindexer = new BulkReindexer(
                indexManager,
                documentSource,
                notifications,
                config.getIndex().getParallelism(),
                config.getIndex().getProgressInterval());
        ReindexReport report = reindexer.reindexVault();
        for (String failed : report.failedPaths()) {
            log.warn("Not indexed: {}", failed);
        }
        return report.hasFailures() ? EXIT_FAILURE : EXIT_OK;
    }

    private int runSimilar(IndexManager indexManager, FileSystemDocumentSource documentSource, AppConfig config) {
        int effectiveLimit = limit != null ? limit : config.getQuery().getLimit();
        double effectiveThreshold = threshold != null ? threshold : config.getQuery().getScoreThreshold();
        if (effectiveLimit <= 0 || effectiveThreshold < 0.0 || effectiveThreshold > 1.0) {
            log.error("--limit must be positive and --threshold within [0, 1]");
            return EXIT_USAGE_ERROR;
        }
        SimilarityResult result;
        try {
            result = indexManager.query(documentSource.load(notePath), effectiveLimit, effectiveThreshold);
        } catch (IOException | IllegalArgumentException | QueryException e) {
            log.error("Error finding similar notes", e);
            notifications.error("Failed to find similar notes");
            return EXIT_FAILURE;
        }
        if (result.isEmpty()) {
            notifications.info("No similar notes found");
            return EXIT_OK;
        }
        notifications.info("Similar notes to " + result.queryPath() + ":");
        for (SimilarNote match : result.matches()) {
            notifications.info(formatMatch(match));
        }
        return EXIT_OK;
    }

    private int runWatch(IndexManager indexManager, FileSystemDocumentSource documentSource, IndexLedger ledger, Path ledgerFile)
            throws IOException, InterruptedException {
        try (VaultWatcher watcher = new VaultWatcher(documentSource, new CheckpointingEventListener(indexManager, ledger, ledgerFile))) {
            watcher.start();
            Thread shutdownHook = new Thread(() -> {
                watcher.requestStop();
                try {
                    ledger.save(ledgerFile);
                } catch (IOException e) {
                    log.warn("Unable to persist index ledger to {}", ledgerFile, e);
                }
            }, "sim-notes-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            notifications.info("Watching " + documentSource.root() + " for note changes. Press Ctrl+C to stop.");
            watcher.runLoop();
        }
        return EXIT_OK;
    }

    private void printStatus(IndexLedger ledger) {
        Map<IndexStatus, Integer> counts = ledger.counts();
        notifications.info("Index ledger: indexed=%d stale=%d failed=%d".formatted(
                counts.getOrDefault(IndexStatus.INDEXED, 0),
                counts.getOrDefault(IndexStatus.STALE, 0),
                counts.getOrDefault(IndexStatus.FAILED, 0)));
        for (LedgerEntry entry : ledger.entriesWithStatus(IndexStatus.FAILED)) {
            notifications.info("  failed: %s (%s)".formatted(entry.path(), entry.lastError()));
        }
    }

    static String formatMatch(SimilarNote match) {
        return "  %s (%s%% similar)".formatted(match.path(), String.format(Locale.ROOT, "%.1f", match.score() * 100));
    }
}
