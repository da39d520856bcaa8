package com.simnotes.vault;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates file-system changes under the vault root into document lifecycle events.
 */
public class VaultWatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VaultWatcher.class);
    private static final long POLL_INTERVAL_MS = 250;

    private final FileSystemDocumentSource source;
    private final DocumentEventListener listener;
    private final WatchService watchService;
    private final Map<WatchKey, Path> directories = new HashMap<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public VaultWatcher(FileSystemDocumentSource source, DocumentEventListener listener) throws IOException {
        this.source = source;
        this.listener = listener;
        this.watchService = source.root().getFileSystem().newWatchService();
    }

    public void start() throws IOException {
        registerTree(source.root());
        log.info("Watching vault {} ({} directories)", source.root(), directories.size());
    }

    public void runLoop() throws InterruptedException {
        while (!stopRequested.get()) {
            WatchKey key;
            try {
                key = watchService.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed, leaving watch loop");
                return;
            }
            if (key == null) {
                continue;
            }
            Path directory = directories.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == OVERFLOW) {
                    log.warn("File events were dropped for {}; run a full reindex to resynchronise", directory);
                    continue;
                }
                if (directory != null) {
                    dispatch(event.kind(), directory.resolve((Path) event.context()));
                }
            }
            if (!key.reset()) {
                directories.remove(key);
            }
        }
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    void dispatch(WatchEvent.Kind<?> kind, Path absolute) {
        if (kind == ENTRY_CREATE && Files.isDirectory(absolute)) {
            registerNewDirectory(absolute);
            return;
        }
        Path relative = source.root().relativize(absolute);
        if (!source.accepts(relative)) {
            return;
        }
        DocumentEventKind eventKind;
        if (kind == ENTRY_CREATE) {
            eventKind = DocumentEventKind.CREATE;
        } else if (kind == ENTRY_MODIFY) {
            eventKind = DocumentEventKind.MODIFY;
        } else if (kind == ENTRY_DELETE) {
            eventKind = DocumentEventKind.DELETE;
        } else {
            return;
        }
        publish(eventKind, FileSystemDocumentSource.toVaultPath(relative));
    }

    private void registerNewDirectory(Path directory) {
        try {
            registerTree(directory);
            List<String> moved;
            try (Stream<Path> files = Files.walk(directory)) {
                moved = files.filter(Files::isRegularFile)
                        .map(source.root()::relativize)
                        .filter(source::accepts)
                        .map(FileSystemDocumentSource::toVaultPath)
                        .toList();
            }
            moved.forEach(path -> publish(DocumentEventKind.CREATE, path));
        } catch (IOException e) {
            log.error("Unable to watch new directory {}", directory, e);
        }
    }

    private void publish(DocumentEventKind kind, String path) {
        log.debug("vault.event kind={} path={}", kind, path);
        try {
            listener.onEvent(kind, path);
        } catch (RuntimeException e) {
            log.error("Listener failed handling {} for {}", kind, path, e);
        }
    }

    private void registerTree(Path start) throws IOException {
        try (Stream<Path> paths = Files.walk(start)) {
            for (Path directory : paths.filter(Files::isDirectory).toList()) {
                if (FileSystemDocumentSource.isHidden(source.root().relativize(directory))) {
                    continue;
                }
                WatchKey key = directory.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                directories.put(key, directory);
            }
        }
    }

    @Override
    public void close() throws IOException {
        requestStop();
        watchService.close();
    }
}
