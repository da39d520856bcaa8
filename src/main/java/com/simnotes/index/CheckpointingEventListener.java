package com.simnotes.index;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simnotes.vault.DocumentEventKind;
import com.simnotes.vault.DocumentEventListener;

/**
 * Persists the ledger after every handled vault event, so a killed watcher loses at most the event in flight.
 */
public class CheckpointingEventListener implements DocumentEventListener {
    private static final Logger log = LoggerFactory.getLogger(CheckpointingEventListener.class);

    private final DocumentEventListener delegate;
    private final IndexLedger ledger;
    private final Path ledgerFile;

    public CheckpointingEventListener(DocumentEventListener delegate, IndexLedger ledger, Path ledgerFile) {
        this.delegate = delegate;
        this.ledger = ledger;
        this.ledgerFile = ledgerFile;
    }

    @Override
    public void onEvent(DocumentEventKind kind, String path) {
        try {
            delegate.onEvent(kind, path);
        } finally {
            checkpoint();
        }
    }

    void checkpoint() {
        try {
            ledger.save(ledgerFile);
        } catch (IOException e) {
            log.warn("Unable to persist index ledger to {} after event; retrying on the next one", ledgerFile, e);
        }
    }
}
