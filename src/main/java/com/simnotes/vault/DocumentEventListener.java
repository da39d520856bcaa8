package com.simnotes.vault;

@FunctionalInterface
public interface DocumentEventListener {
    void onEvent(DocumentEventKind kind, String path);
}
