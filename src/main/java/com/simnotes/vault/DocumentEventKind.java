package com.simnotes.vault;

public enum DocumentEventKind {
    CREATE,
    MODIFY,
    DELETE
}
