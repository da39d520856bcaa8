package com.simnotes.index;

public enum IndexOutcome {
    INDEXED,
    SKIPPED,
    FAILED
}
