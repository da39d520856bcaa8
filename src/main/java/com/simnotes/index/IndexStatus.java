package com.simnotes.index;

public enum IndexStatus {
    UNINDEXED,
    INDEXED,
    STALE,
    FAILED
}
