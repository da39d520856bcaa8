package com.simnotes.index;

import java.time.Instant;

public record LedgerEntry(
        String path,
        IndexStatus status,
        String pointId,
        String fingerprint,
        String embeddingVersion,
        String target,
        String lastError,
        Instant updatedAt) {
}
