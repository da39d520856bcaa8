package com.simnotes.index;

import java.time.Duration;
import java.util.List;

public record ReindexReport(
        int totalDocuments,
        int indexedDocuments,
        int skippedDocuments,
        int failedDocuments,
        int removedDocuments,
        List<String> failedPaths,
        Duration elapsed) {

    public ReindexReport {
        failedPaths = List.copyOf(failedPaths);
    }

    public boolean hasFailures() {
        return failedDocuments > 0;
    }
}
