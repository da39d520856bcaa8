package com.simnotes.index;

public interface ReindexProgressListener {
    ReindexProgressListener NONE = new ReindexProgressListener() {
    };

    default void onStart(int totalDocuments) {
    }

    default void onProgress(int completedDocuments, int totalDocuments) {
    }

    default void onComplete(ReindexReport report) {
    }
}
