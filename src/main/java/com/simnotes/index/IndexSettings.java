package com.simnotes.index;

import com.simnotes.runtime.AppConfig;
import com.simnotes.store.Distance;

public record IndexSettings(
        String collection,
        Distance distance,
        int limit,
        double scoreThreshold,
        boolean skipUnchanged) {

    public IndexSettings {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be blank");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (scoreThreshold < 0.0 || scoreThreshold > 1.0) {
            throw new IllegalArgumentException("scoreThreshold must be within [0, 1]");
        }
    }

    public IndexSettings withSkipUnchanged(boolean skip) {
        return new IndexSettings(collection, distance, limit, scoreThreshold, skip);
    }

    public static IndexSettings fromConfig(AppConfig config) {
        return new IndexSettings(
                config.getStore().getCollection(),
                Distance.parse(config.getStore().getDistance()),
                config.getQuery().getLimit(),
                config.getQuery().getScoreThreshold(),
                config.getIndex().isSkipUnchanged());
    }
}
