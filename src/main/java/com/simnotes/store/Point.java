package com.simnotes.store;

import java.util.Map;
import java.util.stream.Collectors;

public record Point(PointId id, float[] vector, Map<String, Object> payload) {
    public static final String PATH_KEY = "path";

    public Point {
        // null values are dropped
        payload = payload == null ? Map.of() : payload.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static Point forPath(PointId id, float[] vector, String path) {
        return new Point(id, vector, Map.of(PATH_KEY, path));
    }
}
