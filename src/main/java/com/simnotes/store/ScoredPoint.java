package com.simnotes.store;

import java.util.Map;
import java.util.stream.Collectors;

public record ScoredPoint(PointId id, float score, Map<String, Object> payload) {
    public ScoredPoint {
        // Qdrant returns explicit nulls for unset payload fields; immutable maps cannot hold them
        payload = payload == null ? Map.of() : payload.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public String path() {
        Object path = payload.get(Point.PATH_KEY);
        return path == null ? null : path.toString();
    }
}
