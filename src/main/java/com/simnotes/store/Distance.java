package com.simnotes.store;

import java.util.Locale;

public enum Distance {
    COSINE("Cosine"),
    EUCLID("Euclid"),
    DOT("Dot");

    private final String wireName;

    Distance(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Distance parse(String value) {
        if (value == null || value.isBlank()) {
            return COSINE;
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "cosine" -> COSINE;
            case "euclid", "euclidean" -> EUCLID;
            case "dot" -> DOT;
            default -> throw new IllegalArgumentException("Unknown distance metric: " + value);
        };
    }
}
