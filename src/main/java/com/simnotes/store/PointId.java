package com.simnotes.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public record PointId(String value) {
    public PointId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("point id must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PointId of(String value) {
        return new PointId(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
