package io.dagmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BackoffStrategy {
    LINEAR,
    EXPONENTIAL,
    CONSTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BackoffStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return EXPONENTIAL;
        }
        for (BackoffStrategy value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown backoff strategy: " + raw);
    }
}
