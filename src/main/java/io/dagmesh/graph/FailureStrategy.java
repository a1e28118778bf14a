package io.dagmesh.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What the engine does once node failures exceed the execution policy's failure threshold.
 */
public enum FailureStrategy {
    /** Halt scheduling and fail the workflow immediately. */
    STOP,
    /** Keep independent branches running; the workflow fails once everything has settled. */
    CONTINUE,
    /** Enqueue the compensation tasks, then behave like {@link #STOP}. */
    COMPENSATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FailureStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return STOP;
        }
        for (FailureStrategy value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown failure strategy: " + raw);
    }
}
