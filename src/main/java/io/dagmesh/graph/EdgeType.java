package io.dagmesh.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EdgeType {
    SUCCESS,
    FAILURE,
    CONDITIONAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EdgeType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUCCESS;
        }
        for (EdgeType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown edge type: " + raw);
    }
}
