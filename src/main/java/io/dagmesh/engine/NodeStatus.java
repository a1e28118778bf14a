package io.dagmesh.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
