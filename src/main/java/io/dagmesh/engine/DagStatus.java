package io.dagmesh.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DagStatus {
    CREATED,
    VALIDATING,
    RUNNING,
    PAUSED,
    COMPLETED,
    CANCELLED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean terminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
