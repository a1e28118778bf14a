package io.dagmesh.scheduler;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskRunStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
