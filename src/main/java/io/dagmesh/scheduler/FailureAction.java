package io.dagmesh.scheduler;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FailureAction {
    RETRY,
    COMPENSATE,
    FAIL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
