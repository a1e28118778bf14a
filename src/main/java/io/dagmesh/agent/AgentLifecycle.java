package io.dagmesh.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentLifecycle {
    INITIALIZING,
    READY,
    ERROR,
    SHUTTING_DOWN,
    TERMINATED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
