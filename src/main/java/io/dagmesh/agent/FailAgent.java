package io.dagmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public final class FailAgent implements Agent {
    private final String id;
    private final AgentState state = new AgentState();

    public FailAgent() {
        this("fail");
    }

    public FailAgent(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String role() {
        return "Failure Injector";
    }

    @Override
    public void initialize() {
        state.ready();
    }

    @Override
    public void shutdown() {
        state.ready();
    }

    @Override
    public AgentStatus getStatus() {
        return state.snapshot(Map.of());
    }

    @Override
    public void handleEvent(String eventType, JsonNode payload) {
        state.recordEvent(eventType);
        throw new IllegalStateException("intentional failure from fail agent");
    }
}
