package io.dagmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.util.Jsons;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Accepts every event and keeps the most recent ones for inspection.
 */
public final class EchoAgent implements Agent {
    private static final int MAX_RECEIVED = 256;

    private final String id;
    private final String role;
    private final AgentState state = new AgentState();
    private final Deque<ReceivedEvent> received = new ArrayDeque<>();

    public EchoAgent() {
        this("echo", "Echo");
    }

    public EchoAgent(String id, String role) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("echo agent id cannot be empty");
        }
        this.id = id;
        this.role = role == null || role.isBlank() ? "Echo" : role;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String role() {
        return role;
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
        return state.snapshot(Map.of("received", receivedCount()));
    }

    @Override
    public void handleEvent(String eventType, JsonNode payload) {
        state.recordEvent(eventType);
        synchronized (received) {
            received.addLast(new ReceivedEvent(eventType, Jsons.copy(payload), Instant.now()));
            while (received.size() > MAX_RECEIVED) {
                received.removeFirst();
            }
        }
    }

    public List<ReceivedEvent> received() {
        synchronized (received) {
            return List.copyOf(received);
        }
    }

    private int receivedCount() {
        synchronized (received) {
            return received.size();
        }
    }

    public record ReceivedEvent(String type, JsonNode payload, Instant receivedAt) {
    }
}
