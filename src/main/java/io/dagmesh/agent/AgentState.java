package io.dagmesh.agent;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle bookkeeping shared by the built-in agents through composition.
 */
public final class AgentState {
    private final Instant createdAt = Instant.now();
    private final AtomicReference<AgentLifecycle> lifecycle = new AtomicReference<>(AgentLifecycle.INITIALIZING);
    private final AtomicReference<String> lastEvent = new AtomicReference<>();
    private final AtomicLong eventsHandled = new AtomicLong();

    public void ready() {
        lifecycle.set(AgentLifecycle.READY);
    }

    public void error() {
        lifecycle.set(AgentLifecycle.ERROR);
    }

    public AgentLifecycle lifecycle() {
        return lifecycle.get();
    }

    public void recordEvent(String eventType) {
        lastEvent.set(eventType);
        eventsHandled.incrementAndGet();
    }

    public long uptimeMs() {
        return Math.max(0L, Instant.now().toEpochMilli() - createdAt.toEpochMilli());
    }

    public AgentStatus snapshot(Map<String, Object> details) {
        return new AgentStatus(lifecycle.get(), uptimeMs(), lastEvent.get(), eventsHandled.get(), details);
    }
}
