package io.dagmesh.routing;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.agent.Agent;
import io.dagmesh.agent.AgentRegistry;
import io.dagmesh.observability.AuditLogger;
import io.dagmesh.util.Ids;
import io.dagmesh.util.Jsons;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unicast and broadcast delivery of typed events to registered agents.
 *
 * <p>Each target has a delivery lane: a chain of futures where an event starts only after the
 * previous event for the same target finished, so a target sees events in {@code routeEvent}
 * invocation order. Different targets are delivered independently.
 *
 * <p>A caller-side deadline ({@code eventTimeoutMs}) turns a slow delivery into a failed
 * {@link RoutingResult} without breaking the lane; the handler keeps running to completion.
 */
public final class EventRouter {
    public static final String MESH_SOURCE = "mesh";
    public static final String ANY_EVENT = "*";

    private final AgentRegistry registry;
    private final AuditLogger audit;
    private final Executor executor;
    private final ConcurrentMap<String, CompletableFuture<RoutingResult>> lanes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> subscriptions = new ConcurrentHashMap<>();
    private final Deque<AgentInteraction> interactions = new ArrayDeque<>();
    private final AtomicLong routed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong broadcasts = new AtomicLong();
    private volatile long eventTimeoutMs;
    private volatile int maxInteractions;

    public EventRouter(AgentRegistry registry, AuditLogger audit, Executor executor, long eventTimeoutMs, int maxInteractions) {
        this.registry = registry;
        this.audit = audit;
        this.executor = executor;
        this.eventTimeoutMs = Math.max(1L, eventTimeoutMs);
        this.maxInteractions = Math.max(1, maxInteractions);
    }

    public RoutingResult routeEvent(String eventType, JsonNode payload, String targetId) {
        return routeEvent(eventType, payload, targetId, null);
    }

    public RoutingResult routeEvent(String eventType, JsonNode payload, String targetId, String sourceId) {
        return routeEventAsync(eventType, payload, targetId, sourceId).join();
    }

    public CompletableFuture<RoutingResult> routeEventAsync(String eventType, JsonNode payload, String targetId, String sourceId) {
        return routeEventAsync(eventType, payload, targetId, sourceId, null);
    }

    /**
     * The returned future always completes normally. A positive {@code timeoutMs} replaces the
     * router's event timeout for this delivery.
     */
    public CompletableFuture<RoutingResult> routeEventAsync(String eventType, JsonNode payload, String targetId,
                                                            String sourceId, Long timeoutMs) {
        Agent target = registry.get(targetId);
        if (target == null) {
            RoutingResult result = RoutingResult.failed(eventType, sourceId, targetId,
                    "Target agent not registered: " + targetId, 0L);
            record(sourceId, result);
            return CompletableFuture.completedFuture(result);
        }
        JsonNode owned = Jsons.copy(payload);
        CompletableFuture<RoutingResult> delivery = enqueue(targetId, () -> deliver(target, eventType, owned, sourceId));
        long timeout = timeoutMs != null && timeoutMs > 0 ? timeoutMs : eventTimeoutMs;
        return delivery.copy()
                .orTimeout(timeout, TimeUnit.MILLISECONDS)
                .handle((delivered, error) -> {
                    RoutingResult result = delivered;
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        String message = cause instanceof TimeoutException
                                ? "Event delivery timed out after " + timeout + "ms"
                                : String.valueOf(cause.getMessage());
                        result = RoutingResult.failed(eventType, sourceId, targetId, message, timeout);
                    }
                    record(sourceId, result);
                    return result;
                });
    }

    public BroadcastResult broadcastEvent(String eventType, JsonNode payload, String sourceId) {
        return broadcastEvent(eventType, payload, sourceId, BroadcastScope.EXCLUDE_SOURCE);
    }

    /**
     * Delivers to every registered agent whose subscriptions accept {@code eventType}. Deliveries
     * are independent; one failing recipient does not stop the others.
     */
    public BroadcastResult broadcastEvent(String eventType, JsonNode payload, String sourceId, BroadcastScope scope) {
        BroadcastScope effective = scope == null ? BroadcastScope.EXCLUDE_SOURCE : scope;
        broadcasts.incrementAndGet();
        Map<String, CompletableFuture<RoutingResult>> pending = new LinkedHashMap<>();
        for (String agentId : registry.all().keySet()) {
            if (effective == BroadcastScope.EXCLUDE_SOURCE && agentId.equals(sourceId)) {
                continue;
            }
            if (!acceptsBroadcast(agentId, eventType)) {
                continue;
            }
            pending.put(agentId, routeEventAsync(eventType, payload, agentId, sourceId));
        }
        List<String> delivered = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<RoutingResult>> e : pending.entrySet()) {
            RoutingResult result = e.getValue().join();
            if (result.success()) {
                delivered.add(e.getKey());
            } else {
                failures.put(e.getKey(), result.error());
            }
        }
        boolean success = !delivered.isEmpty();
        audit.log(AuditLogger.AuditEvent.of(
                "event.broadcast",
                actor(sourceId),
                "event/" + eventType,
                success ? "ok" : "failed",
                Map.of("recipients", pending.size(), "delivered", delivered.size(), "failed", failures.size())
        ));
        return new BroadcastResult(success, eventType, effective, List.copyOf(pending.keySet()), delivered, failures, Instant.now());
    }

    public void subscribeToEvents(String agentId, Collection<String> eventTypes) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId cannot be empty");
        }
        if (eventTypes == null || eventTypes.isEmpty()) {
            return;
        }
        Set<String> interests = subscriptions.computeIfAbsent(agentId, k -> ConcurrentHashMap.newKeySet());
        for (String type : eventTypes) {
            if (type != null && !type.isBlank()) {
                interests.add(type.trim());
            }
        }
    }

    /**
     * Removes the given interests; a null or empty collection clears every interest of the agent.
     */
    public void unsubscribeFromEvents(String agentId, Collection<String> eventTypes) {
        if (agentId == null) {
            return;
        }
        if (eventTypes == null || eventTypes.isEmpty()) {
            subscriptions.remove(agentId);
            return;
        }
        subscriptions.computeIfPresent(agentId, (k, interests) -> {
            interests.removeAll(eventTypes);
            return interests.isEmpty() ? null : interests;
        });
    }

    public Set<String> subscriptions(String agentId) {
        Set<String> interests = agentId == null ? null : subscriptions.get(agentId);
        return interests == null ? Set.of() : Set.copyOf(new TreeSet<>(interests));
    }

    public Map<String, List<String>> subscriptionTable() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> e : subscriptions.entrySet()) {
            out.put(e.getKey(), List.copyOf(new TreeSet<>(e.getValue())));
        }
        return out;
    }

    public void replaceSubscriptions(Map<String, List<String>> table) {
        Map<String, Set<String>> next = new LinkedHashMap<>();
        if (table != null) {
            for (Map.Entry<String, List<String>> e : table.entrySet()) {
                Set<String> interests = ConcurrentHashMap.newKeySet();
                interests.addAll(e.getValue());
                next.put(e.getKey(), interests);
            }
        }
        subscriptions.keySet().retainAll(next.keySet());
        subscriptions.putAll(next);
    }

    /**
     * Agents without any subscription receive every broadcast.
     */
    public boolean acceptsBroadcast(String agentId, String eventType) {
        Set<String> interests = subscriptions.get(agentId);
        if (interests == null || interests.isEmpty()) {
            return true;
        }
        return interests.contains(eventType) || interests.contains(ANY_EVENT);
    }

    public List<AgentInteraction> getAgentInteractions(String agentId) {
        List<AgentInteraction> out = new ArrayList<>();
        synchronized (interactions) {
            for (AgentInteraction interaction : interactions) {
                if (agentId == null || interaction.involves(agentId)) {
                    out.add(interaction);
                }
            }
        }
        return List.copyOf(out);
    }

    public RouterStats stats() {
        return new RouterStats(routed.get(), failed.get(), broadcasts.get(), subscriptions.size());
    }

    public void reconfigure(long newEventTimeoutMs, int newMaxInteractions) {
        this.eventTimeoutMs = Math.max(1L, newEventTimeoutMs);
        this.maxInteractions = Math.max(1, newMaxInteractions);
        synchronized (interactions) {
            trimInteractions();
        }
    }

    private CompletableFuture<RoutingResult> enqueue(String targetId, Delivery delivery) {
        @SuppressWarnings("unchecked")
        CompletableFuture<RoutingResult>[] created = new CompletableFuture[1];
        lanes.compute(targetId, (id, tail) -> {
            CompletableFuture<?> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            created[0] = previous.handle((ignored, error) -> null)
                    .thenApplyAsync(ignored -> delivery.run(), executor);
            return created[0];
        });
        CompletableFuture<RoutingResult> next = created[0];
        next.whenComplete((r, e) -> lanes.remove(targetId, next));
        return next;
    }

    private RoutingResult deliver(Agent target, String eventType, JsonNode payload, String sourceId) {
        long started = System.nanoTime();
        RoutingResult result;
        try {
            target.handleEvent(eventType, payload);
            result = RoutingResult.delivered(eventType, sourceId, target.id(), elapsedMs(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = RoutingResult.failed(eventType, sourceId, target.id(), "Delivery interrupted", elapsedMs(started));
        } catch (Exception e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            result = RoutingResult.failed(eventType, sourceId, target.id(), message, elapsedMs(started));
        }
        return result;
    }

    private void record(String sourceId, RoutingResult result) {
        (result.success() ? routed : failed).incrementAndGet();
        AgentInteraction interaction = new AgentInteraction(
                Ids.newId("int"),
                result.routingPath().isEmpty() ? actor(sourceId) : result.routingPath().get(0),
                result.routedTo(),
                result.eventType(),
                result.success(),
                result.error(),
                result.timestamp(),
                result.durationMs()
        );
        synchronized (interactions) {
            interactions.addLast(interaction);
            trimInteractions();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventType", result.eventType());
        details.put("durationMs", result.durationMs());
        details.put("error", result.error());
        audit.log(AuditLogger.AuditEvent.of(
                "event.routed",
                actor(sourceId),
                "agent/" + result.routedTo(),
                result.success() ? "ok" : "failed",
                details
        ));
    }

    private void trimInteractions() {
        while (interactions.size() > maxInteractions) {
            interactions.removeFirst();
        }
    }

    private static String actor(String sourceId) {
        return sourceId == null || sourceId.isBlank() ? MESH_SOURCE : sourceId;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @FunctionalInterface
    private interface Delivery {
        RoutingResult run();
    }
}
