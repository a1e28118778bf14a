package io.dagmesh.agent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agent id to live handle. Writers copy the map and publish it whole, so readers always see a
 * complete membership, including across {@link #replaceAll(Collection)}.
 */
public final class AgentRegistry {
    private volatile Map<String, Entry> agents = Map.of();

    /**
     * @return false when the id is already registered; the existing handle is kept
     */
    public synchronized boolean register(Agent agent) {
        if (agent == null || agent.id() == null || agent.id().isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (agents.containsKey(agent.id())) {
            return false;
        }
        Map<String, Entry> next = new LinkedHashMap<>(agents);
        next.put(agent.id(), new Entry(agent.id(), agent.role(), agent, Instant.now()));
        agents = Collections.unmodifiableMap(next);
        return true;
    }

    public synchronized boolean unregister(String agentId) {
        if (agentId == null || !agents.containsKey(agentId)) {
            return false;
        }
        Map<String, Entry> next = new LinkedHashMap<>(agents);
        next.remove(agentId);
        agents = Collections.unmodifiableMap(next);
        return true;
    }

    public Agent get(String agentId) {
        Entry entry = agentId == null ? null : agents.get(agentId);
        return entry == null ? null : entry.handle();
    }

    public Optional<Agent> findById(String agentId) {
        return Optional.ofNullable(get(agentId));
    }

    public boolean contains(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }

    public Map<String, Agent> all() {
        Map<String, Agent> out = new LinkedHashMap<>();
        for (Entry entry : agents.values()) {
            out.put(entry.id(), entry.handle());
        }
        return Collections.unmodifiableMap(out);
    }

    public List<Entry> entries() {
        return List.copyOf(agents.values());
    }

    public int size() {
        return agents.size();
    }

    /**
     * Swaps the whole membership in one publication; used by snapshot restore.
     */
    public synchronized void replaceAll(Collection<Entry> entries) {
        Map<String, Entry> next = new LinkedHashMap<>();
        for (Entry entry : new ArrayList<>(entries)) {
            next.put(entry.id(), entry);
        }
        agents = Collections.unmodifiableMap(next);
    }

    public record Entry(String id, String roleLabel, Agent handle, Instant registeredAt) {
    }
}
