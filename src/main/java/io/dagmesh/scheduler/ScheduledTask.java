package io.dagmesh.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.model.Priority;
import io.dagmesh.model.RetryPolicy;
import io.dagmesh.util.Jsons;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Independent unit of work outside any DAG.
 *
 * @param type         action sent to the agent; defaults to {@code task.execute}
 * @param agentId      executing agent, {@code null} for the mesh default agent
 * @param dependencies ids of other scheduled tasks that must succeed first; unknown ids are ignored
 * @param metadata     may carry {@code compensationTasks} (list of names) and {@code workflowId}
 */
public record ScheduledTask(
        String id,
        String name,
        String type,
        String agentId,
        JsonNode parameters,
        List<String> dependencies,
        Long timeout,
        Priority priority,
        RetryPolicy retryPolicy,
        Map<String, Object> metadata
) {
    public static final String DEFAULT_ACTION = "task.execute";
    public static final String COMPENSATION_ACTION = "task.compensate";

    public ScheduledTask {
        parameters = Jsons.copy(parameters);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        priority = priority == null ? Priority.NORMAL : priority;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ScheduledTask of(String name, String type) {
        return new ScheduledTask(null, name, type, null, null, List.of(), null, Priority.NORMAL, null, Map.of());
    }

    public ScheduledTask withId(String newId) {
        return new ScheduledTask(newId, name, type, agentId, parameters, dependencies, timeout, priority, retryPolicy, metadata);
    }

    public ScheduledTask withAgent(String newAgentId) {
        return new ScheduledTask(id, name, type, newAgentId, parameters, dependencies, timeout, priority, retryPolicy, metadata);
    }

    public ScheduledTask withPriority(Priority newPriority) {
        return new ScheduledTask(id, name, type, agentId, parameters, dependencies, timeout, newPriority, retryPolicy, metadata);
    }

    public ScheduledTask withRetryPolicy(RetryPolicy policy) {
        return new ScheduledTask(id, name, type, agentId, parameters, dependencies, timeout, priority, policy, metadata);
    }

    public ScheduledTask withDependencies(List<String> deps) {
        return new ScheduledTask(id, name, type, agentId, parameters, deps, timeout, priority, retryPolicy, metadata);
    }

    public ScheduledTask withMetadata(Map<String, Object> meta) {
        return new ScheduledTask(id, name, type, agentId, parameters, dependencies, timeout, priority, retryPolicy, meta);
    }

    public ScheduledTask withParameters(JsonNode params) {
        return new ScheduledTask(id, name, type, agentId, params, dependencies, timeout, priority, retryPolicy, metadata);
    }

    public String action() {
        return type == null || type.isBlank() ? DEFAULT_ACTION : type;
    }

    public String workflowId() {
        Object raw = metadata.get("workflowId");
        return raw == null ? null : raw.toString();
    }

    public List<String> compensationTasks() {
        Object raw = metadata.get("compensationTasks");
        if (!(raw instanceof List)) {
            return List.of();
        }
        return ((List<?>) raw).stream().filter(v -> v != null).map(Object::toString).toList();
    }
}
