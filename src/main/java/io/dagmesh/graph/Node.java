package io.dagmesh.graph;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.model.RetryPolicy;
import io.dagmesh.util.Jsons;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One unit of work in a DAG. {@code dependencies} is the authoritative precedence list.
 *
 * @param agentId     agent that executes a {@code task} node; {@code null} means the mesh default agent
 * @param taskType    action name sent to the agent; defaults to {@code task.execute}
 * @param timeout     per-dispatch deadline in milliseconds, {@code null} to use the execution policy
 * @param retryPolicy overrides the retry budget derived from the execution policy
 */
public record Node(
        String id,
        String name,
        NodeType type,
        String taskType,
        String agentId,
        List<String> dependencies,
        Long timeout,
        RetryPolicy retryPolicy,
        JsonNode parameters,
        Map<String, Object> metadata
) {
    public static final String DEFAULT_ACTION = "task.execute";

    public Node {
        type = type == null ? NodeType.TASK : type;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        parameters = Jsons.copy(parameters);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Node task(String id, String... dependencies) {
        return new Node(id, id, NodeType.TASK, null, null, List.of(dependencies), null, null, null, null);
    }

    public static Node task(String id, String agentId, String taskType, List<String> dependencies) {
        return new Node(id, id, NodeType.TASK, taskType, agentId, dependencies, null, null, null, null);
    }

    public Node withTimeout(long timeoutMs) {
        return new Node(id, name, type, taskType, agentId, dependencies, timeoutMs, retryPolicy, parameters, metadata);
    }

    public Node withRetryPolicy(RetryPolicy policy) {
        return new Node(id, name, type, taskType, agentId, dependencies, timeout, policy, parameters, metadata);
    }

    public Node withParameters(JsonNode params) {
        return new Node(id, name, type, taskType, agentId, dependencies, timeout, retryPolicy, params, metadata);
    }

    public String action() {
        return taskType == null || taskType.isBlank() ? DEFAULT_ACTION : taskType;
    }

    /**
     * Decision and merge nodes are evaluated by the engine itself.
     */
    public boolean dispatchable() {
        return type == NodeType.TASK;
    }
}
