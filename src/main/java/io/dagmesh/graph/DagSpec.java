package io.dagmesh.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of a workflow graph. Node and edge lists keep declaration order;
 * {@link DependencyResolver#validate(DagSpec)} enforces id uniqueness.
 */
public record DagSpec(
        String id,
        String name,
        String version,
        List<Node> nodes,
        List<Edge> edges,
        ExecutionPolicy executionPolicy,
        FailureHandling failureHandling,
        Map<String, Object> metadata
) {
    public DagSpec {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        executionPolicy = executionPolicy == null ? ExecutionPolicy.defaults() : executionPolicy;
        failureHandling = failureHandling == null ? FailureHandling.stop() : failureHandling;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static DagSpec of(String id, List<Node> nodes, ExecutionPolicy policy) {
        return new DagSpec(id, id, "1.0.0", nodes, List.of(), policy, FailureHandling.stop(), Map.of());
    }

    public DagSpec withId(String newId) {
        return new DagSpec(newId, name, version, nodes, edges, executionPolicy, failureHandling, metadata);
    }

    public DagSpec withFailureHandling(FailureHandling handling) {
        return new DagSpec(id, name, version, nodes, edges, executionPolicy, handling, metadata);
    }

    public DagSpec withEdges(List<Edge> newEdges) {
        return new DagSpec(id, name, version, nodes, newEdges, executionPolicy, failureHandling, metadata);
    }

    public Optional<Node> node(String nodeId) {
        for (Node node : nodes) {
            if (node.id() != null && node.id().equals(nodeId)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }
}
