package io.dagmesh.graph;

import io.dagmesh.model.ValidationResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Graph validation, cycle detection and topological ordering.
 *
 * <p>Nodes are interned into an index arena and adjacency is kept as {@code int[]} lists built
 * from {@link Node#dependencies()}, so traversal never follows object references.
 */
public final class DependencyResolver {
    private static final byte UNVISITED = 0;
    private static final byte IN_PROGRESS = 1;
    private static final byte DONE = 2;

    private DependencyResolver() {
    }

    public static ValidationResult validate(DagSpec spec) {
        if (spec == null) {
            return ValidationResult.fail("DAG spec is missing", "required_fields_validation", Map.of());
        }
        if (spec.id() == null || spec.id().isBlank()) {
            return ValidationResult.fail("DAG missing required fields: id", "required_fields_validation", Map.of());
        }
        if (spec.executionPolicy().maxConcurrency() < 1) {
            return ValidationResult.fail("maxConcurrency must be at least 1", "execution_policy_validation",
                    Map.of("maxConcurrency", spec.executionPolicy().maxConcurrency()));
        }
        Set<String> ids = new HashSet<>();
        for (Node node : spec.nodes()) {
            if (node.id() == null || node.id().isBlank()) {
                return ValidationResult.fail("Node id cannot be empty", "node_validation", Map.of());
            }
            if (!ids.add(node.id())) {
                return ValidationResult.fail("Duplicate node id: " + node.id(), "node_validation",
                        Map.of("nodeId", node.id()));
            }
        }
        for (Node node : spec.nodes()) {
            for (String dep : node.dependencies()) {
                if (!ids.contains(dep)) {
                    return ValidationResult.fail(
                            "Node " + node.id() + " depends on unknown node: " + dep,
                            "dependency_validation",
                            Map.of("nodeId", node.id(), "dependency", String.valueOf(dep))
                    );
                }
            }
        }
        Set<String> edgeIds = new HashSet<>();
        for (Edge edge : spec.edges()) {
            if (edge.id() == null || edge.id().isBlank() || !edgeIds.add(edge.id())) {
                return ValidationResult.fail("Edge id missing or duplicated: " + edge.id(), "edge_validation",
                        Map.of("edgeId", String.valueOf(edge.id())));
            }
            if (!ids.contains(edge.source()) || !ids.contains(edge.target())) {
                return ValidationResult.fail(
                        "Edge " + edge.id() + " references unknown node",
                        "edge_validation",
                        Map.of("edgeId", edge.id(), "source", String.valueOf(edge.source()),
                                "target", String.valueOf(edge.target()))
                );
            }
        }
        List<String> cycle = findCycle(spec.nodes());
        if (!cycle.isEmpty()) {
            return ValidationResult.fail(
                    "DAG has a circular dependency at node " + cycle.get(0) + ": " + String.join(" -> ", cycle),
                    "circular_dependency_check",
                    Map.of("nodeId", cycle.get(0), "cycle", cycle)
            );
        }
        return ValidationResult.ok("DAG validation passed", Map.of("type", "dag_validation"));
    }

    /**
     * Kahn's algorithm; among simultaneously ready nodes the smallest id goes first.
     *
     * @throws IllegalArgumentException if the spec does not validate
     */
    public static List<String> computeExecutionOrder(DagSpec spec) {
        ValidationResult validation = validate(spec);
        if (!validation.result()) {
            throw new IllegalArgumentException("Cannot order invalid DAG: " + validation.reason());
        }
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Node node : spec.nodes()) {
            inDegree.put(node.id(), new LinkedHashSet<>(node.dependencies()).size());
            for (String dep : new LinkedHashSet<>(node.dependencies())) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(node.id());
            }
        }
        PriorityQueue<String> ready = new PriorityQueue<>();
        for (Map.Entry<String, Integer> e : inDegree.entrySet()) {
            if (e.getValue() == 0) {
                ready.add(e.getKey());
            }
        }
        List<String> order = new ArrayList<>(spec.nodes().size());
        while (!ready.isEmpty()) {
            String next = ready.poll();
            order.add(next);
            for (String dependent : dependents.getOrDefault(next, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        return List.copyOf(order);
    }

    /**
     * Resolves a flat precedence list. The list itself is the resolution path, so an id that
     * appears again after its first occurrence is reported as circular.
     */
    public static DependencyResolution resolveDependencies(List<String> dependencies) {
        if (dependencies == null || dependencies.isEmpty()) {
            return new DependencyResolution(true, List.of(), List.of(), List.of(), List.of());
        }
        Set<String> onPath = new LinkedHashSet<>();
        Set<String> circular = new LinkedHashSet<>();
        List<String> unresolved = new ArrayList<>();
        for (String dep : dependencies) {
            if (dep == null || dep.isBlank()) {
                unresolved.add(String.valueOf(dep));
                continue;
            }
            if (!onPath.add(dep)) {
                circular.add(dep);
            }
        }
        List<String> resolved = List.copyOf(onPath);
        boolean success = circular.isEmpty() && unresolved.isEmpty();
        return new DependencyResolution(success, resolved, unresolved, List.copyOf(circular), resolved);
    }

    /**
     * Iterative three-colour DFS over the dependency relation. Returns the cycle as a path that
     * starts and ends on the same node, or an empty list when the graph is acyclic.
     */
    static List<String> findCycle(List<Node> nodes) {
        int n = nodes.size();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(nodes.get(i).id(), i);
        }
        int[][] adjacency = new int[n][];
        for (int i = 0; i < n; i++) {
            List<String> deps = nodes.get(i).dependencies();
            int[] edges = new int[deps.size()];
            for (int j = 0; j < deps.size(); j++) {
                Integer target = index.get(deps.get(j));
                edges[j] = target == null ? -1 : target;
            }
            adjacency[i] = edges;
        }
        byte[] color = new byte[n];
        int[] cursor = new int[n];
        for (int start = 0; start < n; start++) {
            if (color[start] != UNVISITED) {
                continue;
            }
            Deque<Integer> path = new ArrayDeque<>();
            path.push(start);
            color[start] = IN_PROGRESS;
            while (!path.isEmpty()) {
                int current = path.peek();
                if (cursor[current] < adjacency[current].length) {
                    int next = adjacency[current][cursor[current]++];
                    if (next < 0 || color[next] == DONE) {
                        continue;
                    }
                    if (color[next] == IN_PROGRESS) {
                        return describeCycle(nodes, path, next);
                    }
                    color[next] = IN_PROGRESS;
                    path.push(next);
                } else {
                    color[current] = DONE;
                    path.pop();
                }
            }
        }
        return List.of();
    }

    private static List<String> describeCycle(List<Node> nodes, Deque<Integer> path, int reentry) {
        List<Integer> ordered = new ArrayList<>(path);
        List<String> cycle = new ArrayList<>();
        // path is a stack: index 0 is the most recent node
        for (int i = ordered.size() - 1; i >= 0; i--) {
            int idx = ordered.get(i);
            if (!cycle.isEmpty() || idx == reentry) {
                cycle.add(nodes.get(idx).id());
            }
        }
        cycle.add(nodes.get(reentry).id());
        return List.copyOf(cycle);
    }
}
