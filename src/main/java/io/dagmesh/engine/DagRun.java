package io.dagmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.graph.DagSpec;
import io.dagmesh.graph.Node;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable runtime state of one DAG. Every field is guarded by the run's monitor and only
 * {@link WorkflowEngine} touches it.
 */
final class DagRun {
    final String dagId;
    final Map<String, NodeRun> nodes = new LinkedHashMap<>();
    final List<String> errors = new ArrayList<>();
    final CompletableFuture<DagStatus> termination = new CompletableFuture<>();
    DagSpec spec;
    DagStatus status = DagStatus.CREATED;
    List<String> executionOrder = List.of();
    Map<String, List<String>> dependents = Map.of();
    int failureCount;
    boolean thresholdBreached;
    boolean compensated;
    boolean detached;
    int inFlight;
    String executionId;
    Instant createdAt = Instant.now();
    Instant startedAt;
    Instant completedAt;

    DagRun(DagSpec spec) {
        this.dagId = spec.id();
        this.spec = spec;
        resetNodes();
    }

    void resetNodes() {
        nodes.clear();
        for (Node node : spec.nodes()) {
            nodes.put(node.id(), new NodeRun(node));
        }
    }

    void indexDependents() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Node node : spec.nodes()) {
            for (String dep : node.dependencies()) {
                out.computeIfAbsent(dep, k -> new ArrayList<>()).add(node.id());
            }
        }
        dependents = out;
    }

    static final class NodeRun {
        final Node node;
        NodeStatus status = NodeStatus.PENDING;
        int attempts;
        String lastError;
        JsonNode output;
        Instant startedAt;
        Instant finishedAt;
        boolean waitingRetry;

        NodeRun(Node node) {
            this.node = node;
        }
    }
}
