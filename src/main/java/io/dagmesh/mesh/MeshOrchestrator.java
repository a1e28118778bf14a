package io.dagmesh.mesh;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.agent.AgentRegistry;
import io.dagmesh.config.MeshConfig;
import io.dagmesh.engine.DagStatus;
import io.dagmesh.engine.NodeStatus;
import io.dagmesh.engine.WorkflowEngine;
import io.dagmesh.graph.DagSpec;
import io.dagmesh.graph.DependencyResolution;
import io.dagmesh.graph.DependencyResolver;
import io.dagmesh.graph.ExecutionPolicy;
import io.dagmesh.graph.FailureHandling;
import io.dagmesh.graph.FailureStrategy;
import io.dagmesh.graph.Node;
import io.dagmesh.graph.NodeType;
import io.dagmesh.model.RetryPolicy;
import io.dagmesh.model.ValidationResult;
import io.dagmesh.observability.AuditLogger;
import io.dagmesh.util.Ids;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs mesh workflows on the {@link WorkflowEngine}: every step becomes a task node addressed to
 * its agent, so ordering, retries and timeouts are the engine's. Step failures never stop
 * independent steps; the workflow reports which steps completed and which did not.
 */
public final class MeshOrchestrator {
    private final AgentRegistry registry;
    private final WorkflowEngine engine;
    private final AuditLogger audit;
    private final Supplier<MeshConfig> config;

    public MeshOrchestrator(AgentRegistry registry, WorkflowEngine engine, AuditLogger audit, Supplier<MeshConfig> config) {
        this.registry = registry;
        this.engine = engine;
        this.audit = audit;
        this.config = config;
    }

    /**
     * Blocks until the workflow settles or its timeout elapses. Unregistered agents and invalid
     * step graphs fail fast without running anything.
     */
    public OrchestrationResult orchestrateWorkflow(MeshWorkflow workflow) {
        long started = System.nanoTime();
        if (workflow == null) {
            return rejected(null, started, List.of("Mesh workflow is missing"));
        }
        String workflowId = Ids.orNew(workflow.id(), "wf");
        List<String> errors = checkAgents(workflow);
        if (!errors.isEmpty()) {
            return rejected(workflowId, started, errors);
        }
        MeshConfig current = config.get();
        DagSpec spec = toDagSpec(workflowId, workflow, current);
        ValidationResult validation = DependencyResolver.validate(spec);
        if (!validation.result()) {
            return rejected(workflowId, started, List.of(validation.reason()));
        }
        long timeoutMs = workflow.timeout() != null && workflow.timeout() > 0
                ? workflow.timeout()
                : current.settings().workflowTimeoutMs();
        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(spec, Duration.ofMillis(timeoutMs));

        List<StepResult> steps = new ArrayList<>();
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        for (MeshStep step : workflow.steps()) {
            WorkflowEngine.NodeState node = status.nodes().get(step.id());
            NodeStatus nodeStatus = node == null ? NodeStatus.SKIPPED : node.status();
            switch (nodeStatus) {
                case SUCCEEDED -> completed++;
                case FAILED -> failed++;
                default -> skipped++;
            }
            steps.add(new StepResult(step.id(), step.agentId(), nodeStatus.wireName(),
                    node == null ? 0 : node.attempts(), node == null ? null : node.lastError(),
                    node == null ? null : node.output()));
        }
        boolean success = DagStatus.COMPLETED.wireName().equals(status.status()) && failed == 0 && skipped == 0;
        List<String> allErrors = new ArrayList<>(status.errors());
        for (StepResult step : steps) {
            if (step.error() != null) {
                allErrors.add(step.stepId() + ": " + step.error());
            }
        }
        OrchestrationResult result = new OrchestrationResult(success, workflowId, status.status(), completed, failed,
                skipped, elapsedMs(started), steps, allErrors);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("completedSteps", completed);
        details.put("failedSteps", failed);
        details.put("skippedSteps", skipped);
        details.put("executionTimeMs", result.executionTime());
        audit.log(AuditLogger.AuditEvent.ofWorkflow("mesh.workflow.orchestrated", "mesh", workflowId, null,
                success ? "ok" : "failed", details));
        return result;
    }

    private List<String> checkAgents(MeshWorkflow workflow) {
        List<String> errors = new ArrayList<>();
        if (workflow.steps().isEmpty()) {
            errors.add("Mesh workflow has no steps");
        }
        DependencyResolution resolution = DependencyResolver.resolveDependencies(workflow.dependencies());
        if (!resolution.success()) {
            errors.add("Workflow dependencies are circular or invalid: circular=" + resolution.circularDependencies()
                    + " unresolved=" + resolution.unresolvedDependencies());
        }
        Set<String> required = new LinkedHashSet<>(resolution.resolvedDependencies());
        required.addAll(workflow.agents());
        for (String agentId : required) {
            if (!registry.contains(agentId)) {
                errors.add("Required agent not registered: " + agentId);
            }
        }
        for (MeshStep step : workflow.steps()) {
            if (step.agentId() == null || !registry.contains(step.agentId())) {
                errors.add("Step " + step.id() + " targets unregistered agent: " + step.agentId());
            }
        }
        return errors;
    }

    private static DagSpec toDagSpec(String workflowId, MeshWorkflow workflow, MeshConfig config) {
        RetryPolicy retry = workflow.retryPolicy() != null
                ? workflow.retryPolicy()
                : config.defaultRetryPolicy(config.settings().retryAttempts());
        List<Node> nodes = new ArrayList<>(workflow.steps().size());
        for (MeshStep step : workflow.steps()) {
            nodes.add(new Node(step.id(), step.id(), NodeType.TASK, step.action(), step.agentId(),
                    step.dependencies(), step.timeout(), retry, step.parameters(), step.metadata()));
        }
        ExecutionPolicy policy = new ExecutionPolicy(config.settings().maxConcurrency(), 0L, 0, Integer.MAX_VALUE);
        Map<String, Object> metadata = new LinkedHashMap<>(workflow.metadata());
        metadata.put("meshWorkflow", true);
        return new DagSpec(workflowId, workflow.name() == null ? workflowId : workflow.name(), "1.0.0", nodes,
                List.of(), policy, FailureHandling.of(FailureStrategy.CONTINUE), metadata);
    }

    private OrchestrationResult rejected(String workflowId, long started, List<String> errors) {
        audit.log(AuditLogger.AuditEvent.ofWorkflow("mesh.workflow.rejected", "mesh", String.valueOf(workflowId), null,
                "failed", Map.of("errors", errors)));
        return new OrchestrationResult(false, workflowId, "failed", 0, 0, 0, elapsedMs(started), List.of(), errors);
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    public record StepResult(String stepId, String agentId, String status, int attempts, String error, JsonNode output) {
    }

    /**
     * @param executionTime wall time in milliseconds
     * @param skippedSteps  steps never run because an upstream step failed or the workflow timed out
     */
    public record OrchestrationResult(
            boolean success,
            String workflowId,
            String status,
            int completedSteps,
            int failedSteps,
            int skippedSteps,
            long executionTime,
            List<StepResult> steps,
            List<String> errors
    ) {
        public OrchestrationResult {
            steps = steps == null ? List.of() : List.copyOf(steps);
            errors = errors == null ? List.of() : List.copyOf(errors);
        }
    }
}
