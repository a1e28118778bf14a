package io.dagmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.agent.Agent;
import io.dagmesh.agent.AgentSpecification;
import io.dagmesh.agent.AgentState;
import io.dagmesh.agent.AgentStatus;
import io.dagmesh.graph.DagSpec;
import io.dagmesh.model.ValidationResult;
import io.dagmesh.util.Jsons;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mesh-facing front end of the {@link WorkflowEngine}. It is also the default executor for task
 * nodes that name no agent: {@code task.execute} succeeds unless the parameters ask for
 * {@code "fail": true}.
 */
public final class WorkflowEngineAgent implements Agent {
    public static final String ROLE = "DAG Orchestrator";

    private final String id;
    private final WorkflowEngine engine;
    private final AgentState state = new AgentState();

    public WorkflowEngineAgent(String id, WorkflowEngine engine) {
        this.id = id;
        this.engine = engine;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String role() {
        return ROLE;
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
        WorkflowEngine.EngineMetrics metrics = engine.getSystemMetrics();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("activeWorkflows", metrics.activeWorkflows());
        details.put("totalWorkflows", metrics.totalWorkflows());
        return state.snapshot(details);
    }

    @Override
    public void handleEvent(String eventType, JsonNode payload) {
        state.recordEvent(eventType);
        String workflowId = payload == null ? null : payload.path("workflowId").asText(null);
        switch (eventType == null ? "" : eventType) {
            case "workflow.create" -> {
                DagSpec spec = Jsons.mapper().convertValue(payload.path("spec"), DagSpec.class);
                require(engine.createDAG(spec).success(), "create", spec == null ? null : spec.id());
            }
            case "workflow.start" -> {
                WorkflowEngine.WorkflowOutcome outcome = engine.startWorkflow(workflowId);
                if (!outcome.success()) {
                    throw new IllegalStateException(String.join("; ", outcome.errors()));
                }
            }
            case "workflow.pause" -> require(engine.pauseWorkflow(workflowId), "pause", workflowId);
            case "workflow.resume" -> require(engine.resumeWorkflow(workflowId), "resume", workflowId);
            case "workflow.cancel" -> require(engine.cancelWorkflow(workflowId), "cancel", workflowId);
            case "task.execute" -> {
                if (payload != null && payload.path("parameters").path("fail").asBoolean(false)) {
                    throw new IllegalStateException("Task " + payload.path("unitId").asText() + " failed on request");
                }
            }
            default -> {
                // not ours
            }
        }
    }

    @Override
    public ValidationResult validateSpecification(AgentSpecification spec) {
        if (spec == null) {
            return ValidationResult.fail("Specification is missing");
        }
        if (spec.dependencies().contains(spec.id())) {
            return ValidationResult.fail("Agent " + spec.id() + " depends on itself", "dependency_validation",
                    Map.of("agentId", String.valueOf(spec.id())));
        }
        return ValidationResult.ok("Workflow engine specification validation passed",
                Map.of("capabilities", List.copyOf(spec.capabilities())));
    }

    private static void require(boolean accepted, String operation, String workflowId) {
        if (!accepted) {
            throw new IllegalStateException("Cannot " + operation + " workflow " + workflowId);
        }
    }
}
