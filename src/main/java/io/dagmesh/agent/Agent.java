package io.dagmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.model.ValidationResult;

import java.util.List;

/**
 * Capability contract every mesh participant satisfies: the workflow engine front end, the mesh
 * itself, and any pluggable rule/optimizer/compliance agent.
 *
 * <p>Agents never hold references to each other; they talk through the mesh router only.
 */
public interface Agent {
    String id();

    String role();

    /**
     * Informational agent ids this agent expects to be present; not enforced as a startup order.
     */
    default List<String> dependencies() {
        return List.of();
    }

    /**
     * Idempotent.
     */
    void initialize();

    /**
     * Idempotent. The handle stays valid afterwards and {@link #getStatus()} keeps answering.
     */
    void shutdown();

    AgentStatus getStatus();

    /**
     * Handles one routed event. Unknown event types must be ignored rather than rejected; a thrown
     * exception is recorded by the router as a delivery failure.
     */
    void handleEvent(String eventType, JsonNode payload) throws Exception;

    default ValidationResult validateSpecification(AgentSpecification spec) {
        if (spec == null) {
            return ValidationResult.fail("Specification is missing");
        }
        return ValidationResult.ok(id() + " specification validation passed");
    }

    default List<DesignArtifact> generateDesignArtifacts() {
        return List.of();
    }

    /**
     * Must not throw.
     */
    default void trackUserInteraction(UserInteraction interaction) {
    }
}
