package io.dagmesh.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dagmesh.util.Jsons;

/**
 * @param workflowId owning DAG or mesh workflow, {@code null} for standalone scheduled tasks
 * @param unitId     node, step or task id
 * @param attempt    1-based attempt number
 * @param timeoutMs  per-attempt deadline of the node, step or task; {@code null} leaves the router default
 */
public record DispatchRequest(
        String workflowId,
        String unitId,
        String agentId,
        String action,
        JsonNode parameters,
        int attempt,
        Long timeoutMs
) {
    public DispatchRequest {
        parameters = Jsons.copy(parameters);
    }

    /**
     * Event payload handed to the agent.
     */
    public ObjectNode toPayload() {
        ObjectNode payload = Jsons.object();
        payload.put("workflowId", workflowId);
        payload.put("unitId", unitId);
        payload.put("action", action);
        payload.put("attempt", attempt);
        payload.set("parameters", Jsons.copy(parameters));
        return payload;
    }
}
