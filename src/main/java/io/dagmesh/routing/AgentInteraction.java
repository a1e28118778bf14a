package io.dagmesh.routing;

import java.time.Instant;

public record AgentInteraction(
        String id,
        String sourceAgentId,
        String targetAgentId,
        String eventType,
        boolean success,
        String error,
        Instant timestamp,
        long durationMs
) {
    public boolean involves(String agentId) {
        return agentId != null && (agentId.equals(sourceAgentId) || agentId.equals(targetAgentId));
    }
}
