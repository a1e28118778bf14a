package io.dagmesh.routing;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one unicast delivery. Unknown targets and handler failures come back as
 * {@code success=false}; routing never throws for them.
 */
public record RoutingResult(
        boolean success,
        String eventType,
        String routedTo,
        List<String> routingPath,
        String error,
        Instant timestamp,
        long durationMs
) {
    public RoutingResult {
        routingPath = routingPath == null ? List.of() : List.copyOf(routingPath);
    }

    static RoutingResult delivered(String eventType, String sourceId, String targetId, long durationMs) {
        return new RoutingResult(true, eventType, targetId, path(sourceId, targetId), null, Instant.now(), durationMs);
    }

    static RoutingResult failed(String eventType, String sourceId, String targetId, String error, long durationMs) {
        return new RoutingResult(false, eventType, targetId, path(sourceId, targetId), error, Instant.now(), durationMs);
    }

    private static List<String> path(String sourceId, String targetId) {
        String source = sourceId == null || sourceId.isBlank() ? EventRouter.MESH_SOURCE : sourceId;
        return List.of(source, String.valueOf(targetId));
    }
}
