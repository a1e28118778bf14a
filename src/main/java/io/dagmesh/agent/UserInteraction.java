package io.dagmesh.agent;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record UserInteraction(
        String id,
        String userId,
        String sessionId,
        String action,
        Map<String, Object> context,
        String outcome,
        String feedback,
        Instant timestamp
) {
    public UserInteraction {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }
}
