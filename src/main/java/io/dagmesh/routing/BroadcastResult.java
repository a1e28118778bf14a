package io.dagmesh.routing;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code success} is true when at least one recipient accepted the event. A broadcast with no
 * eligible recipients is therefore unsuccessful.
 *
 * @param broadcastTo every recipient a delivery was attempted to
 * @param failed      recipient id to error for the deliveries that failed
 */
public record BroadcastResult(
        boolean success,
        String eventType,
        BroadcastScope scope,
        List<String> broadcastTo,
        List<String> delivered,
        Map<String, String> failed,
        Instant timestamp
) {
    public BroadcastResult {
        broadcastTo = broadcastTo == null ? List.of() : List.copyOf(broadcastTo);
        delivered = delivered == null ? List.of() : List.copyOf(delivered);
        failed = failed == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }
}
