package io.dagmesh.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AgentStatus(
        AgentLifecycle status,
        long uptimeMs,
        String lastEvent,
        long eventsHandled,
        Map<String, Object> details
) {
    public AgentStatus {
        status = status == null ? AgentLifecycle.READY : status;
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
