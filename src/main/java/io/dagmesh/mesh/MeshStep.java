package io.dagmesh.mesh;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.util.Jsons;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param action  event type delivered to {@code agentId}
 * @param timeout per-attempt deadline in milliseconds, {@code null} for none
 */
public record MeshStep(
        String id,
        String agentId,
        String action,
        JsonNode parameters,
        List<String> dependencies,
        Long timeout,
        Map<String, Object> metadata
) {
    public MeshStep {
        parameters = Jsons.copy(parameters);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static MeshStep of(String id, String agentId, String action, String... dependencies) {
        return new MeshStep(id, agentId, action, null, List.of(dependencies), null, Map.of());
    }
}
