package io.dagmesh.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Advisory link between two nodes. Edges are validated and carried along for routing labels,
 * but never change execution order; that is decided by {@link Node#dependencies()} alone.
 */
public record Edge(
        String id,
        String source,
        String target,
        EdgeType type,
        String condition,
        Map<String, Object> metadata
) {
    public Edge {
        type = type == null ? EdgeType.SUCCESS : type;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Edge of(String id, String source, String target) {
        return new Edge(id, source, target, EdgeType.SUCCESS, null, null);
    }
}
