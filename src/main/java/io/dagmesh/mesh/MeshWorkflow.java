package io.dagmesh.mesh;

import io.dagmesh.model.RetryPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-agent workflow. Steps form a dependency graph like DAG nodes, but each one targets a
 * registered agent.
 *
 * @param agents       agent ids that must be registered before the workflow runs
 * @param dependencies agent ids the workflow relies on, resolved as a flat precedence list
 * @param timeout      whole-workflow deadline in milliseconds, {@code null} for the configured default
 * @param retryPolicy  applied to every step, {@code null} for the configured default
 */
public record MeshWorkflow(
        String id,
        String name,
        String description,
        List<String> agents,
        List<MeshStep> steps,
        List<String> dependencies,
        Long timeout,
        RetryPolicy retryPolicy,
        Map<String, Object> metadata
) {
    public MeshWorkflow {
        agents = agents == null ? List.of() : List.copyOf(agents);
        steps = steps == null ? List.of() : List.copyOf(steps);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static MeshWorkflow of(String id, List<MeshStep> steps, RetryPolicy retryPolicy) {
        return new MeshWorkflow(id, id, null, List.of(), steps, List.of(), null, retryPolicy, Map.of());
    }
}
