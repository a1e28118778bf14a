package io.dagmesh.agent;

import java.util.List;

public record AgentSpecification(
        String id,
        String role,
        List<String> dependencies,
        List<String> capabilities,
        List<String> constraints
) {
    public AgentSpecification {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }
}
