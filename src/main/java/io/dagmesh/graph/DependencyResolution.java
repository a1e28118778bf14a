package io.dagmesh.graph;

import java.util.List;

public record DependencyResolution(
        boolean success,
        List<String> resolvedDependencies,
        List<String> unresolvedDependencies,
        List<String> circularDependencies,
        List<String> executionOrder
) {
}
