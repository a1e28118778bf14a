package io.dagmesh.graph;

import java.util.List;

public record FailureHandling(
        FailureStrategy strategy,
        List<String> compensationTasks,
        List<String> notificationChannels
) {
    public FailureHandling {
        strategy = strategy == null ? FailureStrategy.STOP : strategy;
        compensationTasks = compensationTasks == null ? List.of() : List.copyOf(compensationTasks);
        notificationChannels = notificationChannels == null ? List.of() : List.copyOf(notificationChannels);
    }

    public static FailureHandling stop() {
        return new FailureHandling(FailureStrategy.STOP, List.of(), List.of());
    }

    public static FailureHandling of(FailureStrategy strategy) {
        return new FailureHandling(strategy, List.of(), List.of());
    }
}
