package io.dagmesh.graph;

/**
 * @param maxConcurrency   in-flight node dispatches allowed at once for one DAG
 * @param timeout          per-dispatch deadline in milliseconds; {@code <= 0} disables it
 * @param retryAttempts    retries after the first failed attempt
 * @param failureThreshold failed nodes tolerated before the failure strategy kicks in
 */
public record ExecutionPolicy(
        int maxConcurrency,
        long timeout,
        int retryAttempts,
        int failureThreshold
) {
    public static ExecutionPolicy defaults() {
        return new ExecutionPolicy(4, 30_000L, 0, 0);
    }
}
