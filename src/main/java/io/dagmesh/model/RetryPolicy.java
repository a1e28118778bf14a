package io.dagmesh.model;

/**
 * Retry budget and backoff shared by DAG nodes, mesh workflow steps and scheduled tasks.
 *
 * <p>{@code maxAttempts} counts the first attempt, so {@code maxAttempts = 1} never retries.
 * Delays are in milliseconds and never exceed {@code maxDelay}.
 */
public record RetryPolicy(
        int maxAttempts,
        BackoffStrategy backoffStrategy,
        long initialDelay,
        long maxDelay
) {
    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        backoffStrategy = backoffStrategy == null ? BackoffStrategy.EXPONENTIAL : backoffStrategy;
        initialDelay = Math.max(0L, initialDelay);
        maxDelay = Math.max(initialDelay, maxDelay);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, BackoffStrategy.CONSTANT, 0L, 0L);
    }

    public static RetryPolicy ofRetries(int retries, long initialDelay, long maxDelay) {
        return new RetryPolicy(Math.max(0, retries) + 1, BackoffStrategy.EXPONENTIAL, initialDelay, maxDelay);
    }

    public boolean allowsRetryAfter(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    /**
     * Delay before the attempt that follows {@code failedAttempt} (1-based).
     * Linear adds {@code initialDelay} per attempt, exponential doubles it.
     */
    public long delayAfter(int failedAttempt) {
        int n = Math.max(1, failedAttempt);
        long delay = switch (backoffStrategy) {
            case CONSTANT -> initialDelay;
            case LINEAR -> saturatedMultiply(initialDelay, n);
            case EXPONENTIAL -> n >= 62 ? Long.MAX_VALUE : saturatedMultiply(initialDelay, 1L << (n - 1));
        };
        return Math.min(delay, maxDelay);
    }

    private static long saturatedMultiply(long a, long b) {
        long hi = Math.multiplyHigh(a, b);
        long lo = a * b;
        if ((hi == 0 && lo >= 0) || (hi == -1 && lo < 0)) {
            return lo;
        }
        return Long.MAX_VALUE;
    }
}
