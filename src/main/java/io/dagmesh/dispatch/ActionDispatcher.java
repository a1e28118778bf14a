package io.dagmesh.dispatch;

import java.util.concurrent.CompletableFuture;

/**
 * Seam between the schedulers and whatever executes an action. The mesh routes requests to agents
 * through its event router; tests plug in lambdas.
 *
 * <p>Implementations should not block the caller. A future completing exceptionally counts as a
 * failed attempt, exactly like a {@link DispatchResult} with {@code success=false}.
 */
@FunctionalInterface
public interface ActionDispatcher {
    CompletableFuture<DispatchResult> dispatch(DispatchRequest request);
}
