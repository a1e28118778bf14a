package io.dagmesh.mesh;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dagmesh.dispatch.ActionDispatcher;
import io.dagmesh.dispatch.DispatchRequest;
import io.dagmesh.dispatch.DispatchResult;
import io.dagmesh.engine.WorkflowEngine;
import io.dagmesh.routing.EventRouter;
import io.dagmesh.util.Jsons;

import java.util.concurrent.CompletableFuture;

/**
 * Executes actions by routing them as events: the action becomes the event type and the request
 * becomes the payload. Each attempt is bounded by the request's own timeout, or by the router's event
 * timeout when the request carries none.
 */
final class RoutedActionDispatcher implements ActionDispatcher {
    private final EventRouter router;

    RoutedActionDispatcher(EventRouter router) {
        this.router = router;
    }

    @Override
    public CompletableFuture<DispatchResult> dispatch(DispatchRequest request) {
        return router.routeEventAsync(request.action(), request.toPayload(), request.agentId(), WorkflowEngine.ACTOR,
                        request.timeoutMs())
                .thenApply(result -> {
                    if (!result.success()) {
                        return DispatchResult.fail(result.error());
                    }
                    ObjectNode output = Jsons.object();
                    output.put("routedTo", result.routedTo());
                    output.put("durationMs", result.durationMs());
                    return DispatchResult.ok(output);
                });
    }
}
