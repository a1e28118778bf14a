package io.dagmesh.routing;

public record RouterStats(
        long routed,
        long failed,
        long broadcasts,
        int subscribedAgents
) {
    public long total() {
        return routed + failed;
    }
}
