package io.dagmesh.routing;

/**
 * Whether the broadcasting agent receives its own event.
 */
public enum BroadcastScope {
    EXCLUDE_SOURCE,
    INCLUDE_SOURCE
}
