/**
 * DAG execution package.
 *
 * <p>{@link io.dagmesh.engine.WorkflowEngine} validates and runs DAG specs: it dispatches ready
 * nodes through an {@link io.dagmesh.dispatch.ActionDispatcher}, applies retry policies and
 * failure strategies, and exposes run status and metrics.
 */
package io.dagmesh.engine;
