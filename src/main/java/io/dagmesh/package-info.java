/**
 * DagMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.dagmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.dagmesh.cli.DagMeshCommand} maps commands to mesh and engine APIs.</li>
 *   <li>{@code io.dagmesh.mesh.AgentMesh} wires the registry, router, engine, scheduler and snapshots together.</li>
 *   <li>{@code io.dagmesh.engine.WorkflowEngine} owns DAG lifecycle, retries and failure thresholds.</li>
 * </ul>
 */
package io.dagmesh;
