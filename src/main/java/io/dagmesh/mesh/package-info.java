/**
 * Mesh coordination package.
 *
 * <p>{@link io.dagmesh.mesh.AgentMesh} is the facade; cross-agent workflows go through
 * {@link io.dagmesh.mesh.MeshOrchestrator} and state capture through
 * {@link io.dagmesh.mesh.SnapshotManager}.
 */
package io.dagmesh.mesh;
