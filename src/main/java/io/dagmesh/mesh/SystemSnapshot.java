package io.dagmesh.mesh;

import io.dagmesh.agent.AgentLifecycle;
import io.dagmesh.engine.WorkflowEngine;
import io.dagmesh.scheduler.TaskScheduler;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of mesh state. Every part is immutable, so later mutations of the live mesh
 * never show through. Agent handles are not part of the serialized form; restore takes them from
 * the capture or, for imported snapshots, from the live registry.
 *
 * @param integrityHash SHA-256 over the canonical JSON of everything except the hash itself
 */
public record SystemSnapshot(
        String id,
        Instant timestamp,
        List<AgentSummary> agents,
        List<WorkflowEngine.DagRunSnapshot> workflows,
        Map<String, List<String>> subscriptions,
        List<TaskScheduler.TaskSnapshot> scheduledTasks,
        Map<String, Object> systemState,
        String integrityHash
) {
    public SystemSnapshot {
        agents = agents == null ? List.of() : List.copyOf(agents);
        workflows = workflows == null ? List.of() : List.copyOf(workflows);
        subscriptions = subscriptions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(subscriptions));
        scheduledTasks = scheduledTasks == null ? List.of() : List.copyOf(scheduledTasks);
        systemState = systemState == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(systemState));
    }

    public record AgentSummary(
            String id,
            String role,
            Instant registeredAt,
            AgentLifecycle status,
            List<String> dependencies
    ) {
        public AgentSummary {
            dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        }
    }
}
