package io.dagmesh.mesh;

import io.dagmesh.agent.Agent;
import io.dagmesh.agent.AgentLifecycle;
import io.dagmesh.agent.AgentRegistry;
import io.dagmesh.engine.DagStatus;
import io.dagmesh.engine.WorkflowEngine;
import io.dagmesh.graph.DependencyResolver;
import io.dagmesh.observability.AuditLogger;
import io.dagmesh.routing.EventRouter;
import io.dagmesh.scheduler.TaskScheduler;
import io.dagmesh.util.Hashing;
import io.dagmesh.util.Ids;
import io.dagmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Captures and restores registry membership, DAG runs, subscriptions and scheduled tasks.
 *
 * <p>Restore checks everything it needs before touching live state, then swaps each component
 * in turn while holding the manager's lock, so a restore either applies completely or not at all.
 */
public final class SnapshotManager {
    public static final String SCHEMA_VERSION = "dagmesh.snapshot.v1";

    private final AgentRegistry registry;
    private final EventRouter router;
    private final WorkflowEngine engine;
    private final TaskScheduler scheduler;
    private final AuditLogger audit;
    private final Map<String, SystemSnapshot> snapshots = new LinkedHashMap<>();
    private final Map<String, List<AgentRegistry.Entry>> capturedHandles = new LinkedHashMap<>();

    public SnapshotManager(
            AgentRegistry registry,
            EventRouter router,
            WorkflowEngine engine,
            TaskScheduler scheduler,
            AuditLogger audit
    ) {
        this.registry = registry;
        this.router = router;
        this.engine = engine;
        this.scheduler = scheduler;
        this.audit = audit;
    }

    public synchronized SystemSnapshot createSystemSnapshot() {
        List<AgentRegistry.Entry> entries = registry.entries();
        List<SystemSnapshot.AgentSummary> agents = new ArrayList<>(entries.size());
        for (AgentRegistry.Entry entry : entries) {
            agents.add(new SystemSnapshot.AgentSummary(entry.id(), entry.roleLabel(), entry.registeredAt(),
                    lifecycleOf(entry.handle()), entry.handle().dependencies()));
        }
        List<WorkflowEngine.DagRunSnapshot> workflows = engine.exportRuns();
        Map<String, Object> systemState = new LinkedHashMap<>();
        systemState.put("agentCount", agents.size());
        systemState.put("workflowCount", workflows.size());
        systemState.put("activeWorkflows", workflows.stream().filter(w -> !w.status().terminal()).count());
        systemState.put("pendingTasks", scheduler.pendingCount());
        SystemSnapshot unsigned = new SystemSnapshot(Ids.newId("snap"), Instant.now(), agents, workflows,
                router.subscriptionTable(), scheduler.exportTasks(), systemState, null);
        SystemSnapshot snapshot = withHash(unsigned, integrityHash(unsigned));
        snapshots.put(snapshot.id(), snapshot);
        capturedHandles.put(snapshot.id(), entries);
        audit.log(AuditLogger.AuditEvent.of("snapshot.created", "mesh", "snapshot/" + snapshot.id(), "ok",
                Map.of("agents", agents.size(), "workflows", workflows.size(), "hash", snapshot.integrityHash())));
        return snapshot;
    }

    public synchronized RestoreResult restoreSystemSnapshot(String snapshotId) {
        SystemSnapshot snapshot = snapshotId == null ? null : snapshots.get(snapshotId);
        if (snapshot == null) {
            return RestoreResult.failed(snapshotId, "Unknown snapshot: " + snapshotId);
        }
        if (!integrityHash(snapshot).equals(snapshot.integrityHash())) {
            return RestoreResult.failed(snapshotId, "Snapshot integrity check failed: " + snapshotId);
        }
        List<AgentRegistry.Entry> entries = resolveHandles(snapshot);
        if (entries == null) {
            return RestoreResult.failed(snapshotId, "Snapshot references agents that are no longer available");
        }
        for (WorkflowEngine.DagRunSnapshot workflow : snapshot.workflows()) {
            if (workflow.status() != DagStatus.CREATED && !workflow.status().terminal()
                    && !DependencyResolver.validate(workflow.spec()).result()) {
                return RestoreResult.failed(snapshotId, "Snapshot workflow is not restorable: " + workflow.dagId());
            }
        }

        registry.replaceAll(entries);
        router.replaceSubscriptions(snapshot.subscriptions());
        engine.restoreRuns(snapshot.workflows());
        scheduler.restoreTasks(snapshot.scheduledTasks());

        audit.log(AuditLogger.AuditEvent.of("snapshot.restored", "mesh", "snapshot/" + snapshotId, "ok",
                Map.of("agents", entries.size(), "workflows", snapshot.workflows().size())));
        return new RestoreResult(true, snapshotId, entries.size(), snapshot.workflows().size(),
                snapshot.scheduledTasks().size(), null);
    }

    public synchronized Optional<SystemSnapshot> getSnapshot(String snapshotId) {
        return Optional.ofNullable(snapshotId == null ? null : snapshots.get(snapshotId));
    }

    public synchronized List<SnapshotSummary> listSnapshots() {
        List<SnapshotSummary> out = new ArrayList<>(snapshots.size());
        for (SystemSnapshot snapshot : snapshots.values()) {
            out.add(new SnapshotSummary(snapshot.id(), snapshot.timestamp(), snapshot.agents().size(),
                    snapshot.workflows().size(), snapshot.integrityHash()));
        }
        return List.copyOf(out);
    }

    /**
     * Writes {@code <snapshotId>.json} and {@code manifest.json} into {@code outputDir}.
     *
     * @throws IllegalArgumentException if the snapshot is unknown
     */
    public synchronized SnapshotExportOutcome exportSnapshot(String snapshotId, Path outputDir) {
        SystemSnapshot snapshot = snapshotId == null ? null : snapshots.get(snapshotId);
        if (snapshot == null) {
            throw new IllegalArgumentException("Unknown snapshot: " + snapshotId);
        }
        Path out = outputDir.toAbsolutePath().normalize();
        Path snapshotFile = out.resolve(snapshot.id() + ".json");
        Path manifest = out.resolve("manifest.json");
        try {
            Files.createDirectories(out);
            String body = Jsons.toJson(snapshot);
            Files.writeString(snapshotFile, body, StandardCharsets.UTF_8);
            Map<String, Object> manifestBody = new LinkedHashMap<>();
            manifestBody.put("schema_version", SCHEMA_VERSION);
            manifestBody.put("created_at", snapshot.timestamp().toString());
            manifestBody.put("snapshot_id", snapshot.id());
            manifestBody.put("snapshot_file", snapshotFile.getFileName().toString());
            manifestBody.put("integrity_hash", snapshot.integrityHash());
            manifestBody.put("agents", snapshot.agents().size());
            manifestBody.put("workflows", snapshot.workflows().size());
            manifestBody.put("bytes", body.getBytes(StandardCharsets.UTF_8).length);
            Files.writeString(manifest, Jsons.toJson(manifestBody), StandardCharsets.UTF_8);
            SnapshotExportOutcome outcome = new SnapshotExportOutcome(snapshot.id(), out.toString(),
                    snapshotFile.toString(), manifest.toString(), body.getBytes(StandardCharsets.UTF_8).length);
            audit.log(AuditLogger.AuditEvent.of("snapshot.export", "mesh", "snapshot/" + snapshot.id(), "ok",
                    Map.of("output", outcome.outputDir(), "bytes", outcome.bytes())));
            return outcome;
        } catch (IOException e) {
            throw new RuntimeException("Failed to export snapshot to " + out, e);
        }
    }

    /**
     * Loads a snapshot written by {@link #exportSnapshot} so it can be restored. Agent handles are
     * looked up by id in the live registry at restore time.
     *
     * @throws IllegalArgumentException if the file cannot be read or its integrity hash does not match
     */
    public synchronized SystemSnapshot importSnapshot(Path snapshotFile) {
        SystemSnapshot snapshot = Jsons.read(snapshotFile, SystemSnapshot.class);
        if (snapshot.id() == null || snapshot.integrityHash() == null
                || !integrityHash(snapshot).equals(snapshot.integrityHash())) {
            throw new IllegalArgumentException("Snapshot integrity check failed: " + snapshotFile);
        }
        snapshots.put(snapshot.id(), snapshot);
        capturedHandles.remove(snapshot.id());
        audit.log(AuditLogger.AuditEvent.of("snapshot.import", "mesh", "snapshot/" + snapshot.id(), "ok",
                Map.of("input", snapshotFile.toString())));
        return snapshot;
    }

    private List<AgentRegistry.Entry> resolveHandles(SystemSnapshot snapshot) {
        List<AgentRegistry.Entry> captured = capturedHandles.get(snapshot.id());
        if (captured != null) {
            return captured;
        }
        List<AgentRegistry.Entry> resolved = new ArrayList<>();
        for (SystemSnapshot.AgentSummary summary : snapshot.agents()) {
            Agent handle = registry.get(summary.id());
            if (handle == null) {
                return null;
            }
            resolved.add(new AgentRegistry.Entry(summary.id(), summary.role(), handle, summary.registeredAt()));
        }
        return resolved;
    }

    private static AgentLifecycle lifecycleOf(Agent agent) {
        try {
            return agent.getStatus().status();
        } catch (RuntimeException e) {
            return AgentLifecycle.ERROR;
        }
    }

    static String integrityHash(SystemSnapshot snapshot) {
        return Hashing.sha256Hex(Jsons.toCompactJson(withHash(snapshot, null)));
    }

    private static SystemSnapshot withHash(SystemSnapshot snapshot, String hash) {
        return new SystemSnapshot(snapshot.id(), snapshot.timestamp(), snapshot.agents(), snapshot.workflows(),
                snapshot.subscriptions(), snapshot.scheduledTasks(), snapshot.systemState(), hash);
    }

    public record RestoreResult(
            boolean success,
            String snapshotId,
            int restoredAgents,
            int restoredWorkflows,
            int restoredTasks,
            String error
    ) {
        static RestoreResult failed(String snapshotId, String error) {
            return new RestoreResult(false, snapshotId, 0, 0, 0, error);
        }
    }

    public record SnapshotSummary(String id, Instant timestamp, int agents, int workflows, String integrityHash) {
    }

    public record SnapshotExportOutcome(
            String snapshotId,
            String outputDir,
            String snapshotFile,
            String manifestFile,
            long bytes
    ) {
    }
}
