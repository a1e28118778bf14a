package io.dagmesh.mesh;

import io.dagmesh.agent.AgentRegistry;
import io.dagmesh.agent.EchoAgent;
import io.dagmesh.agent.FailAgent;
import io.dagmesh.engine.DagStatus;
import io.dagmesh.engine.NodeStatus;
import io.dagmesh.engine.WorkflowEngine;
import io.dagmesh.graph.DagSpec;
import io.dagmesh.graph.ExecutionPolicy;
import io.dagmesh.graph.Node;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Stream;

final class SnapshotManagerTest {
    private AgentMesh mesh;

    @BeforeEach
    void setUp() {
        mesh = AgentMesh.inMemory();
        mesh.registerAgent(new EchoAgent());
        mesh.registerAgent(new FailAgent());
        mesh.initialize();
    }

    @AfterEach
    void tearDown() {
        mesh.shutdown();
    }

    @Test
    void restoringAnUntouchedMeshKeepsRegistryMembership() {
        mesh.subscribeToEvents("echo", List.of("greeting"));
        List<String> before = agentIds();

        SystemSnapshot snapshot = mesh.createSystemSnapshot();
        Assertions.assertNotNull(snapshot.integrityHash());
        Assertions.assertEquals(before.size(), snapshot.agents().size());
        Assertions.assertSame(snapshot, mesh.snapshots().getSnapshot(snapshot.id()).orElseThrow());
        Assertions.assertTrue(mesh.snapshots().getSnapshot("snap_missing").isEmpty());
        Assertions.assertTrue(mesh.snapshots().getSnapshot(null).isEmpty());

        SnapshotManager.RestoreResult restored = mesh.restoreSystemSnapshot(snapshot.id());
        Assertions.assertTrue(restored.success(), restored.error());
        Assertions.assertEquals(before, agentIds());
        Assertions.assertEquals(List.of("greeting"), List.copyOf(mesh.router().subscriptions("echo")));
        Assertions.assertSame(mesh.registry().get("echo"), mesh.getAgent("echo"));
    }

    @Test
    void restoreAfterChangesBringsBackCapturedAgents() {
        SystemSnapshot snapshot = mesh.createSystemSnapshot();
        mesh.registerAgent(new EchoAgent("late", "Echo"));
        mesh.unregisterAgent("fail");

        Assertions.assertTrue(mesh.restoreSystemSnapshot(snapshot.id()).success());
        Assertions.assertTrue(mesh.registry().contains("fail"));
        Assertions.assertFalse(mesh.registry().contains("late"));
    }

    @Test
    void unknownSnapshotCannotBeRestored() {
        SnapshotManager.RestoreResult result = mesh.restoreSystemSnapshot("snap_missing");
        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.error().contains("Unknown snapshot"));
        Assertions.assertFalse(mesh.restoreSystemSnapshot(null).success());
    }

    @Test
    void exportedSnapshotImportsAndTamperingIsDetected() throws Exception {
        Path root = Files.createTempDirectory("dagmesh-test-snapshot");
        try {
            WorkflowEngine.WorkflowStatus done = mesh.engine().orchestrateDag(
                    DagSpec.of("pipeline", List.of(Node.task("build", "echo", "build", List.of())),
                            ExecutionPolicy.defaults()),
                    Duration.ofSeconds(5));
            Assertions.assertEquals(DagStatus.COMPLETED.wireName(), done.status());

            SystemSnapshot snapshot = mesh.createSystemSnapshot();
            SnapshotManager.SnapshotExportOutcome exported = mesh.snapshots().exportSnapshot(snapshot.id(), root);
            Path file = root.resolve(snapshot.id() + ".json");
            Assertions.assertEquals(file.toAbsolutePath().normalize().toString(), exported.snapshotFile());
            Assertions.assertTrue(Files.exists(root.resolve("manifest.json")));
            String manifest = Files.readString(root.resolve("manifest.json"), StandardCharsets.UTF_8);
            Assertions.assertTrue(manifest.contains(SnapshotManager.SCHEMA_VERSION));
            Assertions.assertTrue(manifest.contains(snapshot.integrityHash()));

            SystemSnapshot imported = mesh.snapshots().importSnapshot(file);
            Assertions.assertEquals(snapshot.integrityHash(), imported.integrityHash());
            Assertions.assertEquals(1, imported.workflows().size());
            Assertions.assertTrue(mesh.restoreSystemSnapshot(imported.id()).success());

            String body = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertTrue(body.contains("Failure Injector"));
            Path tampered = root.resolve("tampered.json");
            Files.writeString(tampered, body.replace("Failure Injector", "Failure Ignorer"), StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> mesh.snapshots().importSnapshot(tampered));

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> mesh.snapshots().exportSnapshot("snap_missing", root));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runningWorkflowComesBackPaused() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        BlockingAgent sloth = new BlockingAgent("sloth", release);
        mesh.registerAgent(sloth);
        WorkflowEngine engine = mesh.engine();
        try {
            String dagId = engine.createDAG(DagSpec.of("nap", List.of(Node.task("nap", "sloth", "sleep", List.of())),
                    ExecutionPolicy.defaults())).workflowId();
            Assertions.assertTrue(engine.startWorkflow(dagId).success());
            Assertions.assertTrue(sloth.awaitEntered(5_000L));

            SystemSnapshot snapshot = mesh.createSystemSnapshot();
            Assertions.assertEquals(1L, ((Number) snapshot.systemState().get("activeWorkflows")).longValue());

            release.countDown();
            Assertions.assertEquals(DagStatus.COMPLETED.wireName(),
                    engine.awaitTermination(dagId, Duration.ofSeconds(5)).status());

            Assertions.assertTrue(mesh.restoreSystemSnapshot(snapshot.id()).success());
            WorkflowEngine.WorkflowStatus restored = engine.getWorkflowStatus(dagId);
            Assertions.assertEquals(DagStatus.PAUSED.wireName(), restored.status());
            Assertions.assertEquals(NodeStatus.PENDING, restored.nodeStatus("nap"));

            Assertions.assertTrue(engine.resumeWorkflow(dagId));
            Assertions.assertEquals(DagStatus.COMPLETED.wireName(),
                    engine.awaitTermination(dagId, Duration.ofSeconds(5)).status());
        } finally {
            release.countDown();
        }
    }

    private List<String> agentIds() {
        return mesh.registry().entries().stream().map(AgentRegistry.Entry::id).sorted().toList();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
