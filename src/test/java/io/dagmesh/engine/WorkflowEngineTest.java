package io.dagmesh.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dagmesh.config.MeshConfig;
import io.dagmesh.dispatch.ActionDispatcher;
import io.dagmesh.dispatch.DispatchRequest;
import io.dagmesh.dispatch.DispatchResult;
import io.dagmesh.graph.DagSpec;
import io.dagmesh.graph.ExecutionPolicy;
import io.dagmesh.graph.FailureHandling;
import io.dagmesh.graph.FailureStrategy;
import io.dagmesh.graph.Node;
import io.dagmesh.graph.NodeType;
import io.dagmesh.model.TaskState;
import io.dagmesh.observability.AuditLogger;
import io.dagmesh.scheduler.ScheduledTask;
import io.dagmesh.scheduler.TaskScheduler;
import io.dagmesh.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

final class WorkflowEngineTest {
    private static final Duration WAIT = Duration.ofSeconds(5);

    private ExecutorService executor;
    private AuditLogger audit;
    private TaskScheduler scheduler;
    private final List<DispatchRequest> dispatched = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        audit = AuditLogger.inMemory(500);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private WorkflowEngine engine(ActionDispatcher target) {
        MeshConfig config = MeshConfig.inMemory(MeshConfig.Settings.defaults().withRetryDelays(0L, 0L));
        ActionDispatcher recording = request -> {
            dispatched.add(request);
            return target.dispatch(request);
        };
        scheduler = new TaskScheduler(config, recording, audit);
        return new WorkflowEngine(config, recording, scheduler, audit, executor);
    }

    private static ActionDispatcher failing(Set<String> failingNodes) {
        return request -> CompletableFuture.completedFuture(failingNodes.contains(request.unitId())
                ? DispatchResult.fail("node " + request.unitId() + " broke")
                : DispatchResult.ok(null));
    }

    private static DagSpec branches(String id, FailureHandling handling, int threshold) {
        List<Node> nodes = List.of(Node.task("a"), Node.task("b"), Node.task("c", "a"));
        return DagSpec.of(id, nodes, new ExecutionPolicy(1, 0L, 0, threshold)).withFailureHandling(handling);
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT.toMillis();
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("condition not reached in time");
            }
            Thread.sleep(10L);
        }
    }

    @Test
    void singleNodeDagStartsAndCompletes() {
        WorkflowEngine engine = engine(failing(Set.of()));
        DagSpec spec = DagSpec.of("dag-1", List.of(Node.task("n1")), new ExecutionPolicy(1, 30_000L, 3, 0));

        WorkflowEngine.WorkflowOutcome created = engine.createDAG(spec);
        Assertions.assertTrue(created.success());
        Assertions.assertEquals("created", created.status());

        WorkflowEngine.WorkflowOutcome started = engine.startWorkflow("dag-1");
        Assertions.assertTrue(started.success());
        Assertions.assertEquals("dag-1", started.workflowId());

        WorkflowEngine.WorkflowStatus status = engine.awaitTermination("dag-1", WAIT);
        Assertions.assertEquals("completed", status.status());
        Assertions.assertEquals(100.0, status.progress());
        Assertions.assertEquals(NodeStatus.SUCCEEDED, status.nodeStatus("n1"));
        Assertions.assertEquals(MeshConfig.DEFAULT_AGENT_ID, dispatched.get(0).agentId());
        Assertions.assertEquals(Node.DEFAULT_ACTION, dispatched.get(0).action());
        Assertions.assertEquals(30_000L, dispatched.get(0).timeoutMs());
    }

    @Test
    void operationsOnUnknownWorkflowsReturnFalse() {
        WorkflowEngine engine = engine(failing(Set.of()));
        Assertions.assertFalse(engine.pauseWorkflow("nope"));
        Assertions.assertFalse(engine.resumeWorkflow("nope"));
        Assertions.assertFalse(engine.cancelWorkflow("nope"));
        Assertions.assertFalse(engine.startWorkflow("nope").success());
        Assertions.assertFalse(engine.getWorkflowStatus("nope").known());
        Assertions.assertEquals(TaskState.UNKNOWN, engine.getTaskStatus("nope").status());
    }

    @Test
    void pausedRunDispatchesNothingUntilResumed() throws Exception {
        CompletableFuture<DispatchResult> gate = new CompletableFuture<>();
        WorkflowEngine engine = engine(request -> request.unitId().equals("n1")
                ? gate
                : CompletableFuture.completedFuture(DispatchResult.ok(null)));
        engine.createDAG(DagSpec.of("pausable", List.of(Node.task("n1"), Node.task("n2", "n1")), ExecutionPolicy.defaults()));
        Assertions.assertTrue(engine.startWorkflow("pausable").success());

        Assertions.assertTrue(engine.pauseWorkflow("pausable"));
        Assertions.assertFalse(engine.pauseWorkflow("pausable"));
        Assertions.assertEquals("paused", engine.getWorkflowStatus("pausable").status());

        gate.complete(DispatchResult.ok(null));
        waitFor(() -> engine.getWorkflowStatus("pausable").nodeStatus("n1") == NodeStatus.SUCCEEDED);
        Thread.sleep(50L);
        Assertions.assertEquals(NodeStatus.PENDING, engine.getWorkflowStatus("pausable").nodeStatus("n2"));
        Assertions.assertEquals(1, dispatched.size());

        Assertions.assertTrue(engine.resumeWorkflow("pausable"));
        WorkflowEngine.WorkflowStatus status = engine.awaitTermination("pausable", WAIT);
        Assertions.assertEquals("completed", status.status());
        Assertions.assertEquals(2, dispatched.size());
    }

    @Test
    void failedAttemptsAreRetriedWithinBudget() {
        WorkflowEngine engine = engine(request -> CompletableFuture.completedFuture(request.attempt() < 3
                ? DispatchResult.fail("transient")
                : DispatchResult.ok(null)));
        DagSpec spec = DagSpec.of("retry", List.of(Node.task("n1")), new ExecutionPolicy(1, 0L, 2, 0));

        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(spec, WAIT);
        Assertions.assertEquals("completed", status.status());
        Assertions.assertEquals(3, status.nodes().get("n1").attempts());
        Assertions.assertNull(status.nodes().get("n1").lastError());
        Assertions.assertEquals(0, status.failureCount());
    }

    @Test
    void stopStrategyHaltsOnceThresholdIsExceeded() {
        WorkflowEngine engine = engine(failing(Set.of("a")));
        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(branches("stop", FailureHandling.stop(), 0), WAIT);

        Assertions.assertEquals("failed", status.status());
        Assertions.assertEquals(NodeStatus.FAILED, status.nodeStatus("a"));
        Assertions.assertEquals(NodeStatus.SKIPPED, status.nodeStatus("b"));
        Assertions.assertEquals(NodeStatus.SKIPPED, status.nodeStatus("c"));
        Assertions.assertEquals(1, status.failureCount());
        Assertions.assertTrue(status.errors().get(0).startsWith("Failure threshold exceeded"));
    }

    @Test
    void continueStrategyFinishesIndependentBranches() {
        WorkflowEngine engine = engine(failing(Set.of("a")));
        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(
                branches("continue", FailureHandling.of(FailureStrategy.CONTINUE), 0), WAIT);

        Assertions.assertEquals("failed", status.status());
        Assertions.assertEquals(NodeStatus.SUCCEEDED, status.nodeStatus("b"));
        Assertions.assertEquals(NodeStatus.SKIPPED, status.nodeStatus("c"));
        Assertions.assertEquals("Upstream node failed: a", status.nodes().get("c").lastError());
    }

    @Test
    void failuresWithinThresholdStillComplete() {
        WorkflowEngine engine = engine(failing(Set.of("a")));
        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(branches("tolerant", FailureHandling.stop(), 1), WAIT);

        Assertions.assertEquals("completed", status.status());
        Assertions.assertEquals(1, status.failedNodes());
        Assertions.assertEquals(1, status.completedNodes());
        Assertions.assertEquals(1, status.skippedNodes());
    }

    @Test
    void compensateStrategyEnqueuesCompensationTasks() {
        WorkflowEngine engine = engine(failing(Set.of("a")));
        FailureHandling handling = new FailureHandling(FailureStrategy.COMPENSATE, List.of("rollback"), List.of());
        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(branches("comp", handling, 0), WAIT);

        Assertions.assertEquals("failed", status.status());
        Assertions.assertEquals(1, scheduler.pendingCount());
        TaskScheduler.TaskSnapshot queued = scheduler.exportTasks().get(0);
        Assertions.assertEquals("rollback", queued.task().name());
        Assertions.assertEquals(ScheduledTask.COMPENSATION_ACTION, queued.task().action());
        Assertions.assertEquals("comp", queued.task().workflowId());
    }

    @Test
    void cancelDiscardsLateResults() throws Exception {
        CompletableFuture<DispatchResult> gate = new CompletableFuture<>();
        WorkflowEngine engine = engine(request -> gate);
        engine.createDAG(DagSpec.of("cancel-me", List.of(Node.task("n1"), Node.task("n2", "n1")), ExecutionPolicy.defaults()));
        engine.startWorkflow("cancel-me");

        Assertions.assertTrue(engine.cancelWorkflow("cancel-me"));
        Assertions.assertFalse(engine.cancelWorkflow("cancel-me"));
        gate.complete(DispatchResult.ok(null));
        Thread.sleep(50L);

        WorkflowEngine.WorkflowStatus status = engine.getWorkflowStatus("cancel-me");
        Assertions.assertEquals("cancelled", status.status());
        Assertions.assertEquals(NodeStatus.SKIPPED, status.nodeStatus("n1"));
        Assertions.assertEquals(NodeStatus.SKIPPED, status.nodeStatus("n2"));
        Assertions.assertFalse(engine.resumeWorkflow("cancel-me"));
    }

    @Test
    void unansweredDispatchTimesOutAsFailure() {
        WorkflowEngine engine = engine(request -> new CompletableFuture<>());
        DagSpec spec = DagSpec.of("slow", List.of(Node.task("n1").withTimeout(50L)), new ExecutionPolicy(1, 0L, 0, 0));

        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(spec, WAIT);
        Assertions.assertEquals("failed", status.status());
        Assertions.assertEquals("Node timed out after 50ms", status.nodes().get("n1").lastError());
        Assertions.assertEquals(50L, dispatched.get(0).timeoutMs());
    }

    @Test
    void workflowDeadlineCancelsTheRun() {
        WorkflowEngine engine = engine(request -> new CompletableFuture<>());
        DagSpec spec = DagSpec.of("deadline", List.of(Node.task("n1")), new ExecutionPolicy(1, 0L, 0, 0));

        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(spec, Duration.ofMillis(100L));
        Assertions.assertEquals("cancelled", status.status());
        Assertions.assertTrue(status.errors().contains("Workflow timed out after 100ms"));
        Assertions.assertNull(dispatched.get(0).timeoutMs());
    }

    @Test
    void decisionAndMergeNodesRunInsideTheEngine() {
        WorkflowEngine engine = engine(failing(Set.of()));
        List<Node> nodes = List.of(
                Node.task("fetch"),
                new Node("route", "route", NodeType.DECISION, null, null, List.of("fetch"), null, null, null, null),
                new Node("join", "join", NodeType.MERGE, null, null, List.of("route"), null, null, null, null),
                Node.task("store", "join")
        );
        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(DagSpec.of("gates", nodes, ExecutionPolicy.defaults()), WAIT);

        Assertions.assertEquals("completed", status.status());
        Assertions.assertEquals(List.of("fetch", "store"), dispatched.stream().map(DispatchRequest::unitId).toList());
    }

    @Test
    void invalidSpecFailsAtStart() {
        WorkflowEngine engine = engine(failing(Set.of()));
        engine.createDAG(DagSpec.of("loop", List.of(Node.task("a", "b"), Node.task("b", "a")), ExecutionPolicy.defaults()));

        WorkflowEngine.WorkflowOutcome started = engine.startWorkflow("loop");
        Assertions.assertFalse(started.success());
        Assertions.assertEquals("failed", started.status());
        Assertions.assertTrue(started.errors().get(0).contains("circular"));
        Assertions.assertTrue(dispatched.isEmpty());
    }

    @Test
    void createAndUpdateRules() {
        WorkflowEngine engine = engine(failing(Set.of()));
        WorkflowEngine.WorkflowOutcome generated = engine.createDAG(DagSpec.of(null, List.of(Node.task("x")), ExecutionPolicy.defaults()));
        Assertions.assertTrue(generated.workflowId().startsWith("dag_"));

        DagSpec spec = DagSpec.of("editable", List.of(Node.task("x")), ExecutionPolicy.defaults());
        Assertions.assertTrue(engine.createDAG(spec).success());
        Assertions.assertFalse(engine.createDAG(spec).success());
        Assertions.assertTrue(engine.updateDAG("editable",
                DagSpec.of("ignored", List.of(Node.task("x"), Node.task("y", "x")), ExecutionPolicy.defaults())));
        Assertions.assertEquals(2, engine.getWorkflowStatus("editable").totalNodes());

        engine.awaitTermination(engine.startWorkflow("editable").workflowId(), WAIT);
        Assertions.assertFalse(engine.updateDAG("editable", spec));
    }

    @Test
    void taskStatusAndMetricsReflectFinishedRuns() {
        WorkflowEngine engine = engine(failing(Set.of("bad")));
        engine.orchestrateDag(DagSpec.of("good-run", List.of(Node.task("ok")), ExecutionPolicy.defaults()), WAIT);
        engine.orchestrateDag(DagSpec.of("bad-run", List.of(Node.task("bad")), ExecutionPolicy.defaults()), WAIT);

        TaskState qualified = engine.getTaskStatus("good-run:ok");
        Assertions.assertEquals("succeeded", qualified.status());
        Assertions.assertEquals("good-run", qualified.workflowId());
        Assertions.assertEquals("failed", engine.getTaskStatus("bad").status());

        WorkflowEngine.EngineMetrics metrics = engine.getSystemMetrics();
        Assertions.assertEquals(2, metrics.totalWorkflows());
        Assertions.assertEquals(1, metrics.completedWorkflows());
        Assertions.assertEquals(1, metrics.failedWorkflows());
        Assertions.assertEquals(2L, metrics.tasksExecuted());
        Assertions.assertEquals(0.5, metrics.successRate());
        Assertions.assertEquals(2L, metrics.throughputPerMinute());

        Assertions.assertEquals(0, engine.purgeTerminal(Duration.ofHours(1)));
        Assertions.assertEquals(2, engine.purgeTerminal(Duration.ofMillis(-1)));
        Assertions.assertTrue(engine.listWorkflows().isEmpty());
    }

    @Test
    void restoredActiveRunsComeBackPaused() throws Exception {
        CompletableFuture<DispatchResult> gate = new CompletableFuture<>();
        WorkflowEngine engine = engine(request -> request.attempt() == 1 && dispatched.size() == 1
                ? gate
                : CompletableFuture.completedFuture(DispatchResult.ok(null)));
        engine.createDAG(DagSpec.of("live", List.of(Node.task("n1")), ExecutionPolicy.defaults()));
        engine.startWorkflow("live");
        List<WorkflowEngine.DagRunSnapshot> exported = engine.exportRuns();
        Assertions.assertEquals(DagStatus.RUNNING, exported.get(0).status());

        engine.restoreRuns(exported);
        gate.complete(DispatchResult.ok(null));
        WorkflowEngine.WorkflowStatus restored = engine.getWorkflowStatus("live");
        Assertions.assertEquals("paused", restored.status());
        Assertions.assertEquals(NodeStatus.PENDING, restored.nodeStatus("n1"));

        Assertions.assertTrue(engine.resumeWorkflow("live"));
        Assertions.assertEquals("completed", engine.awaitTermination("live", WAIT).status());
        Assertions.assertEquals(2, dispatched.size());
    }

    @Test
    void inFlightNodesNeverExceedPolicyConcurrency() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        WorkflowEngine engine = engine(request -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return CompletableFuture.supplyAsync(() -> {
                try {
                    Thread.sleep(30L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                inFlight.decrementAndGet();
                return DispatchResult.ok(null);
            }, executor);
        });
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            nodes.add(Node.task("n" + i));
        }

        WorkflowEngine.WorkflowStatus status = engine.orchestrateDag(
                DagSpec.of("wide", nodes, new ExecutionPolicy(3, 0L, 0, 0)), WAIT);
        Assertions.assertEquals("completed", status.status());
        Assertions.assertEquals(12, dispatched.size());
        Assertions.assertTrue(peak.get() <= 3, "peak in flight " + peak.get());
        Assertions.assertTrue(peak.get() > 1, "nodes never overlapped");
    }

    @Test
    void nodeOutputReturnedInStatusIsACopy() {
        WorkflowEngine engine = engine(request -> CompletableFuture.completedFuture(
                DispatchResult.ok(Jsons.object().put("rows", 3))));
        engine.orchestrateDag(DagSpec.of("copy", List.of(Node.task("n1")), ExecutionPolicy.defaults()), WAIT);

        WorkflowEngine.NodeState node = engine.getWorkflowStatus("copy").nodes().get("n1");
        ((ObjectNode) node.output()).put("rows", 99);
        Assertions.assertEquals(3, node.output().path("rows").asInt());
        Assertions.assertEquals(3, engine.getWorkflowStatus("copy").nodes().get("n1").output().path("rows").asInt());
    }
}
