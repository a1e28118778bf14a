package io.dagmesh.scheduler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dagmesh.config.MeshConfig;
import io.dagmesh.dispatch.ActionDispatcher;
import io.dagmesh.dispatch.DispatchRequest;
import io.dagmesh.dispatch.DispatchResult;
import io.dagmesh.model.Priority;
import io.dagmesh.model.RetryPolicy;
import io.dagmesh.model.TaskState;
import io.dagmesh.observability.AuditLogger;
import io.dagmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

final class TaskSchedulerTest {

    private static MeshConfig config(int maxConcurrency) {
        return MeshConfig.inMemory(MeshConfig.Settings.defaults()
                .withMaxConcurrency(maxConcurrency)
                .withRetryDelays(0L, 0L));
    }

    private static ActionDispatcher recording(List<DispatchRequest> seen, Set<String> failing) {
        return request -> {
            seen.add(request);
            if (failing.contains(request.unitId())) {
                return CompletableFuture.completedFuture(DispatchResult.fail("boom: " + request.unitId()));
            }
            return CompletableFuture.completedFuture(DispatchResult.ok(null));
        };
    }

    @Test
    void tasksDrainByPriorityThenSchedulingOrder() {
        List<DispatchRequest> seen = Collections.synchronizedList(new ArrayList<>());
        TaskScheduler scheduler = new TaskScheduler(config(1), recording(seen, Set.of()), AuditLogger.inMemory(50));
        scheduler.scheduleTask(ScheduledTask.of("low", null).withId("low").withPriority(Priority.LOW));
        scheduler.scheduleTask(ScheduledTask.of("normal-1", null).withId("normal-1"));
        scheduler.scheduleTask(ScheduledTask.of("high", null).withId("high").withPriority(Priority.HIGH));
        scheduler.scheduleTask(ScheduledTask.of("normal-2", null).withId("normal-2"));
        Assertions.assertEquals(4, scheduler.pendingCount());

        List<TaskScheduler.TaskExecutionResult> results = scheduler.executeScheduledTasks();
        Assertions.assertEquals(4, results.size());
        List<String> order = seen.stream().map(DispatchRequest::unitId).toList();
        Assertions.assertEquals(List.of("high", "normal-1", "normal-2", "low"), order);
        Assertions.assertEquals(ScheduledTask.DEFAULT_ACTION, seen.get(0).action());
        Assertions.assertEquals(MeshConfig.DEFAULT_AGENT_ID, seen.get(0).agentId());
        Assertions.assertEquals(4L, scheduler.stats().succeeded());
        Assertions.assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void dependenciesRunFirstWithinOneCall() {
        List<DispatchRequest> seen = Collections.synchronizedList(new ArrayList<>());
        TaskScheduler scheduler = new TaskScheduler(config(4), recording(seen, Set.of()), AuditLogger.inMemory(50));
        scheduler.scheduleTask(ScheduledTask.of("child", null).withId("child").withDependencies(List.of("parent", "unknown")));
        scheduler.scheduleTask(ScheduledTask.of("parent", null).withId("parent"));

        scheduler.executeScheduledTasks();
        Assertions.assertEquals(List.of("parent", "child"), seen.stream().map(DispatchRequest::unitId).toList());
        Assertions.assertEquals("succeeded", scheduler.getTask("child").orElseThrow().status());
    }

    @Test
    void failedTaskRetriesThenFailsAndBlocksDependents() {
        List<DispatchRequest> seen = Collections.synchronizedList(new ArrayList<>());
        TaskScheduler scheduler = new TaskScheduler(config(2), recording(seen, Set.of("flaky")), AuditLogger.inMemory(50));
        scheduler.scheduleTask(ScheduledTask.of("flaky", null).withId("flaky").withRetryPolicy(RetryPolicy.ofRetries(2, 0L, 0L)));
        scheduler.scheduleTask(ScheduledTask.of("after", null).withId("after").withDependencies(List.of("flaky")));

        List<TaskScheduler.TaskExecutionResult> results = scheduler.executeScheduledTasks();
        TaskState flaky = scheduler.getTask("flaky").orElseThrow();
        Assertions.assertEquals("failed", flaky.status());
        Assertions.assertEquals(3, flaky.attempts());
        Assertions.assertEquals("boom: flaky", flaky.lastError());

        TaskState after = scheduler.getTask("after").orElseThrow();
        Assertions.assertEquals("failed", after.status());
        Assertions.assertEquals("Dependency failed: flaky", after.lastError());
        Assertions.assertEquals(0, after.attempts());

        long retries = results.stream().filter(r -> r.followUp() == FailureAction.RETRY).count();
        Assertions.assertEquals(2L, retries);
        Assertions.assertEquals(3L, seen.stream().filter(r -> r.unitId().equals("flaky")).count());
    }

    @Test
    void exhaustedTaskWithCompensationEnqueuesHighPriorityTasks() {
        List<DispatchRequest> seen = Collections.synchronizedList(new ArrayList<>());
        TaskScheduler scheduler = new TaskScheduler(config(1), recording(seen, Set.of("charge")), AuditLogger.inMemory(50));
        scheduler.scheduleTask(ScheduledTask.of("charge", null)
                .withId("charge")
                .withRetryPolicy(RetryPolicy.noRetry())
                .withMetadata(Map.of("workflowId", "order-7", "compensationTasks", List.of("refund"))));

        List<TaskScheduler.TaskExecutionResult> results = scheduler.executeScheduledTasks();
        Assertions.assertEquals(FailureAction.COMPENSATE, results.get(0).followUp());
        DispatchRequest compensation = seen.get(1);
        Assertions.assertEquals(ScheduledTask.COMPENSATION_ACTION, compensation.action());
        Assertions.assertEquals("order-7", compensation.workflowId());
        ScheduledTask definition = scheduler.definition(compensation.unitId()).orElseThrow();
        Assertions.assertEquals(Priority.HIGH, definition.priority());
        Assertions.assertEquals("refund", definition.name());
    }

    @Test
    void handleTaskFailureNeverThrows() {
        TaskScheduler scheduler = new TaskScheduler(config(1), recording(new ArrayList<>(), Set.of()), AuditLogger.inMemory(50));
        TaskScheduler.FailureHandlingResult unknown = scheduler.handleTaskFailure("missing", "oops");
        Assertions.assertFalse(unknown.success());
        Assertions.assertNull(unknown.action());
        Assertions.assertEquals("oops", unknown.error());

        String id = scheduler.scheduleTask(ScheduledTask.of("manual", null).withRetryPolicy(RetryPolicy.ofRetries(1, 500L, 500L)));
        Assertions.assertTrue(id.startsWith("tsk_"));
        TaskScheduler.FailureHandlingResult retry = scheduler.handleTaskFailure(id, "first failure");
        Assertions.assertTrue(retry.success());
        Assertions.assertEquals(FailureAction.RETRY, retry.action());
        Assertions.assertEquals(500L, retry.retryDelayMs());
        // still inside its backoff window
        Assertions.assertTrue(scheduler.executeScheduledTasks().isEmpty());
        Assertions.assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void duplicateOrNullTasksAreRejected() {
        TaskScheduler scheduler = new TaskScheduler(config(1), recording(new ArrayList<>(), Set.of()), AuditLogger.inMemory(50));
        scheduler.scheduleTask(ScheduledTask.of("once", null).withId("once"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleTask(ScheduledTask.of("again", null).withId("once")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleTask(null));
    }

    @Test
    void dispatchWithoutAnswerTimesOut() {
        TaskScheduler scheduler = new TaskScheduler(config(1), request -> new CompletableFuture<>(), AuditLogger.inMemory(50));
        ScheduledTask task = new ScheduledTask("slow", "slow", null, null, null, List.of(), 50L, Priority.NORMAL,
                RetryPolicy.noRetry(), Map.of());
        scheduler.scheduleTask(task);

        TaskScheduler.TaskExecutionResult result = scheduler.executeScheduledTasks().get(0);
        Assertions.assertFalse(result.success());
        Assertions.assertEquals("Task timed out after 50ms", result.error());
        Assertions.assertEquals(FailureAction.FAIL, result.followUp());
    }

    @Test
    void lateFailureReportDoesNotRerunFinishedTask() {
        List<DispatchRequest> seen = Collections.synchronizedList(new ArrayList<>());
        TaskScheduler scheduler = new TaskScheduler(config(1), recording(seen, Set.of()), AuditLogger.inMemory(50));
        scheduler.scheduleTask(ScheduledTask.of("report", null)
                .withId("report")
                .withAgent("reporter")
                .withRetryPolicy(RetryPolicy.ofRetries(2, 0L, 0L)));

        Assertions.assertTrue(scheduler.executeScheduledTasks().get(0).success());
        Assertions.assertEquals("reporter", seen.get(0).agentId());
        Assertions.assertEquals(MeshConfig.DEFAULT_EVENT_TIMEOUT_MS, seen.get(0).timeoutMs());

        TaskScheduler.FailureHandlingResult late = scheduler.handleTaskFailure("report", "reported too late");
        Assertions.assertFalse(late.success());
        Assertions.assertNull(late.action());
        Assertions.assertTrue(scheduler.executeScheduledTasks().isEmpty());
        Assertions.assertEquals(1, seen.size());

        TaskState state = scheduler.getTask("report").orElseThrow();
        Assertions.assertEquals("succeeded", state.status());
        Assertions.assertEquals(1, state.attempts());
        Assertions.assertNull(state.lastError());
        Assertions.assertEquals(1L, scheduler.stats().succeeded());
        Assertions.assertEquals(0L, scheduler.stats().failed());
    }

    @Test
    void failureReportedWhileRunningDiscardsTheInFlightResult() {
        AtomicReference<TaskScheduler> holder = new AtomicReference<>();
        List<DispatchRequest> seen = Collections.synchronizedList(new ArrayList<>());
        ActionDispatcher dispatcher = request -> {
            seen.add(request);
            if (request.attempt() == 1) {
                holder.get().handleTaskFailure(request.unitId(), "worker lost");
            }
            return CompletableFuture.completedFuture(DispatchResult.ok(null));
        };
        TaskScheduler scheduler = new TaskScheduler(config(1), dispatcher, AuditLogger.inMemory(50));
        holder.set(scheduler);
        scheduler.scheduleTask(ScheduledTask.of("job", null).withId("job").withRetryPolicy(RetryPolicy.ofRetries(1, 0L, 0L)));

        List<TaskScheduler.TaskExecutionResult> results = scheduler.executeScheduledTasks();
        Assertions.assertEquals(2, results.size());
        Assertions.assertFalse(results.get(0).success());
        Assertions.assertEquals("Attempt 1 superseded", results.get(0).error());
        Assertions.assertTrue(results.get(1).success());
        Assertions.assertEquals(2, results.get(1).attempts());
        Assertions.assertEquals(2, seen.size());

        TaskState state = scheduler.getTask("job").orElseThrow();
        Assertions.assertEquals("succeeded", state.status());
        Assertions.assertEquals(2, state.attempts());
        Assertions.assertEquals(1L, scheduler.stats().succeeded());
    }

    @Test
    void inFlightDispatchesNeverExceedMaxConcurrency() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(8);
        try {
            ActionDispatcher dispatcher = request -> {
                peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                return CompletableFuture.supplyAsync(() -> {
                    try {
                        Thread.sleep(30L);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    inFlight.decrementAndGet();
                    return DispatchResult.ok(null);
                }, workers);
            };
            TaskScheduler scheduler = new TaskScheduler(config(3), dispatcher, AuditLogger.inMemory(100));
            for (int i = 0; i < 10; i++) {
                scheduler.scheduleTask(ScheduledTask.of("job-" + i, null).withId("job-" + i));
            }

            List<TaskScheduler.TaskExecutionResult> results = scheduler.executeScheduledTasks();
            Assertions.assertEquals(10, results.size());
            Assertions.assertTrue(results.stream().allMatch(TaskScheduler.TaskExecutionResult::success));
            Assertions.assertTrue(peak.get() <= 3, "peak in flight " + peak.get());
            Assertions.assertTrue(peak.get() > 1, "tasks never overlapped");
        } finally {
            workers.shutdownNow();
            workers.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void exportedTaskOutputIsACopy() {
        TaskScheduler scheduler = new TaskScheduler(config(1),
                request -> CompletableFuture.completedFuture(DispatchResult.ok(Jsons.object().put("rows", 3))),
                AuditLogger.inMemory(50));
        scheduler.scheduleTask(ScheduledTask.of("count", null).withId("count"));
        scheduler.executeScheduledTasks();

        TaskScheduler.TaskSnapshot exported = scheduler.exportTasks().get(0);
        ((ObjectNode) exported.output()).put("rows", 99);
        Assertions.assertEquals(3, exported.output().path("rows").asInt());
        Assertions.assertEquals(3, scheduler.getTask("count").orElseThrow().output().path("rows").asInt());
    }
}
