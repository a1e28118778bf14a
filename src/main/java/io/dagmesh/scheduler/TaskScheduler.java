package io.dagmesh.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.config.MeshConfig;
import io.dagmesh.dispatch.ActionDispatcher;
import io.dagmesh.dispatch.DispatchRequest;
import io.dagmesh.dispatch.DispatchResult;
import io.dagmesh.model.Priority;
import io.dagmesh.model.RetryPolicy;
import io.dagmesh.model.TaskState;
import io.dagmesh.observability.AuditLogger;
import io.dagmesh.util.Ids;
import io.dagmesh.util.Jsons;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Priority queue of ungraphed tasks. Tasks drain by priority, then in scheduling order.
 *
 * <p>{@link #executeScheduledTasks()} runs ready tasks in rounds of at most
 * {@code maxConcurrency} concurrent dispatches, so a task whose dependency succeeds in one round
 * can run in a later round of the same call. Retries wait for their backoff and are picked up by
 * a later call once due.
 */
public final class TaskScheduler {
    private static final Comparator<TaskRecord> QUEUE_ORDER = Comparator
            .comparingInt((TaskRecord r) -> r.task.priority().rank())
            .thenComparingLong(r -> r.sequence);

    private final ActionDispatcher dispatcher;
    private final AuditLogger audit;
    private final Object lock = new Object();
    private final Map<String, TaskRecord> tasks = new LinkedHashMap<>();
    private final PriorityQueue<TaskRecord> queue = new PriorityQueue<>(QUEUE_ORDER);
    private long nextSequence;
    private long succeeded;
    private long failed;
    private volatile MeshConfig config;

    public TaskScheduler(MeshConfig config, ActionDispatcher dispatcher, AuditLogger audit) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.audit = audit;
    }

    public void reconfigure(MeshConfig next) {
        this.config = next;
    }

    /**
     * Enqueues as pending without executing. A blank id is replaced by a generated one.
     *
     * @throws IllegalArgumentException if the task is null or its id is already scheduled
     */
    public String scheduleTask(ScheduledTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        ScheduledTask owned = task.withId(Ids.orNew(task.id(), "tsk"));
        synchronized (lock) {
            if (tasks.containsKey(owned.id())) {
                throw new IllegalArgumentException("Task already scheduled: " + owned.id());
            }
            TaskRecord record = new TaskRecord(owned, nextSequence++);
            tasks.put(owned.id(), record);
            queue.add(record);
        }
        audit.log(AuditLogger.AuditEvent.of(
                "task.scheduled",
                "scheduler",
                "task/" + owned.id(),
                "pending",
                Map.of("type", owned.action(), "priority", owned.priority().wireName())
        ));
        return owned.id();
    }

    /**
     * Schedules one high-priority compensation task per name.
     */
    public List<String> enqueueCompensation(String workflowId, List<String> compensationTasks) {
        List<String> ids = new ArrayList<>();
        for (String name : compensationTasks) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("workflowId", workflowId);
            metadata.put("compensates", name);
            ScheduledTask task = ScheduledTask.of(name, ScheduledTask.COMPENSATION_ACTION)
                    .withPriority(Priority.HIGH)
                    .withMetadata(metadata);
            ids.add(scheduleTask(task));
        }
        return ids;
    }

    public List<TaskExecutionResult> executeScheduledTasks() {
        List<TaskExecutionResult> results = new ArrayList<>();
        while (true) {
            List<TaskRecord> batch = takeReady(config.settings().maxConcurrency(), results);
            if (batch.isEmpty()) {
                return results;
            }
            List<CompletableFuture<TaskExecutionResult>> running = new ArrayList<>(batch.size());
            for (TaskRecord record : batch) {
                running.add(execute(record));
            }
            for (CompletableFuture<TaskExecutionResult> future : running) {
                results.add(future.join());
            }
        }
    }

    /**
     * Records a failure and decides what happens next. Never throws; an unknown id yields
     * {@code success=false} echoing the arguments. Only pending or running tasks change state: a task
     * that already succeeded or failed keeps its recorded outcome and the call reports
     * {@code success=false}. A running attempt that is re-queued here has its late result discarded.
     */
    public FailureHandlingResult handleTaskFailure(String taskId, String error) {
        FailureDecision decision;
        synchronized (lock) {
            TaskRecord record = taskId == null ? null : tasks.get(taskId);
            if (record == null) {
                return new FailureHandlingResult(false, taskId, null, List.of(), 0L, error);
            }
            if (record.status != TaskRunStatus.PENDING && record.status != TaskRunStatus.RUNNING) {
                return new FailureHandlingResult(false, taskId, null, List.of(), 0L,
                        "Task already " + record.status.wireName() + ": " + taskId);
            }
            decision = recordFailureLocked(record, error);
        }
        return auditFailure(taskId, error, decision);
    }

    private FailureDecision recordFailureLocked(TaskRecord record, String error) {
        queue.remove(record);
        record.lastError = error;
        int attempts = Math.max(1, record.attempts);
        RetryPolicy policy = retryPolicyFor(record.task);
        if (policy.allowsRetryAfter(attempts)) {
            long delay = policy.delayAfter(attempts);
            record.status = TaskRunStatus.PENDING;
            record.notBefore = Instant.now().plusMillis(delay);
            record.sequence = nextSequence++;
            queue.add(record);
            return new FailureDecision(FailureAction.RETRY, delay, List.of());
        }
        record.status = TaskRunStatus.FAILED;
        record.finishedAt = Instant.now();
        failed++;
        List<String> names = record.task.compensationTasks();
        if (names.isEmpty()) {
            return new FailureDecision(FailureAction.FAIL, 0L, List.of());
        }
        return new FailureDecision(FailureAction.COMPENSATE, 0L,
                enqueueCompensation(record.task.workflowId(), names));
    }

    private FailureHandlingResult auditFailure(String taskId, String error, FailureDecision decision) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", decision.action().wireName());
        details.put("retryDelayMs", decision.delayMs());
        details.put("error", error);
        audit.log(AuditLogger.AuditEvent.of("task.failure", "scheduler", "task/" + taskId,
                decision.action().wireName(), details));
        return new FailureHandlingResult(true, taskId, decision.action(), decision.compensation(),
                decision.delayMs(), error);
    }

    public Optional<TaskState> getTask(String taskId) {
        synchronized (lock) {
            TaskRecord record = taskId == null ? null : tasks.get(taskId);
            return record == null ? Optional.empty() : Optional.of(record.view());
        }
    }

    public Optional<ScheduledTask> definition(String taskId) {
        synchronized (lock) {
            TaskRecord record = taskId == null ? null : tasks.get(taskId);
            return record == null ? Optional.empty() : Optional.of(record.task);
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public SchedulerStats stats() {
        synchronized (lock) {
            int running = 0;
            for (TaskRecord record : tasks.values()) {
                if (record.status == TaskRunStatus.RUNNING) {
                    running++;
                }
            }
            return new SchedulerStats(tasks.size(), queue.size(), running, succeeded, failed);
        }
    }

    public List<TaskSnapshot> exportTasks() {
        synchronized (lock) {
            List<TaskSnapshot> out = new ArrayList<>(tasks.size());
            for (TaskRecord record : tasks.values()) {
                out.add(new TaskSnapshot(record.task, record.status, record.attempts, record.lastError,
                        record.output, record.sequence, record.notBefore, record.createdAt, record.finishedAt));
            }
            return List.copyOf(out);
        }
    }

    /**
     * Replaces every task. Tasks that were running come back pending; their in-flight results are
     * discarded when they arrive.
     */
    public void restoreTasks(List<TaskSnapshot> snapshots) {
        Map<String, TaskRecord> next = new LinkedHashMap<>();
        long maxSequence = -1L;
        for (TaskSnapshot snapshot : snapshots) {
            TaskRecord record = new TaskRecord(snapshot.task(), snapshot.sequence());
            record.status = snapshot.status() == TaskRunStatus.RUNNING ? TaskRunStatus.PENDING : snapshot.status();
            record.attempts = snapshot.attempts();
            record.lastError = snapshot.lastError();
            record.output = Jsons.copy(snapshot.output());
            record.notBefore = snapshot.notBefore();
            record.createdAt = snapshot.createdAt();
            record.finishedAt = snapshot.finishedAt();
            next.put(record.task.id(), record);
            maxSequence = Math.max(maxSequence, snapshot.sequence());
        }
        synchronized (lock) {
            tasks.clear();
            queue.clear();
            tasks.putAll(next);
            for (TaskRecord record : next.values()) {
                if (record.status == TaskRunStatus.PENDING) {
                    queue.add(record);
                }
            }
            nextSequence = Math.max(nextSequence, maxSequence + 1);
        }
    }

    private List<TaskRecord> takeReady(int limit, List<TaskExecutionResult> results) {
        List<TaskRecord> batch = new ArrayList<>();
        List<TaskRecord> notReady = new ArrayList<>();
        Instant now = Instant.now();
        synchronized (lock) {
            while (batch.size() < Math.max(1, limit) && !queue.isEmpty()) {
                TaskRecord record = queue.poll();
                if (record.notBefore != null && record.notBefore.isAfter(now)) {
                    notReady.add(record);
                    continue;
                }
                String blocked = null;
                String failedDependency = null;
                for (String dep : record.task.dependencies()) {
                    TaskRecord upstream = tasks.get(dep);
                    if (upstream == null || upstream.status == TaskRunStatus.SUCCEEDED) {
                        continue;
                    }
                    if (upstream.status == TaskRunStatus.FAILED) {
                        failedDependency = dep;
                        break;
                    }
                    blocked = dep;
                }
                if (failedDependency != null) {
                    record.status = TaskRunStatus.FAILED;
                    record.lastError = "Dependency failed: " + failedDependency;
                    record.finishedAt = now;
                    failed++;
                    results.add(new TaskExecutionResult(record.task.id(), false, null, record.lastError,
                            record.attempts, FailureAction.FAIL));
                    continue;
                }
                if (blocked != null) {
                    notReady.add(record);
                    continue;
                }
                record.status = TaskRunStatus.RUNNING;
                record.attempts++;
                if (record.startedAt == null) {
                    record.startedAt = now;
                }
                batch.add(record);
            }
            queue.addAll(notReady);
        }
        return batch;
    }

    private CompletableFuture<TaskExecutionResult> execute(TaskRecord record) {
        ScheduledTask task = record.task;
        MeshConfig current = config;
        String agentId = task.agentId() == null || task.agentId().isBlank()
                ? current.settings().defaultAgentId()
                : task.agentId();
        int attempt = record.attempts;
        long timeout = task.timeout() != null && task.timeout() > 0
                ? task.timeout()
                : current.settings().eventTimeoutMs();
        DispatchRequest request = new DispatchRequest(task.workflowId(), task.id(), agentId, task.action(),
                task.parameters(), attempt, timeout);
        CompletableFuture<DispatchResult> future;
        try {
            future = dispatcher.dispatch(request).copy();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.orTimeout(timeout, TimeUnit.MILLISECONDS)
                .handle((result, error) -> complete(record, attempt, result, error, timeout));
    }

    private TaskExecutionResult complete(TaskRecord record, int attempt, DispatchResult result, Throwable error, long timeout) {
        String taskId = record.task.id();
        String failure = null;
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            failure = cause instanceof TimeoutException
                    ? "Task timed out after " + timeout + "ms"
                    : String.valueOf(cause.getMessage());
        } else if (result == null || !result.success()) {
            failure = result == null ? "No dispatch result" : result.error();
        }
        if (failure == null) {
            synchronized (lock) {
                String stale = staleReasonLocked(record, attempt);
                if (stale != null) {
                    return new TaskExecutionResult(taskId, false, null, stale, attempt, null);
                }
                record.status = TaskRunStatus.SUCCEEDED;
                record.output = Jsons.copy(result.output());
                record.lastError = null;
                record.finishedAt = Instant.now();
                succeeded++;
            }
            audit.log(AuditLogger.AuditEvent.of("task.executed", "scheduler", "task/" + taskId, "ok",
                    Map.of("attempt", attempt)));
            return new TaskExecutionResult(taskId, true, result.output(), null, attempt, null);
        }
        FailureDecision decision;
        synchronized (lock) {
            String stale = staleReasonLocked(record, attempt);
            if (stale != null) {
                return new TaskExecutionResult(taskId, false, null, stale, attempt, null);
            }
            decision = recordFailureLocked(record, failure);
        }
        FailureHandlingResult handled = auditFailure(taskId, failure, decision);
        return new TaskExecutionResult(taskId, false, null, failure, attempt, handled.action());
    }

    /**
     * Non-null when the attempt no longer owns the task, because a restore replaced the record or a
     * failure report moved it on while this attempt was in flight.
     */
    private String staleReasonLocked(TaskRecord record, int attempt) {
        if (tasks.get(record.task.id()) != record) {
            return "Task replaced by restore";
        }
        if (record.status != TaskRunStatus.RUNNING || record.attempts != attempt) {
            return "Attempt " + attempt + " superseded";
        }
        return null;
    }

    private RetryPolicy retryPolicyFor(ScheduledTask task) {
        if (task.retryPolicy() != null) {
            return task.retryPolicy();
        }
        MeshConfig current = config;
        return current.defaultRetryPolicy(current.settings().retryAttempts());
    }

    private static final class TaskRecord {
        private final ScheduledTask task;
        private long sequence;
        private TaskRunStatus status = TaskRunStatus.PENDING;
        private int attempts;
        private String lastError;
        private JsonNode output;
        private Instant notBefore;
        private Instant createdAt = Instant.now();
        private Instant startedAt;
        private Instant finishedAt;

        private TaskRecord(ScheduledTask task, long sequence) {
            this.task = task;
            this.sequence = sequence;
        }

        private TaskState view() {
            return new TaskState(task.id(), task.workflowId(), status.wireName(), attempts, lastError, output,
                    startedAt, finishedAt);
        }
    }

    public record TaskExecutionResult(
            String taskId,
            boolean success,
            JsonNode output,
            String error,
            int attempts,
            FailureAction followUp
    ) {
    }

    public record FailureHandlingResult(
            boolean success,
            String taskId,
            FailureAction action,
            List<String> compensationTasks,
            long retryDelayMs,
            String error
    ) {
    }

    private record FailureDecision(FailureAction action, long delayMs, List<String> compensation) {
    }

    public record SchedulerStats(int total, int pending, int running, long succeeded, long failed) {
    }

    public record TaskSnapshot(
            ScheduledTask task,
            TaskRunStatus status,
            int attempts,
            String lastError,
            JsonNode output,
            long sequence,
            Instant notBefore,
            Instant createdAt,
            Instant finishedAt
    ) {
        public TaskSnapshot {
            output = output == null ? null : Jsons.copy(output);
        }

        @Override
        public JsonNode output() {
            return output == null ? null : Jsons.copy(output);
        }
    }
}
