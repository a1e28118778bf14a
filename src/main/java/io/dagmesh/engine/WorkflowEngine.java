package io.dagmesh.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.dagmesh.config.MeshConfig;
import io.dagmesh.dispatch.ActionDispatcher;
import io.dagmesh.dispatch.DispatchRequest;
import io.dagmesh.dispatch.DispatchResult;
import io.dagmesh.graph.DagSpec;
import io.dagmesh.graph.DependencyResolver;
import io.dagmesh.graph.FailureStrategy;
import io.dagmesh.graph.Node;
import io.dagmesh.model.RetryPolicy;
import io.dagmesh.model.TaskState;
import io.dagmesh.model.ValidationResult;
import io.dagmesh.observability.AuditLogger;
import io.dagmesh.scheduler.TaskScheduler;
import io.dagmesh.util.Ids;
import io.dagmesh.util.Jsons;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns DAG runs and drives them through
 * {@code created -> validating -> running <-> paused -> completed | cancelled | failed}.
 *
 * <p>Scheduling is event driven. Each run is pumped under its own monitor whenever something
 * changes (start, resume, an attempt finishing, a retry delay elapsing); a pump dispatches
 * eligible nodes in execution order until {@code maxConcurrency} attempts are in flight. Nothing
 * is dispatched while a run is paused, and results arriving after a run turned terminal are
 * dropped.
 *
 * <p>A node that exhausts its retries is marked failed, its transitive dependents are skipped,
 * and the run's failure counter is compared to {@code failureThreshold}. Going past the
 * threshold stops the run ({@code stop}), enqueues compensation tasks and stops it
 * ({@code compensate}), or lets independent branches finish before failing it ({@code continue}).
 */
public final class WorkflowEngine {
    public static final String ACTOR = "workflow-engine";
    private static final long THROUGHPUT_WINDOW_MS = 60_000L;

    private final ActionDispatcher dispatcher;
    private final TaskScheduler scheduler;
    private final AuditLogger audit;
    private final Executor executor;
    private final Object structureLock = new Object();
    private final AtomicLong attemptsSucceeded = new AtomicLong();
    private final AtomicLong attemptsFailed = new AtomicLong();
    private final AtomicLong attemptDurationMs = new AtomicLong();
    private final Deque<Long> recentNodeFinishes = new ArrayDeque<>();
    private volatile Map<String, DagRun> runs = new ConcurrentHashMap<>();
    private volatile MeshConfig config;

    public WorkflowEngine(
            MeshConfig config,
            ActionDispatcher dispatcher,
            TaskScheduler scheduler,
            AuditLogger audit,
            Executor executor
    ) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.audit = audit;
        this.executor = executor;
    }

    public void reconfigure(MeshConfig next) {
        this.config = next;
    }

    public ValidationResult validateDAG(DagSpec spec) {
        return DependencyResolver.validate(spec);
    }

    /**
     * Registers a run in {@code created} state. Validation happens on start. A blank id is
     * replaced by a generated one.
     */
    public WorkflowOutcome createDAG(DagSpec spec) {
        if (spec == null) {
            return WorkflowOutcome.rejected(null, TaskState.UNKNOWN, "DAG spec is missing");
        }
        DagSpec owned = spec.withId(Ids.orNew(spec.id(), "dag"));
        synchronized (structureLock) {
            if (runs.containsKey(owned.id())) {
                return WorkflowOutcome.rejected(owned.id(), TaskState.UNKNOWN, "DAG already exists: " + owned.id());
            }
            runs.put(owned.id(), new DagRun(owned));
        }
        audit.log(AuditLogger.AuditEvent.ofWorkflow("dag.created", ACTOR, owned.id(), null, "ok",
                Map.of("nodes", owned.nodes().size(), "version", String.valueOf(owned.version()))));
        return WorkflowOutcome.accepted(owned.id(), DagStatus.CREATED);
    }

    /**
     * Replaces the spec of a run that has not been started yet.
     */
    public boolean updateDAG(String dagId, DagSpec spec) {
        DagRun run = dagId == null ? null : runs.get(dagId);
        if (run == null || spec == null) {
            return false;
        }
        DagSpec replacement = spec.withId(dagId);
        if (!DependencyResolver.validate(replacement).result()) {
            return false;
        }
        synchronized (run) {
            if (run.status != DagStatus.CREATED || run.detached) {
                return false;
            }
            run.spec = replacement;
            run.resetNodes();
        }
        audit.log(AuditLogger.AuditEvent.ofWorkflow("dag.updated", ACTOR, dagId, null, "ok",
                Map.of("nodes", replacement.nodes().size())));
        return true;
    }

    /**
     * Validates and starts a created run. Returns as soon as the first nodes are dispatched.
     */
    public WorkflowOutcome startWorkflow(String dagId) {
        DagRun run = dagId == null ? null : runs.get(dagId);
        if (run == null) {
            return WorkflowOutcome.rejected(dagId, TaskState.UNKNOWN, "Unknown workflow: " + dagId);
        }
        synchronized (run) {
            if (run.status != DagStatus.CREATED || run.detached) {
                return WorkflowOutcome.rejected(dagId, run.status.wireName(),
                        "Workflow cannot be started from status " + run.status.wireName());
            }
            run.status = DagStatus.VALIDATING;
            ValidationResult validation = DependencyResolver.validate(run.spec);
            if (!validation.result()) {
                run.errors.add(validation.reason());
                finishLocked(run, DagStatus.FAILED);
                return WorkflowOutcome.rejected(dagId, DagStatus.FAILED.wireName(), validation.reason());
            }
            run.executionOrder = DependencyResolver.computeExecutionOrder(run.spec);
            run.indexDependents();
            run.executionId = Ids.newId("exe");
            run.startedAt = Instant.now();
            run.status = DagStatus.RUNNING;
            audit.log(AuditLogger.AuditEvent.ofWorkflow("workflow.started", ACTOR, dagId, null, "ok",
                    Map.of("executionId", run.executionId, "order", run.executionOrder)));
            pumpLocked(run);
            return WorkflowOutcome.accepted(dagId, run.status);
        }
    }

    public boolean pauseWorkflow(String dagId) {
        return transition(dagId, DagStatus.RUNNING, DagStatus.PAUSED, "workflow.paused");
    }

    public boolean resumeWorkflow(String dagId) {
        return transition(dagId, DagStatus.PAUSED, DagStatus.RUNNING, "workflow.resumed");
    }

    /**
     * Stops new dispatches and marks pending and running nodes skipped. Attempts already handed
     * to an agent are not interrupted; their results are discarded.
     */
    public boolean cancelWorkflow(String dagId) {
        return cancel(dagId, null);
    }

    public WorkflowStatus getWorkflowStatus(String dagId) {
        DagRun run = dagId == null ? null : runs.get(dagId);
        if (run == null) {
            return WorkflowStatus.unknown(dagId);
        }
        synchronized (run) {
            return view(run);
        }
    }

    public List<WorkflowStatus> listWorkflows() {
        List<WorkflowStatus> out = new ArrayList<>();
        for (DagRun run : runs.values()) {
            synchronized (run) {
                out.add(view(run));
            }
        }
        return List.copyOf(out);
    }

    /**
     * Looks up a scheduled task first, then a DAG node addressed as {@code dagId:nodeId} or by
     * bare node id.
     */
    public TaskState getTaskStatus(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return TaskState.unknown(taskId);
        }
        Optional<TaskState> scheduled = scheduler.getTask(taskId);
        if (scheduled.isPresent()) {
            return scheduled.get();
        }
        int separator = taskId.indexOf(':');
        if (separator > 0) {
            DagRun run = runs.get(taskId.substring(0, separator));
            TaskState state = run == null ? null : nodeTaskState(run, taskId.substring(separator + 1));
            if (state != null) {
                return state;
            }
        }
        for (DagRun run : runs.values()) {
            TaskState state = nodeTaskState(run, taskId);
            if (state != null) {
                return state;
            }
        }
        return TaskState.unknown(taskId);
    }

    /**
     * Blocks until the run is terminal or {@code timeout} elapses, then returns its status.
     */
    public WorkflowStatus awaitTermination(String dagId, Duration timeout) {
        DagRun run = dagId == null ? null : runs.get(dagId);
        if (run == null) {
            return WorkflowStatus.unknown(dagId);
        }
        try {
            run.termination.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return getWorkflowStatus(dagId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return getWorkflowStatus(dagId);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Workflow termination failed: " + dagId, e.getCause());
        }
        return getWorkflowStatus(dagId);
    }

    /**
     * Creates, starts and awaits a DAG. A run still active when {@code timeout} elapses is
     * cancelled.
     */
    public WorkflowStatus orchestrateDag(DagSpec spec, Duration timeout) {
        WorkflowOutcome created = createDAG(spec);
        if (!created.success()) {
            return WorkflowStatus.rejected(created.workflowId(), created.errors());
        }
        WorkflowOutcome started = startWorkflow(created.workflowId());
        if (!started.success()) {
            return getWorkflowStatus(created.workflowId());
        }
        WorkflowStatus status = awaitTermination(created.workflowId(), timeout);
        if (!status.terminal()) {
            cancel(created.workflowId(), "Workflow timed out after " + timeout.toMillis() + "ms");
            status = getWorkflowStatus(created.workflowId());
        }
        return status;
    }

    /**
     * Drops terminal runs that finished more than {@code retention} ago.
     */
    public int purgeTerminal(Duration retention) {
        Instant cutoff = Instant.now().minus(retention);
        int purged = 0;
        synchronized (structureLock) {
            for (DagRun run : new ArrayList<>(runs.values())) {
                boolean expired;
                synchronized (run) {
                    expired = run.status.terminal() && run.completedAt != null && run.completedAt.isBefore(cutoff);
                }
                if (expired && runs.remove(run.dagId, run)) {
                    purged++;
                }
            }
        }
        if (purged > 0) {
            audit.log(AuditLogger.AuditEvent.of("dag.purged", ACTOR, "workflow/*", "ok",
                    Map.of("purged", purged, "retentionMs", retention.toMillis())));
        }
        return purged;
    }

    public EngineMetrics getSystemMetrics() {
        int active = 0;
        int completed = 0;
        int failed = 0;
        int cancelled = 0;
        List<DagRun> all = new ArrayList<>(runs.values());
        for (DagRun run : all) {
            DagStatus status;
            synchronized (run) {
                status = run.status;
            }
            switch (status) {
                case RUNNING, PAUSED, VALIDATING -> active++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
                default -> {
                }
            }
        }
        long ok = attemptsSucceeded.get();
        long bad = attemptsFailed.get();
        long executed = ok + bad;
        double successRate = executed == 0 ? 1.0 : (double) ok / executed;
        double averageMs = executed == 0 ? 0.0 : (double) attemptDurationMs.get() / executed;
        return new EngineMetrics(all.size(), active, completed, failed, cancelled, executed, ok, bad,
                successRate, averageMs, throughputLastMinute());
    }

    public List<DagRunSnapshot> exportRuns() {
        List<DagRunSnapshot> out = new ArrayList<>();
        for (DagRun run : runs.values()) {
            synchronized (run) {
                List<NodeState> nodes = new ArrayList<>(run.nodes.size());
                for (DagRun.NodeRun node : run.nodes.values()) {
                    nodes.add(nodeState(node));
                }
                out.add(new DagRunSnapshot(run.dagId, run.spec, run.status, nodes, run.failureCount,
                        run.thresholdBreached, run.compensated, run.errors, run.executionId, run.createdAt,
                        run.startedAt, run.completedAt));
            }
        }
        return List.copyOf(out);
    }

    /**
     * Replaces every run in one step. Runs that were active come back {@code paused} with their
     * running nodes reset to pending, since no in-flight attempt survives a restore.
     */
    public void restoreRuns(List<DagRunSnapshot> snapshots) {
        Map<String, DagRun> next = new ConcurrentHashMap<>();
        for (DagRunSnapshot snapshot : snapshots) {
            next.put(snapshot.dagId(), rebuild(snapshot));
        }
        Map<String, DagRun> previous;
        synchronized (structureLock) {
            previous = runs;
            runs = next;
        }
        for (DagRun old : previous.values()) {
            synchronized (old) {
                old.detached = true;
                old.termination.complete(old.status);
            }
        }
    }

    private DagRun rebuild(DagRunSnapshot snapshot) {
        DagRun run = new DagRun(snapshot.spec());
        run.failureCount = snapshot.failureCount();
        run.thresholdBreached = snapshot.thresholdBreached();
        run.compensated = snapshot.compensated();
        run.errors.addAll(snapshot.errors());
        run.executionId = snapshot.executionId();
        run.createdAt = snapshot.createdAt();
        run.startedAt = snapshot.startedAt();
        run.completedAt = snapshot.completedAt();
        for (NodeState state : snapshot.nodes()) {
            DagRun.NodeRun node = run.nodes.get(state.nodeId());
            if (node == null) {
                continue;
            }
            node.status = state.status() == NodeStatus.RUNNING ? NodeStatus.PENDING : state.status();
            node.attempts = state.attempts();
            node.lastError = state.lastError();
            node.output = Jsons.copy(state.output());
            node.startedAt = state.startedAt();
            node.finishedAt = state.finishedAt();
        }
        DagStatus status = snapshot.status();
        if (status == DagStatus.RUNNING || status == DagStatus.VALIDATING) {
            status = DagStatus.PAUSED;
        }
        run.status = status;
        if (status == DagStatus.PAUSED) {
            run.executionOrder = DependencyResolver.computeExecutionOrder(run.spec);
            run.indexDependents();
        }
        if (status.terminal()) {
            run.termination.complete(status);
        }
        return run;
    }

    private boolean transition(String dagId, DagStatus from, DagStatus to, String action) {
        DagRun run = dagId == null ? null : runs.get(dagId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            if (run.status != from || run.detached) {
                return false;
            }
            run.status = to;
            audit.log(AuditLogger.AuditEvent.ofWorkflow(action, ACTOR, dagId, null, "ok", Map.of()));
            if (to == DagStatus.RUNNING) {
                pumpLocked(run);
            }
            return true;
        }
    }

    private boolean cancel(String dagId, String reason) {
        DagRun run = dagId == null ? null : runs.get(dagId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            if ((run.status != DagStatus.RUNNING && run.status != DagStatus.PAUSED) || run.detached) {
                return false;
            }
            if (reason != null) {
                run.errors.add(reason);
            }
            haltLocked(run, DagStatus.CANCELLED, reason == null ? "Workflow cancelled" : reason);
            return true;
        }
    }

    private void pumpLocked(DagRun run) {
        if (run.detached || run.status != DagStatus.RUNNING) {
            return;
        }
        int limit = Math.max(1, run.spec.executionPolicy().maxConcurrency());
        boolean progressed = true;
        while (progressed && run.status == DagStatus.RUNNING) {
            progressed = false;
            for (String nodeId : run.executionOrder) {
                DagRun.NodeRun node = run.nodes.get(nodeId);
                if (node.status != NodeStatus.PENDING || node.waitingRetry || !dependenciesSucceeded(run, node)) {
                    continue;
                }
                if (!node.node.dispatchable()) {
                    // decision and merge nodes only join their branches
                    Instant now = Instant.now();
                    node.status = NodeStatus.SUCCEEDED;
                    node.attempts = 1;
                    node.startedAt = now;
                    node.finishedAt = now;
                    progressed = true;
                    continue;
                }
                if (run.inFlight < limit) {
                    dispatchLocked(run, node);
                }
            }
        }
        maybeCompleteLocked(run);
    }

    private static boolean dependenciesSucceeded(DagRun run, DagRun.NodeRun node) {
        for (String dep : node.node.dependencies()) {
            if (run.nodes.get(dep).status != NodeStatus.SUCCEEDED) {
                return false;
            }
        }
        return true;
    }

    private void dispatchLocked(DagRun run, DagRun.NodeRun node) {
        node.status = NodeStatus.RUNNING;
        node.attempts++;
        if (node.startedAt == null) {
            node.startedAt = Instant.now();
        }
        run.inFlight++;
        int attempt = node.attempts;
        Node definition = node.node;
        String agentId = definition.agentId() == null || definition.agentId().isBlank()
                ? config.settings().defaultAgentId()
                : definition.agentId();
        long timeout = definition.timeout() != null ? definition.timeout() : run.spec.executionPolicy().timeout();
        DispatchRequest request = new DispatchRequest(run.dagId, definition.id(), agentId, definition.action(),
                definition.parameters(), attempt, timeout > 0 ? timeout : null);
        long startedNanos = System.nanoTime();
        CompletableFuture<DispatchResult> future;
        try {
            CompletableFuture<DispatchResult> dispatched = dispatcher.dispatch(request);
            future = dispatched == null
                    ? CompletableFuture.failedFuture(new IllegalStateException("Dispatcher returned no result"))
                    : dispatched.copy();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (timeout > 0) {
            future = future.orTimeout(timeout, TimeUnit.MILLISECONDS);
        }
        future.whenCompleteAsync(
                (result, error) -> onAttemptFinished(run, node, attempt, result, error, timeout, startedNanos),
                executor
        );
    }

    private void onAttemptFinished(
            DagRun run,
            DagRun.NodeRun node,
            int attempt,
            DispatchResult result,
            Throwable error,
            long timeout,
            long startedNanos
    ) {
        String failure = describeFailure(result, error, timeout);
        recordAttempt(failure == null, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos));
        synchronized (run) {
            if (run.detached || node.status != NodeStatus.RUNNING || node.attempts != attempt) {
                return;
            }
            run.inFlight--;
            String nodeId = node.node.id();
            if (failure == null) {
                node.status = NodeStatus.SUCCEEDED;
                node.output = Jsons.copy(result.output());
                node.lastError = null;
                node.finishedAt = Instant.now();
                audit.log(AuditLogger.AuditEvent.ofWorkflow("node.succeeded", ACTOR, run.dagId, nodeId, "ok",
                        Map.of("attempt", attempt)));
            } else {
                node.lastError = failure;
                RetryPolicy policy = retryPolicyFor(run, node.node);
                if (policy.allowsRetryAfter(attempt)) {
                    scheduleRetryLocked(run, node, attempt, policy.delayAfter(attempt), failure);
                } else {
                    failNodeLocked(run, node, failure);
                }
            }
            pumpLocked(run);
        }
    }

    private void scheduleRetryLocked(DagRun run, DagRun.NodeRun node, int attempt, long delayMs, String failure) {
        node.status = NodeStatus.PENDING;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt", attempt);
        details.put("delayMs", delayMs);
        details.put("error", failure);
        audit.log(AuditLogger.AuditEvent.ofWorkflow("node.retry", ACTOR, run.dagId, node.node.id(), "retry", details));
        if (delayMs <= 0) {
            return;
        }
        node.waitingRetry = true;
        CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, executor).execute(() -> {
            synchronized (run) {
                if (node.waitingRetry && node.attempts == attempt) {
                    node.waitingRetry = false;
                    pumpLocked(run);
                }
            }
        });
    }

    private void failNodeLocked(DagRun run, DagRun.NodeRun node, String failure) {
        node.status = NodeStatus.FAILED;
        node.finishedAt = Instant.now();
        run.failureCount++;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempts", node.attempts);
        details.put("error", failure);
        details.put("failureCount", run.failureCount);
        audit.log(AuditLogger.AuditEvent.ofWorkflow("node.failed", ACTOR, run.dagId, node.node.id(), "failed", details));
        skipDependentsLocked(run, node.node.id());
        int threshold = run.spec.executionPolicy().failureThreshold();
        if (run.failureCount > threshold && !run.thresholdBreached) {
            run.thresholdBreached = true;
            String reason = "Failure threshold exceeded: " + run.failureCount + " failed node(s), threshold " + threshold;
            run.errors.add(reason);
            applyFailureStrategyLocked(run, reason);
        }
    }

    private void skipDependentsLocked(DagRun run, String failedNodeId) {
        Deque<String> frontier = new ArrayDeque<>(run.dependents.getOrDefault(failedNodeId, List.of()));
        Set<String> seen = new HashSet<>();
        while (!frontier.isEmpty()) {
            String nodeId = frontier.poll();
            if (!seen.add(nodeId)) {
                continue;
            }
            DagRun.NodeRun dependent = run.nodes.get(nodeId);
            if (dependent.status == NodeStatus.PENDING) {
                dependent.status = NodeStatus.SKIPPED;
                dependent.waitingRetry = false;
                dependent.lastError = "Upstream node failed: " + failedNodeId;
                dependent.finishedAt = Instant.now();
                audit.log(AuditLogger.AuditEvent.ofWorkflow("node.skipped", ACTOR, run.dagId, nodeId, "skipped",
                        Map.of("upstream", failedNodeId)));
            }
            frontier.addAll(run.dependents.getOrDefault(nodeId, List.of()));
        }
    }

    private void applyFailureStrategyLocked(DagRun run, String reason) {
        FailureStrategy strategy = run.spec.failureHandling().strategy();
        if (strategy == FailureStrategy.CONTINUE) {
            return;
        }
        if (strategy == FailureStrategy.COMPENSATE && !run.compensated) {
            run.compensated = true;
            List<String> compensationIds = scheduler.enqueueCompensation(run.dagId,
                    run.spec.failureHandling().compensationTasks());
            audit.log(AuditLogger.AuditEvent.ofWorkflow("workflow.compensating", ACTOR, run.dagId, null, "ok",
                    Map.of("compensationTasks", compensationIds)));
        }
        haltLocked(run, DagStatus.FAILED, reason);
    }

    private void haltLocked(DagRun run, DagStatus terminal, String reason) {
        Instant now = Instant.now();
        for (DagRun.NodeRun node : run.nodes.values()) {
            if (node.status == NodeStatus.PENDING || node.status == NodeStatus.RUNNING) {
                node.status = NodeStatus.SKIPPED;
                node.waitingRetry = false;
                node.lastError = reason;
                node.finishedAt = now;
            }
        }
        finishLocked(run, terminal);
    }

    private void maybeCompleteLocked(DagRun run) {
        if (run.status != DagStatus.RUNNING || run.inFlight > 0) {
            return;
        }
        for (DagRun.NodeRun node : run.nodes.values()) {
            if (!node.status.terminal()) {
                return;
            }
        }
        finishLocked(run, run.thresholdBreached ? DagStatus.FAILED : DagStatus.COMPLETED);
    }

    private void finishLocked(DagRun run, DagStatus terminal) {
        run.status = terminal;
        run.completedAt = Instant.now();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("failureCount", run.failureCount);
        details.put("errors", List.copyOf(run.errors));
        String action = switch (terminal) {
            case COMPLETED -> "workflow.completed";
            case CANCELLED -> "workflow.cancelled";
            default -> "workflow.failed";
        };
        audit.log(AuditLogger.AuditEvent.ofWorkflow(action, ACTOR, run.dagId, null, terminal.wireName(), details));
        run.termination.complete(terminal);
    }

    private RetryPolicy retryPolicyFor(DagRun run, Node node) {
        if (node.retryPolicy() != null) {
            return node.retryPolicy();
        }
        return config.defaultRetryPolicy(run.spec.executionPolicy().retryAttempts());
    }

    private static String describeFailure(DispatchResult result, Throwable error, long timeout) {
        if (error != null) {
            Throwable cause = error;
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof TimeoutException) {
                return "Node timed out after " + timeout + "ms";
            }
            return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        }
        if (result == null) {
            return "No dispatch result";
        }
        if (!result.success()) {
            return result.error() == null ? "Dispatch failed" : result.error();
        }
        return null;
    }

    private void recordAttempt(boolean success, long durationMs) {
        (success ? attemptsSucceeded : attemptsFailed).incrementAndGet();
        attemptDurationMs.addAndGet(durationMs);
        long now = System.currentTimeMillis();
        synchronized (recentNodeFinishes) {
            recentNodeFinishes.addLast(now);
            while (!recentNodeFinishes.isEmpty() && recentNodeFinishes.peekFirst() < now - THROUGHPUT_WINDOW_MS) {
                recentNodeFinishes.removeFirst();
            }
        }
    }

    private long throughputLastMinute() {
        long cutoff = System.currentTimeMillis() - THROUGHPUT_WINDOW_MS;
        synchronized (recentNodeFinishes) {
            while (!recentNodeFinishes.isEmpty() && recentNodeFinishes.peekFirst() < cutoff) {
                recentNodeFinishes.removeFirst();
            }
            return recentNodeFinishes.size();
        }
    }

    private static TaskState nodeTaskState(DagRun run, String nodeId) {
        synchronized (run) {
            DagRun.NodeRun node = run.nodes.get(nodeId);
            if (node == null) {
                return null;
            }
            return new TaskState(nodeId, run.dagId, node.status.wireName(), node.attempts, node.lastError,
                    node.output, node.startedAt, node.finishedAt);
        }
    }

    private static NodeState nodeState(DagRun.NodeRun node) {
        return new NodeState(node.node.id(), node.status, node.attempts, node.lastError, node.output,
                node.startedAt, node.finishedAt);
    }

    private static WorkflowStatus view(DagRun run) {
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int running = 0;
        Map<String, NodeState> nodes = new LinkedHashMap<>();
        for (DagRun.NodeRun node : run.nodes.values()) {
            switch (node.status) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                case RUNNING -> running++;
                default -> {
                }
            }
            nodes.put(node.node.id(), nodeState(node));
        }
        int total = run.nodes.size();
        int done = succeeded + failed + skipped;
        double progress;
        if (total == 0) {
            progress = run.status.terminal() ? 100.0 : 0.0;
        } else {
            progress = Math.round(done * 1000.0 / total) / 10.0;
        }
        Instant estimated = null;
        if (run.status == DagStatus.RUNNING && run.startedAt != null && done > 0 && done < total) {
            long elapsed = Duration.between(run.startedAt, Instant.now()).toMillis();
            estimated = Instant.now().plusMillis(elapsed / done * (total - done));
        } else if (run.status.terminal()) {
            estimated = run.completedAt;
        }
        return new WorkflowStatus(run.dagId, run.spec.name(), run.status.wireName(), progress, total, succeeded,
                failed, skipped, running, run.failureCount, run.createdAt, run.startedAt, run.completedAt,
                estimated, run.errors, nodes);
    }

    /**
     * Structured answer for create and start. {@code status} is the run status after the call, or
     * {@code unknown} when no run exists.
     */
    public record WorkflowOutcome(boolean success, String workflowId, String status, List<String> errors) {
        public WorkflowOutcome {
            errors = errors == null ? List.of() : List.copyOf(errors);
        }

        static WorkflowOutcome accepted(String workflowId, DagStatus status) {
            return new WorkflowOutcome(true, workflowId, status.wireName(), List.of());
        }

        static WorkflowOutcome rejected(String workflowId, String status, String error) {
            return new WorkflowOutcome(false, workflowId, status, List.of(error));
        }
    }

    public record NodeState(
            String nodeId,
            NodeStatus status,
            int attempts,
            String lastError,
            JsonNode output,
            Instant startedAt,
            Instant finishedAt
    ) {
        public NodeState {
            output = Jsons.copy(output);
        }

        @Override
        public JsonNode output() {
            return Jsons.copy(output);
        }
    }

    /**
     * @param progress            percentage of nodes in a terminal state
     * @param estimatedCompletion extrapolated from the average time per finished node while
     *                            running, the completion time once terminal
     */
    public record WorkflowStatus(
            String workflowId,
            String name,
            String status,
            double progress,
            int totalNodes,
            int completedNodes,
            int failedNodes,
            int skippedNodes,
            int runningNodes,
            int failureCount,
            Instant createdAt,
            Instant startedAt,
            Instant completedAt,
            Instant estimatedCompletion,
            List<String> errors,
            Map<String, NodeState> nodes
    ) {
        public WorkflowStatus {
            errors = errors == null ? List.of() : List.copyOf(errors);
            nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        }

        public static WorkflowStatus unknown(String workflowId) {
            return new WorkflowStatus(workflowId, null, TaskState.UNKNOWN, 0.0, 0, 0, 0, 0, 0, 0,
                    null, null, null, null, List.of(), Map.of());
        }

        static WorkflowStatus rejected(String workflowId, List<String> errors) {
            return new WorkflowStatus(workflowId, null, DagStatus.FAILED.wireName(), 0.0, 0, 0, 0, 0, 0, 0,
                    null, null, null, null, errors, Map.of());
        }

        public boolean known() {
            return !TaskState.UNKNOWN.equals(status);
        }

        public boolean terminal() {
            return DagStatus.COMPLETED.wireName().equals(status)
                    || DagStatus.CANCELLED.wireName().equals(status)
                    || DagStatus.FAILED.wireName().equals(status);
        }

        public NodeStatus nodeStatus(String nodeId) {
            NodeState state = nodes.get(nodeId);
            return state == null ? null : state.status();
        }
    }

    /**
     * @param tasksExecuted       finished node attempts, successful or not
     * @param throughputPerMinute node attempts finished during the last minute
     */
    public record EngineMetrics(
            int totalWorkflows,
            int activeWorkflows,
            int completedWorkflows,
            int failedWorkflows,
            int cancelledWorkflows,
            long tasksExecuted,
            long tasksSucceeded,
            long tasksFailed,
            double successRate,
            double averageExecutionMs,
            long throughputPerMinute
    ) {
    }

    public record DagRunSnapshot(
            String dagId,
            DagSpec spec,
            DagStatus status,
            List<NodeState> nodes,
            int failureCount,
            boolean thresholdBreached,
            boolean compensated,
            List<String> errors,
            String executionId,
            Instant createdAt,
            Instant startedAt,
            Instant completedAt
    ) {
        public DagRunSnapshot {
            nodes = nodes == null ? List.of() : List.copyOf(nodes);
            errors = errors == null ? List.of() : List.copyOf(errors);
        }
    }
}
