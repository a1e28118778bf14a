package io.dagmesh.mesh;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dagmesh.agent.Agent;
import io.dagmesh.agent.AgentLifecycle;
import io.dagmesh.agent.AgentRegistry;
import io.dagmesh.agent.AgentSpecification;
import io.dagmesh.agent.AgentState;
import io.dagmesh.agent.AgentStatus;
import io.dagmesh.agent.DesignArtifact;
import io.dagmesh.agent.UserInteraction;
import io.dagmesh.config.MeshConfig;
import io.dagmesh.engine.WorkflowEngine;
import io.dagmesh.engine.WorkflowEngineAgent;
import io.dagmesh.model.ValidationResult;
import io.dagmesh.observability.AuditLogger;
import io.dagmesh.observability.PrometheusFormatter;
import io.dagmesh.routing.AgentInteraction;
import io.dagmesh.routing.BroadcastResult;
import io.dagmesh.routing.BroadcastScope;
import io.dagmesh.routing.EventRouter;
import io.dagmesh.routing.RouterStats;
import io.dagmesh.routing.RoutingResult;
import io.dagmesh.scheduler.TaskScheduler;
import io.dagmesh.util.Ids;
import io.dagmesh.util.Jsons;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One coordination domain: agent registry, event router, workflow engine, task scheduler,
 * mesh orchestrator and snapshots, all owned by this instance and torn down by {@link #shutdown()}.
 *
 * <p>The mesh is itself an {@link Agent}; it answers {@code integrity.validate} and
 * {@code snapshot.create} events.
 */
public final class AgentMesh implements Agent, AutoCloseable {
    public static final String MESH_ID = "agent-mesh";
    public static final String ROLE = "Mesh Coordinator";
    private static final int MAX_ERRORS = 100;

    private final AuditLogger audit;
    private final ExecutorService executor;
    private final AgentRegistry registry;
    private final EventRouter router;
    private final TaskScheduler scheduler;
    private final WorkflowEngine engine;
    private final MeshOrchestrator orchestrator;
    private final SnapshotManager snapshots;
    private final AgentState state = new AgentState();
    private final AtomicBoolean initialized = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private final AtomicReference<String> lastEvent = new AtomicReference<>();
    private final List<String> errors = new ArrayList<>();
    private volatile MeshConfig config;

    public AgentMesh(MeshConfig config) {
        this.config = config;
        MeshConfig.Settings settings = config.settings();
        this.audit = new AuditLogger(config.auditFile(), config.namespace(), settings.maxEventHistory(),
                settings.tracingEnabled());
        this.executor = Executors.newCachedThreadPool(daemonThreads());
        this.registry = new AgentRegistry();
        this.router = new EventRouter(registry, audit, executor, settings.eventTimeoutMs(), settings.maxInteractions());
        RoutedActionDispatcher dispatcher = new RoutedActionDispatcher(router);
        this.scheduler = new TaskScheduler(config, dispatcher, audit);
        this.engine = new WorkflowEngine(config, dispatcher, scheduler, audit, executor);
        this.orchestrator = new MeshOrchestrator(registry, engine, audit, () -> this.config);
        this.snapshots = new SnapshotManager(registry, router, engine, scheduler, audit);
    }

    public static AgentMesh inMemory() {
        return new AgentMesh(MeshConfig.inMemory());
    }

    @Override
    public String id() {
        return MESH_ID;
    }

    @Override
    public String role() {
        return ROLE;
    }

    /**
     * Registers the workflow engine agent under the configured default agent id and initializes
     * every registered agent. Idempotent.
     */
    @Override
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        String engineAgentId = config.settings().defaultAgentId();
        if (!registry.contains(engineAgentId)) {
            registerAgent(new WorkflowEngineAgent(engineAgentId, engine));
        }
        for (Agent agent : registry.all().values()) {
            initializeAgent(agent);
        }
        state.ready();
        audit.log(AuditLogger.AuditEvent.of("mesh.initialized", MESH_ID, "mesh/" + config.namespace(), "ok",
                Map.of("agents", registry.size())));
    }

    /**
     * Shuts every agent down and stops the worker pool. Idempotent; status stays queryable.
     */
    @Override
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        for (Agent agent : registry.all().values()) {
            try {
                agent.shutdown();
            } catch (RuntimeException e) {
                recordError("Agent " + agent.id() + " failed to shut down: " + e.getMessage());
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        state.ready();
        audit.log(AuditLogger.AuditEvent.of("mesh.shutdown", MESH_ID, "mesh/" + config.namespace(), "ok",
                Map.of("agents", registry.size())));
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        return stopped.get();
    }

    @Override
    public AgentStatus getStatus() {
        MeshStatus status = meshStatus();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("agentCount", status.agentCount());
        details.put("activeWorkflows", status.activeWorkflows());
        details.put("shutdown", status.shutdown());
        details.put("errors", status.errors());
        return state.snapshot(details);
    }

    public MeshStatus meshStatus() {
        List<String> currentErrors;
        synchronized (errors) {
            currentErrors = List.copyOf(errors);
        }
        return new MeshStatus(state.lifecycle(), state.uptimeMs(), registry.size(),
                engine.getSystemMetrics().activeWorkflows(), lastEvent.get(), stopped.get(), currentErrors);
    }

    public boolean registerAgent(Agent agent) {
        boolean added = registry.register(agent);
        if (!added) {
            return false;
        }
        List<String> roleInterests = config.settings().roleSubscriptions().get(agent.role());
        if (roleInterests != null) {
            router.subscribeToEvents(agent.id(), roleInterests);
        }
        audit.log(AuditLogger.AuditEvent.of("agent.registered", MESH_ID, "agent/" + agent.id(), "ok",
                Map.of("role", String.valueOf(agent.role()))));
        if (initialized.get() && !stopped.get()) {
            initializeAgent(agent);
        }
        return true;
    }

    public boolean unregisterAgent(String agentId) {
        boolean removed = registry.unregister(agentId);
        if (removed) {
            router.unsubscribeFromEvents(agentId, null);
            audit.log(AuditLogger.AuditEvent.of("agent.unregistered", MESH_ID, "agent/" + agentId, "ok", Map.of()));
        }
        return removed;
    }

    public Agent getAgent(String agentId) {
        return registry.get(agentId);
    }

    public Map<String, Agent> getAllAgents() {
        return registry.all();
    }

    public RoutingResult routeEvent(String eventType, JsonNode payload, String targetId) {
        lastEvent.set(eventType);
        return router.routeEvent(eventType, payload, targetId, MESH_ID);
    }

    public RoutingResult routeEvent(String eventType, JsonNode payload, String targetId, String sourceId) {
        lastEvent.set(eventType);
        return router.routeEvent(eventType, payload, targetId, sourceId);
    }

    public BroadcastResult broadcastEvent(String eventType, JsonNode payload, String sourceId) {
        return broadcastEvent(eventType, payload, sourceId, BroadcastScope.EXCLUDE_SOURCE);
    }

    public BroadcastResult broadcastEvent(String eventType, JsonNode payload, String sourceId, BroadcastScope scope) {
        lastEvent.set(eventType);
        return router.broadcastEvent(eventType, payload, sourceId, scope);
    }

    public void subscribeToEvents(String agentId, Collection<String> eventTypes) {
        router.subscribeToEvents(agentId, eventTypes);
    }

    public void unsubscribeFromEvents(String agentId, Collection<String> eventTypes) {
        router.unsubscribeFromEvents(agentId, eventTypes);
    }

    public MeshOrchestrator.OrchestrationResult orchestrateWorkflow(MeshWorkflow workflow) {
        return orchestrator.orchestrateWorkflow(workflow);
    }

    public SystemSnapshot createSystemSnapshot() {
        return snapshots.createSystemSnapshot();
    }

    public SnapshotManager.RestoreResult restoreSystemSnapshot(String snapshotId) {
        return snapshots.restoreSystemSnapshot(snapshotId);
    }

    public WorkflowEngine engine() {
        return engine;
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    public EventRouter router() {
        return router;
    }

    public AgentRegistry registry() {
        return registry;
    }

    public SnapshotManager snapshots() {
        return snapshots;
    }

    /**
     * Checks that every agent answers its status without error, that subscriptions only name
     * registered agents, and that the default executor agent is present.
     */
    public ValidationResult validateSystemIntegrity() {
        List<String> issues = new ArrayList<>();
        for (Map.Entry<String, Agent> e : registry.all().entrySet()) {
            Agent agent = e.getValue();
            if (!e.getKey().equals(agent.id())) {
                issues.add("Registry key " + e.getKey() + " does not match agent id " + agent.id());
            }
            try {
                if (agent.getStatus().status() == AgentLifecycle.ERROR) {
                    issues.add("Agent " + agent.id() + " reports error status");
                }
            } catch (RuntimeException ex) {
                issues.add("Agent " + agent.id() + " status check failed: " + ex.getMessage());
            }
        }
        for (String agentId : router.subscriptionTable().keySet()) {
            if (!registry.contains(agentId)) {
                issues.add("Subscriptions reference unregistered agent " + agentId);
            }
        }
        if (initialized.get() && !registry.contains(config.settings().defaultAgentId())) {
            issues.add("Default agent " + config.settings().defaultAgentId() + " is not registered");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", "system_integrity");
        details.put("agents", registry.size());
        details.put("issues", issues);
        details.put("auditHash", audit.currentHash());
        ValidationResult result = issues.isEmpty()
                ? ValidationResult.ok("System integrity validation passed", details)
                : new ValidationResult(false, false, "System integrity issues: " + String.join("; ", issues), details);
        audit.log(AuditLogger.AuditEvent.of("integrity.validated", MESH_ID, "mesh/" + config.namespace(),
                result.result() ? "ok" : "failed", Map.of("issues", issues.size())));
        return result;
    }

    public MeshMetrics getSystemMetrics() {
        WorkflowEngine.EngineMetrics workflows = engine.getSystemMetrics();
        RouterStats routing = router.stats();
        long events = routing.total();
        double errorRate = events == 0 ? 0.0 : (double) routing.failed() / events;
        return new MeshMetrics(registry.size(), state.uptimeMs(), workflows, routing, scheduler.stats(),
                1.0 - errorRate, errorRate);
    }

    public List<AuditLogger.AuditRecord> getEventHistory(int limit) {
        return audit.recent(limit);
    }

    public List<AgentInteraction> getAgentInteractions(String agentId) {
        return router.getAgentInteractions(agentId);
    }

    public MeshConfig.Settings getConfiguration() {
        return config.settings();
    }

    public ValidationResult validateConfiguration(MeshConfig.Settings settings) {
        if (settings == null) {
            return ValidationResult.fail("Configuration is missing");
        }
        return settings.validate();
    }

    /**
     * Applies new settings to every component after validating them. Invalid settings leave the
     * running configuration untouched.
     */
    public ValidationResult updateConfiguration(MeshConfig.Settings settings) {
        ValidationResult validation = validateConfiguration(settings);
        if (!validation.result()) {
            return validation;
        }
        MeshConfig next = config.withSettings(settings);
        config = next;
        MeshConfig.Settings applied = next.settings();
        router.reconfigure(applied.eventTimeoutMs(), applied.maxInteractions());
        scheduler.reconfigure(next);
        engine.reconfigure(next);
        audit.reconfigure(applied.maxEventHistory(), applied.tracingEnabled());
        audit.log(AuditLogger.AuditEvent.of("config.updated", MESH_ID, "mesh/" + config.namespace(), "ok",
                Map.of("maxConcurrency", applied.maxConcurrency(), "eventTimeoutMs", applied.eventTimeoutMs())));
        return validation;
    }

    public String metricsText() {
        return PrometheusFormatter.format(getSystemMetrics(), config.namespace());
    }

    @Override
    public void handleEvent(String eventType, JsonNode payload) {
        state.recordEvent(eventType);
        lastEvent.set(eventType);
        if ("integrity.validate".equals(eventType)) {
            validateSystemIntegrity();
        } else if ("snapshot.create".equals(eventType)) {
            createSystemSnapshot();
        }
    }

    /**
     * Passes when every declared dependency is a registered agent.
     */
    @Override
    public ValidationResult validateSpecification(AgentSpecification spec) {
        if (spec == null) {
            return ValidationResult.fail("Specification is missing");
        }
        List<String> missing = new ArrayList<>();
        for (String dependency : spec.dependencies()) {
            if (!registry.contains(dependency)) {
                missing.add(dependency);
            }
        }
        if (!missing.isEmpty()) {
            return ValidationResult.fail("Unregistered dependencies: " + String.join(", ", missing),
                    "dependency_validation", Map.of("missing", missing));
        }
        return ValidationResult.ok("Mesh specification validation passed",
                Map.of("type", "mesh_validation", "agents", registry.size()));
    }

    @Override
    public List<DesignArtifact> generateDesignArtifacts() {
        ObjectNode topology = Jsons.object();
        ObjectNode agents = topology.putObject("agents");
        for (AgentRegistry.Entry entry : registry.entries()) {
            agents.put(entry.id(), entry.roleLabel());
        }
        topology.set("subscriptions", Jsons.valueToTree(router.subscriptionTable()));
        return List.of(new DesignArtifact(Ids.newId("art"), "mesh-topology", topology, "1.0.0", Instant.now(),
                List.of(MESH_ID)));
    }

    @Override
    public void trackUserInteraction(UserInteraction interaction) {
        if (interaction == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("userId", interaction.userId());
        details.put("sessionId", interaction.sessionId());
        details.put("outcome", interaction.outcome());
        audit.log(AuditLogger.AuditEvent.of("user.interaction", MESH_ID, "interaction/" + interaction.id(),
                String.valueOf(interaction.action()), details));
    }

    private void initializeAgent(Agent agent) {
        try {
            agent.initialize();
        } catch (RuntimeException e) {
            recordError("Agent " + agent.id() + " failed to initialize: " + e.getMessage());
        }
    }

    private void recordError(String message) {
        synchronized (errors) {
            errors.add(message);
            while (errors.size() > MAX_ERRORS) {
                errors.remove(0);
            }
        }
        audit.log(AuditLogger.AuditEvent.of("mesh.error", MESH_ID, "mesh/" + config.namespace(), "failed",
                Map.of("error", message)));
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "dagmesh-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record MeshStatus(
            AgentLifecycle status,
            long uptimeMs,
            int agentCount,
            int activeWorkflows,
            String lastEvent,
            boolean shutdown,
            List<String> errors
    ) {
    }

    public record MeshMetrics(
            int agents,
            long uptimeMs,
            WorkflowEngine.EngineMetrics workflows,
            RouterStats routing,
            TaskScheduler.SchedulerStats tasks,
            double successRate,
            double errorRate
    ) {
    }
}
