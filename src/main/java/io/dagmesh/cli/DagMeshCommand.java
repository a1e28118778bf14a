package io.dagmesh.cli;

import io.dagmesh.agent.AgentRegistry;
import io.dagmesh.agent.EchoAgent;
import io.dagmesh.agent.FailAgent;
import io.dagmesh.config.MeshConfig;
import io.dagmesh.engine.DagStatus;
import io.dagmesh.engine.WorkflowEngine;
import io.dagmesh.graph.DagSpec;
import io.dagmesh.graph.DependencyResolution;
import io.dagmesh.graph.DependencyResolver;
import io.dagmesh.mesh.AgentMesh;
import io.dagmesh.mesh.MeshOrchestrator;
import io.dagmesh.mesh.MeshWorkflow;
import io.dagmesh.model.ValidationResult;
import io.dagmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "dagmesh",
        mixinStandardHelpOptions = true,
        description = "DagMesh DAG workflow and agent mesh CLI",
        subcommands = {
                DagMeshCommand.ValidateCommand.class,
                DagMeshCommand.OrderCommand.class,
                DagMeshCommand.ResolveCommand.class,
                DagMeshCommand.RunDagCommand.class,
                DagMeshCommand.OrchestrateCommand.class,
                DagMeshCommand.AgentsCommand.class,
                DagMeshCommand.MetricsCommand.class
        }
)
public final class DagMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory for settings, audit log and snapshots; in-memory when omitted")
    String root;

    @Option(names = {"--namespace"}, description = "Mesh namespace", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: validate | order | resolve | run-dag | orchestrate | agents | metrics");
    }

    MeshConfig config() {
        if (root == null || root.isBlank()) {
            return MeshConfig.inMemory();
        }
        return MeshConfig.fromRoot(root, namespace);
    }

    /**
     * Builds an initialized mesh with the built-in echo and fail agents registered next to the
     * engine agent.
     */
    AgentMesh mesh() {
        AgentMesh mesh = new AgentMesh(config());
        mesh.registerAgent(new EchoAgent());
        mesh.registerAgent(new FailAgent());
        mesh.initialize();
        return mesh;
    }

    static DagSpec readDag(String file) {
        return Jsons.read(Path.of(file), DagSpec.class);
    }

    @Command(name = "validate", description = "Validate a DAG spec JSON file")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        DagMeshCommand parent;

        @Option(names = {"--file"}, required = true, description = "DAG spec JSON file path")
        String file;

        @Override
        public Integer call() {
            ValidationResult result = DependencyResolver.validate(readDag(file));
            System.out.println(Jsons.toJson(result));
            return result.result() ? 0 : 1;
        }
    }

    @Command(name = "order", description = "Print the execution order of a DAG spec")
    static final class OrderCommand implements Callable<Integer> {
        @ParentCommand
        DagMeshCommand parent;

        @Option(names = {"--file"}, required = true, description = "DAG spec JSON file path")
        String file;

        @Override
        public Integer call() {
            DagSpec spec = readDag(file);
            ValidationResult validation = DependencyResolver.validate(spec);
            if (!validation.result()) {
                System.out.println(Jsons.toJson(validation));
                return 1;
            }
            System.out.println(Jsons.toJson(DependencyResolver.computeExecutionOrder(spec)));
            return 0;
        }
    }

    @Command(name = "resolve", description = "Resolve a flat precedence list of dependency ids")
    static final class ResolveCommand implements Callable<Integer> {
        @ParentCommand
        DagMeshCommand parent;

        @Parameters(arity = "0..*", description = "Dependency ids in precedence order")
        List<String> dependencies = new ArrayList<>();

        @Override
        public Integer call() {
            DependencyResolution resolution = DependencyResolver.resolveDependencies(dependencies);
            System.out.println(Jsons.toJson(resolution));
            return resolution.success() ? 0 : 1;
        }
    }

    @Command(name = "run-dag", description = "Create, start and await a DAG from a spec JSON file")
    static final class RunDagCommand implements Callable<Integer> {
        @ParentCommand
        DagMeshCommand parent;

        @Option(names = {"--file"}, required = true, description = "DAG spec JSON file path")
        String file;

        @Option(names = {"--timeout-ms"}, description = "Workflow timeout; the configured workflowTimeoutMs when omitted")
        Long timeoutMs;

        @Override
        public Integer call() {
            DagSpec spec = readDag(file);
            try (AgentMesh mesh = parent.mesh()) {
                long timeout = timeoutMs == null ? mesh.getConfiguration().workflowTimeoutMs() : timeoutMs;
                WorkflowEngine.WorkflowStatus status = mesh.engine().orchestrateDag(spec, Duration.ofMillis(timeout));
                System.out.println(Jsons.toJson(status));
                return DagStatus.COMPLETED.wireName().equals(status.status()) ? 0 : 1;
            }
        }
    }

    @Command(name = "orchestrate", description = "Orchestrate a mesh workflow JSON file across the built-in agents")
    static final class OrchestrateCommand implements Callable<Integer> {
        @ParentCommand
        DagMeshCommand parent;

        @Option(names = {"--file"}, required = true, description = "Mesh workflow JSON file path")
        String file;

        @Override
        public Integer call() {
            MeshWorkflow workflow = Jsons.read(Path.of(file), MeshWorkflow.class);
            try (AgentMesh mesh = parent.mesh()) {
                MeshOrchestrator.OrchestrationResult result = mesh.orchestrateWorkflow(workflow);
                System.out.println(Jsons.toJson(result));
                return result.success() ? 0 : 1;
            }
        }
    }

    @Command(name = "agents", description = "List the agents an initialized mesh carries")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        DagMeshCommand parent;

        @Override
        public Integer call() {
            try (AgentMesh mesh = parent.mesh()) {
                Map<String, String> roles = new LinkedHashMap<>();
                for (AgentRegistry.Entry entry : mesh.registry().entries()) {
                    roles.put(entry.id(), entry.roleLabel());
                }
                System.out.println(Jsons.toJson(roles));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print mesh metrics in Prometheus text format")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        DagMeshCommand parent;

        @Override
        public Integer call() {
            try (AgentMesh mesh = parent.mesh()) {
                System.out.print(mesh.metricsText());
                return 0;
            }
        }
    }
}
