package io.dagmesh.cli;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class DagMeshCommandTest {

    private static int run(String... args) {
        return new CommandLine(new DagMeshCommand()).execute(args);
    }

    @Test
    void validateAndOrderFollowTheSpecFile() throws Exception {
        Path root = Files.createTempDirectory("dagmesh-test-cli");
        try {
            Path good = root.resolve("good.json");
            Files.writeString(good, """
                    {"id": "build", "nodes": [
                      {"id": "compile"},
                      {"id": "test", "dependencies": ["compile"]}
                    ]}
                    """, StandardCharsets.UTF_8);
            Path cyclic = root.resolve("cyclic.json");
            Files.writeString(cyclic, """
                    {"id": "loop", "nodes": [
                      {"id": "a", "dependencies": ["b"]},
                      {"id": "b", "dependencies": ["a"]}
                    ]}
                    """, StandardCharsets.UTF_8);

            Assertions.assertEquals(0, run("validate", "--file", good.toString()));
            Assertions.assertEquals(0, run("order", "--file", good.toString()));
            Assertions.assertEquals(1, run("validate", "--file", cyclic.toString()));
            Assertions.assertEquals(1, run("order", "--file", cyclic.toString()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resolveRejectsRepeatedIds() {
        Assertions.assertEquals(0, run("resolve", "a", "b"));
        Assertions.assertEquals(1, run("resolve", "a", "b", "a"));
    }

    @Test
    void runDagExitCodeFollowsWorkflowOutcome() throws Exception {
        Path root = Files.createTempDirectory("dagmesh-test-cli");
        try {
            Path passing = root.resolve("passing.json");
            Files.writeString(passing, """
                    {"id": "ship", "nodes": [
                      {"id": "build"},
                      {"id": "announce", "agentId": "echo", "taskType": "release.announce", "dependencies": ["build"]}
                    ]}
                    """, StandardCharsets.UTF_8);
            Path failing = root.resolve("failing.json");
            Files.writeString(failing, """
                    {"id": "broken", "nodes": [{"id": "explode", "agentId": "fail"}]}
                    """, StandardCharsets.UTF_8);

            Assertions.assertEquals(0, run("run-dag", "--file", passing.toString(), "--timeout-ms", "5000"));
            Assertions.assertEquals(1, run("run-dag", "--file", failing.toString(), "--timeout-ms", "5000"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void orchestrateRunsMeshWorkflowFile() throws Exception {
        Path root = Files.createTempDirectory("dagmesh-test-cli");
        try {
            Path workflow = root.resolve("workflow.json");
            Files.writeString(workflow, """
                    {"id": "hello", "steps": [
                      {"id": "greet", "agentId": "echo", "action": "greeting.say"},
                      {"id": "store", "agentId": "echo", "action": "greeting.store", "dependencies": ["greet"]}
                    ]}
                    """, StandardCharsets.UTF_8);
            Path ghost = root.resolve("ghost.json");
            Files.writeString(ghost, """
                    {"id": "ghost", "steps": [{"id": "boo", "agentId": "ghost", "action": "haunt"}]}
                    """, StandardCharsets.UTF_8);

            Assertions.assertEquals(0, run("orchestrate", "--file", workflow.toString()));
            Assertions.assertEquals(1, run("orchestrate", "--file", ghost.toString()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void persistentRootWritesAuditLog() throws Exception {
        Path root = Files.createTempDirectory("dagmesh-test-cli");
        try {
            Assertions.assertEquals(0, run("--root", root.toString(), "--namespace", "cli", "agents"));
            Assertions.assertEquals(0, run("--root", root.toString(), "metrics"));
            try (Stream<Path> files = Files.walk(root)) {
                Assertions.assertTrue(files.anyMatch(p -> p.getFileName().toString().equals("audit.log")));
            }
        } finally {
            deleteRecursively(root);
        }
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
