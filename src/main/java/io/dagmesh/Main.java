package io.dagmesh;

import io.dagmesh.cli.DagMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new DagMeshCommand()).execute(args);
        System.exit(code);
    }
}
