package io.fleetmesh;

import io.fleetmesh.cli.FleetMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new FleetMeshCommand()).execute(args);
        System.exit(code);
    }
}
