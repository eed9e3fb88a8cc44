package io.fleetmesh.testing;

import io.fleetmesh.background.BackgroundPool;
import io.fleetmesh.config.FleetMeshConfig;
import io.fleetmesh.config.FleetMeshSettings;
import io.fleetmesh.runtime.FleetMeshRuntime;
import io.fleetmesh.security.AuthFilePrincipalDirectory;
import io.fleetmesh.security.PrincipalDirectory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

public final class Fixtures {
    private Fixtures() {
    }

    public static Path tempRoot(String name) throws IOException {
        return Files.createTempDirectory("fleetmesh-test-" + name + "-");
    }

    public static FleetMeshSettings fastSettings() {
        return FleetMeshSettings.defaults().withBcryptStrength(4);
    }

    /**
     * Initialized runtime over {@code root} with cheap bcrypt and a private pool.
     */
    public static FleetMeshRuntime runtime(Path root, Clock clock) {
        return runtime(root, clock, AuthFilePrincipalDirectory.empty());
    }

    public static FleetMeshRuntime runtime(Path root, Clock clock, PrincipalDirectory principals) {
        FleetMeshRuntime runtime = new FleetMeshRuntime(
                FleetMeshConfig.fromRoot(root.toString()),
                fastSettings(),
                principals,
                BackgroundPool.isolated(2, "fleetmesh-test-bg-"),
                clock
        );
        runtime.init();
        return runtime;
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }
}
