package io.fleetmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public final class FleetMeshConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE_NAME = "fleetmesh-settings.json";
    public static final long DEFAULT_PAYLOAD_MAX_BYTES = 1024L * 1024L;
    public static final String DEFAULT_INGEST_HOST = "0.0.0.0";
    public static final int DEFAULT_INGEST_PORT = 8449;
    public static final int DEFAULT_ADMIN_PORT = 8448;
    public static final int DEFAULT_BACKGROUND_WORKERS = 4;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_SWEEP_BATCH_SIZE = 100;
    public static final long DEFAULT_COMMAND_TTL_MS = 24L * 60L * 60L * 1000L;
    public static final long DEFAULT_STALE_RUNNING_MS = 10L * 60L * 1000L;
    public static final int DEFAULT_BCRYPT_STRENGTH = 10;

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public FleetMeshConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static FleetMeshConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static FleetMeshConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new FleetMeshConfig(scoped, base, safeNamespace);
    }

    static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path dbFile() {
        return rootDir.resolve("fleetmesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path installerRoot() {
        return rootDir.resolve("installer");
    }
}
