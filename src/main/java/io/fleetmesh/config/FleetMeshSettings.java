package io.fleetmesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fleetmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code fleetmesh-settings.json} under the data root.
 *
 * <p>Every field in the file is optional; missing or out-of-range values fall
 * back to the defaults in {@link FleetMeshConfig}.
 */
public record FleetMeshSettings(
        String ingestHost,
        int ingestPort,
        int adminPort,
        boolean embeddedIngest,
        int backgroundWorkers,
        long sweepIntervalMs,
        int sweepBatchSize,
        long commandTtlMs,
        long staleRunningMs,
        int bcryptStrength,
        String installerPath,
        String authFile
) {
    public static FleetMeshSettings defaults() {
        return new FleetMeshSettings(
                FleetMeshConfig.DEFAULT_INGEST_HOST,
                FleetMeshConfig.DEFAULT_INGEST_PORT,
                FleetMeshConfig.DEFAULT_ADMIN_PORT,
                true,
                FleetMeshConfig.DEFAULT_BACKGROUND_WORKERS,
                FleetMeshConfig.DEFAULT_SWEEP_INTERVAL_MS,
                FleetMeshConfig.DEFAULT_SWEEP_BATCH_SIZE,
                FleetMeshConfig.DEFAULT_COMMAND_TTL_MS,
                FleetMeshConfig.DEFAULT_STALE_RUNNING_MS,
                FleetMeshConfig.DEFAULT_BCRYPT_STRENGTH,
                "",
                ""
        );
    }

    public static FleetMeshSettings load(FleetMeshConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile body = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(body, defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    static FleetMeshSettings fromFile(SettingsFile file, FleetMeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new FleetMeshSettings(
                sanitizeText(file.ingestHost(), defaults.ingestHost()),
                sanitizePort(file.ingestPort(), defaults.ingestPort()),
                sanitizePort(file.adminPort(), defaults.adminPort()),
                file.embeddedIngest() == null ? defaults.embeddedIngest() : file.embeddedIngest(),
                sanitizeInt(file.backgroundWorkers(), defaults.backgroundWorkers(), 1),
                sanitizeLong(file.sweepIntervalMs(), defaults.sweepIntervalMs(), 1_000L),
                sanitizeInt(file.sweepBatchSize(), defaults.sweepBatchSize(), 1),
                sanitizeLong(file.commandTtlMs(), defaults.commandTtlMs(), 1_000L),
                sanitizeLong(file.staleRunningMs(), defaults.staleRunningMs(), 1_000L),
                Math.min(31, sanitizeInt(file.bcryptStrength(), defaults.bcryptStrength(), 4)),
                sanitizeText(file.installerPath(), defaults.installerPath()),
                sanitizeText(file.authFile(), defaults.authFile())
        );
    }

    public FleetMeshSettings withIngestEndpoint(String host, Integer port) {
        return new FleetMeshSettings(
                sanitizeText(host, ingestHost),
                sanitizePort(port, ingestPort),
                adminPort,
                embeddedIngest,
                backgroundWorkers,
                sweepIntervalMs,
                sweepBatchSize,
                commandTtlMs,
                staleRunningMs,
                bcryptStrength,
                installerPath,
                authFile
        );
    }

    public FleetMeshSettings withBcryptStrength(int strength) {
        return new FleetMeshSettings(
                ingestHost,
                ingestPort,
                adminPort,
                embeddedIngest,
                backgroundWorkers,
                sweepIntervalMs,
                sweepBatchSize,
                commandTtlMs,
                staleRunningMs,
                Math.max(4, Math.min(31, strength)),
                installerPath,
                authFile
        );
    }

    private static String sanitizeText(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    private static int sanitizePort(Integer raw, int fallback) {
        if (raw == null || raw < 0 || raw > 65_535) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String ingestHost,
            Integer ingestPort,
            Integer adminPort,
            Boolean embeddedIngest,
            Integer backgroundWorkers,
            Long sweepIntervalMs,
            Integer sweepBatchSize,
            Long commandTtlMs,
            Long staleRunningMs,
            Integer bcryptStrength,
            String installerPath,
            String authFile
    ) {
    }
}
