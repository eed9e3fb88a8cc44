package io.fleetmesh.background;

import io.fleetmesh.config.FleetMeshSettings;

/**
 * Immutable snapshot of the submitter's context, handed to the task as an
 * argument. Nothing is inherited through thread-locals.
 */
public record TaskContext(String namespace, String principalId, FleetMeshSettings settings) {
    public TaskContext {
        namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        principalId = principalId == null || principalId.isBlank() ? "system" : principalId.trim();
        settings = settings == null ? FleetMeshSettings.defaults() : settings;
    }

    public static TaskContext system(String namespace, FleetMeshSettings settings) {
        return new TaskContext(namespace, "system", settings);
    }
}
