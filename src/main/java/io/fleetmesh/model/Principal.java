package io.fleetmesh.model;

/**
 * Read-only view of a user or service account owned outside this core.
 */
public record Principal(String id, String displayName, boolean admin) {
}
