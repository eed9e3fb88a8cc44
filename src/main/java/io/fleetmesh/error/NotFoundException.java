package io.fleetmesh.error;

public final class NotFoundException extends RuntimeException {
    public NotFoundException(String entity, String id) {
        super(entity + " not found: " + id);
    }
}
