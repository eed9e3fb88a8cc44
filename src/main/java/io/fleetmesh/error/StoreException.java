package io.fleetmesh.error;

/**
 * Wraps a failure of the backing store. Callers may retry the whole operation.
 */
public final class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
