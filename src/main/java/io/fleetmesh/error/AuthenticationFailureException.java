package io.fleetmesh.error;

/**
 * Raised for a malformed, unknown or revoked agent key. The message never
 * carries the presented key.
 */
public final class AuthenticationFailureException extends RuntimeException {
    public AuthenticationFailureException(String message) {
        super(message);
    }
}
