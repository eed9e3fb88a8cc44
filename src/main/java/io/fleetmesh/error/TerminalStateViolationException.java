package io.fleetmesh.error;

/**
 * The entity already reached a terminal state; nothing moves it further.
 */
public final class TerminalStateViolationException extends IllegalTransitionException {
    public TerminalStateViolationException(String entity, String entityId, String currentState, String attempted) {
        super(entity + " " + entityId + " is " + currentState + " (terminal), cannot " + attempted, entityId, currentState);
    }
}
