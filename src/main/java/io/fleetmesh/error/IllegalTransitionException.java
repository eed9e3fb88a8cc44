package io.fleetmesh.error;

/**
 * A state change the entity's lifecycle does not allow from its current state.
 */
public class IllegalTransitionException extends RuntimeException {
    private final String entityId;
    private final String currentState;

    public IllegalTransitionException(String entity, String entityId, String currentState, String attempted) {
        this(entity + " " + entityId + " is " + currentState + ", cannot " + attempted, entityId, currentState);
    }

    protected IllegalTransitionException(String message, String entityId, String currentState) {
        super(message);
        this.entityId = entityId;
        this.currentState = currentState;
    }

    public String entityId() {
        return entityId;
    }

    public String currentState() {
        return currentState;
    }
}
