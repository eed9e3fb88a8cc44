package io.fleetmesh.model;

public record RemoteCommand(
        String commandId,
        String targetHost,
        String actionType,
        String payload,
        CommandStatus status,
        String sourceJobId,
        Integer jobOccurrence,
        String detail,
        long createdAtMs,
        Long sentAtMs,
        Long completedAtMs,
        long updatedAtMs
) {
}
