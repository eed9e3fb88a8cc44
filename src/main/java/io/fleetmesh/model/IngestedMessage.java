package io.fleetmesh.model;

public record IngestedMessage(
        String messageId,
        String docKey,
        String payload,
        long receivedAtMs,
        String credentialId
) {
}
