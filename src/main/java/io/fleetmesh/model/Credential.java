package io.fleetmesh.model;

/**
 * Stored API-key identity. The key hash is deliberately not part of this view.
 */
public record Credential(
        String credentialId,
        String name,
        String description,
        String prefix,
        String defaultPrincipal,
        long createdAtMs,
        Long lastUsedAtMs,
        Long revokedAtMs,
        Long rotatedAtMs,
        Long expiresAtMs
) {
    public CredentialState state() {
        return CredentialState.of(revokedAtMs);
    }

    /**
     * Not revoked. Expiry is time-dependent; see {@link #usableAt(long)}.
     */
    public boolean active() {
        return state() == CredentialState.ACTIVE;
    }

    public CredentialState stateAt(long nowMs) {
        return CredentialState.of(revokedAtMs, expiresAtMs, nowMs);
    }

    public boolean usableAt(long nowMs) {
        return stateAt(nowMs) == CredentialState.ACTIVE;
    }
}
