package io.fleetmesh.model;

public enum CredentialState {
    ACTIVE,
    EXPIRED,
    REVOKED;

    public static CredentialState of(Long revokedAtMs) {
        return revokedAtMs == null ? ACTIVE : REVOKED;
    }

    /**
     * Revocation wins over expiry; a key expires once {@code nowMs} reaches its expiry.
     */
    public static CredentialState of(Long revokedAtMs, Long expiresAtMs, long nowMs) {
        if (revokedAtMs != null) {
            return REVOKED;
        }
        return expiresAtMs != null && expiresAtMs <= nowMs ? EXPIRED : ACTIVE;
    }
}
