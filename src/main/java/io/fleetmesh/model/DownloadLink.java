package io.fleetmesh.model;

public record DownloadLink(
        String linkId,
        String token,
        long createdAtMs,
        Long expiresAtMs,
        Long revokedAtMs,
        String createdBy,
        LinkVisibility visibility
) {
    public boolean isActive(long nowMs) {
        if (revokedAtMs != null) {
            return false;
        }
        return expiresAtMs == null || expiresAtMs > nowMs;
    }

    public boolean requireLogin() {
        return visibility == LinkVisibility.RESTRICTED;
    }
}
