package io.fleetmesh.security;

import io.fleetmesh.model.Principal;

import java.util.Optional;

/**
 * Read access to user and service identities owned outside this core.
 */
public interface PrincipalDirectory {
    Optional<Principal> find(String principalId);

    /**
     * Resolves a bearer token presented to the admin API.
     */
    Optional<Principal> resolveToken(String token);

    /**
     * False when no principals are configured and the admin API runs open.
     */
    boolean enabled();
}
