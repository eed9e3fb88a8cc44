package io.fleetmesh.security;

import io.fleetmesh.util.Tokens;
import org.springframework.security.crypto.bcrypt.BCrypt;

/**
 * Salted bcrypt over the whole plain key. The salt travels inside the hash.
 */
public final class KeyHasher {
    private final int strength;
    private final String decoyHash;

    public KeyHasher(int strength) {
        if (strength < 4 || strength > 31) {
            throw new IllegalArgumentException("bcrypt strength must be in [4, 31]");
        }
        this.strength = strength;
        this.decoyHash = BCrypt.hashpw(PlainKey.generate().value(), BCrypt.gensalt(strength, Tokens.random()));
    }

    public String hash(String plainKey) {
        return BCrypt.hashpw(plainKey, BCrypt.gensalt(strength, Tokens.random()));
    }

    public boolean matches(String plainKey, String storedHash) {
        if (plainKey == null || storedHash == null || storedHash.isBlank()) {
            return false;
        }
        try {
            return BCrypt.checkpw(plainKey, storedHash);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Burns one comparison for an unknown prefix so lookups cost the same either way.
     */
    public void matchDecoy(String plainKey) {
        BCrypt.checkpw(plainKey == null ? "" : plainKey, decoyHash);
    }
}
