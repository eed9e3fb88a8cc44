package io.fleetmesh.util;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;

public final class Tokens {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder URL_SAFE = Base64.getUrlEncoder().withoutPadding();

    private Tokens() {
    }

    /**
     * Lowercase hex of {@code bytes} random bytes (2 chars per byte).
     */
    public static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        return HexFormat.of().formatHex(value);
    }

    /**
     * URL-safe Base64 without padding; 32 bytes gives 43 chars / 256 bits.
     */
    public static String urlSafe(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        return URL_SAFE.encodeToString(value);
    }

    public static String newId(String kind) {
        return kind + "_" + UUID.randomUUID();
    }

    public static SecureRandom random() {
        return RANDOM;
    }
}
