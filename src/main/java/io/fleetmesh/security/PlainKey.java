package io.fleetmesh.security;

import io.fleetmesh.util.Tokens;

import java.util.Optional;

/**
 * Agent key as handed to an operator: {@code fm_<prefix>_<secret>}.
 *
 * <p>The prefix is 12 lowercase hex chars and doubles as the public lookup
 * handle. The secret is URL-safe Base64 and may itself contain {@code _}.
 */
public record PlainKey(String prefix, String secret) {
    public static final String TAG = "fm";
    static final int PREFIX_BYTES = 6;
    static final int SECRET_BYTES = 32;

    public static PlainKey generate() {
        return new PlainKey(Tokens.randomHex(PREFIX_BYTES), Tokens.urlSafe(SECRET_BYTES));
    }

    public static Optional<PlainKey> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String[] parts = raw.trim().split("_", 3);
        if (parts.length != 3 || !TAG.equals(parts[0])) {
            return Optional.empty();
        }
        if (!isHexPrefix(parts[1]) || parts[2].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PlainKey(parts[1], parts[2]));
    }

    public String value() {
        return TAG + "_" + prefix + "_" + secret;
    }

    @Override
    public String toString() {
        return TAG + "_" + prefix + "_***";
    }

    private static boolean isHexPrefix(String value) {
        if (value.length() != PREFIX_BYTES * 2) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (!((ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'f'))) {
                return false;
            }
        }
        return true;
    }
}
