package io.fleetmesh.security;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fleetmesh.model.Principal;
import io.fleetmesh.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Principals and their bearer tokens loaded from a JSON auth file:
 *
 * <pre>
 * {"principals": [{"id": "alice", "name": "Alice", "role": "admin", "tokens": ["t1"]}]}
 * </pre>
 */
public final class AuthFilePrincipalDirectory implements PrincipalDirectory {
    private final Map<String, Principal> byId;
    private final Map<String, Principal> byToken;

    private AuthFilePrincipalDirectory(Map<String, Principal> byId, Map<String, Principal> byToken) {
        this.byId = Map.copyOf(byId);
        this.byToken = Map.copyOf(byToken);
    }

    public static AuthFilePrincipalDirectory empty() {
        return new AuthFilePrincipalDirectory(Map.of(), Map.of());
    }

    public static AuthFilePrincipalDirectory load(String authFile) {
        if (authFile == null || authFile.isBlank()) {
            return empty();
        }
        Path file = Path.of(authFile.trim());
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("auth file not found: " + file);
        }
        AuthFile body;
        try {
            body = Jsons.mapper().readValue(file.toFile(), AuthFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read auth file: " + file, e);
        }
        return fromEntries(body == null ? List.of() : body.principals());
    }

    static AuthFilePrincipalDirectory fromEntries(List<PrincipalEntry> entries) {
        Map<String, Principal> byId = new LinkedHashMap<>();
        Map<String, Principal> byToken = new LinkedHashMap<>();
        if (entries == null) {
            return new AuthFilePrincipalDirectory(byId, byToken);
        }
        for (PrincipalEntry entry : entries) {
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                continue;
            }
            String id = entry.id().trim();
            String name = entry.name() == null || entry.name().isBlank() ? id : entry.name().trim();
            Principal principal = new Principal(id, name, parseAdmin(entry.role()));
            byId.put(id, principal);
            if (entry.tokens() == null) {
                continue;
            }
            for (String token : entry.tokens()) {
                if (token != null && !token.isBlank()) {
                    byToken.put(token.trim(), principal);
                }
            }
        }
        return new AuthFilePrincipalDirectory(byId, byToken);
    }

    @Override
    public Optional<Principal> find(String principalId) {
        if (principalId == null || principalId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(principalId.trim()));
    }

    @Override
    public Optional<Principal> resolveToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byToken.get(token.trim()));
    }

    @Override
    public boolean enabled() {
        return !byToken.isEmpty();
    }

    public int size() {
        return byId.size();
    }

    private static boolean parseAdmin(String raw) {
        if (raw == null || raw.isBlank()) {
            return false;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "read", "reader", "ro", "readonly", "agent" -> false;
            case "write", "writer", "rw", "operator", "admin", "owner" -> true;
            default -> throw new IllegalArgumentException("Unsupported auth role: " + raw);
        };
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AuthFile(List<PrincipalEntry> principals) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PrincipalEntry(String id, String name, String role, List<String> tokens) {
    }
}
