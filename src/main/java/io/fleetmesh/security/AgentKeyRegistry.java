package io.fleetmesh.security;

import io.fleetmesh.error.AuthenticationFailureException;
import io.fleetmesh.error.NotFoundException;
import io.fleetmesh.model.Credential;
import io.fleetmesh.observability.AuditLogger;
import io.fleetmesh.storage.CredentialStore;
import io.fleetmesh.util.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Issues, verifies, revokes and rotates agent API keys.
 *
 * <p>Only a bcrypt hash of the whole plain key is persisted; the plain key is
 * returned exactly once, from {@link #generate} or {@link #rotate}.
 */
public final class AgentKeyRegistry {
    private static final Logger log = LoggerFactory.getLogger(AgentKeyRegistry.class);
    private static final int MAX_PREFIX_ATTEMPTS = 5;

    private final CredentialStore store;
    private final KeyHasher hasher;
    private final PrincipalDirectory principals;
    private final AuditLogger audit;
    private final Clock clock;

    public AgentKeyRegistry(CredentialStore store, KeyHasher hasher, PrincipalDirectory principals, AuditLogger audit, Clock clock) {
        this.store = store;
        this.hasher = hasher;
        this.principals = principals;
        this.audit = audit;
        this.clock = clock;
    }

    public GeneratedKey generate(String name, String description, String defaultPrincipal) {
        return generate(name, description, defaultPrincipal, null, "system");
    }

    /**
     * @param expiresAt optional; the key stops verifying from this instant on
     */
    public GeneratedKey generate(String name, String description, String defaultPrincipal, Instant expiresAt, String actor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("key name must not be blank");
        }
        Long expiresAtMs = futureExpiry(expiresAt);
        String principal = defaultPrincipal == null || defaultPrincipal.isBlank() ? null : defaultPrincipal.trim();
        if (principal != null && principals.find(principal).isEmpty()) {
            throw new IllegalArgumentException("unknown principal: " + principal);
        }
        PlainKey key = freshKey();
        String credentialId = Tokens.newId("cred");
        store.insert(new CredentialStore.NewCredential(
                credentialId,
                name.trim(),
                description == null ? "" : description.trim(),
                key.prefix(),
                hasher.hash(key.value()),
                principal,
                clock.millis(),
                expiresAtMs
        ));
        Credential credential = store.findById(credentialId)
                .orElseThrow(() -> new IllegalStateException("credential vanished after insert: " + credentialId));
        log.info("Generated agent key {} (prefix={})", credentialId, key.prefix());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", credential.name());
        details.put("prefix", key.prefix());
        if (expiresAtMs != null) {
            details.put("expires_at_ms", expiresAtMs);
        }
        audit(actor, "key.generate", credentialId, details);
        return new GeneratedKey(key.value(), credential);
    }

    /**
     * Checks a presented key. An accepted key has its last-used time recorded.
     */
    public Optional<Credential> verify(String rawKey) {
        Optional<Credential> match = match(rawKey);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        Credential credential = match.get();
        if (!store.touchLastUsed(credential.credentialId(), credential.prefix(), clock.millis())) {
            // Revoked, expired or rotated between lookup and touch.
            return Optional.empty();
        }
        return store.findById(credential.credentialId());
    }

    /**
     * Like {@link #verify} but fails loudly and leaves no trace on failure.
     */
    public Credential authenticate(String rawKey) {
        Optional<Credential> match = match(rawKey);
        if (match.isEmpty()) {
            throw new AuthenticationFailureException("invalid or revoked agent key");
        }
        return match.get();
    }

    public Credential revoke(String credentialId, String actor) {
        Credential revoked = store.revoke(requireId(credentialId), clock.millis());
        log.info("Revoked agent key {}", revoked.credentialId());
        audit(actor, "key.revoke", revoked.credentialId(), Map.of("prefix", revoked.prefix()));
        return revoked;
    }

    /**
     * Issues a new prefix and secret for the same identity. The previous key
     * keeps working until the single replacing UPDATE commits.
     */
    public GeneratedKey rotate(String credentialId, String actor) {
        String id = requireId(credentialId);
        Credential before = store.findById(id).orElseThrow(() -> new NotFoundException("credential", id));
        PlainKey key = freshKey();
        Credential rotated = store.rotate(id, key.prefix(), hasher.hash(key.value()), clock.millis());
        log.info("Rotated agent key {} (prefix {} -> {})", id, before.prefix(), key.prefix());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("old_prefix", before.prefix());
        details.put("new_prefix", key.prefix());
        details.put("was_revoked", !before.active());
        audit(actor, "key.rotate", id, details);
        return new GeneratedKey(key.value(), rotated);
    }

    /**
     * Sets a new expiry, or clears it when {@code expiresAt} is null.
     */
    public Credential setExpiry(String credentialId, Instant expiresAt, String actor) {
        Long expiresAtMs = futureExpiry(expiresAt);
        Credential updated = store.setExpiry(requireId(credentialId), expiresAtMs);
        log.info("Agent key {} expiry set to {}", updated.credentialId(), expiresAt == null ? "never" : expiresAt);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expires_at_ms", expiresAtMs);
        audit(actor, "key.expiry", updated.credentialId(), details);
        return updated;
    }

    /**
     * Deletes the credential. Its key stops verifying at once; ingested
     * messages are kept.
     */
    public Credential delete(String credentialId, String actor) {
        Credential deleted = store.delete(requireId(credentialId));
        log.info("Deleted agent key {}", deleted.credentialId());
        audit(actor, "key.delete", deleted.credentialId(), Map.of("prefix", deleted.prefix()));
        return deleted;
    }

    public List<Credential> list() {
        return store.list();
    }

    public Optional<Credential> find(String credentialId) {
        return store.findById(credentialId);
    }

    private Optional<Credential> match(String rawKey) {
        Optional<PlainKey> parsed = PlainKey.parse(rawKey);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        PlainKey key = parsed.get();
        Optional<CredentialStore.StoredCredential> stored = store.findByPrefix(key.prefix());
        if (stored.isEmpty()) {
            hasher.matchDecoy(key.value());
            return Optional.empty();
        }
        if (!hasher.matches(key.value(), stored.get().keyHash())) {
            return Optional.empty();
        }
        Credential credential = stored.get().credential();
        if (!credential.usableAt(clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(credential);
    }

    private PlainKey freshKey() {
        for (int i = 0; i < MAX_PREFIX_ATTEMPTS; i++) {
            PlainKey key = PlainKey.generate();
            if (store.findByPrefix(key.prefix()).isEmpty()) {
                return key;
            }
        }
        throw new IllegalStateException("could not allocate a unique key prefix");
    }

    private Long futureExpiry(Instant expiresAt) {
        if (expiresAt == null) {
            return null;
        }
        if (!expiresAt.isAfter(clock.instant())) {
            throw new IllegalArgumentException("expiry must be in the future: " + expiresAt);
        }
        return expiresAt.toEpochMilli();
    }

    private static String requireId(String credentialId) {
        if (credentialId == null || credentialId.isBlank()) {
            throw new IllegalArgumentException("credential id must not be blank");
        }
        return credentialId.trim();
    }

    private void audit(String actor, String action, String resource, Map<String, Object> details) {
        if (audit != null) {
            audit.log(AuditLogger.AuditEvent.of(action, actor, resource, "ok", details));
        }
    }

    /**
     * Result of {@link #generate} or {@link #rotate}; the only place the plain key exists.
     */
    public record GeneratedKey(String plainKey, Credential credential) {
        @Override
        public String toString() {
            return "GeneratedKey[credential=" + credential.credentialId() + ", prefix=" + credential.prefix() + "]";
        }
    }
}
