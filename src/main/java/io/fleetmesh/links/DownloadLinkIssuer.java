package io.fleetmesh.links;

import io.fleetmesh.model.DownloadLink;
import io.fleetmesh.model.LinkVisibility;
import io.fleetmesh.model.Principal;
import io.fleetmesh.observability.AuditLogger;
import io.fleetmesh.storage.DownloadLinkStore;
import io.fleetmesh.util.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Issues and checks installer download links. A link is usable while it is
 * not revoked and its expiry, if any, lies in the future.
 */
public final class DownloadLinkIssuer {
    private static final Logger log = LoggerFactory.getLogger(DownloadLinkIssuer.class);
    static final int TOKEN_BYTES = 32;

    private final DownloadLinkStore store;
    private final AuditLogger audit;
    private final Clock clock;

    public DownloadLinkIssuer(DownloadLinkStore store, AuditLogger audit, Clock clock) {
        this.store = store;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * @param ttl {@code null} for a link that never expires; zero yields a link
     *            that is already inactive
     */
    public DownloadLink issue(String creator, Duration ttl, LinkVisibility visibility) {
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        long nowMs = clock.millis();
        DownloadLink link = new DownloadLink(
                Tokens.newId("link"),
                Tokens.urlSafe(TOKEN_BYTES),
                nowMs,
                ttl == null ? null : nowMs + ttl.toMillis(),
                null,
                creator == null || creator.isBlank() ? "system" : creator.trim(),
                visibility == null ? LinkVisibility.PUBLIC : visibility
        );
        store.insert(link);
        log.info("Issued download link {} ({}, expires={})", link.linkId(), link.visibility(),
                link.expiresAtMs() == null ? "never" : Instant.ofEpochMilli(link.expiresAtMs()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("visibility", link.visibility().name());
        details.put("expires_at_ms", link.expiresAtMs());
        audit(link.createdBy(), "link.issue", link.linkId(), details);
        return link;
    }

    public boolean isActive(DownloadLink link, Instant now) {
        return link.isActive(now.toEpochMilli());
    }

    public boolean requireLogin(DownloadLink link) {
        return link.requireLogin();
    }

    public DownloadLink revoke(String linkId, String actor) {
        if (linkId == null || linkId.isBlank()) {
            throw new IllegalArgumentException("link id must not be blank");
        }
        DownloadLink revoked = store.revoke(linkId.trim(), clock.millis());
        log.info("Revoked download link {}", revoked.linkId());
        audit(actor, "link.revoke", revoked.linkId(), Map.of());
        return revoked;
    }

    /**
     * Decides whether {@code principal} (null when anonymous) may use {@code token}.
     */
    public LinkAccess authorize(String token, Principal principal) {
        if (token == null || token.isBlank()) {
            return LinkAccess.NOT_FOUND;
        }
        Optional<DownloadLink> link = store.findByToken(token.trim());
        if (link.isEmpty()) {
            return LinkAccess.NOT_FOUND;
        }
        if (!isActive(link.get(), clock.instant())) {
            return LinkAccess.INACTIVE;
        }
        if (requireLogin(link.get()) && principal == null) {
            return LinkAccess.LOGIN_REQUIRED;
        }
        return LinkAccess.GRANTED;
    }

    public List<DownloadLink> list() {
        return store.list();
    }

    public Optional<DownloadLink> find(String linkId) {
        return store.findById(linkId);
    }

    public int purgeAll(String actor) {
        int removed = store.deleteAll();
        log.info("Purged {} download links", removed);
        audit(actor, "link.purge", "download_links", Map.of("removed", removed));
        return removed;
    }

    private void audit(String actor, String action, String resource, Map<String, Object> details) {
        if (audit != null) {
            audit.log(AuditLogger.AuditEvent.of(action, actor, resource, "ok", details));
        }
    }
}
