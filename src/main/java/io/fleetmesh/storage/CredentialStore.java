package io.fleetmesh.storage;

import io.fleetmesh.error.NotFoundException;
import io.fleetmesh.error.StoreException;
import io.fleetmesh.error.TerminalStateViolationException;
import io.fleetmesh.model.Credential;
import io.fleetmesh.model.CredentialState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for agent credentials. Only the bcrypt hash of a key is stored.
 */
public final class CredentialStore {
    private static final String COLUMNS =
            "credential_id,name,description,prefix,key_hash,default_principal,created_at_ms,last_used_at_ms,revoked_at_ms,rotated_at_ms,expires_at_ms";

    private final Database database;

    public CredentialStore(Database database) {
        this.database = database;
    }

    public void insert(NewCredential row) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO credentials(credential_id,name,description,prefix,key_hash,default_principal,created_at_ms,expires_at_ms) VALUES(?,?,?,?,?,?,?,?)")) {
            ps.setString(1, row.credentialId());
            ps.setString(2, row.name());
            ps.setString(3, row.description() == null ? "" : row.description());
            ps.setString(4, row.prefix());
            ps.setString(5, row.keyHash());
            if (row.defaultPrincipal() == null) {
                ps.setNull(6, Types.VARCHAR);
            } else {
                ps.setString(6, row.defaultPrincipal());
            }
            ps.setLong(7, row.createdAtMs());
            Rows.setNullableLong(ps, 8, row.expiresAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert credential", e);
        }
    }

    public Optional<StoredCredential> findByPrefix(String prefix) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM credentials WHERE prefix=?")) {
            ps.setString(1, prefix);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StoredCredential(readCredential(rs), rs.getString("key_hash")));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read credential by prefix", e);
        }
    }

    public Optional<Credential> findById(String credentialId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM credentials WHERE credential_id=?")) {
            ps.setString(1, credentialId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readCredential(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read credential", e);
        }
    }

    public List<Credential> list() {
        List<Credential> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM credentials ORDER BY created_at_ms ASC, credential_id ASC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readCredential(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list credentials", e);
        }
    }

    /**
     * Records liveness for the key with this prefix. Returns false when the
     * credential is unknown, revoked, expired or was rotated to another prefix.
     */
    public boolean touchLastUsed(String credentialId, String prefix, long nowMs) {
        try (Connection c = database.openConnection()) {
            return touchLastUsed(c, credentialId, prefix, nowMs);
        } catch (SQLException e) {
            throw new StoreException("Failed to touch credential", e);
        }
    }

    static boolean touchLastUsed(Connection c, String credentialId, String prefix, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE credentials SET last_used_at_ms=?
                WHERE credential_id=? AND prefix=? AND revoked_at_ms IS NULL
                  AND (expires_at_ms IS NULL OR expires_at_ms>?)
                """)) {
            ps.setLong(1, nowMs);
            ps.setString(2, credentialId);
            ps.setString(3, prefix);
            ps.setLong(4, nowMs);
            return ps.executeUpdate() == 1;
        }
    }

    /**
     * Sets or clears ({@code expiresAtMs == null}) the expiry of a live credential.
     */
    public Credential setExpiry(String credentialId, Long expiresAtMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE credentials SET expires_at_ms=? WHERE credential_id=? AND revoked_at_ms IS NULL")) {
                Rows.setNullableLong(ps, 1, expiresAtMs);
                ps.setString(2, credentialId);
                if (ps.executeUpdate() == 0) {
                    Credential current = readById(c, credentialId);
                    c.rollback();
                    if (current == null) {
                        throw new NotFoundException("credential", credentialId);
                    }
                    throw new TerminalStateViolationException(
                            "credential", credentialId, CredentialState.REVOKED.name(), "change expiry");
                }
                Credential updated = readById(c, credentialId);
                c.commit();
                return updated;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to set credential expiry", e);
        }
    }

    /**
     * Removes the credential row. Messages it ingested stay, with their
     * credential reference cleared, so doc_key deduplication still holds.
     */
    public Credential delete(String credentialId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM credentials WHERE credential_id=?")) {
                Credential current = readById(c, credentialId);
                if (current == null) {
                    c.rollback();
                    throw new NotFoundException("credential", credentialId);
                }
                ps.setString(1, credentialId);
                ps.executeUpdate();
                c.commit();
                return current;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to delete credential", e);
        }
    }

    public Credential revoke(String credentialId, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE credentials SET revoked_at_ms=? WHERE credential_id=? AND revoked_at_ms IS NULL")) {
                ps.setLong(1, nowMs);
                ps.setString(2, credentialId);
                if (ps.executeUpdate() == 0) {
                    Credential current = readById(c, credentialId);
                    c.rollback();
                    if (current == null) {
                        throw new NotFoundException("credential", credentialId);
                    }
                    throw new TerminalStateViolationException(
                            "credential", credentialId, CredentialState.REVOKED.name(), "revoke");
                }
                Credential revoked = readById(c, credentialId);
                c.commit();
                return revoked;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to revoke credential", e);
        }
    }

    /**
     * Swaps prefix and hash in one statement; the previous key stops verifying
     * at commit.
     */
    public Credential rotate(String credentialId, String newPrefix, String newHash, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE credentials SET prefix=?,key_hash=?,rotated_at_ms=?,revoked_at_ms=NULL WHERE credential_id=?")) {
                ps.setString(1, newPrefix);
                ps.setString(2, newHash);
                ps.setLong(3, nowMs);
                ps.setString(4, credentialId);
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    throw new NotFoundException("credential", credentialId);
                }
                Credential rotated = readById(c, credentialId);
                c.commit();
                return rotated;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to rotate credential", e);
        }
    }

    private Credential readById(Connection c, String credentialId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM credentials WHERE credential_id=?")) {
            ps.setString(1, credentialId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? readCredential(rs) : null;
            }
        }
    }

    private static Credential readCredential(ResultSet rs) throws SQLException {
        return new Credential(
                rs.getString("credential_id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("prefix"),
                rs.getString("default_principal"),
                rs.getLong("created_at_ms"),
                Rows.nullableLong(rs, "last_used_at_ms"),
                Rows.nullableLong(rs, "revoked_at_ms"),
                Rows.nullableLong(rs, "rotated_at_ms"),
                Rows.nullableLong(rs, "expires_at_ms")
        );
    }

    public record NewCredential(
            String credentialId,
            String name,
            String description,
            String prefix,
            String keyHash,
            String defaultPrincipal,
            long createdAtMs,
            Long expiresAtMs
    ) {
        public NewCredential(String credentialId, String name, String description, String prefix,
                             String keyHash, String defaultPrincipal, long createdAtMs) {
            this(credentialId, name, description, prefix, keyHash, defaultPrincipal, createdAtMs, null);
        }
    }

    public record StoredCredential(Credential credential, String keyHash) {
    }
}
