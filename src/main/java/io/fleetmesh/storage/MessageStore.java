package io.fleetmesh.storage;

import io.fleetmesh.error.AuthenticationFailureException;
import io.fleetmesh.error.StoreException;
import io.fleetmesh.model.IngestedMessage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Deduplicating persistence for agent messages. Uniqueness of {@code doc_key}
 * is enforced by the table, so concurrent writers in any process agree.
 */
public final class MessageStore {
    private final Database database;

    public MessageStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts the message unless a row with the same non-null doc key exists,
     * and touches the credential's last-used time in the same transaction.
     *
     * @param keyPrefix prefix of the key the caller authenticated with; a rotation
     *                  since then makes the insert fail
     * @throws AuthenticationFailureException if the credential was revoked, expired or rotated in the meantime
     */
    public InsertOutcome insertIfAbsent(
            String messageId, String docKey, String payload, String credentialId, String keyPrefix, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement("""
                    INSERT INTO ingested_messages(message_id,doc_key,payload,received_at_ms,credential_id)
                    VALUES(?,?,?,?,?)
                    ON CONFLICT(doc_key) DO NOTHING
                    """)) {
                if (!CredentialStore.touchLastUsed(c, credentialId, keyPrefix, nowMs)) {
                    c.rollback();
                    throw new AuthenticationFailureException("credential is revoked, expired, rotated or unknown");
                }
                ins.setString(1, messageId);
                Rows.setNullableString(ins, 2, docKey);
                ins.setString(3, payload);
                ins.setLong(4, nowMs);
                ins.setString(5, credentialId);
                if (ins.executeUpdate() == 1) {
                    c.commit();
                    return InsertOutcome.inserted(messageId);
                }
                String existing = findIdByDocKey(c, docKey);
                c.commit();
                return InsertOutcome.duplicate(existing);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to ingest message", e);
        }
    }

    public Optional<IngestedMessage> findByDocKey(String docKey) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT message_id,doc_key,payload,received_at_ms,credential_id FROM ingested_messages WHERE doc_key=?")) {
            ps.setString(1, docKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new IngestedMessage(
                        rs.getString("message_id"),
                        rs.getString("doc_key"),
                        rs.getString("payload"),
                        rs.getLong("received_at_ms"),
                        rs.getString("credential_id")
                ));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read message", e);
        }
    }

    public long countByDocKey(String docKey) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM ingested_messages WHERE doc_key=?")) {
            ps.setString(1, docKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count messages", e);
        }
    }

    public long count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM ingested_messages");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreException("Failed to count messages", e);
        }
    }

    public Optional<Long> lastReceivedAtMs() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT MAX(received_at_ms) FROM ingested_messages");
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            long value = rs.getLong(1);
            return rs.wasNull() ? Optional.empty() : Optional.of(value);
        } catch (SQLException e) {
            throw new StoreException("Failed to read last message time", e);
        }
    }

    private String findIdByDocKey(Connection c, String docKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT message_id FROM ingested_messages WHERE doc_key=?")) {
            ps.setString(1, docKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    public record InsertOutcome(boolean stored, String messageId) {
        static InsertOutcome inserted(String messageId) {
            return new InsertOutcome(true, messageId);
        }

        static InsertOutcome duplicate(String existingMessageId) {
            return new InsertOutcome(false, existingMessageId);
        }
    }
}
