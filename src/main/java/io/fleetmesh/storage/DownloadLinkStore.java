package io.fleetmesh.storage;

import io.fleetmesh.error.NotFoundException;
import io.fleetmesh.error.StoreException;
import io.fleetmesh.error.TerminalStateViolationException;
import io.fleetmesh.model.DownloadLink;
import io.fleetmesh.model.LinkVisibility;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class DownloadLinkStore {
    private static final String COLUMNS = "link_id,token,created_at_ms,expires_at_ms,revoked_at_ms,created_by,visibility";

    private final Database database;

    public DownloadLinkStore(Database database) {
        this.database = database;
    }

    public void insert(DownloadLink link) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO download_links(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?)")) {
            ps.setString(1, link.linkId());
            ps.setString(2, link.token());
            ps.setLong(3, link.createdAtMs());
            Rows.setNullableLong(ps, 4, link.expiresAtMs());
            Rows.setNullableLong(ps, 5, link.revokedAtMs());
            ps.setString(6, link.createdBy() == null ? "" : link.createdBy());
            ps.setString(7, link.visibility().name());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert download link", e);
        }
    }

    public Optional<DownloadLink> findByToken(String token) {
        return findOne("token", token);
    }

    public Optional<DownloadLink> findById(String linkId) {
        return findOne("link_id", linkId);
    }

    public List<DownloadLink> list() {
        List<DownloadLink> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM download_links ORDER BY created_at_ms DESC, link_id ASC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readLink(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list download links", e);
        }
    }

    public DownloadLink revoke(String linkId, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE download_links SET revoked_at_ms=? WHERE link_id=? AND revoked_at_ms IS NULL")) {
                ps.setLong(1, nowMs);
                ps.setString(2, linkId);
                if (ps.executeUpdate() == 0) {
                    DownloadLink current = readOne(c, "link_id", linkId);
                    c.rollback();
                    if (current == null) {
                        throw new NotFoundException("download link", linkId);
                    }
                    throw new TerminalStateViolationException("download link", linkId, "REVOKED", "revoke");
                }
                DownloadLink revoked = readOne(c, "link_id", linkId);
                c.commit();
                return revoked;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to revoke download link", e);
        }
    }

    public int deleteAll() {
        try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
            return st.executeUpdate("DELETE FROM download_links");
        } catch (SQLException e) {
            throw new StoreException("Failed to purge download links", e);
        }
    }

    private Optional<DownloadLink> findOne(String column, String value) {
        try (Connection c = database.openConnection()) {
            return Optional.ofNullable(readOne(c, column, value));
        } catch (SQLException e) {
            throw new StoreException("Failed to read download link", e);
        }
    }

    private DownloadLink readOne(Connection c, String column, String value) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM download_links WHERE " + column + "=?")) {
            ps.setString(1, value);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? readLink(rs) : null;
            }
        }
    }

    private static DownloadLink readLink(ResultSet rs) throws SQLException {
        return new DownloadLink(
                rs.getString("link_id"),
                rs.getString("token"),
                rs.getLong("created_at_ms"),
                Rows.nullableLong(rs, "expires_at_ms"),
                Rows.nullableLong(rs, "revoked_at_ms"),
                rs.getString("created_by"),
                LinkVisibility.valueOf(rs.getString("visibility"))
        );
    }
}
