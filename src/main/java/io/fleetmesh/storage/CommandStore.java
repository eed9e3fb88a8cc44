package io.fleetmesh.storage;

import io.fleetmesh.error.IllegalTransitionException;
import io.fleetmesh.error.NotFoundException;
import io.fleetmesh.error.StoreException;
import io.fleetmesh.error.TerminalStateViolationException;
import io.fleetmesh.model.CommandStatus;
import io.fleetmesh.model.RemoteCommand;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sole writer of {@code remote_commands}. Job identity is carried as a plain
 * column for traceability; no job row is ever read or written here.
 */
public final class CommandStore {
    private static final String COLUMNS = """
            command_id,target_host,action_type,payload,status,source_job_id,job_occurrence,detail,
            created_at_ms,sent_at_ms,completed_at_ms,updated_at_ms
            """;

    private final Database database;

    public CommandStore(Database database) {
        this.database = database;
    }

    public void insert(RemoteCommand command) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(insertSql(""))) {
            bindInsert(ps, command);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert command", e);
        }
    }

    /**
     * Inserts the command for one job occurrence and host, or returns the one
     * already recorded for that triple.
     */
    public RemoteCommand insertForJob(RemoteCommand command) {
        if (command.sourceJobId() == null || command.jobOccurrence() == null) {
            throw new IllegalArgumentException("job command requires source job id and occurrence");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    insertSql("ON CONFLICT(source_job_id,job_occurrence,target_host) DO NOTHING"))) {
                bindInsert(ps, command);
                if (ps.executeUpdate() == 1) {
                    c.commit();
                    return command;
                }
                RemoteCommand existing = readForJob(c, command.sourceJobId(), command.jobOccurrence(), command.targetHost());
                c.commit();
                return existing;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to insert job command", e);
        }
    }

    /**
     * Applies a forward transition. Only statuses that may legally precede
     * {@code target} are matched, so a terminal row is never rewritten.
     *
     * @param expectedHost when non-null, the command must target this host
     */
    public RemoteCommand transition(String commandId, CommandStatus target, String detail, String expectedHost, long nowMs) {
        Set<CommandStatus> sources = CommandStatus.sourcesOf(target);
        String sql = "UPDATE remote_commands SET status=?,detail=COALESCE(?,detail),updated_at_ms=?,"
                + (target == CommandStatus.SENT ? "sent_at_ms=?" : "completed_at_ms=?")
                + " WHERE command_id=? AND status IN (" + Rows.placeholders(sources.size()) + ")"
                + (expectedHost == null ? "" : " AND target_host=?");
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int idx = 1;
                ps.setString(idx++, target.name());
                Rows.setNullableString(ps, idx++, detail);
                ps.setLong(idx++, nowMs);
                ps.setLong(idx++, nowMs);
                ps.setString(idx++, commandId);
                for (CommandStatus source : sources) {
                    ps.setString(idx++, source.name());
                }
                if (expectedHost != null) {
                    ps.setString(idx, expectedHost);
                }
                if (ps.executeUpdate() == 0) {
                    RemoteCommand current = readById(c, commandId);
                    c.rollback();
                    if (current == null || (expectedHost != null && !expectedHost.equals(current.targetHost()))) {
                        throw new NotFoundException("command", commandId);
                    }
                    String attempted = "move to " + target.name();
                    if (current.status().terminal()) {
                        throw new TerminalStateViolationException("command", commandId, current.status().name(), attempted);
                    }
                    throw new IllegalTransitionException("command", commandId, current.status().name(), attempted);
                }
                RemoteCommand updated = readById(c, commandId);
                c.commit();
                return updated;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update command: " + commandId, e);
        }
    }

    /**
     * Marks every non-terminal command created at or before {@code cutoffMs} as EXPIRED.
     */
    public int expireCreatedBefore(long cutoffMs, long nowMs) {
        Set<CommandStatus> sources = CommandStatus.sourcesOf(CommandStatus.EXPIRED);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE remote_commands SET status=?,completed_at_ms=?,updated_at_ms=? WHERE created_at_ms<=? AND status IN ("
                             + Rows.placeholders(sources.size()) + ")")) {
            int idx = 1;
            ps.setString(idx++, CommandStatus.EXPIRED.name());
            ps.setLong(idx++, nowMs);
            ps.setLong(idx++, nowMs);
            ps.setLong(idx++, cutoffMs);
            for (CommandStatus source : sources) {
                ps.setString(idx++, source.name());
            }
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to expire commands", e);
        }
    }

    /**
     * Hands the host its PENDING commands, oldest first, marking each SENT.
     */
    public List<RemoteCommand> claimPendingForHost(String host, int limit, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM remote_commands WHERE target_host=? AND status=? ORDER BY created_at_ms ASC, command_id ASC LIMIT ?");
                 PreparedStatement upd = c.prepareStatement(
                         "UPDATE remote_commands SET status=?,sent_at_ms=?,updated_at_ms=? WHERE command_id=? AND status=?")) {
                sel.setString(1, host);
                sel.setString(2, CommandStatus.PENDING.name());
                sel.setInt(3, Math.max(1, limit));
                List<RemoteCommand> pending = readAll(sel);
                List<RemoteCommand> out = new ArrayList<>(pending.size());
                for (RemoteCommand command : pending) {
                    upd.setString(1, CommandStatus.SENT.name());
                    upd.setLong(2, nowMs);
                    upd.setLong(3, nowMs);
                    upd.setString(4, command.commandId());
                    upd.setString(5, CommandStatus.PENDING.name());
                    if (upd.executeUpdate() == 1) {
                        out.add(readById(c, command.commandId()));
                    }
                }
                c.commit();
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to claim commands for host: " + host, e);
        }
    }

    /**
     * Removes every command addressed to {@code host}, whatever its status.
     */
    public int deleteForHost(String host) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM remote_commands WHERE target_host=?")) {
            ps.setString(1, host);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to clear commands for host: " + host, e);
        }
    }

    public Optional<RemoteCommand> findById(String commandId) {
        try (Connection c = database.openConnection()) {
            return Optional.ofNullable(readById(c, commandId));
        } catch (SQLException e) {
            throw new StoreException("Failed to read command", e);
        }
    }

    public List<RemoteCommand> bySourceJob(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM remote_commands WHERE source_job_id=? ORDER BY job_occurrence ASC, target_host ASC")) {
            ps.setString(1, jobId);
            return readAll(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to read commands by job", e);
        }
    }

    public List<RemoteCommand> forHost(String host, CommandStatus status) {
        String sql = status == null
                ? "SELECT " + COLUMNS + " FROM remote_commands WHERE target_host=? ORDER BY created_at_ms ASC, command_id ASC"
                : "SELECT " + COLUMNS + " FROM remote_commands WHERE target_host=? AND status=? ORDER BY created_at_ms ASC, command_id ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, host);
            if (status != null) {
                ps.setString(2, status.name());
            }
            return readAll(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to read commands by host", e);
        }
    }

    public List<RemoteCommand> list(CommandStatus status, int limit) {
        String sql = status == null
                ? "SELECT " + COLUMNS + " FROM remote_commands ORDER BY created_at_ms DESC, command_id ASC LIMIT ?"
                : "SELECT " + COLUMNS + " FROM remote_commands WHERE status=? ORDER BY created_at_ms DESC, command_id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            return readAll(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list commands", e);
        }
    }

    private static String insertSql(String conflictClause) {
        return """
                INSERT INTO remote_commands(command_id,target_host,action_type,payload,status,source_job_id,job_occurrence,
                                            detail,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                """ + conflictClause;
    }

    private static void bindInsert(PreparedStatement ps, RemoteCommand command) throws SQLException {
        ps.setString(1, command.commandId());
        ps.setString(2, command.targetHost());
        ps.setString(3, command.actionType());
        ps.setString(4, command.payload());
        ps.setString(5, command.status().name());
        Rows.setNullableString(ps, 6, command.sourceJobId());
        Rows.setNullableLong(ps, 7, command.jobOccurrence() == null ? null : command.jobOccurrence().longValue());
        Rows.setNullableString(ps, 8, command.detail());
        ps.setLong(9, command.createdAtMs());
        ps.setLong(10, command.updatedAtMs());
    }

    private RemoteCommand readById(Connection c, String commandId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM remote_commands WHERE command_id=?")) {
            ps.setString(1, commandId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? readCommand(rs) : null;
            }
        }
    }

    private RemoteCommand readForJob(Connection c, String jobId, int occurrence, String host) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM remote_commands WHERE source_job_id=? AND job_occurrence=? AND target_host=?")) {
            ps.setString(1, jobId);
            ps.setInt(2, occurrence);
            ps.setString(3, host);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? readCommand(rs) : null;
            }
        }
    }

    private List<RemoteCommand> readAll(PreparedStatement ps) throws SQLException {
        List<RemoteCommand> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readCommand(rs));
            }
        }
        return out;
    }

    private static RemoteCommand readCommand(ResultSet rs) throws SQLException {
        return new RemoteCommand(
                rs.getString("command_id"),
                rs.getString("target_host"),
                rs.getString("action_type"),
                rs.getString("payload"),
                CommandStatus.valueOf(rs.getString("status")),
                rs.getString("source_job_id"),
                Rows.nullableInt(rs, "job_occurrence"),
                rs.getString("detail"),
                rs.getLong("created_at_ms"),
                Rows.nullableLong(rs, "sent_at_ms"),
                Rows.nullableLong(rs, "completed_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
