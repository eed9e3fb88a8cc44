package io.fleetmesh.storage;

import io.fleetmesh.error.IllegalTransitionException;
import io.fleetmesh.error.NotFoundException;
import io.fleetmesh.error.StoreException;
import io.fleetmesh.error.TerminalStateViolationException;
import io.fleetmesh.model.JobStatus;
import io.fleetmesh.model.Recurrence;
import io.fleetmesh.model.ScheduledJob;
import io.fleetmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sole writer of {@code scheduled_jobs}. Every state change is a conditional
 * UPDATE guarded by the current status and, once claimed, the claim epoch.
 */
public final class JobStore {
    private static final String COLUMNS = """
            job_id,name,action_type,status,run_at_ms,recurrence,target_hosts,payload,created_by,
            claim_epoch,occurrence,last_run_at_ms,last_error,created_at_ms,updated_at_ms
            """;

    private final Database database;

    public JobStore(Database database) {
        this.database = database;
    }

    public void insert(ScheduledJob job) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     INSERT INTO scheduled_jobs(job_id,name,action_type,status,run_at_ms,recurrence,target_hosts,payload,created_by,
                                                claim_epoch,occurrence,created_at_ms,updated_at_ms)
                     VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
                     """)) {
            ps.setString(1, job.jobId());
            ps.setString(2, job.name());
            ps.setString(3, job.actionType());
            ps.setString(4, job.status().name());
            ps.setLong(5, job.runAtMs());
            ps.setString(6, job.recurrence().name());
            ps.setString(7, Jsons.toCompactJson(job.targetHosts()));
            ps.setString(8, job.payload());
            ps.setString(9, job.createdBy());
            ps.setLong(10, job.claimEpoch());
            ps.setInt(11, job.occurrence());
            ps.setLong(12, job.createdAtMs());
            ps.setLong(13, job.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert job", e);
        }
    }

    public Optional<ScheduledJob> findById(String jobId) {
        try (Connection c = database.openConnection()) {
            return Optional.ofNullable(readById(c, jobId));
        } catch (SQLException e) {
            throw new StoreException("Failed to read job", e);
        }
    }

    public List<ScheduledJob> list(JobStatus status, int limit) {
        String sql = status == null
                ? "SELECT " + COLUMNS + " FROM scheduled_jobs ORDER BY run_at_ms ASC, job_id ASC LIMIT ?"
                : "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE status=? ORDER BY run_at_ms ASC, job_id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            return readAll(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs", e);
        }
    }

    /**
     * SCHEDULED jobs whose run time has passed, earliest first.
     */
    public List<ScheduledJob> findDue(long nowMs, int limit) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE status=? AND run_at_ms<=? ORDER BY run_at_ms ASC, job_id ASC LIMIT ?")) {
            ps.setString(1, JobStatus.SCHEDULED.name());
            ps.setLong(2, nowMs);
            ps.setInt(3, Math.max(1, limit));
            return readAll(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to read due jobs", e);
        }
    }

    /**
     * Moves a due job to RUNNING if nobody else has since the caller read it.
     * The returned grant carries the new claim epoch required to finish it.
     */
    public ClaimGrant tryClaim(String jobId, long observedEpoch, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE scheduled_jobs SET status=?,claim_epoch=claim_epoch+1,updated_at_ms=?
                    WHERE job_id=? AND status=? AND claim_epoch=? AND run_at_ms<=?
                    """)) {
                ps.setString(1, JobStatus.RUNNING.name());
                ps.setLong(2, nowMs);
                ps.setString(3, jobId);
                ps.setString(4, JobStatus.SCHEDULED.name());
                ps.setLong(5, observedEpoch);
                ps.setLong(6, nowMs);
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    return ClaimGrant.lost();
                }
                ScheduledJob claimed = readById(c, jobId);
                c.commit();
                return ClaimGrant.granted(claimed);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to claim job: " + jobId, e);
        }
    }

    public boolean tryComplete(String jobId, long claimEpoch, long nowMs) {
        return finish(jobId, claimEpoch, """
                UPDATE scheduled_jobs SET status=?,last_run_at_ms=?,last_error=NULL,updated_at_ms=?
                WHERE job_id=? AND status=? AND claim_epoch=?
                """, JobStatus.COMPLETED, nowMs, null, null);
    }

    /**
     * Re-arms a recurring job at {@code nextRunAtMs} and advances its occurrence.
     */
    public boolean tryRearm(String jobId, long claimEpoch, long nextRunAtMs, long nowMs) {
        return finish(jobId, claimEpoch, """
                UPDATE scheduled_jobs SET status=?,last_run_at_ms=?,last_error=NULL,updated_at_ms=?,
                                          run_at_ms=?,occurrence=occurrence+1
                WHERE job_id=? AND status=? AND claim_epoch=?
                """, JobStatus.SCHEDULED, nowMs, nextRunAtMs, null);
    }

    public boolean tryFail(String jobId, long claimEpoch, String error, long nowMs) {
        return finish(jobId, claimEpoch, """
                UPDATE scheduled_jobs SET status=?,last_run_at_ms=?,last_error=?,updated_at_ms=?
                WHERE job_id=? AND status=? AND claim_epoch=?
                """, JobStatus.FAILED, nowMs, null, error == null ? "unknown error" : error);
    }

    private boolean finish(String jobId, long claimEpoch, String sql, JobStatus target, long nowMs, Long nextRunAtMs, String error) {
        if (!JobStatus.RUNNING.canTransitionTo(target)) {
            throw new IllegalStateException("RUNNING cannot move to " + target);
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            ps.setString(idx++, target.name());
            ps.setLong(idx++, nowMs);
            if (error != null) {
                ps.setString(idx++, error);
            }
            ps.setLong(idx++, nowMs);
            if (nextRunAtMs != null) {
                ps.setLong(idx++, nextRunAtMs);
            }
            ps.setString(idx++, jobId);
            ps.setString(idx++, JobStatus.RUNNING.name());
            ps.setLong(idx, claimEpoch);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to finish job: " + jobId, e);
        }
    }

    public ScheduledJob cancel(String jobId, long nowMs) {
        Set<JobStatus> sources = JobStatus.sourcesOf(JobStatus.CANCELLED);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE scheduled_jobs SET status=?,updated_at_ms=? WHERE job_id=? AND status IN (" + Rows.placeholders(sources.size()) + ")")) {
                int idx = 1;
                ps.setString(idx++, JobStatus.CANCELLED.name());
                ps.setLong(idx++, nowMs);
                ps.setString(idx++, jobId);
                for (JobStatus source : sources) {
                    ps.setString(idx++, source.name());
                }
                if (ps.executeUpdate() == 0) {
                    ScheduledJob current = readById(c, jobId);
                    c.rollback();
                    if (current == null) {
                        throw new NotFoundException("job", jobId);
                    }
                    throw rejected(current, "cancel");
                }
                ScheduledJob cancelled = readById(c, jobId);
                c.commit();
                return cancelled;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to cancel job: " + jobId, e);
        }
    }

    /**
     * Rewrites the editable fields of a SCHEDULED job; null fields keep their
     * value. Occurrence and claim epoch are untouched.
     */
    public ScheduledJob update(String jobId, JobChanges changes, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE scheduled_jobs SET name=COALESCE(?,name),run_at_ms=COALESCE(?,run_at_ms),
                                              recurrence=COALESCE(?,recurrence),target_hosts=COALESCE(?,target_hosts),
                                              payload=COALESCE(?,payload),updated_at_ms=?
                    WHERE job_id=? AND status=?
                    """)) {
                Rows.setNullableString(ps, 1, changes.name());
                Rows.setNullableLong(ps, 2, changes.runAtMs());
                Rows.setNullableString(ps, 3, changes.recurrence() == null ? null : changes.recurrence().name());
                Rows.setNullableString(ps, 4, changes.targetHosts() == null ? null : Jsons.toCompactJson(changes.targetHosts()));
                Rows.setNullableString(ps, 5, changes.payload());
                ps.setLong(6, nowMs);
                ps.setString(7, jobId);
                ps.setString(8, JobStatus.SCHEDULED.name());
                if (ps.executeUpdate() == 0) {
                    ScheduledJob current = readById(c, jobId);
                    c.rollback();
                    if (current == null) {
                        throw new NotFoundException("job", jobId);
                    }
                    throw rejected(current, "edit");
                }
                ScheduledJob updated = readById(c, jobId);
                c.commit();
                return updated;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to update job: " + jobId, e);
        }
    }

    /**
     * Removes a job that is not mid-sweep. Commands it already produced are
     * left in place.
     */
    public ScheduledJob delete(String jobId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM scheduled_jobs WHERE job_id=? AND status<>?")) {
                ScheduledJob current = readById(c, jobId);
                if (current == null) {
                    c.rollback();
                    throw new NotFoundException("job", jobId);
                }
                ps.setString(1, jobId);
                ps.setString(2, JobStatus.RUNNING.name());
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    throw rejected(current, "delete");
                }
                c.commit();
                return current;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to delete job: " + jobId, e);
        }
    }

    private static IllegalTransitionException rejected(ScheduledJob current, String attempted) {
        String state = current.status().name();
        if (current.status().terminal()) {
            return new TerminalStateViolationException("job", current.jobId(), state, attempted);
        }
        return new IllegalTransitionException("job", current.jobId(), state, attempted);
    }

    /**
     * Returns RUNNING jobs whose claim went quiet to SCHEDULED. The epoch bump
     * fences out the original claimant if it wakes up later.
     */
    public int recoverStaleRunning(long nowMs, long staleAfterMs) {
        long cutoff = nowMs - Math.max(0L, staleAfterMs);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     UPDATE scheduled_jobs SET status=?,claim_epoch=claim_epoch+1,
                                               last_error='claim expired, re-driven',updated_at_ms=?
                     WHERE status=? AND updated_at_ms<=?
                     """)) {
            ps.setString(1, JobStatus.SCHEDULED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, JobStatus.RUNNING.name());
            ps.setLong(4, cutoff);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to recover stale jobs", e);
        }
    }

    private ScheduledJob readById(Connection c, String jobId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM scheduled_jobs WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? readJob(rs) : null;
            }
        }
    }

    private List<ScheduledJob> readAll(PreparedStatement ps) throws SQLException {
        List<ScheduledJob> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readJob(rs));
            }
        }
        return out;
    }

    private static ScheduledJob readJob(ResultSet rs) throws SQLException {
        return new ScheduledJob(
                rs.getString("job_id"),
                rs.getString("name"),
                rs.getString("action_type"),
                JobStatus.valueOf(rs.getString("status")),
                rs.getLong("run_at_ms"),
                Recurrence.valueOf(rs.getString("recurrence")),
                Jsons.readStringList(rs.getString("target_hosts")),
                rs.getString("payload"),
                rs.getString("created_by"),
                rs.getLong("claim_epoch"),
                rs.getInt("occurrence"),
                Rows.nullableLong(rs, "last_run_at_ms"),
                rs.getString("last_error"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    /**
     * Editable job fields; a null component means unchanged.
     */
    public record JobChanges(String name, Long runAtMs, Recurrence recurrence, List<String> targetHosts, String payload) {
    }

    public record ClaimGrant(boolean granted, ScheduledJob job) {
        public static ClaimGrant granted(ScheduledJob job) {
            return new ClaimGrant(true, job);
        }

        public static ClaimGrant lost() {
            return new ClaimGrant(false, null);
        }
    }
}
