package io.fleetmesh.scheduler;

import io.fleetmesh.dispatch.CommandDispatcher;
import io.fleetmesh.error.NotFoundException;
import io.fleetmesh.model.JobStatus;
import io.fleetmesh.model.Recurrence;
import io.fleetmesh.model.RemoteCommand;
import io.fleetmesh.model.ScheduledJob;
import io.fleetmesh.observability.AuditLogger;
import io.fleetmesh.storage.JobStore;
import io.fleetmesh.util.Jsons;
import io.fleetmesh.util.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creates jobs and sweeps the due ones into remote commands.
 *
 * <p>Sweeps may overlap, in one process or many: a job is only fired by the
 * sweeper whose conditional claim succeeded, and only that claim's epoch can
 * finish it.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStore jobs;
    private final CommandDispatcher dispatcher;
    private final AuditLogger audit;
    private final Clock clock;
    private final int batchSize;

    public JobScheduler(JobStore jobs, CommandDispatcher dispatcher, AuditLogger audit, Clock clock, int batchSize) {
        this.jobs = jobs;
        this.dispatcher = dispatcher;
        this.audit = audit;
        this.clock = clock;
        this.batchSize = Math.max(1, batchSize);
    }

    public ScheduledJob create(
            String name,
            String actionType,
            Instant runAt,
            Recurrence recurrence,
            List<String> targetHosts,
            String payload,
            String creator
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("action type must not be blank");
        }
        if (runAt == null) {
            throw new IllegalArgumentException("run_at must be set");
        }
        List<String> hosts = normalizeHosts(targetHosts);
        String body = payload == null || payload.isBlank() ? "{}" : payload.trim();
        Jsons.readObject(body);
        long nowMs = clock.millis();
        ScheduledJob job = new ScheduledJob(
                Tokens.newId("job"),
                name.trim(),
                actionType.trim(),
                JobStatus.SCHEDULED,
                runAt.toEpochMilli(),
                recurrence == null ? Recurrence.ONCE : recurrence,
                hosts,
                body,
                creator == null || creator.isBlank() ? "system" : creator.trim(),
                0L,
                0,
                null,
                null,
                nowMs,
                nowMs
        );
        jobs.insert(job);
        log.info("Created job {} '{}' ({} on {} hosts, {} from {})",
                job.jobId(), job.name(), job.actionType(), hosts.size(), job.recurrence(), runAt);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", job.name());
        details.put("action_type", job.actionType());
        details.put("recurrence", job.recurrence().name());
        details.put("run_at_ms", job.runAtMs());
        details.put("target_hosts", hosts);
        audit(job.createdBy(), "job.create", job.jobId(), details);
        return job;
    }

    /**
     * Fires every job due at {@code now}, earliest first, up to the batch size.
     */
    public SweepOutcome sweep(Instant now) {
        long nowMs = now.toEpochMilli();
        List<ScheduledJob> due = jobs.findDue(nowMs, batchSize);
        if (due.isEmpty()) {
            return SweepOutcome.empty();
        }
        int claimed = 0;
        int lost = 0;
        int completed = 0;
        int rearmed = 0;
        int failed = 0;
        int enqueued = 0;
        for (ScheduledJob candidate : due) {
            JobStore.ClaimGrant grant = jobs.tryClaim(candidate.jobId(), candidate.claimEpoch(), nowMs);
            if (!grant.granted()) {
                lost++;
                continue;
            }
            claimed++;
            ScheduledJob job = grant.job();
            FireResult fired = fire(job);
            enqueued += fired.enqueued();
            long finishedAt = clock.millis();
            boolean finished;
            if (fired.error() != null) {
                finished = jobs.tryFail(job.jobId(), job.claimEpoch(), fired.error(), finishedAt);
                if (finished) {
                    failed++;
                    log.warn("Job {} failed on occurrence {}: {}", job.jobId(), job.occurrence(), fired.error());
                }
            } else if (job.recurrence().recurring()) {
                long next = job.recurrence().nextRunAtMs(job.runAtMs());
                finished = jobs.tryRearm(job.jobId(), job.claimEpoch(), next, finishedAt);
                if (finished) {
                    rearmed++;
                    log.debug("Job {} re-armed for {}", job.jobId(), Instant.ofEpochMilli(next));
                }
            } else {
                finished = jobs.tryComplete(job.jobId(), job.claimEpoch(), finishedAt);
                if (finished) {
                    completed++;
                }
            }
            if (!finished) {
                lost++;
                log.warn("Job {} claim epoch {} was fenced before it could finish", job.jobId(), job.claimEpoch());
            }
        }
        SweepOutcome outcome = new SweepOutcome(due.size(), claimed, lost, completed, rearmed, failed, enqueued);
        if (claimed > 0) {
            log.info("Sweep at {}: {}", now, outcome);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("claimed", claimed);
            details.put("claims_lost", lost);
            details.put("completed", completed);
            details.put("rearmed", rearmed);
            details.put("failed", failed);
            details.put("commands_enqueued", enqueued);
            audit("scheduler", "job.sweep", "scheduled_jobs", details);
        }
        return outcome;
    }

    /**
     * Puts RUNNING jobs that have not progressed for {@code staleAfter} back to
     * SCHEDULED. Their next sweep re-drives the same occurrence, and commands
     * already created for it are reused rather than duplicated.
     */
    public int recoverStaleRunning(Instant now, Duration staleAfter) {
        int recovered = jobs.recoverStaleRunning(now.toEpochMilli(), staleAfter.toMillis());
        if (recovered > 0) {
            log.warn("Recovered {} stale RUNNING jobs (older than {})", recovered, staleAfter);
        }
        return recovered;
    }

    public ScheduledJob cancel(String jobId, String actor) {
        ScheduledJob cancelled = jobs.cancel(requireId(jobId), clock.millis());
        log.info("Cancelled job {}", cancelled.jobId());
        audit(actor, "job.cancel", cancelled.jobId(), Map.of("name", cancelled.name()));
        return cancelled;
    }

    /**
     * Changes a job that has not fired yet for its current occurrence. Only
     * SCHEDULED jobs are editable; null fields of {@code edit} are kept.
     */
    public ScheduledJob edit(String jobId, JobEdit edit, String actor) {
        String id = requireId(jobId);
        if (edit == null || edit.empty()) {
            throw new IllegalArgumentException("nothing to change");
        }
        if (edit.name() != null && edit.name().isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        String payload = null;
        if (edit.payload() != null) {
            payload = edit.payload().isBlank() ? "{}" : edit.payload().trim();
            Jsons.readObject(payload);
        }
        JobStore.JobChanges changes = new JobStore.JobChanges(
                edit.name() == null ? null : edit.name().trim(),
                edit.runAt() == null ? null : edit.runAt().toEpochMilli(),
                edit.recurrence(),
                edit.targetHosts() == null ? null : normalizeHosts(edit.targetHosts()),
                payload
        );
        ScheduledJob updated = jobs.update(id, changes, clock.millis());
        log.info("Edited job {} (next run {})", updated.jobId(), Instant.ofEpochMilli(updated.runAtMs()));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", updated.name());
        details.put("recurrence", updated.recurrence().name());
        details.put("run_at_ms", updated.runAtMs());
        details.put("target_hosts", updated.targetHosts());
        audit(actor, "job.edit", updated.jobId(), details);
        return updated;
    }

    public ScheduledJob reschedule(String jobId, Instant runAt, String actor) {
        if (runAt == null) {
            throw new IllegalArgumentException("run_at must be set");
        }
        return edit(jobId, JobEdit.moveTo(runAt), actor);
    }

    /**
     * Removes the job. Its commands survive and still answer {@link #commandsFor}.
     */
    public ScheduledJob delete(String jobId, String actor) {
        ScheduledJob deleted = jobs.delete(requireId(jobId));
        log.info("Deleted job {} '{}'", deleted.jobId(), deleted.name());
        audit(actor, "job.delete", deleted.jobId(), Map.of("name", deleted.name(), "status", deleted.status().name()));
        return deleted;
    }

    public Optional<ScheduledJob> find(String jobId) {
        return jobs.findById(jobId);
    }

    public List<ScheduledJob> list(JobStatus status, int limit) {
        return jobs.list(status, limit);
    }

    public List<RemoteCommand> commandsFor(String jobId) {
        List<RemoteCommand> commands = dispatcher.bySourceJob(jobId);
        if (commands.isEmpty() && jobs.findById(jobId).isEmpty()) {
            throw new NotFoundException("job", jobId);
        }
        return commands;
    }

    private FireResult fire(ScheduledJob job) {
        int enqueued = 0;
        try {
            for (String host : job.targetHosts()) {
                dispatcher.enqueueForJob(job, job.occurrence(), host);
                enqueued++;
            }
            return new FireResult(enqueued, null);
        } catch (RuntimeException e) {
            log.error("Dispatch for job {} occurrence {} stopped after {} hosts", job.jobId(), job.occurrence(), enqueued, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new FireResult(enqueued, message);
        }
    }

    private static String requireId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        return jobId.trim();
    }

    private static List<String> normalizeHosts(List<String> targetHosts) {
        if (targetHosts == null) {
            throw new IllegalArgumentException("at least one target host is required");
        }
        Set<String> out = new LinkedHashSet<>();
        for (String host : targetHosts) {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("target hosts must not be blank");
            }
            out.add(host.trim());
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("at least one target host is required");
        }
        return List.copyOf(new ArrayList<>(out));
    }

    private void audit(String actor, String action, String resource, Map<String, Object> details) {
        if (audit != null) {
            audit.log(AuditLogger.AuditEvent.of(action, actor, resource, "ok", details));
        }
    }

    private record FireResult(int enqueued, String error) {
    }
}
