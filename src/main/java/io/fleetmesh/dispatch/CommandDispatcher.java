package io.fleetmesh.dispatch;

import io.fleetmesh.error.NotFoundException;
import io.fleetmesh.model.CommandStatus;
import io.fleetmesh.model.RemoteCommand;
import io.fleetmesh.model.ScheduledJob;
import io.fleetmesh.storage.CommandStore;
import io.fleetmesh.util.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Creates remote commands for hosts and moves them forward through
 * {@link CommandStatus}. Terminal commands are never rewritten.
 */
public final class CommandDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);
    static final int DEFAULT_POLL_LIMIT = 50;

    private final CommandStore store;
    private final Clock clock;

    public CommandDispatcher(CommandStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public RemoteCommand enqueue(String targetHost, String actionType, String payload) {
        RemoteCommand command = newCommand(targetHost, actionType, payload, null, null);
        store.insert(command);
        log.debug("Enqueued command {} {} for {}", command.commandId(), command.actionType(), command.targetHost());
        return command;
    }

    /**
     * Enqueues the job's action for one host. Re-driving the same occurrence
     * returns the command created the first time.
     */
    public RemoteCommand enqueueForJob(ScheduledJob job, int occurrence, String targetHost) {
        RemoteCommand command = newCommand(targetHost, job.actionType(), job.payload(), job.jobId(), occurrence);
        RemoteCommand stored = store.insertForJob(command);
        if (!stored.commandId().equals(command.commandId())) {
            log.info("Job {} occurrence {} already dispatched to {} as {}", job.jobId(), occurrence, targetHost, stored.commandId());
        }
        return stored;
    }

    public RemoteCommand markSent(String commandId) {
        return store.transition(requireId(commandId), CommandStatus.SENT, null, null, clock.millis());
    }

    public RemoteCommand markAcknowledged(String commandId, String detail) {
        return store.transition(requireId(commandId), CommandStatus.ACKNOWLEDGED, detail, null, clock.millis());
    }

    public RemoteCommand markFailed(String commandId, String detail) {
        return store.transition(requireId(commandId), CommandStatus.FAILED, detail, null, clock.millis());
    }

    /**
     * Withdraws a command no agent has picked up yet. Only PENDING commands
     * can be cancelled.
     */
    public RemoteCommand cancel(String commandId, String actor) {
        String by = actor == null || actor.isBlank() ? "system" : actor.trim();
        RemoteCommand cancelled = store.transition(requireId(commandId), CommandStatus.CANCELLED, "cancelled by " + by, null, clock.millis());
        log.info("Cancelled command {} for {}", cancelled.commandId(), cancelled.targetHost());
        return cancelled;
    }

    /**
     * Drops the host's whole command history. Jobs are not touched.
     */
    public int clearForHost(String host) {
        String target = requireHost(host);
        int removed = store.deleteForHost(target);
        log.info("Cleared {} commands for {}", removed, target);
        return removed;
    }

    /**
     * Records an agent's outcome for a command addressed to {@code host}.
     * A command for another host reads as unknown.
     */
    public RemoteCommand reportResult(String host, String commandId, CommandStatus outcome, String detail) {
        if (outcome != CommandStatus.ACKNOWLEDGED && outcome != CommandStatus.FAILED) {
            throw new IllegalArgumentException("agents may only report ACKNOWLEDGED or FAILED, got " + outcome);
        }
        return store.transition(requireId(commandId), outcome, detail, requireHost(host), clock.millis());
    }

    /**
     * Hands the host its pending commands and marks them SENT.
     */
    public List<RemoteCommand> claimPendingForHost(String host, int limit) {
        return store.claimPendingForHost(requireHost(host), limit <= 0 ? DEFAULT_POLL_LIMIT : limit, clock.millis());
    }

    /**
     * Expires PENDING and SENT commands created at or before {@code nowMs - ttl}.
     */
    public int expire(long nowMs, Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a non-negative duration");
        }
        int expired = store.expireCreatedBefore(nowMs - ttl.toMillis(), nowMs);
        if (expired > 0) {
            log.info("Expired {} remote commands older than {}", expired, ttl);
        }
        return expired;
    }

    public List<RemoteCommand> bySourceJob(String jobId) {
        return store.bySourceJob(jobId);
    }

    public List<RemoteCommand> forHost(String host, CommandStatus status) {
        return store.forHost(requireHost(host), status);
    }

    public List<RemoteCommand> list(CommandStatus status, int limit) {
        return store.list(status, limit);
    }

    public Optional<RemoteCommand> find(String commandId) {
        return store.findById(commandId);
    }

    public RemoteCommand require(String commandId) {
        return store.findById(commandId).orElseThrow(() -> new NotFoundException("command", commandId));
    }

    private RemoteCommand newCommand(String targetHost, String actionType, String payload, String jobId, Integer occurrence) {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("action type must not be blank");
        }
        long nowMs = clock.millis();
        return new RemoteCommand(
                Tokens.newId("cmd"),
                requireHost(targetHost),
                actionType.trim(),
                payload == null || payload.isBlank() ? "{}" : payload,
                CommandStatus.PENDING,
                jobId,
                occurrence,
                null,
                nowMs,
                null,
                null,
                nowMs
        );
    }

    private static String requireHost(String host) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("target host must not be blank");
        }
        return host.trim();
    }

    private static String requireId(String commandId) {
        if (commandId == null || commandId.isBlank()) {
            throw new IllegalArgumentException("command id must not be blank");
        }
        return commandId.trim();
    }
}
