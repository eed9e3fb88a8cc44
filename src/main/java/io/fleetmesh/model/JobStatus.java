package io.fleetmesh.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Scheduled job lifecycle. Re-arming a recurring job is the
 * {@code RUNNING -> SCHEDULED} edge.
 */
public enum JobStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public Set<JobStatus> successors() {
        return switch (this) {
            case SCHEDULED -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, SCHEDULED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    public boolean canTransitionTo(JobStatus next) {
        return successors().contains(next);
    }

    public boolean terminal() {
        return successors().isEmpty();
    }

    /**
     * States from which {@code next} is reachable in one step.
     */
    public static Set<JobStatus> sourcesOf(JobStatus next) {
        EnumSet<JobStatus> out = EnumSet.noneOf(JobStatus.class);
        for (JobStatus status : values()) {
            if (status.canTransitionTo(next)) {
                out.add(status);
            }
        }
        return out;
    }

    public static JobStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("job status must not be blank");
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        return "CANCELED".equals(value) ? CANCELLED : JobStatus.valueOf(value);
    }
}
