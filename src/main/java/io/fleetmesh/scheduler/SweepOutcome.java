package io.fleetmesh.scheduler;

/**
 * Counters for one sweep. {@code claimsLost} covers jobs another sweeper
 * claimed first and claims fenced off by stale-claim recovery.
 */
public record SweepOutcome(
        int due,
        int claimed,
        int claimsLost,
        int completed,
        int rearmed,
        int failed,
        int commandsEnqueued
) {
    public static SweepOutcome empty() {
        return new SweepOutcome(0, 0, 0, 0, 0, 0, 0);
    }
}
