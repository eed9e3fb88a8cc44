package io.fleetmesh.scheduler;

import io.fleetmesh.model.Recurrence;

import java.time.Instant;
import java.util.List;

/**
 * Requested changes to a scheduled job; null components stay as they are.
 */
public record JobEdit(String name, Instant runAt, Recurrence recurrence, List<String> targetHosts, String payload) {

    public static JobEdit moveTo(Instant runAt) {
        return new JobEdit(null, runAt, null, null, null);
    }

    public boolean empty() {
        return name == null && runAt == null && recurrence == null && targetHosts == null && payload == null;
    }
}
