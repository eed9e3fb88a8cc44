package io.fleetmesh.model;

import java.util.List;

public record ScheduledJob(
        String jobId,
        String name,
        String actionType,
        JobStatus status,
        long runAtMs,
        Recurrence recurrence,
        List<String> targetHosts,
        String payload,
        String createdBy,
        long claimEpoch,
        int occurrence,
        Long lastRunAtMs,
        String lastError,
        long createdAtMs,
        long updatedAtMs
) {
}
