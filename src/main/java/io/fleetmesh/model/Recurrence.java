package io.fleetmesh.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Closed recurrence policy set. The next run is always derived from the prior
 * scheduled run, never from the time the sweep happened to fire.
 */
public enum Recurrence {
    ONCE,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY;

    public boolean recurring() {
        return this != ONCE;
    }

    public long nextRunAtMs(long priorRunAtMs) {
        ZonedDateTime prior = Instant.ofEpochMilli(priorRunAtMs).atZone(ZoneOffset.UTC);
        return switch (this) {
            case ONCE -> throw new IllegalStateException("ONCE has no next occurrence");
            case HOURLY -> prior.plusHours(1).toInstant().toEpochMilli();
            case DAILY -> prior.plusDays(1).toInstant().toEpochMilli();
            case WEEKLY -> prior.plusWeeks(1).toInstant().toEpochMilli();
            // Month length varies; plusMonths clamps the day to the target month.
            case MONTHLY -> prior.plusMonths(1).toInstant().toEpochMilli();
        };
    }

    public static Recurrence fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ONCE;
        }
        for (Recurrence value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown recurrence: " + raw);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
