package io.fleetmesh.cli;

import io.fleetmesh.model.Recurrence;
import io.fleetmesh.scheduler.JobEdit;
import io.fleetmesh.util.Jsons;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsing shared by CLI options and admin API parameters.
 */
final class Inputs {
    private Inputs() {
    }

    /**
     * ISO-8601 instant or epoch milliseconds; blank means {@code fallback}.
     */
    static Instant parseInstant(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(value));
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid instant: " + raw, e);
        }
    }

    /**
     * JSON array or comma-separated list.
     */
    static List<String> parseHosts(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String value = raw.trim();
        if (value.startsWith("[")) {
            return Jsons.readStringList(value);
        }
        List<String> out = new ArrayList<>();
        for (String part : value.split(",")) {
            out.add(part.trim());
        }
        return out;
    }

    /**
     * Seconds; blank means no expiry.
     */
    static Duration parseTtlSeconds(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ttl must be a whole number of seconds: " + raw, e);
        }
    }

    /**
     * Job changes from raw fields; a blank field leaves that part of the job alone.
     */
    static JobEdit parseJobEdit(String name, String runAt, String recurrence, String hosts, String payload) {
        return new JobEdit(
                blankToNull(name),
                parseInstant(runAt, null),
                blankToNull(recurrence) == null ? null : Recurrence.fromString(recurrence),
                blankToNull(hosts) == null ? null : parseHosts(hosts),
                blankToNull(payload)
        );
    }

    static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
