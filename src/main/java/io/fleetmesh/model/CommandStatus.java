package io.fleetmesh.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Remote command lifecycle; only forward edges exist.
 */
public enum CommandStatus {
    PENDING,
    SENT,
    ACKNOWLEDGED,
    FAILED,
    EXPIRED,
    CANCELLED;

    public Set<CommandStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(SENT, ACKNOWLEDGED, FAILED, EXPIRED, CANCELLED);
            case SENT -> EnumSet.of(ACKNOWLEDGED, FAILED, EXPIRED);
            case ACKNOWLEDGED, FAILED, EXPIRED, CANCELLED -> EnumSet.noneOf(CommandStatus.class);
        };
    }

    public boolean canTransitionTo(CommandStatus next) {
        return successors().contains(next);
    }

    public boolean terminal() {
        return successors().isEmpty();
    }

    public static Set<CommandStatus> sourcesOf(CommandStatus next) {
        EnumSet<CommandStatus> out = EnumSet.noneOf(CommandStatus.class);
        for (CommandStatus status : values()) {
            if (status.canTransitionTo(next)) {
                out.add(status);
            }
        }
        return out;
    }

    public static CommandStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("command status must not be blank");
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        return switch (value) {
            case "ACK", "COMPLETED", "SUCCESS", "OK" -> ACKNOWLEDGED;
            case "ERROR" -> FAILED;
            case "CANCELED" -> CANCELLED;
            default -> CommandStatus.valueOf(value);
        };
    }
}
