package io.fleetmesh.model;

public enum LinkVisibility {
    PUBLIC,
    RESTRICTED;

    public static LinkVisibility fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PUBLIC;
        }
        for (LinkVisibility value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown link visibility: " + raw);
    }
}
