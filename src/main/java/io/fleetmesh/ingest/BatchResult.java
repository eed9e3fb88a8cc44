package io.fleetmesh.ingest;

import java.util.List;

public record BatchResult(int processed, int stored, int duplicates, List<LineError> errors) {
    public BatchResult {
        errors = List.copyOf(errors);
    }

    /**
     * 200 when every line went through, 207 when some did, 400 when none did.
     */
    public int httpStatus() {
        if (errors.isEmpty()) {
            return 200;
        }
        return processed > 0 ? 207 : 400;
    }

    public record LineError(int line, String error) {
    }
}
