package io.fleetmesh.ingest;

import io.fleetmesh.model.CommandStatus;
import io.fleetmesh.model.Credential;
import io.fleetmesh.model.RemoteCommand;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Agent-facing operations. Both listener topologies delegate here, so the
 * behavior is identical wherever the endpoint is hosted.
 */
public interface IngestionService {
    /**
     * Stores {@code payload} once per non-null {@code docKey}; a null key always stores.
     */
    IngestResult ingest(Credential credential, String docKey, String payload);

    IngestResult ingest(String rawKey, String docKey, String payload);

    /**
     * Newline-delimited JSON, one {@code {"doc_key": ..., "payload": ...}} per line.
     */
    BatchResult ingestBatch(String rawKey, String ndjson);

    List<RemoteCommand> pollCommands(String rawKey, String host);

    RemoteCommand reportCommandResult(String rawKey, String host, String commandId, CommandStatus status, String detail);

    Optional<Instant> lastPostAt();
}
