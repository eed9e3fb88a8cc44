package io.fleetmesh.ingest;

/**
 * {@code stored == false} means the doc key was already present and
 * {@code messageId} names the original row.
 */
public record IngestResult(boolean stored, String messageId) {
}
