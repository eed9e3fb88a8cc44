package io.fleetmesh.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.fleetmesh.dispatch.CommandDispatcher;
import io.fleetmesh.model.CommandStatus;
import io.fleetmesh.model.Credential;
import io.fleetmesh.model.RemoteCommand;
import io.fleetmesh.security.AgentKeyRegistry;
import io.fleetmesh.storage.MessageStore;
import io.fleetmesh.util.Jsons;
import io.fleetmesh.util.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class DefaultIngestionService implements IngestionService {
    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);

    private final AgentKeyRegistry keys;
    private final MessageStore messages;
    private final CommandDispatcher dispatcher;
    private final Clock clock;
    private final long payloadMaxBytes;

    public DefaultIngestionService(
            AgentKeyRegistry keys,
            MessageStore messages,
            CommandDispatcher dispatcher,
            Clock clock,
            long payloadMaxBytes
    ) {
        this.keys = keys;
        this.messages = messages;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.payloadMaxBytes = payloadMaxBytes;
    }

    @Override
    public IngestResult ingest(Credential credential, String docKey, String payload) {
        if (credential == null) {
            throw new IllegalArgumentException("credential is required");
        }
        String body = requirePayload(payload);
        String key = docKey == null || docKey.isBlank() ? null : docKey.trim();
        MessageStore.InsertOutcome outcome = messages.insertIfAbsent(
                Tokens.newId("msg"), key, body, credential.credentialId(), credential.prefix(), clock.millis());
        if (!outcome.stored()) {
            log.debug("Duplicate doc_key {} from {}, kept {}", key, credential.credentialId(), outcome.messageId());
        }
        return new IngestResult(outcome.stored(), outcome.messageId());
    }

    @Override
    public IngestResult ingest(String rawKey, String docKey, String payload) {
        Credential credential = keys.authenticate(rawKey);
        return ingest(credential, docKey, payload);
    }

    @Override
    public BatchResult ingestBatch(String rawKey, String ndjson) {
        Credential credential = keys.authenticate(rawKey);
        if (ndjson == null || ndjson.isBlank()) {
            throw new IllegalArgumentException("batch is empty");
        }
        int processed = 0;
        int stored = 0;
        int duplicates = 0;
        List<BatchResult.LineError> errors = new ArrayList<>();
        String[] lines = ndjson == null ? new String[0] : ndjson.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            int lineNo = i + 1;
            try {
                JsonNode node = Jsons.mapper().readTree(line);
                if (node == null || !node.isObject()) {
                    errors.add(new BatchResult.LineError(lineNo, "line is not a JSON object"));
                    continue;
                }
                JsonNode payloadNode = node.get("payload");
                if (payloadNode == null || payloadNode.isNull()) {
                    errors.add(new BatchResult.LineError(lineNo, "payload is required"));
                    continue;
                }
                String payload = payloadNode.isTextual() ? payloadNode.asText() : Jsons.toCompactJson(payloadNode);
                JsonNode docKeyNode = node.get("doc_key");
                String docKey = docKeyNode == null || docKeyNode.isNull() ? null : docKeyNode.asText();
                IngestResult result = ingest(credential, docKey, payload);
                processed++;
                if (result.stored()) {
                    stored++;
                } else {
                    duplicates++;
                }
            } catch (JsonProcessingException e) {
                errors.add(new BatchResult.LineError(lineNo, "malformed JSON"));
            } catch (IllegalArgumentException e) {
                errors.add(new BatchResult.LineError(lineNo, e.getMessage()));
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Batch from {}: {} processed, {} rejected lines", credential.credentialId(), processed, errors.size());
        }
        return new BatchResult(processed, stored, duplicates, errors);
    }

    @Override
    public List<RemoteCommand> pollCommands(String rawKey, String host) {
        keys.authenticate(rawKey);
        List<RemoteCommand> claimed = dispatcher.claimPendingForHost(host, 0);
        if (!claimed.isEmpty()) {
            log.info("Handed {} commands to {}", claimed.size(), host);
        }
        return claimed;
    }

    @Override
    public RemoteCommand reportCommandResult(String rawKey, String host, String commandId, CommandStatus status, String detail) {
        keys.authenticate(rawKey);
        return dispatcher.reportResult(host, commandId, status, detail);
    }

    @Override
    public Optional<Instant> lastPostAt() {
        return messages.lastReceivedAtMs().map(Instant::ofEpochMilli);
    }

    private String requirePayload(String payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
        if (payload.getBytes(StandardCharsets.UTF_8).length > payloadMaxBytes) {
            throw new IllegalArgumentException("payload exceeds " + payloadMaxBytes + " bytes");
        }
        return payload;
    }
}
