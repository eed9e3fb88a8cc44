package io.fleetmesh.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.fleetmesh.error.AuthenticationFailureException;
import io.fleetmesh.model.CommandStatus;
import io.fleetmesh.model.RemoteCommand;
import io.fleetmesh.util.HttpSupport;
import io.fleetmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP contract for agents: {@code POST /ingest}, {@code GET /commands},
 * {@code POST /commands/result} and {@code GET /health}. Agents authenticate
 * with the {@code X-API-Key} header.
 */
public final class IngestEndpoint {
    private static final Logger log = LoggerFactory.getLogger(IngestEndpoint.class);
    public static final String API_KEY_HEADER = "X-API-Key";
    static final int BATCH_BODY_FACTOR = 16;

    private final IngestionService service;
    private final long payloadMaxBytes;

    public IngestEndpoint(IngestionService service, long payloadMaxBytes) {
        this.service = service;
        this.payloadMaxBytes = payloadMaxBytes;
    }

    public void mount(HttpServer server) {
        server.createContext("/ingest", exchange -> handle(exchange, this::ingest));
        server.createContext("/commands", exchange -> handle(exchange, this::pollCommands));
        server.createContext("/commands/result", exchange -> handle(exchange, this::commandResult));
        server.createContext("/health", exchange -> handle(exchange, this::health));
    }

    private void handle(HttpExchange exchange, Route route) throws IOException {
        try {
            route.handle(exchange);
        } catch (AuthenticationFailureException e) {
            log.info("Rejected agent request to {} from {}", exchange.getRequestURI().getPath(), exchange.getRemoteAddress());
            HttpSupport.writeError(exchange, e);
        } catch (RuntimeException e) {
            if (!(e instanceof IllegalArgumentException)) {
                log.error("Agent request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
            }
            HttpSupport.writeError(exchange, e);
        } finally {
            exchange.close();
        }
    }

    private void ingest(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) {
            return;
        }
        String contentType = Optional.ofNullable(HttpSupport.header(exchange, "Content-Type")).orElse("").toLowerCase(Locale.ROOT);
        boolean batch = contentType.contains("ndjson");
        String body = HttpSupport.readBody(exchange, batch ? payloadMaxBytes * BATCH_BODY_FACTOR : payloadMaxBytes);
        if (body == null) {
            HttpSupport.writeJson(exchange, Map.of("error", "payload_too_large"), 413);
            return;
        }
        String apiKey = apiKey(exchange);
        if (batch) {
            BatchResult result = service.ingestBatch(apiKey, body);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("processed", result.processed());
            out.put("stored", result.stored());
            out.put("duplicates", result.duplicates());
            List<Map<String, Object>> errors = new ArrayList<>();
            for (BatchResult.LineError error : result.errors()) {
                errors.add(Map.of("line", error.line(), "error", String.valueOf(error.error())));
            }
            out.put("errors", errors);
            HttpSupport.writeJson(exchange, out, result.httpStatus());
            return;
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed JSON body", e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("body must be a JSON object");
        }
        JsonNode payloadNode = node.get("payload");
        if (payloadNode == null || payloadNode.isNull()) {
            throw new IllegalArgumentException("payload is required");
        }
        String payload = payloadNode.isTextual() ? payloadNode.asText() : Jsons.toCompactJson(payloadNode);
        JsonNode docKeyNode = node.get("doc_key");
        String docKey = docKeyNode == null || docKeyNode.isNull() ? null : docKeyNode.asText();
        IngestResult result = service.ingest(apiKey, docKey, payload);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("stored", result.stored());
        out.put("message_id", result.messageId());
        HttpSupport.writeJson(exchange, out, 200);
    }

    private void pollCommands(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) {
            return;
        }
        String host = HttpSupport.parseQuery(exchange.getRequestURI()).get("host");
        List<RemoteCommand> commands = service.pollCommands(apiKey(exchange), host);
        List<Map<String, Object>> out = new ArrayList<>();
        for (RemoteCommand command : commands) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("command_id", command.commandId());
            row.put("action_type", command.actionType());
            row.put("payload", command.payload());
            row.put("source_job_id", command.sourceJobId());
            row.put("created_at_ms", command.createdAtMs());
            out.add(row);
        }
        HttpSupport.writeJson(exchange, Map.of("commands", out), 200);
    }

    private void commandResult(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "POST")) {
            return;
        }
        Map<String, String> params = HttpSupport.parseParams(exchange, payloadMaxBytes);
        RemoteCommand updated = service.reportCommandResult(
                apiKey(exchange),
                params.get("host"),
                params.get("command_id"),
                CommandStatus.fromString(params.get("status")),
                params.get("detail")
        );
        HttpSupport.writeJson(exchange, Map.of("command_id", updated.commandId(), "status", updated.status().name()), 200);
    }

    private void health(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) {
            return;
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "ok");
        out.put("last_post_at", service.lastPostAt().map(Instant::toString).orElse(null));
        HttpSupport.writeJson(exchange, out, 200);
    }

    private static String apiKey(HttpExchange exchange) {
        String key = HttpSupport.header(exchange, API_KEY_HEADER);
        return key != null ? key : HttpSupport.bearerToken(exchange);
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }
}
