package io.fleetmesh.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import io.fleetmesh.error.AuthenticationFailureException;
import io.fleetmesh.error.IllegalTransitionException;
import io.fleetmesh.error.NotFoundException;
import io.fleetmesh.error.StoreException;
import io.fleetmesh.error.TerminalStateViolationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Request parsing and JSON responses for the JDK {@code HttpServer} handlers.
 */
public final class HttpSupport {
    private HttpSupport() {
    }

    public static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    /**
     * Maps domain exceptions onto status codes and writes the error body.
     */
    public static void writeError(HttpExchange exchange, Exception e) throws IOException {
        if (e instanceof AuthenticationFailureException) {
            writeJson(exchange, Map.of("error", "authentication_failed"), 401);
        } else if (e instanceof TerminalStateViolationException tsv) {
            writeJson(exchange, Map.of("error", "terminal_state", "state", tsv.currentState(), "message", tsv.getMessage()), 409);
        } else if (e instanceof IllegalTransitionException ite) {
            writeJson(exchange, Map.of("error", "illegal_transition", "state", ite.currentState(), "message", ite.getMessage()), 409);
        } else if (e instanceof NotFoundException) {
            writeJson(exchange, Map.of("error", "not_found", "message", e.getMessage()), 404);
        } else if (e instanceof IllegalArgumentException) {
            writeJson(exchange, Map.of("error", "bad_request", "message", String.valueOf(e.getMessage())), 400);
        } else if (e instanceof StoreException) {
            writeJson(exchange, Map.of("error", "store_unavailable", "retryable", true), 503);
        } else {
            writeJson(exchange, Map.of("error", "internal_error"), 500);
        }
    }

    public static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", String.valueOf(method)), 405);
        return false;
    }

    /**
     * Reads at most {@code maxBytes}; a larger body yields {@code null}.
     */
    public static String readBody(HttpExchange exchange, long maxBytes) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] raw = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, maxBytes + 1));
            if (raw.length > maxBytes) {
                return null;
            }
            return new String(raw, StandardCharsets.UTF_8);
        }
    }

    /**
     * Query string merged with a JSON object or form-encoded body.
     */
    public static Map<String, String> parseParams(HttpExchange exchange, long maxBytes) throws IOException {
        Map<String, String> out = new LinkedHashMap<>(parseQuery(exchange.getRequestURI()));
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            return out;
        }
        String body = readBody(exchange, maxBytes);
        if (body == null) {
            throw new IllegalArgumentException("request body exceeds " + maxBytes + " bytes");
        }
        body = body.trim();
        if (body.isEmpty()) {
            return out;
        }
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        String normalized = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (normalized.contains("application/json") || body.startsWith("{")) {
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(body);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("malformed JSON body", e);
            }
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("JSON body must be an object");
            }
            node.fieldNames().forEachRemaining(key -> {
                JsonNode value = node.path(key);
                if (value.isNull()) {
                    out.put(key, "");
                } else if (value.isValueNode()) {
                    out.put(key, value.asText());
                } else {
                    out.put(key, value.toString());
                }
            });
            return out;
        }
        out.putAll(parseQueryString(body));
        return out;
    }

    public static Map<String, String> parseQuery(URI uri) {
        return parseQueryString(uri.getRawQuery());
    }

    static Map<String, String> parseQueryString(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }

    public static String bearerToken(HttpExchange exchange) {
        String authz = exchange.getRequestHeaders().getFirst("Authorization");
        if (authz != null && authz.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = authz.substring(7).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        return null;
    }

    public static String header(HttpExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static int parseIntOrDefault(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
