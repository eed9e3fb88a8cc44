package io.fleetmesh.cli;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.fleetmesh.config.FleetMeshConfig;
import io.fleetmesh.error.AuthenticationFailureException;
import io.fleetmesh.links.LinkAccess;
import io.fleetmesh.model.CommandStatus;
import io.fleetmesh.model.DownloadLink;
import io.fleetmesh.model.JobStatus;
import io.fleetmesh.model.LinkVisibility;
import io.fleetmesh.model.Principal;
import io.fleetmesh.model.Recurrence;
import io.fleetmesh.model.RemoteCommand;
import io.fleetmesh.model.ScheduledJob;
import io.fleetmesh.runtime.FleetMeshRuntime;
import io.fleetmesh.scheduler.SweepOutcome;
import io.fleetmesh.security.AgentKeyRegistry;
import io.fleetmesh.util.HttpSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator-facing HTTP API served by {@code fleetmesh serve}.
 *
 * <p>Callers present a bearer token from the auth file. Reads need any known
 * principal, writes need an admin one. With no principals configured the API
 * runs open and every call acts as {@link #BYPASS_PRINCIPAL}.
 */
public final class AdminApi {
    private static final Logger log = LoggerFactory.getLogger(AdminApi.class);
    static final String BYPASS_PRINCIPAL = "principal:bypass";
    static final String DOWNLOAD_PREFIX = "/agent/download/";
    private static final int DEFAULT_LIST_LIMIT = 100;

    private final FleetMeshRuntime runtime;

    public AdminApi(FleetMeshRuntime runtime) {
        this.runtime = runtime;
    }

    public void mount(HttpServer server) {
        server.createContext("/api/keys", exchange -> handle(exchange, false, this::listKeys));
        server.createContext("/api/keys/generate", exchange -> handle(exchange, true, this::generateKey));
        server.createContext("/api/keys/revoke", exchange -> handle(exchange, true, this::revokeKey));
        server.createContext("/api/keys/rotate", exchange -> handle(exchange, true, this::rotateKey));
        server.createContext("/api/keys/expiry", exchange -> handle(exchange, true, this::expireKey));
        server.createContext("/api/keys/delete", exchange -> handle(exchange, true, this::deleteKey));
        server.createContext("/api/jobs", exchange -> handle(exchange, false, this::listJobs));
        server.createContext("/api/jobs/create", exchange -> handle(exchange, true, this::createJob));
        server.createContext("/api/jobs/update", exchange -> handle(exchange, true, this::updateJob));
        server.createContext("/api/jobs/reschedule", exchange -> handle(exchange, true, this::rescheduleJob));
        server.createContext("/api/jobs/cancel", exchange -> handle(exchange, true, this::cancelJob));
        server.createContext("/api/jobs/delete", exchange -> handle(exchange, true, this::deleteJob));
        server.createContext("/api/jobs/sweep", exchange -> handle(exchange, true, this::sweep));
        server.createContext("/api/commands", exchange -> handle(exchange, false, this::listCommands));
        server.createContext("/api/commands/enqueue", exchange -> handle(exchange, true, this::enqueueCommand));
        server.createContext("/api/commands/expire", exchange -> handle(exchange, true, this::expireCommands));
        server.createContext("/api/commands/cancel", exchange -> handle(exchange, true, this::cancelCommand));
        server.createContext("/api/commands/clear", exchange -> handle(exchange, true, this::clearCommands));
        server.createContext("/api/links", exchange -> handle(exchange, false, this::listLinks));
        server.createContext("/api/links/issue", exchange -> handle(exchange, true, this::issueLink));
        server.createContext("/api/links/revoke", exchange -> handle(exchange, true, this::revokeLink));
        server.createContext("/api/links/purge", exchange -> handle(exchange, true, this::purgeLinks));
        server.createContext(DOWNLOAD_PREFIX, exchange -> {
            try {
                download(exchange);
            } catch (RuntimeException e) {
                log.error("Installer download {} failed", exchange.getRequestURI().getPath(), e);
                HttpSupport.writeError(exchange, e);
            } finally {
                exchange.close();
            }
        });
    }

    private void handle(HttpExchange exchange, boolean write, Route route) throws IOException {
        try {
            if (!HttpSupport.allowMethods(exchange, write ? "POST" : "GET")) {
                return;
            }
            Principal principal = authorize(exchange, write);
            if (principal == null) {
                return;
            }
            route.handle(exchange, principal);
        } catch (AuthenticationFailureException e) {
            HttpSupport.writeError(exchange, e);
        } catch (RuntimeException e) {
            if (!(e instanceof IllegalArgumentException)) {
                log.error("Admin request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
            }
            HttpSupport.writeError(exchange, e);
        } finally {
            exchange.close();
        }
    }

    /**
     * Resolves the caller, or writes 401/403 and returns null.
     */
    private Principal authorize(HttpExchange exchange, boolean write) throws IOException {
        if (!runtime.principals().enabled()) {
            return new Principal(BYPASS_PRINCIPAL, "bypass", true);
        }
        String token = HttpSupport.bearerToken(exchange);
        if (token == null) {
            HttpSupport.writeJson(exchange, Map.of("error", "missing_token"), 401);
            return null;
        }
        Optional<Principal> principal = runtime.principals().resolveToken(token);
        if (principal.isEmpty()) {
            HttpSupport.writeJson(exchange, Map.of("error", "forbidden_token"), 403);
            return null;
        }
        if (write && !principal.get().admin()) {
            HttpSupport.writeJson(exchange, Map.of("error", "forbidden_write", "principal", principal.get().id()), 403);
            return null;
        }
        return principal.get();
    }

    private void listKeys(HttpExchange exchange, Principal principal) throws IOException {
        HttpSupport.writeJson(exchange, Map.of("keys", runtime.keys().list()), 200);
    }

    private void generateKey(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        AgentKeyRegistry.GeneratedKey key = runtime.keys().generate(
                params.get("name"),
                params.get("description"),
                Inputs.blankToNull(params.get("default_principal")),
                Inputs.parseInstant(params.get("expires_at"), null),
                principal.id()
        );
        HttpSupport.writeJson(exchange, key, 200);
    }

    private void revokeKey(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        HttpSupport.writeJson(exchange, runtime.keys().revoke(params.get("credential_id"), principal.id()), 200);
    }

    private void rotateKey(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        HttpSupport.writeJson(exchange, runtime.keys().rotate(params.get("credential_id"), principal.id()), 200);
    }

    private void expireKey(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        HttpSupport.writeJson(exchange, runtime.keys().setExpiry(
                params.get("credential_id"), Inputs.parseInstant(params.get("expires_at"), null), principal.id()), 200);
    }

    private void deleteKey(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        HttpSupport.writeJson(exchange, runtime.keys().delete(params.get("credential_id"), principal.id()), 200);
    }

    private void listJobs(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> query = HttpSupport.parseQuery(exchange.getRequestURI());
        String jobId = Inputs.blankToNull(query.get("job_id"));
        if (jobId != null) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("job", runtime.scheduler().find(jobId).orElse(null));
            out.put("commands", runtime.scheduler().commandsFor(jobId));
            HttpSupport.writeJson(exchange, out, 200);
            return;
        }
        String status = Inputs.blankToNull(query.get("status"));
        List<ScheduledJob> jobs = runtime.scheduler().list(
                status == null ? null : JobStatus.fromString(status),
                HttpSupport.parseIntOrDefault(query.get("limit"), DEFAULT_LIST_LIMIT)
        );
        HttpSupport.writeJson(exchange, Map.of("jobs", jobs), 200);
    }

    private void createJob(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        ScheduledJob job = runtime.scheduler().create(
                params.get("name"),
                params.get("action_type"),
                Inputs.parseInstant(params.get("run_at"), runtime.clock().instant()),
                Recurrence.fromString(params.get("recurrence")),
                Inputs.parseHosts(params.get("target_hosts")),
                params.get("payload"),
                principal.id()
        );
        HttpSupport.writeJson(exchange, job, 200);
    }

    private void updateJob(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        ScheduledJob job = runtime.scheduler().edit(
                params.get("job_id"),
                Inputs.parseJobEdit(
                        params.get("name"),
                        params.get("run_at"),
                        params.get("recurrence"),
                        params.get("target_hosts"),
                        params.get("payload")
                ),
                principal.id()
        );
        HttpSupport.writeJson(exchange, job, 200);
    }

    private void rescheduleJob(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        HttpSupport.writeJson(exchange, runtime.scheduler().reschedule(
                params.get("job_id"), Inputs.parseInstant(params.get("run_at"), null), principal.id()), 200);
    }

    private void cancelJob(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        HttpSupport.writeJson(exchange, runtime.scheduler().cancel(params.get("job_id"), principal.id()), 200);
    }

    private void deleteJob(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        HttpSupport.writeJson(exchange, runtime.scheduler().delete(params.get("job_id"), principal.id()), 200);
    }

    private void sweep(HttpExchange exchange, Principal principal) throws IOException {
        SweepOutcome outcome = runtime.scheduler().sweep(runtime.clock().instant());
        HttpSupport.writeJson(exchange, outcome, 200);
    }

    private void listCommands(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> query = HttpSupport.parseQuery(exchange.getRequestURI());
        String status = Inputs.blankToNull(query.get("status"));
        CommandStatus filter = status == null ? null : CommandStatus.fromString(status);
        String host = Inputs.blankToNull(query.get("host"));
        String jobId = Inputs.blankToNull(query.get("job_id"));
        List<RemoteCommand> commands;
        if (jobId != null) {
            commands = runtime.dispatcher().bySourceJob(jobId);
        } else if (host != null) {
            commands = runtime.dispatcher().forHost(host, filter);
        } else {
            commands = runtime.dispatcher().list(filter, HttpSupport.parseIntOrDefault(query.get("limit"), DEFAULT_LIST_LIMIT));
        }
        HttpSupport.writeJson(exchange, Map.of("commands", commands), 200);
    }

    private void enqueueCommand(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        RemoteCommand command = runtime.dispatcher().enqueue(params.get("host"), params.get("action_type"), params.get("payload"));
        log.info("Principal {} enqueued command {} for {}", principal.id(), command.commandId(), command.targetHost());
        HttpSupport.writeJson(exchange, command, 200);
    }

    private void expireCommands(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        String rawTtl = Inputs.blankToNull(params.get("ttl_ms"));
        Duration ttl = Duration.ofMillis(rawTtl == null ? runtime.settings().commandTtlMs() : parseLong(rawTtl, "ttl_ms"));
        int expired = runtime.dispatcher().expire(runtime.clock().millis(), ttl);
        HttpSupport.writeJson(exchange, Map.of("expired", expired, "ttl_ms", ttl.toMillis()), 200);
    }

    private void cancelCommand(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        HttpSupport.writeJson(exchange, runtime.dispatcher().cancel(params.get("command_id"), principal.id()), 200);
    }

    private void clearCommands(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        String host = params.get("host");
        int removed = runtime.dispatcher().clearForHost(host);
        log.info("Principal {} cleared {} commands for {}", principal.id(), removed, host);
        HttpSupport.writeJson(exchange, Map.of("removed", removed), 200);
    }

    private void listLinks(HttpExchange exchange, Principal principal) throws IOException {
        HttpSupport.writeJson(exchange, Map.of("links", runtime.links().list()), 200);
    }

    private void issueLink(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        DownloadLink link = runtime.links().issue(
                principal.id(),
                Inputs.parseTtlSeconds(params.get("ttl_seconds")),
                LinkVisibility.fromString(params.get("visibility"))
        );
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("link", link);
        out.put("path", DOWNLOAD_PREFIX + link.token());
        HttpSupport.writeJson(exchange, out, 200);
    }

    private void revokeLink(HttpExchange exchange, Principal principal) throws IOException {
        Map<String, String> params = params(exchange);
        HttpSupport.writeJson(exchange, runtime.links().revoke(params.get("link_id"), principal.id()), 200);
    }

    private void purgeLinks(HttpExchange exchange, Principal principal) throws IOException {
        params(exchange);
        HttpSupport.writeJson(exchange, Map.of("removed", runtime.links().purgeAll(principal.id())), 200);
    }

    private void download(HttpExchange exchange) throws IOException {
        if (!HttpSupport.allowMethods(exchange, "GET")) {
            return;
        }
        String token = exchange.getRequestURI().getPath().substring(DOWNLOAD_PREFIX.length());
        String bearer = HttpSupport.bearerToken(exchange);
        Principal principal = bearer == null ? null : runtime.principals().resolveToken(bearer).orElse(null);
        LinkAccess access = runtime.links().authorize(token, principal);
        switch (access) {
            case NOT_FOUND -> HttpSupport.writeJson(exchange, Map.of("error", "not_found"), 404);
            case INACTIVE -> HttpSupport.writeJson(exchange, Map.of("error", "link_inactive"), 410);
            case LOGIN_REQUIRED -> HttpSupport.writeJson(exchange, Map.of("error", "login_required"), 401);
            case GRANTED -> streamInstaller(exchange);
            default -> throw new IllegalStateException("unhandled link access: " + access);
        }
    }

    private void streamInstaller(HttpExchange exchange) throws IOException {
        Path installer = runtime.installerFile();
        if (!Files.isRegularFile(installer)) {
            log.warn("Installer file missing: {}", installer);
            HttpSupport.writeJson(exchange, Map.of("error", "installer_unavailable"), 503);
            return;
        }
        exchange.getResponseHeaders().set("Content-Type", "application/octet-stream");
        exchange.getResponseHeaders().set(
                "Content-Disposition", "attachment; filename=\"" + installer.getFileName() + "\"");
        exchange.sendResponseHeaders(200, Files.size(installer));
        try (InputStream in = Files.newInputStream(installer); OutputStream os = exchange.getResponseBody()) {
            in.transferTo(os);
        }
    }

    private static Map<String, String> params(HttpExchange exchange) throws IOException {
        return HttpSupport.parseParams(exchange, FleetMeshConfig.DEFAULT_PAYLOAD_MAX_BYTES);
    }

    private static long parseLong(String raw, String field) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be an integer: " + raw, e);
        }
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange, Principal principal) throws IOException;
    }
}
