package io.fleetmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import io.fleetmesh.ingest.EmbeddedIngestHost;
import io.fleetmesh.ingest.IngestEndpoint;
import io.fleetmesh.runtime.FleetMeshRuntime;
import io.fleetmesh.security.AuthFilePrincipalDirectory;
import io.fleetmesh.testing.Fixtures;
import io.fleetmesh.testing.MutableClock;
import io.fleetmesh.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

final class AdminApiTest {
    private static final String ADMIN_TOKEN = "tok-admin";
    private static final String READER_TOKEN = "tok-reader";

    private Path root;
    private MutableClock clock;
    private FleetMeshRuntime runtime;
    private HttpServer server;
    private HttpClient client;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        root = Fixtures.tempRoot("admin-api");
        Path authFile = root.resolve("auth.json");
        Files.writeString(authFile, """
                {"principals":[
                  {"id":"alice","name":"Alice","role":"admin","tokens":["tok-admin"]},
                  {"id":"bob","role":"reader","tokens":["tok-reader"]}
                ]}
                """, StandardCharsets.UTF_8);
        clock = new MutableClock(Instant.parse("2026-10-01T00:00:00Z"));
        runtime = Fixtures.runtime(root, clock, AuthFilePrincipalDirectory.load(authFile.toString()));
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        new AdminApi(runtime).mount(server);
        new EmbeddedIngestHost(runtime.ingestEndpoint()).attach(server);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.stop(0);
        runtime.close();
        Fixtures.deleteRecursively(root);
    }

    @Test
    void callersNeedKnownTokensAndWritesNeedAdmin() throws Exception {
        Assertions.assertEquals(401, get("/api/keys", null).statusCode());
        Assertions.assertEquals(403, get("/api/keys", "tok-unknown").statusCode());
        Assertions.assertEquals(200, get("/api/keys", READER_TOKEN).statusCode());

        HttpResponse<String> denied = post("/api/keys/generate", "{\"name\":\"web-01\"}", READER_TOKEN);
        Assertions.assertEquals(403, denied.statusCode());
        Assertions.assertEquals("forbidden_write", Jsons.mapper().readTree(denied.body()).path("error").asText());
        Assertions.assertEquals(405, get("/api/keys/generate", ADMIN_TOKEN).statusCode());
    }

    @Test
    void generatedKeyWorksOnEmbeddedIngest() throws Exception {
        HttpResponse<String> generated = post("/api/keys/generate", "{\"name\":\"web-01\",\"default_principal\":\"bob\"}", ADMIN_TOKEN);
        Assertions.assertEquals(200, generated.statusCode());
        JsonNode body = Jsons.mapper().readTree(generated.body());
        String plainKey = body.path("plainKey").asText();
        String credentialId = body.path("credential").path("credentialId").asText();
        Assertions.assertTrue(plainKey.startsWith("fm_"));

        HttpRequest ingest = HttpRequest.newBuilder(URI.create(baseUrl + "/ingest"))
                .header(IngestEndpoint.API_KEY_HEADER, plainKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{\"doc_key\":\"d1\",\"payload\":{}}"))
                .build();
        Assertions.assertEquals(200, client.send(ingest, HttpResponse.BodyHandlers.ofString()).statusCode());

        Assertions.assertEquals(200, post("/api/keys/revoke", "{\"credential_id\":\"" + credentialId + "\"}", ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(409, post("/api/keys/revoke", "{\"credential_id\":\"" + credentialId + "\"}", ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(404, post("/api/keys/revoke", "{\"credential_id\":\"cred_missing\"}", ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(401, client.send(ingest, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void jobsCanBeCreatedSweptAndInspected() throws Exception {
        String create = "{\"name\":\"patch\",\"action_type\":\"apt-upgrade\",\"run_at\":\"2026-10-01T00:00:00Z\","
                + "\"recurrence\":\"daily\",\"target_hosts\":[\"web-01\",\"web-02\"],\"payload\":{\"reboot\":false}}";
        HttpResponse<String> created = post("/api/jobs/create", create, ADMIN_TOKEN);
        Assertions.assertEquals(200, created.statusCode());
        String jobId = Jsons.mapper().readTree(created.body()).path("jobId").asText();

        JsonNode sweep = Jsons.mapper().readTree(post("/api/jobs/sweep", "", ADMIN_TOKEN).body());
        Assertions.assertEquals(1, sweep.path("rearmed").asInt());
        Assertions.assertEquals(2, sweep.path("commandsEnqueued").asInt());

        JsonNode detail = Jsons.mapper().readTree(get("/api/jobs?job_id=" + jobId, READER_TOKEN).body());
        Assertions.assertEquals("SCHEDULED", detail.path("job").path("status").asText());
        Assertions.assertEquals(2, detail.path("commands").size());

        JsonNode commands = Jsons.mapper().readTree(get("/api/commands?host=web-01", READER_TOKEN).body());
        Assertions.assertEquals(1, commands.path("commands").size());

        Assertions.assertEquals(200, post("/api/jobs/cancel", "job_id=" + jobId, ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(409, post("/api/jobs/cancel", "job_id=" + jobId, ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(400, post("/api/jobs/create", "{\"name\":\"bad\",\"action_type\":\"x\",\"target_hosts\":\"\"}", ADMIN_TOKEN).statusCode());
    }

    @Test
    void commandsCanBeEnqueuedAndExpired() throws Exception {
        HttpResponse<String> queued = post("/api/commands/enqueue", "{\"host\":\"web-01\",\"action_type\":\"restart\"}", ADMIN_TOKEN);
        Assertions.assertEquals(200, queued.statusCode());
        clock.advance(Duration.ofHours(2));

        JsonNode expired = Jsons.mapper().readTree(post("/api/commands/expire", "{\"ttl_ms\":3600000}", ADMIN_TOKEN).body());
        Assertions.assertEquals(1, expired.path("expired").asInt());
        JsonNode list = Jsons.mapper().readTree(get("/api/commands?status=EXPIRED", READER_TOKEN).body());
        Assertions.assertEquals(1, list.path("commands").size());
    }

    @Test
    void keysCanBeGivenAnExpiryAndDeleted() throws Exception {
        HttpResponse<String> generated = post("/api/keys/generate",
                "{\"name\":\"web-01\",\"expires_at\":\"2026-10-02T00:00:00Z\"}", ADMIN_TOKEN);
        Assertions.assertEquals(200, generated.statusCode());
        JsonNode body = Jsons.mapper().readTree(generated.body());
        String credentialId = body.path("credential").path("credentialId").asText();
        Assertions.assertEquals(Instant.parse("2026-10-02T00:00:00Z").toEpochMilli(),
                body.path("credential").path("expiresAtMs").asLong());

        String id = "\"credential_id\":\"" + credentialId + "\"";
        Assertions.assertEquals(400, post("/api/keys/expiry", "{" + id + ",\"expires_at\":\"2026-09-01T00:00:00Z\"}", ADMIN_TOKEN).statusCode());
        JsonNode cleared = Jsons.mapper().readTree(post("/api/keys/expiry", "{" + id + "}", ADMIN_TOKEN).body());
        Assertions.assertTrue(cleared.path("expiresAtMs").isNull());

        Assertions.assertEquals(200, post("/api/keys/delete", "{" + id + "}", ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(404, post("/api/keys/delete", "{" + id + "}", ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(403, post("/api/keys/delete", "{" + id + "}", READER_TOKEN).statusCode());
    }

    @Test
    void jobsCanBeEditedRescheduledAndDeleted() throws Exception {
        String create = "{\"name\":\"patch\",\"action_type\":\"apt-upgrade\",\"run_at\":\"2026-10-05T00:00:00Z\","
                + "\"target_hosts\":[\"web-01\"]}";
        String jobId = Jsons.mapper().readTree(post("/api/jobs/create", create, ADMIN_TOKEN).body()).path("jobId").asText();

        JsonNode edited = Jsons.mapper().readTree(post("/api/jobs/update",
                "{\"job_id\":\"" + jobId + "\",\"name\":\"patch-all\",\"target_hosts\":\"web-01,web-02\"}", ADMIN_TOKEN).body());
        Assertions.assertEquals("patch-all", edited.path("name").asText());
        Assertions.assertEquals(2, edited.path("targetHosts").size());
        Assertions.assertEquals(400, post("/api/jobs/update", "{\"job_id\":\"" + jobId + "\"}", ADMIN_TOKEN).statusCode());

        JsonNode moved = Jsons.mapper().readTree(post("/api/jobs/reschedule",
                "{\"job_id\":\"" + jobId + "\",\"run_at\":\"2026-10-01T00:00:00Z\"}", ADMIN_TOKEN).body());
        Assertions.assertEquals(Instant.parse("2026-10-01T00:00:00Z").toEpochMilli(), moved.path("runAtMs").asLong());

        post("/api/jobs/sweep", "", ADMIN_TOKEN);
        HttpResponse<String> late = post("/api/jobs/reschedule",
                "{\"job_id\":\"" + jobId + "\",\"run_at\":\"2026-10-09T00:00:00Z\"}", ADMIN_TOKEN);
        Assertions.assertEquals(409, late.statusCode());
        Assertions.assertEquals("terminal_state", Jsons.mapper().readTree(late.body()).path("error").asText());

        Assertions.assertEquals(200, post("/api/jobs/delete", "job_id=" + jobId, ADMIN_TOKEN).statusCode());
        JsonNode detail = Jsons.mapper().readTree(get("/api/commands?job_id=" + jobId, READER_TOKEN).body());
        Assertions.assertEquals(2, detail.path("commands").size());
    }

    @Test
    void commandsCanBeCancelledAndCleared() throws Exception {
        String first = Jsons.mapper().readTree(post("/api/commands/enqueue",
                "{\"host\":\"web-01\",\"action_type\":\"restart\"}", ADMIN_TOKEN).body()).path("commandId").asText();
        post("/api/commands/enqueue", "{\"host\":\"web-01\",\"action_type\":\"reload\"}", ADMIN_TOKEN);

        JsonNode cancelled = Jsons.mapper().readTree(post("/api/commands/cancel", "command_id=" + first, ADMIN_TOKEN).body());
        Assertions.assertEquals("CANCELLED", cancelled.path("status").asText());
        Assertions.assertEquals("cancelled by alice", cancelled.path("detail").asText());
        Assertions.assertEquals(409, post("/api/commands/cancel", "command_id=" + first, ADMIN_TOKEN).statusCode());

        JsonNode cleared = Jsons.mapper().readTree(post("/api/commands/clear", "host=web-01", ADMIN_TOKEN).body());
        Assertions.assertEquals(2, cleared.path("removed").asInt());
        Assertions.assertEquals(0, Jsons.mapper().readTree(get("/api/commands?host=web-01", READER_TOKEN).body()).path("commands").size());
    }

    @Test
    void downloadLinksGateTheInstaller() throws Exception {
        Path installer = runtime.installerFile();
        Files.createDirectories(installer.getParent());
        Files.write(installer, new byte[]{1, 2, 3, 4});

        JsonNode issued = Jsons.mapper().readTree(
                post("/api/links/issue", "{\"ttl_seconds\":\"3600\",\"visibility\":\"restricted\"}", ADMIN_TOKEN).body());
        String path = issued.path("path").asText();
        String linkId = issued.path("link").path("linkId").asText();

        Assertions.assertEquals(401, download(path, null).statusCode());
        HttpResponse<byte[]> granted = download(path, READER_TOKEN);
        Assertions.assertEquals(200, granted.statusCode());
        Assertions.assertArrayEquals(new byte[]{1, 2, 3, 4}, granted.body());

        Assertions.assertEquals(200, post("/api/links/revoke", "{\"link_id\":\"" + linkId + "\"}", ADMIN_TOKEN).statusCode());
        Assertions.assertEquals(410, download(path, READER_TOKEN).statusCode());
        Assertions.assertEquals(404, download(AdminApi.DOWNLOAD_PREFIX + "unknown", null).statusCode());

        JsonNode expired = Jsons.mapper().readTree(
                post("/api/links/issue", "{\"ttl_seconds\":\"0\"}", ADMIN_TOKEN).body());
        Assertions.assertEquals(410, download(expired.path("path").asText(), null).statusCode());

        JsonNode purged = Jsons.mapper().readTree(post("/api/links/purge", "", ADMIN_TOKEN).body());
        Assertions.assertEquals(2, purged.path("removed").asInt());
    }

    private HttpResponse<String> get(String path, String token) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET();
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body, String token) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (body.startsWith("{")) {
            request.header("Content-Type", "application/json");
        } else {
            request.header("Content-Type", "application/x-www-form-urlencoded");
        }
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<byte[]> download(String path, String token) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET();
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
    }
}
