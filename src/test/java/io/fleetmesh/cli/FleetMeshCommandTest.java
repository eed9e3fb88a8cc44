package io.fleetmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleetmesh.config.FleetMeshConfig;
import io.fleetmesh.testing.Fixtures;
import io.fleetmesh.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

final class FleetMeshCommandTest {
    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Fixtures.tempRoot("cli");
        Files.writeString(root.resolve(FleetMeshConfig.SETTINGS_FILE_NAME), "{\"bcryptStrength\":4}", StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() throws Exception {
        Fixtures.deleteRecursively(root);
    }

    @Test
    void keyCommandsPrintJson() throws Exception {
        Assertions.assertEquals(0, run("init").code());

        Result generated = run("key-generate", "--name", "web-01", "--description", "edge");
        Assertions.assertEquals(0, generated.code());
        JsonNode key = Jsons.mapper().readTree(generated.out());
        Assertions.assertTrue(key.path("plainKey").asText().startsWith("fm_"));
        String credentialId = key.path("credential").path("credentialId").asText();

        JsonNode listed = Jsons.mapper().readTree(run("key-list").out());
        Assertions.assertEquals(1, listed.size());
        Assertions.assertFalse(listed.get(0).has("keyHash"));

        Assertions.assertEquals(0, run("key-revoke", "--id", credentialId).code());
        Assertions.assertNotEquals(0, run("key-revoke", "--id", credentialId).code());
    }

    @Test
    void jobAndLinkCommandsWork() throws Exception {
        Result created = run("job-create", "--name", "patch", "--action", "apt-upgrade", "--hosts", "web-01, web-02");
        Assertions.assertEquals(0, created.code());
        String jobId = Jsons.mapper().readTree(created.out()).path("jobId").asText();

        JsonNode swept = Jsons.mapper().readTree(run("sweep").out());
        Assertions.assertEquals(1, swept.path("sweep").path("completed").asInt());

        JsonNode commands = Jsons.mapper().readTree(run("command-list", "--job", jobId).out());
        Assertions.assertEquals(2, commands.size());

        Assertions.assertNotEquals(0, run("job-cancel", "--id", jobId).code());

        JsonNode link = Jsons.mapper().readTree(run("link-issue", "--ttl-seconds", "600").out());
        Assertions.assertTrue(link.path("path").asText().startsWith(AdminApi.DOWNLOAD_PREFIX));
        Result verified = run("audit-verify");
        Assertions.assertEquals(0, verified.code());
        JsonNode audit = Jsons.mapper().readTree(verified.out());
        Assertions.assertTrue(audit.path("verification").path("valid").asBoolean());
        Assertions.assertEquals(64, audit.path("head_hash").asText().length());
    }

    @Test
    void keyExpiryAndDeletion() throws Exception {
        Result generated = run("key-generate", "--name", "web-01", "--expires-at", "2999-01-01T00:00:00Z");
        Assertions.assertEquals(0, generated.code());
        JsonNode credential = Jsons.mapper().readTree(generated.out()).path("credential");
        String credentialId = credential.path("credentialId").asText();
        Assertions.assertFalse(credential.path("expiresAtMs").isNull());

        JsonNode cleared = Jsons.mapper().readTree(run("key-expire", "--id", credentialId).out());
        Assertions.assertTrue(cleared.path("expiresAtMs").isNull());
        Assertions.assertNotEquals(0, run("key-expire", "--id", credentialId, "--expires-at", "2001-01-01T00:00:00Z").code());

        Assertions.assertEquals(0, run("key-delete", "--id", credentialId).code());
        Assertions.assertEquals(0, Jsons.mapper().readTree(run("key-list").out()).size());
    }

    @Test
    void jobEditRescheduleAndDelete() throws Exception {
        Result created = run("job-create", "--name", "patch", "--action", "apt-upgrade",
                "--hosts", "web-01", "--run-at", "2999-01-01T00:00:00Z");
        String jobId = Jsons.mapper().readTree(created.out()).path("jobId").asText();

        JsonNode edited = Jsons.mapper().readTree(run("job-edit", "--id", jobId, "--name", "patch-all", "--recurrence", "weekly").out());
        Assertions.assertEquals("patch-all", edited.path("name").asText());
        Assertions.assertEquals("WEEKLY", edited.path("recurrence").asText());
        Assertions.assertNotEquals(0, run("job-edit", "--id", jobId).code());

        JsonNode moved = Jsons.mapper().readTree(run("job-reschedule", "--id", jobId, "--run-at", "2999-02-01T00:00:00Z").out());
        Assertions.assertEquals(Instant.parse("2999-02-01T00:00:00Z").toEpochMilli(), moved.path("runAtMs").asLong());

        Assertions.assertEquals(0, run("job-delete", "--id", jobId).code());
        Assertions.assertEquals(0, Jsons.mapper().readTree(run("job-list").out()).size());
    }

    @Test
    void commandCancelAndClear() throws Exception {
        Result queued = run("command-enqueue", "--host", "web-01", "--action", "restart");
        String commandId = Jsons.mapper().readTree(queued.out()).path("commandId").asText();
        run("command-enqueue", "--host", "web-01", "--action", "reload");

        JsonNode cancelled = Jsons.mapper().readTree(run("command-cancel", "--id", commandId).out());
        Assertions.assertEquals("CANCELLED", cancelled.path("status").asText());
        Assertions.assertNotEquals(0, run("command-cancel", "--id", commandId).code());

        JsonNode cleared = Jsons.mapper().readTree(run("command-clear", "--host", "web-01").out());
        Assertions.assertEquals(2, cleared.path("removed").asInt());
    }

    @Test
    void missingRequiredOptionIsUsageError() {
        Assertions.assertEquals(2, run("key-generate").code());
    }

    private Result run(String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new FleetMeshCommand()).execute(full);
            return new Result(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int code, String out) {
    }
}
