package io.fleetmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fleetmesh.security.SensitiveDataMasker;
import io.fleetmesh.util.Hashing;
import io.fleetmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only JSONL trail of security-relevant actions. Each row carries the
 * hash of the previous row and, when a signing secret is configured, an HMAC
 * of its own hash, so truncation, edits and forged rows show up in {@link #verify()}.
 * <p>
 * Several processes may append to the same file (a running server and one-shot
 * CLI commands). Appends take an exclusive file lock and link to the head that
 * is on disk at that moment.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final int TAIL_CHUNK_BYTES = 8192;
    private static final Map<Path, Object> FILE_MONITORS = new ConcurrentHashMap<>();

    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private final Object monitor;

    public AuditLogger(Path auditFile, String namespace, String signingSecret) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.monitor = FILE_MONITORS.computeIfAbsent(auditFile.toAbsolutePath().normalize(), k -> new Object());
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        synchronized (monitor) {
            try (FileChannel channel = FileChannel.open(auditFile,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                row.put("prev_hash", hashOf(lastLine(channel)));
                String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
                row.put("hash", rowHash);
                if (!signingSecret.isEmpty()) {
                    row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
                }
                ByteBuffer line = ByteBuffer.wrap((Jsons.toCompactJson(row) + "\n").getBytes(StandardCharsets.UTF_8));
                long position = channel.size();
                while (line.hasRemaining()) {
                    position += channel.write(line, position);
                }
                channel.force(false);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write audit log", e);
            }
        }
    }

    /**
     * Hash of the newest row on disk, or an empty string for an empty trail.
     */
    public String headHash() {
        synchronized (monitor) {
            try (FileChannel channel = FileChannel.open(auditFile, StandardOpenOption.READ)) {
                return hashOf(lastLine(channel));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read audit log", e);
            }
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Recomputes every row hash, checks each link to its predecessor and, with a
     * signing secret configured, checks every row signature.
     */
    public ChainVerification verify() {
        List<String> lines;
        synchronized (monitor) {
            try {
                lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read audit log", e);
            }
        }
        String expectedPrev = "";
        int rows = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            rows++;
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new ChainVerification(false, rows, "unparseable row " + rows);
            }
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return new ChainVerification(false, rows, "broken link at row " + rows);
            }
            ObjectNode body = node.deepCopy();
            String hash = body.path("hash").asText("");
            String signature = body.path("signature").asText("");
            body.remove("hash");
            body.remove("signature");
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(body)))) {
                return new ChainVerification(false, rows, "hash mismatch at row " + rows);
            }
            if (!signingSecret.isEmpty() && !constantTimeEquals(Hashing.hmacSha256Hex(signingSecret, hash), signature)) {
                return new ChainVerification(false, rows, "bad signature at row " + rows);
            }
            expectedPrev = hash;
        }
        return new ChainVerification(true, rows, "");
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }

    private String hashOf(String line) {
        if (line.isEmpty()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(line).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit chain head unreadable in {}, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    /**
     * Reads backwards from the end of the file until the last complete non-blank line.
     */
    static String lastLine(FileChannel channel) throws IOException {
        long position = channel.size();
        byte[] tail = new byte[0];
        while (position > 0) {
            int n = (int) Math.min(TAIL_CHUNK_BYTES, position);
            position -= n;
            ByteBuffer chunk = ByteBuffer.allocate(n);
            while (chunk.hasRemaining()) {
                if (channel.read(chunk, position + chunk.position()) < 0) {
                    break;
                }
            }
            byte[] merged = new byte[n + tail.length];
            System.arraycopy(chunk.array(), 0, merged, 0, n);
            System.arraycopy(tail, 0, merged, n, tail.length);
            tail = merged;
            String text = new String(tail, StandardCharsets.UTF_8).stripTrailing();
            int newline = text.lastIndexOf('\n');
            if (newline >= 0) {
                return text.substring(newline + 1).trim();
            }
        }
        return new String(tail, StandardCharsets.UTF_8).trim();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(SensitiveDataMasker.masked(node), Map.class);
    }

    public record ChainVerification(boolean valid, int rows, String problem) {
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor == null || actor.isBlank() ? "system" : actor.trim(), resource, result,
                    details == null ? Map.of() : details);
        }
    }
}
