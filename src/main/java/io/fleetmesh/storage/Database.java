package io.fleetmesh.storage;

import io.fleetmesh.config.FleetMeshConfig;
import io.fleetmesh.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Owns the SQLite file for one namespace: directories, schema, migrations and
 * per-connection settings.
 *
 * <p>Every connection is opened with a busy timeout, foreign keys on and
 * {@code BEGIN IMMEDIATE} transactions, so two writers never both read a row
 * and then race to upgrade their lock.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "fleetmesh.schema.migration.v1";
    static final int BUSY_TIMEOUT_MS = 10_000;

    private final FleetMeshConfig config;
    private final String jdbcUrl;

    public Database(FleetMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public String namespace() {
        return config.namespace();
    }

    public FleetMeshConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        props.setProperty("foreign_keys", "true");
        props.setProperty("transaction_mode", "IMMEDIATE");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new StoreException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS credentials (
                        credential_id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        description TEXT NOT NULL DEFAULT '',
                        prefix TEXT NOT NULL UNIQUE,
                        key_hash TEXT NOT NULL,
                        default_principal TEXT,
                        created_at_ms INTEGER NOT NULL,
                        last_used_at_ms INTEGER,
                        revoked_at_ms INTEGER,
                        rotated_at_ms INTEGER,
                        expires_at_ms INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS ingested_messages (
                        message_id TEXT PRIMARY KEY,
                        doc_key TEXT UNIQUE,
                        payload TEXT NOT NULL,
                        received_at_ms INTEGER NOT NULL,
                        credential_id TEXT,
                        FOREIGN KEY(credential_id) REFERENCES credentials(credential_id) ON DELETE SET NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS scheduled_jobs (
                        job_id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        action_type TEXT NOT NULL,
                        status TEXT NOT NULL,
                        run_at_ms INTEGER NOT NULL,
                        recurrence TEXT NOT NULL,
                        target_hosts TEXT NOT NULL,
                        payload TEXT NOT NULL DEFAULT '{}',
                        created_by TEXT NOT NULL DEFAULT '',
                        claim_epoch INTEGER NOT NULL DEFAULT 0,
                        occurrence INTEGER NOT NULL DEFAULT 0,
                        last_run_at_ms INTEGER,
                        last_error TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS remote_commands (
                        command_id TEXT PRIMARY KEY,
                        target_host TEXT NOT NULL,
                        action_type TEXT NOT NULL,
                        payload TEXT NOT NULL DEFAULT '{}',
                        status TEXT NOT NULL,
                        source_job_id TEXT,
                        job_occurrence INTEGER,
                        detail TEXT,
                        created_at_ms INTEGER NOT NULL,
                        sent_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL,
                        UNIQUE(source_job_id, job_occurrence, target_host)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS download_links (
                        link_id TEXT PRIMARY KEY,
                        token TEXT NOT NULL UNIQUE,
                        created_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER,
                        revoked_at_ms INTEGER,
                        created_by TEXT NOT NULL DEFAULT '',
                        visibility TEXT NOT NULL DEFAULT 'PUBLIC'
                    )
                    """);
            ensureCredentialColumns(conn);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status_run_at ON scheduled_jobs(status, run_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_commands_host_status ON remote_commands(target_host, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_commands_source_job ON remote_commands(source_job_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_commands_status_created ON remote_commands(status, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_messages_received ON ingested_messages(received_at_ms)");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureCredentialColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(credentials)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("default_principal")) {
                st.execute("ALTER TABLE credentials ADD COLUMN default_principal TEXT");
            }
            if (!columns.contains("rotated_at_ms")) {
                st.execute("ALTER TABLE credentials ADD COLUMN rotated_at_ms INTEGER");
            }
            if (!columns.contains("expires_at_ms")) {
                st.execute("ALTER TABLE credentials ADD COLUMN expires_at_ms INTEGER");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_credential_liveness",
                "Index credential liveness and revocation columns",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_credentials_revoked ON credentials(revoked_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_credentials_last_used ON credentials(last_used_at_ms)"
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_link_expiry",
                "Index download link expiry",
                List.of("CREATE INDEX IF NOT EXISTS idx_links_expires ON download_links(expires_at_ms)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            log.info("Applied schema migration {}", step.version());
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        } catch (SQLException e) {
            throw new StoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY version ASC
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
