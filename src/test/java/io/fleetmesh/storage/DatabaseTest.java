package io.fleetmesh.storage;

import io.fleetmesh.config.FleetMeshConfig;
import io.fleetmesh.error.AuthenticationFailureException;
import io.fleetmesh.error.StoreException;
import io.fleetmesh.testing.Fixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

final class DatabaseTest {

    @Test
    void initIsRepeatableAndAppliesPragmas() throws Exception {
        Path root = Fixtures.tempRoot("db-init");
        try {
            Database db = new Database(FleetMeshConfig.fromRoot(root.toString()));
            db.init();
            db.init();

            List<Database.SchemaMigrationRow> migrations = db.listSchemaMigrations();
            Assertions.assertEquals(2, migrations.size());
            Assertions.assertTrue(migrations.stream().allMatch(Database.SchemaMigrationRow::success));

            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertEquals("wal", rs.getString(1).toLowerCase());
                }
                try (ResultSet rs = st.executeQuery("PRAGMA foreign_keys")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertEquals(1, rs.getInt(1));
                }
            }
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void messagesNeedALiveCredential() throws Exception {
        Path root = Fixtures.tempRoot("db-messages");
        try {
            Database db = new Database(FleetMeshConfig.fromRoot(root.toString()));
            db.init();
            CredentialStore credentials = new CredentialStore(db);
            MessageStore messages = new MessageStore(db);
            credentials.insert(new CredentialStore.NewCredential(
                    "cred_1", "web-01", "", "0123456789ab", "$2a$04$notarealhash", null, 1_000L));

            Assertions.assertTrue(messages.insertIfAbsent("msg_1", "doc", "{}", "cred_1", "0123456789ab", 2_000L).stored());
            MessageStore.InsertOutcome dup = messages.insertIfAbsent("msg_2", "doc", "{}", "cred_1", "0123456789ab", 3_000L);
            Assertions.assertFalse(dup.stored());
            Assertions.assertEquals("msg_1", dup.messageId());
            Assertions.assertEquals(3_000L, credentials.findById("cred_1").orElseThrow().lastUsedAtMs());

            Assertions.assertThrows(AuthenticationFailureException.class,
                    () -> messages.insertIfAbsent("msg_3", "other", "{}", "cred_unknown", "0123456789ab", 4_000L));
            Assertions.assertThrows(AuthenticationFailureException.class,
                    () -> messages.insertIfAbsent("msg_3", "other", "{}", "cred_1", "ba9876543210", 4_000L));
            credentials.revoke("cred_1", 5_000L);
            Assertions.assertThrows(AuthenticationFailureException.class,
                    () -> messages.insertIfAbsent("msg_4", "other", "{}", "cred_1", "0123456789ab", 6_000L));
            Assertions.assertFalse(credentials.touchLastUsed("cred_1", "0123456789ab", 7_000L));
            Assertions.assertEquals(1L, messages.count());
            Assertions.assertEquals(2_000L, messages.lastReceivedAtMs().orElseThrow());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void expiredCredentialCannotBeTouched() throws Exception {
        Path root = Fixtures.tempRoot("db-expiry");
        try {
            Database db = new Database(FleetMeshConfig.fromRoot(root.toString()));
            db.init();
            CredentialStore credentials = new CredentialStore(db);
            credentials.insert(new CredentialStore.NewCredential(
                    "cred_1", "web-01", "", "0123456789ab", "$2a$04$notarealhash", null, 1_000L, 5_000L));

            Assertions.assertTrue(credentials.touchLastUsed("cred_1", "0123456789ab", 4_999L));
            Assertions.assertFalse(credentials.touchLastUsed("cred_1", "0123456789ab", 5_000L));
            Assertions.assertEquals(5_000L, credentials.findById("cred_1").orElseThrow().expiresAtMs());

            credentials.setExpiry("cred_1", null);
            Assertions.assertTrue(credentials.touchLastUsed("cred_1", "0123456789ab", 9_000L));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void duplicatePrefixIsRejectedByTheStore() throws Exception {
        Path root = Fixtures.tempRoot("db-prefix");
        try {
            Database db = new Database(FleetMeshConfig.fromRoot(root.toString()));
            db.init();
            CredentialStore credentials = new CredentialStore(db);
            credentials.insert(new CredentialStore.NewCredential("cred_1", "a", "", "0123456789ab", "h1", null, 1L));
            StoreException e = Assertions.assertThrows(StoreException.class,
                    () -> credentials.insert(new CredentialStore.NewCredential("cred_2", "b", "", "0123456789ab", "h2", null, 2L)));
            Assertions.assertInstanceOf(SQLException.class, e.getCause());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }
}
