package com.stockdash.migration;

import com.stockdash.db.Database;
import com.stockdash.db.MigrationBackupDao;
import com.stockdash.db.SchemaInspector;
import com.stockdash.migration.model.BackupDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackupStoreTest {
    @TempDir
    Path tempDir;

    private final MovableClock clock = new MovableClock(Instant.parse("2026-01-10T08:00:00.250Z"));
    private Database database;

    @AfterEach
    void tearDown() {
        if (database != null) {
            database.close();
        }
    }

    @Test
    void createBackup_shouldCopyFileAndCatalogueIt() throws Exception {
        BackupStore store = fileStore();

        BackupDescriptor backup = store.createBackup("001_init");

        assertNotNull(backup);
        assertEquals("backup_001_init_2026-01-10T08-00-00-250Z.db", backup.path.getFileName().toString());
        assertTrue(Files.isRegularFile(backup.path));
        assertEquals(Files.size(backup.path), backup.fileSize);
        assertEquals(1, store.listBackups().size());
        assertEquals("001_init", store.listBackups().get(0).migrationId);
    }

    @Test
    void restoreFromBackup_shouldBringBackEarlierState() throws Exception {
        BackupStore store = fileStore();
        StatementAdapter statements = new StatementAdapter(database);
        statements.execute("CREATE TABLE quotes (code TEXT)");
        BackupDescriptor backup = store.createBackup("002_quotes");
        statements.execute("CREATE TABLE scratch (id INTEGER)");
        statements.execute("INSERT INTO quotes VALUES ('6758')");

        assertTrue(store.restoreFromBackup(backup.path));

        SchemaInspector inspector = new SchemaInspector(database);
        assertTrue(inspector.tableExists("quotes"));
        assertFalse(inspector.tableExists("scratch"));
        assertTrue(statements.query("SELECT code FROM quotes").isEmpty());
    }

    @Test
    void restoreFromBackup_shouldRefuseMissingFile() throws Exception {
        BackupStore store = fileStore();

        assertFalse(store.restoreFromBackup(tempDir.resolve("missing.db")));
        assertTrue(new SchemaInspector(database).ping());
    }

    @Test
    void cleanupOldBackups_shouldDeleteOnlyExpiredBackups() throws Exception {
        BackupStore store = fileStore();
        BackupDescriptor old = store.createBackup("old");
        clock.advance(Duration.ofDays(5));
        BackupDescriptor recent = store.createBackup("recent");
        clock.advance(Duration.ofDays(3));

        int removed = store.cleanupOldBackups(7);

        assertEquals(1, removed);
        assertFalse(Files.exists(old.path));
        assertTrue(Files.exists(recent.path));
        assertEquals(1, store.listBackups().size());
        assertEquals("recent", store.listBackups().get(0).migrationId);
        assertThrows(IllegalArgumentException.class, () -> store.cleanupOldBackups(-1));
    }

    @Test
    void cleanupOldBackups_shouldContinuePastUndeletableBackup() throws Exception {
        BackupStore store = fileStore();
        BackupDescriptor stuck = store.createBackup("stuck");
        clock.advance(Duration.ofSeconds(1));
        BackupDescriptor expired = store.createBackup("expired");
        Files.delete(stuck.path);
        Files.createDirectory(stuck.path);
        Files.writeString(stuck.path.resolve("keep.txt"), "not empty");
        clock.advance(Duration.ofDays(10));

        int removed = store.cleanupOldBackups(7);

        assertEquals(1, removed);
        assertFalse(Files.exists(expired.path));
        assertTrue(Files.isDirectory(stuck.path));
        assertEquals(1, store.listBackups().size());
        assertEquals("stuck", store.listBackups().get(0).migrationId);
    }

    @Test
    void inMemoryDatabase_shouldSkipBackups() throws Exception {
        database = Database.inMemory();
        MigrationBackupDao dao = new MigrationBackupDao(database);
        dao.ensureTable();
        BackupStore store = new BackupStore(database, dao, tempDir.resolve("backups"), clock);

        assertNull(store.createBackup("001_init"));
        assertFalse(store.restoreFromBackup(tempDir.resolve("any.db")));
        assertEquals(0, store.cleanupOldBackups(0));
        assertFalse(Files.exists(tempDir.resolve("backups")));
    }

    @Test
    void fileTimestamp_shouldBeFilesystemSafe() {
        assertEquals("2026-01-10T08-00-00Z", BackupStore.fileTimestamp(Instant.parse("2026-01-10T08:00:00Z")));
    }

    private BackupStore fileStore() throws Exception {
        database = new Database(tempDir.resolve("live.db").toString(), false);
        MigrationBackupDao dao = new MigrationBackupDao(database);
        dao.ensureTable();
        return new BackupStore(database, dao, tempDir.resolve("backups"), clock);
    }

    private static final class MovableClock extends Clock {
        private Instant now;

        private MovableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
