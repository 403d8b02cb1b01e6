package com.stockdash.app;

import com.stockdash.migration.catalog.V001CreateAuthTables;
import com.stockdash.migration.catalog.V002CreateStocksTables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationCliTest {
    @TempDir
    Path workingDir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    @Test
    void help_shouldExitZero() {
        int exit = cli().run(new String[]{"--help"});

        assertEquals(MigrationCli.EXIT_OK, exit);
        assertTrue(out().contains("--enhanced"));
    }

    @Test
    void missingCommand_shouldBeUsageError() {
        int exit = cli().run(new String[]{"--db", "x.db"});

        assertEquals(MigrationCli.EXIT_USAGE, exit);
        assertTrue(err().contains("ERROR: one command is required"));
    }

    @Test
    void conflictingCommands_shouldBeUsageError() {
        assertEquals(MigrationCli.EXIT_USAGE, cli().run(new String[]{"--status", "--health"}));
    }

    @Test
    void invalidTimeout_shouldBeUsageError() {
        int exit = cli().run(new String[]{"--migrate", "--timeout-ms", "soon"});

        assertEquals(MigrationCli.EXIT_USAGE, exit);
        assertTrue(err().contains("--timeout-ms expects a number"));
    }

    @Test
    void enhanced_shouldApplyCatalogAndReportStatus() {
        int exit = cli().run(new String[]{"--enhanced", "--db", "data/dash.db"});

        assertEquals(MigrationCli.EXIT_OK, exit, err());
        assertTrue(out().contains("Applied: " + V001CreateAuthTables.ID + ", " + V002CreateStocksTables.ID));
        assertTrue(out().contains("Backup: "));
        assertTrue(Files.exists(workingDir.resolve("data/dash.db")));

        outBytes.reset();
        assertEquals(MigrationCli.EXIT_OK, cli().run(new String[]{"--status", "--db", "data/dash.db"}));
        assertTrue(out().contains("Applied migrations: 2"));
        assertTrue(out().contains("Pending migrations: 0"));

        outBytes.reset();
        assertEquals(MigrationCli.EXIT_OK, cli().run(new String[]{"--health", "--db", "data/dash.db"}));
        assertTrue(out().contains("healthy=true"));
        assertTrue(out().contains("lastMigration=" + V002CreateStocksTables.NAME));

        outBytes.reset();
        assertEquals(MigrationCli.EXIT_OK, cli().run(new String[]{"--validate", "--db", "data/dash.db"}));
        assertTrue(out().contains("Validation passed"));

        outBytes.reset();
        assertEquals(MigrationCli.EXIT_OK, cli().run(new String[]{"--logs", "--db", "data/dash.db"}));
        assertTrue(out().contains(V002CreateStocksTables.ID + " status=completed"));
    }

    @Test
    void rollbackOfUnknownMigration_shouldFail() {
        int exit = cli().run(new String[]{"--rollback", "999_missing", "--db", ":memory:"});

        assertEquals(MigrationCli.EXIT_FAILED, exit);
        assertTrue(err().contains("Migration 999_missing not found"));
    }

    @Test
    void cleanupBackups_shouldReportRemovedCount() {
        int exit = cli().run(new String[]{"--cleanup-backups", "7", "--db", "data/dash.db"});

        assertEquals(MigrationCli.EXIT_OK, exit);
        assertTrue(out().contains("Removed 0 backup(s) older than 7 day(s)"));
    }

    @Test
    void cleanupBackupsWithoutDays_shouldUseConfiguredRetention() throws Exception {
        Files.writeString(workingDir.resolve("config.properties"), "backup.retain_days=3\n");

        int exit = cli().run(new String[]{"--cleanup-backups", "--db", ":memory:"});

        assertEquals(MigrationCli.EXIT_OK, exit);
        assertTrue(out().contains("Removed 0 backup(s) older than 3 day(s)"));
    }

    @Test
    void cleanupBackupsBeyondIntRange_shouldBeUsageError() {
        int exit = cli().run(new String[]{"--cleanup-backups", "3000000000", "--db", ":memory:"});

        assertEquals(MigrationCli.EXIT_USAGE, exit);
        assertTrue(err().contains("--cleanup-backups must be at most 2147483647"));
        assertFalse(out().contains("Removed"));
    }

    private MigrationCli cli() {
        return new MigrationCli(
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8),
                workingDir,
                Map.of("BACKUP_DIR", workingDir.resolve("backups").toString())
        );
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }
}
