package com.stockdash.config;

import com.stockdash.migration.MigrationSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {
    @TempDir
    Path workingDir;

    @Test
    void defaults_shouldResolveAgainstWorkingDirectory() {
        Config config = Config.load(workingDir, Map.of());

        assertEquals(workingDir.resolve("data/stockdash.db").normalize().toString(), config.dbPath());
        assertEquals(workingDir.resolve("backups").normalize(), config.backupDir());
        assertFalse(config.sqlLogEnabled());
        assertEquals(7, config.backupRetainDays());
        assertEquals("resource", config.sourceOf("db.path"));
        assertEquals("default", config.sourceOf("no.such.key"));
    }

    @Test
    void environment_shouldWinOverFiles() {
        Config config = Config.load(workingDir, Map.of(
                Config.ENV_DB_PATH, ":memory:",
                Config.ENV_BACKUP_DIR, "/var/backups/stockdash"
        ));

        assertEquals(":memory:", config.dbPath());
        assertEquals(Path.of("/var/backups/stockdash"), config.backupDir());
        assertEquals("env", config.sourceOf("db.path"));
        assertEquals("env", config.sourceOf("migration.backup_dir"));
    }

    @Test
    void workingDirectoryFile_shouldOverrideClasspathDefaults() throws Exception {
        Files.writeString(workingDir.resolve("config.properties"), String.join("\n",
                "db.path=var/dash.db",
                "db.sql_log.enabled=yes",
                "migration.max_retries=5",
                "migration.retry_backoff_ms=250",
                "migration.timeout_ms=oops"));

        Config config = Config.load(workingDir, Map.of());
        MigrationSettings settings = config.migrationSettings();

        assertEquals(workingDir.resolve("var/dash.db").toString(), config.dbPath());
        assertTrue(config.sqlLogEnabled());
        assertEquals("override", config.sourceOf("migration.max_retries"));
        assertEquals(5, settings.maxRetries);
        assertEquals(Duration.ofMillis(250), settings.retryBackoffUnit);
        assertEquals(Duration.ofSeconds(30), settings.defaultTimeout);
        assertEquals(Duration.ofSeconds(60), settings.enhancedTimeout);
    }
}
