package com.stockdash.migration;

import com.stockdash.db.Database;
import com.stockdash.db.MigrationBackupDao;
import com.stockdash.migration.model.BackupDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copies of the database file, catalogued in {@code __migration_backups}.
 * Every operation is a no-op for in-memory databases.
 */
public final class BackupStore {
    private static final Logger LOG = LogManager.getLogger(BackupStore.class);
    private static final String[] SQLITE_SIDE_FILES = {"-journal", "-wal", "-shm"};

    private final Database database;
    private final MigrationBackupDao backupDao;
    private final Path backupDir;
    private final Clock clock;

    public BackupStore(Database database, MigrationBackupDao backupDao, Path backupDir, Clock clock) {
        this.database = database;
        this.backupDao = backupDao;
        this.backupDir = backupDir.toAbsolutePath().normalize();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        if (database.isFileBacked()) {
            ensureBackupDirectory();
        }
    }

    /**
     * Copies the live database file to {@code backup_<id>_<timestamp>.db} and catalogues it.
     *
     * @return the descriptor, or null for in-memory databases and failed copies
     */
    public BackupDescriptor createBackup(String migrationId) {
        if (!database.isFileBacked()) {
            LOG.info("In-memory database, backup skipped for {}", migrationId);
            return null;
        }
        Path source = database.file().orElseThrow();
        Instant now = clock.instant();
        Path target = backupDir.resolve("backup_" + migrationId + "_" + fileTimestamp(now) + ".db");
        try {
            Files.createDirectories(backupDir);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            BackupDescriptor backup = BackupDescriptor.builder()
                    .migrationId(migrationId)
                    .path(target)
                    .fileSize(Files.size(target))
                    .createdAt(now)
                    .build();
            backupDao.insert(backup);
            LOG.info("Backup created: migration={} path={} bytes={}", migrationId, target, backup.fileSize);
            return backup;
        } catch (IOException | SQLException | RuntimeException e) {
            LOG.error("backup_failed: migration={}, target={}, cause={}", migrationId, target, e.getMessage());
            return null;
        }
    }

    /**
     * Replaces the live database file with {@code backupPath} and reopens the connection.
     *
     * @return false for in-memory databases, a missing backup file, or a failed copy
     */
    public boolean restoreFromBackup(Path backupPath) {
        if (!database.isFileBacked()) {
            return false;
        }
        if (backupPath == null || !Files.isRegularFile(backupPath)) {
            LOG.warn("Backup file not found, restore skipped: {}", backupPath);
            return false;
        }
        Path live = database.file().orElseThrow();
        database.close();
        try {
            for (String suffix : SQLITE_SIDE_FILES) {
                Files.deleteIfExists(live.resolveSibling(live.getFileName() + suffix));
            }
            Files.copy(backupPath, live, StandardCopyOption.REPLACE_EXISTING);
            database.reopen();
            LOG.info("Database restored from backup: {}", backupPath);
            return true;
        } catch (IOException | SQLException e) {
            LOG.error("restore_failed: backup={}, live={}, cause={}", backupPath, live, e.getMessage());
            reopenAfterFailedRestore();
            return false;
        }
    }

    /**
     * Re-inserts a descriptor that a restore rolled out of the catalogue.
     */
    void ensureCatalogued(BackupDescriptor backup) throws SQLException {
        for (BackupDescriptor existing : backupDao.listAll()) {
            if (existing.path.equals(backup.path)) {
                return;
            }
        }
        backupDao.insert(backup);
    }

    /**
     * Deletes backups created before {@code now - retainDays}. A file that cannot be deleted keeps
     * its descriptor so a later sweep retries it.
     *
     * @return number of backups removed
     */
    public int cleanupOldBackups(int retainDays) {
        if (retainDays < 0) {
            throw new IllegalArgumentException("retainDays must not be negative: " + retainDays);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retainDays));
        int removed = 0;
        try {
            for (BackupDescriptor backup : backupDao.listCreatedBefore(cutoff)) {
                try {
                    Files.deleteIfExists(backup.path);
                    backupDao.delete(backup.id);
                    removed++;
                    LOG.info("Old backup deleted: {}", backup.path);
                } catch (IOException e) {
                    LOG.warn("Backup delete failed: path={} cause={}", backup.path, e.getMessage());
                }
            }
        } catch (SQLException | RuntimeException e) {
            LOG.error("backup_cleanup_failed: cutoff={}, removed={}, cause={}", cutoff, removed, e.getMessage());
        }
        return removed;
    }

    /**
     * Catalogued backups, newest first.
     */
    public List<BackupDescriptor> listBackups() throws SQLException {
        return backupDao.listAll();
    }

    static String fileTimestamp(Instant instant) {
        return instant.toString().replace(':', '-').replace('.', '-');
    }

    private void ensureBackupDirectory() {
        try {
            Files.createDirectories(backupDir);
        } catch (IOException e) {
            LOG.warn("Cannot create backup directory {}: {}", backupDir, e.getMessage());
        }
    }

    private void reopenAfterFailedRestore() {
        try {
            database.reopen();
        } catch (SQLException e) {
            LOG.error("Reopen after failed restore failed: {}", e.getMessage());
        }
    }
}
