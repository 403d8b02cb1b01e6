package com.stockdash.migration;

import com.stockdash.db.AppliedMigrationDao;
import com.stockdash.db.Database;
import com.stockdash.db.MigrationBackupDao;
import com.stockdash.db.MigrationLogDao;
import com.stockdash.db.SchemaInspector;
import com.stockdash.migration.model.AppliedMigration;
import com.stockdash.migration.model.BackupDescriptor;
import com.stockdash.migration.model.EnhancedMigrationResult;
import com.stockdash.migration.model.HealthReport;
import com.stockdash.migration.model.MigrationLogEntry;
import com.stockdash.migration.model.MigrationResult;
import com.stockdash.migration.model.RollbackResult;
import com.stockdash.migration.model.ValidationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Migration runner with integrity validation around every migration, bounded retries with
 * exponential backoff, file backups, and cascading auto-rollback.
 * <p>
 * Composes a {@link MigrationRunner} through its accessor contract ({@code pendingMigrations},
 * {@code statements}, {@code executeForward}, {@code recordApplied}). The failure counter that
 * drives auto-rollback belongs to this instance and accumulates across runs.
 */
public final class EnhancedMigrationRunner implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(EnhancedMigrationRunner.class);

    /** Waits out a retry backoff. */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }

    private final MigrationRunner base;
    private final MigrationSettings settings;
    private final MigrationLogDao logDao;
    private final BackupStore backupStore;
    private final DataIntegrityValidator validator;
    private final Clock clock;
    private final Sleeper sleeper;
    private int failureCount;

    public EnhancedMigrationRunner(MigrationRunner base) throws SQLException {
        this(base, IntegrityRules.stockDashDefaults(), Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public EnhancedMigrationRunner(MigrationRunner base, IntegrityRules rules, Clock clock, Sleeper sleeper)
            throws SQLException {
        if (base == null) {
            throw new IllegalArgumentException("base runner must not be null");
        }
        this.base = base;
        this.settings = base.settings();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;

        Database database = base.database();
        this.logDao = new MigrationLogDao(database);
        logDao.ensureTable();
        MigrationBackupDao backupDao = new MigrationBackupDao(database);
        backupDao.ensureTable();
        this.backupStore = new BackupStore(database, backupDao, settings.backupDir, this.clock);
        this.validator = new DataIntegrityValidator(new SchemaInspector(database), new AppliedMigrationDao(database), rules);
    }

    public void register(Migration migration) {
        base.register(migration);
    }

    public ValidationResult validate() {
        return base.validate();
    }

    /** Plain base-runner pass without validation, retries or backups. */
    public MigrationResult run(Duration timeout) {
        return base.run(timeout);
    }

    public EnhancedMigrationResult runEnhanced() {
        return runEnhanced(settings.enhancedTimeout);
    }

    public EnhancedMigrationResult runEnhanced(Duration timeout) {
        RunState state = new RunState();
        try {
            LOG.info("Pre-migration integrity validation");
            ValidationResult pre = validator.validate();
            if (!pre.valid()) {
                state.errors.add("Pre-migration validation failed: " + String.join(", ", pre.issues()));
                return state.toResult(false);
            }

            List<Migration> pending = base.pendingMigrations();
            if (pending.isEmpty()) {
                LOG.info("No pending migrations");
                return state.toResult(true);
            }

            LOG.info("Running {} pending migration(s), max_retries={}", pending.size(), settings.maxRetries);
            boolean success = true;
            for (Migration migration : pending) {
                settings.progressListener.onProgress(state.applied.size(), pending.size(), migration.name);
                String previousTag = MigrationRunner.tag(migration.id);
                try {
                    if (!applyWithRetries(migration, timeout, state)) {
                        success = false;
                        break;
                    }
                } finally {
                    MigrationRunner.untag(previousTag);
                }
            }

            if (success) {
                ValidationResult last = validator.validate();
                if (!last.valid()) {
                    success = false;
                    state.errors.add("Final validation failed: " + String.join(", ", last.issues()));
                } else {
                    LOG.info("All migrations applied and integrity validated: applied={}", state.applied);
                }
            }
            return state.toResult(success);
        } catch (SQLException | RuntimeException e) {
            LOG.error("Migration system error: {}", e.getMessage(), e);
            state.errors.add("Migration system error: " + MigrationRunner.describe(e));
            return state.toResult(false);
        }
    }

    public RollbackResult rollback(String migrationId, Duration timeout) {
        return base.rollback(migrationId, timeout);
    }

    public List<AppliedMigration> appliedMigrations() throws SQLException {
        return base.appliedMigrations();
    }

    public HealthReport healthCheck() {
        return base.healthCheck();
    }

    public ValidationResult validateDataIntegrity() {
        return validator.validate();
    }

    /**
     * Log entries, newest first.
     */
    public List<MigrationLogEntry> getMigrationLogs() throws SQLException {
        return logDao.list();
    }

    public BackupDescriptor createBackup(String migrationId) {
        return backupStore.createBackup(migrationId);
    }

    public boolean restoreFromBackup(Path backupPath) {
        return backupStore.restoreFromBackup(backupPath);
    }

    public int cleanupOldBackups(int retainDays) {
        return backupStore.cleanupOldBackups(retainDays);
    }

    public List<BackupDescriptor> listBackups() throws SQLException {
        return backupStore.listBackups();
    }

    public int failureCount() {
        return failureCount;
    }

    public MigrationRunner base() {
        return base;
    }

    @Override
    public void close() {
        base.close();
    }

    private boolean applyWithRetries(Migration migration, Duration timeout, RunState state) throws SQLException {
        logDao.markRunning(migration.id, migration.name, clock.instant());
        BackupDescriptor backup = null;
        String lastError = null;
        int attempt = 0;

        while (attempt < settings.maxRetries) {
            attempt++;
            if (attempt == 1) {
                backup = backupStore.createBackup(migration.id);
                if (backup != null) {
                    state.backups.add(backup.path.toString());
                    logDao.recordBackupPath(migration.id, backup.path.toString());
                }
            } else {
                logDao.updateAttemptCount(migration.id, attempt);
            }

            try {
                LOG.info("Executing migration {} (attempt {}/{})", migration.id, attempt, settings.maxRetries);
                attemptOnce(migration, timeout);
                logDao.markCompleted(migration.id, clock.instant());
                state.applied.add(migration.id);
                LOG.info("Migration {} completed", migration.id);
                return true;
            } catch (Exception e) {
                failureCount++;
                lastError = MigrationRunner.describe(e);
                LOG.warn("Migration {} failed (attempt {}/{}): {}", migration.id, attempt, settings.maxRetries, lastError);
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }

            if (attempt < settings.maxRetries) {
                Duration wait = backoff(attempt);
                LOG.info("Retrying migration {} in {}ms", migration.id, wait.toMillis());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = "Interrupted during retry backoff after: " + lastError;
                    break;
                }
            }
        }

        handleExhausted(migration, attempt, lastError, backup, timeout, state);
        return false;
    }

    private void attemptOnce(Migration migration, Duration timeout) throws Exception {
        try {
            base.executeForward(migration, timeout);
        } catch (Exception e) {
            rollbackOpenTransaction();
            throw e;
        }
        base.recordApplied(migration);
        ValidationResult post = validator.validate();
        if (!post.valid()) {
            base.forgetApplied(migration.id);
            throw new IllegalStateException("Post-migration validation failed: " + String.join(", ", post.issues()));
        }
    }

    private void handleExhausted(Migration migration, int attempts, String lastError, BackupDescriptor backup,
                                 Duration timeout, RunState state) throws SQLException {
        String error = lastError == null ? "unknown error" : lastError;
        boolean restoreFailed = false;
        if (backup != null) {
            if (backupStore.restoreFromBackup(backup.path)) {
                // the restored image predates this backup's catalogue row and log path
                backupStore.ensureCatalogued(backup);
                logDao.recordBackupPath(migration.id, backup.path.toString());
            } else {
                restoreFailed = true;
            }
        }
        logDao.markFailed(migration.id, error, attempts);
        state.errors.add("Migration " + migration.id + " failed: " + error);
        if (restoreFailed) {
            state.errors.add("Backup restore failed: " + backup.path);
        }

        if (failureCount >= settings.maxRetries) {
            LOG.error("Failure count {} reached threshold {}, starting auto-rollback", failureCount, settings.maxRetries);
            autoRollback(timeout, state);
        }
    }

    private void autoRollback(Duration timeout, RunState state) throws SQLException {
        List<String> order = new ArrayList<>(state.applied);
        Collections.reverse(order);
        for (String id : order) {
            LOG.info("Auto-rollback: {}", id);
            RollbackResult rollback = base.rollback(id, timeout);
            if (!rollback.success()) {
                LOG.error("Auto-rollback stopped at {}: {}", id, rollback.error());
                state.errors.add("Auto-rollback stopped at " + id + ": " + rollback.error());
                return;
            }
            logDao.markRolledBack(id, clock.instant());
            state.applied.remove(id);
            state.rolledBack.add(id);
        }
    }

    private void rollbackOpenTransaction() {
        try {
            base.statements().execute("ROLLBACK");
            LOG.info("Open transaction rolled back after failed migration");
        } catch (SQLException e) {
            String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("no transaction is active")) {
                LOG.debug("No open transaction after failed migration");
            } else {
                LOG.warn("Transaction rollback after failed migration failed: {}", e.getMessage());
            }
        }
    }

    private Duration backoff(int attempt) {
        int exponent = Math.min(attempt, MigrationSettings.MAX_RETRIES_LIMIT);
        return settings.retryBackoffUnit.multipliedBy(1L << exponent);
    }

    private static final class RunState {
        private final List<String> applied = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private final List<String> backups = new ArrayList<>();
        private final List<String> rolledBack = new ArrayList<>();

        private EnhancedMigrationResult toResult(boolean success) {
            return new EnhancedMigrationResult(success, applied, errors, backups, rolledBack);
        }
    }
}
