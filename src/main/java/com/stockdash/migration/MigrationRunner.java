package com.stockdash.migration;

import com.stockdash.db.AppliedMigrationDao;
import com.stockdash.db.Database;
import com.stockdash.db.SchemaInspector;
import com.stockdash.migration.model.AppliedMigration;
import com.stockdash.migration.model.HealthReport;
import com.stockdash.migration.model.MigrationResult;
import com.stockdash.migration.model.RollbackResult;
import com.stockdash.migration.model.ValidationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies pending migrations in registration order and tracks them in {@code __migrations}.
 * <p>
 * Processing stops at the first failing migration; earlier migrations of the same call stay
 * committed. Callers must not run two operations concurrently on the same runner.
 */
public class MigrationRunner implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);

    private final Database database;
    private final MigrationSettings settings;
    private final MigrationRegistry registry = new MigrationRegistry();
    private final StatementAdapter statements;
    private final AppliedMigrationDao appliedDao;
    private final SchemaInspector inspector;
    private final TimeLimiter limiter = new TimeLimiter();

    public MigrationRunner(Database database) throws SQLException {
        this(database, MigrationSettings.defaults());
    }

    public MigrationRunner(Database database, MigrationSettings settings) throws SQLException {
        if (database == null) {
            throw new IllegalArgumentException("database must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        settings.check();
        this.database = database;
        this.settings = settings;
        this.statements = new StatementAdapter(database);
        this.appliedDao = new AppliedMigrationDao(database);
        this.inspector = new SchemaInspector(database);
        appliedDao.ensureTable();
    }

    public void register(Migration migration) {
        registry.register(migration);
    }

    public ValidationResult validate() {
        return registry.validate();
    }

    public MigrationResult run() {
        return run(settings.defaultTimeout);
    }

    public MigrationResult run(Duration timeout) {
        List<String> applied = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<Migration> pending;
        try {
            pending = pendingMigrations();
        } catch (SQLException | RuntimeException e) {
            LOG.error("Pending migration lookup failed: {}", e.getMessage(), e);
            errors.add("Migration system error: " + safe(e.getMessage()));
            return new MigrationResult(false, applied, errors);
        }
        if (pending.isEmpty()) {
            LOG.info("No pending migrations. registered={}", registry.size());
            return new MigrationResult(true, applied, errors);
        }

        int total = pending.size();
        LOG.info("Running migrations: pending={} batch_size={}", total, settings.batchSize);
        for (int start = 0; start < total; start += settings.batchSize) {
            List<Migration> batch = pending.subList(start, Math.min(total, start + settings.batchSize));
            for (Migration migration : batch) {
                settings.progressListener.onProgress(applied.size(), total, migration.name);
                String previousTag = tag(migration.id);
                long started = System.nanoTime();
                try {
                    executeForward(migration, timeout);
                    recordApplied(migration);
                    applied.add(migration.id);
                    LOG.info("Migration applied: id={} elapsed_ms={}", migration.id, elapsedMs(started));
                } catch (Exception e) {
                    if (e instanceof InterruptedException) {
                        Thread.currentThread().interrupt();
                    }
                    String detail = "migration_failed: id=" + migration.id
                            + ", applied_before=" + applied.size()
                            + ", cause=" + describe(e);
                    LOG.error(detail);
                    errors.add("Migration " + migration.id + ": " + describe(e));
                    return new MigrationResult(false, applied, errors);
                } finally {
                    untag(previousTag);
                }
            }
            if (start + settings.batchSize < total && !pauseBetweenBatches()) {
                errors.add("Migration run interrupted after " + applied.size() + " of " + total);
                return new MigrationResult(false, applied, errors);
            }
        }
        return new MigrationResult(true, applied, errors);
    }

    public RollbackResult rollback(String migrationId) {
        return rollback(migrationId, settings.defaultTimeout);
    }

    /**
     * Runs the backward procedure of one migration and removes its applied record.
     * Other migrations are untouched.
     */
    public RollbackResult rollback(String migrationId, Duration timeout) {
        Optional<Migration> found = registry.find(migrationId);
        if (found.isEmpty()) {
            return RollbackResult.failed("Migration " + migrationId + " not found");
        }
        Migration migration = found.get();
        if (migration.down == null) {
            return RollbackResult.failed("Migration " + migrationId + " missing down function");
        }
        String previousTag = tag(migrationId);
        try {
            limiter.run(migration.down, statements, timeout, "Rollback");
            appliedDao.delete(migrationId);
            LOG.info("Migration rolled back: id={}", migrationId);
            return RollbackResult.ok();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            LOG.error("rollback_failed: id={}, cause={}", migrationId, describe(e));
            return RollbackResult.failed(describe(e));
        } finally {
            untag(previousTag);
        }
    }

    /**
     * Applied records ordered by applied-at, ties broken by insertion order.
     */
    public List<AppliedMigration> appliedMigrations() throws SQLException {
        return appliedDao.listApplied();
    }

    public HealthReport healthCheck() {
        try {
            boolean connected = inspector.ping();
            List<AppliedMigration> applied = appliedMigrations();
            int pending = pendingAgainst(applied).size();

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("connectionTest", connected);
            details.put("totalMigrations", registry.size());
            details.put("appliedMigrations", applied.size());
            details.put("pendingMigrations", pending);
            details.put("lastMigration", applied.isEmpty() ? "none" : applied.get(applied.size() - 1).name);
            return new HealthReport(connected, details);
        } catch (SQLException | RuntimeException e) {
            LOG.warn("Health check failed: {}", e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", safe(e.getMessage()));
            return new HealthReport(false, details);
        }
    }

    /**
     * Registered migrations without an applied record, in registration order.
     */
    public List<Migration> pendingMigrations() throws SQLException {
        Set<String> applied = appliedDao.appliedIds();
        List<Migration> pending = new ArrayList<>();
        for (Migration migration : registry.migrations()) {
            if (!applied.contains(migration.id)) {
                pending.add(migration);
            }
        }
        return pending;
    }

    public List<Migration> migrations() {
        return registry.migrations();
    }

    public StatementAdapter statements() {
        return statements;
    }

    public Database database() {
        return database;
    }

    public MigrationSettings settings() {
        return settings;
    }

    void executeForward(Migration migration, Duration timeout) throws Exception {
        if (migration.up == null) {
            throw new IllegalStateException("Migration " + migration.id + " missing up function");
        }
        limiter.run(migration.up, statements, timeout, "Migration");
    }

    void recordApplied(Migration migration) throws SQLException {
        appliedDao.record(migration.id, migration.name);
    }

    void forgetApplied(String migrationId) throws SQLException {
        appliedDao.delete(migrationId);
    }

    @Override
    public void close() {
        limiter.close();
        database.close();
    }

    private List<Migration> pendingAgainst(List<AppliedMigration> applied) {
        Set<String> appliedIds = new HashSet<>();
        for (AppliedMigration record : applied) {
            appliedIds.add(record.id);
        }
        List<Migration> pending = new ArrayList<>();
        for (Migration migration : registry.migrations()) {
            if (!appliedIds.contains(migration.id)) {
                pending.add(migration);
            }
        }
        return pending;
    }

    private boolean pauseBetweenBatches() {
        if (settings.batchPause.isZero()) {
            return true;
        }
        try {
            Thread.sleep(settings.batchPause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted between migration batches");
            return false;
        }
    }

    /**
     * Tags log lines of the current thread with a migration id.
     *
     * @return the tag it replaced, for {@link #untag(String)}
     */
    static String tag(String migrationId) {
        String previous = ThreadContext.get(Database.LOG_CONTEXT_MIGRATION);
        ThreadContext.put(Database.LOG_CONTEXT_MIGRATION, migrationId);
        return previous;
    }

    static void untag(String previous) {
        if (previous == null) {
            ThreadContext.remove(Database.LOG_CONTEXT_MIGRATION);
        } else {
            ThreadContext.put(Database.LOG_CONTEXT_MIGRATION, previous);
        }
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static String elapsedMs(long startedNanos) {
        return String.valueOf((System.nanoTime() - startedNanos) / 1_000_000L);
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
