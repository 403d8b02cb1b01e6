package com.stockdash.app;

import com.stockdash.config.Config;
import com.stockdash.db.Database;
import com.stockdash.migration.EnhancedMigrationRunner;
import com.stockdash.migration.Migration;
import com.stockdash.migration.MigrationRunner;
import com.stockdash.migration.MigrationSettings;
import com.stockdash.migration.catalog.StockDashMigrations;
import com.stockdash.migration.model.AppliedMigration;
import com.stockdash.migration.model.EnhancedMigrationResult;
import com.stockdash.migration.model.HealthReport;
import com.stockdash.migration.model.MigrationLogEntry;
import com.stockdash.migration.model.MigrationResult;
import com.stockdash.migration.model.RollbackResult;
import com.stockdash.migration.model.ValidationResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Command line front end. Exit codes: 0 success, 1 operation failed, 2 usage error.
 */
public final class MigrationCli {
    private static final Logger LOG = LogManager.getLogger(MigrationCli.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDir;
    private final Map<String, String> env;

    public MigrationCli(PrintStream out, PrintStream err, Path workingDir, Map<String, String> env) {
        this.out = out;
        this.err = err;
        this.workingDir = workingDir;
        this.env = env;
    }

    public static void main(String[] args) {
        installLogRoutingIfNeeded();
        int exit = new MigrationCli(System.out, System.err, Path.of(".").toAbsolutePath().normalize(), System.getenv())
                .run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            printHelp(options);
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help")) {
            printHelp(options);
            return EXIT_OK;
        }
        if (!hasCommand(cmd)) {
            printHelp(options);
            err.println("ERROR: one command is required");
            return EXIT_USAGE;
        }

        Duration timeout;
        Integer retainDays = null;
        try {
            timeout = cmd.hasOption("timeout-ms") ? Duration.ofMillis(parsePositiveLong(cmd.getOptionValue("timeout-ms"), "timeout-ms")) : null;
            if (cmd.getOptionValue("cleanup-backups") != null) {
                retainDays = parseNonNegativeInt(cmd.getOptionValue("cleanup-backups"), "cleanup-backups");
            }
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        Config config = Config.load(workingDir, env);
        String dbPath = cmd.hasOption("db") ? resolveDbPath(cmd.getOptionValue("db")) : config.dbPath();
        MigrationSettings settings = config.migrationSettings();

        try (EnhancedMigrationRunner runner = openRunner(new Database(dbPath, config.sqlLogEnabled()), settings)) {
            LOG.info("Migration CLI started. db={} command={}", dbPath, commandName(cmd));
            if (cmd.hasOption("migrate")) {
                return migrate(runner, timeout == null ? settings.defaultTimeout : timeout);
            }
            if (cmd.hasOption("enhanced")) {
                return migrateEnhanced(runner, timeout == null ? settings.enhancedTimeout : timeout);
            }
            if (cmd.hasOption("rollback")) {
                return rollback(runner, cmd.getOptionValue("rollback"), timeout == null ? settings.defaultTimeout : timeout);
            }
            if (cmd.hasOption("status")) {
                return status(runner);
            }
            if (cmd.hasOption("health")) {
                return health(runner);
            }
            if (cmd.hasOption("logs")) {
                return logs(runner);
            }
            if (cmd.hasOption("validate")) {
                return validate(runner);
            }
            int days = retainDays == null ? config.backupRetainDays() : retainDays;
            int removed = runner.cleanupOldBackups(days);
            out.println("Removed " + removed + " backup(s) older than " + days + " day(s)");
            return EXIT_OK;
        } catch (Exception e) {
            LOG.error("Migration CLI failed: {}", e.getMessage(), e);
            err.println("FATAL: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private EnhancedMigrationRunner openRunner(Database database, MigrationSettings settings) throws Exception {
        MigrationRunner base;
        try {
            base = new MigrationRunner(database, settings);
        } catch (Exception e) {
            database.close();
            throw e;
        }
        for (Migration migration : StockDashMigrations.all()) {
            base.register(migration);
        }
        try {
            return new EnhancedMigrationRunner(base);
        } catch (Exception e) {
            base.close();
            throw e;
        }
    }

    private int migrate(EnhancedMigrationRunner runner, Duration timeout) {
        if (!checkRegistry(runner)) {
            return EXIT_FAILED;
        }
        MigrationResult result = runner.run(timeout);
        out.println("Applied: " + (result.applied().isEmpty() ? "none" : String.join(", ", result.applied())));
        printErrors(result.errors());
        return result.success() ? EXIT_OK : EXIT_FAILED;
    }

    private int migrateEnhanced(EnhancedMigrationRunner runner, Duration timeout) {
        if (!checkRegistry(runner)) {
            return EXIT_FAILED;
        }
        EnhancedMigrationResult result = runner.runEnhanced(timeout);
        out.println("Applied: " + (result.applied().isEmpty() ? "none" : String.join(", ", result.applied())));
        for (String backup : result.backups()) {
            out.println("Backup: " + backup);
        }
        if (!result.rolledBack().isEmpty()) {
            out.println("Rolled back: " + String.join(", ", result.rolledBack()));
        }
        printErrors(result.errors());
        return result.success() ? EXIT_OK : EXIT_FAILED;
    }

    private int rollback(EnhancedMigrationRunner runner, String migrationId, Duration timeout) {
        RollbackResult result = runner.rollback(migrationId, timeout);
        if (result.success()) {
            out.println("Rolled back: " + migrationId);
            return EXIT_OK;
        }
        err.println("ERROR: " + result.error());
        return EXIT_FAILED;
    }

    private int status(EnhancedMigrationRunner runner) throws Exception {
        List<AppliedMigration> applied = runner.appliedMigrations();
        out.println("Applied migrations: " + applied.size());
        for (AppliedMigration migration : applied) {
            out.println("  [x] " + migration.id + "  " + migration.name + "  " + migration.appliedAt);
        }
        List<Migration> pending = runner.base().pendingMigrations();
        out.println("Pending migrations: " + pending.size());
        for (Migration migration : pending) {
            out.println("  [ ] " + migration.id + "  " + migration.name);
        }
        return EXIT_OK;
    }

    private int health(EnhancedMigrationRunner runner) {
        HealthReport report = runner.healthCheck();
        out.println("healthy=" + report.healthy());
        for (Map.Entry<String, Object> entry : report.details().entrySet()) {
            out.println(entry.getKey() + "=" + entry.getValue());
        }
        return report.healthy() ? EXIT_OK : EXIT_FAILED;
    }

    private int logs(EnhancedMigrationRunner runner) throws Exception {
        List<MigrationLogEntry> entries = runner.getMigrationLogs();
        if (entries.isEmpty()) {
            out.println("No migration logs");
        }
        for (MigrationLogEntry entry : entries) {
            out.println(entry.id
                    + " status=" + entry.status.dbValue()
                    + " attempts=" + entry.attemptCount
                    + " started=" + entry.startedAt
                    + " completed=" + entry.completedAt
                    + (entry.backupPath == null ? "" : " backup=" + entry.backupPath)
                    + (entry.errorMessage == null ? "" : " error=" + entry.errorMessage));
        }
        return EXIT_OK;
    }

    private int validate(EnhancedMigrationRunner runner) {
        boolean registryOk = checkRegistry(runner);
        ValidationResult integrity = runner.validateDataIntegrity();
        for (String issue : integrity.issues()) {
            err.println("Integrity issue: " + issue);
        }
        boolean ok = registryOk && integrity.valid();
        out.println(ok ? "Validation passed" : "Validation failed");
        return ok ? EXIT_OK : EXIT_FAILED;
    }

    private boolean checkRegistry(EnhancedMigrationRunner runner) {
        ValidationResult registry = runner.validate();
        for (String issue : registry.issues()) {
            err.println("Registry issue: " + issue);
        }
        return registry.valid();
    }

    private void printErrors(List<String> errors) {
        for (String error : errors) {
            err.println("ERROR: " + error);
        }
    }

    private String resolveDbPath(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (Database.MEMORY.equals(value)) {
            return value;
        }
        return workingDir.resolve(value).normalize().toString();
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "stockdash-migrations", null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        writer.flush();
    }

    private static boolean hasCommand(CommandLine cmd) {
        return commandName(cmd) != null;
    }

    private static String commandName(CommandLine cmd) {
        for (String name : List.of("migrate", "enhanced", "rollback", "status", "health", "logs", "validate", "cleanup-backups")) {
            if (cmd.hasOption(name)) {
                return name;
            }
        }
        return null;
    }

    private static long parsePositiveLong(String raw, String name) {
        long value = parseNonNegativeLong(raw, name);
        if (value == 0) {
            throw new IllegalArgumentException("--" + name + " must be positive");
        }
        return value;
    }

    private static int parseNonNegativeInt(String raw, String name) {
        long value = parseNonNegativeLong(raw, name);
        if (value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("--" + name + " must be at most " + Integer.MAX_VALUE);
        }
        return (int) value;
    }

    private static long parseNonNegativeLong(String raw, String name) {
        try {
            long value = Long.parseLong(raw == null ? "" : raw.trim());
            if (value < 0) {
                throw new IllegalArgumentException("--" + name + " must not be negative");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects a number, got: " + raw);
        }
    }

    private static Options buildOptions() {
        OptionGroup commands = new OptionGroup();
        commands.addOption(Option.builder().longOpt("migrate").desc("apply pending migrations (base runner)").build());
        commands.addOption(Option.builder().longOpt("enhanced").desc("apply pending migrations with validation, retries, backups and auto-rollback").build());
        commands.addOption(Option.builder().longOpt("rollback").hasArg().argName("id").desc("roll back one migration").build());
        commands.addOption(Option.builder().longOpt("status").desc("list applied and pending migrations").build());
        commands.addOption(Option.builder().longOpt("health").desc("run the health check").build());
        commands.addOption(Option.builder().longOpt("logs").desc("show migration logs, newest first").build());
        commands.addOption(Option.builder().longOpt("validate").desc("validate the registry and data integrity").build());
        commands.addOption(Option.builder().longOpt("cleanup-backups").hasArg().optionalArg(true).argName("days").desc("delete backups older than the given number of days (default backup.retain_days)").build());
        commands.addOption(Option.builder().longOpt("help").desc("show help").build());

        Options options = new Options();
        options.addOptionGroup(commands);
        options.addOption(Option.builder().longOpt("db").hasArg().argName("path").desc("database file, or :memory:").build());
        options.addOption(Option.builder().longOpt("timeout-ms").hasArg().argName("ms").desc("per-migration timeout").build());
        return options;
    }

    private static void installLogRoutingIfNeeded() {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (MigrationCli.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            // Init Log4j first so the console appender keeps the original streams.
            LogManager.getLogger(MigrationCli.class);
            System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
            System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());
            LOG_ROUTE_INSTALLED = true;
        }
    }
}
