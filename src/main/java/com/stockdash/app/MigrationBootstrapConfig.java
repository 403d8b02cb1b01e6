package com.stockdash.app;

import com.stockdash.app.properties.MigrationProperties;
import com.stockdash.config.Config;
import com.stockdash.db.Database;
import com.stockdash.migration.EnhancedMigrationRunner;
import com.stockdash.migration.Migration;
import com.stockdash.migration.MigrationRunner;
import com.stockdash.migration.MigrationSettings;
import com.stockdash.migration.catalog.StockDashMigrations;
import com.stockdash.migration.model.EnhancedMigrationResult;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Spring wiring for applications that embed the migration engine.
 */
@Configuration
@EnableConfigurationProperties(MigrationProperties.class)
public class MigrationBootstrapConfig {

    @Bean
    public Database database(MigrationProperties properties) {
        return new Database(readDbPath(properties), properties.getSqlLog() != null && properties.getSqlLog().isEnabled());
    }

    @Bean
    public MigrationRunner migrationRunner(Database database, MigrationProperties properties) throws SQLException {
        MigrationRunner runner = new MigrationRunner(database, toSettings(properties));
        for (Migration migration : StockDashMigrations.all()) {
            runner.register(migration);
        }
        return runner;
    }

    @Bean
    public EnhancedMigrationRunner enhancedMigrationRunner(MigrationRunner migrationRunner, MigrationProperties properties)
            throws SQLException {
        EnhancedMigrationRunner runner = new EnhancedMigrationRunner(migrationRunner);
        if (properties.isRunOnStartup()) {
            EnhancedMigrationResult result = runner.runEnhanced();
            if (!result.success()) {
                throw new IllegalStateException("Database migration failed: " + String.join("; ", result.errors()));
            }
        }
        return runner;
    }

    static MigrationSettings toSettings(MigrationProperties properties) {
        return MigrationSettings.builder()
                .batchSize(properties.getBatchSize())
                .maxRetries(properties.getMaxRetries())
                .backupDir(Paths.get(firstNonBlank(System.getenv(Config.ENV_BACKUP_DIR), properties.getBackupDir(), "./backups")))
                .retryBackoffUnit(Duration.ofMillis(properties.getRetryBackoffMs()))
                .batchPause(Duration.ofMillis(properties.getBatchPauseMs()))
                .defaultTimeout(Duration.ofMillis(properties.getTimeoutMs()))
                .enhancedTimeout(Duration.ofMillis(properties.getEnhancedTimeoutMs()))
                .build();
    }

    private String readDbPath(MigrationProperties properties) {
        return firstNonBlank(
                System.getenv(Config.ENV_DB_PATH),
                properties == null ? null : properties.getDbPath(),
                "data/stockdash.db"
        );
    }

    private static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
