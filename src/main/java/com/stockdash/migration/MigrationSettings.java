package com.stockdash.migration;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MigrationSettings {
    public static final String BACKUP_DIR_ENV = "BACKUP_DIR";
    /** Upper bound for {@code maxRetries}; also caps the backoff exponent. */
    public static final int MAX_RETRIES_LIMIT = 30;
    public static final Duration MAX_RETRY_BACKOFF_UNIT = Duration.ofHours(1);

    /** Migrations per batch in the base runner. */
    @Builder.Default
    public final int batchSize = 5;
    /** Attempts per migration in the enhanced runner, and the aggregate auto-rollback threshold. */
    @Builder.Default
    public final int maxRetries = 3;
    @Builder.Default
    public final Path backupDir = defaultBackupDir();
    /** Backoff before retry {@code n+1} is {@code retryBackoffUnit * 2^n}. */
    @Builder.Default
    public final Duration retryBackoffUnit = Duration.ofSeconds(1);
    @Builder.Default
    public final Duration batchPause = Duration.ofMillis(10);
    @Builder.Default
    public final Duration defaultTimeout = Duration.ofSeconds(30);
    @Builder.Default
    public final Duration enhancedTimeout = Duration.ofSeconds(60);
    @Builder.Default
    public final ProgressListener progressListener = ProgressListener.NONE;

    public static MigrationSettings defaults() {
        return MigrationSettings.builder().build();
    }

    static Path defaultBackupDir() {
        String env = System.getenv(BACKUP_DIR_ENV);
        return Paths.get(env == null || env.isBlank() ? "./backups" : env.trim());
    }

    void check() {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive: " + maxRetries);
        }
        if (maxRetries > MAX_RETRIES_LIMIT) {
            throw new IllegalArgumentException("maxRetries must be at most " + MAX_RETRIES_LIMIT + ": " + maxRetries);
        }
        if (backupDir == null) {
            throw new IllegalArgumentException("backupDir must not be null");
        }
        requireNonNegative("retryBackoffUnit", retryBackoffUnit);
        if (retryBackoffUnit.compareTo(MAX_RETRY_BACKOFF_UNIT) > 0) {
            throw new IllegalArgumentException("retryBackoffUnit must be at most " + MAX_RETRY_BACKOFF_UNIT);
        }
        requireNonNegative("batchPause", batchPause);
        requirePositive("defaultTimeout", defaultTimeout);
        requirePositive("enhancedTimeout", enhancedTimeout);
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
