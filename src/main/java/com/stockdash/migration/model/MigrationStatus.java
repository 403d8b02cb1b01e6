package com.stockdash.migration.model;

import java.util.Locale;

/**
 * Current-state value stored in {@code __migration_logs.status}.
 */
public enum MigrationStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    ROLLED_BACK;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MigrationStatus fromDbValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        return MigrationStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
