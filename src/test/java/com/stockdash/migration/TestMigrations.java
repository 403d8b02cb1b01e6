package com.stockdash.migration;

import java.time.Duration;
import java.util.List;

/**
 * Small hand-written migrations shared by the runner tests.
 */
final class TestMigrations {
    private TestMigrations() {
    }

    static Migration createTable(String id, String table) {
        return createTable(id, table, null);
    }

    static Migration createTable(String id, String table, List<String> downLog) {
        return Migration.of(
                id,
                "Create " + table,
                db -> db.execute("CREATE TABLE IF NOT EXISTS " + table + " (id INTEGER PRIMARY KEY, label TEXT)"),
                db -> {
                    if (downLog != null) {
                        downLog.add(id);
                    }
                    db.execute("DROP TABLE IF EXISTS " + table);
                }
        );
    }

    static Migration failing(String id, String message) {
        return Migration.of(
                id,
                "Failing " + id,
                db -> {
                    throw new IllegalStateException(message);
                },
                db -> {
                }
        );
    }

    static MigrationSettings fastSettings(int maxRetries) {
        return MigrationSettings.builder()
                .maxRetries(maxRetries)
                .batchPause(Duration.ZERO)
                .build();
    }
}
