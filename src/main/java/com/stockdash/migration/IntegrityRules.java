package com.stockdash.migration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural expectations checked by {@link DataIntegrityValidator}: indexes that must exist on a
 * table whenever the table exists, and the tables a tracked migration must have left behind.
 */
public final class IntegrityRules {
    public static final String STOCKS_MIGRATION_ID = "002_v1.1_create_stocks_tables";

    public final Map<String, List<String>> expectedIndexes;
    public final String trackedMigrationId;
    public final List<String> trackedTables;

    public IntegrityRules(Map<String, List<String>> expectedIndexes, String trackedMigrationId, List<String> trackedTables) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (expectedIndexes != null) {
            for (Map.Entry<String, List<String>> entry : expectedIndexes.entrySet()) {
                copy.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
        }
        this.expectedIndexes = Collections.unmodifiableMap(copy);
        this.trackedMigrationId = trackedMigrationId;
        this.trackedTables = trackedTables == null ? List.of() : List.copyOf(trackedTables);
    }

    public static IntegrityRules stockDashDefaults() {
        Map<String, List<String>> indexes = new LinkedHashMap<>();
        indexes.put("stocks", List.of("stocks_symbol_idx", "stocks_name_idx", "stocks_industry_idx"));
        return new IntegrityRules(
                indexes,
                STOCKS_MIGRATION_ID,
                List.of("stocks", "stock_daily", "user_stock_favorites")
        );
    }

    /** Only the generic foreign-key and consistency checks. */
    public static IntegrityRules genericOnly() {
        return new IntegrityRules(Map.of(), null, List.of());
    }
}
