package com.stockdash.migration.catalog;

import com.stockdash.migration.Migration;

import java.util.List;

public final class StockDashMigrations {
    private StockDashMigrations() {
    }

    /** Every shipped migration, in application order. */
    public static List<Migration> all() {
        return List.of(
                V001CreateAuthTables.migration(),
                V002CreateStocksTables.migration()
        );
    }
}
