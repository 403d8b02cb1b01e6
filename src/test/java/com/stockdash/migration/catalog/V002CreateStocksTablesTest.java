package com.stockdash.migration.catalog;

import com.stockdash.migration.Migration;
import com.stockdash.migration.StatementAdapter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class V002CreateStocksTablesTest {

    @Test
    void upStatements_shouldEnableForeignKeysThenCreateEachTableBeforeItsIndexes() throws Exception {
        List<String> sql = render(V002CreateStocksTables.upStatements());

        assertEquals("PRAGMA foreign_keys = ON", sql.get(0));
        assertTrue(sql.get(1).startsWith("CREATE TABLE IF NOT EXISTS stocks ("));
        assertEquals("CREATE INDEX IF NOT EXISTS stocks_symbol_idx ON stocks (symbol)", sql.get(2));
        assertTrue(sql.contains(
                "CREATE UNIQUE INDEX IF NOT EXISTS stock_daily_ts_code_trade_date_idx ON stock_daily (ts_code, trade_date)"));
        assertEquals(1 + 3 + 12, sql.size());
        assertTrue(sql.indexOf("CREATE INDEX IF NOT EXISTS stock_daily_trade_date_idx ON stock_daily (trade_date)")
                > indexOfPrefix(sql, "CREATE TABLE IF NOT EXISTS stock_daily"));
    }

    @Test
    void downStatements_shouldDropChildrenFirst() throws Exception {
        List<String> sql = render(V002CreateStocksTables.downStatements());

        assertEquals("DROP INDEX IF EXISTS user_stock_favorites_user_ts_code_idx", sql.get(0));
        assertEquals("DROP TABLE IF EXISTS stocks", sql.get(sql.size() - 1));
        assertTrue(sql.indexOf("DROP TABLE IF EXISTS user_stock_favorites") < sql.indexOf("DROP TABLE IF EXISTS stock_daily"));
    }

    @Test
    void all_shouldListCatalogInOrder() {
        List<Migration> all = StockDashMigrations.all();

        assertEquals(2, all.size());
        assertEquals(V001CreateAuthTables.ID, all.get(0).id);
        assertEquals(V002CreateStocksTables.ID, all.get(1).id);
    }

    private static List<String> render(List<Object> statements) throws Exception {
        List<String> out = new ArrayList<>();
        for (Object statement : statements) {
            out.add(StatementAdapter.render(statement));
        }
        return out;
    }

    private static int indexOfPrefix(List<String> sql, String prefix) {
        for (int i = 0; i < sql.size(); i++) {
            if (sql.get(i).startsWith(prefix)) {
                return i;
            }
        }
        return -1;
    }
}
