package com.stockdash.migration.catalog;

import com.stockdash.migration.Migration;
import com.stockdash.migration.QueryFragment;
import com.stockdash.migration.StatementAdapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stock master data, daily bars and user favourites.
 * <p>
 * Indexes are declared once in {@link #INDEXES} and rendered as fragments for both directions.
 * Tables are dropped children first so foreign keys never dangle.
 */
public final class V002CreateStocksTables {
    public static final String ID = "002_v1.1_create_stocks_tables";
    public static final String NAME = "Create stock tables";

    public static final List<String> TABLES = List.of("stocks", "stock_daily", "user_stock_favorites");

    static final List<IndexDef> INDEXES = List.of(
            new IndexDef("stocks_symbol_idx", "stocks", false, "symbol"),
            new IndexDef("stocks_name_idx", "stocks", false, "name"),
            new IndexDef("stocks_industry_idx", "stocks", false, "industry"),
            new IndexDef("stocks_market_idx", "stocks", false, "market"),
            new IndexDef("stocks_industry_market_idx", "stocks", false, "industry", "market"),
            new IndexDef("stock_daily_ts_code_trade_date_idx", "stock_daily", true, "ts_code", "trade_date"),
            new IndexDef("stock_daily_trade_date_idx", "stock_daily", false, "trade_date"),
            new IndexDef("stock_daily_ts_code_idx", "stock_daily", false, "ts_code"),
            new IndexDef("stock_daily_ts_code_date_range_idx", "stock_daily", false, "ts_code", "trade_date"),
            new IndexDef("user_stock_favorites_user_ts_code_idx", "user_stock_favorites", true, "user_id", "ts_code"),
            new IndexDef("user_stock_favorites_user_id_idx", "user_stock_favorites", false, "user_id"),
            new IndexDef("user_stock_favorites_ts_code_idx", "user_stock_favorites", false, "ts_code")
    );

    private static final String CREATE_STOCKS = "CREATE TABLE IF NOT EXISTS stocks (" +
            "ts_code TEXT PRIMARY KEY," +
            "symbol TEXT NOT NULL," +
            "name TEXT NOT NULL," +
            "area TEXT," +
            "industry TEXT," +
            "market TEXT," +
            "list_date TEXT," +
            "is_hs TEXT," +
            "created_at INTEGER NOT NULL," +
            "updated_at INTEGER NOT NULL" +
            ")";

    private static final String CREATE_STOCK_DAILY = "CREATE TABLE IF NOT EXISTS stock_daily (" +
            "id INTEGER PRIMARY KEY AUTOINCREMENT," +
            "ts_code TEXT NOT NULL," +
            "trade_date TEXT NOT NULL," +
            "open REAL NOT NULL," +
            "high REAL NOT NULL," +
            "low REAL NOT NULL," +
            "close REAL NOT NULL," +
            "vol REAL DEFAULT 0," +
            "amount REAL DEFAULT 0," +
            "created_at INTEGER NOT NULL," +
            "FOREIGN KEY (ts_code) REFERENCES stocks (ts_code) ON DELETE CASCADE ON UPDATE CASCADE" +
            ")";

    private static final String CREATE_USER_STOCK_FAVORITES = "CREATE TABLE IF NOT EXISTS user_stock_favorites (" +
            "id INTEGER PRIMARY KEY AUTOINCREMENT," +
            "user_id TEXT NOT NULL," +
            "ts_code TEXT NOT NULL," +
            "created_at INTEGER NOT NULL," +
            "FOREIGN KEY (user_id) REFERENCES user (id) ON DELETE CASCADE ON UPDATE CASCADE," +
            "FOREIGN KEY (ts_code) REFERENCES stocks (ts_code) ON DELETE CASCADE ON UPDATE CASCADE" +
            ")";

    private V002CreateStocksTables() {
    }

    public static Migration migration() {
        return Migration.of(ID, NAME, db -> executeAll(db, upStatements()), db -> executeAll(db, downStatements()));
    }

    /**
     * Forward statements in execution order: foreign-key enforcement first, then each table
     * followed by its indexes.
     */
    public static List<Object> upStatements() {
        List<Object> out = new ArrayList<>();
        out.add("PRAGMA foreign_keys = ON");
        for (String table : TABLES) {
            out.add(createTableSql(table));
            for (IndexDef index : INDEXES) {
                if (index.table.equals(table)) {
                    out.add(index.create());
                }
            }
        }
        return out;
    }

    public static List<Object> downStatements() {
        List<String> tables = new ArrayList<>(TABLES);
        Collections.reverse(tables);
        List<Object> out = new ArrayList<>();
        for (String table : tables) {
            for (IndexDef index : INDEXES) {
                if (index.table.equals(table)) {
                    out.add(index.drop());
                }
            }
            out.add("DROP TABLE IF EXISTS " + table);
        }
        return out;
    }

    public static List<String> indexNames() {
        List<String> names = new ArrayList<>();
        for (IndexDef index : INDEXES) {
            names.add(index.name);
        }
        return names;
    }

    private static String createTableSql(String table) {
        switch (table) {
            case "stocks":
                return CREATE_STOCKS;
            case "stock_daily":
                return CREATE_STOCK_DAILY;
            case "user_stock_favorites":
                return CREATE_USER_STOCK_FAVORITES;
            default:
                throw new IllegalArgumentException("unknown table: " + table);
        }
    }

    private static void executeAll(StatementAdapter db, List<Object> statements) throws Exception {
        for (Object statement : statements) {
            db.execute(statement);
        }
    }

    static final class IndexDef {
        final String name;
        final String table;
        final boolean unique;
        final List<String> columns;

        IndexDef(String name, String table, boolean unique, String... columns) {
            this.name = name;
            this.table = table;
            this.unique = unique;
            this.columns = List.of(columns);
        }

        QueryFragment create() {
            return QueryFragment.of(
                    unique ? "CREATE UNIQUE INDEX IF NOT EXISTS " : "CREATE INDEX IF NOT EXISTS ",
                    QueryFragment.raw(name),
                    " ON ",
                    QueryFragment.raw(table),
                    QueryFragment.of(" (", QueryFragment.raw(String.join(", ", columns)), ")")
            );
        }

        QueryFragment drop() {
            return QueryFragment.of("DROP INDEX IF EXISTS ", QueryFragment.raw(name));
        }
    }
}
