package com.stockdash.migration.catalog;

import com.stockdash.migration.Migration;
import com.stockdash.migration.StatementAdapter;

import java.util.List;

/**
 * Authentication tables ({@code user}, {@code session}, {@code account}, {@code verification}).
 */
public final class V001CreateAuthTables {
    public static final String ID = "001_v1.0_create_auth_tables";
    public static final String NAME = "Create auth tables";

    static final List<String> UP = List.of(
            "CREATE TABLE IF NOT EXISTS user (" +
                    "id TEXT PRIMARY KEY NOT NULL," +
                    "name TEXT NOT NULL," +
                    "email TEXT NOT NULL," +
                    "email_verified INTEGER NOT NULL," +
                    "image TEXT," +
                    "created_at INTEGER NOT NULL," +
                    "updated_at INTEGER NOT NULL" +
                    ")",
            "CREATE UNIQUE INDEX IF NOT EXISTS user_email_unique ON user (email)",
            "CREATE TABLE IF NOT EXISTS session (" +
                    "id TEXT PRIMARY KEY NOT NULL," +
                    "expires_at INTEGER NOT NULL," +
                    "token TEXT NOT NULL," +
                    "created_at INTEGER NOT NULL," +
                    "updated_at INTEGER NOT NULL," +
                    "ip_address TEXT," +
                    "user_agent TEXT," +
                    "user_id TEXT NOT NULL," +
                    "FOREIGN KEY (user_id) REFERENCES user (id) ON UPDATE NO ACTION ON DELETE NO ACTION" +
                    ")",
            "CREATE UNIQUE INDEX IF NOT EXISTS session_token_unique ON session (token)",
            "CREATE TABLE IF NOT EXISTS account (" +
                    "id TEXT PRIMARY KEY NOT NULL," +
                    "account_id TEXT NOT NULL," +
                    "provider_id TEXT NOT NULL," +
                    "user_id TEXT NOT NULL," +
                    "access_token TEXT," +
                    "refresh_token TEXT," +
                    "id_token TEXT," +
                    "access_token_expires_at INTEGER," +
                    "refresh_token_expires_at INTEGER," +
                    "scope TEXT," +
                    "password TEXT," +
                    "created_at INTEGER NOT NULL," +
                    "updated_at INTEGER NOT NULL," +
                    "FOREIGN KEY (user_id) REFERENCES user (id) ON UPDATE NO ACTION ON DELETE NO ACTION" +
                    ")",
            "CREATE TABLE IF NOT EXISTS verification (" +
                    "id TEXT PRIMARY KEY NOT NULL," +
                    "identifier TEXT NOT NULL," +
                    "value TEXT NOT NULL," +
                    "expires_at INTEGER NOT NULL," +
                    "created_at INTEGER," +
                    "updated_at INTEGER" +
                    ")"
    );

    static final List<String> DOWN = List.of(
            "DROP TABLE IF EXISTS verification",
            "DROP TABLE IF EXISTS account",
            "DROP INDEX IF EXISTS session_token_unique",
            "DROP TABLE IF EXISTS session",
            "DROP INDEX IF EXISTS user_email_unique",
            "DROP TABLE IF EXISTS user"
    );

    private V001CreateAuthTables() {
    }

    public static Migration migration() {
        return Migration.of(ID, NAME, db -> executeAll(db, UP), db -> executeAll(db, DOWN));
    }

    private static void executeAll(StatementAdapter db, List<String> statements) throws Exception {
        for (String sql : statements) {
            db.execute(sql);
        }
    }
}
