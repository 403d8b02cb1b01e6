package com.stockdash.migration;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlScriptTest {

    @Test
    void split_shouldSeparateStatementsOnSemicolons() {
        List<String> statements = SqlScript.split("CREATE TABLE a (id INTEGER);\n CREATE TABLE b (id INTEGER) ;");

        assertEquals(List.of("CREATE TABLE a (id INTEGER)", "CREATE TABLE b (id INTEGER)"), statements);
    }

    @Test
    void split_shouldKeepSingleStatementWithoutTerminator() {
        assertEquals(List.of("PRAGMA foreign_keys = ON"), SqlScript.split("PRAGMA foreign_keys = ON"));
    }

    @Test
    void split_shouldIgnoreSemicolonsInQuotesAndComments() {
        String script = "INSERT INTO notes VALUES ('a;b', 'it''s; fine'); -- trailing; comment\n"
                + "/* block; comment */ INSERT INTO \"odd;name\" VALUES (1)";

        List<String> statements = SqlScript.split(script);

        assertEquals(2, statements.size());
        assertEquals("INSERT INTO notes VALUES ('a;b', 'it''s; fine')", statements.get(0));
        assertTrue(statements.get(1).endsWith("INSERT INTO \"odd;name\" VALUES (1)"));
    }

    @Test
    void split_shouldKeepTriggerBodyTogether() {
        String script = "CREATE TRIGGER stocks_touch AFTER UPDATE ON stocks BEGIN "
                + "UPDATE stocks SET updated_at = 0 WHERE ts_code = NEW.ts_code; END;"
                + "CREATE INDEX s_idx ON stocks (symbol);";

        List<String> statements = SqlScript.split(script);

        assertEquals(2, statements.size());
        assertTrue(statements.get(0).startsWith("CREATE TRIGGER stocks_touch"));
        assertTrue(statements.get(0).endsWith("END"));
        assertEquals("CREATE INDEX s_idx ON stocks (symbol)", statements.get(1));
    }

    @Test
    void split_shouldDropEmptyAndCommentOnlySegments() {
        assertTrue(SqlScript.split("  ;; -- nothing here\n").isEmpty());
        assertTrue(SqlScript.split(null).isEmpty());
    }
}
