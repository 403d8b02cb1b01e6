package com.stockdash.migration;

import com.stockdash.db.Database;
import com.stockdash.db.SchemaInspector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatementAdapterTest {
    private Database database;
    private StatementAdapter statements;

    @BeforeEach
    void setUp() {
        database = Database.inMemory();
        statements = new StatementAdapter(database);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void render_shouldPassLiteralSqlThrough() throws Exception {
        assertEquals("SELECT 1", StatementAdapter.render("SELECT 1"));
    }

    @Test
    void render_shouldFlattenNestedFragmentsDepthFirst() throws Exception {
        QueryFragment columns = QueryFragment.of("(", QueryFragment.raw(List.of("symbol", ", ", "name")), ")");
        QueryFragment fragment = QueryFragment.of(
                "CREATE INDEX IF NOT EXISTS ",
                QueryFragment.raw("stocks_symbol_name_idx"),
                " ON stocks ",
                columns
        );

        assertEquals("CREATE INDEX IF NOT EXISTS stocks_symbol_name_idx ON stocks (symbol, name)",
                StatementAdapter.render(fragment));
    }

    @Test
    void render_shouldInlineValueAfterMatchingChunk() throws Exception {
        QueryFragment fragment = QueryFragment.of("SELECT ", " + ", "").withValues(40, 2);

        assertEquals("SELECT 40 + 2", StatementAdapter.render(fragment));
    }

    @Test
    void render_shouldRejectUnknownInput() {
        QueryFormatException error = assertThrows(QueryFormatException.class, () -> StatementAdapter.render(42));
        assertTrue(error.getMessage().startsWith("Invalid query format"));
        assertThrows(QueryFormatException.class, () -> StatementAdapter.render(null));
    }

    @Test
    void render_shouldRejectUnknownChunk() {
        QueryFragment fragment = QueryFragment.of("SELECT ", 1L);

        QueryFormatException error = assertThrows(QueryFormatException.class, () -> StatementAdapter.render(fragment));
        assertTrue(error.getMessage().contains("chunk at 1"));
    }

    @Test
    void execute_shouldRunStatementsAndQueryRows() throws Exception {
        statements.execute("CREATE TABLE quotes (code TEXT, close REAL)");
        statements.execute(QueryFragment.of("INSERT INTO quotes VALUES ('7203', ", ")").withValues(2750.5));

        List<Map<String, Object>> rows = statements.query("SELECT code, close FROM quotes");

        assertEquals(1, rows.size());
        assertEquals("7203", rows.get(0).get("code"));
        assertEquals(2750.5, ((Number) rows.get(0).get("close")).doubleValue(), 1e-9);
    }

    @Test
    void execute_shouldRunEveryStatementOfScript() throws Exception {
        statements.execute("CREATE TABLE a (id INTEGER); CREATE TABLE b (id INTEGER);\n"
                + "INSERT INTO a VALUES (1); INSERT INTO b VALUES (2)");

        SchemaInspector inspector = new SchemaInspector(database);
        assertTrue(inspector.tableExists("a"));
        assertTrue(inspector.tableExists("b"));
        assertEquals(1, statements.query("SELECT id FROM b").size());
    }

    @Test
    void execute_shouldStopScriptAtFailingStatement() throws Exception {
        assertThrows(SQLException.class, () -> statements.execute(
                "CREATE TABLE a (id INTEGER); INSERT INTO missing VALUES (1); CREATE TABLE c (id INTEGER)"));

        SchemaInspector inspector = new SchemaInspector(database);
        assertTrue(inspector.tableExists("a"));
        assertFalse(inspector.tableExists("c"));
    }

    @Test
    void execute_shouldSurfaceDriverErrors() {
        assertThrows(SQLException.class, () -> statements.execute("INVALID SQL STATEMENT"));
    }

    @Test
    void cancelRunning_shouldBeNoOpWhenIdle() {
        statements.cancelRunning();
    }
}
