package com.stockdash.migration;

import com.stockdash.db.AppliedMigrationDao;
import com.stockdash.db.Database;
import com.stockdash.db.SchemaInspector;
import com.stockdash.migration.model.ValidationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataIntegrityValidatorTest {
    private Database database;
    private StatementAdapter statements;
    private AppliedMigrationDao appliedDao;
    private DataIntegrityValidator validator;

    @BeforeEach
    void setUp() throws Exception {
        database = Database.inMemory();
        statements = new StatementAdapter(database);
        appliedDao = new AppliedMigrationDao(database);
        appliedDao.ensureTable();
        validator = new DataIntegrityValidator(new SchemaInspector(database), appliedDao,
                IntegrityRules.stockDashDefaults());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void validate_shouldPassOnEmptyDatabase() {
        ValidationResult result = validator.validate();

        assertTrue(result.valid());
    }

    @Test
    void validate_shouldReportMissingIndexesOfExistingTable() throws Exception {
        statements.execute("CREATE TABLE stocks (ts_code TEXT PRIMARY KEY, symbol TEXT, name TEXT, industry TEXT)");
        statements.execute("CREATE INDEX stocks_symbol_idx ON stocks (symbol)");

        ValidationResult result = validator.validate();

        assertFalse(result.valid());
        assertEquals(List.of("Missing index: stocks_name_idx", "Missing index: stocks_industry_idx"), result.issues());
    }

    @Test
    void validate_shouldReportMissingTablesOnceStockMigrationIsRecorded() throws Exception {
        appliedDao.record(IntegrityRules.STOCKS_MIGRATION_ID, "Create stock tables");

        ValidationResult result = validator.validate();

        assertEquals(List.of("Missing table: stocks", "Missing table: stock_daily", "Missing table: user_stock_favorites"),
                result.issues());
    }

    @Test
    void validate_shouldCountForeignKeyViolations() throws Exception {
        statements.execute("CREATE TABLE parent (id INTEGER PRIMARY KEY)");
        statements.execute("CREATE TABLE child (id INTEGER PRIMARY KEY, parent_id INTEGER REFERENCES parent(id))");
        statements.execute("INSERT INTO child VALUES (1, 5)");
        statements.execute("INSERT INTO child VALUES (2, 6)");

        ValidationResult result = validator.validate();

        assertEquals(List.of("Foreign key violations: 2 rows"), result.issues());
    }
}
