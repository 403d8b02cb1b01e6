package com.stockdash.migration;

import com.stockdash.migration.model.ValidationResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRegistryTest {

    @Test
    void validate_shouldReportEveryViolation() {
        MigrationRegistry registry = new MigrationRegistry();
        registry.register(TestMigrations.createTable("X", "t1"));
        registry.register(TestMigrations.createTable("X", "t2"));
        registry.register(Migration.of("Y", "No down", db -> db.execute("SELECT 1"), null));

        ValidationResult result = registry.validate();

        assertFalse(result.valid());
        assertTrue(result.issues().contains("Duplicate migration IDs: X"));
        assertTrue(result.issues().contains("Migration Y missing down function"));
        assertEquals(2, result.issues().size());
    }

    @Test
    void validate_shouldReportMissingUp() {
        MigrationRegistry registry = new MigrationRegistry();
        registry.register(Migration.of("Z", "No up", null, db -> db.execute("SELECT 1")));

        ValidationResult result = registry.validate();

        assertEquals(1, result.issues().size());
        assertEquals("Migration Z missing up function", result.issues().get(0));
    }

    @Test
    void validate_shouldPassForWellFormedRegistry() {
        MigrationRegistry registry = new MigrationRegistry();
        registry.register(TestMigrations.createTable("A", "a"));
        registry.register(TestMigrations.createTable("B", "b"));

        ValidationResult result = registry.validate();

        assertTrue(result.valid());
        assertTrue(result.issues().isEmpty());
        assertEquals("B", registry.migrations().get(1).id);
        assertTrue(registry.find("A").isPresent());
        assertFalse(registry.find("C").isPresent());
    }

    @Test
    void register_shouldRejectProgrammerErrors() {
        MigrationRegistry registry = new MigrationRegistry();

        assertThrows(IllegalArgumentException.class, () -> registry.register(null));
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(Migration.of(" ", "blank", db -> { }, db -> { })));
    }
}
