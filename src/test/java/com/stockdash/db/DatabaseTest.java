package com.stockdash.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseTest {
    @TempDir
    Path tempDir;

    @Test
    void constructor_shouldRejectBlankLocation() {
        assertThrows(IllegalArgumentException.class, () -> new Database("  ", false));
    }

    @Test
    void inMemory_shouldNotBeFileBacked() {
        try (Database database = Database.inMemory()) {
            assertFalse(database.isFileBacked());
            assertFalse(database.file().isPresent());
            assertEquals("jdbc:sqlite::memory:", database.jdbcUrl());
        }
    }

    @Test
    void jdbcPrefix_shouldBeStripped() {
        Path file = tempDir.resolve("x.db");
        try (Database database = new Database("jdbc:sqlite:" + file, false)) {
            assertTrue(database.isFileBacked());
            assertEquals(file.toAbsolutePath().normalize(), database.file().orElseThrow());
        }
    }

    @Test
    void reopen_shouldKeepFileBackedData() throws Exception {
        Path file = tempDir.resolve("nested").resolve("dir").resolve("live.db");
        try (Database database = new Database(file.toString(), true)) {
            try (Statement st = database.connection().createStatement()) {
                st.execute("CREATE TABLE t (v INTEGER)");
                st.execute("INSERT INTO t VALUES (7)");
            }
            assertTrue(Files.exists(file));

            database.reopen();

            Connection conn = database.connection();
            try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT v FROM t")) {
                assertTrue(rs.next());
                assertEquals(7, rs.getInt(1));
            }
        }
    }
}
