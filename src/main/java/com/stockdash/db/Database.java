package com.stockdash.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Optional;

/**
 * Embedded SQLite handle owning exactly one live connection.
 * <p>
 * The location {@value #MEMORY} denotes an ephemeral, non-file-backed database. Every other
 * location is resolved to a database file, which is what backups copy and restores overwrite.
 * The handle is not safe for concurrent writers; callers serialize access.
 */
public final class Database implements AutoCloseable {
    public static final String MEMORY = ":memory:";
    /** log4j thread-context key carrying the id of the migration currently executing. */
    public static final String LOG_CONTEXT_MIGRATION = "migration";

    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");

    private final String location;
    private final Path file;
    private final boolean sqlLogEnabled;
    private Connection connection;

    public Database(String location, boolean sqlLogEnabled) {
        if (isBlank(location)) {
            throw new IllegalArgumentException("db.path must not be empty");
        }
        this.location = normalizeLocation(location);
        this.file = MEMORY.equals(this.location) ? null : Paths.get(this.location).toAbsolutePath().normalize();
        this.sqlLogEnabled = sqlLogEnabled;
    }

    public static Database inMemory() {
        return new Database(MEMORY, false);
    }

    /**
     * Returns the live connection, opening it on first use.
     */
    public synchronized Connection connection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            connection = open();
        }
        return connection;
    }

    /**
     * Closes the live connection and opens a fresh one against the same location.
     * For an in-memory database this discards all data, so callers only reopen file-backed handles.
     */
    public synchronized void reopen() throws SQLException {
        closeQuietly();
        connection = open();
    }

    public boolean isFileBacked() {
        return file != null;
    }

    public Optional<Path> file() {
        return Optional.ofNullable(file);
    }

    public String location() {
        return location;
    }

    public String jdbcUrl() {
        return "jdbc:sqlite:" + (file == null ? MEMORY : file.toString());
    }

    @Override
    public synchronized void close() {
        closeQuietly();
    }

    private Connection open() throws SQLException {
        if (file != null) {
            ensureParentDirectory();
        }
        try {
            Connection raw = DriverManager.getConnection(jdbcUrl());
            try (Statement st = raw.createStatement()) {
                st.execute("PRAGMA busy_timeout=5000");
            }
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String cwd = Paths.get(".").toAbsolutePath().normalize().toString();
            String details = "DB connect failed: jdbc_url=" + jdbcUrl()
                    + ", cwd=" + cwd
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    private void ensureParentDirectory() throws SQLException {
        Path parent = file.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SQLException("cannot create database directory: " + parent, e);
        }
    }

    private void closeQuietly() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("DB close failed: jdbc_url={} cause={}", jdbcUrl(), e.getMessage());
        } finally {
            connection = null;
        }
    }

    private static String normalizeLocation(String raw) {
        String value = raw.trim();
        if (value.toLowerCase(Locale.ROOT).startsWith("jdbc:sqlite:")) {
            value = value.substring("jdbc:sqlite:".length());
        }
        if (value.startsWith("file:")) {
            value = value.substring("file:".length());
        }
        if (value.isEmpty()) {
            throw new IllegalArgumentException("db.path must not be empty");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("locked") || msg.contains("busy")) {
            return "locked";
        }
        if (msg.contains("no such file") || msg.contains("cannot open") || msg.contains("does not exist")) {
            return "missing_dir";
        }
        return "connection_error";
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
