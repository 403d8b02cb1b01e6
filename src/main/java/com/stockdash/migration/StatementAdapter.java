package com.stockdash.migration;

import com.stockdash.db.Database;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single path through which migration procedures touch the database.
 * <p>
 * A script passed to {@link #execute(Object)} runs statement by statement. {@link #cancelRunning()}
 * interrupts the statement in flight from another thread; SQLite only honours the interrupt
 * between virtual-machine steps, so a statement blocked inside the driver may still finish.
 */
public final class StatementAdapter {
    private static final Logger LOG = LogManager.getLogger(StatementAdapter.class);

    private final Database database;
    private volatile Statement running;

    public StatementAdapter(Database database) {
        this.database = database;
    }

    /**
     * Renders {@code query} and runs every statement of the resulting script in order.
     * A failing statement stops the script; statements before it stay applied.
     */
    public void execute(Object query) throws SQLException {
        List<String> statements = SqlScript.split(render(query));
        Connection conn = database.connection();
        try (Statement st = conn.createStatement()) {
            running = st;
            try {
                for (String sql : statements) {
                    st.execute(sql);
                }
            } finally {
                running = null;
            }
        }
    }

    /**
     * Runs a read-only query and returns its rows with column order preserved.
     */
    public List<Map<String, Object>> query(String sql) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        Connection conn = database.connection();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(meta.getColumnLabel(i), rs.getObject(i));
                }
                rows.add(row);
            }
        }
        return rows;
    }

    public void cancelRunning() {
        Statement current = running;
        if (current == null) {
            return;
        }
        try {
            current.cancel();
        } catch (SQLException e) {
            LOG.warn("Statement cancel failed: {}", e.getMessage());
        }
    }

    public static String render(Object query) throws QueryFormatException {
        if (query instanceof String) {
            return (String) query;
        }
        if (query instanceof QueryFragment) {
            StringBuilder sql = new StringBuilder();
            appendFragment(sql, (QueryFragment) query);
            return sql.toString();
        }
        throw new QueryFormatException("Invalid query format: "
                + (query == null ? "null" : query.getClass().getName()));
    }

    private static void appendFragment(StringBuilder sql, QueryFragment fragment) throws QueryFormatException {
        List<Object> chunks = fragment.chunks();
        List<Object> values = fragment.values();
        for (int i = 0; i < chunks.size(); i++) {
            Object chunk = chunks.get(i);
            if (chunk instanceof String) {
                sql.append((String) chunk);
            } else if (chunk instanceof QueryFragment) {
                appendFragment(sql, (QueryFragment) chunk);
            } else if (chunk instanceof QueryFragment.Raw) {
                appendRaw(sql, ((QueryFragment.Raw) chunk).value());
            } else {
                throw new QueryFormatException("Invalid query chunk at " + i + ": "
                        + (chunk == null ? "null" : chunk.getClass().getName()));
            }
            if (i < values.size()) {
                sql.append(values.get(i));
            }
        }
    }

    private static void appendRaw(StringBuilder sql, Object value) throws QueryFormatException {
        if (value instanceof String) {
            sql.append((String) value);
            return;
        }
        if (value instanceof List) {
            for (Object part : (List<?>) value) {
                sql.append(part);
            }
            return;
        }
        throw new QueryFormatException("Invalid raw chunk value: "
                + (value == null ? "null" : value.getClass().getName()));
    }
}
