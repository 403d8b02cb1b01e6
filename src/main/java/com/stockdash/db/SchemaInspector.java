package com.stockdash.db;

import com.stockdash.db.mybatis.ForeignKeyRow;
import com.stockdash.db.mybatis.MyBatisSupport;
import com.stockdash.db.mybatis.SchemaMapper;
import org.apache.ibatis.session.SqlSession;

import java.sql.SQLException;
import java.util.List;

/**
 * SQLite catalogue and PRAGMA introspection.
 */
public final class SchemaInspector {
    private final Database database;

    public SchemaInspector(Database database) {
        this.database = database;
    }

    /** True when {@code SELECT 1} round-trips. */
    public boolean ping() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            Integer value = session.getMapper(SchemaMapper.class).ping();
            return value != null && value == 1;
        }
    }

    public int foreignKeyViolationCount() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return session.getMapper(SchemaMapper.class).foreignKeyCheck().size();
        }
    }

    /**
     * Result of {@code PRAGMA integrity_check}: {@code "ok"} when healthy, otherwise the
     * reported problems joined with {@code "; "}.
     */
    public String integrityCheck() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            List<String> lines = session.getMapper(SchemaMapper.class).integrityCheck();
            if (lines == null || lines.isEmpty()) {
                return "ok";
            }
            return String.join("; ", lines);
        }
    }

    public List<String> tables() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return List.copyOf(session.getMapper(SchemaMapper.class).listTables());
        }
    }

    public boolean tableExists(String table) throws SQLException {
        return tables().contains(table);
    }

    public List<String> indexes() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return List.copyOf(session.getMapper(SchemaMapper.class).listIndexes());
        }
    }

    public List<String> indexesOn(String table) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return List.copyOf(session.getMapper(SchemaMapper.class).listTableIndexes(table));
        }
    }

    public List<ForeignKeyRow> foreignKeysOf(String table) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return List.copyOf(session.getMapper(SchemaMapper.class).listForeignKeys(table));
        }
    }
}
