package com.stockdash.db;

import com.stockdash.db.mybatis.AppliedMigrationMapper;
import com.stockdash.db.mybatis.AppliedMigrationRow;
import com.stockdash.db.mybatis.MyBatisSupport;
import com.stockdash.migration.model.AppliedMigration;
import org.apache.ibatis.session.SqlSession;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Access to {@code __migrations}, the source of truth for "already applied".
 */
public final class AppliedMigrationDao {
    private final Database database;

    public AppliedMigrationDao(Database database) {
        this.database = database;
    }

    public void ensureTable() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(AppliedMigrationMapper.class).createTable();
        }
    }

    public boolean isApplied(String id) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return session.getMapper(AppliedMigrationMapper.class).findId(id) != null;
        }
    }

    public Set<String> appliedIds() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return new LinkedHashSet<>(session.getMapper(AppliedMigrationMapper.class).listIds());
        }
    }

    public void record(String id, String name) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(AppliedMigrationMapper.class).insert(id, name);
        }
    }

    public boolean delete(String id) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return session.getMapper(AppliedMigrationMapper.class).delete(id) > 0;
        }
    }

    public List<AppliedMigration> listApplied() throws SQLException {
        List<AppliedMigration> out = new ArrayList<>();
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            for (AppliedMigrationRow row : session.getMapper(AppliedMigrationMapper.class).listApplied()) {
                if (row == null) {
                    continue;
                }
                out.add(new AppliedMigration(row.getId(), row.getName(), row.getAppliedAt()));
            }
        }
        return out;
    }
}
