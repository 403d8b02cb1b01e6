package com.stockdash.db;

import com.stockdash.db.mybatis.MigrationLogMapper;
import com.stockdash.db.mybatis.MigrationLogRow;
import com.stockdash.db.mybatis.MyBatisSupport;
import com.stockdash.migration.model.MigrationLogEntry;
import com.stockdash.migration.model.MigrationStatus;
import org.apache.ibatis.session.SqlSession;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Current-state snapshot per migration id in {@code __migration_logs}.
 * Rows are overwritten in place and never deleted.
 */
public final class MigrationLogDao {
    private final Database database;

    public MigrationLogDao(Database database) {
        this.database = database;
    }

    public void ensureTable() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(MigrationLogMapper.class).createTable();
        }
    }

    public void markRunning(String id, String name, Instant startedAt) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(MigrationLogMapper.class)
                    .upsertStart(id, name, MigrationStatus.RUNNING.dbValue(), startedAt.toEpochMilli());
        }
    }

    public void updateAttemptCount(String id, int attemptCount) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(MigrationLogMapper.class).updateAttemptCount(id, attemptCount);
        }
    }

    public void recordBackupPath(String id, String backupPath) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(MigrationLogMapper.class).updateBackupPath(id, backupPath);
        }
    }

    public void markCompleted(String id, Instant completedAt) throws SQLException {
        markFinished(id, MigrationStatus.COMPLETED, completedAt);
    }

    public void markRolledBack(String id, Instant completedAt) throws SQLException {
        markFinished(id, MigrationStatus.ROLLED_BACK, completedAt);
    }

    public void markFailed(String id, String errorMessage, int attemptCount) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(MigrationLogMapper.class)
                    .updateFailed(id, MigrationStatus.FAILED.dbValue(), errorMessage, attemptCount);
        }
    }

    /**
     * All entries, newest first.
     */
    public List<MigrationLogEntry> list() throws SQLException {
        List<MigrationLogEntry> out = new ArrayList<>();
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            for (MigrationLogRow row : session.getMapper(MigrationLogMapper.class).listAll()) {
                if (row != null) {
                    out.add(toEntry(row));
                }
            }
        }
        return out;
    }

    public Optional<MigrationLogEntry> find(String id) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            MigrationLogRow row = session.getMapper(MigrationLogMapper.class).findById(id);
            return row == null ? Optional.empty() : Optional.of(toEntry(row));
        }
    }

    private void markFinished(String id, MigrationStatus status, Instant completedAt) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(MigrationLogMapper.class)
                    .updateFinished(id, status.dbValue(), completedAt.toEpochMilli());
        }
    }

    private static MigrationLogEntry toEntry(MigrationLogRow row) {
        return MigrationLogEntry.builder()
                .id(row.getId())
                .name(row.getName())
                .status(MigrationStatus.fromDbValue(row.getStatus()))
                .startedAt(toInstant(row.getStartedAt()))
                .completedAt(toInstant(row.getCompletedAt()))
                .errorMessage(row.getErrorMessage())
                .backupPath(row.getBackupPath())
                .attemptCount(row.getAttemptCount())
                .createdAt(toInstant(row.getCreatedAt()))
                .build();
    }

    private static Instant toInstant(Long epochMillis) {
        return epochMillis == null ? null : Instant.ofEpochMilli(epochMillis);
    }
}
