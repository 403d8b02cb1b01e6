package com.stockdash.db;

import com.stockdash.db.mybatis.BackupRow;
import com.stockdash.db.mybatis.MigrationBackupMapper;
import com.stockdash.db.mybatis.MyBatisSupport;
import com.stockdash.migration.model.BackupDescriptor;
import org.apache.ibatis.session.SqlSession;

import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class MigrationBackupDao {
    private final Database database;

    public MigrationBackupDao(Database database) {
        this.database = database;
    }

    public void ensureTable() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(MigrationBackupMapper.class).createTable();
        }
    }

    public void insert(BackupDescriptor backup) throws SQLException {
        BackupRow row = BackupRow.builder()
                .migrationId(backup.migrationId)
                .backupPath(backup.path.toString())
                .fileSize(backup.fileSize)
                .createdAt(backup.createdAt.toEpochMilli())
                .build();
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(MigrationBackupMapper.class).insert(row);
        }
    }

    public List<BackupDescriptor> listAll() throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return toDescriptors(session.getMapper(MigrationBackupMapper.class).listAll());
        }
    }

    public List<BackupDescriptor> listCreatedBefore(Instant cutoff) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            return toDescriptors(session.getMapper(MigrationBackupMapper.class).listCreatedBefore(cutoff.toEpochMilli()));
        }
    }

    public void delete(long id) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(database.connection())) {
            session.getMapper(MigrationBackupMapper.class).delete(id);
        }
    }

    private static List<BackupDescriptor> toDescriptors(List<BackupRow> rows) {
        List<BackupDescriptor> out = new ArrayList<>();
        for (BackupRow row : rows) {
            if (row == null || row.getBackupPath() == null) {
                continue;
            }
            out.add(new BackupDescriptor(
                    row.getId(),
                    row.getMigrationId(),
                    Paths.get(row.getBackupPath()),
                    row.getFileSize(),
                    Instant.ofEpochMilli(row.getCreatedAt())
            ));
        }
        return out;
    }
}
