package com.stockdash.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

public interface MigrationLogMapper {
    @Update("CREATE TABLE IF NOT EXISTS __migration_logs (" +
            "id TEXT PRIMARY KEY," +
            "name TEXT NOT NULL," +
            "status TEXT NOT NULL," +
            "started_at INTEGER," +
            "completed_at INTEGER," +
            "error_message TEXT," +
            "backup_path TEXT," +
            "attempt_count INTEGER DEFAULT 0," +
            "created_at INTEGER DEFAULT (CAST(strftime('%s', 'now') AS INTEGER) * 1000)" +
            ")")
    void createTable();

    @Insert("INSERT OR REPLACE INTO __migration_logs (id, name, status, started_at, attempt_count, created_at) " +
            "VALUES (#{id}, #{name}, #{status}, #{startedAt}, 1, #{startedAt})")
    int upsertStart(@Param("id") String id,
                    @Param("name") String name,
                    @Param("status") String status,
                    @Param("startedAt") long startedAt);

    @Update("UPDATE __migration_logs SET attempt_count = #{attemptCount} WHERE id = #{id}")
    int updateAttemptCount(@Param("id") String id, @Param("attemptCount") int attemptCount);

    @Update("UPDATE __migration_logs SET backup_path = #{backupPath} WHERE id = #{id}")
    int updateBackupPath(@Param("id") String id, @Param("backupPath") String backupPath);

    @Update("UPDATE __migration_logs SET status = #{status}, completed_at = #{completedAt} WHERE id = #{id}")
    int updateFinished(@Param("id") String id,
                       @Param("status") String status,
                       @Param("completedAt") long completedAt);

    @Update("UPDATE __migration_logs SET status = #{status}, error_message = #{errorMessage}, attempt_count = #{attemptCount} " +
            "WHERE id = #{id}")
    int updateFailed(@Param("id") String id,
                     @Param("status") String status,
                     @Param("errorMessage") String errorMessage,
                     @Param("attemptCount") int attemptCount);

    @Select("SELECT id, name, status, started_at, completed_at, error_message, backup_path, attempt_count, created_at " +
            "FROM __migration_logs ORDER BY created_at DESC, rowid DESC")
    List<MigrationLogRow> listAll();

    @Select("SELECT id, name, status, started_at, completed_at, error_message, backup_path, attempt_count, created_at " +
            "FROM __migration_logs WHERE id = #{id}")
    MigrationLogRow findById(@Param("id") String id);
}
