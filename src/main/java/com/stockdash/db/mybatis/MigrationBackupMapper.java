package com.stockdash.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

public interface MigrationBackupMapper {
    @Update("CREATE TABLE IF NOT EXISTS __migration_backups (" +
            "id INTEGER PRIMARY KEY AUTOINCREMENT," +
            "migration_id TEXT NOT NULL," +
            "backup_path TEXT NOT NULL," +
            "file_size INTEGER NOT NULL," +
            "created_at INTEGER DEFAULT (CAST(strftime('%s', 'now') AS INTEGER) * 1000)" +
            ")")
    void createTable();

    @Insert("INSERT INTO __migration_backups (migration_id, backup_path, file_size, created_at) " +
            "VALUES (#{migrationId}, #{backupPath}, #{fileSize}, #{createdAt})")
    int insert(BackupRow row);

    @Select("SELECT id, migration_id, backup_path, file_size, created_at FROM __migration_backups " +
            "ORDER BY created_at DESC, id DESC")
    List<BackupRow> listAll();

    @Select("SELECT id, migration_id, backup_path, file_size, created_at FROM __migration_backups " +
            "WHERE created_at < #{cutoff} ORDER BY created_at ASC, id ASC")
    List<BackupRow> listCreatedBefore(@Param("cutoff") long cutoff);

    @Delete("DELETE FROM __migration_backups WHERE id = #{id}")
    int delete(@Param("id") long id);
}
