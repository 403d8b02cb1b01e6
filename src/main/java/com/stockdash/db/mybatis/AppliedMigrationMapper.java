package com.stockdash.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

public interface AppliedMigrationMapper {
    @Update("CREATE TABLE IF NOT EXISTS __migrations (" +
            "id TEXT PRIMARY KEY," +
            "name TEXT NOT NULL," +
            "applied_at DATETIME DEFAULT CURRENT_TIMESTAMP," +
            "rollback_sql TEXT" +
            ")")
    void createTable();

    @Select("SELECT id FROM __migrations WHERE id = #{id}")
    String findId(@Param("id") String id);

    @Select("SELECT id FROM __migrations")
    List<String> listIds();

    @Insert("INSERT INTO __migrations (id, name) VALUES (#{id}, #{name})")
    int insert(@Param("id") String id, @Param("name") String name);

    @Delete("DELETE FROM __migrations WHERE id = #{id}")
    int delete(@Param("id") String id);

    @Select("SELECT id, name, applied_at FROM __migrations ORDER BY applied_at ASC, rowid ASC")
    List<AppliedMigrationRow> listApplied();
}
