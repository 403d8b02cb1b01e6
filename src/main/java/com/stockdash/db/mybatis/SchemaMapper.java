package com.stockdash.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;
import java.util.Map;

/**
 * Read-only SQLite schema introspection used by health and integrity checks.
 */
public interface SchemaMapper {
    @Select("SELECT 1 AS test")
    Integer ping();

    @Select("PRAGMA foreign_key_check")
    List<Map<String, Object>> foreignKeyCheck();

    @Select("PRAGMA integrity_check")
    List<String> integrityCheck();

    @Select("SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name")
    List<String> listTables();

    @Select("SELECT name FROM sqlite_master WHERE type = 'index' AND name NOT LIKE 'sqlite_%' ORDER BY name")
    List<String> listIndexes();

    @Select("SELECT name FROM pragma_index_list(#{table})")
    List<String> listTableIndexes(@Param("table") String table);

    @Select("SELECT \"table\" AS parent_table, \"from\" AS from_column, \"to\" AS to_column " +
            "FROM pragma_foreign_key_list(#{table})")
    List<ForeignKeyRow> listForeignKeys(@Param("table") String table);
}
