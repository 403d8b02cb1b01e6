package com.stockdash.migration.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 模块说明：BackupDescriptor（class）。
 * 主要职责：一次迁移前数据库文件备份的描述信息。
 * 使用建议：由 BackupStore 创建并登记到 __migration_backups，清理时按 createdAt 判断是否过期。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class BackupDescriptor {
    /** Catalogue row id; null until the descriptor has been read back from the database. */
    public final Long id;
    public final String migrationId;
    public final Path path;
    public final long fileSize;
    public final Instant createdAt;
}
