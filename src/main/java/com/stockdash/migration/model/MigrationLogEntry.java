package com.stockdash.migration.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 模块说明：MigrationLogEntry（class）。
 * 主要职责：__migration_logs 中单个迁移的当前执行状态。
 * 使用建议：重试时只更新 attemptCount，最终状态与错误信息在迁移结束时写入。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class MigrationLogEntry {
    public final String id;
    public final String name;
    public final MigrationStatus status;
    public final Instant startedAt;
    public final Instant completedAt;
    public final String errorMessage;
    public final String backupPath;
    public final int attemptCount;
    public final Instant createdAt;
}
