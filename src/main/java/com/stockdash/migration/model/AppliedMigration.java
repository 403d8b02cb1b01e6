package com.stockdash.migration.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * 模块说明：AppliedMigration（class）。
 * 主要职责：__migrations 表中的一行已应用迁移记录。
 * 使用建议：供状态查询与回滚判断使用，appliedAt 保留 SQLite 原始时间文本。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class AppliedMigration {
    public final String id;
    public final String name;
    /** SQLite {@code CURRENT_TIMESTAMP} text, UTC. */
    public final String appliedAt;
}
