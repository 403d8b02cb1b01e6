package com.stockdash.migration.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模块说明：HealthReport（record）。
 * 主要职责：迁移子系统健康检查的结果与明细。
 * 使用建议：details 中的键供命令行输出使用，调整键名需同步修改展示逻辑。
 */
public record HealthReport(boolean healthy, Map<String, Object> details) {
    public HealthReport {
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Object detail(String key) {
        return details.get(key);
    }
}
