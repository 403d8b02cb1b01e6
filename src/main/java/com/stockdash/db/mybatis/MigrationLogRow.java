package com.stockdash.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MigrationLogRow {
    private String id;
    private String name;
    private String status;
    private Long startedAt;
    private Long completedAt;
    private String errorMessage;
    private String backupPath;
    private int attemptCount;
    private Long createdAt;
}
