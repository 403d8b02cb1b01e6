package com.stockdash.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupRow {
    private Long id;
    private String migrationId;
    private String backupPath;
    private long fileSize;
    private long createdAt;
}
