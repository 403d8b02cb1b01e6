package com.stockdash.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppliedMigrationRow {
    private String id;
    private String name;
    private String appliedAt;
}
