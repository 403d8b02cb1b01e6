package com.stockdash.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ForeignKeyRow {
    private String parentTable;
    private String fromColumn;
    private String toColumn;
}
