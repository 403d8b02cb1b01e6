package com.stockdash.migration;

/**
 * A forward or backward migration procedure.
 */
@FunctionalInterface
public interface MigrationStep {
    void apply(StatementAdapter db) throws Exception;
}
