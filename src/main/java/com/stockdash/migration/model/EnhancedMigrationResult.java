package com.stockdash.migration.model;

import java.util.List;

/**
 * Outcome of an enhanced run. {@code applied} holds the ids still committed when the run
 * returned; ids undone by auto-rollback move to {@code rolledBack}, in rollback order.
 */
public record EnhancedMigrationResult(
        boolean success,
        List<String> applied,
        List<String> errors,
        List<String> backups,
        List<String> rolledBack
) {
    public EnhancedMigrationResult {
        applied = applied == null ? List.of() : List.copyOf(applied);
        errors = errors == null ? List.of() : List.copyOf(errors);
        backups = backups == null ? List.of() : List.copyOf(backups);
        rolledBack = rolledBack == null ? List.of() : List.copyOf(rolledBack);
    }
}
