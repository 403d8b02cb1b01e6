package com.stockdash.migration.model;

import java.util.List;

/**
 * Outcome of a base {@code run}. {@code success=false} does not imply nothing committed:
 * {@code applied} lists every id recorded before the failure.
 */
public record MigrationResult(
        boolean success,
        List<String> applied,
        List<String> errors
) {
    public MigrationResult {
        applied = applied == null ? List.of() : List.copyOf(applied);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
