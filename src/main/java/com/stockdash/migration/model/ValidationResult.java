package com.stockdash.migration.model;

import java.util.List;

/**
 * {@code valid} is true iff {@code issues} is empty.
 */
public record ValidationResult(boolean valid, List<String> issues) {
    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        valid = issues.isEmpty();
    }

    public static ValidationResult of(List<String> issues) {
        return new ValidationResult(true, issues);
    }
}
