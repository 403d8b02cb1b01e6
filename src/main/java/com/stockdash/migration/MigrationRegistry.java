package com.stockdash.migration;

import com.stockdash.migration.model.ValidationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered in-memory list of migrations. Registration order is application order.
 * Duplicates are accepted here and reported by {@link #validate()}.
 */
public final class MigrationRegistry {
    private final List<Migration> migrations = new ArrayList<>();

    public synchronized void register(Migration migration) {
        if (migration == null) {
            throw new IllegalArgumentException("migration must not be null");
        }
        if (migration.id == null || migration.id.isBlank()) {
            throw new IllegalArgumentException("migration id must not be blank");
        }
        migrations.add(migration);
    }

    public synchronized List<Migration> migrations() {
        return Collections.unmodifiableList(new ArrayList<>(migrations));
    }

    public synchronized Optional<Migration> find(String id) {
        for (Migration migration : migrations) {
            if (migration.id.equals(id)) {
                return Optional.of(migration);
            }
        }
        return Optional.empty();
    }

    public synchronized int size() {
        return migrations.size();
    }

    /**
     * Collects every violation: duplicated ids and migrations lacking a procedure.
     */
    public synchronized ValidationResult validate() {
        List<String> issues = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Migration migration : migrations) {
            if (!seen.add(migration.id)) {
                duplicates.add(migration.id);
            }
        }
        if (!duplicates.isEmpty()) {
            issues.add("Duplicate migration IDs: " + String.join(", ", duplicates));
        }

        for (Migration migration : migrations) {
            if (migration.up == null) {
                issues.add("Migration " + migration.id + " missing up function");
            }
            if (migration.down == null) {
                issues.add("Migration " + migration.id + " missing down function");
            }
        }
        return ValidationResult.of(issues);
    }
}
