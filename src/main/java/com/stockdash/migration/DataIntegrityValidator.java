package com.stockdash.migration;

import com.stockdash.db.AppliedMigrationDao;
import com.stockdash.db.SchemaInspector;
import com.stockdash.migration.model.ValidationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs every integrity check and accumulates the violations instead of stopping at the first.
 */
public final class DataIntegrityValidator {
    private static final Logger LOG = LogManager.getLogger(DataIntegrityValidator.class);

    private final SchemaInspector inspector;
    private final AppliedMigrationDao appliedDao;
    private final IntegrityRules rules;

    public DataIntegrityValidator(SchemaInspector inspector, AppliedMigrationDao appliedDao, IntegrityRules rules) {
        this.inspector = inspector;
        this.appliedDao = appliedDao;
        this.rules = rules == null ? IntegrityRules.genericOnly() : rules;
    }

    public ValidationResult validate() {
        List<String> issues = new ArrayList<>();
        try {
            int violations = inspector.foreignKeyViolationCount();
            if (violations > 0) {
                issues.add("Foreign key violations: " + violations + " rows");
            }

            String integrity = inspector.integrityCheck();
            if (!"ok".equalsIgnoreCase(integrity)) {
                issues.add("Integrity check failed: " + integrity);
            }

            List<String> tables = inspector.tables();
            for (Map.Entry<String, List<String>> entry : rules.expectedIndexes.entrySet()) {
                if (!tables.contains(entry.getKey())) {
                    continue;
                }
                List<String> actual = inspector.indexesOn(entry.getKey());
                for (String expected : entry.getValue()) {
                    if (!actual.contains(expected)) {
                        issues.add("Missing index: " + expected);
                    }
                }
            }

            if (rules.trackedMigrationId != null && appliedDao.isApplied(rules.trackedMigrationId)) {
                for (String expected : rules.trackedTables) {
                    if (!tables.contains(expected)) {
                        issues.add("Missing table: " + expected);
                    }
                }
            }
        } catch (SQLException | RuntimeException e) {
            LOG.warn("Integrity validation error: {}", e.getMessage());
            issues.add("Integrity validation error: " + MigrationRunner.describe(e));
        }
        if (!issues.isEmpty()) {
            LOG.warn("Integrity validation found {} issue(s): {}", issues.size(), issues);
        }
        return ValidationResult.of(issues);
    }
}
