package com.stockdash.migration;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A hand-authored schema change. Ids follow {@code <seq>_<semver>_<slug>}, for example
 * {@code 002_v1.1_create_stocks_tables}. A missing {@code up} or {@code down} is reported by
 * {@link MigrationRegistry#validate()} rather than rejected at construction.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Migration {
    public final String id;
    public final String name;
    public final MigrationStep up;
    public final MigrationStep down;

    public static Migration of(String id, String name, MigrationStep up, MigrationStep down) {
        return new Migration(id, name, up, down);
    }
}
