package schemaguard.plan;

import schemaguard.SchemaMigration;

import java.util.Objects;

/**
 * A migration procedure together with the schema version it produces.
 *
 * @param version the version after this step runs, greater than zero
 * @param description short human-readable summary, used in the journal
 * @param migration the procedure
 */
public record MigrationStep(int version, String description, SchemaMigration migration) {

    public MigrationStep {
        if (version <= 0) {
            throw new IllegalArgumentException("Migration version must be positive: " + version);
        }
        Objects.requireNonNull(migration, "migration");
        description = description == null ? "" : description;
    }
}
