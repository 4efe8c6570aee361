package schemaguard;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One versioned change to the database schema.
 *
 * <p>Implementations run their DDL and data fixes against the live connection.
 * They are registered in a {@link schemaguard.plan.MigrationPlan} under the version
 * they bring the database to; the migration manager runs each at most once and
 * records the version in the ledger after it returns.
 *
 * <h2>Example:</h2>
 * <pre>
 * SchemaMigration addSiteColumn = connection -&gt; {
 *     try (Statement st = connection.createStatement()) {
 *         st.execute("ALTER TABLE equipment ADD COLUMN site VARCHAR(255)");
 *     }
 * };
 * </pre>
 *
 * <p>A step should not swallow its own errors: a thrown exception is what tells the
 * manager to stop and restore the cycle's snapshot.
 *
 * @see schemaguard.engine.MigrationManager
 */
@FunctionalInterface
public interface SchemaMigration {

    /**
     * Apply this migration.
     *
     * @param connection the live connection (autocommit on)
     * @throws SQLException if any statement fails
     */
    void migrate(Connection connection) throws SQLException;
}
