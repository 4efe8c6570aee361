package schemaguard.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import schemaguard.alert.MigrationAlertLogger;
import schemaguard.config.MigrationConfig;
import schemaguard.db.DatabaseHandle;
import schemaguard.engine.MigrationManager;
import schemaguard.engine.MigrationResult;
import schemaguard.exceptions.MigrateException;
import schemaguard.plan.MigrationPlan;
import schemaguard.registry.OperationCatalog;
import schemaguard.registry.OperationExecutor;
import schemaguard.schema.ApplicationMigrations;
import schemaguard.validation.PathSafetyPolicy;

import java.util.Objects;

/**
 * Startup sequence: open the database file, migrate it, prune old backups and only
 * then hand out an {@link OperationExecutor}.
 *
 * <h2>Example:</h2>
 * <pre>
 * try (Database db = DatabaseBootstrap.start(MigrationConfigLoader.load())) {
 *     long count = db.executor().execute("equipment", "getCount").scalarAsLong();
 * }
 * </pre>
 *
 * <p>If migration fails the handle is closed and the exception propagates; the host
 * must not continue.
 */
public final class DatabaseBootstrap {

    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);

    private DatabaseBootstrap() {
    }

    /**
     * Starts the database with the application's own migrations.
     *
     * @param config the loaded configuration
     * @return the ready database
     * @throws MigrateException if the schema could not be brought to the target version
     */
    public static Database start(MigrationConfig config) throws MigrateException {
        return start(config, ApplicationMigrations.plan(), ApplicationMigrations.TARGET_VERSION);
    }

    /**
     * Starts the database with an explicit plan and target.
     *
     * @param config the loaded configuration
     * @param plan the migrations to apply
     * @param targetVersion the version to reach
     * @return the ready database
     * @throws MigrateException if the schema could not be brought to the target version
     */
    public static Database start(MigrationConfig config, MigrationPlan plan, int targetVersion)
            throws MigrateException {
        Objects.requireNonNull(config, "config");
        MigrationAlertLogger.setAlertLevel(config.alertLevel());
        log.info("Starting database with {}", config);

        MigrationManager manager = MigrationManager.create(config);
        DatabaseHandle handle = DatabaseHandle.open(config.dataDir(), config.databaseName());

        MigrationResult result;
        try {
            result = manager.migrate(handle, plan, targetVersion);
        } catch (MigrateException | RuntimeException e) {
            log.error("Database startup aborted: {}", e.getMessage());
            handle.close();
            throw e;
        }

        int deleted = manager.cleanupOldBackups(config.maxBackups());
        if (deleted > 0) {
            log.info("Removed {} old backup(s)", deleted);
        }

        PathSafetyPolicy paths = new PathSafetyPolicy(config.documentsDir(), config.requireManagedDocuments());
        OperationExecutor executor = new OperationExecutor(handle, OperationCatalog.standard(paths));
        log.info("Database ready at schema version {}", result.toVersion());
        return new Database(handle, manager, result, executor);
    }
}
