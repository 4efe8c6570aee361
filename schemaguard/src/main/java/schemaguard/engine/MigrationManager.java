package schemaguard.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import schemaguard.alert.MigrationAlertLogger;
import schemaguard.alert.MigrationJournal;
import schemaguard.backup.BackupInfo;
import schemaguard.backup.BackupStore;
import schemaguard.backup.RollbackManager;
import schemaguard.config.MigrationConfig;
import schemaguard.db.DatabaseHandle;
import schemaguard.db.SchemaVersionLedger;
import schemaguard.exceptions.BackupCreationException;
import schemaguard.exceptions.MigrateException;
import schemaguard.exceptions.MigrationStepException;
import schemaguard.exceptions.MigrationTimeoutException;
import schemaguard.exceptions.RollbackException;
import schemaguard.plan.MigrationPlan;
import schemaguard.plan.MigrationStep;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Brings the embedded database from its recorded schema version up to a target version.
 *
 * <p>One cycle:
 * <ol>
 *   <li>create the ledger table if needed and read the current version</li>
 *   <li>return immediately if the database is already at or past the target</li>
 *   <li>snapshot the live file (skipped on a fresh install)</li>
 *   <li>run each pending step in ascending order, recording its version after it returns</li>
 *   <li>on the first failure restore the snapshot and stop</li>
 * </ol>
 *
 * <p>Versions without a registered step are skipped. The manager never migrates backward.
 *
 * <p>Every state transition is appended to the {@link MigrationJournal}; structured
 * events go through {@link MigrationAlertLogger}.
 *
 * <h2>Example:</h2>
 * <pre>
 * MigrationManager manager = MigrationManager.create(config);
 * MigrationResult result = manager.runMigrations(handle, ApplicationMigrations.plan(),
 *         ApplicationMigrations.TARGET_VERSION);
 * if (!result.success()) {
 *     // database was restored; abort startup
 * }
 * manager.cleanupOldBackups(config.maxBackups());
 * </pre>
 *
 * <p>Not thread-safe. A single cycle runs at startup, before any other use of the handle.
 */
public class MigrationManager {

    private static final Logger log = LoggerFactory.getLogger(MigrationManager.class);

    private final BackupStore backupStore;
    private final RollbackManager rollbackManager;
    private final MigrationJournal journal;
    private final MigrationTimeoutConfig timeouts;
    private final SchemaVersionLedger ledger = new SchemaVersionLedger();

    public MigrationManager(
            BackupStore backupStore,
            RollbackManager rollbackManager,
            MigrationJournal journal,
            MigrationTimeoutConfig timeouts
    ) {
        this.backupStore = Objects.requireNonNull(backupStore, "backupStore");
        this.rollbackManager = Objects.requireNonNull(rollbackManager, "rollbackManager");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.timeouts = timeouts != null ? timeouts : MigrationTimeoutConfig.DEFAULTS;
    }

    /**
     * Wires a manager from configuration: journal file, backup directory and timeouts.
     *
     * @param config the loaded configuration
     * @return a new manager
     */
    public static MigrationManager create(MigrationConfig config) {
        MigrationJournal journal = new MigrationJournal(config.logFile());
        BackupStore store = new BackupStore(config.backupDir(), journal);
        return new MigrationManager(store, new RollbackManager(store, journal), journal,
                MigrationTimeoutConfig.from(config));
    }

    /**
     * Runs one migration cycle and reports failures as exceptions.
     *
     * @param handle the live database handle; left closed after a rollback
     * @param plan the available migrations
     * @param targetVersion the version to reach
     * @return the outcome of a successful cycle
     * @throws BackupCreationException if the snapshot could not be taken (nothing was migrated)
     * @throws MigrationStepException if a step failed (the snapshot has been restored, if one was taken)
     * @throws RollbackException if restoring the snapshot failed
     * @throws MigrateException if the ledger could not be read
     */
    public MigrationResult migrate(DatabaseHandle handle, MigrationPlan plan, int targetVersion)
            throws MigrateException {
        Cycle cycle = new Cycle();
        runCycle(handle, plan, targetVersion, cycle);
        return cycle.succeeded();
    }

    /**
     * Runs one migration cycle and reports failures in the result.
     *
     * @param handle the live database handle; left closed after a rollback
     * @param plan the available migrations
     * @param targetVersion the version to reach
     * @return the outcome; {@code success=false} carries the error message and the exception
     */
    public MigrationResult runMigrations(DatabaseHandle handle, MigrationPlan plan, int targetVersion) {
        Cycle cycle = new Cycle();
        try {
            runCycle(handle, plan, targetVersion, cycle);
            return cycle.succeeded();
        } catch (MigrateException | RuntimeException e) {
            log.error("Migration cycle failed: {}", e.getMessage());
            return cycle.failed(e);
        }
    }

    /**
     * Reads the current schema version.
     *
     * @param handle an open handle
     * @return the highest recorded version, 0 for a database without a ledger
     * @throws MigrateException if the ledger cannot be read
     */
    public int getCurrentSchemaVersion(DatabaseHandle handle) throws MigrateException {
        return ledger.currentVersion(handle.connection());
    }

    /**
     * Deletes all but the {@code maxBackups} newest backups.
     *
     * @param maxBackups the retention ceiling
     * @return the number of backups deleted
     */
    public int cleanupOldBackups(int maxBackups) {
        return backupStore.cleanupOldBackups(maxBackups);
    }

    /**
     * @return the backups, newest first
     */
    public List<BackupInfo> getBackupInfo() {
        return backupStore.listBackups();
    }

    public BackupStore backupStore() {
        return backupStore;
    }

    public MigrationJournal journal() {
        return journal;
    }

    // ===== cycle =====

    private void runCycle(DatabaseHandle handle, MigrationPlan plan, int targetVersion, Cycle cycle)
            throws MigrateException {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(plan, "plan");

        ledger.ensure(handle.connection());
        int current = ledger.currentVersion(handle.connection());
        cycle.from = current;
        cycle.current = current;

        journal.log("Current schema version: " + current + ", target version: " + targetVersion);

        if (current >= targetVersion) {
            journal.log("Database is up to date");
            return;
        }

        long cycleStart = System.currentTimeMillis();
        MigrationAlertLogger.cycleStarted(current, targetVersion);

        if (!handle.existedBeforeOpen() && current == 0) {
            journal.log("Fresh database, skipping backup");
        } else {
            cycle.backup = snapshot(handle);
        }

        int next = current + 1;
        for (MigrationStep step : plan.pending(current, targetVersion)) {
            logSkipped(next, step.version());
            applyStep(handle, step, cycle);
            next = step.version() + 1;
        }
        logSkipped(next, targetVersion + 1);

        journal.log("All migrations completed successfully");
        MigrationAlertLogger.cycleCompleted(cycle.from, cycle.current, cycle.applied.size(),
                System.currentTimeMillis() - cycleStart);
    }

    private void logSkipped(int fromInclusive, int toExclusive) {
        for (int version = fromInclusive; version < toExclusive; version++) {
            journal.log("No migration registered for version " + version + ", skipping");
        }
    }

    private Path snapshot(DatabaseHandle handle) throws BackupCreationException {
        try {
            handle.close();
            return TimeoutExecutor.call("backup", timeouts.backupTimeout(),
                    () -> backupStore.createBackup(handle.databaseFile())).orElse(null);
        } catch (MigrationTimeoutException e) {
            journal.log("Backup timed out: " + e.getMessage());
            throw new BackupCreationException("Backup timed out after " + e.getTimeout().toMillis() + " ms", e);
        } catch (Exception e) {
            throw new BackupCreationException("Failed to create backup: " + e.getMessage(), e);
        } finally {
            handle.reopen();
        }
    }

    private void applyStep(DatabaseHandle handle, MigrationStep step, Cycle cycle) throws MigrateException {
        int version = step.version();
        journal.log("Running migration to version " + version
                + (step.description().isEmpty() ? "" : ": " + step.description()));
        MigrationAlertLogger.stepStarted(version);
        long start = System.currentTimeMillis();

        try {
            TimeoutExecutor.run("migration#" + version, timeouts.stepTimeout(),
                    () -> step.migration().migrate(handle.connection()));
            ledger.record(handle.connection(), version);
        } catch (Exception e) {
            journal.log("Migration to version " + version + " failed: " + e.getMessage());
            MigrationAlertLogger.stepFailed(version, e);
            MigrationStepException failure = new MigrationStepException(version, e);
            rollback(handle, version, cycle, failure);
            throw failure;
        }

        cycle.current = version;
        cycle.applied.add(version);
        journal.log("Schema version updated to " + version);
        journal.log("Migration to version " + version + " completed successfully");
        MigrationAlertLogger.stepCompleted(version, System.currentTimeMillis() - start);
    }

    private void rollback(DatabaseHandle handle, int version, Cycle cycle, MigrationStepException failure)
            throws RollbackException {
        if (cycle.backup == null) {
            journal.log("No backup to restore, database left at version " + cycle.current);
            return;
        }
        journal.log("Rolling back to backup: " + cycle.backup);
        MigrationAlertLogger.rollbackTriggered(version, cycle.backup.toString());
        try {
            rollbackManager.rollback(handle, cycle.backup);
        } catch (RollbackException e) {
            e.addSuppressed(failure);
            throw e;
        }
        cycle.current = cycle.from;
        cycle.applied.clear();
    }

    /**
     * Mutable progress of one cycle, turned into a {@link MigrationResult} at the end.
     */
    private static final class Cycle {
        int from;
        int current;
        Path backup;
        final List<Integer> applied = new ArrayList<>();

        MigrationResult succeeded() {
            return MigrationResult.succeeded(backup, from, current, applied);
        }

        MigrationResult failed(Exception e) {
            return MigrationResult.failed(backup, from, current, applied, e);
        }
    }
}
