package schemaguard.bootstrap;

import schemaguard.backup.BackupInfo;
import schemaguard.db.DatabaseHandle;
import schemaguard.engine.MigrationManager;
import schemaguard.engine.MigrationResult;
import schemaguard.registry.OperationExecutor;

import java.util.List;

/**
 * A migrated, ready-to-use database.
 *
 * <p>Instances only come from {@link DatabaseBootstrap#start}, so holding one means the
 * schema has reached the target version.
 */
public final class Database implements AutoCloseable {

    private final DatabaseHandle handle;
    private final MigrationManager manager;
    private final MigrationResult migrationResult;
    private final OperationExecutor executor;

    Database(DatabaseHandle handle, MigrationManager manager, MigrationResult migrationResult,
             OperationExecutor executor) {
        this.handle = handle;
        this.manager = manager;
        this.migrationResult = migrationResult;
        this.executor = executor;
    }

    public OperationExecutor executor() {
        return executor;
    }

    public DatabaseHandle handle() {
        return handle;
    }

    public MigrationManager manager() {
        return manager;
    }

    /** Returns the outcome of the startup migration cycle. */
    public MigrationResult migrationResult() {
        return migrationResult;
    }

    /** Returns the backups, newest first. */
    public List<BackupInfo> getBackupInfo() {
        return manager.getBackupInfo();
    }

    @Override
    public void close() {
        handle.close();
    }
}
