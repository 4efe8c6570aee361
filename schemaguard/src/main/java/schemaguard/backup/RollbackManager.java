package schemaguard.backup;

import schemaguard.alert.MigrationAlertLogger;
import schemaguard.alert.MigrationJournal;
import schemaguard.db.DatabaseHandle;
import schemaguard.exceptions.RollbackException;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Restores the live database from the snapshot taken at the start of a migration cycle.
 *
 * <p>The handle is closed before the copy so H2 holds no open store on the file, and
 * is left closed afterwards: a failed migration aborts startup, and the restored file
 * is only reopened by the next process.
 *
 * <p>Every step of the cycle is undone, not just the failing one; there is a single
 * snapshot per cycle.
 *
 * @see BackupStore
 */
public class RollbackManager {

    private final BackupStore backupStore;
    private final MigrationJournal journal;

    public RollbackManager(BackupStore backupStore, MigrationJournal journal) {
        this.backupStore = Objects.requireNonNull(backupStore);
        this.journal = Objects.requireNonNull(journal);
    }

    /**
     * Close the handle and copy the backup over the live database file.
     *
     * @param handle the live handle (closed by this call)
     * @param backup the cycle's snapshot
     * @throws RollbackException if closing or restoring fails
     */
    public void rollback(DatabaseHandle handle, Path backup) throws RollbackException {
        try {
            try {
                handle.close();
            } catch (RuntimeException e) {
                // restore still proceeds; H2 has released the file once the connection is gone
                journal.log("Warning: Error closing database: " + e.getMessage());
            }
            backupStore.restore(backup, handle.databaseFile());
            journal.log("Database rolled back from: " + backup);
            MigrationAlertLogger.rollbackCompleted(true);
        } catch (Exception e) {
            journal.log("Rollback failed: " + e.getMessage());
            MigrationAlertLogger.rollbackCompleted(false);
            throw new RollbackException("Rollback failed: " + e.getMessage(), e);
        }
    }
}
