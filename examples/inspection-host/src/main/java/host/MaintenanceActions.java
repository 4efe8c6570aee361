package host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import schemaguard.alert.MigrationJournal;
import schemaguard.backup.BackupStore;
import schemaguard.db.DatabaseHandle;
import schemaguard.db.SchemaVersionLedger;
import schemaguard.exceptions.DatabaseHandleException;
import schemaguard.exceptions.MigrateException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Manual backup and restore of the live database file.
 *
 * <p>Both actions close the handle for the copy. {@link #backupNow} reopens it afterwards.
 * {@link #restoreFrom} leaves it closed: the restored file may be at an older schema
 * version, so it is only used again after the next startup has migrated it.
 */
public class MaintenanceActions {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceActions.class);

    private final DatabaseHandle handle;
    private final BackupStore backupStore;
    private final MigrationJournal journal;
    private final SchemaVersionLedger ledger = new SchemaVersionLedger();

    public MaintenanceActions(DatabaseHandle handle, BackupStore backupStore, MigrationJournal journal) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.backupStore = Objects.requireNonNull(backupStore, "backupStore");
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    /**
     * Copies the live database file to {@code destination}.
     *
     * @param destination target file; overwritten if present
     * @throws IOException if the copy fails
     */
    public void backupNow(Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        handle.close();
        try {
            Files.copy(handle.databaseFile(), destination, StandardCopyOption.REPLACE_EXISTING);
            journal.log("Manual backup written to: " + destination);
        } finally {
            handle.reopen();
        }
    }

    /**
     * Replaces the live database file with {@code source}.
     *
     * <p>The live file is first copied into the backup store. The source must open as an
     * H2 database with a schema version ledger; otherwise the live file is put back and
     * nothing changes. The handle is closed when this returns, either way.
     *
     * @param source a file previously produced by a backup
     * @return the copy of the replaced live file, empty if there was no live file
     * @throws IOException if the source is missing or unusable, or a copy fails
     */
    public Optional<Path> restoreFrom(Path source) throws IOException {
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(source.toString());
        }
        Path live = handle.databaseFile();
        handle.close();
        Optional<Path> previous = backupStore.createBackup(live);

        try {
            Files.copy(source, live, StandardCopyOption.REPLACE_EXISTING);
            verifyRestored();
        } catch (IOException e) {
            putBack(previous, live);
            journal.log("Restore from " + source + " rejected: " + e.getMessage());
            throw e;
        }

        journal.log("Database restored from: " + source
                + previous.map(p -> " (previous database saved to " + p + ")").orElse(""));
        log.warn("Live database replaced with {}; it is migrated on the next startup", source);
        return previous;
    }

    private void verifyRestored() throws IOException {
        try {
            handle.reopen();
            if (ledger.currentVersion(handle.connection()) <= 0) {
                throw new IOException("Not a schemaguard database: no schema version recorded");
            }
        } catch (DatabaseHandleException | MigrateException e) {
            throw new IOException("Not a usable database: " + e.getMessage(), e);
        } finally {
            handle.close();
        }
    }

    private void putBack(Optional<Path> previous, Path live) throws IOException {
        if (previous.isPresent()) {
            backupStore.restore(previous.get(), live);
        } else {
            Files.deleteIfExists(live);
        }
    }
}
