package schemaguard.exceptions;

/**
 * Exception thrown when the pre-migration snapshot of the database file cannot be taken.
 *
 * <p>This is fatal for the cycle: no migration is attempted without a snapshot
 * of an existing database.
 */
public class BackupCreationException extends MigrateException {

    public BackupCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
