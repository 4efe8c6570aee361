package schemaguard.exceptions;

/**
 * Exception thrown when the schema version ledger cannot be created, read or updated.
 */
public class LedgerException extends MigrateException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
