package schemaguard.exceptions;

/**
 * Exception thrown when a schema migration cycle fails.
 *
 * <p>This is the root of the migration failure taxonomy. Callers that only need to
 * know "startup must abort" can catch this type; callers that need to distinguish
 * "migration logic failed" from "could not protect or restore data" catch the
 * subclasses:
 * <ul>
 *   <li>{@link BackupCreationException} - the pre-migration snapshot could not be taken</li>
 *   <li>{@link MigrationStepException} - a specific versioned step raised</li>
 *   <li>{@link RollbackException} - restoring the snapshot itself failed</li>
 *   <li>{@link LedgerException} - the schema version ledger could not be read or written</li>
 * </ul>
 *
 * @see schemaguard.engine.MigrationManager
 */
public class MigrateException extends Exception {

    /** Schema version involved in the failure, or null when not tied to a version */
    private final Integer version;

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        super(message);
        this.version = null;
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        super(message, cause);
        this.version = null;
    }

    /**
     * Creates a new migration exception tied to a schema version.
     *
     * @param message the error message
     * @param version the schema version involved
     * @param cause the underlying cause
     */
    public MigrateException(String message, int version, Throwable cause) {
        super(message, cause);
        this.version = version;
    }

    /**
     * Returns the schema version involved in the failure.
     *
     * @return the version, or null if not set
     */
    public Integer getVersion() {
        return version;
    }

    /**
     * Appends {@code [version=N]} unless the message already names that version.
     */
    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (version == null || (base != null && base.matches("(?s).*\\bversion " + version + "\\b.*"))) {
            return base;
        }
        return base + " [version=" + version + "]";
    }
}
