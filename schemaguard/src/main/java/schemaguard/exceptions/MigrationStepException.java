package schemaguard.exceptions;

/**
 * Exception thrown when a versioned migration step fails.
 *
 * <p>When this exception reaches the caller, the database has already been restored
 * from the cycle's snapshot (if one was taken). Steps are never retried; the
 * step or the data must be fixed before the next startup.
 */
public class MigrationStepException extends MigrateException {

    /**
     * @param version the version of the failing step
     * @param cause what the step raised
     */
    public MigrationStepException(int version, Throwable cause) {
        super("Migration failed at version " + version + ": " + describe(cause), version, cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
