package schemaguard.exceptions;

/**
 * Exception thrown when restoring the pre-migration snapshot fails.
 *
 * <p>This is the most severe failure: the live database may be in an
 * indeterminate state and is not self-healing. The step failure that triggered
 * the rollback, if any, is attached as a suppressed exception.
 */
public class RollbackException extends MigrateException {

    public RollbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
