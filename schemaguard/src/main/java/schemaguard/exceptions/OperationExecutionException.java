package schemaguard.exceptions;

import java.sql.SQLException;

/**
 * Exception thrown when a validated operation fails inside the database.
 *
 * <p>The underlying {@link SQLException} is kept as the cause and classified into a
 * {@link ConstraintKind} from its SQLState, so callers can tell a duplicate key or a
 * missing parent row apart from a broken statement or a lost connection.
 */
public class OperationExecutionException extends OperationException {

    private final ConstraintKind kind;

    public OperationExecutionException(String domain, String operation, SQLException cause) {
        super(domain, operation,
                "Operation " + domain + "." + operation + " failed (" + ConstraintKind.of(cause) + "): " + cause.getMessage(),
                cause);
        this.kind = ConstraintKind.of(cause);
    }

    /**
     * @return the classification of the underlying database error
     */
    public ConstraintKind getKind() {
        return kind;
    }

    /**
     * @return true if the failure is a unique, foreign-key, not-null or check violation
     */
    public boolean isConstraintViolation() {
        return kind.isConstraint();
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}
