package schemaguard.exceptions;

/**
 * Base class for failures of a catalog operation call.
 *
 * <p>Every operation failure is attributable to a {@code domain.operation} key.
 * These failures are returned to the immediate caller, who is expected to turn
 * them into user-facing feedback; they never abort the process.
 *
 * @see schemaguard.registry.OperationExecutor
 */
public abstract class OperationException extends Exception {

    private final String domain;
    private final String operation;

    protected OperationException(String domain, String operation, String message, Throwable cause) {
        super(message, cause);
        this.domain = domain;
        this.operation = operation;
    }

    public String getDomain() {
        return domain;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return the {@code domain.operation} key of the failed call
     */
    public String getOperationKey() {
        return domain + "." + operation;
    }
}
