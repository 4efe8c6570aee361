package schemaguard.exceptions;

import java.time.Duration;

/**
 * Exception thrown when a migration operation exceeds its configured timeout.
 *
 * <p>This indicates that a migration step or a backup copy did not complete
 * within the allowed time limit. A timed-out step is treated like a failed step
 * and the cycle is rolled back; the abandoned work is not cancelled.
 *
 * <p>This is an unchecked exception (extends RuntimeException) so timeout
 * protection can wrap existing code without changing method signatures.
 *
 * @see schemaguard.engine.MigrationTimeoutConfig
 */
public class MigrationTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    /**
     * Creates a new timeout exception.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     */
    public MigrationTimeoutException(String operation, Duration timeout) {
        super(formatMessage(operation, timeout));
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Creates a new timeout exception with a cause.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     * @param cause the underlying cause (typically TimeoutException or InterruptedException)
     */
    public MigrationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(formatMessage(operation, timeout), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Returns the name of the operation that timed out.
     *
     * @return the operation name (e.g., "migration#3", "backup")
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Returns the configured timeout that was exceeded.
     *
     * @return the timeout duration
     */
    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String operation, Duration timeout) {
        return String.format("Operation '%s' timed out after %d ms", operation, timeout.toMillis());
    }
}
