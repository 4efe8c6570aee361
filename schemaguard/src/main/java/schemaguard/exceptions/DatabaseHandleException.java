package schemaguard.exceptions;

/**
 * Exception thrown when the embedded database cannot be opened or closed.
 *
 * <p>This is an unchecked exception: a database that cannot be opened at startup
 * is a deployment problem that cannot be recovered at runtime.
 */
public class DatabaseHandleException extends RuntimeException {

    public DatabaseHandleException(String message) {
        super(message);
    }

    public DatabaseHandleException(String message, Throwable cause) {
        super(message, cause);
    }
}
