package schemaguard.exceptions;

/**
 * Exception thrown when a caller names an operation the catalog does not define.
 */
public class UnknownOperationException extends OperationException {

    public UnknownOperationException(String domain, String operation) {
        super(domain, operation, "Invalid operation: " + domain + "." + operation, null);
    }
}
