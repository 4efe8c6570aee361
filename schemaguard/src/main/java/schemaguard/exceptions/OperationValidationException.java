package schemaguard.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when an operation's validator rejects the supplied arguments.
 *
 * <p>When this is thrown the database has not been touched. The rejected
 * argument bag is kept for diagnostics.
 */
public class OperationValidationException extends OperationException {

    private final Map<String, Object> arguments;

    public OperationValidationException(String domain, String operation, Map<String, ?> arguments) {
        super(domain, operation, "Invalid parameters for operation: " + domain + "." + operation, null);
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    /**
     * @return the argument bag that failed validation (read-only copy)
     */
    public Map<String, Object> getArguments() {
        return arguments;
    }
}
