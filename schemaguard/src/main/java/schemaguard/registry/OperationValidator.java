package schemaguard.registry;

import schemaguard.validation.CallArguments;

/**
 * Argument check run before an operation touches the database.
 */
@FunctionalInterface
public interface OperationValidator {

    /** Accepts any arguments. */
    OperationValidator ALWAYS = args -> true;

    /**
     * @param args the call's arguments
     * @return true if the operation may run with these arguments
     */
    boolean validate(CallArguments args);

    default OperationValidator and(OperationValidator other) {
        return args -> validate(args) && other.validate(args);
    }
}
