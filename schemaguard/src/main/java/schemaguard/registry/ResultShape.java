package schemaguard.registry;

/**
 * How the executor turns a statement's outcome into an {@link OperationResult}.
 */
public enum ResultShape {
    /** every row */
    MANY,
    /** the first row, or nothing */
    ONE,
    /** first column of the first row, or nothing */
    SCALAR,
    /** generated key and update count */
    WRITE
}
