package schemaguard.exceptions;

import java.sql.SQLException;

/**
 * Classification of a database error by its SQLState.
 *
 * <p>Class 23 is integrity constraint violation, class 42 is syntax or access rule
 * violation and class 08 is connection exception. Anything else is {@link #OTHER}.
 */
public enum ConstraintKind {
    UNIQUE(true),
    FOREIGN_KEY(true),
    NOT_NULL(true),
    CHECK(true),
    SYNTAX(false),
    CONNECTION(false),
    OTHER(false);

    private final boolean constraint;

    ConstraintKind(boolean constraint) {
        this.constraint = constraint;
    }

    public boolean isConstraint() {
        return constraint;
    }

    /**
     * Classifies a driver exception.
     *
     * @param e the exception to classify (may be null)
     * @return the matching kind, never null
     */
    public static ConstraintKind of(SQLException e) {
        if (e == null || e.getSQLState() == null) {
            return OTHER;
        }
        String state = e.getSQLState();
        switch (state) {
            case "23505":
                return UNIQUE;
            case "23503":
            case "23506":
                return FOREIGN_KEY;
            case "23502":
                return NOT_NULL;
            case "23513":
            case "23514":
                return CHECK;
            default:
                break;
        }
        if (state.startsWith("42")) return SYNTAX;
        if (state.startsWith("08")) return CONNECTION;
        return OTHER;
    }
}
