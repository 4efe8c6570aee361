package schemaguard.validation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Pure predicates over untyped argument values.
 *
 * <p>Values come from a caller-supplied argument map, so every predicate accepts
 * {@code Object} and returns false for null or for a value of the wrong type.
 */
public final class Validators {

    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private Validators() {
    }

    /**
     * True for an integral number greater than zero. Floating-point values count when
     * they have no fractional part.
     */
    public static boolean isPositiveInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue() > 0;
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).signum() > 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) && d == Math.rint(d) && d > 0 && d <= Long.MAX_VALUE;
        }
        if (value instanceof BigDecimal) {
            BigDecimal bd = ((BigDecimal) value).stripTrailingZeros();
            return bd.signum() > 0 && bd.scale() <= 0;
        }
        return false;
    }

    /**
     * True unless the value is null, an empty string, {@code false}, zero or NaN.
     */
    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        return true;
    }

    /**
     * True for a non-empty string.
     */
    public static boolean isNonEmptyString(Object value) {
        return value instanceof String && !((String) value).isEmpty();
    }

    /**
     * Identifier format: a non-empty string. Used for equipment identifiers and person names.
     */
    public static boolean isIdentifier(Object value) {
        return isNonEmptyString(value);
    }

    /**
     * True if the value is a string equal to one of {@code allowed}.
     */
    public static boolean isOneOf(Object value, Collection<String> allowed) {
        return value instanceof String && allowed.contains(value);
    }

    /**
     * True for a {@code YYYY-MM-DD} string that names a real calendar date.
     * {@code 2025-02-30} is rejected.
     */
    public static boolean isDate(Object value) {
        if (!(value instanceof String) || !DATE.matcher((String) value).matches()) {
            return false;
        }
        try {
            LocalDate.parse((String) value, DateTimeFormatter.ISO_LOCAL_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * True for any finite number.
     */
    public static boolean isNumber(Object value) {
        if (!(value instanceof Number)) {
            return false;
        }
        if (value instanceof Double || value instanceof Float) {
            return Double.isFinite(((Number) value).doubleValue());
        }
        return true;
    }
}
