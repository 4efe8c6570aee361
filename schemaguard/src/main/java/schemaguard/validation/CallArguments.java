package schemaguard.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of the named arguments of one operation call, with typed checks.
 *
 * <p>Validators read arguments only through this class, so the rules for "a positive id",
 * "a date" or "a value that was supplied" are the same for every operation.
 */
public final class CallArguments {

    private static final CallArguments EMPTY = new CallArguments(Map.of());

    private final Map<String, Object> values;

    private CallArguments(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * @param args the caller's argument map; null means no arguments. Null values are allowed.
     */
    public static CallArguments of(Map<String, ?> args) {
        if (args == null || args.isEmpty()) {
            return EMPTY;
        }
        return new CallArguments(Collections.unmodifiableMap(new LinkedHashMap<>(args)));
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isPositiveInt(String name) {
        return Validators.isPositiveInteger(values.get(name));
    }

    public boolean isPresent(String name) {
        return Validators.isPresent(values.get(name));
    }

    public boolean isString(String name) {
        return Validators.isNonEmptyString(values.get(name));
    }

    public boolean isOneOf(String name, Set<String> allowed) {
        return Validators.isOneOf(values.get(name), allowed);
    }

    /**
     * Like {@link #isOneOf(String, Set)}, but a missing or null value also passes.
     */
    public boolean isAbsentOrOneOf(String name, Set<String> allowed) {
        Object value = values.get(name);
        return value == null || Validators.isOneOf(value, allowed);
    }

    public boolean isDate(String name) {
        return Validators.isDate(values.get(name));
    }

    public boolean isNumber(String name) {
        return Validators.isNumber(values.get(name));
    }

    public boolean isSafePath(String name, PathSafetyPolicy policy) {
        return policy.isSafe(values.get(name));
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
