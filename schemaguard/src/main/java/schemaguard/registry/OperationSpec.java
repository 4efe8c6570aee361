package schemaguard.registry;

import schemaguard.validation.CallArguments;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One named, parameterized database operation.
 *
 * <p>The statement uses positional {@code ?} placeholders; {@code parameterNames} says
 * which argument binds to each. Construction fails if the counts differ, so a broken
 * entry is caught when its catalog class loads.
 */
public final class OperationSpec {

    private final String domain;
    private final String name;
    private final String statement;
    private final List<String> parameterNames;
    private final ResultShape shape;
    private final OperationValidator validator;

    public OperationSpec(
            String domain,
            String name,
            String statement,
            List<String> parameterNames,
            ResultShape shape,
            OperationValidator validator
    ) {
        this.domain = requireText(domain, "domain");
        this.name = requireText(name, "name");
        this.statement = requireText(statement, "statement").strip();
        this.parameterNames = List.copyOf(Objects.requireNonNull(parameterNames, "parameterNames"));
        this.shape = Objects.requireNonNull(shape, "shape");
        this.validator = Objects.requireNonNull(validator, "validator");

        int placeholders = countPlaceholders(this.statement);
        if (placeholders != this.parameterNames.size()) {
            throw new IllegalArgumentException("Operation " + key() + " has " + placeholders
                    + " placeholders but " + this.parameterNames.size() + " parameter names");
        }
    }

    public OperationSpec(String domain, String name, String statement, ResultShape shape,
                         OperationValidator validator, String... parameterNames) {
        this(domain, name, statement, Arrays.asList(parameterNames), shape, validator);
    }

    public String domain() {
        return domain;
    }

    public String name() {
        return name;
    }

    /**
     * @return {@code domain.name}
     */
    public String key() {
        return key(domain, name);
    }

    public static String key(String domain, String name) {
        return domain + "." + name;
    }

    public String statement() {
        return statement;
    }

    public List<String> parameterNames() {
        return parameterNames;
    }

    public ResultShape shape() {
        return shape;
    }

    public boolean validate(CallArguments args) {
        return validator.validate(args);
    }

    /**
     * Projects the arguments onto the placeholders. A missing name binds SQL NULL.
     */
    public List<Object> bind(CallArguments args) {
        List<Object> values = new ArrayList<>(parameterNames.size());
        for (String p : parameterNames) {
            values.add(args.get(p));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * @return true if the statement can generate keys (INSERT or MERGE)
     */
    public boolean generatesKeys() {
        String head = statement.toUpperCase(Locale.ROOT);
        return head.startsWith("INSERT") || head.startsWith("MERGE");
    }

    /**
     * Counts {@code ?} outside single-quoted literals and double-quoted identifiers.
     */
    static int countPlaceholders(String sql) {
        int count = 0;
        boolean inLiteral = false;
        boolean inIdentifier = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'' && !inIdentifier) {
                inLiteral = !inLiteral;
            } else if (c == '"' && !inLiteral) {
                inIdentifier = !inIdentifier;
            } else if (c == '?' && !inLiteral && !inIdentifier) {
                count++;
            }
        }
        return count;
    }

    private static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return value;
    }

    @Override
    public String toString() {
        return "OperationSpec{" + key() + ", " + shape + ", params=" + parameterNames + '}';
    }
}
