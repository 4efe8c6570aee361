package schemaguard.registry.catalog;

import schemaguard.registry.OperationSpec;
import schemaguard.registry.OperationValidator;
import schemaguard.registry.ResultShape;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for the per-domain operation lists. Subclasses register their operations in the
 * constructor through the shape-named helpers.
 */
abstract class DomainOperations {

    private final String domain;
    private final List<OperationSpec> specs = new ArrayList<>();

    protected DomainOperations(String domain) {
        this.domain = domain;
    }

    final String domain() {
        return domain;
    }

    final List<OperationSpec> specs() {
        return List.copyOf(specs);
    }

    protected final void many(String name, String sql) {
        many(name, sql, OperationValidator.ALWAYS);
    }

    protected final void many(String name, String sql, OperationValidator validator, String... params) {
        add(name, sql, ResultShape.MANY, validator, params);
    }

    protected final void one(String name, String sql, OperationValidator validator, String... params) {
        add(name, sql, ResultShape.ONE, validator, params);
    }

    protected final void scalar(String name, String sql) {
        add(name, sql, ResultShape.SCALAR, OperationValidator.ALWAYS);
    }

    protected final void write(String name, String sql, OperationValidator validator, String... params) {
        add(name, sql, ResultShape.WRITE, validator, params);
    }

    private void add(String name, String sql, ResultShape shape, OperationValidator validator, String... params) {
        specs.add(new OperationSpec(domain, name, sql, shape, validator, params));
    }
}
