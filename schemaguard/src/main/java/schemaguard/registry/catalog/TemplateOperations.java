package schemaguard.registry.catalog;

/**
 * Inspection form templates, keyed by unique name.
 */
final class TemplateOperations extends DomainOperations {

    TemplateOperations() {
        super("templates");

        many("getAll", "SELECT id, name, fields FROM inspection_templates ORDER BY name");

        // saving under an existing name replaces its fields
        write("save", "MERGE INTO inspection_templates (name, fields) KEY (name) VALUES (?, ?)",
                args -> args.isPresent("name") && args.isPresent("fields"),
                "name", "fields");

        write("delete", "DELETE FROM inspection_templates WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");
    }
}
