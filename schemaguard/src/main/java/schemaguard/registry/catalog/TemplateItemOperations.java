package schemaguard.registry.catalog;

/**
 * Ordered checklist items of an inspection template.
 */
final class TemplateItemOperations extends DomainOperations {

    TemplateItemOperations() {
        super("templateItems");

        many("getByTemplateId", "SELECT * FROM template_items WHERE template_id = ? ORDER BY item_order",
                args -> args.isPositiveInt("templateId"),
                "templateId");

        write("create",
                "INSERT INTO template_items (template_id, standard_id, item_order, standard_ref, "
                        + "item_text, critical, component, inspection_method, acceptance_criteria, notes) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPositiveInt("templateId")
                        && args.isPositiveInt("itemOrder")
                        && args.isPresent("itemText"),
                "templateId", "standardId", "itemOrder", "standardRef", "itemText",
                "critical", "component", "inspectionMethod", "acceptanceCriteria", "notes");

        write("update",
                "UPDATE template_items SET standard_id = ?, item_order = ?, standard_ref = ?, "
                        + "item_text = ?, critical = ?, component = ?, inspection_method = ?, "
                        + "acceptance_criteria = ?, notes = ? WHERE id = ?",
                args -> args.isPositiveInt("id")
                        && args.isPositiveInt("itemOrder")
                        && args.isPresent("itemText"),
                "standardId", "itemOrder", "standardRef", "itemText", "critical",
                "component", "inspectionMethod", "acceptanceCriteria", "notes", "id");

        write("delete", "DELETE FROM template_items WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");
    }
}
