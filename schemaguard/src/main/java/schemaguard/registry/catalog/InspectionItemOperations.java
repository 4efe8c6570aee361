package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Checklist items of an inspection.
 */
final class InspectionItemOperations extends DomainOperations {

    static final Set<String> RESULTS = Set.of("pass", "fail", "na");

    InspectionItemOperations() {
        super("inspectionItems");

        many("getByInspectionId", "SELECT * FROM inspection_items WHERE inspection_id = ? ORDER BY id",
                args -> args.isPositiveInt("inspectionId"),
                "inspectionId");

        write("create",
                "INSERT INTO inspection_items (inspection_id, standard_ref, item_text, critical, "
                        + "result, notes, photos, component, priority) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPositiveInt("inspectionId")
                        && args.isPresent("itemText")
                        && args.isOneOf("result", RESULTS),
                "inspectionId", "standardRef", "itemText", "critical", "result",
                "notes", "photos", "component", "priority");

        write("update",
                "UPDATE inspection_items SET standard_ref = ?, item_text = ?, critical = ?, "
                        + "result = ?, notes = ?, photos = ?, component = ?, priority = ? WHERE id = ?",
                args -> args.isPositiveInt("id")
                        && args.isPresent("itemText")
                        && args.isOneOf("result", RESULTS),
                "standardRef", "itemText", "critical", "result", "notes",
                "photos", "component", "priority", "id");

        write("delete", "DELETE FROM inspection_items WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");

        many("getCriticalFailures",
                "SELECT ii.*, i.equipment_id, e.equipment_id AS equipment_identifier "
                        + "FROM inspection_items ii "
                        + "JOIN inspections i ON ii.inspection_id = i.id "
                        + "JOIN equipment e ON i.equipment_id = e.id "
                        + "WHERE ii.critical = TRUE AND ii.result = 'fail' "
                        + "ORDER BY i.inspection_date DESC");
    }
}
