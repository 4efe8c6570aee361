package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Deficiencies found during inspections, through to verified closure.
 */
final class DeficiencyOperations extends DomainOperations {

    static final Set<String> SEVERITIES = Set.of("critical", "major", "minor");
    static final Set<String> STATUSES = Set.of("open", "in_progress", "verified", "closed");

    private static final String WITH_EQUIPMENT =
            "SELECT d.*, e.equipment_id AS equipment_identifier "
                    + "FROM deficiencies d "
                    + "JOIN equipment e ON d.equipment_id = e.id ";

    DeficiencyOperations() {
        super("deficiencies");

        many("getAll", WITH_EQUIPMENT + "ORDER BY d.created_at DESC, d.id DESC");

        many("getByEquipmentId", "SELECT * FROM deficiencies WHERE equipment_id = ? ORDER BY created_at DESC, id DESC",
                args -> args.isPositiveInt("equipmentId"),
                "equipmentId");

        many("getByStatus", WITH_EQUIPMENT + "WHERE d.status = ? ORDER BY d.created_at DESC, d.id DESC",
                args -> args.isOneOf("status", STATUSES),
                "status");

        write("create",
                "INSERT INTO deficiencies (equipment_id, inspection_item_id, severity, "
                        + "remove_from_service, description, component, corrective_action, due_date, status) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPositiveInt("equipmentId")
                        && args.isOneOf("severity", SEVERITIES)
                        && args.isPresent("description")
                        && args.isOneOf("status", STATUSES),
                "equipmentId", "inspectionItemId", "severity", "removeFromService",
                "description", "component", "correctiveAction", "dueDate", "status");

        write("update",
                "UPDATE deficiencies SET severity = ?, remove_from_service = ?, description = ?, "
                        + "component = ?, corrective_action = ?, due_date = ?, status = ?, "
                        + "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                args -> args.isPositiveInt("id")
                        && args.isOneOf("severity", SEVERITIES)
                        && args.isPresent("description")
                        && args.isOneOf("status", STATUSES),
                "severity", "removeFromService", "description", "component",
                "correctiveAction", "dueDate", "status", "id");

        write("close",
                "UPDATE deficiencies SET status = 'closed', closed_at = CURRENT_TIMESTAMP, "
                        + "verification_signature = ?, verification_timestamp = CURRENT_TIMESTAMP, "
                        + "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "verificationSignature", "id");

        many("getOpenCritical",
                WITH_EQUIPMENT
                        + "WHERE d.severity = 'critical' AND d.status IN ('open', 'in_progress') "
                        + "ORDER BY d.created_at DESC, d.id DESC");

        many("getOverdue",
                WITH_EQUIPMENT
                        + "WHERE d.due_date < CURRENT_DATE AND d.status IN ('open', 'in_progress') "
                        + "ORDER BY d.due_date ASC");

        write("createFromInspectionItem",
                "INSERT INTO deficiencies (equipment_id, inspection_item_id, severity, "
                        + "remove_from_service, description, component, corrective_action, due_date, status) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, 'open')",
                args -> args.isPositiveInt("equipmentId")
                        && args.isPositiveInt("inspectionItemId")
                        && args.isOneOf("severity", SEVERITIES)
                        && args.isPresent("description"),
                "equipmentId", "inspectionItemId", "severity", "removeFromService",
                "description", "component", "correctiveAction", "dueDate");

        write("linkToWorkOrder",
                "UPDATE deficiencies SET work_order_id = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                args -> args.isPositiveInt("id") && args.isPositiveInt("workOrderId"),
                "workOrderId", "id");
    }
}
