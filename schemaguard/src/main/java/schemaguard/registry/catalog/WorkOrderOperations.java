package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Maintenance work orders.
 */
final class WorkOrderOperations extends DomainOperations {

    static final Set<String> STATUSES =
            Set.of("draft", "approved", "assigned", "in_progress", "completed", "closed", "cancelled");
    static final Set<String> WORK_TYPES = Set.of("preventive", "corrective", "emergency", "project");
    static final Set<String> PRIORITIES = Set.of("low", "medium", "high", "critical");

    private static final String WITH_EQUIPMENT =
            "SELECT wo.*, e.equipment_id AS equipment_identifier "
                    + "FROM work_orders wo "
                    + "JOIN equipment e ON wo.equipment_id = e.id ";

    WorkOrderOperations() {
        super("workOrders");

        many("getAll", WITH_EQUIPMENT + "ORDER BY wo.created_at DESC, wo.id DESC");

        many("getByStatus", WITH_EQUIPMENT + "WHERE wo.status = ? ORDER BY wo.created_at DESC, wo.id DESC",
                args -> args.isOneOf("status", STATUSES),
                "status");

        many("getByEquipmentId", "SELECT * FROM work_orders WHERE equipment_id = ? ORDER BY created_at DESC, id DESC",
                args -> args.isPositiveInt("equipmentId"),
                "equipmentId");

        write("create",
                "INSERT INTO work_orders (equipment_id, wo_number, title, description, work_type, "
                        + "priority, assigned_to, estimated_hours, created_by, scheduled_date, deficiency_id) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPositiveInt("equipmentId")
                        && args.isPresent("woNumber")
                        && args.isPresent("title")
                        && args.isOneOf("workType", WORK_TYPES)
                        && args.isOneOf("priority", PRIORITIES)
                        && args.isPresent("createdBy"),
                "equipmentId", "woNumber", "title", "description", "workType",
                "priority", "assignedTo", "estimatedHours", "createdBy", "scheduledDate", "deficiencyId");

        write("update",
                "UPDATE work_orders SET title = ?, description = ?, work_type = ?, priority = ?, "
                        + "assigned_to = ?, estimated_hours = ?, scheduled_date = ? WHERE id = ?",
                args -> args.isPositiveInt("id")
                        && args.isPresent("title")
                        && args.isOneOf("workType", WORK_TYPES)
                        && args.isOneOf("priority", PRIORITIES),
                "title", "description", "workType", "priority", "assignedTo",
                "estimatedHours", "scheduledDate", "id");

        write("updateStatus",
                "UPDATE work_orders SET status = ?, started_at = ?, completed_at = ?, closed_at = ? WHERE id = ?",
                args -> args.isPositiveInt("id") && args.isOneOf("status", STATUSES),
                "status", "startedAt", "completedAt", "closedAt", "id");

        write("complete",
                "UPDATE work_orders SET status = 'completed', completed_at = CURRENT_TIMESTAMP, "
                        + "actual_hours = ?, parts_cost = ?, labor_cost = ?, completion_notes = ? WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "actualHours", "partsCost", "laborCost", "completionNotes", "id");

        many("getDueToday",
                WITH_EQUIPMENT
                        + "WHERE wo.scheduled_date = CURRENT_DATE AND wo.status IN ('approved', 'assigned') "
                        + "ORDER BY wo.priority DESC");

        many("getOverdue",
                WITH_EQUIPMENT
                        + "WHERE wo.scheduled_date < CURRENT_DATE AND wo.status IN ('approved', 'assigned', 'in_progress') "
                        + "ORDER BY wo.scheduled_date ASC");
    }
}
