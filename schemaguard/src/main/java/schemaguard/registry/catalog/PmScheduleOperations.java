package schemaguard.registry.catalog;

/**
 * Preventive-maintenance schedules: a template applied to one piece of equipment.
 */
final class PmScheduleOperations extends DomainOperations {

    private static final String DUE =
            "SELECT ps.*, pt.name AS template_name, e.equipment_id AS equipment_identifier "
                    + "FROM pm_schedules ps "
                    + "JOIN pm_templates pt ON ps.pm_template_id = pt.id "
                    + "JOIN equipment e ON ps.equipment_id = e.id ";

    PmScheduleOperations() {
        super("pmSchedules");

        many("getByEquipmentId",
                "SELECT ps.*, pt.name AS template_name, pt.frequency_type, pt.frequency_value, pt.frequency_unit "
                        + "FROM pm_schedules ps "
                        + "JOIN pm_templates pt ON ps.pm_template_id = pt.id "
                        + "WHERE ps.equipment_id = ? AND ps.active = TRUE "
                        + "ORDER BY ps.next_due_date",
                args -> args.isPositiveInt("equipmentId"),
                "equipmentId");

        many("getDue", DUE + "WHERE ps.next_due_date <= CAST(? AS DATE) AND ps.active = TRUE ORDER BY ps.next_due_date",
                args -> args.isDate("dueDate"),
                "dueDate");

        write("create",
                "INSERT INTO pm_schedules (equipment_id, pm_template_id, next_due_date, next_due_usage) "
                        + "VALUES (?, ?, ?, ?)",
                args -> args.isPositiveInt("equipmentId") && args.isPositiveInt("pmTemplateId"),
                "equipmentId", "pmTemplateId", "nextDueDate", "nextDueUsage");

        write("updateDue",
                "UPDATE pm_schedules SET next_due_date = ?, next_due_usage = ?, "
                        + "last_completed_date = ?, last_completed_usage = ? WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "nextDueDate", "nextDueUsage", "lastCompletedDate", "lastCompletedUsage", "id");

        scalar("getTotal", "SELECT COUNT(*) AS count FROM pm_schedules WHERE active = TRUE");

        many("getOverdue", DUE + "WHERE ps.next_due_date < CURRENT_DATE AND ps.active = TRUE ORDER BY ps.next_due_date ASC");
    }
}
