package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Planned inspections.
 */
final class ScheduledInspectionOperations extends DomainOperations {

    static final Set<String> STATUSES = Set.of("scheduled", "in_progress", "completed");

    ScheduledInspectionOperations() {
        super("scheduledInspections");

        many("getAll",
                "SELECT si.*, e.equipment_id AS equipment_identifier "
                        + "FROM scheduled_inspections si "
                        + "JOIN equipment e ON si.equipment_id = e.id "
                        + "ORDER BY si.scheduled_date");

        many("getUpcoming",
                "SELECT e.equipment_id, s.scheduled_date "
                        + "FROM scheduled_inspections s "
                        + "JOIN equipment e ON s.equipment_id = e.id "
                        + "WHERE s.scheduled_date >= CAST(? AS DATE) AND s.status <> 'completed' "
                        + "ORDER BY s.scheduled_date "
                        + "LIMIT 10",
                args -> args.isDate("fromDate"),
                "fromDate");

        many("getTodayAndLater", "SELECT * FROM scheduled_inspections WHERE scheduled_date >= CAST(? AS DATE)",
                args -> args.isDate("today"),
                "today");

        write("create",
                "INSERT INTO scheduled_inspections (equipment_id, scheduled_date, assigned_inspector, status) "
                        + "VALUES (?, ?, ?, COALESCE(CAST(? AS VARCHAR(20)), 'scheduled'))",
                args -> args.isPositiveInt("equipmentId")
                        && args.isDate("scheduledDate")
                        && args.isString("assignedInspector")
                        && args.isAbsentOrOneOf("status", STATUSES),
                "equipmentId", "scheduledDate", "assignedInspector", "status");

        write("update",
                "UPDATE scheduled_inspections SET equipment_id = ?, scheduled_date = ?, assigned_inspector = ? "
                        + "WHERE id = ?",
                args -> args.isPositiveInt("equipmentId")
                        && args.isDate("scheduledDate")
                        && args.isString("assignedInspector")
                        && args.isPositiveInt("id"),
                "equipmentId", "scheduledDate", "assignedInspector", "id");

        write("updateStatus", "UPDATE scheduled_inspections SET status = ? WHERE id = ?",
                args -> args.isOneOf("status", STATUSES) && args.isPositiveInt("id"),
                "status", "id");

        write("delete", "DELETE FROM scheduled_inspections WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");
    }
}
