package schemaguard.registry.catalog;

/**
 * Completed inspections and the dashboard queries over them.
 */
final class InspectionOperations extends DomainOperations {

    private static final String INSERT =
            "INSERT INTO inspections (equipment_id, inspector, inspection_date, findings, "
                    + "corrective_actions, summary_comments, signature, scheduled_inspection_id, inspection_date_date) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS DATE))";

    InspectionOperations() {
        super("inspections");

        many("getAll", "SELECT * FROM inspections ORDER BY inspection_date DESC");

        many("getByEquipmentId",
                "SELECT * FROM inspections WHERE equipment_id = ? ORDER BY inspection_date DESC",
                args -> args.isPositiveInt("equipmentId"),
                "equipmentId");

        write("create", INSERT,
                args -> args.isPositiveInt("equipmentId")
                        && args.isString("inspector")
                        && args.isDate("inspectionDate"),
                "equipmentId", "inspector", "inspectionDate", "findings", "correctiveActions",
                "summaryComments", "signature", "scheduledInspectionId", "inspectionDate");

        write("createFromScheduled", INSERT,
                args -> args.isPositiveInt("equipmentId")
                        && args.isString("inspector")
                        && args.isDate("inspectionDate")
                        && args.isPositiveInt("scheduledInspectionId"),
                "equipmentId", "inspector", "inspectionDate", "findings", "correctiveActions",
                "summaryComments", "signature", "scheduledInspectionId", "inspectionDate");

        one("getByScheduledId", "SELECT * FROM inspections WHERE scheduled_inspection_id = ?",
                args -> args.isPositiveInt("scheduledInspectionId"),
                "scheduledInspectionId");

        many("getByDateRange",
                "SELECT * FROM inspections WHERE inspection_date_date BETWEEN CAST(? AS DATE) AND CAST(? AS DATE) "
                        + "ORDER BY inspection_date_date DESC",
                args -> args.isDate("startDate") && args.isDate("endDate"),
                "startDate", "endDate");

        scalar("getCount", "SELECT COUNT(*) AS count FROM inspections");

        many("getPerMonth",
                "SELECT FORMATDATETIME(inspection_date_date, 'yyyy-MM') AS inspection_month, COUNT(*) AS count "
                        + "FROM inspections "
                        + "WHERE inspection_date_date IS NOT NULL "
                        + "GROUP BY FORMATDATETIME(inspection_date_date, 'yyyy-MM') "
                        + "ORDER BY inspection_month DESC");

        many("getLastInspectionByEquipment",
                "SELECT equipment_id, MAX(inspection_date_date) AS last_inspection_date "
                        + "FROM inspections "
                        + "WHERE inspection_date_date IS NOT NULL "
                        + "GROUP BY equipment_id");

        many("getRecentFailures",
                "SELECT e.equipment_id, i.inspection_date_date "
                        + "FROM inspections i "
                        + "JOIN equipment e ON i.equipment_id = e.id "
                        + "WHERE i.findings LIKE '%fail%' OR i.findings LIKE '%defect%' "
                        + "ORDER BY i.inspection_date_date DESC "
                        + "LIMIT 10");

        many("getComplianceStatus",
                "SELECT e.id AS equipment_id, e.equipment_id AS equipment_identifier, e.type, "
                        + "MAX(i.inspection_date_date) AS last_inspection_date, "
                        + "COUNT(CASE WHEN ii.critical = TRUE AND ii.result = 'fail' THEN 1 END) AS critical_failures, "
                        + "COUNT(CASE WHEN d.severity = 'critical' AND d.status IN ('open', 'in_progress') THEN 1 END) "
                        + "AS open_critical_deficiencies "
                        + "FROM equipment e "
                        + "LEFT JOIN inspections i ON e.id = i.equipment_id "
                        + "LEFT JOIN inspection_items ii ON i.id = ii.inspection_id "
                        + "LEFT JOIN deficiencies d ON e.id = d.equipment_id "
                        + "GROUP BY e.id, e.equipment_id, e.type "
                        + "ORDER BY e.equipment_id");

        // latest inspection per equipment, older than one year
        many("getOverdue",
                "SELECT i.*, e.equipment_id AS equipment_identifier "
                        + "FROM inspections i "
                        + "JOIN equipment e ON i.equipment_id = e.id "
                        + "WHERE i.inspection_date_date < CURRENT_DATE - INTERVAL '1' YEAR "
                        + "AND i.id IN (SELECT MAX(id) FROM inspections GROUP BY equipment_id) "
                        + "ORDER BY i.inspection_date_date ASC");
    }
}
