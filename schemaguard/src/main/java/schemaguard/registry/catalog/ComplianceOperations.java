package schemaguard.registry.catalog;

/**
 * Compliance standards and their assignment to equipment types.
 */
final class ComplianceOperations extends DomainOperations {

    ComplianceOperations() {
        super("compliance");

        many("getAllStandards", "SELECT * FROM compliance_standards ORDER BY name");

        write("createStandard", "INSERT INTO compliance_standards (name, description, authority) VALUES (?, ?, ?)",
                args -> args.isPresent("name") && args.isPresent("description") && args.isPresent("authority"),
                "name", "description", "authority");

        write("deleteStandard", "DELETE FROM compliance_standards WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");

        many("getAssignedStandards",
                "SELECT cs.id, cs.name FROM compliance_standards cs "
                        + "JOIN equipment_type_compliance etc ON cs.id = etc.standard_id "
                        + "WHERE etc.equipment_type = ?",
                args -> args.isString("equipmentType"),
                "equipmentType");

        // re-assigning an existing pair is a no-op
        write("assignStandard",
                "MERGE INTO equipment_type_compliance (equipment_type, standard_id) "
                        + "KEY (equipment_type, standard_id) VALUES (?, ?)",
                args -> args.isPresent("equipmentType") && args.isPositiveInt("standardId"),
                "equipmentType", "standardId");

        write("unassignStandard",
                "DELETE FROM equipment_type_compliance WHERE equipment_type = ? AND standard_id = ?",
                args -> args.isPresent("equipmentType") && args.isPositiveInt("standardId"),
                "equipmentType", "standardId");

        many("getComplianceReport",
                "SELECT etc.equipment_type, cs.name AS standard_name, cs.id AS standard_id "
                        + "FROM equipment_type_compliance etc "
                        + "JOIN compliance_standards cs ON etc.standard_id = cs.id "
                        + "ORDER BY etc.equipment_type, cs.name");
    }
}
