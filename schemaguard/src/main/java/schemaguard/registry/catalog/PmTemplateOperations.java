package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Preventive-maintenance templates. Deactivated templates are hidden, never deleted.
 */
final class PmTemplateOperations extends DomainOperations {

    static final Set<String> FREQUENCY_TYPES = Set.of("calendar", "usage", "condition");

    PmTemplateOperations() {
        super("pmTemplates");

        many("getAll", "SELECT * FROM pm_templates WHERE active = TRUE ORDER BY name");

        many("getByEquipmentType",
                "SELECT * FROM pm_templates WHERE equipment_type = ? AND active = TRUE ORDER BY name",
                args -> args.isString("equipmentType"),
                "equipmentType");

        write("create",
                "INSERT INTO pm_templates (name, equipment_type, description, frequency_type, "
                        + "frequency_value, frequency_unit, estimated_duration, instructions, required_skills, "
                        + "required_parts, safety_notes) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPresent("name")
                        && args.isPresent("equipmentType")
                        && args.isOneOf("frequencyType", FREQUENCY_TYPES)
                        && args.isPositiveInt("frequencyValue"),
                "name", "equipmentType", "description", "frequencyType", "frequencyValue",
                "frequencyUnit", "estimatedDuration", "instructions", "requiredSkills",
                "requiredParts", "safetyNotes");

        write("update",
                "UPDATE pm_templates SET name = ?, equipment_type = ?, description = ?, "
                        + "frequency_type = ?, frequency_value = ?, frequency_unit = ?, estimated_duration = ?, "
                        + "instructions = ?, required_skills = ?, required_parts = ?, safety_notes = ?, "
                        + "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                args -> args.isPositiveInt("id")
                        && args.isPresent("name")
                        && args.isPresent("equipmentType")
                        && args.isOneOf("frequencyType", FREQUENCY_TYPES)
                        && args.isPositiveInt("frequencyValue"),
                "name", "equipmentType", "description", "frequencyType", "frequencyValue",
                "frequencyUnit", "estimatedDuration", "instructions", "requiredSkills",
                "requiredParts", "safetyNotes", "id");

        write("deactivate", "UPDATE pm_templates SET active = FALSE, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");
    }
}
