package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Calibration records of measuring instruments.
 */
final class CalibrationOperations extends DomainOperations {

    static final Set<String> RESULTS = Set.of("pass", "fail", "limited");

    private static final String WITH_EQUIPMENT =
            "SELECT c.*, e.equipment_id AS equipment_identifier "
                    + "FROM calibrations c "
                    + "JOIN equipment e ON c.equipment_id = e.id ";

    CalibrationOperations() {
        super("calibrations");

        many("getByEquipmentId", "SELECT * FROM calibrations WHERE equipment_id = ? ORDER BY calibration_date DESC",
                args -> args.isPositiveInt("equipmentId"),
                "equipmentId");

        many("getDue", WITH_EQUIPMENT
                        + "WHERE c.calibration_due_date <= CAST(? AS DATE) ORDER BY c.calibration_due_date",
                args -> args.isDate("dueDate"),
                "dueDate");

        write("create",
                "INSERT INTO calibrations (equipment_id, instrument_type, calibration_date, "
                        + "calibration_due_date, calibrated_by, calibration_agency, certificate_number, "
                        + "calibration_results, accuracy_tolerance, actual_accuracy, adjustments_made, notes) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPositiveInt("equipmentId")
                        && args.isPresent("instrumentType")
                        && args.isDate("calibrationDate")
                        && args.isDate("calibrationDueDate")
                        && args.isPresent("calibratedBy")
                        && args.isOneOf("calibrationResults", RESULTS),
                "equipmentId", "instrumentType", "calibrationDate", "calibrationDueDate",
                "calibratedBy", "calibrationAgency", "certificateNumber", "calibrationResults",
                "accuracyTolerance", "actualAccuracy", "adjustmentsMade", "notes");

        scalar("getTotal", "SELECT COUNT(*) AS count FROM calibrations");

        many("getOverdue", WITH_EQUIPMENT
                + "WHERE c.calibration_due_date < CURRENT_DATE ORDER BY c.calibration_due_date ASC");
    }
}
