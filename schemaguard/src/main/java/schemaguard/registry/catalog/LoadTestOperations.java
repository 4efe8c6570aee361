package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Load tests of lifting equipment.
 */
final class LoadTestOperations extends DomainOperations {

    static final Set<String> TEST_TYPES = Set.of("annual", "periodic", "initial", "after_repair");
    static final Set<String> RESULTS = Set.of("pass", "fail");

    private static final String WITH_EQUIPMENT =
            "SELECT lt.*, e.equipment_id AS equipment_identifier "
                    + "FROM load_tests lt "
                    + "JOIN equipment e ON lt.equipment_id = e.id ";

    LoadTestOperations() {
        super("loadTests");

        many("getByEquipmentId", "SELECT * FROM load_tests WHERE equipment_id = ? ORDER BY test_date DESC",
                args -> args.isPositiveInt("equipmentId"),
                "equipmentId");

        many("getDue", WITH_EQUIPMENT
                        + "WHERE lt.next_test_due <= CAST(? AS DATE) AND lt.test_results = 'pass' "
                        + "ORDER BY lt.next_test_due",
                args -> args.isDate("dueDate"),
                "dueDate");

        write("create",
                "INSERT INTO load_tests (equipment_id, test_date, test_type, test_load_percentage, "
                        + "rated_capacity, test_load, test_duration, inspector, test_results, "
                        + "deficiencies_found, corrective_actions, next_test_due, certificate_number, notes) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPositiveInt("equipmentId")
                        && args.isDate("testDate")
                        && args.isOneOf("testType", TEST_TYPES)
                        && args.isOneOf("testResults", RESULTS)
                        && args.isString("inspector"),
                "equipmentId", "testDate", "testType", "testLoadPercentage", "ratedCapacity",
                "testLoad", "testDuration", "inspector", "testResults", "deficienciesFound",
                "correctiveActions", "nextTestDue", "certificateNumber", "notes");

        // most recent test per equipment; the highest id wins a same-day tie
        many("getLastByEquipment",
                "SELECT lt.equipment_id, lt.test_date AS last_test_date, lt.test_results "
                        + "FROM load_tests lt "
                        + "WHERE lt.id = (SELECT x.id FROM load_tests x WHERE x.equipment_id = lt.equipment_id "
                        + "ORDER BY x.test_date DESC, x.id DESC LIMIT 1) "
                        + "ORDER BY lt.equipment_id");

        scalar("getTotal", "SELECT COUNT(*) AS count FROM load_tests");

        many("getOverdue", WITH_EQUIPMENT
                + "WHERE lt.next_test_due < CURRENT_DATE AND lt.test_results = 'pass' "
                + "ORDER BY lt.next_test_due ASC");
    }
}
