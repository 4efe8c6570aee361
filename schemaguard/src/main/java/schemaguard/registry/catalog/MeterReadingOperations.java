package schemaguard.registry.catalog;

/**
 * Hour-meter and cycle-counter readings, used by usage-based maintenance.
 */
final class MeterReadingOperations extends DomainOperations {

    MeterReadingOperations() {
        super("meterReadings");

        many("getByEquipmentId", "SELECT * FROM meter_readings WHERE equipment_id = ? ORDER BY reading_date DESC",
                args -> args.isPositiveInt("equipmentId"),
                "equipmentId");

        many("getLatestByEquipment",
                "SELECT equipment_id, meter_type, MAX(reading_value) AS latest_reading, "
                        + "MAX(reading_date) AS latest_date "
                        + "FROM meter_readings "
                        + "GROUP BY equipment_id, meter_type");

        write("create",
                "INSERT INTO meter_readings (equipment_id, meter_type, reading_value, "
                        + "reading_date, recorded_by, notes) "
                        + "VALUES (?, ?, ?, ?, ?, ?)",
                args -> args.isPositiveInt("equipmentId")
                        && args.isPresent("meterType")
                        && args.isNumber("readingValue")
                        && args.isDate("readingDate")
                        && args.isPresent("recordedBy"),
                "equipmentId", "meterType", "readingValue", "readingDate", "recordedBy", "notes");
    }
}
