package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Equipment register.
 */
final class EquipmentOperations extends DomainOperations {

    static final Set<String> STATUSES = Set.of("active", "out of service", "under maintenance");

    EquipmentOperations() {
        super("equipment");

        many("getAll", "SELECT * FROM equipment ORDER BY equipment_id");

        one("getById", "SELECT * FROM equipment WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");

        one("getByEquipmentId", "SELECT * FROM equipment WHERE equipment_id = ?",
                args -> args.isString("equipmentId"),
                "equipmentId");

        write("create",
                "INSERT INTO equipment (equipment_id, type, manufacturer, model, serial_number, "
                        + "capacity, installation_date, location, status, qr_code_data) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isString("equipmentId")
                        && args.isPresent("type")
                        && args.isPresent("manufacturer")
                        && args.isAbsentOrOneOf("status", STATUSES),
                "equipmentId", "type", "manufacturer", "model", "serialNumber",
                "capacity", "installationDate", "location", "status", "qrCodeData");

        write("update",
                "UPDATE equipment SET manufacturer = ?, model = ?, serial_number = ?, "
                        + "capacity = ?, installation_date = ?, location = ?, status = ? WHERE id = ?",
                args -> args.isPositiveInt("id") && args.isAbsentOrOneOf("status", STATUSES),
                "manufacturer", "model", "serialNumber", "capacity",
                "installationDate", "location", "status", "id");

        write("delete", "DELETE FROM equipment WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");

        many("getDistinctTypes", "SELECT DISTINCT type FROM equipment WHERE type IS NOT NULL ORDER BY type");

        many("getStatusCounts", "SELECT status, COUNT(*) AS count FROM equipment GROUP BY status");

        scalar("getCount", "SELECT COUNT(*) AS count FROM equipment");
    }
}
