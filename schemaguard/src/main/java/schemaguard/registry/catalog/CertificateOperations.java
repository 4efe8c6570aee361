package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Certificates issued for inspections, load tests and calibrations.
 */
final class CertificateOperations extends DomainOperations {

    static final Set<String> TYPES = Set.of("inspection", "load_test", "calibration");
    static final Set<String> STATUSES = Set.of("active", "expired", "revoked");

    CertificateOperations() {
        super("certificates");

        many("getByEquipmentId", "SELECT * FROM certificates WHERE equipment_id = ? ORDER BY issue_date DESC",
                args -> args.isPositiveInt("equipmentId"),
                "equipmentId");

        one("getByCertificateNumber", "SELECT * FROM certificates WHERE certificate_number = ?",
                args -> args.isString("certificateNumber"),
                "certificateNumber");

        many("getExpiring",
                "SELECT c.*, e.equipment_id AS equipment_identifier "
                        + "FROM certificates c "
                        + "JOIN equipment e ON c.equipment_id = e.id "
                        + "WHERE c.expiration_date <= CAST(? AS DATE) AND c.status = 'active' "
                        + "ORDER BY c.expiration_date",
                args -> args.isDate("expirationDate"),
                "expirationDate");

        write("create",
                "INSERT INTO certificates (certificate_number, certificate_type, equipment_id, "
                        + "entity_id, issue_date, expiration_date, issued_by, qr_code_data, certificate_hash) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPresent("certificateNumber")
                        && args.isOneOf("certificateType", TYPES)
                        && args.isPositiveInt("equipmentId")
                        && args.isPositiveInt("entityId")
                        && args.isDate("issueDate")
                        && args.isPresent("issuedBy"),
                "certificateNumber", "certificateType", "equipmentId", "entityId",
                "issueDate", "expirationDate", "issuedBy", "qrCodeData", "certificateHash");

        write("updateStatus", "UPDATE certificates SET status = ? WHERE id = ?",
                args -> args.isPositiveInt("id") && args.isOneOf("status", STATUSES),
                "status", "id");

        scalar("getTotal", "SELECT COUNT(*) AS count FROM certificates");
    }
}
