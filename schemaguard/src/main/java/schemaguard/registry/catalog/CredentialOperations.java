package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Operator and inspector credentials.
 */
final class CredentialOperations extends DomainOperations {

    static final Set<String> STATUSES = Set.of("active", "expired", "suspended", "revoked");

    CredentialOperations() {
        super("credentials");

        many("getAll", "SELECT * FROM credentials ORDER BY person_name, credential_type");

        many("getByPerson", "SELECT * FROM credentials WHERE person_name = ? ORDER BY credential_type",
                args -> args.isString("personName"),
                "personName");

        many("getExpiring",
                "SELECT * FROM credentials WHERE expiration_date <= CAST(? AS DATE) AND status = 'active' "
                        + "ORDER BY expiration_date",
                args -> args.isDate("expirationDate"),
                "expirationDate");

        write("create",
                "INSERT INTO credentials (person_name, credential_type, equipment_types, "
                        + "certification_body, certificate_number, issue_date, expiration_date, "
                        + "renewal_required, notes) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPresent("personName")
                        && args.isPresent("credentialType")
                        && args.isDate("issueDate")
                        && args.isDate("expirationDate"),
                "personName", "credentialType", "equipmentTypes", "certificationBody",
                "certificateNumber", "issueDate", "expirationDate", "renewalRequired", "notes");

        write("updateStatus", "UPDATE credentials SET status = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                args -> args.isPositiveInt("id") && args.isOneOf("status", STATUSES),
                "status", "id");

        scalar("getTotal", "SELECT COUNT(*) AS count FROM credentials");
    }
}
