package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Signatures on inspections, deficiencies and work orders.
 */
final class SignatureOperations extends DomainOperations {

    static final Set<String> ENTITY_TYPES = Set.of("inspection", "deficiency", "work_order");
    static final Set<String> SIGNATURE_TYPES = Set.of("inspector", "supervisor", "verification");

    SignatureOperations() {
        super("signatures");

        many("getByEntity",
                "SELECT * FROM signatures WHERE entity_type = ? AND entity_id = ? ORDER BY signed_at DESC, id DESC",
                args -> args.isOneOf("entityType", ENTITY_TYPES) && args.isPositiveInt("entityId"),
                "entityType", "entityId");

        write("create",
                "INSERT INTO signatures (entity_type, entity_id, signature_type, signatory_name, signature_data) "
                        + "VALUES (?, ?, ?, ?, ?)",
                args -> args.isOneOf("entityType", ENTITY_TYPES)
                        && args.isPositiveInt("entityId")
                        && args.isOneOf("signatureType", SIGNATURE_TYPES)
                        && args.isPresent("signatoryName")
                        && args.isPresent("signatureData"),
                "entityType", "entityId", "signatureType", "signatoryName", "signatureData");

        write("delete", "DELETE FROM signatures WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");
    }
}
