package schemaguard.registry.catalog;

/**
 * Append-only audit trail of user actions.
 */
final class AuditLogOperations extends DomainOperations {

    AuditLogOperations() {
        super("auditLog");

        write("create",
                "INSERT INTO audit_log (user_id, username, action, entity_type, entity_id, "
                        + "old_values, new_values, ip_address, user_agent) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                args -> args.isPresent("username")
                        && args.isPresent("action")
                        && args.isPresent("entityType")
                        && args.isPositiveInt("entityId"),
                "userId", "username", "action", "entityType", "entityId",
                "oldValues", "newValues", "ipAddress", "userAgent");

        many("getByEntity",
                "SELECT * FROM audit_log WHERE entity_type = ? AND entity_id = ? ORDER BY created_at DESC, id DESC",
                args -> args.isPresent("entityType") && args.isPositiveInt("entityId"),
                "entityType", "entityId");

        many("getRecent", "SELECT * FROM audit_log ORDER BY created_at DESC, id DESC LIMIT ?",
                args -> args.isPositiveInt("limit"),
                "limit");
    }
}
