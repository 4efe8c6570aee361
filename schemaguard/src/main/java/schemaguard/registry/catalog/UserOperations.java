package schemaguard.registry.catalog;

import java.util.Set;

/**
 * Application users and roles.
 */
final class UserOperations extends DomainOperations {

    static final Set<String> ROLES = Set.of("admin", "inspector", "reviewer", "viewer");

    UserOperations() {
        super("users");

        many("getAll", "SELECT * FROM users WHERE active = TRUE ORDER BY full_name");

        one("getByUsername", "SELECT * FROM users WHERE username = ? AND active = TRUE",
                args -> args.isString("username"),
                "username");

        write("create", "INSERT INTO users (username, full_name, email, role) VALUES (?, ?, ?, ?)",
                args -> args.isPresent("username")
                        && args.isPresent("fullName")
                        && args.isOneOf("role", ROLES),
                "username", "fullName", "email", "role");

        write("updateLastLogin", "UPDATE users SET last_login = CURRENT_TIMESTAMP WHERE id = ?",
                args -> args.isPositiveInt("id"),
                "id");
    }
}
