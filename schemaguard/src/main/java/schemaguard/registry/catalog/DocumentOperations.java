package schemaguard.registry.catalog;

import schemaguard.validation.PathSafetyPolicy;

/**
 * Documents attached to equipment. Stored paths must pass the path-safety policy.
 */
final class DocumentOperations extends DomainOperations {

    DocumentOperations(PathSafetyPolicy paths) {
        super("documents");

        many("getByEquipmentId", "SELECT * FROM documents WHERE equipment_id = ? ORDER BY file_name",
                args -> args.isPositiveInt("equipmentId"),
                "equipmentId");

        write("create",
                "INSERT INTO documents (equipment_id, file_name, file_path, hash, size) VALUES (?, ?, ?, ?, ?)",
                args -> args.isPositiveInt("equipmentId")
                        && args.isPresent("fileName")
                        && args.isSafePath("filePath", paths)
                        && args.isPresent("hash")
                        && args.isPresent("size"),
                "equipmentId", "fileName", "filePath", "hash", "size");

        one("checkExisting", "SELECT id FROM documents WHERE equipment_id = ? AND file_name = ?",
                args -> args.isPositiveInt("equipmentId") && args.isPresent("fileName"),
                "equipmentId", "fileName");
    }
}
