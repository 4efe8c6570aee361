package schemaguard.backup;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Description of one backup file, for operational tooling.
 *
 * @param name file name, e.g. {@code database-backup-2025-01-03T10-00-00-000Z.db}
 * @param path absolute path of the file
 * @param size size in bytes
 * @param created last-modification time of the file
 */
public record BackupInfo(String name, Path path, long size, Instant created) {
}
