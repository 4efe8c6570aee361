package schemaguard.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import schemaguard.alert.MigrationAlertLogger;
import schemaguard.alert.MigrationJournal;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the backup directory: creates snapshots, lists them and enforces retention.
 *
 * <p>Backups are named {@code database-backup-<timestamp>.db}, where the timestamp is
 * an ISO-8601 UTC instant with colons and dots replaced by hyphens so that names
 * sort chronologically. No other component writes to the backup directory.
 */
public class BackupStore {

    private static final Logger log = LoggerFactory.getLogger(BackupStore.class);

    public static final String PREFIX = "database-backup-";
    public static final String SUFFIX = ".db";

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

    private static final Comparator<BackupInfo> NEWEST_FIRST =
            Comparator.comparing(BackupInfo::created).reversed()
                    .thenComparing(BackupInfo::name, Comparator.reverseOrder());

    private final Path directory;
    private final MigrationJournal journal;
    private final Clock clock;

    public BackupStore(Path directory, MigrationJournal journal) {
        this(directory, journal, Clock.systemUTC());
    }

    public BackupStore(Path directory, MigrationJournal journal, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.journal = Objects.requireNonNull(journal, "journal");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path directory() {
        return directory;
    }

    /**
     * Returns true if the file name follows the backup naming scheme.
     */
    public static boolean isBackupName(String fileName) {
        return fileName.startsWith(PREFIX) && fileName.endsWith(SUFFIX);
    }

    /**
     * Copies the live database file to a new timestamped backup.
     *
     * @param liveFile the database file to snapshot
     * @return the backup path, or empty if the live file does not exist
     * @throws IOException if the directory cannot be created or the copy fails
     */
    public Optional<Path> createBackup(Path liveFile) throws IOException {
        if (!Files.exists(liveFile)) {
            journal.log("No existing database found, skipping backup");
            return Optional.empty();
        }
        Files.createDirectories(directory);
        Path target = uniqueTarget();
        try {
            Files.copy(liveFile, target);
        } catch (IOException e) {
            journal.log("Failed to create backup: " + e.getMessage());
            Files.deleteIfExists(target);
            throw e;
        }
        journal.log("Database backup created: " + target);
        MigrationAlertLogger.backupCreated(target.toString());
        return Optional.of(target);
    }

    private Path uniqueTarget() {
        String stamp = STAMP.format(clock.instant());
        Path target = directory.resolve(PREFIX + stamp + SUFFIX);
        int n = 1;
        while (Files.exists(target)) {
            target = directory.resolve(PREFIX + stamp + "-" + n++ + SUFFIX);
        }
        return target;
    }

    /**
     * Copies a backup back over the live database file (full overwrite).
     *
     * @param backup the backup to restore
     * @param liveFile the database file to overwrite
     * @throws IOException if the backup is missing or the copy fails
     */
    public void restore(Path backup, Path liveFile) throws IOException {
        if (backup == null || !Files.exists(backup)) {
            throw new IOException("Backup file not found for rollback: " + backup);
        }
        Files.copy(backup, liveFile, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Lists the backups, newest first by modification time.
     *
     * @return the backups; empty if the directory is missing or unreadable
     */
    public List<BackupInfo> listBackups() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<BackupInfo> result = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (!isBackupName(name) || !Files.isRegularFile(p)) {
                    continue;
                }
                BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
                result.add(new BackupInfo(name, p, attrs.size(), attrs.lastModifiedTime().toInstant()));
            }
        } catch (IOException e) {
            journal.log("Failed to get backup info: " + e.getMessage());
            return List.of();
        }
        result.sort(NEWEST_FIRST);
        return List.copyOf(result);
    }

    /**
     * Deletes every backup beyond the {@code maxBackups} newest. A failed deletion is
     * logged and does not stop the rest.
     *
     * @param maxBackups how many backups to keep
     * @return the number of files deleted
     */
    public int cleanupOldBackups(int maxBackups) {
        if (maxBackups < 0) {
            throw new IllegalArgumentException("maxBackups must not be negative: " + maxBackups);
        }
        List<BackupInfo> backups = listBackups();
        if (backups.size() <= maxBackups) {
            return 0;
        }
        int deleted = 0;
        for (BackupInfo info : backups.subList(maxBackups, backups.size())) {
            try {
                deleteBackup(info.path());
                deleted++;
                journal.log("Deleted old backup: " + info.name());
            } catch (IOException e) {
                journal.log("Failed to delete old backup " + info.name() + ": " + e.getMessage());
                MigrationAlertLogger.backupDeleteFailed(info.name(), e);
                log.debug("Backup deletion failed", e);
            }
        }
        return deleted;
    }

    void deleteBackup(Path backup) throws IOException {
        Files.delete(backup);
    }
}
