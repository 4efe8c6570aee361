package schemaguard.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import schemaguard.config.AlertLevel;

/**
 * Structured logging for migration events.
 *
 * <p>Entries use markers like CYCLE_STARTED, STEP_COMPLETED, STEP_FAILED with
 * key=value pairs so log aggregators can alert on them.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: cycle started, step started/completed, cycle completed</li>
 *   <li>WARN: rollback triggered, backup cleanup problems</li>
 *   <li>ERROR: step failed, rollback failed</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - CYCLE_STARTED from=2 to=5
 * 12:00:00.010 INFO  migration - BACKUP_CREATED path=/data/backups/database-backup-...db
 * 12:00:00.100 INFO  migration - STEP_COMPLETED version=3 duration_ms=90
 * 12:00:00.200 ERROR migration - STEP_FAILED version=4 error="Column X not found"
 * 12:00:00.210 WARN  migration - ROLLBACK_TRIGGERED version=4 backup=/data/backups/...
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void cycleStarted(int fromVersion, int toVersion) {
        if (shouldLogInfo()) {
            log.info("CYCLE_STARTED from={} to={}", fromVersion, toVersion);
        }
    }

    public static void backupCreated(String path) {
        if (shouldLogInfo()) {
            log.info("BACKUP_CREATED path={}", path);
        }
    }

    public static void stepStarted(int version) {
        if (shouldLogInfo()) {
            log.info("STEP_STARTED version={}", version);
        }
    }

    public static void stepCompleted(int version, long durationMs) {
        if (shouldLogInfo()) {
            log.info("STEP_COMPLETED version={} duration_ms={}", version, durationMs);
        }
    }

    public static void cycleCompleted(int fromVersion, int toVersion, int applied, long durationMs) {
        if (shouldLogInfo()) {
            log.info("CYCLE_COMPLETED from={} to={} applied={} duration_ms={}",
                    fromVersion, toVersion, applied, durationMs);
        }
    }

    /**
     * Log when a step fails. Always logged.
     *
     * @param version the failing version
     * @param error what the step raised
     */
    public static void stepFailed(int version, Throwable error) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        log.error("STEP_FAILED version={} error=\"{}\"", version, errorMsg);
    }

    public static void rollbackTriggered(int version, String backupPath) {
        if (shouldLogWarn()) {
            log.warn("ROLLBACK_TRIGGERED version={} backup={}", version, backupPath);
        }
    }

    /**
     * Log when rollback completes.
     *
     * @param success whether the snapshot was restored
     */
    public static void rollbackCompleted(boolean success) {
        if (success) {
            if (shouldLogWarn()) {
                log.warn("ROLLBACK_COMPLETED status=SUCCESS");
            }
        } else {
            // Always log errors
            log.error("ROLLBACK_COMPLETED status=FAILED");
        }
    }

    public static void backupDeleteFailed(String name, Throwable error) {
        if (shouldLogWarn()) {
            log.warn("BACKUP_DELETE_FAILED name={} error=\"{}\"", name, error.getMessage());
        }
    }
}
