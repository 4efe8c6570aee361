package schemaguard.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Central configuration for the database subsystem.
 *
 * <p>Holds the persisted-state layout (data directory, database name, backup
 * directory, journal file, managed documents directory), the backup retention
 * ceiling, the optional migration timeouts and the alert level.
 *
 * <p>Paths that are not set explicitly are derived from the data directory:
 * <pre>
 * &lt;data.dir&gt;/database.mv.db
 * &lt;data.dir&gt;/backups/
 * &lt;data.dir&gt;/migration.log
 * &lt;data.dir&gt;/documents/
 * </pre>
 *
 * @see MigrationConfigLoader
 */
public final class MigrationConfig {

    public static final int DEFAULT_MAX_BACKUPS = 10;
    public static final String DEFAULT_DATABASE_NAME = "database";

    public static final MigrationConfig DEFAULTS = builder().build();

    private final Path dataDir;
    private final String databaseName;
    private final Path backupDir;
    private final int maxBackups;
    private final Path logFile;
    private final Duration stepTimeout;
    private final Duration backupTimeout;
    private final AlertLevel alertLevel;
    private final Path documentsDir;
    private final boolean requireManagedDocuments;

    private MigrationConfig(Builder b) {
        this.dataDir = b.dataDir;
        this.databaseName = b.databaseName;
        this.backupDir = b.backupDir != null ? b.backupDir : b.dataDir.resolve("backups");
        this.maxBackups = b.maxBackups;
        this.logFile = b.logFile != null ? b.logFile : b.dataDir.resolve("migration.log");
        this.stepTimeout = b.stepTimeout;
        this.backupTimeout = b.backupTimeout;
        this.alertLevel = b.alertLevel;
        this.documentsDir = b.documentsDir != null ? b.documentsDir : b.dataDir.resolve("documents");
        this.requireManagedDocuments = b.requireManagedDocuments;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the application-data directory. */
    public Path dataDir() { return dataDir; }

    /** Returns the H2 database name; the live file is {@code <name>.mv.db}. */
    public String databaseName() { return databaseName; }

    /** Returns the directory holding pre-migration backups. */
    public Path backupDir() { return backupDir; }

    /** Returns how many backups retention cleanup keeps. */
    public int maxBackups() { return maxBackups; }

    /** Returns the append-only migration journal file. */
    public Path logFile() { return logFile; }

    /** Returns the per-step timeout, {@link Duration#ZERO} when disabled. */
    public Duration stepTimeout() { return stepTimeout; }

    /** Returns the backup copy timeout, {@link Duration#ZERO} when disabled. */
    public Duration backupTimeout() { return backupTimeout; }

    /** Returns the alert level for structured logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns the managed documents directory. */
    public Path documentsDir() { return documentsDir; }

    /** Returns true if stored document paths must live inside {@link #documentsDir()}. */
    public boolean requireManagedDocuments() { return requireManagedDocuments; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "dataDir=" + dataDir +
                ", databaseName=" + databaseName +
                ", backupDir=" + backupDir +
                ", maxBackups=" + maxBackups +
                ", logFile=" + logFile +
                ", stepTimeout=" + stepTimeout.toSeconds() + "s" +
                ", backupTimeout=" + backupTimeout.toSeconds() + "s" +
                ", alertLevel=" + alertLevel +
                ", documentsDir=" + documentsDir +
                ", requireManagedDocuments=" + requireManagedDocuments +
                '}';
    }

    /**
     * Builder for constructing {@link MigrationConfig} instances.
     */
    public static final class Builder {
        private Path dataDir = Path.of(System.getProperty("user.home"), ".schemaguard");
        private String databaseName = DEFAULT_DATABASE_NAME;
        private Path backupDir;
        private int maxBackups = DEFAULT_MAX_BACKUPS;
        private Path logFile;
        private Duration stepTimeout = Duration.ZERO;
        private Duration backupTimeout = Duration.ZERO;
        private AlertLevel alertLevel = AlertLevel.WARNING;
        private Path documentsDir;
        private boolean requireManagedDocuments = false;

        public Builder dataDir(Path dir) {
            if (dir == null) throw new IllegalArgumentException("dataDir must not be null");
            this.dataDir = dir;
            return this;
        }

        public Builder databaseName(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("databaseName must not be blank");
            this.databaseName = name;
            return this;
        }

        public Builder backupDir(Path dir) {
            this.backupDir = dir;
            return this;
        }

        public Builder maxBackups(int max) {
            if (max < 0) throw new IllegalArgumentException("maxBackups must not be negative");
            this.maxBackups = max;
            return this;
        }

        public Builder logFile(Path file) {
            this.logFile = file;
            return this;
        }

        public Builder stepTimeout(Duration timeout) {
            this.stepTimeout = timeout;
            return this;
        }

        public Builder stepTimeoutSeconds(long seconds) {
            return stepTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder backupTimeout(Duration timeout) {
            this.backupTimeout = timeout;
            return this;
        }

        public Builder backupTimeoutSeconds(long seconds) {
            return backupTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public Builder documentsDir(Path dir) {
            this.documentsDir = dir;
            return this;
        }

        public Builder requireManagedDocuments(boolean require) {
            this.requireManagedDocuments = require;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}
