package schemaguard.engine;

import schemaguard.config.MigrationConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Time limits for the two long-running parts of a migration cycle.
 *
 * <ul>
 *   <li>step timeout: applies to each {@link schemaguard.SchemaMigration} separately</li>
 *   <li>backup timeout: applies to the snapshot copy of the live file</li>
 * </ul>
 *
 * <p>Both default to {@link #NO_TIMEOUT} (disabled).
 *
 * <h2>Example:</h2>
 * <pre>
 * MigrationTimeoutConfig timeouts = MigrationTimeoutConfig.builder()
 *     .stepTimeoutSeconds(120)
 *     .backupTimeoutSeconds(30)
 *     .build();
 * </pre>
 */
public final class MigrationTimeoutConfig {

    /**
     * Special value indicating no timeout.
     */
    public static final Duration NO_TIMEOUT = Duration.ZERO;

    /**
     * Default configuration with all timeouts disabled.
     */
    public static final MigrationTimeoutConfig DEFAULTS = new MigrationTimeoutConfig(NO_TIMEOUT, NO_TIMEOUT);

    private final Duration stepTimeout;
    private final Duration backupTimeout;

    private MigrationTimeoutConfig(Duration stepTimeout, Duration backupTimeout) {
        this.stepTimeout = Objects.requireNonNull(stepTimeout, "stepTimeout");
        this.backupTimeout = Objects.requireNonNull(backupTimeout, "backupTimeout");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Takes the timeouts from the loaded configuration.
     *
     * @param config the configuration
     * @return the matching timeout configuration
     */
    public static MigrationTimeoutConfig from(MigrationConfig config) {
        return builder()
                .stepTimeout(config.stepTimeout() != null ? config.stepTimeout() : NO_TIMEOUT)
                .backupTimeout(config.backupTimeout() != null ? config.backupTimeout() : NO_TIMEOUT)
                .build();
    }

    /**
     * @return the per-step timeout, or {@link #NO_TIMEOUT} if disabled
     */
    public Duration stepTimeout() {
        return stepTimeout;
    }

    /**
     * @return the snapshot copy timeout, or {@link #NO_TIMEOUT} if disabled
     */
    public Duration backupTimeout() {
        return backupTimeout;
    }

    /**
     * Checks if a timeout is enabled (not {@link #NO_TIMEOUT}).
     *
     * @param timeout the timeout to check
     * @return true if timeout is enabled
     */
    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    @Override
    public String toString() {
        return "MigrationTimeoutConfig{" +
                "step=" + formatTimeout(stepTimeout) +
                ", backup=" + formatTimeout(backupTimeout) +
                '}';
    }

    private static String formatTimeout(Duration d) {
        return isEnabled(d) ? d.toMillis() + "ms" : "disabled";
    }

    /**
     * Builder for creating {@link MigrationTimeoutConfig} instances.
     */
    public static final class Builder {
        private Duration stepTimeout = NO_TIMEOUT;
        private Duration backupTimeout = NO_TIMEOUT;

        private Builder() {}

        public Builder stepTimeout(Duration timeout) {
            this.stepTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        /**
         * @param seconds the timeout in seconds, or 0 to disable
         * @return this builder
         */
        public Builder stepTimeoutSeconds(long seconds) {
            return stepTimeout(seconds <= 0 ? NO_TIMEOUT : Duration.ofSeconds(seconds));
        }

        public Builder backupTimeout(Duration timeout) {
            this.backupTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        /**
         * @param seconds the timeout in seconds, or 0 to disable
         * @return this builder
         */
        public Builder backupTimeoutSeconds(long seconds) {
            return backupTimeout(seconds <= 0 ? NO_TIMEOUT : Duration.ofSeconds(seconds));
        }

        public MigrationTimeoutConfig build() {
            return new MigrationTimeoutConfig(stepTimeout, backupTimeout);
        }
    }
}
