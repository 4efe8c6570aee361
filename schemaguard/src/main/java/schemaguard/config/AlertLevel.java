package schemaguard.config;

/**
 * Alert level for structured migration logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link schemaguard.alert.MigrationAlertLogger}. Configured via the
 * {@code migration.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - all events: cycle started, step started/completed, warnings, errors</li>
 *   <li>{@link #WARNING} - rollback triggered, backup cleanup problems, and errors</li>
 *   <li>{@link #ERROR} - errors only (step failed, rollback failed)</li>
 * </ul>
 *
 * <p>The durable migration journal is not affected by this level; it always
 * records every state transition.
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}
