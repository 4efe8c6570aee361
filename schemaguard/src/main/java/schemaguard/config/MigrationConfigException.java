package schemaguard.config;

/**
 * Exception thrown when configuration cannot be loaded or is invalid.
 *
 * <p>This is thrown when:
 * <ul>
 *   <li>No configuration file is found on the classpath</li>
 *   <li>The configuration file cannot be parsed</li>
 *   <li>A value is structurally impossible (e.g. a negative backup count)</li>
 * </ul>
 *
 * <p>Unchecked so configuration loading can sit in initialization code
 * without forced exception handling.
 *
 * @see MigrationConfigLoader
 */
public class MigrationConfigException extends RuntimeException {

    public MigrationConfigException(String message) {
        super(message);
    }

    public MigrationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
