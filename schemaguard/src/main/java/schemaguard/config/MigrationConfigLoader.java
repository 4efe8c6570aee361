package schemaguard.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * Loads configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code schemaguard.properties} on the classpath</li>
 *   <li>{@code schemaguard.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based configuration, using the same keys
 * (e.g., {@code -Dbackup.max.count=20}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code storage.data.dir} - application-data directory</li>
 *   <li>{@code storage.database.name} - H2 database name</li>
 *   <li>{@code backup.dir} - backup directory</li>
 *   <li>{@code backup.max.count} - backups kept by retention cleanup</li>
 *   <li>{@code migration.log.file} - append-only migration journal</li>
 *   <li>{@code migration.timeout.step} - per-step timeout in seconds (0 = off)</li>
 *   <li>{@code migration.timeout.backup} - backup copy timeout in seconds (0 = off)</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 *   <li>{@code documents.dir} - managed documents directory</li>
 *   <li>{@code documents.require.managed} - true to only accept paths inside it</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    private MigrationConfigLoader() {}

    /**
     * Load from classpath (schemaguard.properties or schemaguard.yml).
     * @throws MigrationConfigException if no config file found
     */
    public static MigrationConfig load() {
        InputStream is = getResource("schemaguard.properties");
        if (is != null) {
            return loadProperties(is, "schemaguard.properties");
        }

        is = getResource("schemaguard.yml");
        if (is != null) {
            return loadYaml(is, "schemaguard.yml");
        }

        throw new MigrationConfigException(
                "Config file required: schemaguard.properties or schemaguard.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the configuration is invalid
     */
    public static MigrationConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigrationConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        } catch (RuntimeException e) {
            throw new MigrationConfigException("Failed to parse " + source + ": " + e.getMessage(), e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static MigrationConfig parse(Properties props) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        getString(props, "storage.data.dir").ifPresent(v -> b.dataDir(Path.of(v)));
        getString(props, "storage.database.name").ifPresent(v -> {
            if (!v.isEmpty()) b.databaseName(v);
        });
        getString(props, "backup.dir").ifPresent(v -> b.backupDir(Path.of(v)));
        getInt(props, "backup.max.count").ifPresent(v -> {
            if (v >= 0) {
                b.maxBackups(v);
            } else {
                log.warn("Invalid backup.max.count: {}", v);
            }
        });
        getString(props, "migration.log.file").ifPresent(v -> b.logFile(Path.of(v)));

        getLong(props, "migration.timeout.step").ifPresent(b::stepTimeoutSeconds);
        getLong(props, "migration.timeout.backup").ifPresent(b::backupTimeoutSeconds);

        getString(props, "migration.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        getString(props, "documents.dir").ifPresent(v -> b.documentsDir(Path.of(v)));
        getString(props, "documents.require.managed").ifPresent(v -> {
            if ("true".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v)) {
                b.requireManagedDocuments(Boolean.parseBoolean(v));
            } else {
                log.warn("Invalid documents.require.managed: {}", v);
            }
        });

        return b.build();
    }

    private static java.util.Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? java.util.Optional.of(val.trim()) : java.util.Optional.empty();
    }

    private static java.util.Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return java.util.Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return java.util.Optional.empty();
            }
        });
    }

    private static java.util.Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return java.util.Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return java.util.Optional.empty();
            }
        });
    }
}
