package schemaguard.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MigrationConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                storage.data.dir=/var/lib/inspections
                storage.database.name=plant
                backup.max.count=25
                migration.timeout.step=60
                migration.timeout.backup=30
                migration.alert.level=ERROR
                documents.require.managed=true
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(Path.of("/var/lib/inspections"), c.dataDir());
        assertEquals("plant", c.databaseName());
        assertEquals(25, c.maxBackups());
        assertEquals(Duration.ofSeconds(60), c.stepTimeout());
        assertEquals(Duration.ofSeconds(30), c.backupTimeout());
        assertEquals(AlertLevel.ERROR, c.alertLevel());
        assertTrue(c.requireManagedDocuments());
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path f = tempDir.resolve("test.yml");
        Files.writeString(f, """
                storage:
                  data:
                    dir: /srv/data
                backup:
                  dir: /mnt/backups
                  max:
                    count: 3
                migration:
                  log:
                    file: /var/log/migration.log
                  timeout:
                    step: 90
                  alert:
                    level: DEBUG
                documents:
                  dir: /srv/docs
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(Path.of("/srv/data"), c.dataDir());
        assertEquals(Path.of("/mnt/backups"), c.backupDir());
        assertEquals(3, c.maxBackups());
        assertEquals(Path.of("/var/log/migration.log"), c.logFile());
        assertEquals(Duration.ofSeconds(90), c.stepTimeout());
        assertEquals(Duration.ZERO, c.backupTimeout());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
        assertEquals(Path.of("/srv/docs"), c.documentsDir());
    }

    @Test
    void derivedPathsFollowDataDir() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, "storage.data.dir=/srv/data\n");

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(Path.of("/srv/data/backups"), c.backupDir());
        assertEquals(Path.of("/srv/data/migration.log"), c.logFile());
        assertEquals(Path.of("/srv/data/documents"), c.documentsDir());
        assertEquals(MigrationConfig.DEFAULT_DATABASE_NAME, c.databaseName());
        assertEquals(MigrationConfig.DEFAULT_MAX_BACKUPS, c.maxBackups());
    }

    @Test
    void caseInsensitiveEnums() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                migration.alert.level=error
                documents.require.managed=TRUE
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(AlertLevel.ERROR, c.alertLevel());
        assertTrue(c.requireManagedDocuments());
    }

    @Test
    void invalidValuesUseDefaults() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                migration.alert.level=INVALID
                migration.timeout.step=not-a-number
                backup.max.count=-4
                documents.require.managed=maybe
                storage.database.name=
                """);

        MigrationConfig c = MigrationConfigLoader.loadFromFile(f);

        assertEquals(AlertLevel.WARNING, c.alertLevel());
        assertEquals(Duration.ZERO, c.stepTimeout());
        assertEquals(MigrationConfig.DEFAULT_MAX_BACKUPS, c.maxBackups());
        assertFalse(c.requireManagedDocuments());
        assertEquals(MigrationConfig.DEFAULT_DATABASE_NAME, c.databaseName());
    }

    @Test
    void systemPropertiesOverrideFileValues() {
        Properties props = new Properties();
        props.setProperty("backup.max.count", "5");
        System.setProperty("backup.max.count", "20");
        try {
            assertEquals(20, MigrationConfigLoader.parse(props).maxBackups());
        } finally {
            System.clearProperty("backup.max.count");
        }
        assertEquals(5, MigrationConfigLoader.parse(props).maxBackups());
    }

    @Test
    void nonexistentFileThrows() {
        Path f = tempDir.resolve("nonexistent.properties");
        assertThrows(IOException.class, () -> MigrationConfigLoader.loadFromFile(f));
    }

    @Test
    void malformedYamlThrowsConfigException() throws IOException {
        Path f = tempDir.resolve("broken.yml");
        Files.writeString(f, "storage: [unclosed\n");

        assertThrows(MigrationConfigException.class, () -> MigrationConfigLoader.loadFromFile(f));
    }
}
