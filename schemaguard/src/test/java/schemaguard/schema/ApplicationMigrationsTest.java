package schemaguard.schema;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import schemaguard.alert.MigrationJournal;
import schemaguard.backup.BackupStore;
import schemaguard.backup.RollbackManager;
import schemaguard.db.DatabaseHandle;
import schemaguard.db.SchemaVersionLedger;
import schemaguard.engine.MigrationManager;
import schemaguard.engine.MigrationResult;
import schemaguard.engine.MigrationTimeoutConfig;
import schemaguard.registry.OperationCatalog;
import schemaguard.registry.OperationSpec;
import schemaguard.validation.PathSafetyPolicy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

@DisplayName("ApplicationMigrations")
class ApplicationMigrationsTest {

    @TempDir
    Path tempDir;

    private DatabaseHandle handle;
    private MigrationManager manager;

    @BeforeEach
    void setUp() {
        handle = DatabaseHandle.open(tempDir.resolve("data"), "database");
        MigrationJournal journal = new MigrationJournal(tempDir.resolve("migration.log"));
        BackupStore store = new BackupStore(tempDir.resolve("backups"), journal);
        manager = new MigrationManager(store, new RollbackManager(store, journal), journal,
                MigrationTimeoutConfig.DEFAULTS);
    }

    @AfterEach
    void tearDown() {
        handle.close();
    }

    private List<String> tables() throws SQLException {
        List<String> names = new ArrayList<>();
        DatabaseMetaData md = handle.connection().getMetaData();
        try (ResultSet rs = md.getTables(null, "PUBLIC", "%", null)) {
            while (rs.next()) {
                names.add(rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    @Test
    @DisplayName("should bring a fresh database to the target version")
    void shouldMigrateFreshDatabase() throws Exception {
        MigrationResult result = manager.migrate(handle, ApplicationMigrations.plan(), ApplicationMigrations.TARGET_VERSION);

        assertThat(result.appliedVersions()).containsExactly(1, 2, 3, 4, 5);
        assertThat(result.backup()).isEmpty();
        assertThat(new SchemaVersionLedger().currentVersion(handle.connection()))
                .isEqualTo(ApplicationMigrations.TARGET_VERSION);
        assertThat(tables()).contains(
                "equipment", "inspections", "documents", "scheduled_inspections", "compliance_standards",
                "equipment_type_compliance", "inspection_templates", "inspection_items", "deficiencies",
                "signatures", "work_orders", "pm_templates", "pm_schedules", "meter_readings", "load_tests",
                "calibrations", "credentials", "template_items", "users", "audit_log", "certificates",
                SchemaVersionLedger.TABLE);
    }

    @Test
    @DisplayName("the plan should end at the target version")
    void planShouldEndAtTarget() {
        assertThat(ApplicationMigrations.plan().latestVersion()).isEqualTo(ApplicationMigrations.TARGET_VERSION);
    }

    @Test
    @DisplayName("every catalog statement should prepare against the migrated schema")
    void everyStatementShouldPrepare() throws Exception {
        manager.migrate(handle, ApplicationMigrations.plan(), ApplicationMigrations.TARGET_VERSION);
        Connection connection = handle.connection();

        List<String> broken = new ArrayList<>();
        for (OperationSpec spec : OperationCatalog.standard(PathSafetyPolicy.unmanaged()).all()) {
            try (PreparedStatement ignored = connection.prepareStatement(spec.statement())) {
                // parsed and resolved
            } catch (SQLException e) {
                broken.add(spec.key() + ": " + e.getMessage());
            }
        }

        if (!broken.isEmpty()) {
            fail("Statements that do not match the schema:%n%s", String.join("\n", broken));
        }
    }

    @Test
    @DisplayName("a second run should be a no-op")
    void secondRunShouldBeNoOp() throws Exception {
        manager.migrate(handle, ApplicationMigrations.plan(), ApplicationMigrations.TARGET_VERSION);

        MigrationResult again = manager.migrate(handle, ApplicationMigrations.plan(), ApplicationMigrations.TARGET_VERSION);

        assertThat(again.upToDate()).isTrue();
        assertThat(manager.getBackupInfo()).isEmpty();
    }

    @Test
    @DisplayName("upgrading a baseline database should keep its rows and backfill inspection dates")
    void shouldUpgradeBaselineDatabase() throws Exception {
        manager.migrate(handle, ApplicationMigrations.plan(), 1);
        try (Statement st = handle.connection().createStatement()) {
            st.executeUpdate("INSERT INTO equipment (equipment_id, type, manufacturer) VALUES ('CR-1', 'Hoist', 'Acme')");
            st.executeUpdate("INSERT INTO inspections (equipment_id, inspector, inspection_date) "
                    + "SELECT id, 'J. Smith', DATE '2024-06-01' FROM equipment");
        }

        MigrationResult result = manager.migrate(handle, ApplicationMigrations.plan(), ApplicationMigrations.TARGET_VERSION);

        assertThat(result.fromVersion()).isEqualTo(1);
        assertThat(result.appliedVersions()).containsExactly(2, 3, 4, 5);
        assertThat(result.backup()).isPresent();
        try (Statement st = handle.connection().createStatement();
             ResultSet rs = st.executeQuery("SELECT inspection_date_date FROM inspections")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getObject(1, LocalDate.class)).isEqualTo(LocalDate.of(2024, 6, 1));
        }
    }
}
