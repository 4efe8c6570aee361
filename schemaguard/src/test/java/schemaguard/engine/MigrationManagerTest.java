package schemaguard.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import schemaguard.alert.MigrationJournal;
import schemaguard.backup.BackupInfo;
import schemaguard.backup.BackupStore;
import schemaguard.backup.RollbackManager;
import schemaguard.db.DatabaseHandle;
import schemaguard.db.SchemaVersionLedger;
import schemaguard.exceptions.BackupCreationException;
import schemaguard.exceptions.MigrationStepException;
import schemaguard.exceptions.MigrationTimeoutException;
import schemaguard.exceptions.RollbackException;
import schemaguard.plan.MigrationPlan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("MigrationManager")
class MigrationManagerTest {

    @TempDir
    Path tempDir;

    private MigrationJournal journal;
    private BackupStore store;
    private DatabaseHandle handle;

    @BeforeEach
    void setUp() {
        journal = new MigrationJournal(tempDir.resolve("migration.log"));
        store = new BackupStore(tempDir.resolve("backups"), journal);
        handle = DatabaseHandle.open(tempDir.resolve("data"), "database");
    }

    @AfterEach
    void tearDown() {
        handle.close();
    }

    private MigrationManager manager() {
        return manager(MigrationTimeoutConfig.DEFAULTS);
    }

    private MigrationManager manager(MigrationTimeoutConfig timeouts) {
        return new MigrationManager(store, new RollbackManager(store, journal), journal, timeouts);
    }

    private static void exec(Connection c, String sql) throws SQLException {
        try (Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }

    private static long count(Connection c, String table) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static int columnCount(Connection c, String table) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT * FROM " + table)) {
            return rs.getMetaData().getColumnCount();
        }
    }

    private List<String> journalMessages() throws IOException {
        return Files.readAllLines(journal.file()).stream()
                .map(line -> line.substring(line.indexOf("] ") + 2))
                .collect(Collectors.toList());
    }

    private static MigrationPlan tableA() {
        return MigrationPlan.builder()
                .step(1, "create t", c -> {
                    exec(c, "CREATE TABLE t (a INT)");
                    exec(c, "INSERT INTO t (a) VALUES (1)");
                })
                .build();
    }

    /** Brings the database to version 1 and reopens it so it counts as an existing install. */
    private void existingDatabaseAtVersionOne() throws Exception {
        manager().migrate(handle, tableA(), 1);
        handle.close();
        handle = DatabaseHandle.open(tempDir.resolve("data"), "database");
        assertThat(handle.existedBeforeOpen()).isTrue();
    }

    @Nested
    @DisplayName("fresh install")
    class FreshInstall {

        @Test
        @DisplayName("should migrate without taking a backup")
        void shouldMigrateWithoutBackup() throws Exception {
            MigrationResult result = manager().migrate(handle, tableA(), 1);

            assertThat(result.success()).isTrue();
            assertThat(result.backup()).isEmpty();
            assertThat(result.fromVersion()).isZero();
            assertThat(result.toVersion()).isEqualTo(1);
            assertThat(store.listBackups()).isEmpty();
            assertThat(journalMessages()).contains("Fresh database, skipping backup");
        }

        @Test
        @DisplayName("should record the reached version in the ledger")
        void shouldRecordVersion() throws Exception {
            MigrationManager manager = manager();
            manager.migrate(handle, tableA(), 1);

            assertThat(manager.getCurrentSchemaVersion(handle)).isEqualTo(1);
            assertThat(new SchemaVersionLedger().appliedVersions(handle.connection())).containsExactly(1);
        }
    }

    @Nested
    @DisplayName("ordering and idempotence")
    class Ordering {

        @Test
        @DisplayName("should run pending steps in ascending order")
        void shouldRunStepsInOrder() throws Exception {
            List<Integer> trace = new ArrayList<>();
            MigrationPlan plan = MigrationPlan.builder()
                    .step(3, "third", c -> trace.add(3))
                    .step(1, "first", c -> trace.add(1))
                    .step(2, "second", c -> trace.add(2))
                    .build();

            MigrationResult result = manager().migrate(handle, plan, 3);

            assertThat(trace).containsExactly(1, 2, 3);
            assertThat(result.appliedVersions()).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("should do nothing on a second run")
        void shouldBeIdempotent() throws Exception {
            List<Integer> trace = new ArrayList<>();
            MigrationPlan plan = MigrationPlan.builder()
                    .step(1, "first", c -> trace.add(1))
                    .step(2, "second", c -> trace.add(2))
                    .build();
            MigrationManager manager = manager();

            manager.migrate(handle, plan, 2);
            MigrationResult second = manager.migrate(handle, plan, 2);

            assertThat(trace).containsExactly(1, 2);
            assertThat(second.upToDate()).isTrue();
            assertThat(second.toVersion()).isEqualTo(2);
            assertThat(store.listBackups()).isEmpty();
            assertThat(journalMessages()).contains("Database is up to date");
        }

        @Test
        @DisplayName("should add one column per step and stay put on later runs")
        void shouldAddColumnsPerStep() throws Exception {
            exec(handle.connection(), "CREATE TABLE s (id INT)");
            MigrationPlan plan = MigrationPlan.builder()
                    .step(1, "add a", c -> exec(c, "ALTER TABLE s ADD COLUMN a INT"))
                    .step(2, "add b", c -> exec(c, "ALTER TABLE s ADD COLUMN b INT"))
                    .build();
            MigrationManager manager = manager();

            manager.migrate(handle, plan, 2);

            assertThat(columnCount(handle.connection(), "s")).isEqualTo(3);
            assertThat(manager.getCurrentSchemaVersion(handle)).isEqualTo(2);
            assertThat(manager.migrate(handle, plan, 2).upToDate()).isTrue();
            assertThat(manager.migrate(handle, plan, 1).upToDate()).isTrue();
            assertThat(manager.getCurrentSchemaVersion(handle)).isEqualTo(2);
        }

        @Test
        @DisplayName("should never migrate backward")
        void shouldNeverMigrateBackward() throws Exception {
            List<Integer> trace = new ArrayList<>();
            MigrationPlan plan = MigrationPlan.builder()
                    .step(1, "first", c -> trace.add(1))
                    .step(2, "second", c -> trace.add(2))
                    .step(3, "third", c -> trace.add(3))
                    .build();
            MigrationManager manager = manager();
            manager.migrate(handle, plan, 3);
            trace.clear();

            MigrationResult result = manager.migrate(handle, plan, 1);

            assertThat(result.success()).isTrue();
            assertThat(trace).isEmpty();
            assertThat(manager.getCurrentSchemaVersion(handle)).isEqualTo(3);
        }

        @Test
        @DisplayName("should skip versions without a step")
        void shouldSkipGaps() throws Exception {
            List<Integer> trace = new ArrayList<>();
            MigrationPlan plan = MigrationPlan.builder()
                    .step(1, "first", c -> trace.add(1))
                    .step(3, "third", c -> trace.add(3))
                    .build();
            MigrationManager manager = manager();

            MigrationResult result = manager.migrate(handle, plan, 3);

            assertThat(trace).containsExactly(1, 3);
            assertThat(result.appliedVersions()).containsExactly(1, 3);
            assertThat(manager.getCurrentSchemaVersion(handle)).isEqualTo(3);
            assertThat(new SchemaVersionLedger().appliedVersions(handle.connection())).containsExactly(1, 3);
            assertThat(journalMessages()).contains("No migration registered for version 2, skipping");
        }

        @Test
        @DisplayName("should reach a target beyond the last registered step")
        void shouldSkipTrailingVersions() throws Exception {
            MigrationPlan plan = MigrationPlan.builder()
                    .step(1, "first", c -> { })
                    .build();
            MigrationManager manager = manager();

            MigrationResult result = manager.migrate(handle, plan, 3);

            assertThat(result.appliedVersions()).containsExactly(1);
            assertThat(result.toVersion()).isEqualTo(1);
            assertThat(journalMessages()).contains(
                    "No migration registered for version 2, skipping",
                    "No migration registered for version 3, skipping");
        }

        @Test
        @DisplayName("should write the journal in cycle order")
        void shouldJournalTransitions() throws Exception {
            MigrationPlan plan = MigrationPlan.builder()
                    .step(1, "first", c -> { })
                    .step(2, "second", c -> { })
                    .build();

            manager().migrate(handle, plan, 2);

            assertThat(journalMessages()).containsSubsequence(
                    "Current schema version: 0, target version: 2",
                    "Fresh database, skipping backup",
                    "Running migration to version 1: first",
                    "Schema version updated to 1",
                    "Migration to version 1 completed successfully",
                    "Running migration to version 2: second",
                    "Schema version updated to 2",
                    "Migration to version 2 completed successfully",
                    "All migrations completed successfully");
        }
    }

    @Nested
    @DisplayName("existing database")
    class ExistingDatabase {

        @Test
        @DisplayName("should snapshot before applying pending steps")
        void shouldSnapshotBeforeMigrating() throws Exception {
            existingDatabaseAtVersionOne();
            MigrationPlan plan = MigrationPlan.builder()
                    .step(1, "create t", c -> { })
                    .step(2, "add b", c -> exec(c, "ALTER TABLE t ADD COLUMN b INT"))
                    .build();

            MigrationResult result = manager().migrate(handle, plan, 2);

            assertThat(result.backup()).isPresent();
            assertThat(result.backupPath()).isRegularFile();
            assertThat(Files.size(result.backupPath())).isPositive();
            assertThat(result.backupPath().getParent()).isEqualTo(store.directory());
            assertThat(handle.isOpen()).isTrue();
            assertThat(columnCount(handle.connection(), "t")).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        private MigrationPlan failingSecondStep() {
            return MigrationPlan.builder()
                    .step(1, "create t", c -> { })
                    .step(2, "add b then fail", c -> {
                        exec(c, "ALTER TABLE t ADD COLUMN b INT");
                        exec(c, "INSERT INTO t (a, b) VALUES (2, 2)");
                        throw new SQLException("boom");
                    })
                    .build();
        }

        @Test
        @DisplayName("should restore the snapshot byte for byte")
        void shouldRestoreSnapshot() throws Exception {
            existingDatabaseAtVersionOne();

            assertThatThrownBy(() -> manager().migrate(handle, failingSecondStep(), 2))
                    .isInstanceOf(MigrationStepException.class)
                    .hasMessageContaining("version 2")
                    .hasMessageContaining("boom");

            assertThat(handle.isOpen()).isFalse();
            List<BackupInfo> backups = store.listBackups();
            assertThat(backups).hasSize(1);
            assertThat(Files.readAllBytes(handle.databaseFile()))
                    .isEqualTo(Files.readAllBytes(backups.get(0).path()));
        }

        @Test
        @DisplayName("should leave version, columns and rows as before the cycle")
        void shouldUndoPartialStep() throws Exception {
            existingDatabaseAtVersionOne();

            assertThatThrownBy(() -> manager().migrate(handle, failingSecondStep(), 2))
                    .isInstanceOf(MigrationStepException.class);

            handle.reopen();
            assertThat(manager().getCurrentSchemaVersion(handle)).isEqualTo(1);
            assertThat(columnCount(handle.connection(), "t")).isEqualTo(1);
            assertThat(count(handle.connection(), "t")).isEqualTo(1);
        }

        @Test
        @DisplayName("should undo every step of the cycle, not only the failing one")
        void shouldUndoWholeCycle() throws Exception {
            existingDatabaseAtVersionOne();
            MigrationPlan plan = MigrationPlan.builder()
                    .step(2, "table u", c -> exec(c, "CREATE TABLE u (x INT)"))
                    .step(3, "fail", c -> {
                        throw new SQLException("step 3 broken");
                    })
                    .build();

            assertThatThrownBy(() -> manager().migrate(handle, plan, 3))
                    .isInstanceOf(MigrationStepException.class);

            handle.reopen();
            assertThat(manager().getCurrentSchemaVersion(handle)).isEqualTo(1);
            try (ResultSet rs = handle.connection().getMetaData().getTables(null, null, "U", null)) {
                assertThat(rs.next()).isFalse();
            }
        }

        @Test
        @DisplayName("should report failure in the result instead of throwing")
        void shouldReportFailureInResult() throws Exception {
            existingDatabaseAtVersionOne();

            MigrationResult result = manager().runMigrations(handle, failingSecondStep(), 2);

            assertThat(result.success()).isFalse();
            assertThat(result.error()).contains("version 2");
            assertThat(result.failure()).isInstanceOf(MigrationStepException.class);
            assertThat(result.fromVersion()).isEqualTo(1);
            assertThat(result.toVersion()).isEqualTo(1);
            assertThat(result.appliedVersions()).isEmpty();
            assertThat(result.backup()).isPresent();
            assertThat(journalMessages()).containsSubsequence(
                    "Running migration to version 2: add b then fail",
                    "Migration to version 2 failed: boom",
                    "Rolling back to backup: " + result.backupPath(),
                    "Database rolled back from: " + result.backupPath());
        }

        @Test
        @DisplayName("should leave the database at the last good version when there is no backup")
        void shouldStopWithoutBackupOnFreshInstall() throws Exception {
            MigrationPlan plan = MigrationPlan.builder()
                    .step(1, "ok", c -> exec(c, "CREATE TABLE t (a INT)"))
                    .step(2, "fail", c -> {
                        throw new SQLException("nope");
                    })
                    .build();

            MigrationResult result = manager().runMigrations(handle, plan, 2);

            assertThat(result.success()).isFalse();
            assertThat(result.toVersion()).isEqualTo(1);
            assertThat(handle.isOpen()).isTrue();
            assertThat(journalMessages()).contains("No backup to restore, database left at version 1");
        }

        @Test
        @DisplayName("should treat a step timeout as a failure and roll back")
        void shouldRollBackOnTimeout() throws Exception {
            existingDatabaseAtVersionOne();
            MigrationPlan plan = MigrationPlan.builder()
                    .step(2, "slow", c -> {
                        try {
                            Thread.sleep(1000);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    })
                    .build();
            MigrationTimeoutConfig timeouts = MigrationTimeoutConfig.builder()
                    .stepTimeout(Duration.ofMillis(100))
                    .build();

            assertThatThrownBy(() -> manager(timeouts).migrate(handle, plan, 2))
                    .isInstanceOf(MigrationStepException.class)
                    .hasCauseInstanceOf(MigrationTimeoutException.class);

            handle.reopen();
            assertThat(manager().getCurrentSchemaVersion(handle)).isEqualTo(1);
        }

        @Test
        @DisplayName("should attach the step failure when the restore itself fails")
        void shouldAttachStepFailureToRollbackException() throws Exception {
            existingDatabaseAtVersionOne();
            RollbackManager rollbackManager = mock(RollbackManager.class);
            RollbackException restoreFailure = new RollbackException("Rollback failed: disk full", new IOException("disk full"));
            doThrow(restoreFailure).when(rollbackManager).rollback(any(), any());
            MigrationManager manager = new MigrationManager(store, rollbackManager, journal, null);

            assertThatThrownBy(() -> manager.migrate(handle, failingSecondStep(), 2))
                    .isSameAs(restoreFailure)
                    .satisfies(e -> assertThat(e.getSuppressed())
                            .singleElement()
                            .isInstanceOf(MigrationStepException.class));
        }
    }

    @Nested
    @DisplayName("backup failure")
    class BackupFailure {

        @Test
        @DisplayName("should abort before any step and reopen the handle")
        void shouldAbortBeforeSteps() throws Exception {
            existingDatabaseAtVersionOne();
            BackupStore failingStore = mock(BackupStore.class);
            when(failingStore.createBackup(any())).thenThrow(new IOException("read-only file system"));
            MigrationManager manager = new MigrationManager(failingStore,
                    new RollbackManager(failingStore, journal), journal, MigrationTimeoutConfig.DEFAULTS);
            List<Integer> trace = new ArrayList<>();
            MigrationPlan plan = MigrationPlan.builder()
                    .step(2, "never", c -> trace.add(2))
                    .build();

            assertThatThrownBy(() -> manager.migrate(handle, plan, 2))
                    .isInstanceOf(BackupCreationException.class)
                    .hasMessageContaining("read-only file system");

            assertThat(trace).isEmpty();
            assertThat(handle.isOpen()).isTrue();
            assertThat(manager.getCurrentSchemaVersion(handle)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("backups")
    class Backups {

        @Test
        @DisplayName("should expose backup listing and retention")
        void shouldDelegateToBackupStore() throws Exception {
            existingDatabaseAtVersionOne();
            MigrationManager manager = manager();
            manager.migrate(handle, MigrationPlan.builder().step(2, "noop", c -> { }).build(), 2);

            assertThat(manager.getBackupInfo()).hasSize(1);
            assertThat(manager.cleanupOldBackups(0)).isEqualTo(1);
            assertThat(manager.getBackupInfo()).isEmpty();
        }
    }
}
