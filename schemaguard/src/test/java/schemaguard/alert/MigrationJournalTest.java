package schemaguard.alert;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MigrationJournal")
class MigrationJournalTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-14T09:26:53.589Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should prefix each line with an ISO-8601 instant")
    void shouldWriteTimestampedLines() throws Exception {
        MigrationJournal journal = new MigrationJournal(tempDir.resolve("migration.log"), CLOCK);

        journal.log("Starting migration from version 0 to 5");

        assertThat(Files.readAllLines(journal.file()))
                .containsExactly("[2025-03-14T09:26:53.589Z] Starting migration from version 0 to 5");
    }

    @Test
    @DisplayName("should append to an existing journal")
    void shouldAppend() throws Exception {
        Path file = tempDir.resolve("migration.log");
        Files.writeString(file, "[2025-01-01T00:00:00Z] earlier run" + System.lineSeparator());
        MigrationJournal journal = new MigrationJournal(file, CLOCK);

        journal.log("first");
        journal.log("second");

        assertThat(Files.readAllLines(file)).hasSize(3)
                .endsWith("[2025-03-14T09:26:53.589Z] first", "[2025-03-14T09:26:53.589Z] second");
    }

    @Test
    @DisplayName("should create missing parent directories")
    void shouldCreateParents() {
        MigrationJournal journal = new MigrationJournal(tempDir.resolve("logs/nested/migration.log"), CLOCK);

        journal.log("hello");

        assertThat(journal.file()).exists();
    }

    @Test
    @DisplayName("should not throw when the journal cannot be written")
    void shouldSurviveWriteFailure() throws Exception {
        Path directory = Files.createDirectory(tempDir.resolve("occupied"));
        MigrationJournal journal = new MigrationJournal(directory, CLOCK);

        journal.log("lost");

        assertThat(directory).isDirectory();
    }
}
