package schemaguard.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Durable, append-only record of migration state transitions.
 *
 * <p>Each call to {@link #log(String)} appends one line
 * {@code [<ISO-8601 instant>] <message>} to the journal file and mirrors the
 * message to the console through SLF4J. The journal is never truncated here.
 *
 * <p>A failure to append is reported through SLF4J and otherwise ignored: losing a
 * journal line must not abort a migration.
 */
public class MigrationJournal {

    private static final Logger log = LoggerFactory.getLogger(MigrationJournal.class);

    private final Path file;
    private final Clock clock;

    public MigrationJournal(Path file) {
        this(file, Clock.systemUTC());
    }

    public MigrationJournal(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path file() {
        return file;
    }

    /**
     * Append a message to the journal.
     *
     * @param message the message, written as-is after the timestamp
     */
    public void log(String message) {
        log.info(message);
        String line = "[" + Instant.now(clock) + "] " + message + System.lineSeparator();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.error("Failed to write to migration log {}", file, e);
        }
    }
}
