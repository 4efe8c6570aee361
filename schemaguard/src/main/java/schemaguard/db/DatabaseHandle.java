package schemaguard.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import schemaguard.exceptions.DatabaseHandleException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Owner of the single long-lived connection to the embedded H2 database file.
 *
 * <p>The host process keeps one handle for its whole lifetime; the migration manager
 * and the operation executor both work through it. The handle can be closed and
 * reopened so that the database file can be copied (snapshot) or overwritten
 * (restore) while H2 holds no open store on it.
 *
 * <p>No locking is done here. The database is assumed to have a single writer.
 */
public class DatabaseHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatabaseHandle.class);

    /** File suffix H2 uses for the MVStore file. */
    public static final String FILE_SUFFIX = ".mv.db";

    private final Path directory;
    private final String name;
    private final boolean existedBeforeOpen;
    private Connection connection;

    private DatabaseHandle(Path directory, String name) {
        this.directory = directory.toAbsolutePath().normalize();
        this.name = name;
        this.existedBeforeOpen = Files.exists(databaseFile());
    }

    /**
     * Opens (or creates) the database {@code <directory>/<name>.mv.db}.
     *
     * @param directory the directory holding the database file; created if missing
     * @param name the database name
     * @return an open handle
     * @throws DatabaseHandleException if the directory or database cannot be opened
     */
    public static DatabaseHandle open(Path directory, String name) {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(name, "name");
        try {
            Files.createDirectories(directory);
        } catch (Exception e) {
            throw new DatabaseHandleException("Cannot create database directory " + directory, e);
        }
        DatabaseHandle handle = new DatabaseHandle(directory, name);
        handle.reopen();
        return handle;
    }

    /**
     * @return the live database file
     */
    public Path databaseFile() {
        return directory.resolve(name + FILE_SUFFIX);
    }

    public String jdbcUrl() {
        return "jdbc:h2:file:" + directory.resolve(name);
    }

    /**
     * @return true if the database file was already present before this handle first opened it
     */
    public boolean existedBeforeOpen() {
        return existedBeforeOpen;
    }

    public synchronized boolean isOpen() {
        try {
            return connection != null && !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    /**
     * Returns the live connection.
     *
     * @return the open connection
     * @throws DatabaseHandleException if the handle is closed
     */
    public synchronized Connection connection() {
        if (!isOpen()) {
            throw new DatabaseHandleException("Database handle is closed: " + databaseFile());
        }
        return connection;
    }

    /**
     * Opens the connection if it is not open. No-op when already open.
     *
     * @throws DatabaseHandleException if H2 refuses the file (locked, corrupt, wrong credentials)
     */
    public synchronized void reopen() {
        if (isOpen()) {
            return;
        }
        try {
            connection = DriverManager.getConnection(jdbcUrl(), "sa", "");
            connection.setAutoCommit(true);
            log.debug("Opened database {}", databaseFile());
        } catch (SQLException e) {
            String causeMsg = e.getMessage() != null ? e.getMessage() : "";
            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                throw new DatabaseHandleException(
                        "Cannot open database " + databaseFile() + ": file already in use by another process", e);
            }
            throw new DatabaseHandleException("Failed to open database " + databaseFile() + ": " + causeMsg, e);
        }
    }

    /**
     * Closes the connection. H2 closes the store with the last connection, so after this
     * returns the database file is complete on disk and may be copied or overwritten.
     */
    @Override
    public synchronized void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
            log.debug("Closed database {}", databaseFile());
        } catch (SQLException e) {
            throw new DatabaseHandleException("Failed to close database " + databaseFile(), e);
        } finally {
            connection = null;
        }
    }

    @Override
    public String toString() {
        return "DatabaseHandle{" + databaseFile() + (isOpen() ? ", open" : ", closed") + '}';
    }
}
