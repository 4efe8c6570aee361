package schemaguard.db;

import schemaguard.exceptions.LedgerException;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * The {@code schema_version} table: one row per applied version.
 *
 * <p>The current version is the largest stored value, or 0 when the table is empty
 * or missing. Rows are only ever added, so the version never decreases.
 */
public final class SchemaVersionLedger {

    public static final String TABLE = "schema_version";

    private static final String CREATE =
            "CREATE TABLE IF NOT EXISTS " + TABLE + " (version INT PRIMARY KEY)";
    private static final String CURRENT = "SELECT MAX(version) FROM " + TABLE;
    private static final String ALL = "SELECT version FROM " + TABLE + " ORDER BY version";
    private static final String RECORD = "MERGE INTO " + TABLE + " (version) KEY (version) VALUES (?)";

    /**
     * Creates the ledger table if it does not exist.
     */
    public void ensure(Connection connection) throws LedgerException {
        try (Statement st = connection.createStatement()) {
            st.execute(CREATE);
        } catch (SQLException e) {
            throw new LedgerException("Failed to create schema version table: " + e.getMessage(), e);
        }
    }

    /**
     * @return the current schema version, 0 if the ledger is empty or absent
     */
    public int currentVersion(Connection connection) throws LedgerException {
        try {
            if (!exists(connection)) {
                return 0;
            }
            try (Statement st = connection.createStatement();
                 ResultSet rs = st.executeQuery(CURRENT)) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new LedgerException("Failed to read schema version: " + e.getMessage(), e);
        }
    }

    /**
     * @return every recorded version, ascending
     */
    public List<Integer> appliedVersions(Connection connection) throws LedgerException {
        List<Integer> versions = new ArrayList<>();
        try {
            if (!exists(connection)) {
                return versions;
            }
            try (Statement st = connection.createStatement();
                 ResultSet rs = st.executeQuery(ALL)) {
                while (rs.next()) {
                    versions.add(rs.getInt(1));
                }
            }
        } catch (SQLException e) {
            throw new LedgerException("Failed to read schema versions: " + e.getMessage(), e);
        }
        return versions;
    }

    /**
     * Records a version. Recording the same version twice is a no-op.
     */
    public void record(Connection connection, int version) throws LedgerException {
        try (PreparedStatement ps = connection.prepareStatement(RECORD)) {
            ps.setInt(1, version);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerException("Failed to record schema version " + version + ": " + e.getMessage(), e);
        }
    }

    private static boolean exists(Connection connection) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        // H2 stores unquoted identifiers upper-case
        try (ResultSet rs = meta.getTables(null, null, TABLE.toUpperCase(), null)) {
            return rs.next();
        }
    }
}
