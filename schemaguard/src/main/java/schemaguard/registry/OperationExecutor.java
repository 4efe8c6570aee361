package schemaguard.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import schemaguard.db.DatabaseHandle;
import schemaguard.exceptions.DatabaseHandleException;
import schemaguard.exceptions.OperationException;
import schemaguard.exceptions.OperationExecutionException;
import schemaguard.exceptions.OperationValidationException;
import schemaguard.exceptions.UnknownOperationException;
import schemaguard.validation.CallArguments;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The only way collaborators read or write the database.
 *
 * <p>A call names an operation by domain and name and supplies its arguments as a map:
 * <ol>
 *   <li>the operation is looked up in the {@link OperationCatalog}</li>
 *   <li>its validator checks the arguments; on failure the database is not touched</li>
 *   <li>arguments are bound positionally to a prepared statement</li>
 *   <li>the outcome is shaped according to the operation's {@link ResultShape}</li>
 * </ol>
 *
 * <h2>Example:</h2>
 * <pre>
 * WriteResult created = executor.execute("equipment", "create", Map.of(
 *         "equipmentId", "CR-001", "type", "Overhead Crane", "manufacturer", "Acme"))
 *     .write();
 * </pre>
 *
 * <p>Callers serialize access; the executor shares the handle's single connection.
 */
public class OperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(OperationExecutor.class);

    private final DatabaseHandle handle;
    private final OperationCatalog catalog;

    public OperationExecutor(DatabaseHandle handle, OperationCatalog catalog) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public OperationCatalog catalog() {
        return catalog;
    }

    /**
     * Runs one catalog operation.
     *
     * @param domain the operation's domain, e.g. {@code equipment}
     * @param operation the operation's name, e.g. {@code getById}
     * @param args named arguments; null means none
     * @return the shaped result
     * @throws UnknownOperationException if the catalog has no such operation
     * @throws OperationValidationException if the arguments were rejected
     * @throws OperationExecutionException if the database reported an error
     */
    public OperationResult execute(String domain, String operation, Map<String, ?> args)
            throws OperationException {
        OperationSpec spec = catalog.find(domain, operation).orElse(null);
        if (spec == null) {
            log.warn("Unknown operation requested: {}.{}", domain, operation);
            throw new UnknownOperationException(domain, operation);
        }

        CallArguments call = CallArguments.of(args);
        if (!spec.validate(call)) {
            log.warn("Invalid parameters for operation {}: {}", spec.key(), call);
            throw new OperationValidationException(domain, operation, call.asMap());
        }

        try {
            OperationResult result = run(spec, spec.bind(call));
            log.debug("Executed {} -> {}", spec.key(), result.shape());
            return result;
        } catch (SQLException e) {
            log.error("Operation {} failed: {} (SQLState {})", spec.key(), e.getMessage(), e.getSQLState());
            throw new OperationExecutionException(domain, operation, e);
        } catch (DatabaseHandleException e) {
            log.error("Operation {} failed: {}", spec.key(), e.getMessage());
            // 08003: connection does not exist
            throw new OperationExecutionException(domain, operation, new SQLException(e.getMessage(), "08003", e));
        }
    }

    /**
     * Same as {@link #execute(String, String, Map)} with no arguments.
     */
    public OperationResult execute(String domain, String operation) throws OperationException {
        return execute(domain, operation, Map.of());
    }

    private OperationResult run(OperationSpec spec, List<Object> params) throws SQLException {
        Connection connection = handle.connection();
        if (spec.shape() == ResultShape.WRITE) {
            return runWrite(connection, spec, params);
        }
        try (PreparedStatement ps = connection.prepareStatement(spec.statement())) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                switch (spec.shape()) {
                    case MANY:
                        return OperationResult.many(readRows(rs));
                    case ONE:
                        return OperationResult.one(rs.next() ? readRow(rs) : null);
                    case SCALAR:
                        return OperationResult.scalar(rs.next() ? normalize(rs.getObject(1)) : null);
                    default:
                        throw new IllegalStateException("Unexpected shape " + spec.shape());
                }
            }
        }
    }

    private OperationResult runWrite(Connection connection, OperationSpec spec, List<Object> params)
            throws SQLException {
        boolean keys = spec.generatesKeys();
        try (PreparedStatement ps = keys
                ? connection.prepareStatement(spec.statement(), Statement.RETURN_GENERATED_KEYS)
                : connection.prepareStatement(spec.statement())) {
            bind(ps, params);
            int affected = ps.executeUpdate();
            Long insertedId = null;
            if (keys) {
                try (ResultSet generated = ps.getGeneratedKeys()) {
                    if (generated.next()) {
                        long id = generated.getLong(1);
                        insertedId = generated.wasNull() ? null : id;
                    }
                }
            }
            return OperationResult.write(new WriteResult(insertedId, affected));
        }
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            rows.add(readRow(rs));
        }
        return rows;
    }

    private static Map<String, Object> readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            row.put(md.getColumnLabel(i).toLowerCase(Locale.ROOT), normalize(rs.getObject(i)));
        }
        return row;
    }

    // java.sql date/time types become java.time; CLOBs become strings
    private static Object normalize(Object value) throws SQLException {
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            return clob.getSubString(1, (int) clob.length());
        }
        return value;
    }
}
