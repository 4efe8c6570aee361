package schemaguard.registry;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shaped result of one executor call.
 *
 * <p>Rows are maps keyed by the lower-case column label, in select order. Each accessor
 * matches one {@link ResultShape} and throws {@link IllegalStateException} for the others.
 */
public final class OperationResult {

    private final ResultShape shape;
    private final Object value;

    private OperationResult(ResultShape shape, Object value) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.value = value;
    }

    static OperationResult many(List<Map<String, Object>> rows) {
        return new OperationResult(ResultShape.MANY, List.copyOf(rows));
    }

    static OperationResult one(Map<String, Object> row) {
        return new OperationResult(ResultShape.ONE, row);
    }

    static OperationResult scalar(Object value) {
        return new OperationResult(ResultShape.SCALAR, value);
    }

    static OperationResult write(WriteResult result) {
        return new OperationResult(ResultShape.WRITE, Objects.requireNonNull(result));
    }

    public ResultShape shape() {
        return shape;
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> rows() {
        expect(ResultShape.MANY);
        return (List<Map<String, Object>>) value;
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> row() {
        expect(ResultShape.ONE);
        return Optional.ofNullable((Map<String, Object>) value);
    }

    public Optional<Object> scalar() {
        expect(ResultShape.SCALAR);
        return Optional.ofNullable(value);
    }

    /**
     * Scalar result as a long, for counts.
     *
     * @return the number, or 0 when there was no row
     */
    public long scalarAsLong() {
        return scalar().map(v -> ((Number) v).longValue()).orElse(0L);
    }

    public WriteResult write() {
        expect(ResultShape.WRITE);
        return (WriteResult) value;
    }

    private void expect(ResultShape wanted) {
        if (shape != wanted) {
            throw new IllegalStateException("Result shape is " + shape + ", not " + wanted);
        }
    }

    @Override
    public String toString() {
        return "OperationResult{" + shape + "=" + value + '}';
    }
}
