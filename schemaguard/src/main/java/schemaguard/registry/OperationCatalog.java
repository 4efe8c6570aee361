package schemaguard.registry;

import schemaguard.registry.catalog.StandardOperations;
import schemaguard.validation.PathSafetyPolicy;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable lookup of operations by {@code (domain, name)}.
 *
 * <p>Built once at startup and read without synchronization.
 */
public final class OperationCatalog {

    private final Map<String, OperationSpec> byKey;

    private OperationCatalog(Map<String, OperationSpec> byKey) {
        this.byKey = Map.copyOf(byKey);
    }

    /**
     * @param specs the operations
     * @return a catalog of exactly these operations
     * @throws IllegalArgumentException if two specs share a key
     */
    public static OperationCatalog of(Collection<OperationSpec> specs) {
        Map<String, OperationSpec> byKey = new HashMap<>();
        for (OperationSpec spec : specs) {
            if (byKey.putIfAbsent(spec.key(), spec) != null) {
                throw new IllegalArgumentException("Duplicate operation: " + spec.key());
            }
        }
        return new OperationCatalog(byKey);
    }

    /**
     * The application's operations.
     *
     * @param paths policy for operations that store file paths
     * @return the standard catalog
     */
    public static OperationCatalog standard(PathSafetyPolicy paths) {
        return of(StandardOperations.all(paths));
    }

    public Optional<OperationSpec> find(String domain, String name) {
        if (domain == null || name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(OperationSpec.key(domain, name)));
    }

    /**
     * @return every operation, sorted by key
     */
    public List<OperationSpec> all() {
        return byKey.values().stream()
                .sorted(Comparator.comparing(OperationSpec::key))
                .collect(Collectors.toUnmodifiableList());
    }

    public Set<String> domains() {
        return byKey.values().stream()
                .map(OperationSpec::domain)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public int size() {
        return byKey.size();
    }
}
