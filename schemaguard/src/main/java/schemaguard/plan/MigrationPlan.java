package schemaguard.plan;

import schemaguard.SchemaMigration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, version-ordered set of migration steps.
 *
 * <p>Versions need not be contiguous. A version with no step is skipped by the
 * migration manager and the ledger simply jumps over it; {@link #pending} only
 * returns the versions that have a step.
 *
 * <p>Plans are built with {@link #builder()}, which rejects:
 * <ul>
 *   <li>non-positive versions</li>
 *   <li>two steps registered under the same version</li>
 * </ul>
 *
 * @see MigrationStep
 * @see schemaguard.engine.MigrationManager
 */
public final class MigrationPlan {

    private final SortedMap<Integer, MigrationStep> steps;

    private MigrationPlan(SortedMap<Integer, MigrationStep> steps) {
        this.steps = Collections.unmodifiableSortedMap(steps);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return an empty plan
     */
    public static MigrationPlan empty() {
        return new MigrationPlan(new TreeMap<>());
    }

    /**
     * Steps with {@code fromExclusive < version <= toInclusive}, ascending.
     *
     * @param fromExclusive the current version
     * @param toInclusive the target version
     * @return the pending steps, possibly empty
     */
    public List<MigrationStep> pending(int fromExclusive, int toInclusive) {
        if (toInclusive <= fromExclusive) {
            return List.of();
        }
        return List.copyOf(new ArrayList<>(steps.subMap(fromExclusive + 1, toInclusive + 1).values()));
    }

    /**
     * @return the highest registered version, or 0 for an empty plan
     */
    public int latestVersion() {
        return steps.isEmpty() ? 0 : steps.lastKey();
    }

    /**
     * @return all steps, ascending by version
     */
    public List<MigrationStep> steps() {
        return List.copyOf(steps.values());
    }

    public int size() {
        return steps.size();
    }

    @Override
    public String toString() {
        return "MigrationPlan{versions=" + steps.keySet() + '}';
    }

    /**
     * Builder for {@link MigrationPlan}.
     */
    public static final class Builder {
        private final SortedMap<Integer, MigrationStep> steps = new TreeMap<>();

        private Builder() {}

        public Builder step(int version, String description, SchemaMigration migration) {
            return step(new MigrationStep(version, description, migration));
        }

        public Builder step(MigrationStep step) {
            Objects.requireNonNull(step, "step");
            if (steps.containsKey(step.version())) {
                throw new IllegalArgumentException("Duplicate migration for version " + step.version());
            }
            steps.put(step.version(), step);
            return this;
        }

        public MigrationPlan build() {
            return new MigrationPlan(new TreeMap<>(steps));
        }
    }
}
