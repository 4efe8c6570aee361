package schemaguard.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one migration cycle.
 *
 * @param success whether the database is at the target version
 * @param backupPath the snapshot taken for this cycle, or null if none was taken
 * @param error message of the failure, or null on success
 * @param fromVersion ledger version when the cycle started
 * @param toVersion ledger version when the cycle ended (the start version after a rollback)
 * @param appliedVersions versions whose step ran and was recorded, ascending
 * @param failure the exception that stopped the cycle, or null on success
 */
public record MigrationResult(
        boolean success,
        Path backupPath,
        String error,
        int fromVersion,
        int toVersion,
        List<Integer> appliedVersions,
        Exception failure
) {

    public MigrationResult {
        appliedVersions = appliedVersions == null ? List.of() : List.copyOf(appliedVersions);
    }

    static MigrationResult succeeded(Path backupPath, int from, int to, List<Integer> applied) {
        return new MigrationResult(true, backupPath, null, from, to, applied, null);
    }

    static MigrationResult failed(Path backupPath, int from, int to, List<Integer> applied, Exception failure) {
        return new MigrationResult(false, backupPath, failure.getMessage(), from, to, applied, failure);
    }

    public Optional<Path> backup() {
        return Optional.ofNullable(backupPath);
    }

    /**
     * @return true if the cycle found the database already current
     */
    public boolean upToDate() {
        return success && appliedVersions.isEmpty() && backupPath == null;
    }
}
