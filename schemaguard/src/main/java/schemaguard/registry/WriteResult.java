package schemaguard.registry;

import java.util.Optional;

/**
 * Outcome of a {@link ResultShape#WRITE} operation.
 *
 * @param insertedId the generated key of the inserted row, or null when the statement generated none
 * @param rowsAffected the update count
 */
public record WriteResult(Long insertedId, int rowsAffected) {

    public Optional<Long> generatedId() {
        return Optional.ofNullable(insertedId);
    }
}
