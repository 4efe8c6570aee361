package schemaguard.exceptions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class ConstraintKindTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "23505, UNIQUE",
            "23503, FOREIGN_KEY",
            "23506, FOREIGN_KEY",
            "23502, NOT_NULL",
            "23513, CHECK",
            "23514, CHECK",
            "42S02, SYNTAX",
            "42000, SYNTAX",
            "08003, CONNECTION",
            "HY000, OTHER",
            "22007, OTHER"
    })
    void classifiesBySqlState(String state, ConstraintKind expected) {
        assertThat(ConstraintKind.of(new SQLException("boom", state))).isEqualTo(expected);
    }

    @Test
    void missingStateIsOther() {
        assertThat(ConstraintKind.of(new SQLException("boom"))).isEqualTo(ConstraintKind.OTHER);
        assertThat(ConstraintKind.of(null)).isEqualTo(ConstraintKind.OTHER);
    }

    @Test
    void onlyIntegrityKindsAreConstraints() {
        assertThat(ConstraintKind.UNIQUE.isConstraint()).isTrue();
        assertThat(ConstraintKind.CHECK.isConstraint()).isTrue();
        assertThat(ConstraintKind.SYNTAX.isConstraint()).isFalse();
        assertThat(ConstraintKind.CONNECTION.isConstraint()).isFalse();
    }

    @Test
    void executionExceptionCarriesKind() {
        OperationExecutionException e = new OperationExecutionException(
                "equipment", "create", new SQLException("duplicate", "23505"));

        assertThat(e.getKind()).isEqualTo(ConstraintKind.UNIQUE);
        assertThat(e.isConstraintViolation()).isTrue();
        assertThat(e.getOperationKey()).isEqualTo("equipment.create");
        assertThat(e.getCause().getSQLState()).isEqualTo("23505");
    }
}
