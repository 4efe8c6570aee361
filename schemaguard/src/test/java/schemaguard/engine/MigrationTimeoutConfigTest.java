package schemaguard.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import schemaguard.config.MigrationConfig;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MigrationTimeoutConfig")
class MigrationTimeoutConfigTest {

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        @DisplayName("should disable both timeouts by default")
        void shouldDisableTimeoutsByDefault() {
            MigrationTimeoutConfig config = MigrationTimeoutConfig.builder().build();

            assertThat(config.stepTimeout()).isEqualTo(MigrationTimeoutConfig.NO_TIMEOUT);
            assertThat(config.backupTimeout()).isEqualTo(MigrationTimeoutConfig.NO_TIMEOUT);
        }

        @Test
        @DisplayName("should set step timeout in seconds")
        void shouldSetStepTimeoutInSeconds() {
            MigrationTimeoutConfig config = MigrationTimeoutConfig.builder()
                    .stepTimeoutSeconds(45)
                    .build();

            assertThat(config.stepTimeout()).isEqualTo(Duration.ofSeconds(45));
        }

        @Test
        @DisplayName("should set backup timeout")
        void shouldSetBackupTimeout() {
            MigrationTimeoutConfig config = MigrationTimeoutConfig.builder()
                    .backupTimeout(Duration.ofMinutes(2))
                    .build();

            assertThat(config.backupTimeout()).isEqualTo(Duration.ofMinutes(2));
        }

        @Test
        @DisplayName("should treat zero or negative seconds as disabled")
        void shouldDisableForNonPositiveSeconds() {
            MigrationTimeoutConfig config = MigrationTimeoutConfig.builder()
                    .stepTimeoutSeconds(0)
                    .backupTimeoutSeconds(-5)
                    .build();

            assertThat(config.stepTimeout()).isEqualTo(MigrationTimeoutConfig.NO_TIMEOUT);
            assertThat(config.backupTimeout()).isEqualTo(MigrationTimeoutConfig.NO_TIMEOUT);
        }

        @Test
        @DisplayName("should reject null timeout")
        void shouldRejectNullTimeout() {
            assertThatThrownBy(() -> MigrationTimeoutConfig.builder().stepTimeout(null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("from")
    class From {

        @Test
        @DisplayName("should take timeouts from the loaded configuration")
        void shouldTakeTimeoutsFromConfig() {
            MigrationConfig config = MigrationConfig.builder()
                    .stepTimeoutSeconds(30)
                    .backupTimeoutSeconds(10)
                    .build();

            MigrationTimeoutConfig timeouts = MigrationTimeoutConfig.from(config);

            assertThat(timeouts.stepTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(timeouts.backupTimeout()).isEqualTo(Duration.ofSeconds(10));
        }

        @Test
        @DisplayName("should fall back to disabled for a null timeout")
        void shouldFallBackForNull() {
            MigrationConfig config = MigrationConfig.builder()
                    .stepTimeout(null)
                    .build();

            assertThat(MigrationTimeoutConfig.from(config).stepTimeout())
                    .isEqualTo(MigrationTimeoutConfig.NO_TIMEOUT);
        }
    }

    @Nested
    @DisplayName("isEnabled")
    class IsEnabled {

        @Test
        @DisplayName("should be false for null, zero and negative durations")
        void shouldBeFalseForDisabledValues() {
            assertThat(MigrationTimeoutConfig.isEnabled(null)).isFalse();
            assertThat(MigrationTimeoutConfig.isEnabled(Duration.ZERO)).isFalse();
            assertThat(MigrationTimeoutConfig.isEnabled(Duration.ofSeconds(-1))).isFalse();
        }

        @Test
        @DisplayName("should be true for a positive duration")
        void shouldBeTrueForPositive() {
            assertThat(MigrationTimeoutConfig.isEnabled(Duration.ofMillis(1))).isTrue();
        }
    }

    @Test
    @DisplayName("should describe disabled timeouts in toString")
    void shouldDescribeDisabledTimeouts() {
        assertThat(MigrationTimeoutConfig.DEFAULTS.toString())
                .isEqualTo("MigrationTimeoutConfig{step=disabled, backup=disabled}");
    }
}
