package schemaguard.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import schemaguard.exceptions.MigrationTimeoutException;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeoutExecutor")
class TimeoutExecutorTest {

    @Nested
    @DisplayName("call")
    class Call {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResultWithinTimeout() throws Exception {
            String result = TimeoutExecutor.call("test", Duration.ofSeconds(5), () -> "success");

            assertThat(result).isEqualTo("success");
        }

        @Test
        @DisplayName("should throw MigrationTimeoutException when operation exceeds timeout")
        void shouldThrowWhenTimeoutExceeded() {
            assertThatThrownBy(() -> TimeoutExecutor.call("migration#4", Duration.ofMillis(50), () -> {
                Thread.sleep(2000);
                return "never";
            }))
                    .isInstanceOf(MigrationTimeoutException.class)
                    .hasMessageContaining("migration#4")
                    .hasMessageContaining("50 ms");
        }

        @Test
        @DisplayName("should leave the abandoned worker running after a timeout")
        void shouldNotInterruptWorker() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch finished = new CountDownLatch(1);

            assertThatThrownBy(() -> TimeoutExecutor.call("migration#2", Duration.ofMillis(50), () -> {
                release.await();
                finished.countDown();
                return null;
            })).isInstanceOf(MigrationTimeoutException.class);

            release.countDown();
            assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("should run on the calling thread when timeout is disabled")
        void shouldRunInlineWhenDisabled() throws Exception {
            AtomicReference<Thread> worker = new AtomicReference<>();

            TimeoutExecutor.call("test", MigrationTimeoutConfig.NO_TIMEOUT, () -> {
                worker.set(Thread.currentThread());
                return null;
            });

            assertThat(worker.get()).isSameAs(Thread.currentThread());
        }

        @Test
        @DisplayName("should run on a daemon worker when timeout is enabled")
        void shouldRunOnDaemonWorker() throws Exception {
            AtomicReference<Thread> worker = new AtomicReference<>();

            TimeoutExecutor.call("test", Duration.ofSeconds(5), () -> {
                worker.set(Thread.currentThread());
                return null;
            });

            assertThat(worker.get()).isNotSameAs(Thread.currentThread());
            assertThat(worker.get().isDaemon()).isTrue();
            assertThat(worker.get().getName()).isEqualTo("schemaguard-timeout-executor");
        }

        @Test
        @DisplayName("should propagate checked exceptions unwrapped")
        void shouldPropagateCheckedExceptions() {
            assertThatThrownBy(() -> TimeoutExecutor.call("test", Duration.ofSeconds(5), () -> {
                throw new SQLException("syntax error", "42000");
            }))
                    .isInstanceOf(SQLException.class)
                    .hasMessage("syntax error");
        }

        @Test
        @DisplayName("should propagate runtime exceptions unwrapped")
        void shouldPropagateRuntimeExceptions() {
            assertThatThrownBy(() -> TimeoutExecutor.call("test", Duration.ofSeconds(5), () -> {
                throw new IllegalStateException("bad state");
            }))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("bad state");
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("should execute the action")
        void shouldExecuteAction() throws Exception {
            AtomicBoolean ran = new AtomicBoolean();

            TimeoutExecutor.run("test", Duration.ofSeconds(5), () -> ran.set(true));

            assertThat(ran).isTrue();
        }

        @Test
        @DisplayName("should propagate exceptions from the action")
        void shouldPropagateFromAction() {
            assertThatThrownBy(() -> TimeoutExecutor.run("backup", null, () -> {
                throw new IOException("disk full");
            }))
                    .isInstanceOf(IOException.class)
                    .hasMessage("disk full");
        }
    }
}
