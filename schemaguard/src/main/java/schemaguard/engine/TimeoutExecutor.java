package schemaguard.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import schemaguard.exceptions.MigrationTimeoutException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a migration step or a backup copy with an optional time limit.
 *
 * <p>When the limit is exceeded the caller gets a {@link MigrationTimeoutException}.
 * The worker thread is not interrupted ({@code CompletableFuture.cancel} only marks the
 * future), so the abandoned work keeps running. For a migration step it ends when rollback
 * closes the H2 connection, which cancels the running statement and fails any later one.
 *
 * @see MigrationTimeoutConfig
 */
public final class TimeoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutExecutor.class);

    // daemon threads so an abandoned step never blocks JVM shutdown
    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "schemaguard-timeout-executor");
        t.setDaemon(true);
        return t;
    });

    private TimeoutExecutor() {
    }

    /**
     * Executes a callable with a timeout.
     *
     * <p>If the timeout is disabled ({@link MigrationTimeoutConfig#NO_TIMEOUT} or null)
     * the callable runs directly on the calling thread.
     *
     * @param operation the name of the operation (for error messages)
     * @param timeout the timeout duration, or null/zero to disable
     * @param callable the operation to execute
     * @param <T> the return type
     * @return the result of the callable
     * @throws MigrationTimeoutException if the operation times out
     * @throws Exception whatever the callable throws
     */
    public static <T> T call(String operation, Duration timeout, Callable<T> callable) throws Exception {
        if (!MigrationTimeoutConfig.isEnabled(timeout)) {
            return callable.call();
        }

        log.debug("Executing '{}' with timeout of {} ms", operation, timeout.toMillis());

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return callable.call();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, EXECUTOR);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Operation '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new MigrationTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new MigrationTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof Exception) {
                throw (Exception) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            } else {
                throw new RuntimeException("Operation '" + operation + "' failed", cause);
            }
        }
    }

    /**
     * Void variant of {@link #call(String, Duration, Callable)}.
     *
     * @param operation the name of the operation (for error messages)
     * @param timeout the timeout duration, or null/zero to disable
     * @param action the operation to execute
     * @throws MigrationTimeoutException if the operation times out
     * @throws Exception whatever the action throws
     */
    public static void run(String operation, Duration timeout, CheckedRunnable action) throws Exception {
        call(operation, timeout, () -> {
            action.run();
            return null;
        });
    }

    /**
     * A runnable that can throw checked exceptions.
     */
    @FunctionalInterface
    public interface CheckedRunnable {
        void run() throws Exception;
    }
}
