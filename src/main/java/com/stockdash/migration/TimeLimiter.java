package com.stockdash.migration;

import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs migration procedures on a single worker thread and bounds how long the caller waits.
 * <p>
 * On timeout the worker is interrupted and the supplied canceller is invoked (statement cancel).
 * A procedure that ignores both keeps the worker busy, and later calls queue behind it.
 */
final class TimeLimiter implements AutoCloseable {
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "migration-worker-" + THREAD_SEQ.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    void run(MigrationStep step, StatementAdapter statements, Duration timeout, String timeoutLabel) throws Exception {
        Map<String, String> logContext = ThreadContext.getImmutableContext();
        Future<?> future = executor.submit(() -> {
            ThreadContext.putAll(logContext);
            try {
                step.apply(statements);
                return null;
            } finally {
                ThreadContext.clearMap();
            }
        });
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            statements.cancelRunning();
            future.cancel(true);
            throw new MigrationTimeoutException(timeoutLabel + " timeout after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            statements.cancelRunning();
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
