package com.ctdl.scout.service.download;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Try-with-resources wrapper around an {@link ExecutorService}: closing it waits for every
 * submitted task, so the end of the block is a join-all barrier.
 *
 * <pre>
 * try (AutoCloseableExecutor pool = new AutoCloseableExecutor(Executors.newFixedThreadPool(4), Duration.ofHours(1))) {
 *     pool.executor().submit(() -> { ... });
 * }
 * </pre>
 */
@Slf4j
public record AutoCloseableExecutor(ExecutorService executor, Duration shutdownTimeout) implements AutoCloseable {

    /**
     * Stops accepting work and waits up to {@code shutdownTimeout} for running tasks.
     * On timeout or interruption the remaining tasks are cancelled.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("⚠️ Download pool did not finish within {}, forced shutdown.", shutdownTimeout);
            } else {
                log.debug("✅ Download pool shut down cleanly.");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            log.error("❌ Download pool shutdown interrupted: {}", e.getMessage(), e);
        }
    }
}
