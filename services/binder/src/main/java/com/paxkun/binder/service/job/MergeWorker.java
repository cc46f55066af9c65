package com.paxkun.binder.service.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * The dedicated merge thread, closeable so shutdown can wait for the running job.
 *
 * <pre>
 * try (MergeWorker worker = MergeWorker.singleThread()) {
 *     worker.executor().submit(() -> { ... });
 * }
 * </pre>
 */
public record MergeWorker(ExecutorService executor, long shutdownSeconds) implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MergeWorker.class);

    public static MergeWorker singleThread() {
        return new MergeWorker(Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "binder-worker");
            thread.setDaemon(true);
            return thread;
        }), 30);
    }

    /**
     * Stops accepting jobs and waits for the running one. A job still running
     * after {@code shutdownSeconds} is interrupted.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownSeconds, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("⚠️ Merge worker did not terminate in time, forced shutdown.");
            } else {
                log.info("✅ Merge worker shut down cleanly.");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            log.error("❌ Merge worker shutdown interrupted: {}", e.getMessage(), e);
        }
    }
}
