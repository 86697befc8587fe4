package de.mirkosertic.vectorizer.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool for plan items. The pool size is the configured concurrency,
 * which caps the number of simultaneous embedding provider and store calls.
 */
public class SyncExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(SyncExecutorService.class);

    private static final int QUEUE_CAPACITY = 10_000;

    private final ThreadPoolExecutor executor;

    public SyncExecutorService(final int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive, was " + concurrency);
        }
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "sync-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };

        // Full queue: the dispatching thread runs the item itself, which throttles dispatch
        this.executor = new ThreadPoolExecutor(
                concurrency,
                concurrency,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(QUEUE_CAPACITY),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("SyncExecutorService initialized with {} threads", concurrency);
    }

    public Future<?> submit(final Runnable task) {
        return executor.submit(task);
    }

    /**
     * Shutdown the executor service. Running items are given time to finish.
     */
    public void shutdown() {
        logger.info("Shutting down SyncExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("SyncExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for SyncExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
