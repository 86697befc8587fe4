package de.mirkosertic.vectorizer.sync;

import de.mirkosertic.vectorizer.reconcile.SyncAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregates per-item outcomes into a {@link RunResult}.
 * Thread-safe for use from multiple worker threads.
 */
public class RunResultCollector {

    private static final Logger logger = LoggerFactory.getLogger(RunResultCollector.class);

    private final long progressIntervalMs;

    private final Map<SyncAction, AtomicLong> succeeded = new EnumMap<>(SyncAction.class);
    private final Map<SyncAction, AtomicLong> failed = new EnumMap<>(SyncAction.class);
    private final AtomicLong skipped = new AtomicLong(0);
    private final AtomicLong plannedItems = new AtomicLong(0);

    private final ConcurrentLinkedQueue<ItemFailure> failures = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<ItemFailure> truncations = new ConcurrentLinkedQueue<>();

    // Applied mutations, kept so that a failed final commit can be attributed to them
    private final ConcurrentLinkedQueue<AppliedMutation> appliedMutations = new ConcurrentLinkedQueue<>();

    // In-flight item tracking (path or identity -> start timestamp in millis)
    private final ConcurrentHashMap<String, Long> activeItems = new ConcurrentHashMap<>();

    private final ScheduledExecutorService progressTimerExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "progress-timer");
                t.setDaemon(true);
                return t;
            });
    private volatile ScheduledFuture<?> progressTimerFuture;

    private volatile long startTime = 0;

    public RunResultCollector(final long progressIntervalMs) {
        this.progressIntervalMs = progressIntervalMs;
        for (final SyncAction action : SyncAction.values()) {
            succeeded.put(action, new AtomicLong(0));
            failed.put(action, new AtomicLong(0));
        }
    }

    /**
     * Reset all counters and start periodic progress logging.
     *
     * @param itemCount number of plan entries that will be executed
     */
    public void start(final long itemCount) {
        for (final SyncAction action : SyncAction.values()) {
            succeeded.get(action).set(0);
            failed.get(action).set(0);
        }
        skipped.set(0);
        plannedItems.set(itemCount);
        failures.clear();
        truncations.clear();
        appliedMutations.clear();
        activeItems.clear();
        startTime = System.currentTimeMillis();

        if (progressIntervalMs > 0) {
            progressTimerFuture = progressTimerExecutor.scheduleAtFixedRate(
                    this::logProgress, progressIntervalMs, progressIntervalMs, TimeUnit.MILLISECONDS);
        }
    }

    public void recordSuccess(final SyncAction action, final String identity, final String path) {
        succeeded.get(action).incrementAndGet();
        if (action != SyncAction.SKIP) {
            appliedMutations.add(new AppliedMutation(identity, path, action));
        }
    }

    public void recordSkipped() {
        skipped.incrementAndGet();
    }

    public void recordFailure(final ItemFailure failure) {
        if (failure.action() != null) {
            failed.get(failure.action()).incrementAndGet();
        }
        failures.add(failure);
    }

    public void recordTruncation(final ItemFailure truncation) {
        truncations.add(truncation);
    }

    /**
     * Turn every applied mutation into a STORE failure. Used when the final commit fails,
     * because none of the changes became durable.
     */
    public void failAppliedMutations(final String message) {
        AppliedMutation mutation;
        while ((mutation = appliedMutations.poll()) != null) {
            succeeded.get(mutation.action()).decrementAndGet();
            recordFailure(new ItemFailure(mutation.identity(), mutation.path(), mutation.action(),
                    FailureReason.STORE, message));
        }
    }

    public boolean hasAppliedMutations() {
        return !appliedMutations.isEmpty();
    }

    public void registerActiveItem(final String key) {
        activeItems.put(key, System.currentTimeMillis());
    }

    public void unregisterActiveItem(final String key) {
        activeItems.remove(key);
    }

    /**
     * Stop progress logging and freeze the counters into a result.
     */
    public RunResult finish(final boolean cancelled) {
        final ScheduledFuture<?> future = progressTimerFuture;
        if (future != null) {
            future.cancel(false);
            progressTimerFuture = null;
        }
        return snapshot(cancelled);
    }

    public RunResult snapshot(final boolean cancelled) {
        final Map<SyncAction, Long> succeededCounts = new EnumMap<>(SyncAction.class);
        final Map<SyncAction, Long> failedCounts = new EnumMap<>(SyncAction.class);
        for (final SyncAction action : SyncAction.values()) {
            succeededCounts.put(action, succeeded.get(action).get());
            failedCounts.put(action, failed.get(action).get());
        }
        return new RunResult(
                succeededCounts,
                failedCounts,
                skipped.get(),
                new ArrayList<>(failures),
                new ArrayList<>(truncations),
                cancelled,
                startTime,
                System.currentTimeMillis()
        );
    }

    /**
     * Shut down the progress timer executor. Called on application shutdown.
     */
    public void shutdown() {
        final ScheduledFuture<?> future = progressTimerFuture;
        if (future != null) {
            future.cancel(false);
        }
        progressTimerExecutor.shutdown();
        try {
            if (!progressTimerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                progressTimerExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            progressTimerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void logProgress() {
        try {
            long done = skipped.get();
            for (final SyncAction action : SyncAction.values()) {
                done += succeeded.get(action).get() + failed.get(action).get();
            }
            final List<String> inFlight = new ArrayList<>(activeItems.keySet());
            logger.info("Sync progress: {}/{} items done, {} failed, in flight: {}",
                    done, plannedItems.get(), failures.size(), inFlight);
        } catch (final Exception e) {
            // Must catch all exceptions: ScheduledExecutorService silently cancels
            // the periodic task if the Runnable throws any uncaught exception.
            logger.error("Failed to log sync progress", e);
        }
    }

    private record AppliedMutation(String identity, String path, SyncAction action) {
    }
}
