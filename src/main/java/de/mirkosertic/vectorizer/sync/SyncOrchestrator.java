package de.mirkosertic.vectorizer.sync;

import de.mirkosertic.vectorizer.embedding.EmbeddingProvider;
import de.mirkosertic.vectorizer.embedding.ProviderException;
import de.mirkosertic.vectorizer.reconcile.LocalDocument;
import de.mirkosertic.vectorizer.reconcile.PlanEntry;
import de.mirkosertic.vectorizer.reconcile.ReconciliationPlan;
import de.mirkosertic.vectorizer.reconcile.SyncAction;
import de.mirkosertic.vectorizer.store.StoreException;
import de.mirkosertic.vectorizer.store.VectorRecord;
import de.mirkosertic.vectorizer.store.VectorStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes a {@link ReconciliationPlan} against the embedding provider and the vector store.
 * <p>
 * Items run on a bounded worker pool. A failing item is recorded and never aborts the others.
 * All mutations become durable with a single commit after the last item.
 */
public class SyncOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final @Nullable EmbeddingProvider embeddingProvider;
    private final VectorStore store;
    private final int concurrency;
    private final RunResultCollector collector;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @param embeddingProvider provider for INSERT and UPDATE items, may be {@code null}
     *                          when the plan needs no embeddings
     * @param store             target store
     * @param concurrency       maximum number of items processed at the same time
     * @param progressIntervalMs interval of the periodic progress log, 0 to disable
     */
    public SyncOrchestrator(final @Nullable EmbeddingProvider embeddingProvider,
                            final VectorStore store,
                            final int concurrency,
                            final long progressIntervalMs) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive, was " + concurrency);
        }
        this.embeddingProvider = embeddingProvider;
        this.store = store;
        this.concurrency = concurrency;
        this.collector = new RunResultCollector(progressIntervalMs);
    }

    public RunResult execute(final ReconciliationPlan plan, final Map<String, LocalDocument> corpusIndex) {
        return execute(plan, corpusIndex, List.of());
    }

    /**
     * Execute the plan.
     *
     * @param plan         plan produced by the reconciler
     * @param corpusIndex  admitted local documents by identity
     * @param readFailures failures collected while reading the corpus, merged into the result
     * @return the aggregated result; never throws for per-item failures
     */
    public RunResult execute(final ReconciliationPlan plan,
                             final Map<String, LocalDocument> corpusIndex,
                             final List<ItemFailure> readFailures) {
        if (plan.requiresEmbeddings() && embeddingProvider == null) {
            throw new IllegalStateException("Plan contains INSERT or UPDATE entries but no embedding provider is configured");
        }

        logger.info("Executing {} with {} worker(s)", plan, concurrency);
        collector.start(plan.size());
        readFailures.forEach(collector::recordFailure);

        final SyncExecutorService executorService = new SyncExecutorService(concurrency);
        final List<Future<?>> futures = new ArrayList<>();
        try {
            for (final PlanEntry entry : plan.entries()) {
                if (cancelled.get()) {
                    logger.warn("Sync cancelled, {} of {} item(s) dispatched", futures.size(), plan.size());
                    break;
                }
                if (entry.action() == SyncAction.SKIP) {
                    processSkip(entry, corpusIndex.get(entry.identity()));
                    continue;
                }
                futures.add(executorService.submit(() -> processItem(entry, corpusIndex.get(entry.identity()))));
            }
            awaitAll(futures);
        } finally {
            executorService.shutdown();
        }

        commitIfNeeded();

        final RunResult result = collector.finish(cancelled.get());
        logSummary(result);
        return result;
    }

    /**
     * Stop dispatching new items. Items already running finish; items that never started
     * are not counted. Safe to call from any thread, e.g. a shutdown hook.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("Cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Release background resources. Called once the orchestrator is no longer needed.
     */
    public void shutdown() {
        collector.shutdown();
    }

    private void processSkip(final PlanEntry entry, final @Nullable LocalDocument document) {
        if (document != null) {
            logger.info("Unchanged: {}", document.path());
            recordTruncationIfNeeded(document, SyncAction.SKIP);
        }
        collector.recordSkipped();
    }

    private void processItem(final PlanEntry entry, final @Nullable LocalDocument document) {
        if (cancelled.get()) {
            return;
        }
        final String activeKey = document != null ? document.path() : entry.identity();
        collector.registerActiveItem(activeKey);
        try {
            switch (entry.action()) {
                case INSERT, UPDATE -> embedAndUpsert(entry, document);
                case DELETE -> delete(entry);
                case SKIP -> processSkip(entry, document);
            }
        } finally {
            collector.unregisterActiveItem(activeKey);
        }
    }

    private void embedAndUpsert(final PlanEntry entry, final @Nullable LocalDocument document) {
        if (document == null) {
            collector.recordFailure(new ItemFailure(entry.identity(), null, entry.action(), FailureReason.READ,
                    "No local document for planned " + entry.action()));
            return;
        }

        recordTruncationIfNeeded(document, entry.action());

        final float[] embedding;
        try {
            embedding = embeddingProvider.embed(document.content());
        } catch (final ProviderException | RuntimeException e) {
            logger.error("Failed to embed {}: {}", document.path(), e.getMessage(), e);
            collector.recordFailure(new ItemFailure(entry.identity(), document.path(), entry.action(),
                    FailureReason.EMBEDDING, messageOf(e)));
            return;
        }

        try {
            store.upsert(new VectorRecord(entry.identity(), document.path(), document.content(),
                    embedding, document.fingerprint()));
        } catch (final StoreException | RuntimeException e) {
            logger.error("Failed to store {}: {}", document.path(), e.getMessage(), e);
            collector.recordFailure(new ItemFailure(entry.identity(), document.path(), entry.action(),
                    FailureReason.STORE, messageOf(e)));
            return;
        }

        logger.info("{}: {}", entry.action() == SyncAction.INSERT ? "New" : "Updated", document.path());
        collector.recordSuccess(entry.action(), entry.identity(), document.path());
    }

    private void delete(final PlanEntry entry) {
        try {
            store.delete(entry.identity());
        } catch (final StoreException | RuntimeException e) {
            logger.error("Failed to remove {}: {}", entry.identity(), e.getMessage(), e);
            collector.recordFailure(new ItemFailure(entry.identity(), null, SyncAction.DELETE,
                    FailureReason.STORE, messageOf(e)));
            return;
        }
        logger.info("Removed: {}", entry.identity());
        collector.recordSuccess(SyncAction.DELETE, entry.identity(), null);
    }

    private void recordTruncationIfNeeded(final LocalDocument document, final SyncAction action) {
        if (document.truncated()) {
            logger.warn("Truncated {} from {} to {} characters", document.path(),
                    document.originalLength(), document.content().codePointCount(0, document.content().length()));
            collector.recordTruncation(new ItemFailure(document.identity(), document.path(), action,
                    FailureReason.TRUNCATED, "Content of " + document.originalLength()
                    + " characters exceeds the admission limit"));
        }
    }

    private void awaitAll(final List<Future<?>> futures) {
        for (final Future<?> future : futures) {
            try {
                future.get();
            } catch (final ExecutionException e) {
                // Workers record their own failures, anything escaping is a programming error
                logger.error("Unexpected error in sync worker", e.getCause());
            } catch (final InterruptedException e) {
                logger.warn("Interrupted while waiting for sync workers");
                cancel();
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void commitIfNeeded() {
        if (!collector.hasAppliedMutations()) {
            return;
        }
        try {
            store.commit();
            logger.info("Committed changes to vector store");
        } catch (final StoreException | RuntimeException e) {
            logger.error("Final commit failed, no change of this run is durable", e);
            collector.failAppliedMutations("Commit failed: " + messageOf(e));
        }
    }

    private void logSummary(final RunResult result) {
        logger.info("Sync finished in {}ms: inserted={}, updated={}, deleted={}, unchanged={}, failed={}, truncated={}, outcome={}",
                result.elapsedTimeMs(),
                result.succeeded(SyncAction.INSERT),
                result.succeeded(SyncAction.UPDATE),
                result.succeeded(SyncAction.DELETE),
                result.skipped(),
                result.failureCount(),
                result.truncationCount(),
                result.outcome());
        for (final ItemFailure failure : result.failures()) {
            logger.warn("Failed [{}] {}: {}", failure.reason(),
                    failure.path() != null ? failure.path() : failure.identity(), failure.message());
        }
    }

    private static String messageOf(final Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
