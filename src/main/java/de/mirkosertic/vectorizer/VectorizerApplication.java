package de.mirkosertic.vectorizer;

import de.mirkosertic.vectorizer.config.ApplicationConfig;
import de.mirkosertic.vectorizer.config.BuildInfo;
import de.mirkosertic.vectorizer.config.ConfigException;
import de.mirkosertic.vectorizer.config.LoggingConfigurator;
import de.mirkosertic.vectorizer.corpus.AdmissionFilter;
import de.mirkosertic.vectorizer.corpus.CorpusDocument;
import de.mirkosertic.vectorizer.corpus.CorpusReader;
import de.mirkosertic.vectorizer.corpus.DocumentFingerprinter;
import de.mirkosertic.vectorizer.corpus.ReadFailure;
import de.mirkosertic.vectorizer.embedding.EmbeddingProvider;
import de.mirkosertic.vectorizer.embedding.OpenAiEmbeddingProvider;
import de.mirkosertic.vectorizer.embedding.ProviderException;
import de.mirkosertic.vectorizer.embedding.RetryPolicy;
import de.mirkosertic.vectorizer.embedding.RetryingEmbeddingClient;
import de.mirkosertic.vectorizer.reconcile.LocalDocument;
import de.mirkosertic.vectorizer.reconcile.LocalDocumentFactory;
import de.mirkosertic.vectorizer.reconcile.PlanEntry;
import de.mirkosertic.vectorizer.reconcile.Reconciler;
import de.mirkosertic.vectorizer.reconcile.ReconciliationPlan;
import de.mirkosertic.vectorizer.search.SimilaritySearchService;
import de.mirkosertic.vectorizer.store.LuceneVectorStore;
import de.mirkosertic.vectorizer.store.RecordIndexer;
import de.mirkosertic.vectorizer.store.SearchHit;
import de.mirkosertic.vectorizer.store.StoreException;
import de.mirkosertic.vectorizer.sync.FailureReason;
import de.mirkosertic.vectorizer.sync.ItemFailure;
import de.mirkosertic.vectorizer.sync.RemoteStateLoader;
import de.mirkosertic.vectorizer.sync.RunReportWriter;
import de.mirkosertic.vectorizer.sync.RunResult;
import de.mirkosertic.vectorizer.sync.StateLoadException;
import de.mirkosertic.vectorizer.sync.SyncOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the markdown vectorizer.
 * <p>
 * A sync run reads the corpus, loads the fingerprints from the vector index, reconciles
 * both into a plan and executes it. With {@code --query} the application answers a
 * similarity search instead.
 * <p>
 * Exit codes: 0 clean run, 1 run completed with failures, truncations or cancellation,
 * 2 fatal error before any change was made.
 */
public class VectorizerApplication {

    private static final Logger logger = LoggerFactory.getLogger(VectorizerApplication.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_ABNORMAL = 1;
    static final int EXIT_FATAL = 2;

    private final ApplicationConfig config;
    private final LuceneVectorStore store;
    private final DocumentFingerprinter fingerprinter;
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile SyncOrchestrator orchestrator;
    private volatile boolean cancelRequested;
    private OpenAiEmbeddingProvider embeddingProvider;

    public VectorizerApplication(final ApplicationConfig config) {
        this.config = config;
        this.fingerprinter = new DocumentFingerprinter();
        this.store = new LuceneVectorStore(Paths.get(config.getIndexPath()), config.getEmbeddingDimensions(),
                new RecordIndexer());
    }

    /**
     * Open the vector index.
     *
     * @throws StoreException if the index cannot be opened
     */
    public void init() throws StoreException {
        logger.info("Initializing markdown vectorizer...");
        store.init();
    }

    /**
     * Run in the configured mode.
     *
     * @return the process exit code
     */
    public int run() throws StateLoadException, ProviderException, StoreException {
        if (config.isSearchMode()) {
            return runSearch();
        }
        return runSync();
    }

    int runSync() throws StateLoadException, StoreException {
        final Path docsRoot = Paths.get(config.getDocsPath());
        logger.info("Reading markdown corpus from {}", docsRoot.toAbsolutePath());

        // Corpus
        final List<ReadFailure> readFailures = new ArrayList<>();
        final CorpusReader corpusReader = new CorpusReader(config.getIncludePatterns(), config.getExcludePatterns());
        final List<CorpusDocument> documents = corpusReader.readAll(docsRoot, readFailures::add);
        logger.info("Found {} markdown document(s), {} unreadable", documents.size(), readFailures.size());

        final LocalDocumentFactory documentFactory = new LocalDocumentFactory(
                new AdmissionFilter(config.getMaxContentLength()), fingerprinter);
        final Map<String, LocalDocument> corpusIndex = documentFactory.index(documents);

        final List<ItemFailure> preRunFailures = new ArrayList<>();
        for (final ReadFailure failure : readFailures) {
            preRunFailures.add(new ItemFailure(fingerprinter.identityOf(failure.relativePath()),
                    failure.relativePath(), null, FailureReason.READ, failure.message()));
        }

        // Remote state, fatal on failure
        final Map<String, String> remote = new RemoteStateLoader(store).loadFingerprints();
        logger.info("Vector index holds {} record(s)", remote.size());

        final Set<String> protectedIdentities = protectedIdentities(readFailures, corpusIndex, remote);
        final ReconciliationPlan plan = new Reconciler().reconcile(corpusIndex, remote, protectedIdentities);

        if (config.isDryRun()) {
            logPlan(plan, corpusIndex);
            return EXIT_SUCCESS;
        }
        if (cancelRequested) {
            logger.warn("Sync cancelled before any item was dispatched, the index is unchanged");
            return EXIT_ABNORMAL;
        }

        final EmbeddingProvider embeddingClient;
        if (plan.requiresEmbeddings()) {
            embeddingProvider = OpenAiEmbeddingProvider.create(config);
            embeddingClient = new RetryingEmbeddingClient(embeddingProvider, retryPolicy());
        } else {
            embeddingClient = null;
        }

        orchestrator = new SyncOrchestrator(embeddingClient, store, config.getConcurrency(),
                config.getProgressIntervalMs());
        // A signal may arrive between the check above and the assignment
        if (cancelRequested) {
            orchestrator.cancel();
        }
        final RunResult result = orchestrator.execute(plan, corpusIndex, preRunFailures);

        logger.info("Stored {} document(s)", store.getDocumentCount());
        writeReport(result);
        return result.exitCode();
    }

    /**
     * Identities that must neither be deleted nor updated in this run. An unreadable file
     * protects its own identity. An unreadable directory hides an unknown set of documents,
     * so every stored record that was not seen locally is kept.
     */
    Set<String> protectedIdentities(final List<ReadFailure> readFailures,
                                    final Map<String, LocalDocument> corpusIndex,
                                    final Map<String, String> remote) {
        final Set<String> result = new HashSet<>();
        boolean directoryFailed = false;
        for (final ReadFailure failure : readFailures) {
            result.add(fingerprinter.identityOf(failure.relativePath()));
            directoryFailed |= failure.directory();
        }
        if (directoryFailed) {
            int kept = 0;
            for (final String identity : remote.keySet()) {
                if (!corpusIndex.containsKey(identity) && result.add(identity)) {
                    kept++;
                }
            }
            logger.warn("At least one directory could not be read, keeping {} stored record(s) that were not found locally",
                    kept);
        }
        return result;
    }

    int runSearch() throws ProviderException, StoreException {
        embeddingProvider = OpenAiEmbeddingProvider.create(config);
        final SimilaritySearchService searchService = new SimilaritySearchService(
                new RetryingEmbeddingClient(embeddingProvider, retryPolicy()), store);

        final List<SearchHit> hits = searchService.search(config.getQuery(), config.getTopK());
        if (hits.isEmpty()) {
            System.out.println("No matching documents.");
        }
        int rank = 1;
        for (final SearchHit hit : hits) {
            System.out.printf("%d. %s (score %.4f)%n", rank++, hit.path(), hit.score());
        }
        return EXIT_SUCCESS;
    }

    private RetryPolicy retryPolicy() {
        return new RetryPolicy(config.getMaxAttempts(),
                Duration.ofMillis(config.getInitialBackoffMs()),
                Duration.ofMillis(config.getMaxBackoffMs()));
    }

    private void logPlan(final ReconciliationPlan plan, final Map<String, LocalDocument> corpusIndex) {
        logger.info("Dry run, no changes are made: {}", plan);
        for (final PlanEntry entry : plan.entries()) {
            final LocalDocument document = corpusIndex.get(entry.identity());
            logger.info("  {} {}{}", entry.action(),
                    document != null ? document.path() : entry.identity(),
                    document != null && document.truncated() ? " (truncated)" : "");
        }
    }

    private void writeReport(final RunResult result) {
        final String reportPath = config.getReportPath();
        if (reportPath == null) {
            return;
        }
        try {
            RunReportWriter.write(result, Paths.get(reportPath));
        } catch (final IOException e) {
            logger.error("Failed to write run report to {}", reportPath, e);
        }
    }

    /**
     * Stop dispatching. Honoured even when the orchestrator has not been created yet.
     */
    void requestCancel() {
        cancelRequested = true;
        final SyncOrchestrator current = orchestrator;
        if (current != null) {
            current.cancel();
        }
    }

    /**
     * Invoked from the shutdown hook: stop dispatching and wait for in-flight items.
     */
    void cancelAndAwait() {
        requestCancel();
        try {
            if (!finished.await(60, TimeUnit.SECONDS)) {
                logger.warn("Run did not finish within 60s after cancellation");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Release all resources in reverse order of creation.
     */
    public void shutdown() {
        logger.info("Shutting down markdown vectorizer...");

        try {
            if (orchestrator != null) {
                orchestrator.shutdown();
            }
        } catch (final Exception e) {
            logger.error("Error shutting down sync orchestrator", e);
        }

        try {
            if (embeddingProvider != null) {
                embeddingProvider.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing embedding provider", e);
        }

        try {
            store.close();
        } catch (final Exception e) {
            logger.error("Error closing vector store", e);
        }

        finished.countDown();
        logger.info("Markdown vectorizer shutdown complete");
    }

    public static void main(final String[] args) {
        // Before anything logs
        LoggingConfigurator.configure();

        System.exit(runApplication(args));
    }

    static int runApplication(final String[] args) {
        final ApplicationConfig config;
        try {
            config = ApplicationConfig.load(args);
            config.validate();
        } catch (final ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return EXIT_FATAL;
        }

        logger.info("Markdown vectorizer {} (built {})", BuildInfo.getVersion(), BuildInfo.getBuildTimestamp());

        final VectorizerApplication app = new VectorizerApplication(config);
        final Thread shutdownHook = new Thread(app::cancelAndAwait, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            app.init();
            return app.run();
        } catch (final ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            logger.error("Configuration error", e);
            return EXIT_FATAL;
        } catch (final StateLoadException e) {
            System.err.println("Failed to load vector index state: " + e.getMessage());
            logger.error("Failed to load vector index state, no changes were made", e);
            return EXIT_FATAL;
        } catch (final Exception e) {
            System.err.println("Markdown vectorizer failed: " + e.getMessage());
            logger.error("Markdown vectorizer failed", e);
            return EXIT_FATAL;
        } finally {
            app.shutdown();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                // JVM is already shutting down, the hook is running
                logger.debug("Shutdown in progress, hook stays registered");
            }
        }
    }
}
