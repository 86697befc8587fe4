package de.mirkosertic.vectorizer.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries transient provider failures with bounded exponential backoff.
 * Non-transient failures are rethrown immediately; after the last attempt the final
 * {@link ProviderException} is rethrown unchanged.
 */
public class RetryingEmbeddingClient implements EmbeddingProvider {

    private static final Logger logger = LoggerFactory.getLogger(RetryingEmbeddingClient.class);

    private final EmbeddingProvider delegate;
    private final RetryPolicy retryPolicy;

    public RetryingEmbeddingClient(final EmbeddingProvider delegate, final RetryPolicy retryPolicy) {
        this.delegate = delegate;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public float[] embed(final String text) throws ProviderException {
        for (int attempt = 1; ; attempt++) {
            try {
                return delegate.embed(text);
            } catch (final ProviderException e) {
                if (!e.isTransient()) {
                    logger.warn("[EMBEDDING] Non-transient failure on attempt {}/{}, not retrying: {}",
                            attempt, retryPolicy.maxAttempts(), e.getMessage());
                    throw e;
                }
                if (attempt >= retryPolicy.maxAttempts()) {
                    logger.error("[EMBEDDING] Giving up after {} attempts: {}", attempt, e.getMessage());
                    throw e;
                }
                final long backoffMs = retryPolicy.backoffAfter(attempt).toMillis();
                logger.warn("[EMBEDDING] Transient failure on attempt {}/{}, retrying in {}ms: {}",
                        attempt, retryPolicy.maxAttempts(), backoffMs, e.getMessage());
                sleep(backoffMs, e);
            }
        }
    }

    @Override
    public int dimensions() {
        return delegate.dimensions();
    }

    private static void sleep(final long backoffMs, final ProviderException lastFailure) throws ProviderException {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            final ProviderException interrupted = new ProviderException("Embedding retry interrupted", false, e);
            interrupted.addSuppressed(lastFailure);
            throw interrupted;
        }
    }
}
