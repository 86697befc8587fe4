package de.mirkosertic.vectorizer.embedding;

/**
 * An embedding call failed. Transient failures (timeouts, rate limits, server errors)
 * may be retried; all others are final for the affected document.
 */
public class ProviderException extends Exception {

    private final boolean transientFailure;

    public ProviderException(final String message, final boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ProviderException(final String message, final boolean transientFailure, final Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
