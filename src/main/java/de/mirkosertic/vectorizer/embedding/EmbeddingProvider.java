package de.mirkosertic.vectorizer.embedding;

/**
 * Capability to turn text into a dense vector. Implementations are called from
 * several worker threads at once and must be thread-safe.
 */
public interface EmbeddingProvider {

    /**
     * @param text input text, never null
     * @return embedding vector of length {@link #dimensions()}
     * @throws ProviderException on network, authentication, rate-limit or malformed-response failures
     */
    float[] embed(String text) throws ProviderException;

    /**
     * @return the fixed dimensionality of the vectors this provider returns
     */
    int dimensions();
}
