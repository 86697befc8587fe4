package de.mirkosertic.vectorizer.sync;

/**
 * Why an item ended up in the run's failure ledger.
 */
public enum FailureReason {
    /** The document file could not be read or decoded. */
    READ,
    /** The document exceeded the size limit and was embedded in truncated form. */
    TRUNCATED,
    /** The embedding provider failed permanently or retries were exhausted. */
    EMBEDDING,
    /** The vector store rejected the upsert, delete or final commit. */
    STORE
}
