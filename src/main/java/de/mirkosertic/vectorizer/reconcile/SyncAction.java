package de.mirkosertic.vectorizer.reconcile;

/**
 * What a run does with one identity.
 */
public enum SyncAction {
    /** Present locally, absent from the index: embed and store. */
    INSERT,
    /** Present on both sides with a different fingerprint: embed and overwrite. */
    UPDATE,
    /** Present in the index only: remove. */
    DELETE,
    /** Present on both sides with the same fingerprint: nothing to do. */
    SKIP;

    public boolean requiresEmbedding() {
        return this == INSERT || this == UPDATE;
    }
}
