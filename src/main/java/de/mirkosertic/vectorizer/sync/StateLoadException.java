package de.mirkosertic.vectorizer.sync;

/**
 * The fingerprints recorded in the vector index could not be loaded. Reconciling
 * against an unknown index state could delete records that still exist locally,
 * so the run stops before any mutation.
 */
public class StateLoadException extends Exception {

    public StateLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
