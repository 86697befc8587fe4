package de.mirkosertic.vectorizer.store;

/**
 * A vector store operation failed.
 */
public class StoreException extends Exception {

    public StoreException(final String message) {
        super(message);
    }

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
