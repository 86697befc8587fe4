package de.mirkosertic.vectorizer.store;

import java.util.List;
import java.util.Map;

/**
 * Record-oriented vector store keyed by document identity.
 * All methods are safe to call from several threads.
 */
public interface VectorStore extends AutoCloseable {

    /**
     * Insert the record, or replace the record with the same identity.
     */
    void upsert(VectorRecord record) throws StoreException;

    /**
     * Remove the record with this identity. Deleting an unknown identity is not an error.
     */
    void delete(String identity) throws StoreException;

    /**
     * @return identity to content fingerprint for every record currently in the store
     */
    Map<String, String> listFingerprints() throws StoreException;

    /**
     * @return at most {@code topK} records ordered by descending similarity to {@code query}
     */
    List<SearchHit> findNearest(float[] query, int topK) throws StoreException;

    /**
     * Make all changes durable and visible to readers.
     */
    void commit() throws StoreException;

    @Override
    void close() throws StoreException;
}
