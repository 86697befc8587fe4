package de.mirkosertic.vectorizer.sync;

import de.mirkosertic.vectorizer.store.StoreException;
import de.mirkosertic.vectorizer.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Snapshots the identity-to-fingerprint map of the vector index. Either the whole map
 * is returned or the run fails; partial state is never handed to the reconciler.
 */
public class RemoteStateLoader {

    private static final Logger logger = LoggerFactory.getLogger(RemoteStateLoader.class);

    private final VectorStore store;

    public RemoteStateLoader(final VectorStore store) {
        this.store = store;
    }

    public Map<String, String> loadFingerprints() throws StateLoadException {
        final long startTime = System.currentTimeMillis();
        try {
            final Map<String, String> fingerprints = Map.copyOf(store.listFingerprints());
            logger.info("Index snapshot: {} records loaded in {}ms",
                    fingerprints.size(), System.currentTimeMillis() - startTime);
            return fingerprints;
        } catch (final StoreException | RuntimeException e) {
            throw new StateLoadException("Cannot load fingerprints from vector index: " + e.getMessage(), e);
        }
    }
}
