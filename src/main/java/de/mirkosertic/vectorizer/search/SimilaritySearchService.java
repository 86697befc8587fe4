package de.mirkosertic.vectorizer.search;

import de.mirkosertic.vectorizer.embedding.EmbeddingProvider;
import de.mirkosertic.vectorizer.embedding.ProviderException;
import de.mirkosertic.vectorizer.store.SearchHit;
import de.mirkosertic.vectorizer.store.StoreException;
import de.mirkosertic.vectorizer.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Answers free text queries with the most similar stored documents.
 * The query is embedded with the same model the documents were embedded with.
 */
public class SimilaritySearchService {

    private static final Logger logger = LoggerFactory.getLogger(SimilaritySearchService.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorStore store;

    public SimilaritySearchService(final EmbeddingProvider embeddingProvider, final VectorStore store) {
        this.embeddingProvider = embeddingProvider;
        this.store = store;
    }

    /**
     * @param query free text
     * @param topK  maximum number of hits
     * @return hits ordered by descending similarity
     */
    public List<SearchHit> search(final String query, final int topK) throws ProviderException, StoreException {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, was " + topK);
        }

        final long startTime = System.currentTimeMillis();
        final float[] queryVector = embeddingProvider.embed(query);
        final List<SearchHit> hits = store.findNearest(queryVector, topK);
        logger.info("Similarity search returned {} hit(s) in {}ms", hits.size(), System.currentTimeMillis() - startTime);
        return hits;
    }
}
