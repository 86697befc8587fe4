package de.mirkosertic.vectorizer.store;

import de.mirkosertic.vectorizer.config.ConfigException;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.Bits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link VectorStore} backed by a local Lucene index with an HNSW vector field.
 * <p>
 * Upserts use {@link IndexWriter#updateDocument}, an atomic delete-and-add keyed by
 * identity, so readers never see a partial record. The index records its schema version
 * and vector dimension in the commit user data; opening an index that was built for a
 * different dimension fails with a {@link ConfigException}.
 */
public class LuceneVectorStore implements VectorStore {

    private static final Logger logger = LoggerFactory.getLogger(LuceneVectorStore.class);

    static final String COMMIT_KEY_SCHEMA_VERSION = "schema_version";
    static final String COMMIT_KEY_VECTOR_DIMENSION = "vector_dimension";

    private final Path indexPath;
    private final int dimensions;
    private final RecordIndexer recordIndexer;

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;

    public LuceneVectorStore(final Path indexPath, final int dimensions, final RecordIndexer recordIndexer) {
        if (dimensions <= 0 || dimensions > HighDimensionVectorCodec.MAX_DIMENSIONS) {
            throw new ConfigException("Embedding dimensions must be between 1 and "
                    + HighDimensionVectorCodec.MAX_DIMENSIONS + ", was " + dimensions);
        }
        this.indexPath = indexPath;
        this.dimensions = dimensions;
        this.recordIndexer = recordIndexer;
    }

    /**
     * Open (or create) the index. Must be called before using the store.
     *
     * @throws StoreException if the index cannot be opened
     * @throws ConfigException if the index was built for a different vector dimension
     */
    public void init() throws StoreException {
        try {
            if (!Files.exists(indexPath)) {
                Files.createDirectories(indexPath);
                logger.info("Created index directory: {}", indexPath.toAbsolutePath());
            }

            directory = FSDirectory.open(indexPath);
            if (DirectoryReader.indexExists(directory)) {
                verifyRecordedDimension();
            }

            final IndexWriterConfig config = new IndexWriterConfig();
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            config.setCodec(new HighDimensionVectorCodec());
            indexWriter = new IndexWriter(directory, config);
            indexWriter.setLiveCommitData(commitUserData().entrySet());

            // Commit to ensure index files and commit data exist
            indexWriter.commit();

            searcherManager = new SearcherManager(indexWriter, null);
        } catch (final IOException e) {
            closeQuietly();
            throw new StoreException("Cannot open vector index at " + indexPath, e);
        } catch (final ConfigException e) {
            closeQuietly();
            throw e;
        }

        logger.info("Vector index initialized at: {} (dimensions={}, schemaVersion={})",
                indexPath.toAbsolutePath(), dimensions, RecordIndexer.SCHEMA_VERSION);
    }

    private void verifyRecordedDimension() throws IOException {
        final Map<String, String> userData = SegmentInfos.readLatestCommit(directory).getUserData();

        final String recordedSchema = userData.get(COMMIT_KEY_SCHEMA_VERSION);
        if (recordedSchema != null && !recordedSchema.equals(String.valueOf(RecordIndexer.SCHEMA_VERSION))) {
            logger.warn("Index schema version {} differs from current version {}",
                    recordedSchema, RecordIndexer.SCHEMA_VERSION);
        }

        int recordedDimension = -1;
        final String recorded = userData.get(COMMIT_KEY_VECTOR_DIMENSION);
        if (recorded != null) {
            recordedDimension = Integer.parseInt(recorded);
        } else {
            // Index written by another tool: fall back to the field infos
            try (DirectoryReader reader = DirectoryReader.open(directory)) {
                for (final LeafReaderContext leaf : reader.leaves()) {
                    final FieldInfo fieldInfo = leaf.reader().getFieldInfos().fieldInfo(RecordIndexer.FIELD_EMBEDDING);
                    if (fieldInfo != null && fieldInfo.getVectorDimension() > 0) {
                        recordedDimension = fieldInfo.getVectorDimension();
                        break;
                    }
                }
            }
        }

        if (recordedDimension > 0 && recordedDimension != dimensions) {
            throw new ConfigException("Vector index at " + indexPath + " holds " + recordedDimension
                    + "-dimensional embeddings but " + dimensions + " dimensions are configured");
        }
    }

    private Map<String, String> commitUserData() {
        return Map.of(
                COMMIT_KEY_SCHEMA_VERSION, String.valueOf(RecordIndexer.SCHEMA_VERSION),
                COMMIT_KEY_VECTOR_DIMENSION, String.valueOf(dimensions));
    }

    @Override
    public void upsert(final VectorRecord record) throws StoreException {
        if (record.embedding().length != dimensions) {
            throw new StoreException("Embedding for " + record.path() + " has " + record.embedding().length
                    + " dimensions, index expects " + dimensions);
        }
        try {
            recordIndexer.indexDocument(indexWriter, recordIndexer.createDocument(record));
        } catch (final IOException | IllegalArgumentException e) {
            throw new StoreException("Failed to upsert " + record.path(), e);
        }
    }

    @Override
    public void delete(final String identity) throws StoreException {
        try {
            recordIndexer.deleteDocument(indexWriter, identity);
        } catch (final IOException e) {
            throw new StoreException("Failed to delete " + identity, e);
        }
    }

    @Override
    public Map<String, String> listFingerprints() throws StoreException {
        try {
            searcherManager.maybeRefreshBlocking();
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final Set<String> fields = Set.of(RecordIndexer.FIELD_IDENTITY, RecordIndexer.FIELD_CONTENT_HASH);
                final Map<String, String> result = new HashMap<>();
                for (final LeafReaderContext leaf : searcher.getIndexReader().leaves()) {
                    final LeafReader reader = leaf.reader();
                    final Bits liveDocs = reader.getLiveDocs();
                    final StoredFields storedFields = reader.storedFields();
                    for (int docId = 0; docId < reader.maxDoc(); docId++) {
                        if (liveDocs != null && !liveDocs.get(docId)) {
                            continue;
                        }
                        final Document doc = storedFields.document(docId, fields);
                        final String identity = doc.get(RecordIndexer.FIELD_IDENTITY);
                        final String hash = doc.get(RecordIndexer.FIELD_CONTENT_HASH);
                        if (identity != null && hash != null) {
                            result.put(identity, hash);
                        }
                    }
                }
                logger.debug("Listed {} fingerprints from index", result.size());
                return result;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new StoreException("Failed to list fingerprints", e);
        }
    }

    @Override
    public List<SearchHit> findNearest(final float[] query, final int topK) throws StoreException {
        if (query.length != dimensions) {
            throw new StoreException("Query vector has " + query.length + " dimensions, index expects " + dimensions);
        }
        try {
            searcherManager.maybeRefreshBlocking();
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final TopDocs topDocs = searcher.search(
                        new KnnFloatVectorQuery(RecordIndexer.FIELD_EMBEDDING, query, topK), topK);
                final StoredFields storedFields = searcher.storedFields();
                final List<SearchHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
                for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    final Document doc = storedFields.document(scoreDoc.doc);
                    hits.add(new SearchHit(
                            doc.get(RecordIndexer.FIELD_IDENTITY),
                            doc.get(RecordIndexer.FIELD_PATH),
                            scoreDoc.score,
                            doc.get(RecordIndexer.FIELD_CONTENT)));
                }
                return hits;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new StoreException("Similarity search failed", e);
        }
    }

    @Override
    public void commit() throws StoreException {
        try {
            indexWriter.setLiveCommitData(commitUserData().entrySet());
            indexWriter.commit();
            searcherManager.maybeRefresh();
        } catch (final IOException e) {
            throw new StoreException("Failed to commit vector index", e);
        }
    }

    public long getDocumentCount() throws StoreException {
        try {
            searcherManager.maybeRefreshBlocking();
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                return searcher.getIndexReader().numDocs();
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new StoreException("Failed to count documents", e);
        }
    }

    /**
     * Close the store and release all resources. Pending changes are committed.
     */
    @Override
    public void close() throws StoreException {
        try {
            // Close SearcherManager before IndexWriter
            if (searcherManager != null) {
                searcherManager.close();
            }
            if (indexWriter != null) {
                indexWriter.close();
            }
            if (directory != null) {
                directory.close();
            }
        } catch (final IOException e) {
            throw new StoreException("Failed to close vector index", e);
        } finally {
            searcherManager = null;
            indexWriter = null;
            directory = null;
        }
        logger.info("Vector index closed");
    }

    private void closeQuietly() {
        try {
            close();
        } catch (final StoreException e) {
            logger.warn("Error while closing partially opened index", e);
        }
    }
}
