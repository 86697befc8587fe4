package de.mirkosertic.vectorizer.store;

import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;

import java.io.IOException;

/**
 * Maps {@link VectorRecord}s to Lucene documents with a consistent field schema.
 */
public class RecordIndexer {

    /**
     * Schema version for the index.
     * MUST be incremented whenever the index schema changes (fields added/removed/modified).
     * Version 1: identity, path, content, content_hash, embedding (cosine).
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String FIELD_IDENTITY = "identity";
    public static final String FIELD_PATH = "path";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_CONTENT_HASH = "content_hash";
    public static final String FIELD_EMBEDDING = "embedding";

    public static final VectorSimilarityFunction SIMILARITY = VectorSimilarityFunction.COSINE;

    public Document createDocument(final VectorRecord record) {
        final Document doc = new Document();

        // identity - unique ID (not analyzed, stored)
        doc.add(new StringField(FIELD_IDENTITY, record.identity(), Field.Store.YES));

        // path - relative path for display (not analyzed, stored)
        doc.add(new StringField(FIELD_PATH, record.path(), Field.Store.YES));

        // content - stored only, the index is searched by vector
        doc.add(new StoredField(FIELD_CONTENT, record.content()));

        // content_hash for change detection (SHA-256)
        doc.add(new StringField(FIELD_CONTENT_HASH, record.contentFingerprint(), Field.Store.YES));

        doc.add(new KnnFloatVectorField(FIELD_EMBEDDING, record.embedding(), SIMILARITY));

        return doc;
    }

    public void indexDocument(final IndexWriter writer, final Document document) throws IOException {
        // Update or insert document (using identity as unique identifier)
        writer.updateDocument(new Term(FIELD_IDENTITY, document.get(FIELD_IDENTITY)), document);
    }

    public void deleteDocument(final IndexWriter writer, final String identity) throws IOException {
        writer.deleteDocuments(new Term(FIELD_IDENTITY, identity));
    }
}
