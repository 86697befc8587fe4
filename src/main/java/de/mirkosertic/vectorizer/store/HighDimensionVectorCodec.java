package de.mirkosertic.vectorizer.store;

import org.apache.lucene.codecs.Codec;
import org.apache.lucene.codecs.FilterCodec;
import org.apache.lucene.codecs.KnnVectorsFormat;
import org.apache.lucene.codecs.KnnVectorsReader;
import org.apache.lucene.codecs.KnnVectorsWriter;
import org.apache.lucene.codecs.lucene99.Lucene99HnswVectorsFormat;
import org.apache.lucene.codecs.perfield.PerFieldKnnVectorsFormat;
import org.apache.lucene.index.SegmentReadState;
import org.apache.lucene.index.SegmentWriteState;

import java.io.IOException;

/**
 * Default codec with the vector dimension limit raised from 1024 to {@link #MAX_DIMENSIONS},
 * so that large embedding models (3072 dimensions) can be indexed.
 * <p>
 * Segments are written under the names of the default codec and the default HNSW format,
 * so an index written with this codec can be opened with a stock Lucene reader.
 */
public final class HighDimensionVectorCodec extends FilterCodec {

    public static final int MAX_DIMENSIONS = 4096;

    private final KnnVectorsFormat knnVectorsFormat;

    public HighDimensionVectorCodec() {
        super(Codec.getDefault().getName(), Codec.getDefault());
        final KnnVectorsFormat highDimensionFormat = new HighDimensionFormat(new Lucene99HnswVectorsFormat());
        this.knnVectorsFormat = new PerFieldKnnVectorsFormat() {
            @Override
            public KnnVectorsFormat getKnnVectorsFormatForField(final String field) {
                return highDimensionFormat;
            }
        };
    }

    @Override
    public KnnVectorsFormat knnVectorsFormat() {
        return knnVectorsFormat;
    }

    private static final class HighDimensionFormat extends KnnVectorsFormat {

        private final KnnVectorsFormat delegate;

        HighDimensionFormat(final KnnVectorsFormat delegate) {
            super(delegate.getName());
            this.delegate = delegate;
        }

        @Override
        public KnnVectorsWriter fieldsWriter(final SegmentWriteState state) throws IOException {
            return delegate.fieldsWriter(state);
        }

        @Override
        public KnnVectorsReader fieldsReader(final SegmentReadState state) throws IOException {
            return delegate.fieldsReader(state);
        }

        @Override
        public int getMaxDimensions(final String fieldName) {
            return MAX_DIMENSIONS;
        }
    }
}
