package de.mirkosertic.vectorizer.store;

/**
 * The persisted unit of the vector index. {@code contentFingerprint} is always the
 * fingerprint of {@code content}, and {@code embedding} was computed from exactly that content.
 */
public record VectorRecord(
        String identity,
        String path,
        String content,
        float[] embedding,
        String contentFingerprint
) {
}
