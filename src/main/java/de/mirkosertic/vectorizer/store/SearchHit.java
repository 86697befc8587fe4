package de.mirkosertic.vectorizer.store;

/**
 * One nearest-neighbour match. Higher scores mean more similar.
 */
public record SearchHit(
        String identity,
        String path,
        float score,
        String content
) {
}
