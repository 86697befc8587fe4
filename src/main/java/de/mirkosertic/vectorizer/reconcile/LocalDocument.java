package de.mirkosertic.vectorizer.reconcile;

/**
 * A corpus document after identity derivation, admission and fingerprinting.
 *
 * @param identity       hash of the relative path
 * @param path           relative path with {@code /} separators
 * @param content        content to embed, possibly truncated
 * @param fingerprint    hash of {@code content}
 * @param truncated      {@code true} if the admission filter cut the content
 * @param originalLength content length before truncation, in code points
 */
public record LocalDocument(
        String identity,
        String path,
        String content,
        String fingerprint,
        boolean truncated,
        long originalLength
) {
}
