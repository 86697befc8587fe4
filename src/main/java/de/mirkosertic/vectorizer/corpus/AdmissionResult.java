package de.mirkosertic.vectorizer.corpus;

/**
 * Outcome of the size-admission check.
 *
 * @param content        the content to embed, truncated if the document was too long
 * @param admitted       {@code false} if the content had to be truncated
 * @param originalLength length of the content before truncation, in code points
 */
public record AdmissionResult(
        String content,
        boolean admitted,
        long originalLength
) {
}
