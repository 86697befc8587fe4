package de.mirkosertic.vectorizer.corpus;

/**
 * A markdown document read from the corpus during the current run.
 *
 * @param relativePath path relative to the corpus root, always with {@code /} separators
 * @param content      raw UTF-8 decoded text
 * @param size         content length in code points
 */
public record CorpusDocument(
        String relativePath,
        String content,
        long size
) {

    public static CorpusDocument of(final String relativePath, final String content) {
        return new CorpusDocument(relativePath, content, content.codePointCount(0, content.length()));
    }
}
