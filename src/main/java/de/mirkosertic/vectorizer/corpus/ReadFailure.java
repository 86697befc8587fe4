package de.mirkosertic.vectorizer.corpus;

/**
 * A path under the corpus root that could not be read. When {@code directory} is set the
 * whole subtree below {@code relativePath} is unknown for this run.
 */
public record ReadFailure(String relativePath, String message, boolean directory) {

    public static ReadFailure ofFile(final String relativePath, final String message) {
        return new ReadFailure(relativePath, message, false);
    }

    public static ReadFailure ofDirectory(final String relativePath, final String message) {
        return new ReadFailure(relativePath, message, true);
    }
}
