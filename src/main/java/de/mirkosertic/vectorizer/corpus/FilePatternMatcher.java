package de.mirkosertic.vectorizer.corpus;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Decides which files under the corpus root are documents.
 * Include globs are matched against the file name, exclude globs against the
 * path relative to the corpus root.
 */
public class FilePatternMatcher {

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeMatchers = includePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        this.excludeMatchers = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    /**
     * @param relativePath path of the file relative to the corpus root
     */
    public boolean shouldInclude(final Path relativePath) {
        // "**/x/**" needs at least one leading segment, so also try with a synthetic one
        final Path anchored = Path.of("_").resolve(relativePath);
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(relativePath) || excludeMatcher.matches(anchored)) {
                return false;
            }
        }

        // If no include patterns specified, include all (except excluded)
        if (includeMatchers.isEmpty()) {
            return true;
        }

        final Path fileName = relativePath.getFileName();
        if (fileName == null) {
            return false;
        }
        for (final PathMatcher includeMatcher : includeMatchers) {
            if (includeMatcher.matches(fileName)) {
                return true;
            }
        }

        return false;
    }
}
