package de.mirkosertic.vectorizer.corpus;

import de.mirkosertic.vectorizer.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Walks the corpus root and produces one {@link CorpusDocument} per markdown file.
 * <p>
 * The directory walk happens eagerly, file contents are read lazily as the returned
 * stream is consumed. Re-invoking {@link #read} on an unchanged tree yields the same set
 * of documents; the order is unspecified.
 */
public class CorpusReader {

    private static final Logger logger = LoggerFactory.getLogger(CorpusReader.class);

    private final FilePatternMatcher matcher;

    public CorpusReader(final List<String> includePatterns, final List<String> excludePatterns) {
        this.matcher = new FilePatternMatcher(includePatterns, excludePatterns);
    }

    /**
     * @param root      corpus root directory
     * @param onFailure receives every file (or subdirectory) that could not be read
     * @return lazily reading stream of documents
     * @throws ConfigException if the root is missing, not a directory, or cannot be walked
     */
    public Stream<CorpusDocument> read(final Path root, final Consumer<ReadFailure> onFailure) {
        final List<Path> files = collectFiles(root, onFailure);
        logger.info("Found {} markdown file(s) under {}", files.size(), root);

        return files.stream()
                .map(file -> readDocument(root, file, onFailure))
                .filter(Objects::nonNull);
    }

    /**
     * Convenience variant that materializes all documents.
     */
    public List<CorpusDocument> readAll(final Path root, final Consumer<ReadFailure> onFailure) {
        try (final Stream<CorpusDocument> documents = read(root, onFailure)) {
            return documents.toList();
        }
    }

    private List<Path> collectFiles(final Path root, final Consumer<ReadFailure> onFailure) {
        if (!Files.isDirectory(root)) {
            throw new ConfigException(root + " is not a directory");
        }
        if (!Files.isReadable(root)) {
            throw new ConfigException(root + " is not readable");
        }

        final List<Path> result = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && matcher.shouldInclude(root.relativize(file))) {
                        result.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                    if (file.equals(root)) {
                        throw new ConfigException("Cannot read corpus root " + root, exc);
                    }
                    final String relativePath = toRelativePath(root, file);
                    // Anything that is not known to be a regular file may hide a subtree
                    if (Files.isRegularFile(file)) {
                        logger.warn("Cannot access {}, skipping", relativePath, exc);
                        onFailure.accept(ReadFailure.ofFile(relativePath, describe(exc)));
                    } else {
                        logger.warn("Cannot access directory {}, its documents are left untouched", relativePath, exc);
                        onFailure.accept(ReadFailure.ofDirectory(relativePath, describe(exc)));
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (final IOException e) {
            throw new ConfigException("Cannot walk corpus root " + root, e);
        }
        return result;
    }

    private CorpusDocument readDocument(final Path root, final Path file, final Consumer<ReadFailure> onFailure) {
        final String relativePath = toRelativePath(root, file);
        try {
            final String content = Files.readString(file, StandardCharsets.UTF_8);
            return CorpusDocument.of(relativePath, content);
        } catch (final CharacterCodingException e) {
            logger.warn("File {} is not valid UTF-8, skipping", relativePath);
            onFailure.accept(ReadFailure.ofFile(relativePath, "not valid UTF-8"));
        } catch (final IOException e) {
            logger.warn("Cannot read {}, skipping", relativePath, e);
            onFailure.accept(ReadFailure.ofFile(relativePath, describe(e)));
        }
        return null;
    }

    /**
     * Relative path with {@code /} separators on every platform, so that identities
     * derived from it are the same on every machine.
     */
    static String toRelativePath(final Path root, final Path file) {
        final Path relative = root.relativize(file);
        final StringBuilder builder = new StringBuilder();
        for (final Path segment : relative) {
            if (builder.length() > 0) {
                builder.append('/');
            }
            builder.append(segment);
        }
        return builder.toString();
    }

    private static String describe(final IOException e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }
}
