package de.mirkosertic.vectorizer;

import de.mirkosertic.vectorizer.config.ApplicationConfig;
import de.mirkosertic.vectorizer.corpus.DocumentFingerprinter;
import de.mirkosertic.vectorizer.corpus.ReadFailure;
import de.mirkosertic.vectorizer.reconcile.LocalDocument;
import de.mirkosertic.vectorizer.store.LuceneVectorStore;
import de.mirkosertic.vectorizer.store.RecordIndexer;
import de.mirkosertic.vectorizer.store.VectorRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("VectorizerApplication Tests")
class VectorizerApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should exit with 2 when the docs directory does not exist")
    void shouldFailFatallyForMissingDocs() {
        // When
        final int exitCode = VectorizerApplication.runApplication(new String[]{
                "--docs", tempDir.resolve("missing").toString(),
                "--db", tempDir.resolve("index").toString()});

        // Then
        assertThat(exitCode).isEqualTo(VectorizerApplication.EXIT_FATAL);
    }

    @Test
    @DisplayName("Should exit with 2 for an unknown option")
    void shouldFailFatallyForUnknownOption() {
        assertThat(VectorizerApplication.runApplication(new String[]{"--bogus"}))
                .isEqualTo(VectorizerApplication.EXIT_FATAL);
    }

    @Test
    @DisplayName("Should compute a plan without changing the index in dry-run mode")
    void shouldNotMutateInDryRun() throws Exception {
        // Given
        final Path docs = Files.createDirectories(tempDir.resolve("docs"));
        Files.writeString(docs.resolve("a.md"), "alpha");
        final Path index = tempDir.resolve("index");

        // When
        final int exitCode = VectorizerApplication.runApplication(new String[]{
                "--docs", docs.toString(), "--db", index.toString(), "--dry-run"});

        // Then
        assertThat(exitCode).isEqualTo(VectorizerApplication.EXIT_SUCCESS);
        try (LuceneVectorStore store = new LuceneVectorStore(index, 3072, new RecordIndexer())) {
            store.init();
            assertThat(store.listFingerprints()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should remove records of deleted files without needing an API key")
    void shouldDeleteWithoutCredentials() throws Exception {
        // Given: the index holds a record whose file no longer exists
        final Path docs = Files.createDirectories(tempDir.resolve("docs"));
        final Path index = tempDir.resolve("index");
        final float[] embedding = new float[3072];
        embedding[0] = 1.0f;
        try (LuceneVectorStore store = new LuceneVectorStore(index, 3072, new RecordIndexer())) {
            store.init();
            store.upsert(new VectorRecord("stale-id", "gone.md", "gone", embedding, "fp"));
            store.commit();
        }
        final Path report = tempDir.resolve("report.json");

        // When
        final int exitCode = VectorizerApplication.runApplication(new String[]{
                "--docs", docs.toString(), "--db", index.toString(), "--report", report.toString()});

        // Then
        assertThat(exitCode).isEqualTo(VectorizerApplication.EXIT_SUCCESS);
        assertThat(Files.readString(report)).contains("\"deleted\" : 1");
        try (LuceneVectorStore store = new LuceneVectorStore(index, 3072, new RecordIndexer())) {
            store.init();
            assertThat(store.listFingerprints()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should keep stored records that were not seen locally when a directory is unreadable")
    void shouldProtectRecordsBelowUnreadableDirectory() {
        // Given
        final DocumentFingerprinter fingerprinter = new DocumentFingerprinter();
        final VectorizerApplication app = new VectorizerApplication(config(tempDir.resolve("docs")));
        final String visible = fingerprinter.identityOf("top.md");
        final String hidden = fingerprinter.identityOf("sub/a.md");
        final Map<String, LocalDocument> corpusIndex = Map.of(visible,
                new LocalDocument(visible, "top.md", "top", "fp-top", false, 3));
        final Map<String, String> remote = Map.of(visible, "fp-old", hidden, "fp-hidden");

        // When
        final Set<String> protectedIdentities = app.protectedIdentities(
                List.of(ReadFailure.ofDirectory("sub", "Permission denied")), corpusIndex, remote);

        // Then
        assertThat(protectedIdentities)
                .contains(hidden, fingerprinter.identityOf("sub"))
                .doesNotContain(visible);
    }

    @Test
    @DisplayName("Should only protect the failing file itself when no directory failed")
    void shouldProtectOnlyUnreadableFile() {
        // Given
        final DocumentFingerprinter fingerprinter = new DocumentFingerprinter();
        final VectorizerApplication app = new VectorizerApplication(config(tempDir.resolve("docs")));
        final Map<String, String> remote = Map.of(
                fingerprinter.identityOf("broken.md"), "fp-broken",
                fingerprinter.identityOf("gone.md"), "fp-gone");

        // When
        final Set<String> protectedIdentities = app.protectedIdentities(
                List.of(ReadFailure.ofFile("broken.md", "not valid UTF-8")), Map.of(), remote);

        // Then
        assertThat(protectedIdentities).containsExactly(fingerprinter.identityOf("broken.md"));
    }

    @Test
    @DisplayName("Should not delete records under a chmod 000 subdirectory")
    void shouldNotDeleteUnderUnreadableDirectory() throws Exception {
        // Given
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        final Path docs = Files.createDirectories(tempDir.resolve("docs"));
        final Path locked = Files.createDirectories(docs.resolve("sub"));
        Files.writeString(locked.resolve("a.md"), "hidden");
        final Path index = tempDir.resolve("index");
        final String hidden = new DocumentFingerprinter().identityOf("sub/a.md");
        seed(index, hidden, "sub/a.md");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            // Permissions do not apply to a superuser
            assumeTrue(!Files.isReadable(locked));

            // When
            final int exitCode = VectorizerApplication.runApplication(new String[]{
                    "--docs", docs.toString(), "--db", index.toString()});

            // Then
            assertThat(exitCode).isEqualTo(VectorizerApplication.EXIT_ABNORMAL);
            try (LuceneVectorStore store = new LuceneVectorStore(index, 3072, new RecordIndexer())) {
                store.init();
                assertThat(store.listFingerprints()).containsOnlyKeys(hidden);
            }
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    @DisplayName("Should dispatch nothing when cancelled before execution starts")
    void shouldHonourCancellationBeforeExecution() throws Exception {
        // Given: one stale record to delete and one new file to insert
        final Path docs = Files.createDirectories(tempDir.resolve("docs"));
        Files.writeString(docs.resolve("new.md"), "fresh");
        final Path index = tempDir.resolve("index");
        seed(index, "stale-id", "gone.md");
        final VectorizerApplication app = new VectorizerApplication(config(docs));
        final int exitCode;
        try {
            app.init();

            // When
            app.requestCancel();
            exitCode = app.runSync();
        } finally {
            app.shutdown();
        }

        // Then
        assertThat(exitCode).isEqualTo(VectorizerApplication.EXIT_ABNORMAL);
        try (LuceneVectorStore store = new LuceneVectorStore(index, 3072, new RecordIndexer())) {
            store.init();
            assertThat(store.listFingerprints()).containsOnlyKeys("stale-id");
        }
    }

    private ApplicationConfig config(final Path docs) {
        return ApplicationConfig.load(new String[]{
                "--docs", docs.toString(), "--db", tempDir.resolve("index").toString()});
    }

    private static void seed(final Path index, final String identity, final String path) throws Exception {
        final float[] embedding = new float[3072];
        embedding[0] = 1.0f;
        try (LuceneVectorStore store = new LuceneVectorStore(index, 3072, new RecordIndexer())) {
            store.init();
            store.upsert(new VectorRecord(identity, path, "content", embedding, "fp"));
            store.commit();
        }
    }
}
