package de.mirkosertic.vectorizer.reconcile;

import de.mirkosertic.vectorizer.corpus.AdmissionFilter;
import de.mirkosertic.vectorizer.corpus.CorpusDocument;
import de.mirkosertic.vectorizer.corpus.DocumentFingerprinter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Reconciler Tests")
class ReconcilerTest {

    private final Reconciler reconciler = new Reconciler();
    private final LocalDocumentFactory factory =
            new LocalDocumentFactory(new AdmissionFilter(10_000), new DocumentFingerprinter());

    private Map<String, LocalDocument> corpus(final CorpusDocument... documents) {
        return factory.index(List.of(documents));
    }

    private static Map<String, String> fingerprintsOf(final Map<String, LocalDocument> local) {
        return local.values().stream()
                .collect(Collectors.toMap(LocalDocument::identity, LocalDocument::fingerprint));
    }

    private static Map<SyncAction, Set<String>> byAction(final ReconciliationPlan plan) {
        return plan.entries().stream().collect(Collectors.groupingBy(PlanEntry::action,
                Collectors.mapping(PlanEntry::identity, Collectors.toSet())));
    }

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @Test
        @DisplayName("Should classify a first run against an empty index as all INSERT")
        void shouldInsertEverythingOnFirstRun() {
            // Given
            final Map<String, LocalDocument> local = corpus(
                    CorpusDocument.of("a.md", "alpha"),
                    CorpusDocument.of("b.md", "beta"),
                    CorpusDocument.of("c.md", "gamma"));

            // When
            final ReconciliationPlan plan = reconciler.reconcile(local, Map.of());

            // Then
            assertThat(plan.size()).isEqualTo(3);
            assertThat(plan.count(SyncAction.INSERT)).isEqualTo(3);
            assertThat(plan.requiresEmbeddings()).isTrue();
        }

        @Test
        @DisplayName("Should classify changed, unchanged, new and removed documents")
        void shouldClassifyMixedState() {
            // Given: index holds a, b, c; b changed, c removed, d new
            final Map<String, LocalDocument> before = corpus(
                    CorpusDocument.of("a.md", "alpha"),
                    CorpusDocument.of("b.md", "beta"),
                    CorpusDocument.of("c.md", "gamma"));
            final Map<String, String> remote = fingerprintsOf(before);
            final Map<String, LocalDocument> now = corpus(
                    CorpusDocument.of("a.md", "alpha"),
                    CorpusDocument.of("b.md", "beta, edited"),
                    CorpusDocument.of("d.md", "delta"));
            final DocumentFingerprinter fingerprinter = new DocumentFingerprinter();

            // When
            final Map<SyncAction, Set<String>> actions = byAction(reconciler.reconcile(now, remote));

            // Then
            assertThat(actions.get(SyncAction.SKIP)).containsExactly(fingerprinter.identityOf("a.md"));
            assertThat(actions.get(SyncAction.UPDATE)).containsExactly(fingerprinter.identityOf("b.md"));
            assertThat(actions.get(SyncAction.DELETE)).containsExactly(fingerprinter.identityOf("c.md"));
            assertThat(actions.get(SyncAction.INSERT)).containsExactly(fingerprinter.identityOf("d.md"));
        }

        @Test
        @DisplayName("Should produce an all-DELETE plan for an empty corpus")
        void shouldDeleteEverythingForEmptyCorpus() {
            // Given
            final Map<String, String> remote = Map.of("id-1", "fp-1", "id-2", "fp-2");

            // When
            final ReconciliationPlan plan = reconciler.reconcile(Map.of(), remote);

            // Then
            assertThat(plan.entries()).extracting(PlanEntry::action).containsOnly(SyncAction.DELETE);
            assertThat(plan.size()).isEqualTo(2);
            assertThat(plan.requiresEmbeddings()).isFalse();
            assertThat(plan.hasMutations()).isTrue();
        }

        @Test
        @DisplayName("Should produce an empty plan for empty inputs")
        void shouldHandleEmptyInputs() {
            // When
            final ReconciliationPlan plan = reconciler.reconcile(Map.of(), Map.of());

            // Then
            assertThat(plan.isEmpty()).isTrue();
            assertThat(plan.hasMutations()).isFalse();
        }

        @Test
        @DisplayName("Should compare fingerprints of the truncated content")
        void shouldCompareTruncatedFingerprints() {
            // Given: a 15,000 character document already stored in truncated form
            final Map<String, LocalDocument> local = corpus(CorpusDocument.of("big.md", "x".repeat(15_000)));
            final Map<String, String> remote = fingerprintsOf(local);

            // When
            final ReconciliationPlan plan = reconciler.reconcile(local, remote);

            // Then
            assertThat(plan.count(SyncAction.SKIP)).isEqualTo(1);
            assertThat(local.values()).singleElement().satisfies(d -> assertThat(d.truncated()).isTrue());
        }
    }

    @Nested
    @DisplayName("Plan properties")
    class PlanPropertyTests {

        @Test
        @DisplayName("Should contain every identity of the union exactly once")
        void shouldCoverUnionExactlyOnce() {
            // Given
            final Map<String, LocalDocument> local = corpus(
                    CorpusDocument.of("a.md", "alpha"),
                    CorpusDocument.of("b.md", "beta"));
            final Map<String, String> remote = new HashMap<>(fingerprintsOf(corpus(CorpusDocument.of("b.md", "old"))));
            remote.put("orphan", "fp");

            // When
            final ReconciliationPlan plan = reconciler.reconcile(local, remote);

            // Then
            final List<String> identities = plan.entries().stream().map(PlanEntry::identity).toList();
            assertThat(identities).doesNotHaveDuplicates();
            assertThat(identities).hasSize(3).contains("orphan");
        }

        @Test
        @DisplayName("Should be idempotent: applying a plan and reconciling again yields only SKIP")
        void shouldBeIdempotent() {
            // Given
            final Map<String, LocalDocument> local = corpus(
                    CorpusDocument.of("a.md", "alpha"),
                    CorpusDocument.of("b.md", "beta"));
            final Map<String, String> remote = new HashMap<>(Map.of("stale", "fp"));

            // When: simulate applying the plan to the remote state
            final ReconciliationPlan first = reconciler.reconcile(local, remote);
            for (final PlanEntry entry : first.entries()) {
                switch (entry.action()) {
                    case INSERT, UPDATE -> remote.put(entry.identity(), local.get(entry.identity()).fingerprint());
                    case DELETE -> remote.remove(entry.identity());
                    case SKIP -> { }
                }
            }
            final ReconciliationPlan second = reconciler.reconcile(local, remote);

            // Then
            assertThat(second.entries()).extracting(PlanEntry::action).containsOnly(SyncAction.SKIP);
            assertThat(second.hasMutations()).isFalse();
        }

        @Test
        @DisplayName("Should order buckets INSERT, UPDATE, DELETE, SKIP sorted by identity")
        void shouldOrderDeterministically() {
            // Given
            final Map<String, LocalDocument> local = corpus(
                    CorpusDocument.of("n1.md", "new one"),
                    CorpusDocument.of("n2.md", "new two"),
                    CorpusDocument.of("same.md", "same"));
            final Map<String, String> remote = new HashMap<>(fingerprintsOf(corpus(CorpusDocument.of("same.md", "same"))));
            remote.put("z-removed", "fp");
            remote.put("a-removed", "fp");

            // When
            final ReconciliationPlan plan = reconciler.reconcile(local, remote);

            // Then
            assertThat(plan.entries()).extracting(PlanEntry::action).containsExactly(
                    SyncAction.INSERT, SyncAction.INSERT, SyncAction.DELETE, SyncAction.DELETE, SyncAction.SKIP);
            assertThat(plan.entries().get(2).identity()).isEqualTo("a-removed");
            assertThat(plan.entries().get(0).identity()).isLessThan(plan.entries().get(1).identity());
        }

        @Test
        @DisplayName("Should never delete a protected identity")
        void shouldKeepProtectedIdentities() {
            // Given: the file exists but could not be read in this run
            final Map<String, String> remote = Map.of("unreadable", "fp", "gone", "fp");

            // When
            final ReconciliationPlan plan = reconciler.reconcile(Map.of(), remote, Set.of("unreadable"));

            // Then
            assertThat(plan.entries()).containsExactly(new PlanEntry("gone", SyncAction.DELETE));
        }
    }
}
