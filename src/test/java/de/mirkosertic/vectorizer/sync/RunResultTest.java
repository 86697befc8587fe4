package de.mirkosertic.vectorizer.sync;

import de.mirkosertic.vectorizer.reconcile.SyncAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RunResult Tests")
class RunResultTest {

    private static final ItemFailure FAILURE =
            new ItemFailure("id-1", "a.md", SyncAction.INSERT, FailureReason.EMBEDDING, "boom");
    private static final ItemFailure TRUNCATION =
            new ItemFailure("id-2", "b.md", SyncAction.UPDATE, FailureReason.TRUNCATED, "too long");

    private static RunResult result(final List<ItemFailure> failures, final List<ItemFailure> truncations,
                                    final boolean cancelled) {
        return new RunResult(Map.of(SyncAction.INSERT, 3L), Map.of(), 2, failures, truncations, cancelled, 1_000, 1_250);
    }

    @Test
    @DisplayName("Should report success with exit code 0 for a clean run")
    void shouldSucceedForCleanRun() {
        // When
        final RunResult result = result(List.of(), List.of(), false);

        // Then
        assertThat(result.outcome()).isEqualTo(RunOutcome.SUCCESS);
        assertThat(result.exitCode()).isZero();
        assertThat(result.succeeded(SyncAction.INSERT)).isEqualTo(3);
        assertThat(result.succeeded(SyncAction.DELETE)).isZero();
        assertThat(result.elapsedTimeMs()).isEqualTo(250);
    }

    @Test
    @DisplayName("Should distinguish truncations from failures")
    void shouldDistinguishTruncations() {
        assertThat(result(List.of(), List.of(TRUNCATION), false).outcome())
                .isEqualTo(RunOutcome.COMPLETED_WITH_TRUNCATIONS);
        assertThat(result(List.of(FAILURE), List.of(TRUNCATION), false).outcome())
                .isEqualTo(RunOutcome.COMPLETED_WITH_FAILURES);
    }

    @Test
    @DisplayName("Should rank cancellation above failures")
    void shouldRankCancellationFirst() {
        // When
        final RunResult result = result(List.of(FAILURE), List.of(TRUNCATION), true);

        // Then
        assertThat(result.outcome()).isEqualTo(RunOutcome.CANCELLED);
        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(result.truncationCount()).isEqualTo(1);
        assertThat(result.failedIdentities()).containsExactly("id-1");
    }
}
