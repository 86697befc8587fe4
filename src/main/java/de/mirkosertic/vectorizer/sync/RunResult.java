package de.mirkosertic.vectorizer.sync;

import de.mirkosertic.vectorizer.reconcile.SyncAction;

import java.util.List;
import java.util.Map;

/**
 * Immutable summary of one sync run.
 *
 * @param succeeded   per action, number of items that completed
 * @param failed      per action, number of items that failed
 * @param skipped     number of unchanged items (no provider or store call)
 * @param failures    failed items: READ, EMBEDDING and STORE entries
 * @param truncations documents embedded in truncated form (TRUNCATED entries)
 * @param cancelled   {@code true} if dispatching stopped early on a cancellation signal
 * @param startTimeMs epoch millis when execution started
 * @param endTimeMs   epoch millis when execution finished
 */
public record RunResult(
        Map<SyncAction, Long> succeeded,
        Map<SyncAction, Long> failed,
        long skipped,
        List<ItemFailure> failures,
        List<ItemFailure> truncations,
        boolean cancelled,
        long startTimeMs,
        long endTimeMs
) {

    public RunResult {
        succeeded = Map.copyOf(succeeded);
        failed = Map.copyOf(failed);
        failures = List.copyOf(failures);
        truncations = List.copyOf(truncations);
    }

    public long succeeded(final SyncAction action) {
        return succeeded.getOrDefault(action, 0L);
    }

    public long failed(final SyncAction action) {
        return failed.getOrDefault(action, 0L);
    }

    public int failureCount() {
        return failures.size();
    }

    public int truncationCount() {
        return truncations.size();
    }

    public List<String> failedIdentities() {
        return failures.stream().map(ItemFailure::identity).distinct().toList();
    }

    public RunOutcome outcome() {
        if (cancelled) {
            return RunOutcome.CANCELLED;
        }
        if (!failures.isEmpty()) {
            return RunOutcome.COMPLETED_WITH_FAILURES;
        }
        if (!truncations.isEmpty()) {
            return RunOutcome.COMPLETED_WITH_TRUNCATIONS;
        }
        return RunOutcome.SUCCESS;
    }

    /**
     * @return 0 if the run had no failures, no truncations and was not cancelled; 1 otherwise
     */
    public int exitCode() {
        return outcome() == RunOutcome.SUCCESS ? 0 : 1;
    }

    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }
}
