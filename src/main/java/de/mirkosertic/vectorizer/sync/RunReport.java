package de.mirkosertic.vectorizer.sync;

import de.mirkosertic.vectorizer.reconcile.SyncAction;

import java.util.List;

/**
 * Serializable view of a {@link RunResult}, written by {@link RunReportWriter}.
 */
public record RunReport(
        RunOutcome outcome,
        int exitCode,
        boolean cancelled,
        long inserted,
        long updated,
        long deleted,
        long unchanged,
        long failedInserts,
        long failedUpdates,
        long failedDeletes,
        int failureCount,
        int truncationCount,
        long startTimeMs,
        long elapsedTimeMs,
        List<ItemFailure> failures,
        List<ItemFailure> truncations
) {
    public static RunReport from(final RunResult result) {
        return new RunReport(
                result.outcome(),
                result.exitCode(),
                result.cancelled(),
                result.succeeded(SyncAction.INSERT),
                result.succeeded(SyncAction.UPDATE),
                result.succeeded(SyncAction.DELETE),
                result.skipped(),
                result.failed(SyncAction.INSERT),
                result.failed(SyncAction.UPDATE),
                result.failed(SyncAction.DELETE),
                result.failureCount(),
                result.truncationCount(),
                result.startTimeMs(),
                result.elapsedTimeMs(),
                result.failures(),
                result.truncations()
        );
    }
}
