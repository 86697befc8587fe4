package de.mirkosertic.vectorizer.sync;

import de.mirkosertic.vectorizer.reconcile.SyncAction;
import org.jspecify.annotations.Nullable;

/**
 * One entry of the run's failure ledger.
 *
 * @param identity document identity
 * @param path     relative path, {@code null} for index-only records
 * @param action   planned action, {@code null} for documents that never made it into the plan
 * @param reason   failure category
 * @param message  human readable cause
 */
public record ItemFailure(
        String identity,
        @Nullable String path,
        @Nullable SyncAction action,
        FailureReason reason,
        String message
) {
}
