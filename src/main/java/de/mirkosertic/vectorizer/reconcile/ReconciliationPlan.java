package de.mirkosertic.vectorizer.reconcile;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of per-identity actions for one run.
 * Every identity appears exactly once.
 */
public final class ReconciliationPlan {

    private final List<PlanEntry> entries;
    private final Map<SyncAction, Integer> counts;
    private final long reconciliationTimeMs;

    ReconciliationPlan(final List<PlanEntry> entries, final long reconciliationTimeMs) {
        this.entries = List.copyOf(entries);
        this.reconciliationTimeMs = reconciliationTimeMs;

        final Map<SyncAction, Integer> tally = new EnumMap<>(SyncAction.class);
        for (final SyncAction action : SyncAction.values()) {
            tally.put(action, 0);
        }
        for (final PlanEntry entry : this.entries) {
            tally.merge(entry.action(), 1, Integer::sum);
        }
        this.counts = tally;
    }

    public List<PlanEntry> entries() {
        return entries;
    }

    public int count(final SyncAction action) {
        return counts.get(action);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** {@code true} if at least one entry needs an embedding (INSERT or UPDATE). */
    public boolean requiresEmbeddings() {
        return count(SyncAction.INSERT) + count(SyncAction.UPDATE) > 0;
    }

    /** {@code true} if executing this plan changes the index. */
    public boolean hasMutations() {
        return requiresEmbeddings() || count(SyncAction.DELETE) > 0;
    }

    public long reconciliationTimeMs() {
        return reconciliationTimeMs;
    }

    @Override
    public String toString() {
        return String.format("ReconciliationPlan[insert=%d, update=%d, delete=%d, skip=%d]",
                count(SyncAction.INSERT), count(SyncAction.UPDATE), count(SyncAction.DELETE), count(SyncAction.SKIP));
    }
}
