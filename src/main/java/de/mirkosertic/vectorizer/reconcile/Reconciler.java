package de.mirkosertic.vectorizer.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the diff between the local corpus and the fingerprints recorded in the
 * vector index.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>Identities present locally but not in the index: INSERT.</li>
 *   <li>Identities present on both sides: UPDATE if the fingerprints differ, SKIP otherwise.</li>
 *   <li>Identities present in the index but not locally: DELETE.</li>
 * </ol>
 * The result depends only on the two inputs. An empty corpus against a populated index
 * yields an all-DELETE plan.
 */
public class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    /**
     * @param local  identity to local document
     * @param remote identity to fingerprint, as loaded from the index
     * @return the plan; entries are grouped INSERT, UPDATE, DELETE, SKIP and sorted by identity
     */
    public ReconciliationPlan reconcile(final Map<String, LocalDocument> local, final Map<String, String> remote) {
        return reconcile(local, remote, Set.of());
    }

    /**
     * Variant that leaves the given identities untouched. Used for documents that exist
     * locally but could not be read in this run; their index records must survive.
     *
     * @param protectedIdentities identities that must not become DELETE entries
     */
    public ReconciliationPlan reconcile(final Map<String, LocalDocument> local,
                                        final Map<String, String> remote,
                                        final Set<String> protectedIdentities) {
        final long startTime = System.currentTimeMillis();

        final List<PlanEntry> inserts = new ArrayList<>();
        final List<PlanEntry> updates = new ArrayList<>();
        final List<PlanEntry> deletes = new ArrayList<>();
        final List<PlanEntry> skips = new ArrayList<>();

        for (final Map.Entry<String, LocalDocument> localEntry : local.entrySet()) {
            final String identity = localEntry.getKey();
            final String remoteFingerprint = remote.get(identity);
            if (remoteFingerprint == null) {
                inserts.add(new PlanEntry(identity, SyncAction.INSERT));
            } else if (!remoteFingerprint.equals(localEntry.getValue().fingerprint())) {
                updates.add(new PlanEntry(identity, SyncAction.UPDATE));
            } else {
                skips.add(new PlanEntry(identity, SyncAction.SKIP));
            }
        }

        for (final String remoteIdentity : remote.keySet()) {
            if (!local.containsKey(remoteIdentity) && !protectedIdentities.contains(remoteIdentity)) {
                deletes.add(new PlanEntry(remoteIdentity, SyncAction.DELETE));
            }
        }

        final List<PlanEntry> entries = new ArrayList<>(inserts.size() + updates.size() + deletes.size() + skips.size());
        for (final List<PlanEntry> bucket : List.of(inserts, updates, deletes, skips)) {
            bucket.sort((a, b) -> a.identity().compareTo(b.identity()));
            entries.addAll(bucket);
        }

        final ReconciliationPlan plan = new ReconciliationPlan(entries, System.currentTimeMillis() - startTime);
        logger.info("Reconciliation diff computed in {}ms: insert={}, update={}, delete={}, skip={}",
                plan.reconciliationTimeMs(), inserts.size(), updates.size(), deletes.size(), skips.size());
        return plan;
    }
}
