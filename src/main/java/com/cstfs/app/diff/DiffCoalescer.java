package com.cstfs.app.diff;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstfs.app.database.IndexEntry;

/**
 * Rewrites elementary diffs into semantic events.
 * <p>
 * A NEW record whose hash is already indexed is always replaced: by MOVED
 * when a REMOVED record carries the same hash (both records are consumed),
 * otherwise by DUPLICATE pointing at the indexed path. One rewrite per pass,
 * passes repeat until none applies. Every rewrite removes one NEW record and
 * never creates one, so the loop ends after at most as many passes as there
 * are NEW records.
 */
public final class DiffCoalescer {

    private static final Logger logger = LoggerFactory.getLogger(DiffCoalescer.class);

    private DiffCoalescer() {}

    /**
     * Coalesces {@code diffs} in place and returns it.
     *
     * @param diffs    mutable list, typically straight from {@link DiffGenerator}
     * @param snapshot the persisted index the diffs were computed against
     */
    public static List<DiffRecord> coalesce(List<DiffRecord> diffs, List<IndexEntry> snapshot) {
        Map<String, IndexEntry> byHash = new HashMap<>();
        for (IndexEntry entry : snapshot) {
            byHash.putIfAbsent(entry.hash(), entry);
        }

        int merges = 0;
        while (mergeOnce(diffs, byHash)) {
            merges++;
        }
        logger.debug("Coalesced {} records, {} remain", merges, diffs.size());
        return diffs;
    }

    private static boolean mergeOnce(List<DiffRecord> diffs, Map<String, IndexEntry> byHash) {
        for (int i = 0; i < diffs.size(); i++) {
            DiffRecord added = diffs.get(i);
            if (added.kind() != DiffKind.NEW) continue;

            IndexEntry indexed = byHash.get(added.hash());
            if (indexed == null) continue;

            int removedAt = indexOfRemoved(diffs, added.hash());
            if (removedAt >= 0) {
                DiffRecord removed = diffs.get(removedAt);
                diffs.set(i, DiffRecord.moved(added.path(), added.hash(), removed.path()));
                diffs.remove(removedAt);
            } else {
                diffs.set(i, DiffRecord.duplicate(added.path(), added.hash(), indexed.path()));
            }
            return true;
        }
        return false;
    }

    private static int indexOfRemoved(List<DiffRecord> diffs, String hash) {
        for (int j = 0; j < diffs.size(); j++) {
            DiffRecord r = diffs.get(j);
            if (r.kind() == DiffKind.REMOVED && r.hash().equals(hash)) return j;
        }
        return -1;
    }
}
