package ai.svcs.semantic;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Node-level partition of one file: ids only in the new version, ids only in the old version, and the pairs present
 * in both. All three views iterate in id order.
 */
public record ChangeSet(SortedSet<String> added, SortedSet<String> removed, SortedMap<String, NodePair> common) {

    public ChangeSet {
        added = Collections.unmodifiableSortedSet(new TreeSet<>(added));
        removed = Collections.unmodifiableSortedSet(new TreeSet<>(removed));
        common = Collections.unmodifiableSortedMap(new TreeMap<>(common));
    }

    public static ChangeSet empty() {
        return new ChangeSet(new TreeSet<>(), new TreeSet<>(), new TreeMap<>());
    }

    /** Common pairs whose canonical text differs, in id order. */
    public List<NodePair> candidates() {
        return common.values().stream().filter(p -> !p.isUnchanged()).toList();
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && candidates().isEmpty();
    }

    /**
     * Checks that added, removed and common are pairwise disjoint and together cover exactly {@code before ∪ after}.
     *
     * @throws IllegalStateException on the first violation
     */
    public void verifyPartition(SortedSet<String> beforeIds, SortedSet<String> afterIds) {
        var union = new TreeSet<>(beforeIds);
        union.addAll(afterIds);

        var seen = new TreeSet<String>();
        for (var id : added) {
            if (!seen.add(id)) {
                throw new IllegalStateException("Duplicate id " + id);
            }
        }
        for (var id : removed) {
            if (!seen.add(id)) {
                throw new IllegalStateException("Id " + id + " is both added and removed");
            }
        }
        for (var id : common.keySet()) {
            if (!seen.add(id)) {
                throw new IllegalStateException("Id " + id + " is both common and added/removed");
            }
        }
        if (!seen.equals(union)) {
            var missing = new TreeSet<>(union);
            missing.removeAll(seen);
            var extra = new TreeSet<>(seen);
            extra.removeAll(union);
            throw new IllegalStateException("Partition mismatch, missing " + missing + ", unexpected " + extra);
        }
    }
}
