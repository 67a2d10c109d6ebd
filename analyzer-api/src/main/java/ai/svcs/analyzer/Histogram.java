package ai.svcs.analyzer;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/** Immutable key to count multiset with deterministic (sorted) iteration. */
public record Histogram(SortedMap<String, Integer> counts) {
    private static final Histogram EMPTY = new Histogram(new TreeMap<>());

    public Histogram {
        var copy = new TreeMap<String, Integer>();
        counts.forEach((k, v) -> {
            if (v < 0) {
                throw new IllegalArgumentException("Negative count for " + k);
            }
            if (v > 0) {
                copy.put(k, v);
            }
        });
        counts = Collections.unmodifiableSortedMap(copy);
    }

    public static Histogram empty() {
        return EMPTY;
    }

    public static Histogram of(Map<String, Integer> counts) {
        return counts.isEmpty() ? EMPTY : new Histogram(new TreeMap<>(counts));
    }

    public int count(String key) {
        return counts.getOrDefault(key, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /** L1 distance: the sum over all keys of the absolute count difference. */
    public int distance(Histogram other) {
        var keys = new TreeSet<>(counts.keySet());
        keys.addAll(other.counts.keySet());
        int distance = 0;
        for (var key : keys) {
            distance += Math.abs(count(key) - other.count(key));
        }
        return distance;
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
