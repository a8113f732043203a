package com.costwatch.anomaly.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered tuple of dimension values identifying one cost series. Ordered
 * lexicographically over its components so ties in the ranked output always
 * resolve the same way.
 */
public record GroupKey(List<String> values) implements Comparable<GroupKey> {

    public static final String UNKNOWN = "unknown";

    public GroupKey {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("group key needs at least one value");
        }
        values = List.copyOf(values);
    }

    public static GroupKey of(String... values) {
        return of(List.of(values));
    }

    public static GroupKey of(List<String> values) {
        List<String> normalized = new ArrayList<>(values.size());
        for (String value : values) {
            normalized.add(value == null || value.isBlank() ? UNKNOWN : value);
        }
        return new GroupKey(normalized);
    }

    public String label() {
        return String.join(" / ", values);
    }

    @Override
    public int compareTo(GroupKey other) {
        int shared = Math.min(values.size(), other.values.size());
        for (int i = 0; i < shared; i++) {
            int cmp = values.get(i).compareTo(other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @Override
    public String toString() {
        return label();
    }
}
