package com.lifecycle.core.model;

import java.util.List;

/**
 * Result of comparing two projection snapshots.
 */
public record SnapshotComparison(
    boolean equal,
    List<String> differences
) {

    public SnapshotComparison {
        differences = List.copyOf(differences);
    }

    public static SnapshotComparison of(List<String> differences) {
        return new SnapshotComparison(differences.isEmpty(), differences);
    }
}
