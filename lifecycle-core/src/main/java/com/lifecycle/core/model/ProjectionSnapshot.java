package com.lifecycle.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Verification artifact summarising read model content. Not part of the
 * system of record; produced on demand and discarded after comparison.
 */
public record ProjectionSnapshot(
    Instant takenAt,
    List<TableSnapshot> tables
) {

    public ProjectionSnapshot {
        tables = List.copyOf(tables);
    }

    public Optional<TableSnapshot> table(String tableName) {
        return tables.stream()
            .filter(t -> t.tableName().equals(tableName))
            .findFirst();
    }
}
