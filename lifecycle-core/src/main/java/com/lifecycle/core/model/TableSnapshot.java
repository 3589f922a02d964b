package com.lifecycle.core.model;

import java.util.List;
import java.util.Map;

/**
 * Row count and content checksum of one read model table.
 */
public record TableSnapshot(
    String tableName,
    long rowCount,
    String checksum,
    List<Map<String, Object>> sampleRows
) {

    public TableSnapshot {
        sampleRows = sampleRows == null ? List.of() : List.copyOf(sampleRows);
    }

    public static TableSnapshot of(String tableName, long rowCount, String checksum) {
        return new TableSnapshot(tableName, rowCount, checksum, List.of());
    }
}
