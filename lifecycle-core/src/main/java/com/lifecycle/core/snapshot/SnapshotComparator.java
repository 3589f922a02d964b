package com.lifecycle.core.snapshot;

import com.lifecycle.core.model.ProjectionSnapshot;
import com.lifecycle.core.model.SnapshotComparison;
import com.lifecycle.core.model.TableSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares two projection snapshots table by table.
 * 
 * Equal iff every table appears in both snapshots with the same row count
 * and checksum. A missing table, a row count mismatch and a checksum
 * mismatch are each reported as separate differences.
 */
public final class SnapshotComparator {

    private SnapshotComparator() {
    }

    public static SnapshotComparison compare(ProjectionSnapshot before, ProjectionSnapshot after) {
        List<String> differences = new ArrayList<>();

        for (TableSnapshot beforeTable : before.tables()) {
            Optional<TableSnapshot> match = after.table(beforeTable.tableName());
            if (match.isEmpty()) {
                differences.add(String.format("Table %s: missing from after snapshot",
                    beforeTable.tableName()));
                continue;
            }
            TableSnapshot afterTable = match.get();

            if (beforeTable.rowCount() != afterTable.rowCount()) {
                differences.add(String.format("Table %s: row count differs (%d vs %d)",
                    beforeTable.tableName(), beforeTable.rowCount(), afterTable.rowCount()));
            }
            if (!beforeTable.checksum().equals(afterTable.checksum())) {
                differences.add(String.format("Table %s: checksum differs (%s vs %s)",
                    beforeTable.tableName(), beforeTable.checksum(), afterTable.checksum()));
            }
        }

        for (TableSnapshot afterTable : after.tables()) {
            if (before.table(afterTable.tableName()).isEmpty()) {
                differences.add(String.format("Table %s: missing from before snapshot",
                    afterTable.tableName()));
            }
        }

        return SnapshotComparison.of(differences);
    }
}
