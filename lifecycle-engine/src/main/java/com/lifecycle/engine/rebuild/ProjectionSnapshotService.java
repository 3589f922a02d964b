package com.lifecycle.engine.rebuild;

import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.model.ProjectionSnapshot;
import com.lifecycle.core.model.SnapshotComparison;
import com.lifecycle.core.model.TableSnapshot;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.snapshot.RowChecksum;
import com.lifecycle.core.snapshot.SnapshotComparator;
import com.lifecycle.engine.projection.ReadModelCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Takes row-count and checksum snapshots of read model tables.
 */
public class ProjectionSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(ProjectionSnapshotService.class);

    private final ReadModelStore readModelStore;
    private final ReadModelCatalog catalog;
    private final Clock clock;
    private final int sampleSize;

    public ProjectionSnapshotService(ReadModelStore readModelStore, ReadModelCatalog catalog,
                                     Clock clock, int sampleSize) {
        this.readModelStore = readModelStore;
        this.catalog = catalog;
        this.clock = clock;
        this.sampleSize = sampleSize;
    }

    /**
     * Snapshot the given tables, or every known table when none are given.
     * 
     * @throws NotFoundException if a table is not owned by any projector
     */
    public ProjectionSnapshot snapshot(Collection<String> tableNames) {
        Collection<String> names = tableNames == null || tableNames.isEmpty() ? catalog.tableNames() : tableNames;
        for (String name : names) {
            if (!catalog.contains(name)) {
                throw new NotFoundException("ReadModelTable", name);
            }
        }

        List<TableSnapshot> tables = new ArrayList<>();
        for (String name : names) {
            List<Map<String, Object>> rows = readModelStore.findAll(name);
            String checksum = RowChecksum.ofRows(rows);
            tables.add(new TableSnapshot(name, rows.size(), checksum, sample(rows)));
            log.debug("Snapshot of {}: {} rows, checksum {}", name, rows.size(), checksum);
        }
        return new ProjectionSnapshot(clock.instant(), tables);
    }

    public SnapshotComparison compare(ProjectionSnapshot before, ProjectionSnapshot after) {
        return SnapshotComparator.compare(before, after);
    }

    /**
     * The first rows in canonical order, so two snapshots of equal tables
     * carry equal samples.
     */
    private List<Map<String, Object>> sample(List<Map<String, Object>> rows) {
        if (sampleSize <= 0 || rows.isEmpty()) {
            return List.of();
        }
        return rows.stream()
            .map(RowChecksum::canonicalRow)
            .sorted(Comparator.comparing(RowChecksum::canonicalJson))
            .limit(sampleSize)
            .toList();
    }
}
