package com.lifecycle.core.snapshot;

import com.lifecycle.core.model.ProjectionSnapshot;
import com.lifecycle.core.model.SnapshotComparison;
import com.lifecycle.core.model.TableSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Snapshot comparison")
class SnapshotComparatorTest {

    @Test
    @DisplayName("A snapshot compared with itself is equal")
    void identicalSnapshotsAreEqual() {
        ProjectionSnapshot snapshot = snapshot(
            TableSnapshot.of("tableA", 10, "abc123"),
            TableSnapshot.of("tableB", 0, "e3b0c4"));

        SnapshotComparison comparison = SnapshotComparator.compare(snapshot, snapshot);

        assertThat(comparison.equal()).isTrue();
        assertThat(comparison.differences()).isEmpty();
    }

    @Test
    @DisplayName("Row count mismatch with equal checksum reports only the row count")
    void rowCountMismatchOnly() {
        SnapshotComparison comparison = SnapshotComparator.compare(
            snapshot(TableSnapshot.of("tableA", 10, "abc")),
            snapshot(TableSnapshot.of("tableA", 15, "abc")));

        assertThat(comparison.equal()).isFalse();
        assertThat(comparison.differences()).hasSize(1);
        assertThat(comparison.differences().get(0))
            .contains("tableA")
            .contains("row count")
            .doesNotContain("checksum");
    }

    @Test
    @DisplayName("Checksum mismatch with equal row count reports only the checksum")
    void checksumMismatchOnly() {
        SnapshotComparison comparison = SnapshotComparator.compare(
            snapshot(TableSnapshot.of("tableA", 10, "abc123")),
            snapshot(TableSnapshot.of("tableA", 10, "def456")));

        assertThat(comparison.equal()).isFalse();
        assertThat(comparison.differences()).hasSize(1);
        assertThat(comparison.differences().get(0))
            .contains("tableA")
            .contains("checksum")
            .doesNotContain("row count");
    }

    @Test
    @DisplayName("Row count and checksum mismatches are reported separately")
    void bothMismatchesReportedSeparately() {
        SnapshotComparison comparison = SnapshotComparator.compare(
            snapshot(TableSnapshot.of("tableA", 10, "abc")),
            snapshot(TableSnapshot.of("tableA", 11, "def")));

        assertThat(comparison.differences()).hasSize(2);
        assertThat(comparison.differences()).anyMatch(d -> d.contains("row count"));
        assertThat(comparison.differences()).anyMatch(d -> d.contains("checksum"));
    }

    @Test
    @DisplayName("Disjoint tables are reported as missing, not as mismatches")
    void missingTablesReported() {
        SnapshotComparison comparison = SnapshotComparator.compare(
            snapshot(TableSnapshot.of("tableA", 10, "abc"), TableSnapshot.of("tableB", 3, "bbb")),
            snapshot(TableSnapshot.of("tableA", 10, "abc"), TableSnapshot.of("tableC", 3, "ccc")));

        assertThat(comparison.equal()).isFalse();
        assertThat(comparison.differences()).containsExactly(
            "Table tableB: missing from after snapshot",
            "Table tableC: missing from before snapshot");
        assertThat(comparison.differences())
            .noneMatch(d -> d.contains("row count") || d.contains("checksum"));
    }

    private static ProjectionSnapshot snapshot(TableSnapshot... tables) {
        return new ProjectionSnapshot(Instant.parse("2026-01-07T10:00:00Z"), List.of(tables));
    }
}
