package com.lifecycle.engine.rebuild;

import com.lifecycle.core.exception.RebuildVerificationMismatchException;
import com.lifecycle.core.model.ProjectionSnapshot;
import com.lifecycle.core.model.RebuildRecord;

import java.util.List;

/**
 * Outcome of replaying projectors and comparing their tables.
 * 
 * @param projectors Projectors that were rebuilt
 * @param before Snapshot taken before the (first) rebuild
 * @param after Snapshot taken after the (last) rebuild
 * @param rebuilds Audit records of every rebuild run
 * @param differences Per-table differences, plus any rebuild that did not complete
 */
public record VerificationReport(
    List<String> projectors,
    ProjectionSnapshot before,
    ProjectionSnapshot after,
    List<RebuildRecord> rebuilds,
    List<String> differences
) {

    public VerificationReport {
        projectors = List.copyOf(projectors);
        rebuilds = List.copyOf(rebuilds);
        differences = List.copyOf(differences);
    }

    public boolean equal() {
        return differences.isEmpty();
    }

    /**
     * @throws RebuildVerificationMismatchException if the replay did not reproduce the tables
     */
    public VerificationReport requireEqual() {
        if (!equal()) {
            throw new RebuildVerificationMismatchException(differences);
        }
        return this;
    }
}
