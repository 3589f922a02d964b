package com.lifecycle.api.rest;

import com.lifecycle.core.model.ProjectionSnapshot;
import com.lifecycle.core.model.SnapshotComparison;
import com.lifecycle.engine.rebuild.ProjectionSnapshotService;
import com.lifecycle.engine.rebuild.ProjectionVerifier;
import com.lifecycle.engine.rebuild.VerificationReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for read model snapshots and rebuild verification.
 */
@RestController
@RequestMapping("/api/v1/snapshots")
public class SnapshotController {

    private final ProjectionSnapshotService snapshotService;
    private final ProjectionVerifier verifier;

    public SnapshotController(ProjectionSnapshotService snapshotService, ProjectionVerifier verifier) {
        this.snapshotService = snapshotService;
        this.verifier = verifier;
    }

    /**
     * Row count and checksum of the given tables, or of all tables.
     */
    @PostMapping
    public ResponseEntity<ProjectionSnapshot> snapshot(@RequestBody(required = false) SnapshotRequest request) {
        List<String> tables = request != null && request.tables() != null ? request.tables() : List.of();
        return ResponseEntity.ok(snapshotService.snapshot(tables));
    }

    @PostMapping("/compare")
    public ResponseEntity<SnapshotComparison> compare(@RequestBody CompareRequest request) {
        return ResponseEntity.ok(snapshotService.compare(request.before(), request.after()));
    }

    /**
     * Snapshot, rebuild, snapshot and compare. Responds 422 when the rebuilt
     * tables differ from the live ones; {@code mode=determinism} rebuilds
     * twice instead.
     */
    @PostMapping("/verify")
    public ResponseEntity<VerificationReport> verify(
            @RequestParam(defaultValue = "rebuild") String mode,
            @RequestBody(required = false) VerifyRequest request) {

        List<String> projectors = request != null && request.projectors() != null ? request.projectors() : List.of();
        VerificationReport report = "determinism".equalsIgnoreCase(mode)
            ? verifier.verifyDeterminism(projectors)
            : verifier.verify(projectors);
        return ResponseEntity.ok(report.requireEqual());
    }

    // ========== DTOs ==========

    public record SnapshotRequest(List<String> tables) {}

    public record CompareRequest(ProjectionSnapshot before, ProjectionSnapshot after) {}

    public record VerifyRequest(List<String> projectors) {}
}
