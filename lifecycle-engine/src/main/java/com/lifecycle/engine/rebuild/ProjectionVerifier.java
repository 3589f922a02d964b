package com.lifecycle.engine.rebuild;

import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.ProjectionSnapshot;
import com.lifecycle.core.model.RebuildRecord;
import com.lifecycle.core.model.RebuildStatus;
import com.lifecycle.core.projection.Projector;
import com.lifecycle.engine.projection.ProjectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Proves projections are a function of the log: replays projectors and
 * checks their tables come out the same. Differences are reported, never
 * repaired.
 */
public class ProjectionVerifier {

    private static final Logger log = LoggerFactory.getLogger(ProjectionVerifier.class);

    private static final String VERIFIER_ACTOR = "projection-verifier";

    private final ProjectorRegistry registry;
    private final RebuildService rebuildService;
    private final ProjectionSnapshotService snapshotService;

    public ProjectionVerifier(ProjectorRegistry registry, RebuildService rebuildService,
                              ProjectionSnapshotService snapshotService) {
        this.registry = registry;
        this.rebuildService = rebuildService;
        this.snapshotService = snapshotService;
    }

    /**
     * Snapshot the live tables, rebuild, snapshot again and compare.
     * 
     * @param projectorNames Projectors to verify; all when empty
     */
    public VerificationReport verify(List<String> projectorNames) {
        List<Projector> projectors = resolve(projectorNames);
        List<String> tables = tables(projectors);

        ProjectionSnapshot before = snapshotService.snapshot(tables);
        List<RebuildRecord> rebuilds = rebuildEach(projectors);
        ProjectionSnapshot after = snapshotService.snapshot(tables);

        return report(projectors, before, after, rebuilds, "Rebuild verification");
    }

    /**
     * Rebuild twice from the same log and compare the two results.
     * 
     * @param projectorNames Projectors to verify; all when empty
     */
    public VerificationReport verifyDeterminism(List<String> projectorNames) {
        List<Projector> projectors = resolve(projectorNames);
        List<String> tables = tables(projectors);

        List<RebuildRecord> rebuilds = new ArrayList<>(rebuildEach(projectors));
        ProjectionSnapshot first = snapshotService.snapshot(tables);
        rebuilds.addAll(rebuildEach(projectors));
        ProjectionSnapshot second = snapshotService.snapshot(tables);

        return report(projectors, first, second, rebuilds, "Determinism check");
    }

    private VerificationReport report(List<Projector> projectors, ProjectionSnapshot before,
                                      ProjectionSnapshot after, List<RebuildRecord> rebuilds, String label) {
        List<String> differences = new ArrayList<>();
        for (RebuildRecord record : rebuilds) {
            if (record.status() != RebuildStatus.COMPLETED) {
                differences.add(String.format("Rebuild of %s ended %s: %s",
                    record.projectorName(), record.status(), record.error()));
            }
        }
        differences.addAll(snapshotService.compare(before, after).differences());

        List<String> names = projectors.stream().map(Projector::name).toList();
        if (differences.isEmpty()) {
            log.info("{} passed for {}", label, names);
        } else {
            log.error("{} found {} differences for {}: {}", label, differences.size(), names, differences);
        }
        return new VerificationReport(names, before, after, rebuilds, differences);
    }

    private List<RebuildRecord> rebuildEach(List<Projector> projectors) {
        List<String> names = projectors.stream().map(Projector::name).toList();
        return rebuildService.rebuildEach(names, ActorType.SYSTEM, VERIFIER_ACTOR);
    }

    private List<Projector> resolve(List<String> projectorNames) {
        if (projectorNames == null || projectorNames.isEmpty()) {
            return registry.projectors();
        }
        return projectorNames.stream().map(registry::get).toList();
    }

    private static List<String> tables(List<Projector> projectors) {
        return projectors.stream().flatMap(p -> p.tableNames().stream()).toList();
    }
}
