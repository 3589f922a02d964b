package com.lifecycle.engine.projection;

import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.projection.Projector;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.projection.ReadModelTable;
import com.lifecycle.core.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * The set of projectors known to this process, in registration order.
 * 
 * Validates that names are unique and that every table has exactly one owner,
 * and makes sure each projector has a checkpoint.
 */
public class ProjectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProjectorRegistry.class);

    private final Map<String, Projector> projectors = new LinkedHashMap<>();
    private final CheckpointRepository checkpointRepository;
    private final ReadModelCatalog catalog;

    public ProjectorRegistry(List<? extends Projector> projectors, CheckpointRepository checkpointRepository) {
        for (Projector projector : projectors) {
            ReadModelTable.requireIdentifier(projector.name());
            if (this.projectors.putIfAbsent(projector.name(), projector) != null) {
                throw new IllegalStateException("Duplicate projector name: " + projector.name());
            }
            if (projector.outputs().isEmpty()) {
                throw new IllegalStateException("Projector " + projector.name() + " owns no tables");
            }
        }
        this.catalog = new ReadModelCatalog(projectors);
        this.checkpointRepository = checkpointRepository;
    }

    /**
     * Create a checkpoint (cursor 0, ACTIVE) for every projector that has none.
     */
    public List<ProjectorCheckpoint> registerCheckpoints() {
        List<ProjectorCheckpoint> checkpoints = new ArrayList<>();
        for (Projector projector : projectors.values()) {
            ProjectorCheckpoint checkpoint = checkpointRepository.register(projector.name());
            log.info("Projector {} registered at cursor {} ({})",
                projector.name(), checkpoint.cursor(), checkpoint.status().value());
            checkpoints.add(checkpoint);
        }
        return checkpoints;
    }

    public Projector get(String projectorName) {
        Projector projector = projectors.get(projectorName);
        if (projector == null) {
            throw new NotFoundException("Projector", projectorName);
        }
        return projector;
    }

    public List<Projector> projectors() {
        return List.copyOf(projectors.values());
    }

    public List<String> names() {
        return List.copyOf(projectors.keySet());
    }

    public ReadModelCatalog catalog() {
        return catalog;
    }

    /**
     * The store handed to a projector's apply: writes limited to its own tables.
     */
    public ReadModelStore scopedStore(Projector projector, ReadModelStore store) {
        return new ScopedReadModelStore(projector.name(), Set.copyOf(projector.tableNames()), store);
    }
}
