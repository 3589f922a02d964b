package com.lifecycle.engine.persistence;

import com.lifecycle.core.exception.CheckpointConflictException;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.model.ProjectorStatus;
import com.lifecycle.core.repository.CheckpointRepository;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of CheckpointRepository.
 * Compare-and-set is done inside {@link ConcurrentMap#compute}.
 */
public class InMemoryCheckpointRepository implements CheckpointRepository {

    private final ConcurrentMap<String, ProjectorCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCheckpointRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryCheckpointRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ProjectorCheckpoint register(String projectorName) {
        return checkpoints.computeIfAbsent(projectorName,
            name -> ProjectorCheckpoint.initial(name, clock.instant()));
    }

    @Override
    public Optional<ProjectorCheckpoint> findByName(String projectorName) {
        return Optional.ofNullable(checkpoints.get(projectorName));
    }

    @Override
    public List<ProjectorCheckpoint> findAll() {
        return checkpoints.values().stream()
            .sorted(Comparator.comparing(ProjectorCheckpoint::projectorName))
            .toList();
    }

    @Override
    public void advance(String projectorName, long expectedCursor, ProjectorStatus expectedStatus,
                        long newCursor, UUID eventId) {
        checkpoints.compute(projectorName, (name, current) -> {
            if (current == null) {
                throw new NotFoundException("ProjectorCheckpoint", name);
            }
            if (current.cursor() != expectedCursor || current.status() != expectedStatus) {
                throw new CheckpointConflictException(name, expectedCursor);
            }
            return current.advancedTo(newCursor, eventId, clock.instant());
        });
    }

    @Override
    public void markError(String projectorName, UUID eventId, String error) {
        checkpoints.compute(projectorName, (name, current) -> {
            if (current == null) {
                throw new NotFoundException("ProjectorCheckpoint", name);
            }
            return current.failedAt(eventId, error, clock.instant());
        });
    }

    @Override
    public ProjectorCheckpoint updateStatus(String projectorName, ProjectorStatus expected, ProjectorStatus target) {
        return checkpoints.compute(projectorName, (name, current) -> {
            if (current == null) {
                throw new NotFoundException("ProjectorCheckpoint", name);
            }
            if (current.status() != expected) {
                throw new CheckpointConflictException(name, current.cursor());
            }
            return current.withStatus(target, clock.instant());
        });
    }

    @Override
    public ProjectorCheckpoint rewind(String projectorName, ProjectorStatus expected, ProjectorStatus target) {
        return checkpoints.compute(projectorName, (name, current) -> {
            if (current == null) {
                throw new NotFoundException("ProjectorCheckpoint", name);
            }
            if (current.status() != expected) {
                throw new CheckpointConflictException(name, current.cursor());
            }
            return current.rewound(target, clock.instant());
        });
    }
}
