package com.lifecycle.engine.projection;

import com.lifecycle.core.exception.InvalidStateTransitionException;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.model.ProjectorStatus;
import com.lifecycle.core.repository.CheckpointRepository;
import com.lifecycle.core.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Operator actions on projector checkpoints: pause, resume, reset, and
 * the read side (status plus lag).
 */
public class CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    private final ProjectorRegistry registry;
    private final CheckpointRepository checkpointRepository;
    private final EventRepository eventRepository;
    private final ProjectorLocks locks;

    public CheckpointService(ProjectorRegistry registry, CheckpointRepository checkpointRepository,
                             EventRepository eventRepository, ProjectorLocks locks) {
        this.registry = registry;
        this.checkpointRepository = checkpointRepository;
        this.eventRepository = eventRepository;
        this.locks = locks;
    }

    public List<ProjectorState> list() {
        long head = eventRepository.headGlobalSequence();
        return checkpointRepository.findAll().stream()
            .map(checkpoint -> ProjectorState.of(checkpoint, head))
            .toList();
    }

    public ProjectorState get(String projectorName) {
        return ProjectorState.of(find(projectorName), eventRepository.headGlobalSequence());
    }

    /**
     * ACTIVE -> PAUSED. A running dispatch stops at its next checkpoint advance.
     */
    public ProjectorCheckpoint pause(String projectorName) {
        ProjectorCheckpoint updated = transition(projectorName, ProjectorStatus.ACTIVE, ProjectorStatus.PAUSED);
        log.info("Projector {} paused at cursor {}", projectorName, updated.cursor());
        return updated;
    }

    /**
     * PAUSED -> ACTIVE.
     */
    public ProjectorCheckpoint resume(String projectorName) {
        ProjectorCheckpoint updated = transition(projectorName, ProjectorStatus.PAUSED, ProjectorStatus.ACTIVE);
        log.info("Projector {} resumed at cursor {}", projectorName, updated.cursor());
        return updated;
    }

    /**
     * Rewind to cursor 0 and clear the recorded error. The owned tables are
     * not cleared; projectors skip rows they already hold, so a reset replays
     * the log over the existing rows. Not allowed while a rebuild holds the
     * projector.
     */
    public ProjectorCheckpoint reset(String projectorName) {
        registry.get(projectorName);
        ReentrantLock lock = locks.lockFor(projectorName);
        lock.lock();
        try {
            ProjectorCheckpoint current = find(projectorName);
            if (current.status() == ProjectorStatus.REBUILDING) {
                throw new InvalidStateTransitionException(projectorName, current.status(), ProjectorStatus.ACTIVE);
            }
            ProjectorCheckpoint updated = checkpointRepository.rewind(projectorName, current.status(), ProjectorStatus.ACTIVE);
            log.warn("Projector {} reset from {} at cursor {} (errors: {})",
                projectorName, current.status().value(), current.cursor(), current.errorCount());
            return updated;
        } finally {
            lock.unlock();
        }
    }

    private ProjectorCheckpoint transition(String projectorName, ProjectorStatus expected, ProjectorStatus target) {
        registry.get(projectorName);
        ProjectorCheckpoint current = find(projectorName);
        if (current.status() != expected || !current.status().canTransitionTo(target)) {
            throw new InvalidStateTransitionException(projectorName, current.status(), target);
        }
        return checkpointRepository.updateStatus(projectorName, expected, target);
    }

    private ProjectorCheckpoint find(String projectorName) {
        return checkpointRepository.findByName(projectorName)
            .orElseThrow(() -> new NotFoundException("ProjectorCheckpoint", projectorName));
    }
}
