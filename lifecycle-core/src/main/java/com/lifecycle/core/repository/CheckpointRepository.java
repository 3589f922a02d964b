package com.lifecycle.core.repository;

import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.model.ProjectorStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for projector checkpoints.
 * All mutations are compare-and-set on the current cursor or status.
 */
public interface CheckpointRepository {

    /**
     * Create the checkpoint for a projector if it does not exist.
     * 
     * @param projectorName The projector name
     * @return The existing or newly created checkpoint
     */
    ProjectorCheckpoint register(String projectorName);

    Optional<ProjectorCheckpoint> findByName(String projectorName);

    /**
     * All checkpoints ordered by projector name.
     */
    List<ProjectorCheckpoint> findAll();

    /**
     * Move the cursor forward past one processed event.
     * 
     * @param projectorName The projector name
     * @param expectedCursor Cursor the dispatcher read before processing
     * @param expectedStatus Status the dispatcher is running under
     * @param newCursor Global sequence of the processed event
     * @param eventId ID of the processed event
     * @throws com.lifecycle.core.exception.CheckpointConflictException if cursor or status moved
     */
    void advance(String projectorName, long expectedCursor, ProjectorStatus expectedStatus,
                 long newCursor, UUID eventId);

    /**
     * Freeze the checkpoint in ERROR, recording the failing event.
     */
    void markError(String projectorName, UUID eventId, String error);

    /**
     * Change status if the checkpoint is currently in the expected status.
     * 
     * @return The updated checkpoint
     * @throws com.lifecycle.core.exception.CheckpointConflictException if the status moved
     */
    ProjectorCheckpoint updateStatus(String projectorName, ProjectorStatus expected, ProjectorStatus target);

    /**
     * Rewind the cursor to 0, clear errors and set the target status,
     * if the checkpoint is currently in the expected status.
     * 
     * @return The updated checkpoint
     * @throws com.lifecycle.core.exception.CheckpointConflictException if the status moved
     */
    ProjectorCheckpoint rewind(String projectorName, ProjectorStatus expected, ProjectorStatus target);
}
