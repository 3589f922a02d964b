package com.lifecycle.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-projector cursor and status.
 * 
 * Primary Key: projectorName
 * 
 * Invariants:
 * - cursor is the global sequence of the last event processed (0 = none)
 * - cursor never moves backwards except through reset or rebuild
 */
public record ProjectorCheckpoint(
    String projectorName,
    long cursor,
    UUID lastEventId,
    ProjectorStatus status,
    long eventsProcessed,
    int errorCount,
    String lastError,
    UUID lastErrorEventId,
    Instant createdAt,
    Instant updatedAt
) {

    /**
     * Create a fresh checkpoint at registration time.
     */
    public static ProjectorCheckpoint initial(String projectorName, Instant now) {
        return new ProjectorCheckpoint(
            projectorName,
            0L,
            null,
            ProjectorStatus.ACTIVE,
            0L,
            0,
            null,
            null,
            now,
            now
        );
    }

    /**
     * Checkpoint after one more event has been processed.
     */
    public ProjectorCheckpoint advancedTo(long newCursor, UUID eventId, Instant now) {
        return new ProjectorCheckpoint(
            projectorName, newCursor, eventId, status,
            eventsProcessed + 1, errorCount, lastError, lastErrorEventId,
            createdAt, now
        );
    }

    /**
     * Checkpoint frozen on a failing event.
     */
    public ProjectorCheckpoint failedAt(UUID eventId, String error, Instant now) {
        return new ProjectorCheckpoint(
            projectorName, cursor, lastEventId, ProjectorStatus.ERROR,
            eventsProcessed, errorCount + 1, error, eventId,
            createdAt, now
        );
    }

    public ProjectorCheckpoint withStatus(ProjectorStatus newStatus, Instant now) {
        return new ProjectorCheckpoint(
            projectorName, cursor, lastEventId, newStatus,
            eventsProcessed, errorCount, lastError, lastErrorEventId,
            createdAt, now
        );
    }

    /**
     * Checkpoint rewound to the start of the log with errors cleared.
     */
    public ProjectorCheckpoint rewound(ProjectorStatus newStatus, Instant now) {
        return new ProjectorCheckpoint(
            projectorName, 0L, null, newStatus,
            0L, 0, null, null,
            createdAt, now
        );
    }

    /**
     * Number of events in the log this projector has not yet seen.
     */
    public long lag(long headGlobalSequence) {
        return Math.max(0L, headGlobalSequence - cursor);
    }
}
