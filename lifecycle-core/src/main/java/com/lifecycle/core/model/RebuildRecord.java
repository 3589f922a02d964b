package com.lifecycle.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit entry for one rebuild run.
 */
public record RebuildRecord(
    UUID rebuildId,
    String projectorName,
    RebuildStatus status,
    ActorType actorType,
    String actorId,
    Instant startedAt,
    Instant completedAt,
    long eventsReplayed,
    String error
) {

    public static final String ALL_PROJECTORS = "ALL";

    public static RebuildRecord started(String projectorName, ActorType actorType, String actorId, Instant now) {
        return new RebuildRecord(
            UUID.randomUUID(),
            projectorName,
            RebuildStatus.RUNNING,
            actorType,
            actorId,
            now,
            null,
            0L,
            null
        );
    }

    public RebuildRecord finished(RebuildStatus outcome, long replayed, String failure, Instant now) {
        return new RebuildRecord(
            rebuildId, projectorName, outcome, actorType, actorId,
            startedAt, now, replayed, failure
        );
    }
}
