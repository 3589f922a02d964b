package com.lifecycle.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit entry for the one permitted change to a stored event:
 * replacing its payload on an erasure request.
 */
public record RedactionRecord(
    UUID redactionId,
    UUID eventId,
    String reason,
    ActorType actorType,
    String actorId,
    Instant redactedAt
) {}
