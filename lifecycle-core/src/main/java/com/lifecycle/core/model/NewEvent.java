package com.lifecycle.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * A validated event that has not been sequenced or stored yet.
 * The store assigns eventId, sequenceNumber and globalSequence.
 */
public record NewEvent(
    String aggregateType,
    UUID aggregateId,
    String eventType,
    JsonNode eventData,
    ActorType actorType,
    String actorId,
    JsonNode metadata,
    Instant createdAt
) {

    /**
     * Materialize the stored event once the store has assigned its positions.
     */
    public Event toEvent(UUID eventId, long globalSequence, long sequenceNumber) {
        return new Event(
            eventId,
            globalSequence,
            aggregateType,
            aggregateId,
            sequenceNumber,
            eventType,
            eventData,
            actorType,
            actorId,
            metadata,
            createdAt
        );
    }
}
