package com.lifecycle.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened to an aggregate.
 * 
 * Primary Key: eventId
 * Unique: (aggregateType, aggregateId, sequenceNumber)
 * Global order: globalSequence
 * 
 * Invariants:
 * - sequenceNumber starts at 1 and is contiguous within an aggregate stream
 * - globalSequence is strictly increasing across the whole log
 * - Events are never deleted or modified
 */
public record Event(
    // Primary key
    UUID eventId,
    
    // Global ordering for projector bookkeeping
    long globalSequence,
    
    // Stream identity and ordering
    String aggregateType,
    UUID aggregateId,
    long sequenceNumber,
    
    // Event data
    String eventType,
    JsonNode eventData,
    
    // Actor (who/what caused this event)
    ActorType actorType,
    String actorId,
    
    // Correlation, causation, request ids
    JsonNode metadata,
    
    Instant createdAt
) {

    /**
     * Copy whose data and metadata nodes are not shared with this event.
     * {@link JsonNode} payloads are mutable, so stores hand these out
     * instead of the instance they keep.
     */
    public Event detached() {
        return withPayload(copyOf(eventData), copyOf(metadata));
    }

    /**
     * Same identity, ordering and actor with a different payload.
     */
    public Event withPayload(JsonNode data, JsonNode meta) {
        return new Event(eventId, globalSequence, aggregateType, aggregateId, sequenceNumber,
            eventType, data, actorType, actorId, meta, createdAt);
    }

    /**
     * Check if this event belongs to the given aggregate stream.
     */
    public boolean belongsTo(String type, UUID id) {
        return aggregateType.equals(type) && aggregateId.equals(id);
    }

    /**
     * Read a text field from the event data, or null when absent.
     */
    public String dataText(String field) {
        JsonNode node = eventData == null ? null : eventData.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    /**
     * Read an integral field from the event data, or null when absent.
     */
    public Integer dataInt(String field) {
        JsonNode node = eventData == null ? null : eventData.get(field);
        return node == null || node.isNull() ? null : node.asInt();
    }

    /**
     * Read a UUID field from the event data, or null when absent.
     */
    public UUID dataUuid(String field) {
        String text = dataText(field);
        return text == null || text.isBlank() ? null : UUID.fromString(text);
    }

    private static JsonNode copyOf(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }

    /**
     * Short description for log lines.
     */
    public String describe() {
        return String.format("%s %s[%s]#%d (global %d)",
            eventType, aggregateType, aggregateId, sequenceNumber, globalSequence);
    }
}
