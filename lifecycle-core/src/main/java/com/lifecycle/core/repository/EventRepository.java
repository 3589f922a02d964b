package com.lifecycle.core.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.NewEvent;
import com.lifecycle.core.model.RedactionRecord;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Repository for Event persistence.
 * Events are append-only and immutable; implementations must reject
 * updates and deletes at the storage layer itself.
 */
public interface EventRepository {

    /**
     * Compute the next sequence number for an aggregate stream.
     * 
     * @param aggregateType The aggregate type
     * @param aggregateId The aggregate ID
     * @return 1 if the stream is empty, else max(sequenceNumber) + 1
     */
    long nextSequence(String aggregateType, UUID aggregateId);

    /**
     * Sequence and append a new event in one atomic unit.
     * 
     * @param event The validated event
     * @param expectedSequence Sequence number the caller read, or null to let the store allocate
     * @return The stored event with its assigned positions
     * @throws com.lifecycle.core.exception.SequenceConflictException if the sequence is taken
     *         or does not match the caller's expectation
     */
    Event append(NewEvent event, Long expectedSequence);

    /**
     * Find an event by ID.
     * 
     * @param eventId The event ID
     * @return The event if found
     */
    Optional<Event> findById(UUID eventId);

    /**
     * Get all events for an aggregate in sequence order.
     * 
     * @param aggregateType The aggregate type
     * @param aggregateId The aggregate ID
     * @return All events ordered by sequence number
     */
    List<Event> findByAggregate(String aggregateType, UUID aggregateId);

    /**
     * Get events for an aggregate starting from a sequence number.
     * 
     * @param aggregateType The aggregate type
     * @param aggregateId The aggregate ID
     * @param fromSequence Start sequence number (inclusive)
     * @return Events from the given sequence number
     */
    List<Event> findByAggregateFrom(String aggregateType, UUID aggregateId, long fromSequence);

    /**
     * Get events after a global sequence, in global order.
     * 
     * @param afterGlobalSequence Exclusive lower bound
     * @param aggregateTypes Aggregate types to include (empty = all)
     * @param limit Maximum number of results
     * @return Matching events ordered by global sequence
     */
    List<Event> findAfter(long afterGlobalSequence, Set<String> aggregateTypes, int limit);

    /**
     * Highest global sequence in the log, 0 when empty.
     */
    long headGlobalSequence();

    /**
     * Total number of events in the log.
     */
    long count();

    /**
     * Replace an event's payload under an erasure request and record the audit entry
     * in the same atomic unit. The only mutation the store permits.
     * 
     * @param eventId The event to redact
     * @param redactedData Replacement event data
     * @param redactedMetadata Replacement metadata
     * @param record Audit entry
     */
    void redact(UUID eventId, JsonNode redactedData, JsonNode redactedMetadata, RedactionRecord record);

    /**
     * Get the redaction audit entries for an event.
     */
    List<RedactionRecord> findRedactions(UUID eventId);
}
