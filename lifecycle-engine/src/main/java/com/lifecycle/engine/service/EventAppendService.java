package com.lifecycle.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.lifecycle.core.exception.AppendFailedException;
import com.lifecycle.core.exception.EventValidationException;
import com.lifecycle.core.exception.SequenceConflictException;
import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.NewEvent;
import com.lifecycle.core.model.RetryPolicy;
import com.lifecycle.core.repository.EventRepository;
import com.lifecycle.engine.logging.LoggingContext;
import com.lifecycle.engine.metrics.EventStoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Single entry point for writing to the event log.
 * 
 * Validates the request, then sequences and appends it. Sequence conflicts
 * on unpinned appends are retried with backoff; a conflict on a pinned
 * append goes straight back to the caller, who must re-read the stream.
 */
public class EventAppendService {

    private static final Logger log = LoggerFactory.getLogger(EventAppendService.class);

    private final EventRepository eventRepository;
    private final RetryPolicy retryPolicy;
    private final EventStoreMetrics metrics;
    private final Clock clock;

    public EventAppendService(EventRepository eventRepository, RetryPolicy retryPolicy,
                              EventStoreMetrics metrics, Clock clock) {
        this.eventRepository = eventRepository;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Append one event.
     * 
     * @param request The event to append
     * @return The stored event with its assigned sequence numbers
     * @throws EventValidationException if the request is malformed
     * @throws com.lifecycle.core.exception.InvalidActorException if the actor type is unknown
     * @throws SequenceConflictException if a pinned expected sequence is stale
     * @throws AppendFailedException if an unpinned append keeps conflicting
     */
    public Event append(AppendRequest request) {
        validate(request);
        ActorType actorType = ActorType.fromValue(request.actorType());

        NewEvent event = new NewEvent(
            request.aggregateType(),
            request.aggregateId(),
            request.eventType(),
            request.eventData(),
            actorType,
            request.actorId(),
            request.metadata() != null && !request.metadata().isNull()
                ? request.metadata()
                : JsonNodeFactory.instance.objectNode(),
            clock.instant()
        );
        boolean pinned = request.expectedSequence() != null;

        try (var ctx = LoggingContext.forAggregate(request.aggregateType(), request.aggregateId())) {
            int attempt = 1;
            while (true) {
                try {
                    Event stored = eventRepository.append(event, request.expectedSequence());
                    metrics.eventAppended(stored.aggregateType(), stored.eventType());
                    log.info("Appended {} as #{} (global {})",
                        stored.eventType(), stored.sequenceNumber(), stored.globalSequence());
                    return stored;
                } catch (SequenceConflictException e) {
                    metrics.appendConflict(request.aggregateType(), pinned);
                    if (pinned) {
                        log.info("Pinned sequence {} is stale", request.expectedSequence());
                        throw e;
                    }
                    if (!retryPolicy.hasMoreAttempts(attempt)) {
                        metrics.appendFailed(request.aggregateType());
                        log.error("Append failed after {} attempts", attempt);
                        throw new AppendFailedException(
                            request.aggregateType(), request.aggregateId(), attempt, e);
                    }
                    Duration backoff = retryPolicy.computeBackoff(attempt);
                    log.debug("Sequence conflict on attempt {}, retrying in {}ms", attempt, backoff.toMillis());
                    pause(backoff, request, attempt, e);
                    attempt++;
                }
            }
        }
    }

    private void pause(Duration backoff, AppendRequest request, int attempt, SequenceConflictException cause) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AppendFailedException(request.aggregateType(), request.aggregateId(), attempt, cause);
        }
    }

    private void validate(AppendRequest request) {
        List<String> errors = new ArrayList<>();
        if (request.aggregateType() == null || request.aggregateType().isBlank()) {
            errors.add("aggregateType is required");
        }
        if (request.aggregateId() == null) {
            errors.add("aggregateId is required");
        }
        if (request.eventType() == null || request.eventType().isBlank()) {
            errors.add("eventType is required");
        }
        if (request.eventData() == null || !request.eventData().isObject()) {
            errors.add("eventData must be a JSON object");
        }
        if (request.metadata() != null && !request.metadata().isNull() && !request.metadata().isObject()) {
            errors.add("metadata must be a JSON object");
        }
        if (request.expectedSequence() != null && request.expectedSequence() < 1) {
            errors.add("expectedSequence must be >= 1");
        }
        if (!errors.isEmpty()) {
            throw new EventValidationException(errors);
        }
    }

    /**
     * Request to append an event. actorType is the wire value and is parsed here.
     */
    public record AppendRequest(
        String aggregateType,
        UUID aggregateId,
        String eventType,
        JsonNode eventData,
        String actorType,
        String actorId,
        JsonNode metadata,
        Long expectedSequence
    ) {
        public AppendRequest withExpectedSequence(Long sequence) {
            return new AppendRequest(aggregateType, aggregateId, eventType, eventData,
                actorType, actorId, metadata, sequence);
        }
    }
}
