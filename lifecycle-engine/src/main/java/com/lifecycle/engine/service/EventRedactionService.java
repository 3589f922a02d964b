package com.lifecycle.engine.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lifecycle.core.exception.EventValidationException;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.RedactionRecord;
import com.lifecycle.core.repository.EventRepository;
import com.lifecycle.engine.logging.LoggingContext;
import com.lifecycle.engine.metrics.EventStoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Audited erasure of an event's payload.
 * 
 * The event keeps its identity, position and actor; eventData becomes
 * {"redacted": true} and metadata becomes {}. Read models built from the
 * original payload keep it until the owning projectors are rebuilt.
 */
public class EventRedactionService {

    private static final Logger log = LoggerFactory.getLogger(EventRedactionService.class);

    private final EventRepository eventRepository;
    private final EventStoreMetrics metrics;
    private final Clock clock;

    public EventRedactionService(EventRepository eventRepository, EventStoreMetrics metrics, Clock clock) {
        this.eventRepository = eventRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    public RedactionRecord redact(UUID eventId, String reason, String actorType, String actorId) {
        if (reason == null || reason.isBlank()) {
            throw new EventValidationException(List.of("reason is required"));
        }
        ActorType actor = ActorType.fromValue(actorType);
        Event event = eventRepository.findById(eventId)
            .orElseThrow(() -> new NotFoundException("Event", eventId.toString()));

        ObjectNode redactedData = JsonNodeFactory.instance.objectNode().put("redacted", true);
        RedactionRecord record = new RedactionRecord(
            UUID.randomUUID(), eventId, reason, actor, actorId, clock.instant());

        try (var ctx = LoggingContext.forAggregate(event.aggregateType(), event.aggregateId())) {
            eventRepository.redact(eventId, redactedData, JsonNodeFactory.instance.objectNode(), record);
            metrics.eventRedacted(event.aggregateType());
            log.warn("Redacted payload of event {} ({}) by {}:{}: {}",
                eventId, event.describe(), actor.value(), actorId, reason);
        }
        return record;
    }

    public List<RedactionRecord> history(UUID eventId) {
        return eventRepository.findRedactions(eventId);
    }
}
