package com.lifecycle.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.RedactionRecord;
import com.lifecycle.core.repository.EventRepository;
import com.lifecycle.engine.service.EventAppendService;
import com.lifecycle.engine.service.EventAppendService.AppendRequest;
import com.lifecycle.engine.service.EventRedactionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for appending and reading events.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventAppendService appendService;
    private final EventRedactionService redactionService;
    private final EventRepository eventRepository;

    public EventController(EventAppendService appendService, EventRedactionService redactionService,
                           EventRepository eventRepository) {
        this.appendService = appendService;
        this.redactionService = redactionService;
        this.eventRepository = eventRepository;
    }

    /**
     * Append one event to its aggregate stream.
     */
    @PostMapping
    public ResponseEntity<AppendResponse> append(@RequestBody AppendEventRequest request) {
        Event event = appendService.append(new AppendRequest(
            request.aggregateType(),
            request.aggregateId(),
            request.eventType(),
            request.eventData(),
            request.actorType(),
            request.actorId(),
            request.metadata(),
            request.expectedSequence()
        ));

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new AppendResponse(event.eventId(), event.sequenceNumber(), event.globalSequence()));
    }

    /**
     * Read one aggregate stream in sequence order.
     */
    @GetMapping("/{aggregateType}/{aggregateId}")
    public ResponseEntity<List<EventResponse>> getStream(
            @PathVariable String aggregateType,
            @PathVariable UUID aggregateId,
            @RequestParam(defaultValue = "1") long fromSequence) {

        List<EventResponse> events = eventRepository.findByAggregateFrom(aggregateType, aggregateId, fromSequence)
            .stream()
            .map(EventResponse::from)
            .toList();

        return ResponseEntity.ok(events);
    }

    /**
     * Replace an event's payload on an erasure request.
     */
    @PostMapping("/{eventId}/redact")
    public ResponseEntity<RedactionResponse> redact(
            @PathVariable UUID eventId,
            @RequestBody RedactRequest request) {

        RedactionRecord record = redactionService.redact(
            eventId, request.reason(), request.actorType(), request.actorId());
        return ResponseEntity.ok(RedactionResponse.from(record));
    }

    @GetMapping("/{eventId}/redactions")
    public ResponseEntity<List<RedactionResponse>> getRedactions(@PathVariable UUID eventId) {
        List<RedactionResponse> redactions = redactionService.history(eventId).stream()
            .map(RedactionResponse::from)
            .toList();
        return ResponseEntity.ok(redactions);
    }

    // ========== DTOs ==========

    public record AppendEventRequest(
        String aggregateType,
        UUID aggregateId,
        String eventType,
        JsonNode eventData,
        String actorType,
        String actorId,
        JsonNode metadata,
        Long expectedSequence
    ) {}

    public record AppendResponse(
        UUID eventId,
        long sequenceNumber,
        long globalSequence
    ) {}

    public record RedactRequest(
        String reason,
        String actorType,
        String actorId
    ) {}

    public record EventResponse(
        UUID eventId,
        long globalSequence,
        String aggregateType,
        UUID aggregateId,
        long sequenceNumber,
        String eventType,
        JsonNode eventData,
        String actorType,
        String actorId,
        JsonNode metadata,
        Instant createdAt
    ) {
        public static EventResponse from(Event event) {
            return new EventResponse(
                event.eventId(),
                event.globalSequence(),
                event.aggregateType(),
                event.aggregateId(),
                event.sequenceNumber(),
                event.eventType(),
                event.eventData(),
                event.actorType().value(),
                event.actorId(),
                event.metadata(),
                event.createdAt()
            );
        }
    }

    public record RedactionResponse(
        UUID redactionId,
        UUID eventId,
        String reason,
        String actorType,
        String actorId,
        Instant redactedAt
    ) {
        public static RedactionResponse from(RedactionRecord record) {
            return new RedactionResponse(
                record.redactionId(),
                record.eventId(),
                record.reason(),
                record.actorType().value(),
                record.actorId(),
                record.redactedAt()
            );
        }
    }
}
