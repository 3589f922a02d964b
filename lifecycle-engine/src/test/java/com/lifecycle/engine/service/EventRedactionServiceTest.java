package com.lifecycle.engine.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.lifecycle.core.exception.EventValidationException;
import com.lifecycle.core.exception.InvalidActorException;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.RedactionRecord;
import com.lifecycle.core.model.RetryPolicy;
import com.lifecycle.engine.metrics.EventStoreMetrics;
import com.lifecycle.engine.persistence.InMemoryEventRepository;
import com.lifecycle.engine.service.EventAppendService.AppendRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Event redaction service")
class EventRedactionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryEventRepository repository;
    private EventRedactionService redactions;
    private Event event;

    @BeforeEach
    void setUp() {
        repository = new InMemoryEventRepository();
        EventStoreMetrics metrics = new EventStoreMetrics();
        redactions = new EventRedactionService(repository, metrics, CLOCK);
        EventAppendService appender = new EventAppendService(repository,
            RetryPolicy.noRetry(), metrics, CLOCK);
        event = appender.append(new AppendRequest("support_case", UUID.randomUUID(), "SupportCaseCreated",
            JsonNodeFactory.instance.objectNode().put("title", "Customer email: jane@example.com"),
            "user", "agent-1",
            JsonNodeFactory.instance.objectNode().put("requestId", "r-1"), null));
    }

    @Test
    @DisplayName("Redaction blanks the payload and writes an audit record")
    void testRedactReplacesPayload() {
        RedactionRecord record = redactions.redact(event.eventId(), "erasure request", "user", "dpo-1");

        Event stored = repository.findById(event.eventId()).orElseThrow();
        assertThat(stored.eventData().toString()).isEqualTo("{\"redacted\":true}");
        assertThat(stored.metadata().size()).isZero();
        assertThat(stored.sequenceNumber()).isEqualTo(event.sequenceNumber());
        assertThat(record.actorType()).isEqualTo(ActorType.USER);
        assertThat(record.redactedAt()).isEqualTo(CLOCK.instant());
        assertThat(redactions.history(event.eventId())).containsExactly(record);
    }

    @Test
    @DisplayName("A reason is required")
    void testReasonRequired() {
        assertThatThrownBy(() -> redactions.redact(event.eventId(), " ", "user", "dpo-1"))
            .isInstanceOf(EventValidationException.class);
        assertThat(redactions.history(event.eventId())).isEmpty();
    }

    @Test
    @DisplayName("Unknown actors and events are rejected")
    void testUnknownActorOrEvent() {
        assertThatThrownBy(() -> redactions.redact(event.eventId(), "reason", "intern", "x"))
            .isInstanceOf(InvalidActorException.class);
        assertThatThrownBy(() -> redactions.redact(UUID.randomUUID(), "reason", "user", "x"))
            .isInstanceOf(NotFoundException.class);
    }
}
