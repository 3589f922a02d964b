package com.lifecycle.engine.persistence;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.lifecycle.core.exception.ImmutableRecordException;
import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Append-only event log")
class AppendOnlyEventLogTest {

    private AppendOnlyEventLog log;
    private Event first;

    @BeforeEach
    void setUp() {
        log = new AppendOnlyEventLog();
        first = event(1, "created");
        log.add(first);
        log.add(event(2, "assigned"));
    }

    @Test
    @DisplayName("Appending at the tail is the only accepted write")
    void testAppendAtTail() {
        log.add(log.size(), event(3, "closed"));

        assertThat(log).hasSize(3);
        assertThatThrownBy(() -> log.add(0, event(4, "inserted")))
            .isInstanceOf(ImmutableRecordException.class)
            .hasMessageContaining("insert");
    }

    @Test
    @DisplayName("Every update and delete path is rejected")
    void testMutationsRejected() {
        assertThatThrownBy(() -> log.set(0, first)).isInstanceOf(ImmutableRecordException.class);
        assertThatThrownBy(() -> log.remove(0)).isInstanceOf(ImmutableRecordException.class);
        assertThatThrownBy(() -> log.remove(first)).isInstanceOf(ImmutableRecordException.class);
        assertThatThrownBy(() -> log.removeAll(List.of(first))).isInstanceOf(ImmutableRecordException.class);
        assertThatThrownBy(() -> log.retainAll(List.of())).isInstanceOf(ImmutableRecordException.class);
        assertThatThrownBy(() -> log.removeIf(e -> true)).isInstanceOf(ImmutableRecordException.class);
        assertThatThrownBy(() -> log.replaceAll(e -> e)).isInstanceOf(ImmutableRecordException.class);
        assertThatThrownBy(() -> log.clear()).isInstanceOf(ImmutableRecordException.class);
        assertThatThrownBy(() -> log.subList(0, 1).clear()).isInstanceOf(ImmutableRecordException.class);

        assertThat(log).hasSize(2);
        assertThat(log.get(0)).isSameAs(first);
    }

    @Test
    @DisplayName("Deleting through an iterator is rejected")
    void testIteratorRemoveRejected() {
        Iterator<Event> iterator = log.iterator();
        iterator.next();

        assertThatThrownBy(iterator::remove).isInstanceOf(ImmutableRecordException.class);
    }

    @Test
    @DisplayName("Redaction may only change the payload")
    void testRedactionCannotChangeIdentity() {
        Event payloadOnly = new Event(first.eventId(), first.globalSequence(), first.aggregateType(),
            first.aggregateId(), first.sequenceNumber(), first.eventType(),
            JsonNodeFactory.instance.objectNode().put("redacted", true), first.actorType(), first.actorId(),
            JsonNodeFactory.instance.objectNode(), first.createdAt());
        Event resequenced = new Event(first.eventId(), 99L, first.aggregateType(),
            first.aggregateId(), first.sequenceNumber(), first.eventType(),
            first.eventData(), first.actorType(), first.actorId(),
            first.metadata(), first.createdAt());

        log.redact(0, payloadOnly);

        assertThat(log.get(0).eventData().get("redacted").asBoolean()).isTrue();
        assertThatThrownBy(() -> log.redact(0, resequenced)).isInstanceOf(ImmutableRecordException.class);
    }

    private static Event event(long sequence, String label) {
        return new Event(UUID.randomUUID(), sequence, "support_case", UUID.randomUUID(), 1L,
            "SupportCaseCreated", JsonNodeFactory.instance.objectNode().put("label", label),
            ActorType.SYSTEM, null, JsonNodeFactory.instance.objectNode(),
            Instant.parse("2026-01-05T09:00:00Z"));
    }
}
