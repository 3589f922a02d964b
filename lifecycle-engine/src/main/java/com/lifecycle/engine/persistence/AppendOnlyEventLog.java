package com.lifecycle.engine.persistence;

import com.lifecycle.core.exception.ImmutableRecordException;
import com.lifecycle.core.model.Event;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Backing list of the in-memory event store.
 * Only appends at the tail are accepted; every other mutation fails with
 * {@link ImmutableRecordException}, mirroring the triggers on the
 * PostgreSQL event table.
 */
public final class AppendOnlyEventLog extends AbstractList<Event> {

    private final List<Event> events = new ArrayList<>();

    @Override
    public Event get(int index) {
        return events.get(index);
    }

    @Override
    public int size() {
        return events.size();
    }

    @Override
    public boolean add(Event event) {
        events.add(event);
        return true;
    }

    @Override
    public void add(int index, Event event) {
        if (index != events.size()) {
            throw rejected("insert");
        }
        events.add(event);
    }

    @Override
    public Event set(int index, Event event) {
        throw rejected("update");
    }

    @Override
    public Event remove(int index) {
        throw rejected("delete");
    }

    @Override
    public boolean remove(Object o) {
        throw rejected("delete");
    }

    @Override
    public boolean removeAll(Collection<?> c) {
        throw rejected("delete");
    }

    @Override
    public boolean retainAll(Collection<?> c) {
        throw rejected("delete");
    }

    @Override
    public boolean removeIf(Predicate<? super Event> filter) {
        throw rejected("delete");
    }

    @Override
    public void replaceAll(UnaryOperator<Event> operator) {
        throw rejected("update");
    }

    @Override
    public void clear() {
        throw rejected("delete");
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        throw rejected("delete");
    }

    /**
     * View for callers outside the repository. Unlike this list it has no
     * tail append, since appends must go through the repository's sequencing.
     */
    List<Event> readOnlyView() {
        return new ReadOnlyView();
    }

    /**
     * Replace the payload of a stored event. Only the audited redaction path calls this;
     * identity, ordering and actor columns must be unchanged.
     */
    void redact(int index, Event redacted) {
        Event current = events.get(index);
        if (!current.eventId().equals(redacted.eventId())
                || current.globalSequence() != redacted.globalSequence()
                || current.sequenceNumber() != redacted.sequenceNumber()
                || !current.aggregateType().equals(redacted.aggregateType())
                || !current.aggregateId().equals(redacted.aggregateId())
                || !current.eventType().equals(redacted.eventType())
                || current.actorType() != redacted.actorType()
                || !current.createdAt().equals(redacted.createdAt())) {
            throw rejected("update");
        }
        events.set(index, redacted);
    }

    private final class ReadOnlyView extends AbstractList<Event> {

        @Override
        public Event get(int index) {
            return events.get(index).detached();
        }

        @Override
        public int size() {
            return events.size();
        }

        @Override
        public void add(int index, Event event) {
            throw rejected("insert");
        }

        @Override
        public Event set(int index, Event event) {
            throw rejected("update");
        }

        @Override
        public Event remove(int index) {
            throw rejected("delete");
        }
    }

    private static ImmutableRecordException rejected(String operation) {
        return new ImmutableRecordException("event_store is append-only: " + operation + " rejected");
    }
}
