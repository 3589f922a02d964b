package com.lifecycle.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.exception.SequenceConflictException;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.NewEvent;
import com.lifecycle.core.model.RedactionRecord;
import com.lifecycle.core.repository.EventRepository;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of EventRepository.
 * For local runs and tests. Appends are serialized by a write lock, so
 * global sequence order equals append order.
 */
public class InMemoryEventRepository implements EventRepository {

    private final AppendOnlyEventLog log = new AppendOnlyEventLog();
    private final Map<UUID, Integer> positionById = new HashMap<>();
    private final Map<StreamKey, List<Integer>> positionsByStream = new HashMap<>();
    private final List<RedactionRecord> redactions = new CopyOnWriteArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public long nextSequence(String aggregateType, UUID aggregateId) {
        lock.readLock().lock();
        try {
            return nextSequenceLocked(new StreamKey(aggregateType, aggregateId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Event append(NewEvent event, Long expectedSequence) {
        StreamKey key = new StreamKey(event.aggregateType(), event.aggregateId());
        lock.writeLock().lock();
        try {
            long next = nextSequenceLocked(key);
            if (expectedSequence != null && expectedSequence != next) {
                throw new SequenceConflictException(event.aggregateType(), event.aggregateId(), expectedSequence);
            }
            Event stored = event.toEvent(UUID.randomUUID(), log.size() + 1L, next).detached();
            int position = log.size();
            log.add(stored);
            positionById.put(stored.eventId(), position);
            positionsByStream.computeIfAbsent(key, k -> new ArrayList<>()).add(position);
            return stored.detached();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Event> findById(UUID eventId) {
        lock.readLock().lock();
        try {
            Integer position = positionById.get(eventId);
            return position == null ? Optional.empty() : Optional.of(log.get(position).detached());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Event> findByAggregate(String aggregateType, UUID aggregateId) {
        return findByAggregateFrom(aggregateType, aggregateId, 1L);
    }

    @Override
    public List<Event> findByAggregateFrom(String aggregateType, UUID aggregateId, long fromSequence) {
        lock.readLock().lock();
        try {
            List<Event> result = new ArrayList<>();
            for (int position : positionsByStream.getOrDefault(new StreamKey(aggregateType, aggregateId), List.of())) {
                Event event = log.get(position);
                if (event.sequenceNumber() >= fromSequence) {
                    result.add(event.detached());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Event> findAfter(long afterGlobalSequence, Set<String> aggregateTypes, int limit) {
        boolean allTypes = aggregateTypes == null || aggregateTypes.isEmpty();
        lock.readLock().lock();
        try {
            List<Event> result = new ArrayList<>();
            // global sequence n lives at position n - 1
            for (int i = (int) Math.max(0L, afterGlobalSequence); i < log.size() && result.size() < limit; i++) {
                Event event = log.get(i);
                if (allTypes || aggregateTypes.contains(event.aggregateType())) {
                    result.add(event.detached());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long headGlobalSequence() {
        lock.readLock().lock();
        try {
            return log.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        return headGlobalSequence();
    }

    @Override
    public void redact(UUID eventId, JsonNode redactedData, JsonNode redactedMetadata, RedactionRecord record) {
        lock.writeLock().lock();
        try {
            Integer position = positionById.get(eventId);
            if (position == null) {
                throw new NotFoundException("Event", eventId.toString());
            }
            Event current = log.get(position);
            log.redact(position, current.withPayload(copyOf(redactedData), copyOf(redactedMetadata)));
            redactions.add(record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<RedactionRecord> findRedactions(UUID eventId) {
        return redactions.stream()
            .filter(r -> r.eventId().equals(eventId))
            .toList();
    }

    /**
     * Read-only view of the log. Every write through it is rejected and
     * reads return detached copies.
     */
    public List<Event> log() {
        return log.readOnlyView();
    }

    private static JsonNode copyOf(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }

    private long nextSequenceLocked(StreamKey key) {
        List<Integer> positions = positionsByStream.get(key);
        if (positions == null || positions.isEmpty()) {
            return 1L;
        }
        return log.get(positions.get(positions.size() - 1)).sequenceNumber() + 1;
    }

    private record StreamKey(String aggregateType, UUID aggregateId) {}
}
