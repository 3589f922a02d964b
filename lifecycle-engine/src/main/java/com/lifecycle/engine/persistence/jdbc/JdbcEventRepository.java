package com.lifecycle.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.exception.SequenceConflictException;
import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.NewEvent;
import com.lifecycle.core.model.RedactionRecord;
import com.lifecycle.core.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of EventRepository.
 * Provides an append-only log with per-aggregate sequencing and a global order.
 * 
 * Appends take a transaction-scoped advisory lock, so global_sequence order
 * equals commit order and a dispatcher reading after its cursor can never skip
 * a lower sequence that commits later. The unique constraint on
 * (aggregate_type, aggregate_id, sequence_number) remains the backstop.
 */
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);

    /** Advisory lock key serializing appends ("lcevents"). */
    static final long APPEND_LOCK_KEY = 0x6c636576656e7473L;

    private static final String COLUMNS = """
        global_sequence, event_id, aggregate_type, aggregate_id, sequence_number,
        event_type, event_data, actor_type, actor_id, metadata, created_at
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EventRowMapper rowMapper;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new EventRowMapper();
    }

    @Override
    public long nextSequence(String aggregateType, UUID aggregateId) {
        String sql = """
            SELECT COALESCE(MAX(sequence_number), 0) + 1
            FROM event_store
            WHERE aggregate_type = ? AND aggregate_id = ?
            """;
        Long seq = jdbcTemplate.queryForObject(sql, Long.class, aggregateType, aggregateId);
        return seq != null ? seq : 1L;
    }

    @Override
    @Transactional
    public Event append(NewEvent event, Long expectedSequence) {
        jdbcTemplate.execute("SELECT pg_advisory_xact_lock(" + APPEND_LOCK_KEY + ")");

        long next = nextSequence(event.aggregateType(), event.aggregateId());
        if (expectedSequence != null && expectedSequence != next) {
            throw new SequenceConflictException(event.aggregateType(), event.aggregateId(), expectedSequence);
        }

        String sql = """
            INSERT INTO event_store (
                event_id, aggregate_type, aggregate_id, sequence_number,
                event_type, event_data, actor_type, actor_id, metadata, created_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?::jsonb, ?)
            RETURNING global_sequence
            """;

        UUID eventId = UUID.randomUUID();
        try {
            Long globalSequence = jdbcTemplate.queryForObject(sql, Long.class,
                eventId,
                event.aggregateType(),
                event.aggregateId(),
                next,
                event.eventType(),
                serialize(event.eventData()),
                event.actorType().value(),
                event.actorId(),
                serialize(event.metadata()),
                Timestamp.from(event.createdAt())
            );

            log.debug("Appended {} #{} for {}[{}] at global {}",
                event.eventType(), next, event.aggregateType(), event.aggregateId(), globalSequence);
            return event.toEvent(eventId, globalSequence, next);
        } catch (DuplicateKeyException e) {
            log.debug("Sequence {} already taken for {}[{}]", next, event.aggregateType(), event.aggregateId());
            throw new SequenceConflictException(event.aggregateType(), event.aggregateId(), next, e);
        }
    }

    @Override
    public Optional<Event> findById(UUID eventId) {
        String sql = "SELECT " + COLUMNS + " FROM event_store WHERE event_id = ?";
        List<Event> results = jdbcTemplate.query(sql, rowMapper, eventId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Event> findByAggregate(String aggregateType, UUID aggregateId) {
        return findByAggregateFrom(aggregateType, aggregateId, 1L);
    }

    @Override
    public List<Event> findByAggregateFrom(String aggregateType, UUID aggregateId, long fromSequence) {
        String sql = "SELECT " + COLUMNS + """
            FROM event_store
            WHERE aggregate_type = ? AND aggregate_id = ? AND sequence_number >= ?
            ORDER BY sequence_number ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, aggregateType, aggregateId, fromSequence);
    }

    @Override
    public List<Event> findAfter(long afterGlobalSequence, Set<String> aggregateTypes, int limit) {
        if (aggregateTypes == null || aggregateTypes.isEmpty()) {
            String sql = "SELECT " + COLUMNS + """
                FROM event_store
                WHERE global_sequence > ?
                ORDER BY global_sequence ASC
                LIMIT ?
                """;
            return jdbcTemplate.query(sql, rowMapper, afterGlobalSequence, limit);
        }

        String placeholders = String.join(",", aggregateTypes.stream().map(t -> "?").toList());
        String sql = "SELECT " + COLUMNS + """
            FROM event_store
            WHERE global_sequence > ? AND aggregate_type IN (%s)
            ORDER BY global_sequence ASC
            LIMIT ?
            """.formatted(placeholders);

        List<Object> params = new ArrayList<>(aggregateTypes.size() + 2);
        params.add(afterGlobalSequence);
        params.addAll(aggregateTypes);
        params.add(limit);
        return jdbcTemplate.query(sql, rowMapper, params.toArray());
    }

    @Override
    public long headGlobalSequence() {
        Long head = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(global_sequence), 0) FROM event_store", Long.class);
        return head != null ? head : 0L;
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM event_store", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    @Transactional
    public void redact(UUID eventId, JsonNode redactedData, JsonNode redactedMetadata, RedactionRecord record) {
        EventStoreSqlErrors.guard(() -> {
            jdbcTemplate.execute("SET LOCAL lifecycle.allow_redaction = 'on'");
            int rows = jdbcTemplate.update(
                "UPDATE event_store SET event_data = ?::jsonb, metadata = ?::jsonb WHERE event_id = ?",
                serialize(redactedData), serialize(redactedMetadata), eventId);
            if (rows == 0) {
                throw new NotFoundException("Event", eventId.toString());
            }
            jdbcTemplate.update("""
                INSERT INTO event_redactions (
                    redaction_id, event_id, reason, actor_type, actor_id, redacted_at
                ) VALUES (?, ?, ?, ?, ?, ?)
                """,
                record.redactionId(),
                record.eventId(),
                record.reason(),
                record.actorType().value(),
                record.actorId(),
                Timestamp.from(record.redactedAt()));
            jdbcTemplate.execute("SET LOCAL lifecycle.allow_redaction = 'off'");
            return rows;
        });
    }

    @Override
    public List<RedactionRecord> findRedactions(UUID eventId) {
        String sql = """
            SELECT redaction_id, event_id, reason, actor_type, actor_id, redacted_at
            FROM event_redactions
            WHERE event_id = ?
            ORDER BY redacted_at ASC
            """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new RedactionRecord(
            rs.getObject("redaction_id", UUID.class),
            rs.getObject("event_id", UUID.class),
            rs.getString("reason"),
            ActorType.fromValue(rs.getString("actor_type")),
            rs.getString("actor_id"),
            rs.getTimestamp("redacted_at").toInstant()
        ), eventId);
    }

    private String serialize(JsonNode node) {
        if (node == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not serializable", e);
        }
    }

    private class EventRowMapper implements RowMapper<Event> {

        @Override
        public Event mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Event(
                rs.getObject("event_id", UUID.class),
                rs.getLong("global_sequence"),
                rs.getString("aggregate_type"),
                rs.getObject("aggregate_id", UUID.class),
                rs.getLong("sequence_number"),
                rs.getString("event_type"),
                deserialize(rs.getString("event_data")),
                ActorType.fromValue(rs.getString("actor_type")),
                rs.getString("actor_id"),
                deserialize(rs.getString("metadata")),
                rs.getTimestamp("created_at").toInstant()
            );
        }

        private JsonNode deserialize(String json) throws SQLException {
            try {
                return objectMapper.readTree(json == null ? "{}" : json);
            } catch (JsonProcessingException e) {
                throw new SQLException("Stored event payload is not valid JSON", e);
            }
        }
    }
}
