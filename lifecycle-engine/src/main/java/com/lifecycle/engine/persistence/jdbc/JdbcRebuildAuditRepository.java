package com.lifecycle.engine.persistence.jdbc;

import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.RebuildRecord;
import com.lifecycle.core.model.RebuildStatus;
import com.lifecycle.core.repository.RebuildAuditRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of RebuildAuditRepository.
 */
public class JdbcRebuildAuditRepository implements RebuildAuditRepository {

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<RebuildRecord> rowMapper = (rs, rowNum) -> {
        Timestamp completedAt = rs.getTimestamp("completed_at");
        return new RebuildRecord(
            rs.getObject("rebuild_id", UUID.class),
            rs.getString("projector_name"),
            RebuildStatus.valueOf(rs.getString("status")),
            ActorType.fromValue(rs.getString("actor_type")),
            rs.getString("actor_id"),
            rs.getTimestamp("started_at").toInstant(),
            completedAt != null ? completedAt.toInstant() : null,
            rs.getLong("events_replayed"),
            rs.getString("error")
        );
    };

    public JdbcRebuildAuditRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(RebuildRecord record) {
        jdbcTemplate.update("""
            INSERT INTO projection_rebuilds (
                rebuild_id, projector_name, status, actor_type, actor_id,
                started_at, completed_at, events_replayed, error
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (rebuild_id) DO UPDATE SET
                status = EXCLUDED.status,
                completed_at = EXCLUDED.completed_at,
                events_replayed = EXCLUDED.events_replayed,
                error = EXCLUDED.error
            """,
            record.rebuildId(),
            record.projectorName(),
            record.status().name(),
            record.actorType().value(),
            record.actorId(),
            Timestamp.from(record.startedAt()),
            record.completedAt() != null ? Timestamp.from(record.completedAt()) : null,
            record.eventsReplayed(),
            record.error()
        );
    }

    @Override
    public Optional<RebuildRecord> findById(UUID rebuildId) {
        List<RebuildRecord> results = jdbcTemplate.query(
            "SELECT * FROM projection_rebuilds WHERE rebuild_id = ?", rowMapper, rebuildId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<RebuildRecord> findRecent(int limit) {
        return jdbcTemplate.query(
            "SELECT * FROM projection_rebuilds ORDER BY started_at DESC LIMIT ?", rowMapper, limit);
    }
}
