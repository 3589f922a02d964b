package com.lifecycle.engine.persistence.jdbc;

import com.lifecycle.core.exception.CheckpointConflictException;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.model.ProjectorStatus;
import com.lifecycle.core.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of CheckpointRepository.
 * Every mutation is a single conditional UPDATE; zero affected rows means
 * the checkpoint moved underneath the caller.
 */
public class JdbcCheckpointRepository implements CheckpointRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final CheckpointRowMapper rowMapper = new CheckpointRowMapper();

    public JdbcCheckpointRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public ProjectorCheckpoint register(String projectorName) {
        Timestamp now = Timestamp.from(clock.instant());
        int rows = jdbcTemplate.update("""
            INSERT INTO projector_checkpoints (
                projector_name, last_global_sequence, status, created_at, updated_at
            ) VALUES (?, 0, ?, ?, ?)
            ON CONFLICT (projector_name) DO NOTHING
            """,
            projectorName, ProjectorStatus.ACTIVE.value(), now, now);
        if (rows > 0) {
            log.info("Registered checkpoint for projector {}", projectorName);
        }
        return require(projectorName);
    }

    @Override
    public Optional<ProjectorCheckpoint> findByName(String projectorName) {
        List<ProjectorCheckpoint> results = jdbcTemplate.query(
            "SELECT * FROM projector_checkpoints WHERE projector_name = ?", rowMapper, projectorName);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ProjectorCheckpoint> findAll() {
        return jdbcTemplate.query(
            "SELECT * FROM projector_checkpoints ORDER BY projector_name", rowMapper);
    }

    @Override
    public void advance(String projectorName, long expectedCursor, ProjectorStatus expectedStatus,
                        long newCursor, UUID eventId) {
        int rows = jdbcTemplate.update("""
            UPDATE projector_checkpoints SET
                last_global_sequence = ?,
                last_event_id = ?,
                events_processed = events_processed + 1,
                updated_at = ?
            WHERE projector_name = ? AND last_global_sequence = ? AND status = ?
            """,
            newCursor, eventId, Timestamp.from(clock.instant()),
            projectorName, expectedCursor, expectedStatus.value());
        if (rows == 0) {
            require(projectorName);
            throw new CheckpointConflictException(projectorName, expectedCursor);
        }
    }

    @Override
    public void markError(String projectorName, UUID eventId, String error) {
        int rows = jdbcTemplate.update("""
            UPDATE projector_checkpoints SET
                status = ?,
                error_count = error_count + 1,
                last_error = ?,
                last_error_event_id = ?,
                updated_at = ?
            WHERE projector_name = ?
            """,
            ProjectorStatus.ERROR.value(), error, eventId, Timestamp.from(clock.instant()), projectorName);
        if (rows == 0) {
            throw new NotFoundException("ProjectorCheckpoint", projectorName);
        }
    }

    @Override
    public ProjectorCheckpoint updateStatus(String projectorName, ProjectorStatus expected, ProjectorStatus target) {
        int rows = jdbcTemplate.update("""
            UPDATE projector_checkpoints SET status = ?, updated_at = ?
            WHERE projector_name = ? AND status = ?
            """,
            target.value(), Timestamp.from(clock.instant()), projectorName, expected.value());
        return afterConditionalUpdate(projectorName, rows);
    }

    @Override
    public ProjectorCheckpoint rewind(String projectorName, ProjectorStatus expected, ProjectorStatus target) {
        int rows = jdbcTemplate.update("""
            UPDATE projector_checkpoints SET
                last_global_sequence = 0,
                last_event_id = NULL,
                status = ?,
                events_processed = 0,
                error_count = 0,
                last_error = NULL,
                last_error_event_id = NULL,
                updated_at = ?
            WHERE projector_name = ? AND status = ?
            """,
            target.value(), Timestamp.from(clock.instant()), projectorName, expected.value());
        return afterConditionalUpdate(projectorName, rows);
    }

    private ProjectorCheckpoint afterConditionalUpdate(String projectorName, int rows) {
        ProjectorCheckpoint checkpoint = require(projectorName);
        if (rows == 0) {
            throw new CheckpointConflictException(projectorName, checkpoint.cursor());
        }
        return checkpoint;
    }

    private ProjectorCheckpoint require(String projectorName) {
        return findByName(projectorName)
            .orElseThrow(() -> new NotFoundException("ProjectorCheckpoint", projectorName));
    }

    private static class CheckpointRowMapper implements RowMapper<ProjectorCheckpoint> {

        @Override
        public ProjectorCheckpoint mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ProjectorCheckpoint(
                rs.getString("projector_name"),
                rs.getLong("last_global_sequence"),
                rs.getObject("last_event_id", UUID.class),
                ProjectorStatus.fromValue(rs.getString("status")),
                rs.getLong("events_processed"),
                rs.getInt("error_count"),
                rs.getString("last_error"),
                rs.getObject("last_error_event_id", UUID.class),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
            );
        }
    }
}
