package com.lifecycle.engine.health;

import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.repository.CheckpointRepository;
import com.lifecycle.core.repository.EventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health of the event store and its projectors.
 * Reports:
 * - Event log reachability and head position
 * - Status, cursor and lag of each projector
 * 
 * DOWN when the log cannot be read or a projector is stuck in ERROR.
 */
public class ProjectorHealthIndicator implements HealthIndicator {

    private final EventRepository eventRepository;
    private final CheckpointRepository checkpointRepository;

    public ProjectorHealthIndicator(EventRepository eventRepository, CheckpointRepository checkpointRepository) {
        this.eventRepository = eventRepository;
        this.checkpointRepository = checkpointRepository;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            long head = eventRepository.headGlobalSequence();
            details.put("headGlobalSequence", head);

            List<ProjectorCheckpoint> checkpoints = checkpointRepository.findAll();
            Map<String, Object> projectors = new LinkedHashMap<>();
            boolean anyFailed = false;
            for (ProjectorCheckpoint checkpoint : checkpoints) {
                Map<String, Object> projector = new LinkedHashMap<>();
                projector.put("status", checkpoint.status().value());
                projector.put("cursor", checkpoint.cursor());
                projector.put("lag", checkpoint.lag(head));
                if (checkpoint.status().requiresIntervention()) {
                    anyFailed = true;
                    projector.put("lastError", checkpoint.lastError());
                    projector.put("lastErrorEventId", checkpoint.lastErrorEventId());
                }
                projectors.put(checkpoint.projectorName(), projector);
            }
            details.put("projectors", projectors);

            return (anyFailed ? Health.down() : Health.up())
                .withDetails(details)
                .build();
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
