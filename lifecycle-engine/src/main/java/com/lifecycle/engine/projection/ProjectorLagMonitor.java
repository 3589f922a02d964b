package com.lifecycle.engine.projection;

import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.repository.CheckpointRepository;
import com.lifecycle.core.repository.EventRepository;
import com.lifecycle.engine.metrics.EventStoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Keeps the per-projector lag gauges in step with the log head.
 */
public class ProjectorLagMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProjectorLagMonitor.class);

    private final EventRepository eventRepository;
    private final CheckpointRepository checkpointRepository;
    private final EventStoreMetrics metrics;

    public ProjectorLagMonitor(EventRepository eventRepository, CheckpointRepository checkpointRepository,
                               EventStoreMetrics metrics) {
        this.eventRepository = eventRepository;
        this.checkpointRepository = checkpointRepository;
        this.metrics = metrics;
    }

    @Scheduled(fixedRateString = "${lifecycle.projectors.lag-sync-interval:PT30S}")
    public void syncLag() {
        try {
            long head = eventRepository.headGlobalSequence();
            for (ProjectorCheckpoint checkpoint : checkpointRepository.findAll()) {
                metrics.syncProjectorLag(checkpoint.projectorName(), checkpoint.lag(head));
            }
            log.debug("Projector lag synced at head {}", head);
        } catch (RuntimeException e) {
            log.warn("Failed to sync projector lag: {}", e.getMessage());
        }
    }
}
