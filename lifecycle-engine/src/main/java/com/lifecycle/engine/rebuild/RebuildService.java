package com.lifecycle.engine.rebuild;

import com.lifecycle.core.exception.InvalidStateTransitionException;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.exception.ProjectorApplyException;
import com.lifecycle.core.exception.RebuildCancelledException;
import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.model.ProjectorStatus;
import com.lifecycle.core.model.RebuildRecord;
import com.lifecycle.core.model.RebuildStatus;
import com.lifecycle.core.projection.Projector;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.repository.CheckpointRepository;
import com.lifecycle.core.repository.EventRepository;
import com.lifecycle.core.repository.RebuildAuditRepository;
import com.lifecycle.engine.logging.LoggingContext;
import com.lifecycle.engine.metrics.EventStoreMetrics;
import com.lifecycle.engine.projection.ProjectorLocks;
import com.lifecycle.engine.projection.ProjectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Replays the event log into a projector's freshly cleared tables.
 * 
 * A rebuild holds the projector lock for its whole run and marks the
 * checkpoint REBUILDING, which keeps incremental dispatch away in this
 * process and in any other. Replay advances the checkpoint event by event,
 * so a cancelled or crashed rebuild can be resumed from where it stopped
 * without clearing the tables again.
 */
public class RebuildService {

    private static final Logger log = LoggerFactory.getLogger(RebuildService.class);

    private final ProjectorRegistry registry;
    private final EventRepository eventRepository;
    private final CheckpointRepository checkpointRepository;
    private final RebuildAuditRepository auditRepository;
    private final ReadModelStore readModelStore;
    private final TransactionOperations transactions;
    private final ProjectorLocks locks;
    private final EventStoreMetrics metrics;
    private final Clock clock;
    private final int batchSize;

    private final Map<UUID, RebuildJob> running = new ConcurrentHashMap<>();

    public RebuildService(ProjectorRegistry registry,
                          EventRepository eventRepository,
                          CheckpointRepository checkpointRepository,
                          RebuildAuditRepository auditRepository,
                          ReadModelStore readModelStore,
                          TransactionOperations transactions,
                          ProjectorLocks locks,
                          EventStoreMetrics metrics,
                          Clock clock,
                          int batchSize) {
        this.registry = registry;
        this.eventRepository = eventRepository;
        this.checkpointRepository = checkpointRepository;
        this.auditRepository = auditRepository;
        this.readModelStore = readModelStore;
        this.transactions = transactions;
        this.locks = locks;
        this.metrics = metrics;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    /**
     * Rebuild one projector from the start of the log and wait for it.
     */
    public RebuildRecord rebuild(String projectorName, ActorType actorType, String actorId) {
        return run(prepare(projectorName, actorType, actorId));
    }

    /**
     * Rebuild the given projectors in order. A projector that fails or
     * refuses to start gets a FAILED record and the rest still run.
     */
    public List<RebuildRecord> rebuildEach(List<String> projectorNames, ActorType actorType, String actorId) {
        List<RebuildRecord> records = new ArrayList<>();
        for (String name : projectorNames) {
            records.add(execute(prepare(name, actorType, actorId), false));
        }
        return records;
    }

    /**
     * Continue an interrupted rebuild from its recorded cursor.
     */
    public RebuildRecord resume(String projectorName, ActorType actorType, String actorId) {
        return run(prepareResume(projectorName, actorType, actorId));
    }

    /**
     * Rebuild every projector in registration order. A failing projector
     * does not stop the others.
     */
    public List<RebuildRecord> rebuildAll(ActorType actorType, String actorId) {
        List<RebuildRecord> records = rebuildEach(registry.names(), actorType, actorId);
        long failed = records.stream().filter(r -> r.status() != RebuildStatus.COMPLETED).count();
        log.info("Rebuilt {} projectors ({} not completed)", records.size(), failed);
        return records;
    }

    /**
     * Create the handle for a fresh rebuild without starting it.
     */
    public RebuildJob prepare(String projectorName, ActorType actorType, String actorId) {
        registry.get(projectorName);
        return new RebuildJob(RebuildRecord.started(projectorName, actorType, actorId, clock.instant()), false);
    }

    /**
     * Create the handle for resuming a rebuild without starting it.
     */
    public RebuildJob prepareResume(String projectorName, ActorType actorType, String actorId) {
        registry.get(projectorName);
        return new RebuildJob(RebuildRecord.started(projectorName, actorType, actorId, clock.instant()), true);
    }

    /**
     * Request cancellation of a running rebuild.
     * 
     * @return false if no rebuild with that ID is running here
     */
    public boolean cancel(UUID rebuildId) {
        RebuildJob job = running.get(rebuildId);
        if (job == null) {
            return false;
        }
        job.cancel();
        log.info("Cancellation requested for rebuild {} of {}", rebuildId, job.projectorName());
        return true;
    }

    public List<RebuildRecord> history(int limit) {
        return auditRepository.findRecent(limit);
    }

    public RebuildRecord find(UUID rebuildId) {
        return auditRepository.findById(rebuildId)
            .orElseThrow(() -> new NotFoundException("RebuildRecord", rebuildId.toString()));
    }

    /**
     * Run a prepared rebuild on the calling thread.
     */
    public RebuildRecord run(RebuildJob job) {
        return execute(job, true);
    }

    private RebuildRecord execute(RebuildJob job, boolean propagateRejection) {
        Projector projector = registry.get(job.projectorName());
        String name = projector.name();
        ReentrantLock lock = locks.lockFor(name);
        lock.lock();
        running.put(job.rebuildId(), job);
        Instant started = clock.instant();
        try (var ctx = LoggingContext.forRebuild(job.rebuildId(), name)) {
            auditRepository.save(job.startedRecord());
            ProjectorCheckpoint checkpoint = begin(projector, job);
            log.info("Rebuild {} of {} started from cursor {}", job.rebuildId(), name, checkpoint.cursor());

            replay(projector, job, checkpoint.cursor());
            checkpointRepository.updateStatus(name, ProjectorStatus.REBUILDING, ProjectorStatus.ACTIVE);

            log.info("Rebuild {} of {} completed: {} events replayed", job.rebuildId(), name, job.eventsReplayed());
            return finish(job, RebuildStatus.COMPLETED, null, started);
        } catch (RebuildCancelledException e) {
            log.warn("{}; resume to continue", e.getMessage());
            return finish(job, RebuildStatus.CANCELLED, e.getMessage(), started);
        } catch (InvalidStateTransitionException e) {
            RebuildRecord rejected = finish(job, RebuildStatus.FAILED, e.getMessage(), started);
            if (propagateRejection) {
                throw e;
            }
            log.warn("Rebuild {} of {} not started: {}", job.rebuildId(), name, e.getMessage());
            return rejected;
        } catch (RuntimeException e) {
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Rebuild {} of {} failed: {}", job.rebuildId(), name, error, e);
            UUID failedEventId = e instanceof ProjectorApplyException applyFailure ? applyFailure.getEventId() : null;
            markFailed(name, failedEventId, error);
            return finish(job, RebuildStatus.FAILED, error, started);
        } finally {
            running.remove(job.rebuildId());
            lock.unlock();
        }
    }

    private ProjectorCheckpoint begin(Projector projector, RebuildJob job) {
        String name = projector.name();
        ProjectorCheckpoint current = checkpointRepository.register(name);

        if (job.isResume()) {
            if (current.status() != ProjectorStatus.REBUILDING) {
                throw new InvalidStateTransitionException(name, current.status(), ProjectorStatus.REBUILDING);
            }
            return current;
        }
        // REBUILDING here is a cancelled or crashed run; holding the lock, start it over
        if (current.status() != ProjectorStatus.REBUILDING
                && !current.status().canTransitionTo(ProjectorStatus.REBUILDING)) {
            throw new InvalidStateTransitionException(name, current.status(), ProjectorStatus.REBUILDING);
        }
        return transactions.execute(status -> {
            ProjectorCheckpoint rewound = checkpointRepository.rewind(name, current.status(), ProjectorStatus.REBUILDING);
            for (String table : projector.tableNames()) {
                readModelStore.truncate(table);
            }
            log.info("Cleared {} for rebuild of {}", projector.tableNames(), name);
            return rewound;
        });
    }

    private void replay(Projector projector, RebuildJob job, long startCursor) {
        String name = projector.name();
        ReadModelStore scoped = registry.scopedStore(projector, readModelStore);
        long cursor = startCursor;

        while (true) {
            List<Event> batch = eventRepository.findAfter(cursor, projector.aggregateTypes(), batchSize);
            for (Event event : batch) {
                if (job.isCancelled()) {
                    throw new RebuildCancelledException(name, cursor);
                }
                long expectedCursor = cursor;
                LoggingContext.setEvent(event.eventId(), event.globalSequence());
                try {
                    transactions.executeWithoutResult(status -> {
                        if (projector.handles(event)) {
                            projector.apply(event, scoped);
                        }
                        checkpointRepository.advance(name, expectedCursor, ProjectorStatus.REBUILDING,
                            event.globalSequence(), event.eventId());
                    });
                } catch (RuntimeException e) {
                    throw new ProjectorApplyException(name, event.eventId(), event.globalSequence(), e);
                }
                cursor = event.globalSequence();
                job.replayedOne();
            }
            if (batch.size() < batchSize) {
                return;
            }
        }
    }

    private void markFailed(String projectorName, UUID eventId, String error) {
        transactions.executeWithoutResult(status -> checkpointRepository.markError(projectorName, eventId, error));
        metrics.projectorFailed(projectorName, "RebuildFailed");
    }

    private RebuildRecord finish(RebuildJob job, RebuildStatus outcome, String error, Instant started) {
        Instant now = clock.instant();
        RebuildRecord record = job.startedRecord().finished(outcome, job.eventsReplayed(), error, now);
        auditRepository.save(record);
        metrics.rebuildFinished(job.projectorName(), outcome.name().toLowerCase(), Duration.between(started, now));
        return record;
    }
}
