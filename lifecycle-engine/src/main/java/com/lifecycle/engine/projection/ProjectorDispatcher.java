package com.lifecycle.engine.projection;

import com.lifecycle.core.exception.CheckpointConflictException;
import com.lifecycle.core.exception.ProjectorApplyException;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.model.ProjectorStatus;
import com.lifecycle.core.projection.Projector;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.repository.CheckpointRepository;
import com.lifecycle.core.repository.EventRepository;
import com.lifecycle.engine.logging.LoggingContext;
import com.lifecycle.engine.metrics.EventStoreMetrics;
import com.lifecycle.engine.projection.DispatchResult.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Feeds events to projectors in global sequence order.
 * 
 * For each event after a projector's cursor, the projector's writes and the
 * checkpoint advance commit in one transaction. Events the projector does not
 * subscribe to only advance the cursor. A failing apply rolls back that
 * event, leaves the cursor on the last applied event and parks the projector
 * in ERROR; other projectors are unaffected.
 */
public class ProjectorDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ProjectorDispatcher.class);

    private final ProjectorRegistry registry;
    private final EventRepository eventRepository;
    private final CheckpointRepository checkpointRepository;
    private final ReadModelStore readModelStore;
    private final TransactionOperations transactions;
    private final ProjectorLocks locks;
    private final EventStoreMetrics metrics;
    private final int batchSize;

    public ProjectorDispatcher(ProjectorRegistry registry,
                               EventRepository eventRepository,
                               CheckpointRepository checkpointRepository,
                               ReadModelStore readModelStore,
                               TransactionOperations transactions,
                               ProjectorLocks locks,
                               EventStoreMetrics metrics,
                               int batchSize) {
        this.registry = registry;
        this.eventRepository = eventRepository;
        this.checkpointRepository = checkpointRepository;
        this.readModelStore = readModelStore;
        this.transactions = transactions;
        this.locks = locks;
        this.metrics = metrics;
        this.batchSize = batchSize;
    }

    /**
     * Dispatch every registered projector, one after another.
     */
    public List<DispatchResult> dispatchAll() {
        List<DispatchResult> results = new ArrayList<>();
        for (String name : registry.names()) {
            results.add(dispatch(name));
        }
        return results;
    }

    /**
     * Bring one projector up to the head of the log.
     * Returns immediately if another thread is dispatching or rebuilding it.
     */
    public DispatchResult dispatch(String projectorName) {
        Projector projector = registry.get(projectorName);
        ReentrantLock lock = locks.lockFor(projectorName);
        if (!lock.tryLock()) {
            log.debug("Projector {} is busy, skipping", projectorName);
            return DispatchResult.skipped(projectorName, currentCursor(projectorName), "busy");
        }
        try (var ctx = LoggingContext.forProjector(projectorName)) {
            ProjectorCheckpoint checkpoint = checkpointRepository.register(projectorName);
            if (!checkpoint.status().allowsDispatch()) {
                log.debug("Projector {} is {}, skipping", projectorName, checkpoint.status().value());
                return DispatchResult.skipped(projectorName, checkpoint.cursor(), checkpoint.status().value());
            }
            DispatchResult result = run(projector, checkpoint.cursor());
            if (result.eventsProcessed() > 0) {
                log.info("Dispatched {} events ({} applied) to {}, cursor {} [{}]",
                    result.eventsProcessed(), result.eventsApplied(), projectorName,
                    result.cursor(), result.outcome());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private DispatchResult run(Projector projector, long startCursor) {
        String name = projector.name();
        ReadModelStore scoped = registry.scopedStore(projector, readModelStore);
        long cursor = startCursor;
        long processed = 0;
        long applied = 0;

        while (true) {
            List<Event> batch = eventRepository.findAfter(cursor, Set.of(), batchSize);
            for (Event event : batch) {
                long expectedCursor = cursor;
                boolean handles = projector.handles(event);
                LoggingContext.setEvent(event.eventId(), event.globalSequence());
                long started = System.nanoTime();
                try {
                    transactions.executeWithoutResult(status -> {
                        if (handles) {
                            projector.apply(event, scoped);
                        }
                        checkpointRepository.advance(name, expectedCursor, ProjectorStatus.ACTIVE,
                            event.globalSequence(), event.eventId());
                    });
                } catch (CheckpointConflictException e) {
                    log.info("Checkpoint of {} moved during dispatch, stopping at {}", name, cursor);
                    return new DispatchResult(name, Outcome.INTERRUPTED, processed, applied, cursor, e.getMessage());
                } catch (RuntimeException e) {
                    return fail(projector, event, e, processed, applied, cursor);
                }
                cursor = event.globalSequence();
                processed++;
                if (handles) {
                    applied++;
                    metrics.eventApplied(name, Duration.ofNanos(System.nanoTime() - started));
                }
            }
            if (batch.size() < batchSize) {
                return new DispatchResult(name, Outcome.CAUGHT_UP, processed, applied, cursor, null);
            }
        }
    }

    private DispatchResult fail(Projector projector, Event event, RuntimeException cause,
                                long processed, long applied, long cursor) {
        String name = projector.name();
        ProjectorApplyException failure =
            new ProjectorApplyException(name, event.eventId(), event.globalSequence(), cause);
        String error = describe(cause);
        log.error("Projector {} failed on {}: {}", name, event.describe(), error, failure);

        transactions.executeWithoutResult(status -> checkpointRepository.markError(name, event.eventId(), error));
        metrics.projectorFailed(name, cause.getClass().getSimpleName());
        return new DispatchResult(name, Outcome.FAILED, processed, applied, cursor, failure.getMessage());
    }

    private long currentCursor(String projectorName) {
        return checkpointRepository.findByName(projectorName)
            .map(ProjectorCheckpoint::cursor)
            .orElse(0L);
    }

    static String describe(Throwable t) {
        String message = t.getMessage();
        return t.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
