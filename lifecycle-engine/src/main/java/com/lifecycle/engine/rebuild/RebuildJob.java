package com.lifecycle.engine.rebuild;

import com.lifecycle.core.model.RebuildRecord;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Handle on one rebuild run. Cancellation is cooperative: the replay loop
 * checks the flag between events.
 */
public class RebuildJob {

    private final RebuildRecord started;
    private final boolean resume;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicLong replayed = new AtomicLong();

    RebuildJob(RebuildRecord started, boolean resume) {
        this.started = started;
        this.resume = resume;
    }

    public UUID rebuildId() {
        return started.rebuildId();
    }

    public String projectorName() {
        return started.projectorName();
    }

    public RebuildRecord startedRecord() {
        return started;
    }

    /**
     * True if this run continues an interrupted rebuild from its cursor.
     */
    public boolean isResume() {
        return resume;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public long eventsReplayed() {
        return replayed.get();
    }

    void replayedOne() {
        replayed.incrementAndGet();
    }
}
