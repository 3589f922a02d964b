package com.lifecycle.engine.projection;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One in-process lock per projector. Held by the dispatcher for a dispatch
 * pass and by a rebuild or reset for its whole duration.
 */
public class ProjectorLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String projectorName) {
        return locks.computeIfAbsent(projectorName, name -> new ReentrantLock());
    }

    public boolean isLocked(String projectorName) {
        return lockFor(projectorName).isLocked();
    }
}
