package com.lifecycle.core.model;

/**
 * Outcome of a rebuild run as recorded in the audit trail.
 */
public enum RebuildStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
