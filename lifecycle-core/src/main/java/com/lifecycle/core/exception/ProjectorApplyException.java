package com.lifecycle.core.exception;

import java.util.UUID;

/**
 * Thrown when a projector fails to apply an event. The projector's
 * checkpoint stays at the last applied event.
 */
public class ProjectorApplyException extends LifecycleException {
    
    public static final String ERROR_CODE = "PROJECTOR_APPLY_FAILED";

    private final String projectorName;
    private final UUID eventId;
    private final long globalSequence;
    
    public ProjectorApplyException(String projectorName, UUID eventId, long globalSequence, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Projector %s failed on event %s (global sequence %d): %s",
            projectorName, eventId, globalSequence, cause.getMessage()
        ), cause);
        this.projectorName = projectorName;
        this.eventId = eventId;
        this.globalSequence = globalSequence;
    }

    public String getProjectorName() {
        return projectorName;
    }

    public UUID getEventId() {
        return eventId;
    }

    public long getGlobalSequence() {
        return globalSequence;
    }
}
