package com.lifecycle.core.exception;

import com.lifecycle.core.model.ProjectorStatus;

/**
 * Thrown when a projector checkpoint is asked to move to a status
 * its current status does not allow.
 */
public class InvalidStateTransitionException extends LifecycleException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(String projectorName, ProjectorStatus currentStatus, ProjectorStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition projector %s from %s to %s",
            projectorName, currentStatus.value(), targetStatus.value()
        ));
    }
}
