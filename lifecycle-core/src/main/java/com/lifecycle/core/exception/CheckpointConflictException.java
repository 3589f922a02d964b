package com.lifecycle.core.exception;

/**
 * Thrown when a checkpoint advance finds the cursor or status changed
 * underneath it (concurrent dispatcher, pause or rebuild).
 */
public class CheckpointConflictException extends LifecycleException {
    
    public static final String ERROR_CODE = "CHECKPOINT_CONFLICT";
    
    public CheckpointConflictException(String projectorName, long expectedCursor) {
        super(ERROR_CODE, String.format(
            "Checkpoint for %s moved away from cursor %d",
            projectorName, expectedCursor
        ));
    }
}
