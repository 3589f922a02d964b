package com.lifecycle.core.exception;

/**
 * Thrown when a rebuild stops because it was cancelled. The checkpoint
 * keeps its cursor so the rebuild can be resumed.
 */
public class RebuildCancelledException extends LifecycleException {
    
    public static final String ERROR_CODE = "REBUILD_CANCELLED";
    
    public RebuildCancelledException(String projectorName, long cursor) {
        super(ERROR_CODE, String.format(
            "Rebuild of %s cancelled at cursor %d",
            projectorName, cursor
        ));
    }
}
