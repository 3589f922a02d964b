package com.lifecycle.core.exception;

import java.util.List;

/**
 * Thrown when replaying the log does not reproduce the live projections.
 * Never reconciled automatically.
 */
public class RebuildVerificationMismatchException extends LifecycleException {
    
    public static final String ERROR_CODE = "REBUILD_VERIFICATION_MISMATCH";
    
    private final List<String> differences;
    
    public RebuildVerificationMismatchException(List<String> differences) {
        super(ERROR_CODE, "Rebuilt projections differ from live projections: " + String.join("; ", differences));
        this.differences = List.copyOf(differences);
    }
    
    public List<String> getDifferences() {
        return differences;
    }
}
