package com.lifecycle.core.exception;

/**
 * Thrown when a projector writes to a table it does not own.
 */
public class ProjectionWriteViolationException extends LifecycleException {
    
    public static final String ERROR_CODE = "PROJECTION_WRITE_VIOLATION";
    
    public ProjectionWriteViolationException(String projectorName, String tableName, String operation) {
        super(ERROR_CODE, String.format(
            "Projector %s may not %s table %s",
            projectorName, operation, tableName
        ));
    }
}
