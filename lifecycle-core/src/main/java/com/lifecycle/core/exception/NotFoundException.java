package com.lifecycle.core.exception;

/**
 * Thrown when an event, projector or rebuild record is not found.
 */
public class NotFoundException extends LifecycleException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
