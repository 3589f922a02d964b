package com.lifecycle.core.exception;

import java.util.List;

/**
 * Thrown when an append request fails validation. Never retried.
 */
public class EventValidationException extends LifecycleException {
    
    public static final String ERROR_CODE = "EVENT_VALIDATION";
    
    private final List<String> errors;
    
    public EventValidationException(List<String> errors) {
        super(ERROR_CODE, "Event validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
    
    public List<String> getErrors() {
        return errors;
    }
}
