package com.lifecycle.core.exception;

import java.util.UUID;

/**
 * Thrown when an append could not resolve its sequence conflict
 * within the configured number of attempts.
 */
public class AppendFailedException extends LifecycleException {
    
    public static final String ERROR_CODE = "APPEND_FAILED";
    
    public AppendFailedException(String aggregateType, UUID aggregateId, int attempts, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Failed to append to %s[%s] after %d attempts",
            aggregateType, aggregateId, attempts
        ), cause);
    }
}
