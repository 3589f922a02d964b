package com.lifecycle.core.exception;

/**
 * Thrown by the storage layer when anything tries to update or delete
 * an existing event. Signals a programming error upstream.
 */
public class ImmutableRecordException extends LifecycleException {
    
    public static final String ERROR_CODE = "IMMUTABLE_RECORD";
    
    public ImmutableRecordException(String message) {
        super(ERROR_CODE, message);
    }

    public ImmutableRecordException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
