package com.lifecycle.core.exception;

/**
 * Base exception for all event store and projection errors.
 */
public class LifecycleException extends RuntimeException {
    
    private final String errorCode;
    
    public LifecycleException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public LifecycleException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
