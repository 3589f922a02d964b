package com.lifecycle.core.exception;

/**
 * Thrown when an append names an actor type outside the closed set.
 */
public class InvalidActorException extends LifecycleException {
    
    public static final String ERROR_CODE = "INVALID_ACTOR";
    
    public InvalidActorException(String actorType) {
        super(ERROR_CODE, String.format(
            "Invalid actor type: %s",
            actorType
        ));
    }
}
