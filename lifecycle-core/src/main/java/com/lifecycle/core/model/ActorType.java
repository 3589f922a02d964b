package com.lifecycle.core.model;

import com.lifecycle.core.exception.InvalidActorException;

/**
 * Closed set of actors that may cause an event.
 */
public enum ActorType {
    SYSTEM("system"),
    USER("user"),
    AI("ai"),
    EXTERNAL("external");

    private final String value;

    ActorType(String value) {
        this.value = value;
    }

    /**
     * Stored and wire representation.
     */
    public String value() {
        return value;
    }

    /**
     * Parse a stored or wire value, case-insensitively.
     * 
     * @throws InvalidActorException if the value is not a known actor type
     */
    public static ActorType fromValue(String value) {
        if (value != null) {
            for (ActorType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new InvalidActorException(value);
    }
}
