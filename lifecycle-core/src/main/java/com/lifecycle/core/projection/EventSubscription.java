package com.lifecycle.core.projection;

/**
 * An (aggregate type, event type) pair a projector consumes.
 */
public record EventSubscription(String aggregateType, String eventType) {

    public static EventSubscription of(String aggregateType, String eventType) {
        return new EventSubscription(aggregateType, eventType);
    }
}
