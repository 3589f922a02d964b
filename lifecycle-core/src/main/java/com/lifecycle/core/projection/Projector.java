package com.lifecycle.core.projection;

import com.lifecycle.core.model.Event;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named function deriving read model tables from the event log.
 * 
 * Implementations must be idempotent: applying the same event twice leaves
 * the read model exactly as applying it once. They must derive every value
 * from the event itself so that a replay reproduces identical rows.
 */
public interface Projector {

    /**
     * Unique name; also the checkpoint key.
     */
    String name();

    /**
     * The (aggregate type, event type) pairs this projector applies.
     */
    Set<EventSubscription> subscriptions();

    /**
     * Tables this projector owns exclusively. Cleared on rebuild.
     */
    List<ReadModelTable> outputs();

    /**
     * Apply one event. All writes for the event happen in one transaction
     * together with the checkpoint advance.
     */
    void apply(Event event, ReadModelStore store);

    default boolean handles(Event event) {
        return subscriptions().contains(EventSubscription.of(event.aggregateType(), event.eventType()));
    }

    default Set<String> aggregateTypes() {
        return subscriptions().stream()
            .map(EventSubscription::aggregateType)
            .collect(Collectors.toUnmodifiableSet());
    }

    default List<String> tableNames() {
        return outputs().stream().map(ReadModelTable::name).toList();
    }
}
