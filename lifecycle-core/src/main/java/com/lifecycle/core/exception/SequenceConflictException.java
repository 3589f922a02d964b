package com.lifecycle.core.exception;

import java.util.UUID;

/**
 * Thrown when another writer already holds the sequence number an append
 * tried to use. Recoverable: re-read the next sequence and retry.
 */
public class SequenceConflictException extends LifecycleException {
    
    public static final String ERROR_CODE = "SEQUENCE_CONFLICT";

    private final String aggregateType;
    private final UUID aggregateId;
    private final long attemptedSequence;
    
    public SequenceConflictException(String aggregateType, UUID aggregateId, long attemptedSequence) {
        this(aggregateType, aggregateId, attemptedSequence, null);
    }

    public SequenceConflictException(String aggregateType, UUID aggregateId, long attemptedSequence, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Sequence %d is not available for %s[%s]",
            attemptedSequence, aggregateType, aggregateId
        ), cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.attemptedSequence = attemptedSequence;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public long getAttemptedSequence() {
        return attemptedSequence;
    }
}
