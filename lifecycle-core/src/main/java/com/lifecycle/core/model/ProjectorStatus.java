package com.lifecycle.core.model;

/**
 * Lifecycle states for a projector checkpoint.
 * Transitions follow a strict state machine; only the dispatcher and
 * operator actions move a checkpoint between them.
 */
public enum ProjectorStatus {
    /**
     * Dispatching events incrementally.
     * Transitions: -> PAUSED, ERROR, REBUILDING
     */
    ACTIVE("active"),

    /**
     * Halted by an operator.
     * Transitions: -> ACTIVE, REBUILDING
     */
    PAUSED("paused"),

    /**
     * Halted on a failing event; requires operator triage.
     * Transitions: -> ACTIVE (reset), REBUILDING
     */
    ERROR("error"),

    /**
     * Replaying the log into cleared tables. Incremental dispatch is suspended.
     * Transitions: -> ACTIVE, ERROR
     */
    REBUILDING("rebuilding");

    private final String value;

    ProjectorStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ProjectorStatus fromValue(String value) {
        for (ProjectorStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown projector status: " + value);
    }

    /**
     * Check if incremental dispatch may run in this state.
     */
    public boolean allowsDispatch() {
        return this == ACTIVE;
    }

    /**
     * Check if this state requires manual intervention.
     */
    public boolean requiresIntervention() {
        return this == ERROR;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(ProjectorStatus target) {
        return switch (this) {
            case ACTIVE -> target == PAUSED || target == ERROR || target == REBUILDING;
            case PAUSED -> target == ACTIVE || target == REBUILDING;
            case ERROR -> target == ACTIVE || target == REBUILDING;
            case REBUILDING -> target == ACTIVE || target == ERROR;
        };
    }
}
