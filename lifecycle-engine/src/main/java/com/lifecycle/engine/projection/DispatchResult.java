package com.lifecycle.engine.projection;

/**
 * Outcome of one dispatch pass for one projector.
 */
public record DispatchResult(
    String projectorName,
    Outcome outcome,
    long eventsProcessed,
    long eventsApplied,
    long cursor,
    String detail
) {

    public enum Outcome {
        /** Caught up with the head of the log. */
        CAUGHT_UP,
        /** Not run: projector busy or not ACTIVE. */
        SKIPPED,
        /** Stopped because the checkpoint moved (pause, reset or rebuild). */
        INTERRUPTED,
        /** Stopped on a failing event; checkpoint is now ERROR. */
        FAILED
    }

    public static DispatchResult skipped(String projectorName, long cursor, String reason) {
        return new DispatchResult(projectorName, Outcome.SKIPPED, 0, 0, cursor, reason);
    }

    public boolean failed() {
        return outcome == Outcome.FAILED;
    }
}
