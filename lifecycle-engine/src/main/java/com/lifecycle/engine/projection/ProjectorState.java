package com.lifecycle.engine.projection;

import com.lifecycle.core.model.ProjectorCheckpoint;

/**
 * A checkpoint together with how far it trails the head of the log.
 */
public record ProjectorState(ProjectorCheckpoint checkpoint, long head, long lag) {

    public static ProjectorState of(ProjectorCheckpoint checkpoint, long head) {
        return new ProjectorState(checkpoint, head, checkpoint.lag(head));
    }
}
