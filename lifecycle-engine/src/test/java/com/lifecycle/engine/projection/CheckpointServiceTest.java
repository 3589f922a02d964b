package com.lifecycle.engine.projection;

import com.lifecycle.core.exception.InvalidStateTransitionException;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.model.ProjectorStatus;
import com.lifecycle.engine.test.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.lifecycle.engine.test.InMemoryEventStore.data;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Checkpoint operator actions")
class CheckpointServiceTest {

    private RecordingProjector alpha;
    private InMemoryEventStore engine;
    private UUID ticket;

    @BeforeEach
    void setUp() {
        alpha = new RecordingProjector("alpha", "Opened");
        engine = new InMemoryEventStore(List.of(alpha, new RecordingProjector("beta", "Closed")));
        ticket = UUID.randomUUID();
    }

    // ========== Read side ==========

    @Test
    @DisplayName("Lag is the distance between the head of the log and the cursor")
    void testLag() {
        append("Opened");
        append("Opened");
        append("Closed");
        engine.dispatcher.dispatch("alpha");
        append("Opened");

        ProjectorState alphaState = engine.checkpointService.get("alpha");
        ProjectorState betaState = engine.checkpointService.get("beta");

        assertThat(alphaState.head()).isEqualTo(4L);
        assertThat(alphaState.lag()).isEqualTo(1L);
        assertThat(betaState.lag()).isEqualTo(4L);
        assertThat(engine.checkpointService.list()).hasSize(2);
    }

    @Test
    @DisplayName("Unknown projector is reported as not found")
    void testUnknownProjector() {
        assertThatThrownBy(() -> engine.checkpointService.get("nope"))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> engine.checkpointService.pause("nope"))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> engine.dispatcher.dispatch("nope"))
            .isInstanceOf(NotFoundException.class);
    }

    // ========== Transitions ==========

    @Test
    @DisplayName("Pause and resume keep the cursor")
    void testPauseResume() {
        append("Opened");
        engine.dispatcher.dispatch("alpha");

        ProjectorCheckpoint paused = engine.checkpointService.pause("alpha");
        ProjectorCheckpoint resumed = engine.checkpointService.resume("alpha");

        assertThat(paused.status()).isEqualTo(ProjectorStatus.PAUSED);
        assertThat(paused.cursor()).isEqualTo(1L);
        assertThat(resumed.status()).isEqualTo(ProjectorStatus.ACTIVE);
        assertThat(resumed.cursor()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Pausing twice or resuming an active projector is rejected")
    void testInvalidTransitions() {
        engine.checkpointService.pause("alpha");

        assertThatThrownBy(() -> engine.checkpointService.pause("alpha"))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> engine.checkpointService.resume("beta"))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("A projector in ERROR cannot be resumed, only reset")
    void testErrorRequiresReset() {
        append("Opened");
        alpha.failWhen(event -> true);
        engine.dispatcher.dispatch("alpha");

        assertThatThrownBy(() -> engine.checkpointService.resume("alpha"))
            .isInstanceOf(InvalidStateTransitionException.class);

        ProjectorCheckpoint reset = engine.checkpointService.reset("alpha");

        assertThat(reset.status()).isEqualTo(ProjectorStatus.ACTIVE);
        assertThat(reset.cursor()).isZero();
        assertThat(reset.errorCount()).isZero();
        assertThat(reset.lastError()).isNull();
        assertThat(reset.lastErrorEventId()).isNull();
    }

    @Test
    @DisplayName("Reset replays the log over existing rows without duplicating them")
    void testResetReplaysIdempotently() {
        append("Opened");
        append("Opened");
        engine.dispatcher.dispatch("alpha");

        engine.checkpointService.reset("alpha");
        engine.dispatcher.dispatch("alpha");

        assertThat(engine.store.count(alpha.table())).isEqualTo(2);
        assertThat(engine.checkpoints.findByName("alpha").orElseThrow().cursor()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Reset is refused while the projector is rebuilding")
    void testResetRefusedDuringRebuild() {
        engine.checkpoints.updateStatus("alpha", ProjectorStatus.ACTIVE, ProjectorStatus.REBUILDING);

        assertThatThrownBy(() -> engine.checkpointService.reset("alpha"))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(engine.checkpoints.findByName("alpha").orElseThrow().status())
            .isEqualTo(ProjectorStatus.REBUILDING);
    }

    private void append(String eventType) {
        engine.append(RecordingProjector.AGGREGATE_TYPE, ticket, eventType, data("note", eventType));
    }
}
