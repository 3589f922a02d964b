package com.lifecycle.engine.rebuild;

import com.lifecycle.core.exception.InvalidStateTransitionException;
import com.lifecycle.core.exception.NotFoundException;
import com.lifecycle.core.model.ActorType;
import com.lifecycle.core.model.Event;
import com.lifecycle.core.model.ProjectionSnapshot;
import com.lifecycle.core.model.ProjectorCheckpoint;
import com.lifecycle.core.model.ProjectorStatus;
import com.lifecycle.core.model.RebuildRecord;
import com.lifecycle.core.model.RebuildStatus;
import com.lifecycle.engine.projection.DispatchResult;
import com.lifecycle.engine.projection.RecordingProjector;
import com.lifecycle.engine.test.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static com.lifecycle.engine.test.InMemoryEventStore.data;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Projection rebuild")
class RebuildServiceTest {

    private RecordingProjector alpha;
    private RecordingProjector beta;
    private InMemoryEventStore engine;
    private UUID ticket;

    @BeforeEach
    void setUp() {
        alpha = new RecordingProjector("alpha", "Opened", "Closed");
        beta = new RecordingProjector("beta", "Closed");
        engine = new InMemoryEventStore(List.of(alpha, beta));
        ticket = UUID.randomUUID();
    }

    // ========== Full rebuild ==========

    @Test
    @DisplayName("Rebuild clears the tables and replays the log to the same state")
    void testRebuildReproducesState() {
        appendMany(7);
        engine.dispatcher.dispatchAll();
        ProjectionSnapshot before = engine.snapshots.snapshot(List.of(alpha.table()));
        engine.store.upsert(alpha.table(), Map.of("event_id", UUID.randomUUID(), "event_type", "Stray"));

        RebuildRecord record = engine.rebuilds.rebuild("alpha", ActorType.USER, "ops@example.com");

        assertThat(record.status()).isEqualTo(RebuildStatus.COMPLETED);
        assertThat(record.eventsReplayed()).isEqualTo(7L);
        assertThat(record.completedAt()).isNotNull();
        assertThat(engine.snapshots.compare(before, engine.snapshots.snapshot(List.of(alpha.table()))).equal())
            .isTrue();
        ProjectorCheckpoint checkpoint = engine.checkpoints.findByName("alpha").orElseThrow();
        assertThat(checkpoint.status()).isEqualTo(ProjectorStatus.ACTIVE);
        assertThat(checkpoint.cursor()).isEqualTo(7L);
    }

    @Test
    @DisplayName("Rebuild repairs a projector left in ERROR")
    void testRebuildClearsError() {
        Event poison = append("Opened");
        append("Closed");
        alpha.failWhen(event -> event.eventId().equals(poison.eventId()));
        engine.dispatcher.dispatch("alpha");
        assertThat(engine.checkpoints.findByName("alpha").orElseThrow().status()).isEqualTo(ProjectorStatus.ERROR);

        alpha.failWhen(event -> false);
        RebuildRecord record = engine.rebuilds.rebuild("alpha", ActorType.SYSTEM, "test");

        assertThat(record.status()).isEqualTo(RebuildStatus.COMPLETED);
        ProjectorCheckpoint checkpoint = engine.checkpoints.findByName("alpha").orElseThrow();
        assertThat(checkpoint.status()).isEqualTo(ProjectorStatus.ACTIVE);
        assertThat(checkpoint.lastError()).isNull();
        assertThat(engine.store.count(alpha.table())).isEqualTo(2);
    }

    @Test
    @DisplayName("Incremental dispatch continues normally after a rebuild")
    void testDispatchAfterRebuild() {
        appendMany(4);
        engine.rebuilds.rebuild("alpha", ActorType.SYSTEM, "test");
        append("Opened");

        DispatchResult result = engine.dispatcher.dispatch("alpha");

        assertThat(result.eventsProcessed()).isEqualTo(1);
        assertThat(engine.store.count(alpha.table())).isEqualTo(5);
    }

    // ========== Failure ==========

    @Test
    @DisplayName("A replay failure parks the projector in ERROR and is audited")
    void testReplayFailure() {
        append("Opened");
        Event poison = append("Closed");
        append("Opened");
        beta.failWhen(event -> event.eventId().equals(poison.eventId()));

        RebuildRecord record = engine.rebuilds.rebuild("beta", ActorType.SYSTEM, "test");

        assertThat(record.status()).isEqualTo(RebuildStatus.FAILED);
        assertThat(record.error()).contains("cannot project Closed");
        ProjectorCheckpoint checkpoint = engine.checkpoints.findByName("beta").orElseThrow();
        assertThat(checkpoint.status()).isEqualTo(ProjectorStatus.ERROR);
        assertThat(checkpoint.lastErrorEventId()).isEqualTo(poison.eventId());
        assertThat(checkpoint.cursor()).isEqualTo(1L);
        assertThat(engine.rebuilds.find(record.rebuildId())).isEqualTo(record);
    }

    @Test
    @DisplayName("rebuildAll runs in registration order and carries on past a failure")
    void testRebuildAll() {
        appendMany(3);
        alpha.failWhen(event -> true);

        List<RebuildRecord> records = engine.rebuilds.rebuildAll(ActorType.SYSTEM, "test");

        assertThat(records).extracting(RebuildRecord::projectorName).containsExactly("alpha", "beta");
        assertThat(records).extracting(RebuildRecord::status)
            .containsExactly(RebuildStatus.FAILED, RebuildStatus.COMPLETED);
        assertThat(engine.checkpoints.findByName("beta").orElseThrow().cursor()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Unknown projectors and rebuild IDs are reported as not found")
    void testNotFound() {
        assertThatThrownBy(() -> engine.rebuilds.rebuild("nope", ActorType.SYSTEM, "test"))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> engine.rebuilds.find(UUID.randomUUID()))
            .isInstanceOf(NotFoundException.class);
        assertThat(engine.rebuilds.cancel(UUID.randomUUID())).isFalse();
    }

    // ========== Cancel and resume ==========

    @Test
    @DisplayName("A cancelled rebuild stays REBUILDING and resume converges to a full rebuild")
    void testCancelThenResume() {
        appendMany(8);
        engine.dispatcher.dispatchAll();
        ProjectionSnapshot expected = engine.snapshots.snapshot(List.of(alpha.table()));

        RebuildJob job = engine.rebuilds.prepare("alpha", ActorType.USER, "ops");
        alpha.failWhen(event -> {
            if (event.globalSequence() == 3L) {
                job.cancel();
            }
            return false;
        });
        RebuildRecord cancelled = engine.rebuilds.run(job);

        assertThat(cancelled.status()).isEqualTo(RebuildStatus.CANCELLED);
        assertThat(cancelled.eventsReplayed()).isEqualTo(3L);
        ProjectorCheckpoint parked = engine.checkpoints.findByName("alpha").orElseThrow();
        assertThat(parked.status()).isEqualTo(ProjectorStatus.REBUILDING);
        assertThat(parked.cursor()).isEqualTo(3L);
        assertThat(engine.dispatcher.dispatch("alpha").outcome()).isEqualTo(DispatchResult.Outcome.SKIPPED);

        alpha.failWhen(event -> false);
        RebuildRecord resumed = engine.rebuilds.resume("alpha", ActorType.USER, "ops");

        assertThat(resumed.status()).isEqualTo(RebuildStatus.COMPLETED);
        assertThat(resumed.eventsReplayed()).isEqualTo(5L);
        assertThat(engine.snapshots.compare(expected, engine.snapshots.snapshot(List.of(alpha.table()))).equal())
            .isTrue();
        assertThat(engine.checkpoints.findByName("alpha").orElseThrow().status()).isEqualTo(ProjectorStatus.ACTIVE);
    }

    @Test
    @DisplayName("Cancel by rebuild ID reaches the running job")
    void testCancelById() {
        appendMany(5);
        AtomicReference<Boolean> accepted = new AtomicReference<>();
        RebuildJob job = engine.rebuilds.prepare("alpha", ActorType.USER, "ops");
        alpha.failWhen(event -> {
            if (event.globalSequence() == 2L && accepted.get() == null) {
                accepted.set(engine.rebuilds.cancel(job.rebuildId()));
            }
            return false;
        });

        RebuildRecord record = engine.rebuilds.run(job);

        assertThat(accepted.get()).isTrue();
        assertThat(record.status()).isEqualTo(RebuildStatus.CANCELLED);
        assertThat(engine.rebuilds.cancel(job.rebuildId())).isFalse();
    }

    @Test
    @DisplayName("A fresh rebuild starts a cancelled one over from the beginning")
    void testFreshRebuildAfterCancel() {
        appendMany(8);
        engine.dispatcher.dispatchAll();
        ProjectionSnapshot expected = engine.snapshots.snapshot(List.of(alpha.table()));
        parkAlphaAt(3L);

        RebuildRecord record = engine.rebuilds.rebuild("alpha", ActorType.USER, "ops");

        assertThat(record.status()).isEqualTo(RebuildStatus.COMPLETED);
        assertThat(record.eventsReplayed()).isEqualTo(8L);
        assertThat(engine.snapshots.compare(expected, engine.snapshots.snapshot(List.of(alpha.table()))).equal())
            .isTrue();
        ProjectorCheckpoint checkpoint = engine.checkpoints.findByName("alpha").orElseThrow();
        assertThat(checkpoint.status()).isEqualTo(ProjectorStatus.ACTIVE);
        assertThat(checkpoint.cursor()).isEqualTo(8L);
    }

    @Test
    @DisplayName("rebuildAll and verification run over a projector left mid-rebuild")
    void testParkedRebuildDoesNotBlockOthers() {
        appendMany(6);
        engine.dispatcher.dispatchAll();
        parkAlphaAt(2L);

        List<RebuildRecord> records = engine.rebuilds.rebuildAll(ActorType.SYSTEM, "test");

        assertThat(records).extracting(RebuildRecord::status)
            .containsExactly(RebuildStatus.COMPLETED, RebuildStatus.COMPLETED);

        parkAlphaAt(4L);
        VerificationReport report = engine.verifier.verify(List.of());

        assertThat(report.rebuilds()).extracting(RebuildRecord::status)
            .containsExactly(RebuildStatus.COMPLETED, RebuildStatus.COMPLETED);
        assertThat(report.differences()).hasSize(2)
            .contains("Table " + alpha.table() + ": row count differs (4 vs 6)");
        assertThat(engine.checkpoints.findAll()).extracting(ProjectorCheckpoint::status)
            .containsOnly(ProjectorStatus.ACTIVE);
        assertThat(engine.verifier.verify(List.of()).equal()).isTrue();
    }

    @Test
    @DisplayName("Resume is refused unless a rebuild was interrupted")
    void testResumeRequiresRebuilding() {
        appendMany(2);

        assertThatThrownBy(() -> engine.rebuilds.resume("alpha", ActorType.SYSTEM, "test"))
            .isInstanceOf(InvalidStateTransitionException.class);

        assertThat(engine.rebuilds.history(10)).singleElement()
            .extracting(RebuildRecord::status).isEqualTo(RebuildStatus.FAILED);
    }

    @Test
    @DisplayName("History lists the most recent rebuilds first")
    void testHistory() {
        appendMany(2);
        RebuildRecord first = engine.rebuilds.rebuild("alpha", ActorType.SYSTEM, "test");
        engine.clock.advance(Duration.ofMinutes(5));
        RebuildRecord second = engine.rebuilds.rebuild("beta", ActorType.SYSTEM, "test");

        assertThat(engine.rebuilds.history(10)).extracting(RebuildRecord::rebuildId)
            .containsExactly(second.rebuildId(), first.rebuildId());
        assertThat(engine.rebuilds.history(1)).hasSize(1);
    }

    private void parkAlphaAt(long sequence) {
        RebuildJob job = engine.rebuilds.prepare("alpha", ActorType.USER, "ops");
        alpha.failWhen(event -> {
            if (event.globalSequence() == sequence) {
                job.cancel();
            }
            return false;
        });
        assertThat(engine.rebuilds.run(job).status()).isEqualTo(RebuildStatus.CANCELLED);
        alpha.failWhen(event -> false);
    }

    private void appendMany(int count) {
        for (int i = 0; i < count; i++) {
            append(i % 2 == 0 ? "Opened" : "Closed");
        }
    }

    private Event append(String eventType) {
        return engine.append(RecordingProjector.AGGREGATE_TYPE, ticket, eventType, data("n", eventType));
    }
}
