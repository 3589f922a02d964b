package com.lifecycle.engine.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for the event store and projectors.
 * Exposes key operational metrics for monitoring and alerting.
 * 
 * Metrics exposed:
 * - Appends and sequence conflicts per aggregate type
 * - Projector apply latency and failures
 * - Rebuild duration by outcome
 * - Per-projector lag behind the head of the log
 */
public class EventStoreMetrics implements MeterBinder {

    // Metric names
    public static final String EVENTS_APPENDED = "lifecycle.events.appended";
    public static final String APPEND_CONFLICTS = "lifecycle.append.conflicts";
    public static final String APPEND_FAILURES = "lifecycle.append.failures";

    public static final String PROJECTOR_APPLY = "lifecycle.projector.apply";
    public static final String PROJECTOR_FAILURES = "lifecycle.projector.failures";
    public static final String PROJECTOR_LAG = "lifecycle.projector.lag";

    public static final String REBUILD_DURATION = "lifecycle.rebuild.duration";
    public static final String REDACTIONS = "lifecycle.events.redacted";

    // Replaced by the application registry once bound
    private volatile MeterRegistry registry = new SimpleMeterRegistry();

    private final ConcurrentHashMap<String, AtomicLong> lagGauges = new ConcurrentHashMap<>();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        lagGauges.forEach((name, gauge) -> registerLagGauge(name, gauge));
    }

    // ========== Append Metrics ==========

    public void eventAppended(String aggregateType, String eventType) {
        Counter.builder(EVENTS_APPENDED)
            .tag("aggregate_type", aggregateType)
            .tag("event_type", eventType)
            .description("Total events appended")
            .register(registry)
            .increment();
    }

    public void appendConflict(String aggregateType, boolean pinned) {
        Counter.builder(APPEND_CONFLICTS)
            .tag("aggregate_type", aggregateType)
            .tag("pinned", String.valueOf(pinned))
            .description("Sequence conflicts on append")
            .register(registry)
            .increment();
    }

    public void appendFailed(String aggregateType) {
        Counter.builder(APPEND_FAILURES)
            .tag("aggregate_type", aggregateType)
            .description("Appends that exhausted their retries")
            .register(registry)
            .increment();
    }

    public void eventRedacted(String aggregateType) {
        Counter.builder(REDACTIONS)
            .tag("aggregate_type", aggregateType)
            .description("Events whose payload was redacted")
            .register(registry)
            .increment();
    }

    // ========== Projector Metrics ==========

    public void eventApplied(String projectorName, Duration duration) {
        Timer.builder(PROJECTOR_APPLY)
            .tag("projector", projectorName)
            .description("Time to apply one event and advance the checkpoint")
            .register(registry)
            .record(duration);
    }

    public void projectorFailed(String projectorName, String errorType) {
        Counter.builder(PROJECTOR_FAILURES)
            .tag("projector", projectorName)
            .tag("error_type", errorType)
            .description("Projector apply failures")
            .register(registry)
            .increment();
    }

    /**
     * Update the lag gauge of a projector, registering it on first use.
     */
    public void syncProjectorLag(String projectorName, long lag) {
        lagGauges.computeIfAbsent(projectorName, name -> {
            AtomicLong gauge = new AtomicLong(0);
            registerLagGauge(name, gauge);
            return gauge;
        }).set(lag);
    }

    private void registerLagGauge(String projectorName, AtomicLong gauge) {
        Gauge.builder(PROJECTOR_LAG, gauge, AtomicLong::get)
            .tag("projector", projectorName)
            .description("Events in the log not yet processed by the projector")
            .register(registry);
    }

    public long projectorLag(String projectorName) {
        AtomicLong gauge = lagGauges.get(projectorName);
        return gauge != null ? gauge.get() : 0L;
    }

    // ========== Rebuild Metrics ==========

    public void rebuildFinished(String projectorName, String outcome, Duration duration) {
        Timer.builder(REBUILD_DURATION)
            .tag("projector", projectorName)
            .tag("outcome", outcome)
            .description("Projection rebuild duration")
            .register(registry)
            .record(duration);
    }

    public MeterRegistry registry() {
        return registry;
    }
}
