package com.lifecycle.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the event store, projectors and verification,
 * bound from the {@code lifecycle.*} namespace.
 */
@Validated
@ConfigurationProperties(prefix = "lifecycle")
public class LifecycleProperties {

    @Valid
    private Store store = new Store();

    @Valid
    private Append append = new Append();

    @Valid
    private Projectors projectors = new Projectors();

    @Valid
    private Snapshot snapshot = new Snapshot();

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Append getAppend() {
        return append;
    }

    public void setAppend(Append append) {
        this.append = append;
    }

    public Projectors getProjectors() {
        return projectors;
    }

    public void setProjectors(Projectors projectors) {
        this.projectors = projectors;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    public enum StoreType {
        JDBC, MEMORY
    }

    public static class Store {
        /** Backing store for events, checkpoints and read models. */
        @NotNull
        private StoreType type = StoreType.JDBC;

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }
    }

    public static class Append {
        /** Attempts for an unpinned append that keeps hitting sequence conflicts. */
        @Min(1)
        private int maxAttempts = 5;

        /** Backoff before the second attempt; doubles up to maxBackoff. */
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(10);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(1);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class Projectors {
        /** Events read per batch while dispatching or replaying. */
        @Min(1)
        private int batchSize = 500;

        /** Delay between scheduler ticks. */
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(1);

        /** Whether the background scheduler dispatches projectors. */
        private boolean schedulingEnabled = true;

        /** Worker threads used to dispatch projectors concurrently. */
        @Min(1)
        private int workerThreads = 4;

        /** Interval at which projector lag gauges are refreshed. */
        @NotNull
        private Duration lagSyncInterval = Duration.ofSeconds(30);

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public boolean isSchedulingEnabled() {
            return schedulingEnabled;
        }

        public void setSchedulingEnabled(boolean schedulingEnabled) {
            this.schedulingEnabled = schedulingEnabled;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public Duration getLagSyncInterval() {
            return lagSyncInterval;
        }

        public void setLagSyncInterval(Duration lagSyncInterval) {
            this.lagSyncInterval = lagSyncInterval;
        }
    }

    public static class Snapshot {
        /** Rows included as samples in each table snapshot (0 = none). */
        @Min(0)
        private int sampleSize = 0;

        public int getSampleSize() {
            return sampleSize;
        }

        public void setSampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
        }
    }
}
