package com.lifecycle.engine.config;

import com.lifecycle.core.model.RetryPolicy;
import com.lifecycle.core.projection.Projector;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.repository.CheckpointRepository;
import com.lifecycle.core.repository.EventRepository;
import com.lifecycle.core.repository.RebuildAuditRepository;
import com.lifecycle.engine.health.ProjectorHealthIndicator;
import com.lifecycle.engine.metrics.EventStoreMetrics;
import com.lifecycle.engine.projection.CheckpointService;
import com.lifecycle.engine.projection.ProjectorDispatcher;
import com.lifecycle.engine.projection.ProjectorLagMonitor;
import com.lifecycle.engine.projection.ProjectorLocks;
import com.lifecycle.engine.projection.ProjectorRegistry;
import com.lifecycle.engine.projection.ProjectorScheduler;
import com.lifecycle.engine.projection.companyproduct.CompanyProductReadModelProjector;
import com.lifecycle.engine.projection.companyproduct.CompanyProductStageFactsProjector;
import com.lifecycle.engine.projection.supportcase.OpenCaseCountsProjector;
import com.lifecycle.engine.projection.supportcase.SupportCaseReadModelProjector;
import com.lifecycle.engine.rebuild.ProjectionSnapshotService;
import com.lifecycle.engine.rebuild.ProjectionVerifier;
import com.lifecycle.engine.rebuild.RebuildService;
import com.lifecycle.engine.service.EventAppendService;
import com.lifecycle.engine.service.EventRedactionService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.util.List;

/**
 * Wires the append path, the projectors and the rebuild tooling.
 * Projectors are registered, and rebuilt by rebuildAll, in bean order.
 */
@Configuration(proxyBeanMethods = false)
@EnableScheduling
@EnableConfigurationProperties(LifecycleProperties.class)
public class EventStoreConfiguration {

    @Bean
    public RetryPolicy appendRetryPolicy(LifecycleProperties properties) {
        LifecycleProperties.Append append = properties.getAppend();
        return new RetryPolicy(append.getMaxAttempts(), append.getInitialBackoff(), append.getMaxBackoff(), 2.0, 0.2);
    }

    @Bean
    public EventAppendService eventAppendService(EventRepository eventRepository, RetryPolicy appendRetryPolicy,
                                                 EventStoreMetrics metrics, Clock clock) {
        return new EventAppendService(eventRepository, appendRetryPolicy, metrics, clock);
    }

    @Bean
    public EventRedactionService eventRedactionService(EventRepository eventRepository,
                                                       EventStoreMetrics metrics, Clock clock) {
        return new EventRedactionService(eventRepository, metrics, clock);
    }

    @Bean
    @Order(1)
    public SupportCaseReadModelProjector supportCaseReadModelProjector() {
        return new SupportCaseReadModelProjector();
    }

    @Bean
    @Order(2)
    public OpenCaseCountsProjector openCaseCountsProjector() {
        return new OpenCaseCountsProjector();
    }

    @Bean
    @Order(3)
    public CompanyProductReadModelProjector companyProductReadModelProjector() {
        return new CompanyProductReadModelProjector();
    }

    @Bean
    @Order(4)
    public CompanyProductStageFactsProjector companyProductStageFactsProjector() {
        return new CompanyProductStageFactsProjector();
    }

    @Bean
    public ProjectorRegistry projectorRegistry(List<Projector> projectors, CheckpointRepository checkpointRepository) {
        ProjectorRegistry registry = new ProjectorRegistry(projectors, checkpointRepository);
        registry.registerCheckpoints();
        return registry;
    }

    @Bean
    public ProjectorLocks projectorLocks() {
        return new ProjectorLocks();
    }

    @Bean
    public ProjectorDispatcher projectorDispatcher(ProjectorRegistry registry,
                                                   EventRepository eventRepository,
                                                   CheckpointRepository checkpointRepository,
                                                   ReadModelStore readModelStore,
                                                   TransactionOperations projectionTransactions,
                                                   ProjectorLocks locks,
                                                   EventStoreMetrics metrics,
                                                   LifecycleProperties properties) {
        return new ProjectorDispatcher(registry, eventRepository, checkpointRepository, readModelStore,
            projectionTransactions, locks, metrics, properties.getProjectors().getBatchSize());
    }

    @Bean
    public CheckpointService checkpointService(ProjectorRegistry registry, CheckpointRepository checkpointRepository,
                                               EventRepository eventRepository, ProjectorLocks locks) {
        return new CheckpointService(registry, checkpointRepository, eventRepository, locks);
    }

    @Bean
    public RebuildService rebuildService(ProjectorRegistry registry,
                                         EventRepository eventRepository,
                                         CheckpointRepository checkpointRepository,
                                         RebuildAuditRepository rebuildAuditRepository,
                                         ReadModelStore readModelStore,
                                         TransactionOperations projectionTransactions,
                                         ProjectorLocks locks,
                                         EventStoreMetrics metrics,
                                         Clock clock,
                                         LifecycleProperties properties) {
        return new RebuildService(registry, eventRepository, checkpointRepository, rebuildAuditRepository,
            readModelStore, projectionTransactions, locks, metrics, clock,
            properties.getProjectors().getBatchSize());
    }

    @Bean
    public ProjectionSnapshotService projectionSnapshotService(ReadModelStore readModelStore, ProjectorRegistry registry,
                                                               Clock clock, LifecycleProperties properties) {
        return new ProjectionSnapshotService(readModelStore, registry.catalog(), clock,
            properties.getSnapshot().getSampleSize());
    }

    @Bean
    public ProjectionVerifier projectionVerifier(ProjectorRegistry registry, RebuildService rebuildService,
                                                 ProjectionSnapshotService snapshotService) {
        return new ProjectionVerifier(registry, rebuildService, snapshotService);
    }

    @Bean
    public ProjectorHealthIndicator projectorHealthIndicator(EventRepository eventRepository,
                                                             CheckpointRepository checkpointRepository) {
        return new ProjectorHealthIndicator(eventRepository, checkpointRepository);
    }

    @Bean
    public ProjectorLagMonitor projectorLagMonitor(EventRepository eventRepository,
                                                   CheckpointRepository checkpointRepository,
                                                   EventStoreMetrics metrics) {
        return new ProjectorLagMonitor(eventRepository, checkpointRepository, metrics);
    }

    @Bean
    @ConditionalOnProperty(name = "lifecycle.projectors.scheduling-enabled", havingValue = "true", matchIfMissing = true)
    public ProjectorScheduler projectorScheduler(ProjectorRegistry registry, ProjectorDispatcher dispatcher,
                                                 LifecycleProperties properties) {
        return new ProjectorScheduler(registry, dispatcher, properties.getProjectors().getWorkerThreads());
    }
}
