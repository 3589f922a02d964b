package com.lifecycle.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifecycle.core.projection.ReadModelStore;
import com.lifecycle.core.repository.CheckpointRepository;
import com.lifecycle.core.repository.EventRepository;
import com.lifecycle.core.repository.RebuildAuditRepository;
import com.lifecycle.engine.persistence.InMemoryCheckpointRepository;
import com.lifecycle.engine.persistence.InMemoryEventRepository;
import com.lifecycle.engine.persistence.InMemoryReadModelStore;
import com.lifecycle.engine.persistence.InMemoryReadModelTransactions;
import com.lifecycle.engine.persistence.InMemoryRebuildAuditRepository;
import com.lifecycle.engine.persistence.jdbc.JdbcCheckpointRepository;
import com.lifecycle.engine.persistence.jdbc.JdbcEventRepository;
import com.lifecycle.engine.persistence.jdbc.JdbcReadModelStore;
import com.lifecycle.engine.persistence.jdbc.JdbcRebuildAuditRepository;
import com.lifecycle.engine.projection.ProjectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Storage beans, selected by {@code lifecycle.store.type}:
 * - jdbc (default): PostgreSQL through JdbcTemplate, one transaction per applied event
 * - memory: in-process collections, no transactions
 */
@Configuration(proxyBeanMethods = false)
public class PersistenceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "lifecycle.store.type", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStore {

        @Bean
        public EventRepository eventRepository(JdbcTemplate jdbcTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            log.info("Using PostgreSQL event store");
            return new JdbcEventRepository(jdbcTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        public CheckpointRepository checkpointRepository(JdbcTemplate jdbcTemplate, Clock clock) {
            return new JdbcCheckpointRepository(jdbcTemplate, clock);
        }

        @Bean
        public RebuildAuditRepository rebuildAuditRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcRebuildAuditRepository(jdbcTemplate);
        }

        @Bean
        public ReadModelStore readModelStore(JdbcTemplate jdbcTemplate, ProjectorRegistry registry) {
            return new JdbcReadModelStore(jdbcTemplate, registry.catalog());
        }

        @Bean
        public TransactionOperations projectionTransactions(PlatformTransactionManager transactionManager) {
            return new TransactionTemplate(transactionManager);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "lifecycle.store.type", havingValue = "memory")
    static class MemoryStore {

        @Bean
        public EventRepository eventRepository() {
            log.warn("Using in-memory event store; events are lost on restart");
            return new InMemoryEventRepository();
        }

        @Bean
        public CheckpointRepository checkpointRepository(Clock clock) {
            return new InMemoryCheckpointRepository(clock);
        }

        @Bean
        public RebuildAuditRepository rebuildAuditRepository() {
            return new InMemoryRebuildAuditRepository();
        }

        @Bean
        public InMemoryReadModelStore readModelStore(ProjectorRegistry registry) {
            return new InMemoryReadModelStore(registry.catalog());
        }

        @Bean
        public TransactionOperations projectionTransactions(InMemoryReadModelStore readModelStore) {
            return new InMemoryReadModelTransactions(readModelStore);
        }
    }
}
