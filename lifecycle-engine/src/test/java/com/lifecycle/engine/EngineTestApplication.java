package com.lifecycle.engine;

import com.lifecycle.engine.config.EventStoreConfiguration;
import com.lifecycle.engine.config.PersistenceConfiguration;
import com.lifecycle.engine.metrics.MetricsConfiguration;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.context.annotation.Import;

/**
 * Boot context for engine integration tests: the engine configuration
 * classes on top of Spring Boot's JDBC auto-configuration.
 */
@SpringBootConfiguration
@EnableAutoConfiguration
@Import({PersistenceConfiguration.class, EventStoreConfiguration.class, MetricsConfiguration.class})
public class EngineTestApplication {
}
