package com.agentflow.api.config;

import com.agentflow.core.repository.ExecutionRepository;
import com.agentflow.core.repository.WorkflowRepository;
import com.agentflow.engine.health.EngineHealthIndicator;
import com.agentflow.engine.json.ObjectMappers;
import com.agentflow.engine.lifecycle.GracefulShutdownHandler;
import com.agentflow.engine.loader.WorkflowLoader;
import com.agentflow.engine.metrics.MetricsConfiguration;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.engine.persistence.FileExecutionRepository;
import com.agentflow.engine.persistence.FileWorkflowRepository;
import com.agentflow.engine.persistence.InMemoryExecutionRepository;
import com.agentflow.engine.persistence.InMemoryWorkflowRepository;
import com.agentflow.engine.persistence.jdbc.JdbcExecutionRepository;
import com.agentflow.engine.persistence.jdbc.JdbcWorkflowRepository;
import com.agentflow.engine.service.DefaultWorkflowEngine;
import com.agentflow.provider.ProviderRegistrar;
import com.agentflow.provider.ProviderRegistry;
import com.agentflow.recovery.RecoveryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.List;

/**
 * Wires the plain-Java engine into the Spring context.
 */
@Configuration
@Import(MetricsConfiguration.class)
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    /** Subdirectory of the state directory holding stored workflow definitions. */
    static final String DEFINITIONS_DIRECTORY = "definitions";

    @Bean
    public ProviderRegistry providerRegistry(List<ProviderRegistrar> registrars) {
        ProviderRegistry.Builder builder = ProviderRegistry.builder();
        registrars.forEach(builder::apply);
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "agentflow.engine.store", havingValue = "jdbc")
    public JdbcTemplate agentflowJdbcTemplate(EngineProperties properties) {
        EngineProperties.Jdbc jdbc = properties.jdbc();
        if (jdbc.url() == null) {
            throw new IllegalStateException("agentflow.engine.jdbc.url is required for the jdbc store");
        }
        DataSource dataSource = DataSourceBuilder.create()
            .url(jdbc.url())
            .username(jdbc.username())
            .password(jdbc.password())
            .build();
        log.info("Using jdbc store at {}", jdbc.url());
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public ExecutionRepository executionRepository(
            EngineProperties properties,
            ObjectProvider<JdbcTemplate> jdbcTemplate) {
        return switch (properties.store()) {
            case MEMORY -> new InMemoryExecutionRepository();
            case FILE -> {
                log.info("Using file execution store at {}", properties.stateDirectory().toAbsolutePath());
                yield new FileExecutionRepository(properties.stateDirectory(), ObjectMappers.json());
            }
            case JDBC -> {
                JdbcExecutionRepository repository =
                    new JdbcExecutionRepository(jdbcTemplate.getObject(), ObjectMappers.json());
                if (properties.jdbc().initializeSchema()) {
                    repository.initializeSchema();
                }
                yield repository;
            }
        };
    }

    @Bean
    public WorkflowRepository workflowRepository(
            EngineProperties properties,
            ObjectProvider<JdbcTemplate> jdbcTemplate) {
        return switch (properties.store()) {
            case MEMORY -> new InMemoryWorkflowRepository();
            case FILE -> new FileWorkflowRepository(
                properties.stateDirectory().resolve(DEFINITIONS_DIRECTORY), ObjectMappers.json());
            case JDBC -> {
                JdbcWorkflowRepository repository =
                    new JdbcWorkflowRepository(jdbcTemplate.getObject(), ObjectMappers.json());
                if (properties.jdbc().initializeSchema()) {
                    repository.initializeSchema();
                }
                yield repository;
            }
        };
    }

    @Bean
    public DefaultWorkflowEngine workflowEngine(
            ProviderRegistry providerRegistry,
            ExecutionRepository executionRepository,
            WorkflowRepository workflowRepository,
            WorkflowMetrics workflowMetrics) {
        return DefaultWorkflowEngine.builder(providerRegistry)
            .executionRepository(executionRepository)
            .workflowRepository(workflowRepository)
            .metrics(workflowMetrics)
            .build();
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(DefaultWorkflowEngine engine, EngineProperties properties) {
        return new GracefulShutdownHandler(engine, properties.shutdownTimeout());
    }

    @Bean
    public EngineHealthIndicator engineHealthIndicator(
            DefaultWorkflowEngine engine,
            ExecutionRepository executionRepository,
            ProviderRegistry providerRegistry) {
        return new EngineHealthIndicator(engine, executionRepository, providerRegistry);
    }

    @Bean
    public WorkflowLoader workflowLoader() {
        return new WorkflowLoader();
    }

    @Bean
    public RecoveryEngine recoveryEngine(
            ExecutionRepository executionRepository,
            DefaultWorkflowEngine engine,
            EngineProperties properties) {
        return new RecoveryEngine(executionRepository, engine, properties.recovery().scanInterval());
    }
}
