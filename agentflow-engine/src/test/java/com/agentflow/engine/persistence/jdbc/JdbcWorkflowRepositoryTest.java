package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.BackoffStrategy;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.Step;
import com.agentflow.core.model.Workflow;
import com.agentflow.engine.json.ObjectMappers;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs against a real PostgreSQL; skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcWorkflowRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("agentflow_test")
        .withUsername("test")
        .withPassword("test");

    private JdbcWorkflowRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        repository = new JdbcWorkflowRepository(jdbcTemplate, ObjectMappers.json());
        repository.initializeSchema();
        jdbcTemplate.update("DELETE FROM workflow_definitions");
    }

    private static Workflow newsletter(String version) {
        return Workflow.builder("newsletter")
            .version(version)
            .maxConcurrent(2)
            .tokenBudget(5_000L)
            .step(Step.builder("outline")
                .agent("writer")
                .task(JsonNodeFactory.instance.objectNode().put("words", 300))
                .retryPolicy(RetryPolicy.builder().maxAttempts(2).delay(250).backoff(BackoffStrategy.LINEAR).build())
                .timeout(30_000L)
                .build())
            .step(Step.builder("polish").agent("editor").dependsOn("outline").optional(true).build())
            .build();
    }

    @Test
    @DisplayName("Definitions round-trip through the JSONB column")
    void save_shouldPersistDefinition() {
        repository.save(newsletter("1.0.0"));

        assertThat(repository.findById("newsletter")).contains(newsletter("1.0.0"));
        assertThat(repository.findById("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Loading a workflow again replaces the stored definition")
    void save_shouldReplaceExisting() {
        repository.save(newsletter("1.0.0"));
        repository.save(newsletter("1.1.0"));

        assertThat(repository.findAll()).extracting(Workflow::version).containsExactly("1.1.0");
    }
}
