package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.engine.json.ObjectMappers;
import com.agentflow.engine.test.Executions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs against a real PostgreSQL; skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcExecutionRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("agentflow_test")
        .withUsername("test")
        .withPassword("test");

    private JdbcTemplate jdbcTemplate;
    private JdbcExecutionRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        jdbcTemplate = new JdbcTemplate(dataSource);
        repository = new JdbcExecutionRepository(jdbcTemplate, ObjectMappers.json());
        repository.initializeSchema();
        jdbcTemplate.update("DELETE FROM executions");
    }

    @Test
    @DisplayName("Records round-trip through the JSONB column")
    void save_shouldPersistRecord() {
        Execution execution = Executions.sample("research", ExecutionStatus.RUNNING,
            Instant.now().truncatedTo(ChronoUnit.MILLIS));

        repository.save(execution);
        Execution loaded = repository.findById(execution.id()).orElseThrow();

        assertThat(loaded.workflowId()).isEqualTo("research");
        assertThat(loaded.step("fetch").status()).isEqualTo(StepStatus.SUCCEEDED);
        assertThat(loaded.contextSnapshot().data()).containsKeys("topic", "fetch");
    }

    @Test
    @DisplayName("Saving an existing id updates status and record")
    void save_shouldUpsert() {
        Execution execution = Executions.sample("research", ExecutionStatus.RUNNING, Instant.now());
        repository.save(execution);

        repository.save(execution.transitionTo(ExecutionStatus.FAILED));

        assertThat(repository.findById(execution.id()).orElseThrow().status()).isEqualTo(ExecutionStatus.FAILED);
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM executions", Integer.class);
        assertThat(rows).isEqualTo(1);
        String status = jdbcTemplate.queryForObject(
            "SELECT status FROM executions WHERE execution_id = ?", String.class, execution.id());
        assertThat(status).isEqualTo("failed");
    }

    @Test
    @DisplayName("Queries filter on the indexed columns")
    void findAll_shouldFilter() {
        Instant base = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        Execution running = Executions.sample("research", ExecutionStatus.RUNNING, base);
        Execution completed = Executions.sample("research", ExecutionStatus.COMPLETED, base.minusSeconds(10));
        Execution other = Executions.sample("publish", ExecutionStatus.RUNNING, base.minusSeconds(20));
        repository.save(running);
        repository.save(completed);
        repository.save(other);

        assertThat(repository.findAll(ExecutionQuery.byStatus(ExecutionStatus.RUNNING)))
            .extracting(Execution::id)
            .containsExactly(running.id(), other.id());
        assertThat(repository.findAll(ExecutionQuery.byWorkflow("publish")))
            .extracting(Execution::id)
            .containsExactly(other.id());
        assertThat(repository.findById("exec-missing")).isEmpty();
    }
}
