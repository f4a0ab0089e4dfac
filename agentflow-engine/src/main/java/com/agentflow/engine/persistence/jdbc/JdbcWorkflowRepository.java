package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.exception.ExecutionStoreException;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.repository.WorkflowRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of WorkflowRepository.
 * The definition is stored as a JSONB document keyed by workflow id; loading
 * a workflow again replaces the stored definition.
 */
public class JdbcWorkflowRepository implements WorkflowRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Workflow> rowMapper;

    public JdbcWorkflowRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new WorkflowRowMapper();
    }

    /**
     * Create the workflow_definitions table if it does not exist.
     */
    public void initializeSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS workflow_definitions (
                workflow_id VARCHAR(255) PRIMARY KEY,
                version     VARCHAR(64) NOT NULL,
                updated_at  TIMESTAMPTZ NOT NULL,
                definition  JSONB NOT NULL
            )
            """);
        log.info("Workflow definition schema initialized");
    }

    @Override
    public void save(Workflow workflow) {
        String sql = """
            INSERT INTO workflow_definitions (workflow_id, version, updated_at, definition)
            VALUES (?, ?, ?, ?::jsonb)
            ON CONFLICT (workflow_id) DO UPDATE SET
                version = EXCLUDED.version,
                updated_at = EXCLUDED.updated_at,
                definition = EXCLUDED.definition
            """;
        try {
            jdbcTemplate.update(sql,
                workflow.id(),
                workflow.version(),
                Timestamp.from(Instant.now()),
                objectMapper.writeValueAsString(workflow)
            );
        } catch (JsonProcessingException | DataAccessException e) {
            throw new ExecutionStoreException("Failed to save workflow " + workflow.id(), e);
        }
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        String sql = "SELECT definition FROM workflow_definitions WHERE workflow_id = ?";
        try {
            List<Workflow> results = jdbcTemplate.query(sql, rowMapper, workflowId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new ExecutionStoreException("Failed to load workflow " + workflowId, e);
        }
    }

    @Override
    public List<Workflow> findAll() {
        String sql = "SELECT definition FROM workflow_definitions ORDER BY workflow_id";
        try {
            return jdbcTemplate.query(sql, rowMapper);
        } catch (DataAccessException e) {
            throw new ExecutionStoreException("Failed to list workflows", e);
        }
    }

    private class WorkflowRowMapper implements RowMapper<Workflow> {
        @Override
        public Workflow mapRow(ResultSet rs, int rowNum) throws SQLException {
            String json = rs.getString("definition");
            try {
                return objectMapper.readValue(json, Workflow.class);
            } catch (JsonProcessingException e) {
                throw new SQLException("Corrupt workflow definition", e);
            }
        }
    }
}
