package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.exception.ExecutionStoreException;
import com.agentflow.core.model.Execution;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of ExecutionRepository.
 *
 * The full record is stored as a JSONB document; id, workflow, status and
 * timestamps are duplicated into columns for filtering and ordering.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Execution> rowMapper;

    public JdbcExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new ExecutionRowMapper();
    }

    /**
     * Create the executions table if it does not exist.
     */
    public void initializeSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS executions (
                execution_id    VARCHAR(64) PRIMARY KEY,
                workflow_id     VARCHAR(255) NOT NULL,
                status          VARCHAR(32) NOT NULL,
                started_at      TIMESTAMPTZ NOT NULL,
                completed_at    TIMESTAMPTZ,
                sequence_number BIGINT NOT NULL,
                record          JSONB NOT NULL
            )
            """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_executions_workflow_status
                ON executions (workflow_id, status, started_at DESC)
            """);
        log.info("Execution schema initialized");
    }

    @Override
    public void save(Execution execution) {
        String sql = """
            INSERT INTO executions (
                execution_id, workflow_id, status, started_at, completed_at, sequence_number, record
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (execution_id) DO UPDATE SET
                status = EXCLUDED.status,
                completed_at = EXCLUDED.completed_at,
                sequence_number = EXCLUDED.sequence_number,
                record = EXCLUDED.record
            """;
        try {
            jdbcTemplate.update(sql,
                execution.id(),
                execution.workflowId(),
                execution.status().value(),
                toTimestamp(execution.startedAt()),
                toTimestamp(execution.completedAt()),
                execution.sequenceNumber(),
                objectMapper.writeValueAsString(execution)
            );
        } catch (JsonProcessingException | DataAccessException e) {
            throw new ExecutionStoreException("Failed to save execution " + execution.id(), e);
        }
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        String sql = "SELECT record FROM executions WHERE execution_id = ?";
        try {
            List<Execution> results = jdbcTemplate.query(sql, rowMapper, executionId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new ExecutionStoreException("Failed to load execution " + executionId, e);
        }
    }

    @Override
    public List<Execution> findAll(ExecutionQuery query) {
        StringBuilder sql = new StringBuilder("SELECT record FROM executions WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.workflowId() != null) {
            sql.append(" AND workflow_id = ?");
            args.add(query.workflowId());
        }
        if (query.status() != null) {
            sql.append(" AND status = ?");
            args.add(query.status().value());
        }
        sql.append(" ORDER BY started_at DESC LIMIT ?");
        args.add(query.limit());
        try {
            return jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
        } catch (DataAccessException e) {
            throw new ExecutionStoreException("Failed to list executions", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class ExecutionRowMapper implements RowMapper<Execution> {
        @Override
        public Execution mapRow(ResultSet rs, int rowNum) throws SQLException {
            String json = rs.getString("record");
            try {
                return objectMapper.readValue(json, Execution.class);
            } catch (JsonProcessingException e) {
                throw new SQLException("Corrupt execution record", e);
            }
        }
    }
}
