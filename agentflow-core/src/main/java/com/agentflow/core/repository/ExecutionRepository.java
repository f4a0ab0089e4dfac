package com.agentflow.core.repository;

import com.agentflow.core.model.Execution;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of execution records.
 */
public interface ExecutionRepository {

    /**
     * Insert or replace the record with the same id. Last write wins.
     *
     * @throws com.agentflow.core.exception.ExecutionStoreException on I/O failure
     */
    void save(Execution execution);

    Optional<Execution> findById(String executionId);

    /**
     * Find executions matching the query, most recently started first.
     */
    List<Execution> findAll(ExecutionQuery query);
}
