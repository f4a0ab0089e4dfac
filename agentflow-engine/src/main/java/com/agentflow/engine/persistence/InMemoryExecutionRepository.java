package com.agentflow.engine.persistence;

import com.agentflow.core.model.Execution;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ExecutionRepository.
 * Records do not survive a restart; for tests and embedded use.
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    private final Map<String, Execution> executions = new ConcurrentHashMap<>();

    @Override
    public void save(Execution execution) {
        executions.put(execution.id(), execution);
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<Execution> findAll(ExecutionQuery query) {
        return executions.values().stream()
            .filter(query::matches)
            .sorted(Comparator.comparing(Execution::startedAt).reversed())
            .limit(query.limit())
            .collect(Collectors.toList());
    }

    /**
     * Get the number of stored executions.
     */
    public int size() {
        return executions.size();
    }
}
