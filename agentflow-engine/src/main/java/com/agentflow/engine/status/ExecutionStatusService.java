package com.agentflow.engine.status;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.Execution;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only queries over executions. The live record of an execution running in
 * this process is preferred over the last stored checkpoint.
 */
public class ExecutionStatusService {

    private final ExecutionRepository repository;
    private final Function<String, Optional<Execution>> liveSource;

    /**
     * @param liveSource looks up the in-memory record of an active execution
     */
    public ExecutionStatusService(ExecutionRepository repository, Function<String, Optional<Execution>> liveSource) {
        this.repository = repository;
        this.liveSource = liveSource;
    }

    /**
     * Get an execution by id.
     *
     * @throws NotFoundException if the id is unknown
     */
    public Execution getExecution(String executionId) {
        return liveSource.apply(executionId)
            .or(() -> repository.findById(executionId))
            .orElseThrow(() -> NotFoundException.execution(executionId));
    }

    public ExecutionSummary getSummary(String executionId) {
        return ExecutionSummary.from(getExecution(executionId));
    }

    /**
     * List executions matching the query, most recently started first.
     */
    public List<Execution> list(ExecutionQuery query) {
        Map<String, Execution> byId = new LinkedHashMap<>();
        for (Execution stored : repository.findAll(query)) {
            byId.put(stored.id(), liveSource.apply(stored.id()).orElse(stored));
        }
        List<Execution> result = new ArrayList<>(byId.values());
        result.removeIf(e -> !query.matches(e));
        result.sort(Comparator.comparing(Execution::startedAt).reversed());
        return result.stream().limit(query.limit()).collect(Collectors.toList());
    }
}
