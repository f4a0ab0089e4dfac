package com.agentflow.engine.persistence;

import com.agentflow.core.model.Workflow;
import com.agentflow.core.repository.WorkflowRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of loaded workflow definitions.
 */
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();

    @Override
    public void save(Workflow workflow) {
        workflows.put(workflow.id(), workflow);
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public List<Workflow> findAll() {
        List<Workflow> all = new ArrayList<>(workflows.values());
        all.sort(Comparator.comparing(Workflow::id));
        return all;
    }
}
