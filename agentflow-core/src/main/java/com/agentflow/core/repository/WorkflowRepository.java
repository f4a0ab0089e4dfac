package com.agentflow.core.repository;

import com.agentflow.core.model.Workflow;

import java.util.List;
import java.util.Optional;

/**
 * Registry of loaded workflow definitions.
 */
public interface WorkflowRepository {

    /**
     * Store a definition, replacing any previous one with the same id.
     */
    void save(Workflow workflow);

    Optional<Workflow> findById(String workflowId);

    List<Workflow> findAll();
}
