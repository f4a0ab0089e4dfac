package com.agentflow.engine.service;

import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionResult;
import com.agentflow.core.model.ValidationResult;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.engine.status.ExecutionSummary;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Entry point for defining, running and observing workflows.
 */
public interface WorkflowEngine {

    // ========== Definitions ==========

    ValidationResult validate(Workflow workflow);

    /**
     * Validate and register a workflow definition, replacing any previous one with the same id.
     *
     * @throws com.agentflow.core.exception.WorkflowValidationException if the definition is invalid
     */
    void loadWorkflow(Workflow workflow);

    /**
     * @throws com.agentflow.core.exception.NotFoundException if no such workflow is loaded
     */
    Workflow getWorkflow(String workflowId);

    List<Workflow> listWorkflows();

    // ========== Execution ==========

    /**
     * Run a loaded workflow on the calling thread until it reaches a terminal status.
     */
    ExecutionResult execute(String workflowId, Map<String, JsonNode> initialContext);

    /**
     * Register and run a workflow on the calling thread.
     *
     * @throws com.agentflow.core.exception.WorkflowValidationException if the definition is invalid
     */
    ExecutionResult execute(Workflow workflow, Map<String, JsonNode> initialContext);

    /**
     * Start a loaded workflow in the background.
     */
    ExecutionHandle start(String workflowId, Map<String, JsonNode> initialContext);

    /**
     * Continue an interrupted execution from its last checkpoint on the calling thread.
     * Succeeded steps are not run again.
     *
     * @throws com.agentflow.core.exception.InvalidStateTransitionException if the execution is terminal or active
     */
    ExecutionResult resume(String executionId);

    ExecutionHandle resumeAsync(String executionId);

    /**
     * Cancel an execution and wait for its coordinator to record the outcome.
     *
     * @return the execution after cancellation
     * @throws com.agentflow.core.exception.InvalidStateTransitionException if the execution already finished
     */
    Execution cancel(String executionId);

    boolean isActive(String executionId);

    // ========== Status ==========

    Execution getExecutionStatus(String executionId);

    ExecutionSummary getExecutionSummary(String executionId);

    List<Execution> listExecutions(ExecutionQuery query);

    /**
     * Stop accepting work, wait up to the timeout for active executions, then
     * interrupt the rest. Interrupted executions stay resumable.
     */
    void shutdown(Duration timeout);
}
