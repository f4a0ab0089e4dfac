package com.agentflow.core.repository;

import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionStatus;

/**
 * Filter for listing executions. Null fields match everything.
 */
public record ExecutionQuery(
    String workflowId,
    ExecutionStatus status,
    int limit
) {
    public static final int DEFAULT_LIMIT = 100;

    public ExecutionQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static ExecutionQuery all() {
        return new ExecutionQuery(null, null, DEFAULT_LIMIT);
    }

    public static ExecutionQuery byStatus(ExecutionStatus status) {
        return new ExecutionQuery(null, status, DEFAULT_LIMIT);
    }

    public static ExecutionQuery byWorkflow(String workflowId) {
        return new ExecutionQuery(workflowId, null, DEFAULT_LIMIT);
    }

    /**
     * Check if an execution passes the filter. Limit is not considered.
     */
    public boolean matches(Execution execution) {
        return (workflowId == null || workflowId.equals(execution.workflowId()))
            && (status == null || status == execution.status());
    }
}
