package com.agentflow.core.exception;

/**
 * Thrown when a requested workflow or execution does not exist.
 */
public class NotFoundException extends AgentFlowException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(ERROR_CODE, message);
    }

    public static NotFoundException workflow(String workflowId) {
        return new NotFoundException("Workflow not found: " + workflowId);
    }

    public static NotFoundException execution(String executionId) {
        return new NotFoundException("Execution not found: " + executionId);
    }
}
