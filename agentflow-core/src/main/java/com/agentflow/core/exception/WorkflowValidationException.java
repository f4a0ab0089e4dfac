package com.agentflow.core.exception;

import java.util.List;

/**
 * Thrown when a workflow definition fails validation.
 * Carries every error found, not just the first.
 */
public class WorkflowValidationException extends AgentFlowException {

    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";

    private final List<String> errors;

    public WorkflowValidationException(String workflowId, List<String> errors) {
        super(ERROR_CODE, String.format("Invalid workflow definition %s: %s",
            workflowId, String.join("; ", errors)));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
