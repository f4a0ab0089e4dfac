package com.agentflow.core.exception;

/**
 * A workflow definition file could not be read or parsed.
 */
public class WorkflowLoadException extends AgentFlowException {

    public static final String ERROR_CODE = "WORKFLOW_LOAD_FAILED";

    public WorkflowLoadException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
