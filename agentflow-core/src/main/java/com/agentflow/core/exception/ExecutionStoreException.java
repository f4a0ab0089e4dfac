package com.agentflow.core.exception;

/**
 * Reading or writing an execution record failed.
 */
public class ExecutionStoreException extends AgentFlowException {

    public static final String ERROR_CODE = "EXECUTION_STORE_FAILURE";

    public ExecutionStoreException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
