package com.agentflow.core.exception;

import com.agentflow.core.model.ExecutionStatus;

/**
 * Thrown when an operation would move an execution through an illegal transition,
 * such as resuming or cancelling an execution that already finished.
 */
public class InvalidStateTransitionException extends AgentFlowException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    private final ExecutionStatus currentStatus;

    public InvalidStateTransitionException(String executionId, ExecutionStatus currentStatus, String operation) {
        super(ERROR_CODE, String.format("Cannot %s execution %s in status %s",
            operation, executionId, currentStatus));
        this.currentStatus = currentStatus;
    }

    public ExecutionStatus getCurrentStatus() {
        return currentStatus;
    }
}
