package com.agentflow.core.exception;

/**
 * Base exception for all engine errors.
 */
public class AgentFlowException extends RuntimeException {

    private final String errorCode;

    public AgentFlowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AgentFlowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
