package com.agentflow.core.exception;

/**
 * The engine is shutting down and accepts no new or resumed executions.
 */
public class EngineShutdownException extends AgentFlowException {

    public static final String ERROR_CODE = "ENGINE_UNAVAILABLE";

    public EngineShutdownException() {
        super(ERROR_CODE, "Workflow engine is shutting down");
    }
}
