package com.agentflow.core.exception;

/**
 * A non-optional step exhausted its attempts and failed the execution.
 */
public class FatalStepFailureException extends AgentFlowException {

    public static final String ERROR_CODE = "FATAL_STEP_FAILURE";

    private final String executionId;
    private final String stepId;

    public FatalStepFailureException(String executionId, String stepId, String message) {
        super(ERROR_CODE, String.format("Execution %s failed at step %s: %s",
            executionId, stepId, message));
        this.executionId = executionId;
        this.stepId = stepId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getStepId() {
        return stepId;
    }
}
