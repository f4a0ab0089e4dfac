package com.agentflow.core.exception;

/**
 * A failed attempt of a step. Retried according to the step's retry policy
 * unless {@link #isRetryable()} is false.
 */
public class StepExecutionException extends AgentFlowException {

    public static final String ERROR_CODE = "STEP_EXECUTION_FAILED";

    private final String stepId;
    private final boolean retryable;
    private final long tokensUsed;

    public StepExecutionException(String stepId, String message, Throwable cause) {
        this(ERROR_CODE, stepId, message, cause, true, 0);
    }

    public StepExecutionException(String errorCode, String stepId, String message,
                                  Throwable cause, boolean retryable, long tokensUsed) {
        super(errorCode != null ? errorCode : ERROR_CODE, message, cause);
        this.stepId = stepId;
        this.retryable = retryable;
        this.tokensUsed = tokensUsed;
    }

    public String getStepId() {
        return stepId;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Tokens the provider reported before failing.
     */
    public long getTokensUsed() {
        return tokensUsed;
    }
}
