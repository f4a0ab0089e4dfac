package com.agentflow.core.exception;

/**
 * A single attempt exceeded the step's timeout. Counts as a failed attempt.
 */
public class StepTimeoutException extends StepExecutionException {

    public static final String ERROR_CODE = "STEP_TIMEOUT";

    private final long timeoutMs;

    public StepTimeoutException(String stepId, long timeoutMs) {
        super(ERROR_CODE, stepId,
            String.format("Step %s timed out after %dms", stepId, timeoutMs),
            null, true, 0);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
