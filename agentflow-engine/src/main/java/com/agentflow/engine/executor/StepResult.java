package com.agentflow.engine.executor;

import com.agentflow.core.model.StepStatus;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of running a step through all of its attempts.
 *
 * @param status    SUCCEEDED or FAILED
 * @param cancelled true if the loop stopped because the execution was cancelled or interrupted;
 *                  status is FAILED in that case and the coordinator decides what it means
 */
public record StepResult(
    String stepId,
    StepStatus status,
    JsonNode output,
    String error,
    String errorCode,
    int attempts,
    long tokensUsed,
    long durationMs,
    boolean cancelled
) {
    public static StepResult succeeded(String stepId, JsonNode output, int attempts, long tokensUsed, long durationMs) {
        return new StepResult(stepId, StepStatus.SUCCEEDED, output, null, null, attempts, tokensUsed, durationMs, false);
    }

    public static StepResult failed(String stepId, String error, String errorCode,
                                    int attempts, long tokensUsed, long durationMs) {
        return new StepResult(stepId, StepStatus.FAILED, null, error, errorCode, attempts, tokensUsed, durationMs, false);
    }

    public static StepResult cancelled(String stepId, int attempts, long tokensUsed, long durationMs) {
        return new StepResult(stepId, StepStatus.FAILED, null, "Cancelled", "CANCELLED",
            attempts, tokensUsed, durationMs, true);
    }

    public boolean isSuccess() {
        return status == StepStatus.SUCCEEDED;
    }
}
