package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Per-step state inside an execution record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepRecord(
    StepStatus status,
    int attempts,
    Instant startedAt,
    Instant endedAt,
    String error,
    String errorCode,
    JsonNode output,
    long tokensUsed
) {
    public static StepRecord pending() {
        return new StepRecord(StepStatus.PENDING, 0, null, null, null, null, null, 0);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public StepRecord withStatus(StepStatus newStatus) {
        return new StepRecord(newStatus, attempts, startedAt, endedAt, error, errorCode, output, tokensUsed);
    }

    /**
     * Record the start of an attempt. The first attempt also sets startedAt.
     */
    public StepRecord withAttemptStarted(int attempt, Instant at) {
        return new StepRecord(StepStatus.RUNNING, attempt, startedAt != null ? startedAt : at,
            null, error, errorCode, output, tokensUsed);
    }

    /**
     * Record a failed attempt that will be retried.
     */
    public StepRecord withRetrying(int attempt, String attemptError, String attemptErrorCode) {
        return new StepRecord(StepStatus.RETRYING, attempt, startedAt, endedAt,
            attemptError, attemptErrorCode, output, tokensUsed);
    }

    public StepRecord withTokensAdded(long tokens) {
        return new StepRecord(status, attempts, startedAt, endedAt, error, errorCode, output, tokensUsed + tokens);
    }

    public StepRecord withSucceeded(int totalAttempts, JsonNode result, Instant at) {
        return new StepRecord(StepStatus.SUCCEEDED, totalAttempts, startedAt, at, null, null, result, tokensUsed);
    }

    public StepRecord withFailed(int totalAttempts, String failure, String failureCode, Instant at) {
        return new StepRecord(StepStatus.FAILED, totalAttempts, startedAt, at, failure, failureCode, null, tokensUsed);
    }

    public StepRecord withSkipped(String reason, Instant at) {
        return new StepRecord(StepStatus.SKIPPED, attempts, startedAt, at, reason, null, null, tokensUsed);
    }

    /**
     * Return an interrupted step to PENDING so a resumed execution runs it again.
     * Attempts already spent are kept for the record.
     */
    public StepRecord resetForResume() {
        return new StepRecord(StepStatus.PENDING, attempts, null, null, error, errorCode, null, tokensUsed);
    }
}
