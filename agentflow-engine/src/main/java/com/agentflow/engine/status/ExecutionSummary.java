package com.agentflow.engine.status;

import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.StepRecord;
import com.agentflow.core.model.StepStatus;

import java.time.Instant;

/**
 * Compact progress view of an execution.
 */
public record ExecutionSummary(
    String executionId,
    String workflowId,
    ExecutionStatus status,
    int totalSteps,
    int completedSteps,
    int failedSteps,
    int skippedSteps,
    int runningSteps,
    long totalTokens,
    Instant startedAt,
    Instant completedAt,
    String lastError,
    String lastErrorStepId
) {
    public static ExecutionSummary from(Execution execution) {
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        int running = 0;
        for (StepRecord record : execution.steps().values()) {
            StepStatus status = record.status();
            if (status == StepStatus.SUCCEEDED) {
                completed++;
            } else if (status == StepStatus.FAILED) {
                failed++;
            } else if (status == StepStatus.SKIPPED) {
                skipped++;
            } else if (status.isInFlight()) {
                running++;
            }
        }
        long tokens = execution.contextSnapshot() != null && execution.contextSnapshot().metadata() != null
            ? execution.contextSnapshot().metadata().totalTokens()
            : 0;
        return new ExecutionSummary(
            execution.id(),
            execution.workflowId(),
            execution.status(),
            execution.steps().size(),
            completed,
            failed,
            skipped,
            running,
            tokens,
            execution.startedAt(),
            execution.completedAt(),
            execution.lastError(),
            execution.lastErrorStepId()
        );
    }
}
