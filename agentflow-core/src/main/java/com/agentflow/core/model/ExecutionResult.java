package com.agentflow.core.model;

import com.agentflow.core.context.ContextSnapshot;
import com.agentflow.core.exception.FatalStepFailureException;

import java.util.Map;

/**
 * Outcome of a finished (or cancelled) execution, as returned to the caller.
 */
public record ExecutionResult(
    String executionId,
    ExecutionStatus status,
    Map<String, StepRecord> stepResults,
    ContextSnapshot finalContext,
    String lastError,
    String lastErrorStepId
) {
    public static ExecutionResult from(Execution execution) {
        return new ExecutionResult(
            execution.id(),
            execution.status(),
            execution.steps(),
            execution.contextSnapshot(),
            execution.lastError(),
            execution.lastErrorStepId()
        );
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }

    /**
     * Return this result if the execution completed, otherwise throw.
     *
     * @throws FatalStepFailureException if the execution did not complete
     */
    public ExecutionResult requireSuccess() {
        if (!isSuccess()) {
            String reason = lastError != null ? lastError : "execution " + status.value();
            throw new FatalStepFailureException(executionId, lastErrorStepId, reason);
        }
        return this;
    }
}
