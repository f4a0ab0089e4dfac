package com.agentflow.engine.coordinator;

import com.agentflow.core.context.ContextEntry;
import com.agentflow.engine.executor.StepResult;

/**
 * Messages posted by worker threads to the coordinator of an execution.
 * The coordinator applies them one at a time, in arrival order.
 */
public interface CoordinatorEvent {

    record AttemptStarted(String stepId, int attempt) implements CoordinatorEvent {
    }

    record AttemptFailed(String stepId, int attempt, String error, String errorCode, boolean willRetry)
        implements CoordinatorEvent {
    }

    record HistoryAppended(ContextEntry entry) implements CoordinatorEvent {
    }

    record TokensAdded(String stepId, long tokens) implements CoordinatorEvent {
    }

    record StepFinished(StepResult result) implements CoordinatorEvent {
    }

    record CancelRequested() implements CoordinatorEvent {
    }
}
