package com.agentflow.engine.coordinator;

import com.agentflow.core.context.ContextAppender;
import com.agentflow.core.context.ContextEntry;
import com.agentflow.engine.executor.StepListener;

import java.util.concurrent.BlockingQueue;

/**
 * Worker-side handle of one step: forwards context appends and attempt progress
 * to the coordinator's queue instead of touching shared state.
 */
class QueueingContextAppender implements ContextAppender, StepListener {

    private final String stepId;
    private final BlockingQueue<CoordinatorEvent> events;

    QueueingContextAppender(String stepId, BlockingQueue<CoordinatorEvent> events) {
        this.stepId = stepId;
        this.events = events;
    }

    @Override
    public void appendHistory(ContextEntry entry) {
        events.add(new CoordinatorEvent.HistoryAppended(entry));
    }

    @Override
    public void addTokens(long tokens) {
        if (tokens < 0) {
            throw new IllegalArgumentException("Token delta must not be negative: " + tokens);
        }
        if (tokens > 0) {
            events.add(new CoordinatorEvent.TokensAdded(stepId, tokens));
        }
    }

    @Override
    public void onAttemptStarted(String stepId, int attempt) {
        events.add(new CoordinatorEvent.AttemptStarted(stepId, attempt));
    }

    @Override
    public void onAttemptFailed(String stepId, int attempt, String error, String errorCode, boolean willRetry) {
        events.add(new CoordinatorEvent.AttemptFailed(stepId, attempt, error, errorCode, willRetry));
    }
}
