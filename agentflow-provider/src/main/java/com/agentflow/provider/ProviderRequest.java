package com.agentflow.provider;

import com.agentflow.core.context.ContextView;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Input of a single provider attempt.
 */
public class ProviderRequest {

    private final String executionId;
    private final String stepId;
    private final String agentId;
    private final JsonNode task;
    private final int attempt;
    private final ContextView context;
    private final CancellationSignal cancellation;

    public ProviderRequest(
            String executionId,
            String stepId,
            String agentId,
            JsonNode task,
            int attempt,
            ContextView context,
            CancellationSignal cancellation) {
        this.executionId = executionId;
        this.stepId = stepId;
        this.agentId = agentId;
        this.task = task;
        this.attempt = attempt;
        this.context = context;
        this.cancellation = cancellation != null ? cancellation : CancellationSignal.NONE;
    }

    public String executionId() {
        return executionId;
    }

    public String stepId() {
        return stepId;
    }

    public String agentId() {
        return agentId;
    }

    public JsonNode task() {
        return task;
    }

    /**
     * 1-indexed attempt number.
     */
    public int attempt() {
        return attempt;
    }

    public ContextView context() {
        return context;
    }

    /**
     * Check if the execution was cancelled. Providers should stop work promptly.
     */
    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    @Override
    public String toString() {
        return "ProviderRequest{executionId=" + executionId + ", stepId=" + stepId
            + ", agentId=" + agentId + ", attempt=" + attempt + "}";
    }
}
