package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Execution settings of a workflow.
 *
 * @param maxConcurrent ceiling on steps running at the same time
 * @param failFast      stop admitting steps after the first fatal failure
 * @param saveState     checkpoint the execution after every step transition
 * @param tokenBudget   optional ceiling on total tokens; null means unlimited
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowConfig(
    Integer maxConcurrent,
    Boolean failFast,
    Boolean saveState,
    Long tokenBudget
) {
    public static final int DEFAULT_MAX_CONCURRENT = 3;

    public WorkflowConfig {
        if (maxConcurrent == null) {
            maxConcurrent = DEFAULT_MAX_CONCURRENT;
        }
        if (failFast == null) {
            failFast = false;
        }
        if (saveState == null) {
            saveState = true;
        }
    }

    public static WorkflowConfig defaults() {
        return new WorkflowConfig(null, null, null, null);
    }

    public boolean hasTokenBudget() {
        return tokenBudget != null;
    }

    public WorkflowConfig withMaxConcurrent(int value) {
        return new WorkflowConfig(value, failFast, saveState, tokenBudget);
    }

    public WorkflowConfig withFailFast(boolean value) {
        return new WorkflowConfig(maxConcurrent, value, saveState, tokenBudget);
    }

    public WorkflowConfig withSaveState(boolean value) {
        return new WorkflowConfig(maxConcurrent, failFast, value, tokenBudget);
    }

    public WorkflowConfig withTokenBudget(Long value) {
        return new WorkflowConfig(maxConcurrent, failFast, saveState, value);
    }
}
