package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of an execution.
 */
public enum ExecutionStatus {
    /**
     * Created, coordinator not yet looping.
     * Transitions: -> RUNNING, CANCELLED
     */
    PENDING,

    /**
     * Coordinator is advancing the DAG, or was interrupted and can be resumed.
     * Transitions: -> COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Every non-optional step succeeded. Terminal state.
     */
    COMPLETED,

    /**
     * At least one non-optional step failed, or the token budget ran out. Terminal state.
     */
    FAILED,

    /**
     * Cancelled on request. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        return ExecutionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
