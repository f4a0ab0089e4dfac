package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a step within one execution.
 */
public enum StepStatus {
    /**
     * Waiting for dependencies.
     * Transitions: -> READY, RUNNING, SKIPPED
     */
    PENDING,

    /**
     * Dependencies satisfied, waiting for a free concurrency slot.
     * Transitions: -> RUNNING, SKIPPED
     */
    READY,

    /**
     * An attempt is in flight.
     * Transitions: -> RETRYING, SUCCEEDED, FAILED, SKIPPED
     */
    RUNNING,

    /**
     * An attempt failed and the next one is waiting out its backoff delay.
     * Transitions: -> RUNNING, FAILED, SKIPPED
     */
    RETRYING,

    /**
     * Terminal.
     */
    SUCCEEDED,

    /**
     * Terminal. Attempts exhausted or a non-retryable error.
     */
    FAILED,

    /**
     * Terminal. Never ran because a dependency failed, the run stopped early,
     * or the execution was cancelled.
     */
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    /**
     * Check if the step occupies a concurrency slot.
     */
    public boolean isInFlight() {
        return this == RUNNING || this == RETRYING;
    }

    /**
     * Check if the step has not been admitted yet.
     */
    public boolean isWaiting() {
        return this == PENDING || this == READY;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepStatus fromValue(String value) {
        return StepStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
