package com.agentflow.engine.executor;

/**
 * Progress callbacks from the step executor, called on the worker thread.
 */
public interface StepListener {

    StepListener NONE = new StepListener() {
    };

    default void onAttemptStarted(String stepId, int attempt) {
    }

    /**
     * @param willRetry true if another attempt follows after the backoff delay
     */
    default void onAttemptFailed(String stepId, int attempt, String error, String errorCode, boolean willRetry) {
    }
}
