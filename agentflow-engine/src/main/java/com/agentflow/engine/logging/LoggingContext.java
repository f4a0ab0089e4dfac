package com.agentflow.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Tags every log line with the execution and step being processed.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStep(executionId, workflowId, stepId, attempt)) {
 *     log.info("Invoking provider"); // includes executionId, workflowId, stepId, attempt
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String STEP_ID = "stepId";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    // false when nested inside an execution context that owns those keys
    private final boolean ownsExecutionKeys;

    private LoggingContext(boolean ownsExecutionKeys) {
        this.ownsExecutionKeys = ownsExecutionKeys;
    }

    /**
     * Create a logging context for coordinator-level operations.
     */
    public static LoggingContext forExecution(String executionId, String workflowId) {
        putIfPresent(EXECUTION_ID, executionId);
        putIfPresent(WORKFLOW_ID, workflowId);
        ensureTraceId();
        return new LoggingContext(true);
    }

    /**
     * Create a logging context for a single step attempt.
     * When nested inside an execution context, closing it removes only the step keys.
     */
    public static LoggingContext forStep(String executionId, String workflowId, String stepId, int attempt) {
        boolean nested = MDC.get(EXECUTION_ID) != null;
        putIfPresent(EXECUTION_ID, executionId);
        putIfPresent(WORKFLOW_ID, workflowId);
        putIfPresent(STEP_ID, stepId);
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return new LoggingContext(!nested);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(STEP_ID);
        MDC.remove(ATTEMPT);
        if (ownsExecutionKeys) {
            MDC.remove(EXECUTION_ID);
            MDC.remove(WORKFLOW_ID);
            MDC.remove(TRACE_ID);
        }
    }
}
