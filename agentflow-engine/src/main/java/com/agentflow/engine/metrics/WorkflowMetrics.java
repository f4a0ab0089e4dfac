package com.agentflow.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the workflow engine.
 *
 * Metrics exposed:
 * - Execution counts by outcome and execution duration
 * - Step latency, retries, timeouts, failures and skips
 * - Tokens consumed per workflow
 * - Number of executions currently active
 */
public class WorkflowMetrics implements MeterBinder {

    // Metric names
    public static final String EXECUTIONS_STARTED = "agentflow.executions.started";
    public static final String EXECUTIONS_COMPLETED = "agentflow.executions.completed";
    public static final String EXECUTIONS_FAILED = "agentflow.executions.failed";
    public static final String EXECUTIONS_CANCELLED = "agentflow.executions.cancelled";
    public static final String EXECUTIONS_RESUMED = "agentflow.executions.resumed";
    public static final String EXECUTIONS_ACTIVE = "agentflow.executions.active";
    public static final String EXECUTION_DURATION = "agentflow.execution.duration";

    public static final String STEP_DURATION = "agentflow.step.duration";
    public static final String STEP_RETRIES = "agentflow.step.retries";
    public static final String STEP_TIMEOUTS = "agentflow.step.timeouts";
    public static final String STEP_FAILURES = "agentflow.step.failures";
    public static final String STEP_SKIPPED = "agentflow.step.skipped";

    public static final String TOKENS = "agentflow.tokens";

    private MeterRegistry registry;
    private final AtomicInteger activeExecutions = new AtomicInteger();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(EXECUTIONS_ACTIVE, activeExecutions, AtomicInteger::get)
            .description("Executions currently owned by a coordinator")
            .register(registry);
    }

    // ========== Execution Metrics ==========

    public void executionStarted(String workflowId) {
        Counter.builder(EXECUTIONS_STARTED)
            .tag("workflow", workflowId)
            .description("Total executions started")
            .register(registry)
            .increment();
        activeExecutions.incrementAndGet();
    }

    public void executionResumed(String workflowId) {
        Counter.builder(EXECUTIONS_RESUMED)
            .tag("workflow", workflowId)
            .description("Total executions resumed from a checkpoint")
            .register(registry)
            .increment();
        activeExecutions.incrementAndGet();
    }

    public void executionCompleted(String workflowId, long durationMs) {
        Counter.builder(EXECUTIONS_COMPLETED)
            .tag("workflow", workflowId)
            .description("Total executions completed successfully")
            .register(registry)
            .increment();
        recordDuration(workflowId, "success", durationMs);
    }

    public void executionFailed(String workflowId, long durationMs) {
        Counter.builder(EXECUTIONS_FAILED)
            .tag("workflow", workflowId)
            .description("Total executions failed")
            .register(registry)
            .increment();
        recordDuration(workflowId, "failure", durationMs);
    }

    public void executionCancelled(String workflowId) {
        Counter.builder(EXECUTIONS_CANCELLED)
            .tag("workflow", workflowId)
            .description("Total executions cancelled")
            .register(registry)
            .increment();
    }

    /**
     * A coordinator stopped owning an execution, whatever the outcome. Pairs with
     * {@link #executionStarted} and {@link #executionResumed}.
     */
    public void executionReleased() {
        activeExecutions.decrementAndGet();
    }

    public int activeExecutions() {
        return activeExecutions.get();
    }

    // ========== Step Metrics ==========

    public void stepSucceeded(String workflowId, String agent, long durationMs) {
        Timer.builder(STEP_DURATION)
            .tag("workflow", workflowId)
            .tag("agent", agent)
            .tag("outcome", "success")
            .description("Step duration including retries")
            .register(registry)
            .record(Duration.ofMillis(durationMs));
    }

    public void stepFailed(String workflowId, String agent, String errorCode, long durationMs) {
        Counter.builder(STEP_FAILURES)
            .tag("workflow", workflowId)
            .tag("agent", agent)
            .tag("error_code", errorCode != null ? errorCode : "unknown")
            .description("Total steps failed after exhausting attempts")
            .register(registry)
            .increment();

        Timer.builder(STEP_DURATION)
            .tag("workflow", workflowId)
            .tag("agent", agent)
            .tag("outcome", "failure")
            .description("Step duration including retries")
            .register(registry)
            .record(Duration.ofMillis(durationMs));
    }

    public void stepRetried(String workflowId, String agent) {
        Counter.builder(STEP_RETRIES)
            .tag("workflow", workflowId)
            .tag("agent", agent)
            .description("Total step retry attempts")
            .register(registry)
            .increment();
    }

    public void stepTimedOut(String workflowId, String agent) {
        Counter.builder(STEP_TIMEOUTS)
            .tag("workflow", workflowId)
            .tag("agent", agent)
            .description("Total step attempts that timed out")
            .register(registry)
            .increment();
    }

    public void stepSkipped(String workflowId) {
        Counter.builder(STEP_SKIPPED)
            .tag("workflow", workflowId)
            .description("Total steps skipped")
            .register(registry)
            .increment();
    }

    public void tokensConsumed(String workflowId, long tokens) {
        if (tokens <= 0) {
            return;
        }
        Counter.builder(TOKENS)
            .tag("workflow", workflowId)
            .description("Total tokens reported by capability providers")
            .register(registry)
            .increment(tokens);
    }

    // ========== Helper Methods ==========

    private void recordDuration(String workflowId, String outcome, long durationMs) {
        Timer.builder(EXECUTION_DURATION)
            .tag("workflow", workflowId)
            .tag("outcome", outcome)
            .description("Execution duration")
            .register(registry)
            .record(Duration.ofMillis(durationMs));
    }
}
