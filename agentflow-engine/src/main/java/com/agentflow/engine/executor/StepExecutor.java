package com.agentflow.engine.executor;

import com.agentflow.core.context.ContextEntry;
import com.agentflow.core.exception.AgentResolutionException;
import com.agentflow.core.exception.StepExecutionException;
import com.agentflow.core.exception.StepTimeoutException;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.Step;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.provider.CapabilityProvider;
import com.agentflow.provider.ProviderException;
import com.agentflow.provider.ProviderRegistry;
import com.agentflow.provider.ProviderRequest;
import com.agentflow.provider.ProviderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one step to a terminal outcome: resolves its provider, then attempts it
 * up to {@code maxAttempts} times with the configured backoff between attempts.
 *
 * Responsibilities:
 * - Enforce the per-attempt timeout
 * - Record one history entry and one token delta per completed attempt
 * - Stop promptly on cancellation, interrupting an in-flight provider call
 *
 * Whether a failure is fatal or optional is decided by the coordinator.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ProviderRegistry registry;
    private final ExecutorService invocationPool;
    private final WorkflowMetrics metrics;

    /**
     * @param invocationPool runs provider calls so a timeout can abandon them;
     *                       must not be bounded below the number of concurrent steps
     */
    public StepExecutor(ProviderRegistry registry, ExecutorService invocationPool, WorkflowMetrics metrics) {
        this.registry = registry;
        this.invocationPool = invocationPool;
        this.metrics = metrics;
    }

    /**
     * Run a step through all of its attempts.
     *
     * @throws InterruptedException if the calling thread is interrupted; the
     *                              in-flight provider call is cancelled first
     */
    public StepResult run(StepInvocation invocation) throws InterruptedException {
        Step step = invocation.step();
        long startNanos = System.nanoTime();

        CapabilityProvider provider;
        try {
            provider = registry.resolve(step.agent());
        } catch (AgentResolutionException e) {
            log.error("Step {} cannot run: {}", step.id(), e.getMessage());
            return StepResult.failed(step.id(), e.getMessage(), e.getErrorCode(), 0, 0, elapsedMs(startNanos));
        }

        RetryPolicy policy = step.retryPolicy();
        CancellationToken cancellation = invocation.cancellation();
        long tokens = 0;
        int attempt = 0;
        StepExecutionException lastFailure = null;

        while (attempt < policy.maxAttempts()) {
            if (cancellation.isCancelled()) {
                return StepResult.cancelled(step.id(), attempt, tokens, elapsedMs(startNanos));
            }
            attempt++;
            invocation.listener().onAttemptStarted(step.id(), attempt);

            try (var ctx = LoggingContext.forStep(invocation.executionId(), invocation.workflowId(), step.id(), attempt)) {
                log.debug("Invoking agent {} (attempt {}/{})", step.agent(), attempt, policy.maxAttempts());
                try {
                    ProviderResult result = invokeOnce(provider, invocation, attempt);
                    if (cancellation.isCancelled()) {
                        return StepResult.cancelled(step.id(), attempt, tokens, elapsedMs(startNanos));
                    }
                    record(invocation, attempt, result.tokensUsed(),
                        result.summary() != null ? result.summary() : "completed");
                    tokens += result.tokensUsed();
                    long duration = elapsedMs(startNanos);
                    log.info("Step {} succeeded after {} attempt(s) in {}ms", step.id(), attempt, duration);
                    metrics.stepSucceeded(invocation.workflowId(), step.agent(), duration);
                    return StepResult.succeeded(step.id(), result.output(), attempt, tokens, duration);

                } catch (StepExecutionException e) {
                    if (cancellation.isCancelled()) {
                        return StepResult.cancelled(step.id(), attempt, tokens, elapsedMs(startNanos));
                    }
                    record(invocation, attempt, e.getTokensUsed(), "failed: " + e.getMessage());
                    tokens += e.getTokensUsed();
                    lastFailure = e;

                    boolean willRetry = e.isRetryable() && policy.hasMoreAttempts(attempt);
                    invocation.listener().onAttemptFailed(step.id(), attempt, e.getMessage(), e.getErrorCode(), willRetry);
                    if (!willRetry) {
                        log.warn("Step {} attempt {} failed, not retrying: {}", step.id(), attempt, e.getMessage());
                        break;
                    }

                    long delay = policy.computeDelay(attempt);
                    log.warn("Step {} attempt {} failed, retrying in {}ms: {}", step.id(), attempt, delay, e.getMessage());
                    metrics.stepRetried(invocation.workflowId(), step.agent());
                    if (cancellation.await(delay)) {
                        return StepResult.cancelled(step.id(), attempt, tokens, elapsedMs(startNanos));
                    }
                }
            }
        }

        long duration = elapsedMs(startNanos);
        metrics.stepFailed(invocation.workflowId(), step.agent(), lastFailure.getErrorCode(), duration);
        return StepResult.failed(step.id(), lastFailure.getMessage(), lastFailure.getErrorCode(),
            attempt, tokens, duration);
    }

    // ========== Internal Methods ==========

    private ProviderResult invokeOnce(CapabilityProvider provider, StepInvocation invocation, int attempt)
            throws InterruptedException {
        Step step = invocation.step();
        ProviderRequest request = new ProviderRequest(
            invocation.executionId(),
            step.id(),
            step.agent(),
            step.task(),
            attempt,
            invocation.context(),
            invocation.cancellation()
        );

        Future<ProviderResult> future = invocationPool.submit(() -> provider.invoke(request));
        try (var registration = invocation.cancellation().onCancel(() -> future.cancel(true))) {
            ProviderResult result = step.hasTimeout()
                ? future.get(step.timeout(), TimeUnit.MILLISECONDS)
                : future.get();
            if (result == null) {
                throw new StepExecutionException(step.id(), "Provider returned no result", null);
            }
            return result;

        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.stepTimedOut(invocation.workflowId(), step.agent());
            throw new StepTimeoutException(step.id(), step.timeout());

        } catch (ExecutionException e) {
            throw toStepException(step.id(), e.getCause());

        } catch (CancellationException e) {
            throw new StepExecutionException(step.id(), "Attempt cancelled", e);

        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private StepExecutionException toStepException(String stepId, Throwable cause) {
        if (cause instanceof ProviderException) {
            ProviderException pe = (ProviderException) cause;
            return new StepExecutionException(pe.getErrorCode(), stepId, pe.getMessage(), pe,
                pe.isRetryable(), pe.getTokensUsed());
        }
        if (cause instanceof StepExecutionException) {
            return (StepExecutionException) cause;
        }
        return new StepExecutionException(stepId, "Provider threw " + cause, cause);
    }

    private void record(StepInvocation invocation, int attempt, long tokensUsed, String summary) {
        Step step = invocation.step();
        invocation.appender().addTokens(tokensUsed);
        invocation.appender().appendHistory(new ContextEntry(
            step.id(), step.agent(), attempt, Instant.now(), summary, tokensUsed));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
