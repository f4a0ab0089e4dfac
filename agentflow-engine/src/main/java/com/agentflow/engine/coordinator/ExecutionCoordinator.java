package com.agentflow.engine.coordinator;

import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.Step;
import com.agentflow.core.model.StepRecord;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowConfig;
import com.agentflow.core.repository.ExecutionRepository;
import com.agentflow.engine.context.WorkflowContext;
import com.agentflow.engine.executor.CancellationToken;
import com.agentflow.engine.executor.StepExecutor;
import com.agentflow.engine.executor.StepInvocation;
import com.agentflow.engine.executor.StepResult;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;

/**
 * Owns one execution and advances its DAG until every step is terminal.
 *
 * The coordinator thread is the only writer of the execution record and the
 * context. Steps run on the shared step pool and report back through an event
 * queue, so state changes are applied serially and in arrival order.
 *
 * Loop:
 * 1. Skip waiting steps whose dependencies can never be satisfied
 * 2. Admit ready steps in declaration order up to maxConcurrent
 * 3. Wait for the next event and apply it
 * 4. Repeat until nothing is in flight
 *
 * Fail-fast and an exhausted token budget close admission: waiting steps are
 * skipped and in-flight steps are allowed to finish.
 */
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    public static final String CANCELLED_REASON = "Execution cancelled";
    public static final String BUDGET_EXHAUSTED = "token budget exhausted";

    private final Workflow workflow;
    private final WorkflowConfig config;
    private final WorkflowContext context;
    private final StepExecutor stepExecutor;
    private final ExecutorService stepPool;
    private final ExecutionRepository repository;
    private final WorkflowMetrics metrics;
    private final DependencyResolver resolver;
    private final boolean resumed;

    private final BlockingQueue<CoordinatorEvent> events = new LinkedBlockingQueue<>();
    private final CancellationToken cancellation = new CancellationToken();

    private volatile Execution execution;
    private int inFlight;
    private boolean admissionClosed;
    private boolean cancelled;
    private boolean suspended;
    private boolean budgetExhausted;
    // Set once the active-executions gauge includes this execution
    private boolean counted;

    public ExecutionCoordinator(
            Workflow workflow,
            Execution execution,
            WorkflowContext context,
            StepExecutor stepExecutor,
            ExecutorService stepPool,
            ExecutionRepository repository,
            WorkflowMetrics metrics,
            boolean resumed) {
        this.workflow = workflow;
        this.config = workflow.config();
        this.execution = execution;
        this.context = context;
        this.stepExecutor = stepExecutor;
        this.stepPool = stepPool;
        this.repository = repository;
        this.metrics = metrics;
        this.resolver = new DependencyResolver(workflow);
        this.resumed = resumed;
    }

    /**
     * Get the latest in-memory record. Safe to call from any thread.
     */
    public Execution current() {
        return execution;
    }

    public String executionId() {
        return execution.id();
    }

    /**
     * Request cancellation. Wakes retry sleeps and interrupts in-flight provider
     * calls; the coordinator thread records the outcome.
     */
    public void cancel() {
        if (cancellation.cancel()) {
            events.add(new CoordinatorEvent.CancelRequested());
        }
    }

    /**
     * Drive the execution to a terminal status.
     *
     * @return the final record; status stays RUNNING if the coordinator thread was
     *         interrupted, so the execution can be resumed later
     * @throws com.agentflow.core.exception.ExecutionStoreException if the initial or final save fails
     */
    public Execution run() {
        try (var ctx = LoggingContext.forExecution(execution.id(), workflow.id())) {
            begin();
            return drive();
        } finally {
            if (counted) {
                counted = false;
                metrics.executionReleased();
            }
        }
    }

    private Execution drive() {
        try {
            if (cancellation.isCancelled()) {
                applyCancel();
                return execution;
            }
            schedule();
            while (inFlight > 0 && !cancelled) {
                handle(events.take());
                if (!cancelled) {
                    schedule();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            suspend("coordinator interrupted");
            return execution;
        }

        if (cancelled) {
            return execution;
        }
        if (suspended) {
            suspend("step workers interrupted");
            return execution;
        }
        return complete();
    }

    // ========== Lifecycle ==========

    private void begin() {
        if (execution.status() == ExecutionStatus.PENDING) {
            execution = execution.transitionTo(ExecutionStatus.RUNNING);
        }
        context.bindExecution(execution.id());
        execution = execution.withContextSnapshot(context.snapshot());
        repository.save(execution);

        if (resumed) {
            metrics.executionResumed(workflow.id());
            counted = true;
            log.info("Resumed execution of workflow {} ({} of {} steps already succeeded)",
                workflow.id(), execution.countSteps(StepStatus.SUCCEEDED), execution.steps().size());
        } else {
            metrics.executionStarted(workflow.id());
            counted = true;
            log.info("Started execution of workflow {} with {} steps, maxConcurrent={}",
                workflow.id(), workflow.steps().size(), config.maxConcurrent());
        }
    }

    private Execution complete() {
        boolean fatalFailure = workflow.steps().stream()
            .anyMatch(s -> !s.optional() && execution.step(s.id()).status() == StepStatus.FAILED);
        ExecutionStatus outcome = fatalFailure || budgetExhausted
            ? ExecutionStatus.FAILED
            : ExecutionStatus.COMPLETED;

        execution = execution.withContextSnapshot(context.snapshot()).transitionTo(outcome);
        repository.save(execution);

        long durationMs = Duration.between(execution.startedAt(), execution.completedAt()).toMillis();
        if (outcome == ExecutionStatus.COMPLETED) {
            metrics.executionCompleted(workflow.id(), durationMs);
            log.info("Execution completed in {}ms, tokens={}", durationMs, context.totalTokens());
        } else {
            metrics.executionFailed(workflow.id(), durationMs);
            log.warn("Execution failed in {}ms at step {}: {}",
                durationMs, execution.lastErrorStepId(), execution.lastError());
        }
        return execution;
    }

    private void suspend(String reason) {
        execution = execution.withContextSnapshot(context.snapshot());
        repository.save(execution);
        log.warn("Execution suspended ({}), left {} for resume", reason, execution.status().value());
    }

    // ========== Scheduling ==========

    private void schedule() {
        if (admissionClosed) {
            return;
        }
        boolean changed = false;

        Map<String, String> blocked = resolver.blockedSteps(execution.steps());
        for (Map.Entry<String, String> entry : blocked.entrySet()) {
            skip(entry.getKey(), entry.getValue());
            changed = true;
        }

        List<String> ready = resolver.readySteps(execution.steps());
        int slots = config.maxConcurrent() - inFlight;
        for (int i = 0; i < ready.size(); i++) {
            String stepId = ready.get(i);
            if (i < slots) {
                if (!admit(stepId)) {
                    break;
                }
            } else if (execution.step(stepId).status() == StepStatus.PENDING) {
                execution = execution.withStep(stepId, execution.step(stepId).withStatus(StepStatus.READY));
            }
            changed = true;
        }

        if (changed) {
            checkpoint();
        }
    }

    private boolean admit(String stepId) {
        Step step = resolver.step(stepId);
        QueueingContextAppender appender = new QueueingContextAppender(stepId, events);
        StepInvocation invocation = new StepInvocation(
            execution.id(), workflow.id(), step, context, appender, cancellation, appender);

        execution = execution.withStep(stepId, execution.step(stepId).withStatus(StepStatus.RUNNING));
        inFlight++;
        try {
            stepPool.execute(() -> runStep(invocation));
        } catch (RejectedExecutionException e) {
            log.warn("Step pool rejected step {}, suspending execution", stepId);
            execution = execution.withStep(stepId, execution.step(stepId).resetForResume());
            inFlight--;
            admissionClosed = true;
            suspended = true;
            return false;
        }
        log.debug("Admitted step {} ({} in flight)", stepId, inFlight);
        return true;
    }

    /**
     * Worker body. Always posts exactly one StepFinished event.
     */
    private void runStep(StepInvocation invocation) {
        String stepId = invocation.step().id();
        StepResult result;
        try {
            result = stepExecutor.run(invocation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = StepResult.cancelled(stepId, 0, 0, 0);
        } catch (RuntimeException e) {
            log.error("Unexpected error running step {}", stepId, e);
            result = StepResult.failed(stepId, "Unexpected error: " + e.getMessage(), "INTERNAL_ERROR", 0, 0, 0);
        }
        events.add(new CoordinatorEvent.StepFinished(result));
    }

    // ========== Event Handling ==========

    private void handle(CoordinatorEvent event) {
        if (event instanceof CoordinatorEvent.AttemptStarted) {
            CoordinatorEvent.AttemptStarted started = (CoordinatorEvent.AttemptStarted) event;
            updateInFlight(started.stepId(), r -> r.withAttemptStarted(started.attempt(), Instant.now()));
            checkpoint();

        } else if (event instanceof CoordinatorEvent.AttemptFailed) {
            CoordinatorEvent.AttemptFailed failed = (CoordinatorEvent.AttemptFailed) event;
            if (failed.willRetry()) {
                updateInFlight(failed.stepId(),
                    r -> r.withRetrying(failed.attempt(), failed.error(), failed.errorCode()));
                checkpoint();
            }

        } else if (event instanceof CoordinatorEvent.HistoryAppended) {
            context.appendHistory(((CoordinatorEvent.HistoryAppended) event).entry());

        } else if (event instanceof CoordinatorEvent.TokensAdded) {
            CoordinatorEvent.TokensAdded added = (CoordinatorEvent.TokensAdded) event;
            context.addTokens(added.tokens());
            execution = execution.withStep(added.stepId(), execution.step(added.stepId()).withTokensAdded(added.tokens()));
            metrics.tokensConsumed(workflow.id(), added.tokens());

        } else if (event instanceof CoordinatorEvent.StepFinished) {
            onStepFinished(((CoordinatorEvent.StepFinished) event).result());

        } else if (event instanceof CoordinatorEvent.CancelRequested) {
            applyCancel();
        }
    }

    private void onStepFinished(StepResult result) {
        inFlight--;
        String stepId = result.stepId();
        Step step = resolver.step(stepId);
        StepRecord record = execution.step(stepId);
        Instant now = Instant.now();

        if (result.cancelled() && cancellation.isCancelled()) {
            // The token fires before CancelRequested is queued
            applyCancel();
            return;
        }
        if (result.cancelled()) {
            // Interrupted without a cancel request: the process is shutting down
            execution = execution.withStep(stepId, record.resetForResume());
            admissionClosed = true;
            suspended = true;
        } else if (result.isSuccess()) {
            // The record and the context each keep their own copy of the output
            JsonNode output = result.output() != null ? result.output().deepCopy() : null;
            context.putData(stepId, output);
            execution = execution.withStep(stepId, record.withSucceeded(result.attempts(), output, now));
        } else {
            execution = execution.withStep(stepId,
                record.withFailed(result.attempts(), result.error(), result.errorCode(), now));
            if (step.optional()) {
                log.warn("Optional step {} failed after {} attempt(s): {}", stepId, result.attempts(), result.error());
            } else {
                log.error("Step {} failed after {} attempt(s): {}", stepId, result.attempts(), result.error());
                execution = execution.withLastError(result.error(), stepId);
                if (config.failFast()) {
                    closeAdmission("Skipped by fail-fast after step " + stepId + " failed");
                }
            }
        }

        if (config.hasTokenBudget() && !budgetExhausted && context.totalTokens() > config.tokenBudget()) {
            budgetExhausted = true;
            log.warn("Token budget exhausted: {} > {}", context.totalTokens(), config.tokenBudget());
            execution = execution.withLastError(BUDGET_EXHAUSTED, stepId);
            closeAdmission("Skipped: " + BUDGET_EXHAUSTED);
        }
        checkpoint();
    }

    private void applyCancel() {
        Instant now = Instant.now();
        for (Map.Entry<String, StepRecord> entry : execution.steps().entrySet()) {
            if (!entry.getValue().isTerminal()) {
                execution = execution.withStep(entry.getKey(), entry.getValue().withSkipped(CANCELLED_REASON, now));
            }
        }
        cancelled = true;
        execution = execution.withContextSnapshot(context.snapshot()).transitionTo(ExecutionStatus.CANCELLED);
        repository.save(execution);
        metrics.executionCancelled(workflow.id());
        log.info("Execution cancelled with {} step(s) in flight", inFlight);
    }

    // ========== Internal Methods ==========

    private void closeAdmission(String reason) {
        admissionClosed = true;
        for (Map.Entry<String, StepRecord> entry : execution.steps().entrySet()) {
            if (entry.getValue().status().isWaiting()) {
                skip(entry.getKey(), reason);
            }
        }
    }

    private void skip(String stepId, String reason) {
        execution = execution.withStep(stepId, execution.step(stepId).withSkipped(reason, Instant.now()));
        metrics.stepSkipped(workflow.id());
        log.info("Step {} skipped: {}", stepId, reason);
    }

    private void updateInFlight(String stepId, UnaryOperator<StepRecord> change) {
        StepRecord record = execution.step(stepId);
        if (record.status().isInFlight()) {
            execution = execution.withStep(stepId, change.apply(record));
        }
    }

    /**
     * Refresh the context snapshot and persist when the workflow asks for it.
     * A failed intermediate save is logged; the final save still happens.
     */
    private void checkpoint() {
        execution = execution.withContextSnapshot(context.snapshot());
        if (!config.saveState()) {
            return;
        }
        try {
            repository.save(execution);
        } catch (RuntimeException e) {
            log.error("Checkpoint of execution {} failed", execution.id(), e);
        }
    }
}
