package com.agentflow.engine.service;

import com.agentflow.core.exception.EngineShutdownException;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.WorkflowValidationException;
import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionResult;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.StepRecord;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.ValidationResult;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;
import com.agentflow.core.repository.WorkflowRepository;
import com.agentflow.core.validation.WorkflowValidator;
import com.agentflow.engine.context.WorkflowContext;
import com.agentflow.engine.coordinator.ExecutionCoordinator;
import com.agentflow.engine.executor.StepExecutor;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.engine.persistence.InMemoryExecutionRepository;
import com.agentflow.engine.persistence.InMemoryWorkflowRepository;
import com.agentflow.engine.status.ExecutionStatusService;
import com.agentflow.engine.status.ExecutionSummary;
import com.agentflow.provider.ProviderRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default in-process implementation of {@link WorkflowEngine}.
 *
 * Each execution gets its own {@link ExecutionCoordinator}; steps from all
 * executions share one step pool, and provider calls run on a separate pool so
 * attempts can be abandoned on timeout.
 */
public class DefaultWorkflowEngine implements WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkflowEngine.class);
    private static final Duration CANCEL_WAIT = Duration.ofSeconds(30);

    private final WorkflowRepository workflowRepository;
    private final ExecutionRepository executionRepository;
    private final WorkflowValidator validator;
    private final WorkflowMetrics metrics;
    private final StepExecutor stepExecutor;
    private final ExecutionStatusService statusService;

    private final ExecutorService coordinatorPool;
    private final ExecutorService stepPool;
    private final ExecutorService invocationPool;

    private final Map<String, ActiveExecution> active = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private DefaultWorkflowEngine(Builder builder) {
        this.workflowRepository = builder.workflowRepository;
        this.executionRepository = builder.executionRepository;
        this.validator = builder.validator;
        this.metrics = builder.metrics;
        this.coordinatorPool = Executors.newCachedThreadPool(namedThreads("agentflow-coordinator"));
        this.stepPool = Executors.newCachedThreadPool(namedThreads("agentflow-step"));
        this.invocationPool = Executors.newCachedThreadPool(namedThreads("agentflow-provider"));
        this.stepExecutor = new StepExecutor(builder.providerRegistry, invocationPool, metrics);
        this.statusService = new ExecutionStatusService(executionRepository, this::liveExecution);
    }

    public static Builder builder(ProviderRegistry providerRegistry) {
        return new Builder(providerRegistry);
    }

    // ========== Definitions ==========

    @Override
    public ValidationResult validate(Workflow workflow) {
        return validator.validate(workflow);
    }

    @Override
    public void loadWorkflow(Workflow workflow) {
        ValidationResult result = validateOrThrow(workflow);
        workflowRepository.save(workflow);
        log.info("Loaded workflow {} v{} with {} steps{}", workflow.id(), workflow.version(),
            workflow.steps().size(), result.warnings().isEmpty() ? "" : ", warnings: " + result.warnings());
    }

    @Override
    public Workflow getWorkflow(String workflowId) {
        return workflowRepository.findById(workflowId)
            .orElseThrow(() -> NotFoundException.workflow(workflowId));
    }

    @Override
    public List<Workflow> listWorkflows() {
        return workflowRepository.findAll();
    }

    // ========== Execution ==========

    @Override
    public ExecutionResult execute(String workflowId, Map<String, JsonNode> initialContext) {
        return execute(getWorkflow(workflowId), initialContext);
    }

    @Override
    public ExecutionResult execute(Workflow workflow, Map<String, JsonNode> initialContext) {
        ActiveExecution execution = prepareNew(workflow, initialContext);
        return ExecutionResult.from(runCoordinator(execution));
    }

    @Override
    public ExecutionHandle start(String workflowId, Map<String, JsonNode> initialContext) {
        ActiveExecution execution = prepareNew(getWorkflow(workflowId), initialContext);
        return submit(execution);
    }

    @Override
    public ExecutionResult resume(String executionId) {
        return ExecutionResult.from(runCoordinator(prepareResume(executionId)));
    }

    @Override
    public ExecutionHandle resumeAsync(String executionId) {
        return submit(prepareResume(executionId));
    }

    @Override
    public Execution cancel(String executionId) {
        ActiveExecution running = active.get(executionId);
        if (running != null) {
            log.info("Cancelling active execution {}", executionId);
            running.coordinator.cancel();
            return awaitCancellation(running);
        }

        Execution stored = executionRepository.findById(executionId)
            .orElseThrow(() -> NotFoundException.execution(executionId));
        if (stored.isTerminal()) {
            throw new InvalidStateTransitionException(executionId, stored.status(), "cancel");
        }

        // Not owned by any coordinator in this process, e.g. left behind by a crash
        Instant now = Instant.now();
        Execution cancelled = stored;
        for (Map.Entry<String, StepRecord> entry : stored.steps().entrySet()) {
            if (!entry.getValue().isTerminal()) {
                cancelled = cancelled.withStep(entry.getKey(),
                    entry.getValue().withSkipped(ExecutionCoordinator.CANCELLED_REASON, now));
            }
        }
        cancelled = cancelled.transitionTo(ExecutionStatus.CANCELLED);
        executionRepository.save(cancelled);
        log.info("Cancelled stored execution {}", executionId);
        return cancelled;
    }

    @Override
    public boolean isActive(String executionId) {
        return active.containsKey(executionId);
    }

    // ========== Status ==========

    @Override
    public Execution getExecutionStatus(String executionId) {
        return statusService.getExecution(executionId);
    }

    @Override
    public ExecutionSummary getExecutionSummary(String executionId) {
        return statusService.getSummary(executionId);
    }

    @Override
    public List<Execution> listExecutions(ExecutionQuery query) {
        return statusService.list(query);
    }

    /**
     * Get the number of executions owned by a coordinator in this process.
     */
    public int activeCount() {
        return active.size();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    // ========== Lifecycle ==========

    @Override
    public void shutdown(Duration timeout) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down workflow engine with {} active execution(s)", active.size());

        long deadline = System.nanoTime() + timeout.toNanos();
        for (ActiveExecution execution : active.values()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                execution.done.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException | ExecutionException e) {
                log.debug("Execution {} did not finish cleanly: {}", execution.coordinator.executionId(), e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        for (ActiveExecution execution : active.values()) {
            Thread thread = execution.thread;
            if (thread != null) {
                log.warn("Interrupting execution {}; it stays resumable", execution.coordinator.executionId());
                thread.interrupt();
            }
        }

        coordinatorPool.shutdownNow();
        stepPool.shutdownNow();
        invocationPool.shutdownNow();
        try {
            coordinatorPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Workflow engine stopped");
    }

    // ========== Internal Methods ==========

    private ValidationResult validateOrThrow(Workflow workflow) {
        ValidationResult result = validator.validate(workflow);
        if (!result.valid()) {
            throw new WorkflowValidationException(workflow.id(), result.errors());
        }
        return result;
    }

    private ActiveExecution prepareNew(Workflow workflow, Map<String, JsonNode> initialContext) {
        ensureAccepting();
        validateOrThrow(workflow);
        workflowRepository.save(workflow);

        WorkflowContext context = new WorkflowContext(initialContext);
        Execution execution = Execution.create(workflow, context.snapshot());
        return register(new ExecutionCoordinator(workflow, execution, context, stepExecutor,
            stepPool, executionRepository, metrics, false));
    }

    private ActiveExecution prepareResume(String executionId) {
        ensureAccepting();
        if (active.containsKey(executionId)) {
            throw new InvalidStateTransitionException(executionId, ExecutionStatus.RUNNING, "resume active");
        }
        Execution stored = executionRepository.findById(executionId)
            .orElseThrow(() -> NotFoundException.execution(executionId));
        if (stored.isTerminal()) {
            throw new InvalidStateTransitionException(executionId, stored.status(), "resume");
        }
        Workflow workflow = getWorkflow(stored.workflowId());

        Execution reset = stored;
        for (Map.Entry<String, StepRecord> entry : stored.steps().entrySet()) {
            StepStatus status = entry.getValue().status();
            if (!status.isTerminal() && status != StepStatus.PENDING) {
                reset = reset.withStep(entry.getKey(), entry.getValue().resetForResume());
            }
        }
        WorkflowContext context = stored.contextSnapshot() != null
            ? WorkflowContext.restore(stored.contextSnapshot())
            : new WorkflowContext();

        log.info("Resuming execution {} of workflow {}", executionId, workflow.id());
        return register(new ExecutionCoordinator(workflow, reset, context, stepExecutor,
            stepPool, executionRepository, metrics, true));
    }

    private ActiveExecution register(ExecutionCoordinator coordinator) {
        ActiveExecution execution = new ActiveExecution(coordinator);
        if (active.putIfAbsent(coordinator.executionId(), execution) != null) {
            throw new InvalidStateTransitionException(coordinator.executionId(), ExecutionStatus.RUNNING, "resume active");
        }
        return execution;
    }

    private ExecutionHandle submit(ActiveExecution execution) {
        CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
        try {
            coordinatorPool.execute(() -> {
                try {
                    result.complete(ExecutionResult.from(runCoordinator(execution)));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            active.remove(execution.coordinator.executionId());
            throw e;
        }
        return new ExecutionHandle(execution.coordinator.executionId(), result);
    }

    private Execution runCoordinator(ActiveExecution execution) {
        execution.thread = Thread.currentThread();
        Execution result = null;
        RuntimeException failure = null;
        try {
            result = execution.coordinator.run();
            return result;
        } catch (RuntimeException e) {
            log.error("Coordinator of execution {} failed", execution.coordinator.executionId(), e);
            failure = e;
            throw e;
        } finally {
            // Deregister before waking waiters so they never observe a finished but active execution
            execution.thread = null;
            active.remove(execution.coordinator.executionId());
            if (failure != null) {
                execution.done.completeExceptionally(failure);
            } else {
                execution.done.complete(result);
            }
        }
    }

    private Execution awaitCancellation(ActiveExecution execution) {
        try {
            return execution.done.get(CANCEL_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return execution.coordinator.current();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Execution {} did not confirm cancellation: {}", execution.coordinator.executionId(), e.toString());
            return execution.coordinator.current();
        }
    }

    private Optional<Execution> liveExecution(String executionId) {
        ActiveExecution execution = active.get(executionId);
        return execution != null ? Optional.of(execution.coordinator.current()) : Optional.empty();
    }

    private void ensureAccepting() {
        if (shuttingDown.get()) {
            throw new EngineShutdownException();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ActiveExecution {
        private final ExecutionCoordinator coordinator;
        private final CompletableFuture<Execution> done = new CompletableFuture<>();
        private volatile Thread thread;

        private ActiveExecution(ExecutionCoordinator coordinator) {
            this.coordinator = coordinator;
        }
    }

    public static class Builder {
        private final ProviderRegistry providerRegistry;
        private WorkflowRepository workflowRepository = new InMemoryWorkflowRepository();
        private ExecutionRepository executionRepository = new InMemoryExecutionRepository();
        private WorkflowValidator validator = new WorkflowValidator();
        private WorkflowMetrics metrics;

        private Builder(ProviderRegistry providerRegistry) {
            this.providerRegistry = providerRegistry;
        }

        public Builder workflowRepository(WorkflowRepository workflowRepository) {
            this.workflowRepository = workflowRepository;
            return this;
        }

        public Builder executionRepository(ExecutionRepository executionRepository) {
            this.executionRepository = executionRepository;
            return this;
        }

        public Builder validator(WorkflowValidator validator) {
            this.validator = validator;
            return this;
        }

        /**
         * Use metrics already bound to a registry. Defaults to a private in-memory registry.
         */
        public Builder metrics(WorkflowMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public DefaultWorkflowEngine build() {
            if (providerRegistry == null) {
                throw new IllegalStateException("A provider registry is required");
            }
            if (metrics == null) {
                metrics = new WorkflowMetrics();
                metrics.bindTo(new SimpleMeterRegistry());
            }
            return new DefaultWorkflowEngine(this);
        }
    }
}
