package com.agentflow.recovery;

import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.Step;
import com.agentflow.core.model.StepRecord;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.engine.context.WorkflowContext;
import com.agentflow.engine.persistence.InMemoryExecutionRepository;
import com.agentflow.engine.service.DefaultWorkflowEngine;
import com.agentflow.provider.ProviderRegistry;
import com.agentflow.provider.ProviderResult;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class RecoveryEngineTest {

    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();

    private InMemoryExecutionRepository repository;
    private DefaultWorkflowEngine engine;
    private RecoveryEngine recovery;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        ProviderRegistry registry = ProviderRegistry.builder()
            .register("counter", request -> {
                invocations.computeIfAbsent(request.stepId(), k -> new AtomicInteger()).incrementAndGet();
                return ProviderResult.of(TextNode.valueOf(request.stepId() + "-done"), 1);
            })
            .build();
        repository = new InMemoryExecutionRepository();
        engine = DefaultWorkflowEngine.builder(registry).executionRepository(repository).build();
        recovery = new RecoveryEngine(repository, engine, Duration.ofMillis(100));

        workflow = Workflow.builder("report")
            .step(Step.builder("collect").agent("counter").build())
            .step(Step.builder("write").agent("counter").dependsOn("collect").build())
            .build();
        engine.loadWorkflow(workflow);
    }

    @AfterEach
    void tearDown() {
        recovery.stop();
        engine.shutdown(Duration.ofSeconds(1));
    }

    private Execution interrupted(Workflow definition) {
        Instant now = Instant.now();
        Execution execution = Execution.create(definition, new WorkflowContext().snapshot())
            .transitionTo(ExecutionStatus.RUNNING)
            .withStep("collect", StepRecord.pending().withAttemptStarted(1, now)
                .withSucceeded(1, TextNode.valueOf("collect-done"), now))
            .withStep("write", StepRecord.pending().withAttemptStarted(1, now));
        repository.save(execution);
        return execution;
    }

    private ExecutionStatus storedStatus(String executionId) {
        return repository.findById(executionId).orElseThrow().status();
    }

    @Test
    @DisplayName("Interrupted executions are resumed from their checkpoint")
    void recoverInterrupted_shouldResumeRunningExecutions() {
        Execution execution = interrupted(workflow);

        List<String> resumed = recovery.recoverInterrupted();

        assertThat(resumed).containsExactly(execution.id());
        await().atMost(5, TimeUnit.SECONDS).until(() -> storedStatus(execution.id()) == ExecutionStatus.COMPLETED);
        assertThat(invocations).doesNotContainKey("collect");
        assertThat(invocations.get("write").get()).isEqualTo(1);
        assertThat(repository.findById(execution.id()).orElseThrow().step("write").status())
            .isEqualTo(StepStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("Finished executions are left alone")
    void recoverInterrupted_shouldIgnoreTerminalExecutions() {
        Execution done = Execution.create(workflow, new WorkflowContext().snapshot())
            .transitionTo(ExecutionStatus.RUNNING)
            .transitionTo(ExecutionStatus.COMPLETED);
        repository.save(done);

        assertThat(recovery.recoverInterrupted()).isEmpty();
        assertThat(invocations).isEmpty();
    }

    @Test
    @DisplayName("Executions whose workflow is no longer loaded are skipped")
    void recoverInterrupted_shouldSkipUnknownWorkflows() {
        Workflow retired = Workflow.builder("retired")
            .step(Step.builder("collect").agent("counter").build())
            .step(Step.builder("write").agent("counter").dependsOn("collect").build())
            .build();
        Execution orphan = interrupted(retired);

        assertThat(recovery.recoverInterrupted()).isEmpty();
        assertThat(storedStatus(orphan.id())).isEqualTo(ExecutionStatus.RUNNING);
    }

    @Test
    @DisplayName("Starting the engine triggers an immediate scan")
    void start_shouldScanImmediately() {
        Execution execution = interrupted(workflow);

        recovery.start();

        assertThat(recovery.isRunning()).isTrue();
        await().atMost(5, TimeUnit.SECONDS).until(() -> storedStatus(execution.id()) == ExecutionStatus.COMPLETED);
    }

    @Test
    @DisplayName("Scans stop once the engine shuts down")
    void scan_shouldStopWhenEngineShutsDown() {
        engine.shutdown(Duration.ofSeconds(1));
        interrupted(workflow);

        recovery.start();

        await().atMost(5, TimeUnit.SECONDS).until(() -> !recovery.isRunning());
    }

    @Test
    @DisplayName("A failing scan does not stop later scans")
    void scan_shouldContinueAfterStoreFailure() {
        AtomicInteger queries = new AtomicInteger();
        InMemoryExecutionRepository flaky = new InMemoryExecutionRepository() {
            @Override
            public List<Execution> findAll(ExecutionQuery query) {
                if (queries.incrementAndGet() == 1) {
                    throw new IllegalStateException("store not ready");
                }
                return repository.findAll(query);
            }
        };
        Execution execution = interrupted(workflow);
        recovery.stop();
        recovery = new RecoveryEngine(flaky, engine, Duration.ofMillis(50));

        recovery.start();

        await().atMost(5, TimeUnit.SECONDS).until(() -> storedStatus(execution.id()) == ExecutionStatus.COMPLETED);
        assertThat(recovery.isRunning()).isTrue();
        assertThat(queries.get()).isGreaterThan(1);
    }
}
