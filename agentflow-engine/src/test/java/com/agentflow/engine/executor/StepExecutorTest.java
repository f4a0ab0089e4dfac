package com.agentflow.engine.executor;

import com.agentflow.core.context.ContextEntry;
import com.agentflow.core.exception.AgentResolutionException;
import com.agentflow.core.exception.StepTimeoutException;
import com.agentflow.core.model.BackoffStrategy;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.Step;
import com.agentflow.core.model.StepStatus;
import com.agentflow.engine.context.WorkflowContext;
import com.agentflow.engine.metrics.WorkflowMetrics;
import com.agentflow.engine.test.ScriptedProvider;
import com.agentflow.provider.ProviderRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@Timeout(10)
class StepExecutorTest {

    private ExecutorService invocationPool;
    private ScriptedProvider provider;
    private StepExecutor executor;
    private WorkflowContext context;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        invocationPool = Executors.newCachedThreadPool();
        provider = new ScriptedProvider();
        meterRegistry = new SimpleMeterRegistry();
        WorkflowMetrics metrics = new WorkflowMetrics();
        metrics.bindTo(meterRegistry);
        executor = new StepExecutor(ProviderRegistry.builder().register("scripted", provider).build(),
            invocationPool, metrics);
        context = new WorkflowContext();
    }

    @AfterEach
    void tearDown() {
        invocationPool.shutdownNow();
    }

    private static Step step(String id, int maxAttempts, Long timeout) {
        return Step.builder(id)
            .agent("scripted")
            .retryPolicy(RetryPolicy.builder().maxAttempts(maxAttempts).delay(10).backoff(BackoffStrategy.LINEAR).build())
            .timeout(timeout)
            .build();
    }

    private StepInvocation invocation(Step step, CancellationToken token, StepListener listener) {
        return new StepInvocation("exec-1", "wf", step, context, context, token, listener);
    }

    private StepResult run(Step step) throws InterruptedException {
        return executor.run(invocation(step, new CancellationToken(), null));
    }

    @Test
    @DisplayName("Transient failures are retried until an attempt succeeds")
    void run_shouldRetryUntilSuccess() throws Exception {
        provider.failTimes("fetch", 2);

        StepResult result = run(step("fetch", 3, null));

        assertThat(result.status()).isEqualTo(StepStatus.SUCCEEDED);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.output().asText()).isEqualTo("fetch-done");
        assertThat(context.history()).extracting(ContextEntry::attempt).containsExactly(1, 2, 3);
        assertThat(context.totalTokens()).isEqualTo(ScriptedProvider.DEFAULT_TOKENS);
        assertThat(meterRegistry.counter(WorkflowMetrics.STEP_RETRIES, "workflow", "wf", "agent", "scripted").count())
            .isEqualTo(2.0);
    }

    @Test
    @DisplayName("A step fails once its attempts are exhausted")
    void run_shouldFailAfterMaxAttempts() throws Exception {
        provider.alwaysFail("flaky");

        StepResult result = run(step("flaky", 2, null));

        assertThat(result.status()).isEqualTo(StepStatus.FAILED);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.errorCode()).isEqualTo("TRANSIENT");
        assertThat(result.error()).isEqualTo("flaky failure 2");
        assertThat(provider.invocations("flaky")).isEqualTo(2);
        assertThat(context.history()).hasSize(2);
    }

    @Test
    @DisplayName("A permanent provider error stops retrying immediately")
    void run_shouldNotRetryPermanentFailure() throws Exception {
        provider.failPermanently("publish");

        StepResult result = run(step("publish", 5, null));

        assertThat(result.status()).isEqualTo(StepStatus.FAILED);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.errorCode()).isEqualTo("BAD_REQUEST");
    }

    @Test
    @DisplayName("An attempt exceeding the timeout counts as a failed attempt")
    void run_shouldTimeOutSlowAttempt() throws Exception {
        provider.sleep("slow", 5_000);

        long start = System.nanoTime();
        StepResult result = run(step("slow", 2, 50L));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.status()).isEqualTo(StepStatus.FAILED);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.errorCode()).isEqualTo(StepTimeoutException.ERROR_CODE);
        assertThat(elapsedMs).isLessThan(2_000);
    }

    @Test
    @DisplayName("An unknown agent fails the step without any attempt")
    void run_shouldFailOnUnknownAgent() throws Exception {
        Step step = Step.builder("ghost").agent("nobody").build();

        StepResult result = run(step);

        assertThat(result.status()).isEqualTo(StepStatus.FAILED);
        assertThat(result.attempts()).isZero();
        assertThat(result.errorCode()).isEqualTo(AgentResolutionException.ERROR_CODE);
        assertThat(context.history()).isEmpty();
    }

    @Test
    @DisplayName("Cancellation wakes a step sleeping out its retry delay")
    void run_shouldStopDuringBackoffOnCancel() throws Exception {
        provider.alwaysFail("flaky");
        Step step = Step.builder("flaky")
            .agent("scripted")
            .retryPolicy(RetryPolicy.builder().maxAttempts(3).delay(60_000).build())
            .build();
        CancellationToken token = new CancellationToken();
        CountDownLatch firstFailure = new CountDownLatch(1);
        StepListener listener = new StepListener() {
            @Override
            public void onAttemptFailed(String stepId, int attempt, String error, String errorCode, boolean willRetry) {
                firstFailure.countDown();
            }
        };

        CompletableFuture<StepResult> future = CompletableFuture.supplyAsync(() -> {
            try {
                return executor.run(invocation(step, token, listener));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        assertThat(firstFailure.await(5, TimeUnit.SECONDS)).isTrue();
        token.cancel();

        StepResult result = future.get(5, TimeUnit.SECONDS);
        assertThat(result.cancelled()).isTrue();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(provider.invocations("flaky")).isEqualTo(1);
    }

    @Test
    @DisplayName("Cancellation interrupts an in-flight provider call and records nothing more")
    void run_shouldInterruptInFlightAttemptOnCancel() throws Exception {
        provider.blockUntil("review", new CountDownLatch(1));
        CancellationToken token = new CancellationToken();
        List<Integer> started = new ArrayList<>();
        CountDownLatch attemptStarted = new CountDownLatch(1);
        StepListener listener = new StepListener() {
            @Override
            public void onAttemptStarted(String stepId, int attempt) {
                started.add(attempt);
                attemptStarted.countDown();
            }
        };

        CompletableFuture<StepResult> future = CompletableFuture.supplyAsync(() -> {
            try {
                return executor.run(invocation(step("review", 3, null), token, listener));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        assertThat(attemptStarted.await(5, TimeUnit.SECONDS)).isTrue();
        token.cancel();

        StepResult result = future.get(5, TimeUnit.SECONDS);
        assertThat(result.cancelled()).isTrue();
        assertThat(started).containsExactly(1);
        assertThat(context.history()).isEmpty();
    }
}
