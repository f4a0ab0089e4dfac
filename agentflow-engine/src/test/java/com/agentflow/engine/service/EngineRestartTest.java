package com.agentflow.engine.service;

import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionResult;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.Step;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.Workflow;
import com.agentflow.engine.json.ObjectMappers;
import com.agentflow.engine.persistence.FileExecutionRepository;
import com.agentflow.engine.persistence.FileWorkflowRepository;
import com.agentflow.engine.test.ScriptedProvider;
import com.agentflow.provider.ProviderRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * Two engines sharing one state directory, standing in for a process restart.
 */
@Timeout(30)
class EngineRestartTest {

    @TempDir
    Path stateDirectory;

    private DefaultWorkflowEngine newEngine(ScriptedProvider provider) {
        return DefaultWorkflowEngine.builder(ProviderRegistry.builder().register("scripted", provider).build())
            .executionRepository(new FileExecutionRepository(stateDirectory, ObjectMappers.json()))
            .workflowRepository(new FileWorkflowRepository(stateDirectory.resolve("definitions"), ObjectMappers.json()))
            .build();
    }

    private static Workflow publishing() {
        return Workflow.builder("loaded-at-runtime")
            .step(Step.builder("draft").agent("scripted").build())
            .step(Step.builder("review").agent("scripted").dependsOn("draft").build())
            .build();
    }

    @Test
    @DisplayName("A workflow loaded at runtime survives a restart and its execution resumes")
    void resume_afterRestart_shouldFindStoredDefinition() {
        CountDownLatch never = new CountDownLatch(1);
        ScriptedProvider firstProvider = new ScriptedProvider().blockUntil("review", never);
        DefaultWorkflowEngine first = newEngine(firstProvider);
        first.loadWorkflow(publishing());
        ExecutionHandle handle = first.start("loaded-at-runtime", Map.of());
        await().atMost(Duration.ofSeconds(5)).until(() -> firstProvider.invocations("review") == 1);

        first.shutdown(Duration.ofMillis(100));

        ScriptedProvider secondProvider = new ScriptedProvider();
        DefaultWorkflowEngine second = newEngine(secondProvider);
        try {
            Execution stored = second.getExecutionStatus(handle.executionId());
            assertThat(stored.status()).isEqualTo(ExecutionStatus.RUNNING);
            assertThat(stored.step("draft").status()).isEqualTo(StepStatus.SUCCEEDED);
            assertThat(second.listWorkflows()).extracting(Workflow::id).containsExactly("loaded-at-runtime");

            ExecutionResult result = second.resume(handle.executionId());

            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(secondProvider.invocations("draft")).isZero();
            assertThat(secondProvider.invocations("review")).isEqualTo(1);
        } finally {
            second.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    @DisplayName("Definitions passed straight to execute are stored too")
    void execute_shouldStoreDefinition() {
        DefaultWorkflowEngine engine = newEngine(new ScriptedProvider());
        try {
            engine.execute(publishing(), Map.of());
        } finally {
            engine.shutdown(Duration.ofSeconds(1));
        }

        FileWorkflowRepository reopened =
            new FileWorkflowRepository(stateDirectory.resolve("definitions"), ObjectMappers.json());
        Workflow stored = reopened.findById("loaded-at-runtime").orElseThrow();
        assertThat(stored).isEqualTo(publishing());
    }
}
