package com.agentflow.engine.coordinator;

import com.agentflow.core.model.Execution;
import com.agentflow.core.model.Step;
import com.agentflow.core.model.StepRecord;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.Workflow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DependencyResolverTest {

    private static Step step(String id, boolean optional, String... dependsOn) {
        return Step.builder(id).agent("x").optional(optional).dependsOn(dependsOn).build();
    }

    private static Map<String, StepRecord> records(Workflow workflow) {
        return new LinkedHashMap<>(Execution.create(workflow, null).steps());
    }

    private static void set(Map<String, StepRecord> records, String stepId, StepStatus status) {
        records.put(stepId, records.get(stepId).withStatus(status));
    }

    @Test
    void readySteps_initially_shouldBeRootsInDeclarationOrder() {
        Workflow workflow = Workflow.builder("wf")
            .step(step("C", false))
            .step(step("B", false, "C"))
            .step(step("A", false))
            .build();

        assertThat(new DependencyResolver(workflow).readySteps(records(workflow)))
            .containsExactly("C", "A");
    }

    @Test
    void readySteps_shouldWaitForAllDependencies() {
        Workflow workflow = Workflow.builder("diamond")
            .step(step("A", false))
            .step(step("B", false, "A"))
            .step(step("C", false, "A"))
            .step(step("D", false, "B", "C"))
            .build();
        DependencyResolver resolver = new DependencyResolver(workflow);
        Map<String, StepRecord> records = records(workflow);

        set(records, "A", StepStatus.SUCCEEDED);
        assertThat(resolver.readySteps(records)).containsExactly("B", "C");

        set(records, "B", StepStatus.SUCCEEDED);
        set(records, "C", StepStatus.RUNNING);
        assertThat(resolver.readySteps(records)).isEmpty();

        set(records, "C", StepStatus.SUCCEEDED);
        assertThat(resolver.readySteps(records)).containsExactly("D");
    }

    @Test
    void blockedSteps_shouldPropagateTransitively() {
        Workflow workflow = Workflow.builder("chain")
            .step(step("A", false))
            .step(step("B", false, "A"))
            .step(step("C", false, "B"))
            .step(step("X", false))
            .build();
        Map<String, StepRecord> records = records(workflow);
        records.put("A", records.get("A").withFailed(1, "boom", "E", Instant.now()));

        Map<String, String> blocked = new DependencyResolver(workflow).blockedSteps(records);

        assertThat(blocked).containsOnlyKeys("B", "C");
        assertThat(blocked.get("B")).isEqualTo("Dependency A failed");
        assertThat(blocked.get("C")).isEqualTo("Dependency B skipped");
    }

    @Test
    void optionalDependency_failedOrSkipped_shouldSatisfyDependents() {
        Workflow workflow = Workflow.builder("optional")
            .step(step("A", true))
            .step(step("B", false, "A"))
            .build();
        DependencyResolver resolver = new DependencyResolver(workflow);
        Map<String, StepRecord> records = records(workflow);

        set(records, "A", StepStatus.FAILED);
        assertThat(resolver.blockedSteps(records)).isEmpty();
        assertThat(resolver.readySteps(records)).containsExactly("B");

        set(records, "A", StepStatus.SKIPPED);
        assertThat(resolver.readySteps(records)).containsExactly("B");
    }

    @Test
    void readyStatus_shouldStillCountAsWaiting() {
        Workflow workflow = Workflow.builder("wf").step(step("A", false)).build();
        Map<String, StepRecord> records = records(workflow);
        set(records, "A", StepStatus.READY);

        assertThat(new DependencyResolver(workflow).readySteps(records)).containsExactly("A");
    }
}
