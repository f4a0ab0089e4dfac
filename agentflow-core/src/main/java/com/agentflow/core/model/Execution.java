package com.agentflow.core.model;

import com.agentflow.core.context.ContextSnapshot;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One run of a workflow. Primary source of truth for execution state.
 * Mutated only by the coordinator that owns it; never deleted by the engine.
 *
 * Invariants:
 * - status transitions follow {@link ExecutionStatus#canTransitionTo}
 * - steps holds one record per workflow step, in declaration order
 * - sequenceNumber is monotonically increasing
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Execution(
    String id,
    String workflowId,
    ExecutionStatus status,
    Map<String, StepRecord> steps,
    ContextSnapshot contextSnapshot,
    Instant startedAt,
    Instant completedAt,
    String lastError,
    String lastErrorStepId,
    long sequenceNumber
) {
    public static final String ID_PREFIX = "exec-";

    public Execution {
        steps = steps == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(steps));
    }

    /**
     * Create a new execution in PENDING state with every step pending.
     */
    public static Execution create(Workflow workflow, ContextSnapshot initialContext) {
        Map<String, StepRecord> steps = new LinkedHashMap<>();
        for (Step step : workflow.steps()) {
            steps.put(step.id(), StepRecord.pending());
        }
        return new Execution(
            ID_PREFIX + UUID.randomUUID(),
            workflow.id(),
            ExecutionStatus.PENDING,
            steps,
            initialContext,
            Instant.now(),
            null,
            null,
            null,
            0L
        );
    }

    /**
     * Check if the execution is in a terminal state.
     */
    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Get the record of one step.
     */
    public StepRecord step(String stepId) {
        return steps.get(stepId);
    }

    /**
     * Count the steps currently in the given status.
     */
    public long countSteps(StepStatus stepStatus) {
        return steps.values().stream().filter(r -> r.status() == stepStatus).count();
    }

    /**
     * Create a copy in the target status.
     *
     * @throws InvalidStateTransitionException if the transition is not allowed
     */
    public Execution transitionTo(ExecutionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id, status, "move to " + target.value());
        }
        Instant completed = target.isTerminal() ? Instant.now() : completedAt;
        return new Execution(id, workflowId, target, steps, contextSnapshot, startedAt,
            completed, lastError, lastErrorStepId, sequenceNumber + 1);
    }

    /**
     * Create a copy with one step record replaced.
     */
    public Execution withStep(String stepId, StepRecord record) {
        Map<String, StepRecord> newSteps = new LinkedHashMap<>(steps);
        newSteps.put(stepId, record);
        return new Execution(id, workflowId, status, newSteps, contextSnapshot, startedAt,
            completedAt, lastError, lastErrorStepId, sequenceNumber + 1);
    }

    /**
     * Create a copy with a new context checkpoint.
     */
    public Execution withContextSnapshot(ContextSnapshot snapshot) {
        return new Execution(id, workflowId, status, steps, snapshot, startedAt,
            completedAt, lastError, lastErrorStepId, sequenceNumber + 1);
    }

    /**
     * Create a copy with the last error recorded.
     */
    public Execution withLastError(String error, String stepId) {
        return new Execution(id, workflowId, status, steps, contextSnapshot, startedAt,
            completedAt, error, stepId, sequenceNumber + 1);
    }
}
