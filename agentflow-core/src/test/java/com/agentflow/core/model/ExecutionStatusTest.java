package com.agentflow.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(ExecutionStatus.COMPLETED.isTerminal());
        assertTrue(ExecutionStatus.FAILED.isTerminal());
        assertTrue(ExecutionStatus.CANCELLED.isTerminal());

        assertFalse(ExecutionStatus.PENDING.isTerminal());
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
    }

    @Test
    void canTransitionTo_fromPending_shouldAllowRunningAndCancelled() {
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING));
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.CANCELLED));

        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.FAILED));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowEveryTerminalState() {
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.FAILED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.CANCELLED));

        assertFalse(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.PENDING));
    }

    @Test
    void canTransitionTo_fromTerminal_shouldAllowNothing() {
        for (ExecutionStatus terminal : new ExecutionStatus[]{
                ExecutionStatus.COMPLETED, ExecutionStatus.FAILED, ExecutionStatus.CANCELLED}) {
            for (ExecutionStatus target : ExecutionStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    void stepStatus_shouldClassifyInFlightAndWaiting() {
        assertTrue(StepStatus.RUNNING.isInFlight());
        assertTrue(StepStatus.RETRYING.isInFlight());
        assertFalse(StepStatus.READY.isInFlight());

        assertTrue(StepStatus.PENDING.isWaiting());
        assertTrue(StepStatus.READY.isWaiting());
        assertFalse(StepStatus.SKIPPED.isWaiting());

        assertTrue(StepStatus.SKIPPED.isTerminal());
        assertFalse(StepStatus.RETRYING.isTerminal());
    }
}
