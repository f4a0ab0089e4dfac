package com.agentflow.engine.service;

import com.agentflow.core.model.ExecutionResult;

import java.util.concurrent.CompletableFuture;

/**
 * Reference to an execution running in the background.
 *
 * @param result completes when the coordinator stops (a RUNNING status means it was
 *               interrupted and can be resumed), or
 *               exceptionally if its coordinator fails
 */
public record ExecutionHandle(
    String executionId,
    CompletableFuture<ExecutionResult> result
) {
}
