package com.agentflow.core.context;

/**
 * Append-only access to the shared context used while running a step.
 * History can only grow and the token counter can only increase.
 */
public interface ContextAppender {

    void appendHistory(ContextEntry entry);

    /**
     * Add a token delta.
     *
     * @throws IllegalArgumentException if tokens is negative
     */
    void addTokens(long tokens);
}
