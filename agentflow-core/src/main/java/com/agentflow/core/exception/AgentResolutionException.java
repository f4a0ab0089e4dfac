package com.agentflow.core.exception;

/**
 * Thrown when a step names a capability provider that is not registered.
 * Never retried.
 */
public class AgentResolutionException extends AgentFlowException {

    public static final String ERROR_CODE = "AGENT_NOT_FOUND";

    private final String agentId;

    public AgentResolutionException(String agentId) {
        super(ERROR_CODE, "No capability provider registered for agent: " + agentId);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
