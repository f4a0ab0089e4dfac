package com.agentflow.engine.health;

import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;
import com.agentflow.engine.service.DefaultWorkflowEngine;
import com.agentflow.provider.ProviderRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the workflow engine.
 * Reports health status based on:
 * - Whether the engine still accepts work
 * - Execution store reachability
 * - Registered capability providers
 */
public class EngineHealthIndicator implements HealthIndicator {

    private final DefaultWorkflowEngine engine;
    private final ExecutionRepository executionRepository;
    private final ProviderRegistry providerRegistry;

    public EngineHealthIndicator(
            DefaultWorkflowEngine engine,
            ExecutionRepository executionRepository,
            ProviderRegistry providerRegistry) {
        this.engine = engine;
        this.executionRepository = executionRepository;
        this.providerRegistry = providerRegistry;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("activeExecutions", engine.activeCount());
        details.put("agents", providerRegistry.agentIds());

        if (engine.isShuttingDown()) {
            return Health.outOfService().withDetails(details).build();
        }

        try {
            int running = executionRepository
                .findAll(new ExecutionQuery(null, ExecutionStatus.RUNNING, 1000))
                .size();
            details.put("runningExecutions", running);
            return Health.up().withDetails(details).build();
        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
