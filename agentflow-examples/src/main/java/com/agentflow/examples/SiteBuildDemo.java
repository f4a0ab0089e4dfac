package com.agentflow.examples;

import com.agentflow.core.model.ExecutionResult;
import com.agentflow.core.model.StepRecord;
import com.agentflow.engine.json.ObjectMappers;
import com.agentflow.engine.persistence.FileExecutionRepository;
import com.agentflow.engine.persistence.FileWorkflowRepository;
import com.agentflow.engine.service.DefaultWorkflowEngine;
import com.agentflow.provider.ProviderRegistry;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Runs the site-build workflow once with stub agents and a file store.
 *
 * Usage: {@code SiteBuildDemo [business-name] [state-directory]}
 */
public final class SiteBuildDemo {

    private static final Logger log = LoggerFactory.getLogger(SiteBuildDemo.class);

    private SiteBuildDemo() {
    }

    public static void main(String[] args) {
        String business = args.length > 0 ? args[0] : "Corner Bakery";
        Path stateDirectory = Path.of(args.length > 1 ? args[1] : "./state");

        ProviderRegistry registry = ProviderRegistry.builder()
            .apply(new SiteBuildProviders())
            .build();
        DefaultWorkflowEngine engine = DefaultWorkflowEngine.builder(registry)
            .executionRepository(new FileExecutionRepository(stateDirectory, ObjectMappers.json()))
            .workflowRepository(new FileWorkflowRepository(stateDirectory.resolve("definitions"), ObjectMappers.json()))
            .build();

        try {
            ExecutionResult result = engine.execute(SiteBuildWorkflow.definition(),
                Map.of("business", TextNode.valueOf(business)));

            log.info("Execution {} finished {}", result.executionId(), result.status().value());
            for (Map.Entry<String, StepRecord> step : result.stepResults().entrySet()) {
                StepRecord record = step.getValue();
                log.info("  {} {} attempts={} tokens={}", step.getKey(), record.status().value(),
                    record.attempts(), record.tokensUsed());
            }
            log.info("Page: {}", result.finalContext().data().get(SiteBuildWorkflow.ASSEMBLE));
            log.info("Total tokens: {}", result.finalContext().metadata().totalTokens());
        } finally {
            engine.shutdown(Duration.ofSeconds(5));
        }
    }
}
