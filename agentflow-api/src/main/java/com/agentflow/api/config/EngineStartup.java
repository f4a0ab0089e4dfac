package com.agentflow.api.config;

import com.agentflow.core.model.Workflow;
import com.agentflow.engine.loader.WorkflowLoader;
import com.agentflow.engine.service.WorkflowEngine;
import com.agentflow.recovery.RecoveryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads workflow definitions once the application is ready, then starts recovery.
 * Definitions must be loaded first so interrupted executions can find their workflow.
 */
@Component
public class EngineStartup {

    private static final Logger log = LoggerFactory.getLogger(EngineStartup.class);

    private final WorkflowEngine engine;
    private final WorkflowLoader loader;
    private final RecoveryEngine recovery;
    private final EngineProperties properties;

    public EngineStartup(WorkflowEngine engine, WorkflowLoader loader, RecoveryEngine recovery,
                         EngineProperties properties) {
        this.engine = engine;
        this.loader = loader;
        this.recovery = recovery;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        Path directory = properties.workflowsDirectory();
        if (directory != null && Files.isDirectory(directory)) {
            for (Workflow workflow : loader.loadDirectory(directory)) {
                engine.loadWorkflow(workflow);
            }
        } else if (directory != null) {
            log.warn("Workflow directory {} does not exist, no definitions loaded", directory);
        }

        if (properties.recovery().enabled()) {
            recovery.start();
        }
    }

    /**
     * Runs before the engine shuts down so no execution is resumed mid-shutdown.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(-1)
    public void onShutdown() {
        if (recovery.isRunning()) {
            recovery.stop();
        }
    }
}
