package com.agentflow.engine.lifecycle;

import com.agentflow.engine.service.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops the workflow engine when the application context closes.
 *
 * On shutdown:
 * 1. The engine stops accepting new executions
 * 2. Active executions get a bounded time to finish
 * 3. Executions still running are interrupted and checkpointed as RUNNING,
 *    so recovery can resume them on the next start
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final WorkflowEngine engine;
    private final Duration timeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(WorkflowEngine engine, Duration timeout) {
        this.engine = engine;
        this.timeout = timeout;
    }

    /**
     * Check if shutdown is in progress.
     */
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Graceful shutdown initiated, waiting up to {}s for executions", timeout.toSeconds());
        long start = System.currentTimeMillis();
        engine.shutdown(timeout);
        log.info("Graceful shutdown completed in {}ms", System.currentTimeMillis() - start);
    }
}
