package com.agentflow.recovery;

import com.agentflow.core.exception.EngineShutdownException;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;
import com.agentflow.engine.service.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Resumes executions left unfinished by a previous process.
 *
 * Responsibilities:
 * - Scan the store for pending and running executions at startup
 * - Rescan periodically for executions interrupted since
 * - Hand each one not owned by this process to {@link WorkflowEngine#resumeAsync}
 *
 * Assumes a single engine process per store.
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private static final int BATCH_SIZE = 100;

    private final ExecutionRepository executionRepository;
    private final WorkflowEngine engine;
    private final Duration scanInterval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RecoveryEngine(ExecutionRepository executionRepository, WorkflowEngine engine, Duration scanInterval) {
        this.executionRepository = executionRepository;
        this.engine = engine;
        this.scanInterval = scanInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "agentflow-recovery");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start the recovery engine. The first scan runs immediately.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }

        running = true;
        log.info("Starting recovery engine, scan interval {}", scanInterval);

        scheduler.scheduleWithFixedDelay(
            this::scan,
            0,
            scanInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the recovery engine.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Resume every unfinished execution not active in this process.
     *
     * @return ids of the executions handed to the engine
     */
    public List<String> recoverInterrupted() {
        List<Execution> candidates = new ArrayList<>();
        candidates.addAll(executionRepository.findAll(
            new ExecutionQuery(null, ExecutionStatus.RUNNING, BATCH_SIZE)));
        candidates.addAll(executionRepository.findAll(
            new ExecutionQuery(null, ExecutionStatus.PENDING, BATCH_SIZE)));

        List<String> resumed = new ArrayList<>();
        for (Execution execution : candidates) {
            if (engine.isActive(execution.id())) {
                continue;
            }
            try {
                engine.resumeAsync(execution.id());
                resumed.add(execution.id());
                log.info("Recovering execution {} of workflow {}", execution.id(), execution.workflowId());
            } catch (NotFoundException e) {
                log.warn("Cannot recover execution {}: {}", execution.id(), e.getMessage());
            } catch (InvalidStateTransitionException e) {
                log.debug("Execution {} no longer needs recovery: {}", execution.id(), e.getMessage());
            }
        }
        return resumed;
    }

    private void scan() {
        if (!running) return;

        try {
            List<String> resumed = recoverInterrupted();
            if (!resumed.isEmpty()) {
                log.info("Recovery scan resumed {} execution(s)", resumed.size());
            }
        } catch (EngineShutdownException e) {
            log.info("Engine is not accepting work, stopping recovery scans: {}", e.getMessage());
            running = false;
        } catch (Exception e) {
            log.error("Error in recovery scan", e);
        }
    }
}
