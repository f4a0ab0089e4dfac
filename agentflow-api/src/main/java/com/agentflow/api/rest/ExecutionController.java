package com.agentflow.api.rest;

import com.agentflow.core.model.Execution;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.engine.service.ExecutionHandle;
import com.agentflow.engine.service.WorkflowEngine;
import com.agentflow.engine.status.ExecutionSummary;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for executions.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private final WorkflowEngine engine;

    public ExecutionController(WorkflowEngine engine) {
        this.engine = engine;
    }

    /**
     * List executions, most recently started first.
     */
    @GetMapping
    public ResponseEntity<List<ExecutionSummary>> listExecutions(
            @RequestParam(required = false) String workflowId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "100") int limit) {

        ExecutionStatus statusFilter = status != null ? ExecutionStatus.fromValue(status) : null;
        List<ExecutionSummary> summaries = engine
            .listExecutions(new ExecutionQuery(workflowId, statusFilter, limit))
            .stream()
            .map(ExecutionSummary::from)
            .toList();

        return ResponseEntity.ok(summaries);
    }

    @GetMapping("/{executionId}")
    public ResponseEntity<Execution> getExecution(@PathVariable String executionId) {
        return ResponseEntity.ok(engine.getExecutionStatus(executionId));
    }

    @GetMapping("/{executionId}/summary")
    public ResponseEntity<ExecutionSummary> getSummary(@PathVariable String executionId) {
        return ResponseEntity.ok(engine.getExecutionSummary(executionId));
    }

    /**
     * Cancel an execution and return its final record.
     */
    @PostMapping("/{executionId}/cancel")
    public ResponseEntity<Execution> cancelExecution(@PathVariable String executionId) {
        return ResponseEntity.ok(engine.cancel(executionId));
    }

    /**
     * Resume an interrupted execution in the background.
     */
    @PostMapping("/{executionId}/resume")
    public ResponseEntity<ResumeAcceptedResponse> resumeExecution(@PathVariable String executionId) {
        ExecutionHandle handle = engine.resumeAsync(executionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new ResumeAcceptedResponse(handle.executionId()));
    }

    public record ResumeAcceptedResponse(String executionId) {}
}
