package com.agentflow.api.rest;

import com.agentflow.core.model.ValidationResult;
import com.agentflow.core.model.Workflow;
import com.agentflow.engine.service.ExecutionHandle;
import com.agentflow.engine.service.WorkflowEngine;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for workflow definitions.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowEngine engine;

    public WorkflowController(WorkflowEngine engine) {
        this.engine = engine;
    }

    /**
     * Register a workflow definition, replacing any previous version with the same id.
     */
    @PostMapping
    public ResponseEntity<WorkflowLoadedResponse> loadWorkflow(@RequestBody Workflow workflow) {
        engine.loadWorkflow(workflow);
        ValidationResult validation = engine.validate(workflow);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new WorkflowLoadedResponse(workflow.id(), workflow.version(),
                workflow.steps().size(), validation.warnings()));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validateWorkflow(@RequestBody Workflow workflow) {
        return ResponseEntity.ok(engine.validate(workflow));
    }

    @GetMapping
    public ResponseEntity<List<Workflow>> listWorkflows() {
        return ResponseEntity.ok(engine.listWorkflows());
    }

    @GetMapping("/{workflowId}")
    public ResponseEntity<Workflow> getWorkflow(@PathVariable String workflowId) {
        return ResponseEntity.ok(engine.getWorkflow(workflowId));
    }

    /**
     * Start an execution in the background.
     */
    @PostMapping("/{workflowId}/executions")
    public ResponseEntity<ExecutionAcceptedResponse> startExecution(
            @PathVariable String workflowId,
            @RequestBody(required = false) StartExecutionRequest request) {

        Map<String, JsonNode> context = request != null && request.context() != null
            ? request.context()
            : Map.of();
        ExecutionHandle handle = engine.start(workflowId, context);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new ExecutionAcceptedResponse(handle.executionId(), workflowId));
    }

    // ========== DTOs ==========

    public record StartExecutionRequest(Map<String, JsonNode> context) {}

    public record WorkflowLoadedResponse(
        String id,
        String version,
        int steps,
        List<String> warnings
    ) {}

    public record ExecutionAcceptedResponse(String executionId, String workflowId) {}
}
