package com.agentflow.core.validation;

import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.Step;
import com.agentflow.core.model.ValidationResult;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowConfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation of workflow definitions. Pure and stateless.
 *
 * Errors make the workflow unrunnable; warnings are advisory only.
 */
public class WorkflowValidator {

    public static final int LARGE_WORKFLOW_THRESHOLD = 100;

    /**
     * Validate a workflow definition, collecting every problem found.
     */
    public ValidationResult validate(Workflow workflow) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (isBlank(workflow.id())) {
            errors.add("Workflow id is required");
        }
        if (isBlank(workflow.name())) {
            errors.add("Workflow name is required");
        }
        if (workflow.steps().isEmpty()) {
            errors.add("Workflow must contain at least one step");
        }

        validateConfig(workflow.config(), errors);

        Map<String, Step> stepsById = new LinkedHashMap<>();
        for (int i = 0; i < workflow.steps().size(); i++) {
            Step step = workflow.steps().get(i);
            validateStep(step, i, errors);
            if (!isBlank(step.id()) && stepsById.putIfAbsent(step.id(), step) != null) {
                errors.add("Duplicate step id: " + step.id());
            }
        }

        boolean danglingDependency = false;
        for (Step step : stepsById.values()) {
            for (String dependency : step.dependsOn()) {
                if (!stepsById.containsKey(dependency)) {
                    errors.add(String.format("Step %s depends on non-existent step: %s", step.id(), dependency));
                    danglingDependency = true;
                }
            }
        }

        // Dangling edges would be reported twice by the cycle search
        if (!danglingDependency) {
            String cycleAt = findCycle(stepsById);
            if (cycleAt != null) {
                errors.add("Circular dependency detected at step: " + cycleAt);
            }
        }

        if (workflow.steps().size() > LARGE_WORKFLOW_THRESHOLD) {
            warnings.add(String.format("Workflow has %d steps; consider splitting it",
                workflow.steps().size()));
        }
        if (workflow.steps().size() > 1 && workflow.steps().stream().allMatch(Step::parallel)) {
            warnings.add("All steps are marked parallel; dependencies may be missing");
        }

        return ValidationResult.of(errors, warnings);
    }

    // ========== Internal Methods ==========

    private void validateConfig(WorkflowConfig config, List<String> errors) {
        if (config.maxConcurrent() < 1) {
            errors.add("maxConcurrent must be at least 1, was " + config.maxConcurrent());
        }
        if (config.tokenBudget() != null && config.tokenBudget() <= 0) {
            errors.add("tokenBudget must be positive, was " + config.tokenBudget());
        }
    }

    private void validateStep(Step step, int index, List<String> errors) {
        String label = isBlank(step.id()) ? "#" + index : step.id();
        if (isBlank(step.id())) {
            errors.add("Step " + label + " is missing an id");
        }
        if (isBlank(step.agent())) {
            errors.add("Step " + label + " is missing an agent");
        }
        RetryPolicy retry = step.retryPolicy();
        if (retry.maxAttempts() < 1) {
            errors.add(String.format("Step %s: maxAttempts must be at least 1, was %d", label, retry.maxAttempts()));
        }
        if (retry.delay() < 0) {
            errors.add(String.format("Step %s: retry delay must not be negative, was %d", label, retry.delay()));
        }
        if (step.timeout() != null && step.timeout() <= 0) {
            errors.add(String.format("Step %s: timeout must be positive, was %d", label, step.timeout()));
        }
    }

    /**
     * Depth-first search with an explicit recursion stack, so long dependency
     * chains cannot overflow the thread stack.
     *
     * @return id of the step that closes a cycle, or null if the graph is acyclic
     */
    private String findCycle(Map<String, Step> stepsById) {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Deque<Frame> path = new ArrayDeque<>();
        for (String root : stepsById.keySet()) {
            if (!visited.add(root)) {
                continue;
            }
            onStack.add(root);
            path.push(new Frame(root, stepsById.get(root).dependsOn().iterator()));
            while (!path.isEmpty()) {
                Frame frame = path.peek();
                if (!frame.dependencies().hasNext()) {
                    onStack.remove(frame.stepId());
                    path.pop();
                    continue;
                }
                String dependency = frame.dependencies().next();
                if (onStack.contains(dependency)) {
                    return dependency;
                }
                if (visited.add(dependency)) {
                    onStack.add(dependency);
                    path.push(new Frame(dependency, stepsById.get(dependency).dependsOn().iterator()));
                }
            }
        }
        return null;
    }

    private record Frame(String stepId, Iterator<String> dependencies) {
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
