package com.agentflow.engine.coordinator;

import com.agentflow.core.model.Step;
import com.agentflow.core.model.StepRecord;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.Workflow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure dependency rules of the scheduler.
 *
 * A dependency is satisfied when it SUCCEEDED, or when it is optional and ended
 * FAILED or SKIPPED. A non-optional dependency that ended FAILED or SKIPPED blocks
 * its dependents, which are then skipped.
 */
public class DependencyResolver {

    private final Workflow workflow;
    private final Map<String, Step> stepsById = new LinkedHashMap<>();

    public DependencyResolver(Workflow workflow) {
        this.workflow = workflow;
        for (Step step : workflow.steps()) {
            stepsById.put(step.id(), step);
        }
    }

    public Step step(String stepId) {
        return stepsById.get(stepId);
    }

    /**
     * Find waiting steps that can never run because a dependency is blocked,
     * following the chain transitively until nothing changes.
     *
     * @return step id to skip reason, in declaration order
     */
    public Map<String, String> blockedSteps(Map<String, StepRecord> records) {
        Map<String, StepStatus> statuses = new HashMap<>();
        records.forEach((id, r) -> statuses.put(id, r.status()));

        Map<String, String> skipped = new LinkedHashMap<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Step step : workflow.steps()) {
                if (!statuses.get(step.id()).isWaiting()) {
                    continue;
                }
                for (String dependency : step.dependsOn()) {
                    if (blocks(dependency, statuses.get(dependency))) {
                        statuses.put(step.id(), StepStatus.SKIPPED);
                        skipped.put(step.id(), String.format("Dependency %s %s",
                            dependency, statuses.get(dependency).value()));
                        changed = true;
                        break;
                    }
                }
            }
        }
        return skipped;
    }

    /**
     * Waiting steps whose dependencies are all satisfied, in declaration order.
     */
    public List<String> readySteps(Map<String, StepRecord> records) {
        List<String> ready = new ArrayList<>();
        for (Step step : workflow.steps()) {
            if (!records.get(step.id()).status().isWaiting()) {
                continue;
            }
            boolean satisfied = step.dependsOn().stream()
                .allMatch(dependency -> isSatisfied(dependency, records.get(dependency).status()));
            if (satisfied) {
                ready.add(step.id());
            }
        }
        return ready;
    }

    /**
     * Check if a dependency in the given status lets its dependents run.
     */
    public boolean isSatisfied(String dependencyId, StepStatus status) {
        if (status == StepStatus.SUCCEEDED) {
            return true;
        }
        return stepsById.get(dependencyId).optional()
            && (status == StepStatus.FAILED || status == StepStatus.SKIPPED);
    }

    /**
     * Check if a dependency in the given status prevents its dependents from ever running.
     */
    public boolean blocks(String dependencyId, StepStatus status) {
        return !stepsById.get(dependencyId).optional()
            && (status == StepStatus.FAILED || status == StepStatus.SKIPPED);
    }
}
