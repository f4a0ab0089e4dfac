package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable workflow definition: an ordered list of steps forming a DAG.
 * Step order is used for deterministic tie-breaking only; it does not
 * imply execution order.
 *
 * Invariants (enforced by {@link com.agentflow.core.validation.WorkflowValidator}):
 * - step ids are unique
 * - every dependsOn entry names a step of this workflow
 * - the dependency graph is acyclic
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Workflow(
    String id,
    String name,
    String version,
    String description,
    List<Step> steps,
    WorkflowConfig config
) {
    public static final String DEFAULT_VERSION = "1.0.0";

    public Workflow {
        if (version == null) {
            version = DEFAULT_VERSION;
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (config == null) {
            config = WorkflowConfig.defaults();
        }
    }

    /**
     * Find a step by id.
     */
    public Optional<Step> step(String stepId) {
        return steps.stream()
            .filter(s -> s.id() != null && s.id().equals(stepId))
            .findFirst();
    }

    /**
     * Create a copy with a different configuration.
     */
    public Workflow withConfig(WorkflowConfig newConfig) {
        return new Workflow(id, name, version, description, steps, newConfig);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String version;
        private String description;
        private final List<Step> steps = new ArrayList<>();
        private WorkflowConfig config = WorkflowConfig.defaults();

        private Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(step);
            return this;
        }

        public Builder steps(List<Step> steps) {
            this.steps.addAll(steps);
            return this;
        }

        public Builder config(WorkflowConfig config) {
            this.config = config;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.config = config.withMaxConcurrent(maxConcurrent);
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.config = config.withFailFast(failFast);
            return this;
        }

        public Builder saveState(boolean saveState) {
            this.config = config.withSaveState(saveState);
            return this;
        }

        public Builder tokenBudget(Long tokenBudget) {
            this.config = config.withTokenBudget(tokenBudget);
            return this;
        }

        public Workflow build() {
            return new Workflow(id, name, version, description, steps, config);
        }
    }
}
