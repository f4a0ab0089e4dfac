package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single node of a workflow DAG, delegated to one capability provider.
 *
 * @param id          unique within the workflow
 * @param name        display name, defaults to the id
 * @param agent       id of the capability provider that runs the step
 * @param task        opaque payload handed to the provider
 * @param dependsOn   ids of steps that must finish first; empty means eligible immediately
 * @param parallel    scheduling hint only, never bypasses the concurrency ceiling
 * @param optional    a terminal failure does not fail the workflow
 * @param retryPolicy attempts and backoff, defaults applied when absent
 * @param timeout     wall-clock bound on one attempt in milliseconds, null for none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Step(
    String id,
    String name,
    String agent,
    JsonNode task,
    Set<String> dependsOn,
    boolean parallel,
    boolean optional,
    RetryPolicy retryPolicy,
    Long timeout
) {
    public Step {
        if (name == null) {
            name = id;
        }
        dependsOn = dependsOn == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaultPolicy();
        }
    }

    public boolean hasTimeout() {
        return timeout != null;
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
            .name(name)
            .agent(agent)
            .task(task)
            .dependsOn(dependsOn)
            .parallel(parallel)
            .optional(optional)
            .retryPolicy(retryPolicy)
            .timeout(timeout);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String agent;
        private JsonNode task;
        private Set<String> dependsOn = new LinkedHashSet<>();
        private boolean parallel;
        private boolean optional;
        private RetryPolicy retryPolicy;
        private Long timeout;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder agent(String agent) {
            this.agent = agent;
            return this;
        }

        public Builder task(JsonNode task) {
            this.task = task;
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            Collections.addAll(this.dependsOn, stepIds);
            return this;
        }

        public Builder dependsOn(Collection<String> stepIds) {
            this.dependsOn = new LinkedHashSet<>(stepIds);
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder timeout(Long timeoutMs) {
            this.timeout = timeoutMs;
            return this;
        }

        public Step build() {
            return new Step(id, name, agent, task, dependsOn, parallel, optional, retryPolicy, timeout);
        }
    }
}
