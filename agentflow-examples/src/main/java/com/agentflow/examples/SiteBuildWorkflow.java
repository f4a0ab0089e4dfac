package com.agentflow.examples;

import com.agentflow.core.model.BackoffStrategy;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.Step;
import com.agentflow.core.model.Workflow;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Landing page build: brand identity first, then layout and copy in parallel,
 * an optional SEO pass over the copy, and finally assembly.
 *
 * <pre>
 * brand-identity --+--> layout-design ----------------+--> assemble
 *                  +--> content --> seo (optional) ---+
 * </pre>
 */
public final class SiteBuildWorkflow {

    public static final String ID = "site-build";

    public static final String BRAND = "brand-identity";
    public static final String LAYOUT = "layout-design";
    public static final String CONTENT = "content";
    public static final String SEO = "seo";
    public static final String ASSEMBLE = "assemble";

    private SiteBuildWorkflow() {
    }

    public static Workflow definition() {
        RetryPolicy agentRetry = RetryPolicy.builder()
            .maxAttempts(3)
            .delay(200)
            .backoff(BackoffStrategy.EXPONENTIAL)
            .build();

        return Workflow.builder(ID)
            .name("Site build")
            .description("Design, write and assemble a landing page")
            .maxConcurrent(2)
            .step(Step.builder(BRAND)
                .name("Brand Identity")
                .agent(SiteBuildProviders.GRAPHIC_DESIGN)
                .task(task("Generate brand colors and typography"))
                .retryPolicy(agentRetry)
                .build())
            .step(Step.builder(LAYOUT)
                .name("Layout Design")
                .agent(SiteBuildProviders.LAYOUT)
                .task(task("Create a responsive page layout"))
                .dependsOn(BRAND)
                .parallel(true)
                .retryPolicy(agentRetry)
                .timeout(30_000L)
                .build())
            .step(Step.builder(CONTENT)
                .name("Content")
                .agent(SiteBuildProviders.CONTENT)
                .task(task("Write hero, features and call to action"))
                .dependsOn(BRAND)
                .parallel(true)
                .retryPolicy(agentRetry)
                .timeout(30_000L)
                .build())
            .step(Step.builder(SEO)
                .name("SEO Optimization")
                .agent(SiteBuildProviders.SEO)
                .task(task("Tune title, description and keywords"))
                .dependsOn(CONTENT)
                .optional(true)
                .retryPolicy(RetryPolicy.builder().maxAttempts(2).delay(100).build())
                .build())
            .step(Step.builder(ASSEMBLE)
                .name("Assemble Page")
                .agent(SiteBuildProviders.ASSEMBLER)
                .task(task("Combine layout, copy and metadata"))
                .dependsOn(LAYOUT, SEO)
                .build())
            .build();
    }

    private static ObjectNode task(String description) {
        ObjectNode task = JsonNodeFactory.instance.objectNode();
        task.put("description", description);
        return task;
    }
}
