package com.agentflow.examples;

import com.agentflow.provider.ProviderRegistrar;
import com.agentflow.provider.ProviderRegistry;
import com.agentflow.provider.ProviderRequest;
import com.agentflow.provider.ProviderResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Stub agents for the site-build workflow. Each derives its output from the
 * shared context so the data flow between steps is visible in the result.
 */
public class SiteBuildProviders implements ProviderRegistrar {

    public static final String GRAPHIC_DESIGN = "graphic-design-agent";
    public static final String LAYOUT = "layout-agent";
    public static final String CONTENT = "content-generation-agent";
    public static final String SEO = "seo-optimization-agent";
    public static final String ASSEMBLER = "site-assembler";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Override
    public void register(ProviderRegistry.Builder registry) {
        registry.register(GRAPHIC_DESIGN, this::brandIdentity);
        registry.register(LAYOUT, this::layout);
        registry.register(CONTENT, this::content);
        registry.register(SEO, this::seo);
        registry.register(ASSEMBLER, this::assemble);
    }

    private ProviderResult brandIdentity(ProviderRequest request) {
        String business = text(request, "business", "Acme");
        ObjectNode brand = NODES.objectNode();
        brand.put("name", business);
        brand.put("primaryColor", "#1f6feb");
        brand.put("font", "Inter");
        return new ProviderResult(brand, 120, "brand identity for " + business);
    }

    private ProviderResult layout(ProviderRequest request) {
        ObjectNode layout = NODES.objectNode();
        layout.putArray("sections").add("hero").add("features").add("cta");
        layout.put("font", request.context().get(SiteBuildWorkflow.BRAND)
            .map(brand -> brand.path("font").asText())
            .orElse("system-ui"));
        return new ProviderResult(layout, 200, "three-section layout");
    }

    private ProviderResult content(ProviderRequest request) {
        String business = request.context().get(SiteBuildWorkflow.BRAND)
            .map(brand -> brand.path("name").asText())
            .orElse("our company");
        ObjectNode copy = NODES.objectNode();
        copy.put("headline", "Welcome to " + business);
        copy.put("body", business + " makes every day better.");
        return new ProviderResult(copy, 350, "landing page copy");
    }

    private ProviderResult seo(ProviderRequest request) {
        String headline = request.context().get(SiteBuildWorkflow.CONTENT)
            .map(copy -> copy.path("headline").asText())
            .orElse("");
        ObjectNode meta = NODES.objectNode();
        meta.put("title", headline);
        meta.put("description", headline.isEmpty() ? "" : headline + " | official site");
        return new ProviderResult(meta, 80, "meta tags");
    }

    private ProviderResult assemble(ProviderRequest request) {
        ObjectNode page = NODES.objectNode();
        for (String part : new String[] {SiteBuildWorkflow.LAYOUT, SiteBuildWorkflow.CONTENT, SiteBuildWorkflow.SEO}) {
            request.context().get(part).ifPresent(value -> page.set(part, value));
        }
        page.put("seoApplied", page.has(SiteBuildWorkflow.SEO));
        return new ProviderResult(page, 50, "assembled " + page.size() + " parts");
    }

    private static String text(ProviderRequest request, String key, String fallback) {
        JsonNode value = request.context().get(key).orElse(null);
        return value != null && value.isTextual() ? value.asText() : fallback;
    }
}
