package com.agentflow.api.provider;

import com.agentflow.provider.CapabilityProvider;
import com.agentflow.provider.ProviderException;
import com.agentflow.provider.ProviderRegistrar;
import com.agentflow.provider.ProviderRegistry;
import com.agentflow.provider.ProviderRequest;
import com.agentflow.provider.ProviderResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Smoke-test provider registered as {@code echo}. Returns its task, optionally
 * after a delay, and can be told to fail.
 *
 * Task fields, all optional:
 * - delayMs: sleep before answering
 * - tokens: tokens to report
 * - fail: "transient" or "permanent"
 */
@Component
public class EchoProvider implements CapabilityProvider, ProviderRegistrar {

    public static final String AGENT_ID = "echo";

    private static final Logger log = LoggerFactory.getLogger(EchoProvider.class);

    @Override
    public void register(ProviderRegistry.Builder registry) {
        registry.register(AGENT_ID, this);
    }

    @Override
    public ProviderResult invoke(ProviderRequest request) throws ProviderException {
        JsonNode task = request.task();
        long delayMs = task != null ? task.path("delayMs").asLong(0) : 0;
        long tokens = task != null ? task.path("tokens").asLong(0) : 0;
        String fail = task != null ? task.path("fail").asText("") : "";

        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw ProviderException.retryable("INTERRUPTED", "echo interrupted");
            }
        }
        if ("permanent".equals(fail)) {
            throw ProviderException.permanent("ECHO_REJECTED", "echo asked to fail permanently");
        }
        if ("transient".equals(fail)) {
            throw ProviderException.retryable("ECHO_UNAVAILABLE", "echo asked to fail, attempt " + request.attempt());
        }

        ObjectNode output = JsonNodeFactory.instance.objectNode();
        output.put("stepId", request.stepId());
        output.put("attempt", request.attempt());
        output.set("task", task);
        output.put("contextKeys", request.context().data().size());
        log.debug("Echoing step {} attempt {}", request.stepId(), request.attempt());
        return new ProviderResult(output, tokens, "echoed " + request.stepId());
    }
}
