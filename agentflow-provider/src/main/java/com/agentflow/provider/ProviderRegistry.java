package com.agentflow.provider;

import com.agentflow.core.exception.AgentResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from agent id to capability provider.
 * Built once at start-up and passed to the engine.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, CapabilityProvider> providers;

    private ProviderRegistry(Map<String, CapabilityProvider> providers) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create an empty registry.
     */
    public static ProviderRegistry empty() {
        return new ProviderRegistry(Map.of());
    }

    /**
     * Get the provider registered under an agent id.
     *
     * @throws AgentResolutionException if nothing is registered under the id
     */
    public CapabilityProvider resolve(String agentId) {
        CapabilityProvider provider = agentId == null ? null : providers.get(agentId);
        if (provider == null) {
            throw new AgentResolutionException(agentId);
        }
        return provider;
    }

    public Optional<CapabilityProvider> find(String agentId) {
        return Optional.ofNullable(providers.get(agentId));
    }

    public boolean contains(String agentId) {
        return providers.containsKey(agentId);
    }

    public Set<String> agentIds() {
        return providers.keySet();
    }

    public int size() {
        return providers.size();
    }

    public static class Builder {
        private final Map<String, CapabilityProvider> providers = new LinkedHashMap<>();

        /**
         * Register a provider.
         *
         * @throws IllegalArgumentException if the id is blank or already taken
         */
        public Builder register(String agentId, CapabilityProvider provider) {
            if (agentId == null || agentId.isBlank()) {
                throw new IllegalArgumentException("Agent id must not be blank");
            }
            if (provider == null) {
                throw new IllegalArgumentException("Provider for " + agentId + " must not be null");
            }
            if (providers.putIfAbsent(agentId, provider) != null) {
                throw new IllegalArgumentException("Agent already registered: " + agentId);
            }
            log.debug("Registered capability provider: {}", agentId);
            return this;
        }

        public Builder apply(ProviderRegistrar registrar) {
            registrar.register(this);
            return this;
        }

        public ProviderRegistry build() {
            log.info("Provider registry built with {} agents: {}", providers.size(), providers.keySet());
            return new ProviderRegistry(providers);
        }
    }
}
