package com.agentflow.provider;

/**
 * Contributes providers to a registry under construction.
 * Applications expose these as beans; the engine configuration applies all of them.
 */
@FunctionalInterface
public interface ProviderRegistrar {

    void register(ProviderRegistry.Builder registry);
}
