package com.agentflow.provider;

/**
 * A pluggable agent that performs the work of a step.
 *
 * Implementations must be thread-safe: the same provider may be invoked for
 * several steps concurrently. Long-running work should poll
 * {@link ProviderRequest#isCancelled()} or respond to thread interruption.
 *
 * Example:
 * <pre>
 * CapabilityProvider summarizer = request -> {
 *     String text = request.task().path("text").asText();
 *     return ProviderResult.of(TextNode.valueOf(summarize(text)), 120);
 * };
 * </pre>
 */
@FunctionalInterface
public interface CapabilityProvider {

    /**
     * Perform one attempt of a step.
     *
     * @param request the step's task payload and a read-only view of the shared context
     * @return the step output and the tokens consumed
     * @throws ProviderException if the attempt fails; retried unless marked permanent
     */
    ProviderResult invoke(ProviderRequest request) throws ProviderException;
}
