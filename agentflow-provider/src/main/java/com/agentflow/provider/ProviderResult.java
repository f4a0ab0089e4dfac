package com.agentflow.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Output of a successful provider attempt.
 *
 * @param output     stored in the shared context under the step id
 * @param tokensUsed resource usage to add to the context's token counter
 * @param summary    one line recorded in the context history, optional
 */
public record ProviderResult(
    JsonNode output,
    long tokensUsed,
    String summary
) {
    public ProviderResult {
        if (tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed must not be negative: " + tokensUsed);
        }
    }

    public static ProviderResult of(JsonNode output) {
        return new ProviderResult(output, 0, null);
    }

    public static ProviderResult of(JsonNode output, long tokensUsed) {
        return new ProviderResult(output, tokensUsed, null);
    }
}
