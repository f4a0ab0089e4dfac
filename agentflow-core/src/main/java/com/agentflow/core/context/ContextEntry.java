package com.agentflow.core.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * One history line of the shared context, appended per completed attempt.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContextEntry(
    String stepId,
    String agent,
    int attempt,
    Instant timestamp,
    String summary,
    long tokensUsed
) {
}
