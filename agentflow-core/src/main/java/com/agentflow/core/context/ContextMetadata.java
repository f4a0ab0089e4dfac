package com.agentflow.core.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Bookkeeping of the shared context.
 *
 * @param totalTokens sum of every token delta reported so far, never decreases
 * @param entryCount  number of history entries
 * @param size        character length of the JSON rendering of the data map
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContextMetadata(
    Instant created,
    Instant updated,
    long totalTokens,
    int entryCount,
    long size
) {
}
