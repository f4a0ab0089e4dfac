package com.agentflow.core.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the shared context, stored with the execution record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContextSnapshot(
    String id,
    String executionId,
    Map<String, JsonNode> data,
    List<ContextEntry> history,
    ContextMetadata metadata
) {
    public ContextSnapshot {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        history = history == null ? List.of() : List.copyOf(history);
    }
}
