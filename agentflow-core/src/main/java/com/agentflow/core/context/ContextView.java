package com.agentflow.core.context;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the shared context handed to capability providers.
 * Every collection returned is a copy.
 */
public interface ContextView {

    String contextId();

    String executionId();

    Optional<JsonNode> get(String key);

    Map<String, JsonNode> data();

    List<ContextEntry> history();

    ContextMetadata metadata();
}
