package com.agentflow.engine.context;

import com.agentflow.core.context.ContextAppender;
import com.agentflow.core.context.ContextEntry;
import com.agentflow.core.context.ContextMetadata;
import com.agentflow.core.context.ContextSnapshot;
import com.agentflow.core.context.ContextView;
import com.agentflow.engine.json.ObjectMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Shared state of one execution: a data map, an append-only history and a token counter.
 *
 * The coordinator owns the instance and is the only caller of the mutating methods
 * ({@link #putData}, {@link #restore}, {@link #bindExecution}). Providers receive it as a
 * {@link ContextView}; step attempts reach it only through a {@link ContextAppender}.
 * All methods are synchronized so views can be read from worker threads. Values are
 * copied on the way in and on the way out, so no caller ever holds a node stored here.
 */
public class WorkflowContext implements ContextView, ContextAppender {

    private static final ObjectMapper MAPPER = ObjectMappers.json();

    private final String id;
    private String executionId;
    private final Map<String, JsonNode> data = new LinkedHashMap<>();
    private final List<ContextEntry> history = new ArrayList<>();
    private final Instant created;
    private Instant updated;
    private long totalTokens;

    public WorkflowContext() {
        this(Map.of());
    }

    public WorkflowContext(Map<String, JsonNode> initialData) {
        this.id = "ctx-" + UUID.randomUUID();
        this.created = Instant.now();
        this.updated = created;
        if (initialData != null) {
            initialData.forEach((k, v) -> data.put(k, copyOf(v)));
        }
    }

    private WorkflowContext(ContextSnapshot snapshot) {
        this.id = snapshot.id();
        this.executionId = snapshot.executionId();
        ContextMetadata metadata = snapshot.metadata();
        this.created = metadata != null && metadata.created() != null ? metadata.created() : Instant.now();
        this.updated = metadata != null && metadata.updated() != null ? metadata.updated() : created;
        this.totalTokens = metadata != null ? metadata.totalTokens() : 0;
        snapshot.data().forEach((k, v) -> data.put(k, copyOf(v)));
        this.history.addAll(snapshot.history());
    }

    /**
     * Rebuild a context from a checkpoint.
     */
    public static WorkflowContext restore(ContextSnapshot snapshot) {
        return new WorkflowContext(snapshot);
    }

    /**
     * Attach the context to its execution. A context belongs to exactly one execution.
     *
     * @throws IllegalStateException if already bound to a different execution
     */
    public synchronized void bindExecution(String newExecutionId) {
        if (executionId != null && !executionId.equals(newExecutionId)) {
            throw new IllegalStateException(String.format(
                "Context %s already belongs to execution %s", id, executionId));
        }
        this.executionId = newExecutionId;
    }

    /**
     * Store a value under a key, replacing any previous value.
     */
    public synchronized void putData(String key, JsonNode value) {
        data.put(key, copyOf(value));
        touch();
    }

    @Override
    public synchronized void appendHistory(ContextEntry entry) {
        history.add(entry);
        touch();
    }

    @Override
    public synchronized void addTokens(long tokens) {
        if (tokens < 0) {
            throw new IllegalArgumentException("Token delta must not be negative: " + tokens);
        }
        totalTokens += tokens;
        touch();
    }

    /**
     * Copy the current state into an immutable checkpoint.
     */
    public synchronized ContextSnapshot snapshot() {
        return new ContextSnapshot(id, executionId, copyOf(data), history, metadata());
    }

    // ========== ContextView ==========

    @Override
    public String contextId() {
        return id;
    }

    @Override
    public synchronized String executionId() {
        return executionId;
    }

    @Override
    public synchronized Optional<JsonNode> get(String key) {
        return Optional.ofNullable(data.get(key)).map(JsonNode::deepCopy);
    }

    @Override
    public synchronized Map<String, JsonNode> data() {
        return Collections.unmodifiableMap(copyOf(data));
    }

    @Override
    public synchronized List<ContextEntry> history() {
        return List.copyOf(history);
    }

    @Override
    public synchronized ContextMetadata metadata() {
        return new ContextMetadata(created, updated, totalTokens, history.size(), dataSize());
    }

    public synchronized long totalTokens() {
        return totalTokens;
    }

    // ========== Internal Methods ==========

    private static JsonNode copyOf(JsonNode value) {
        return value != null ? value.deepCopy() : NullNode.getInstance();
    }

    private static Map<String, JsonNode> copyOf(Map<String, JsonNode> source) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, copyOf(v)));
        return copy;
    }

    private void touch() {
        updated = Instant.now();
    }

    private long dataSize() {
        try {
            return MAPPER.writeValueAsString(data).length();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Context data is not serializable", e);
        }
    }
}
