package com.agentflow.engine.context;

import com.agentflow.core.context.ContextEntry;
import com.agentflow.core.context.ContextSnapshot;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WorkflowContextTest {

    @Test
    void addTokens_shouldAccumulateAndRejectNegativeDeltas() {
        WorkflowContext context = new WorkflowContext();

        context.addTokens(5);
        context.addTokens(0);
        context.addTokens(7);

        assertThat(context.metadata().totalTokens()).isEqualTo(12);
        assertThatThrownBy(() -> context.addTokens(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(context.totalTokens()).isEqualTo(12);
    }

    @Test
    void appendHistory_shouldCountEntries() {
        WorkflowContext context = new WorkflowContext();

        context.appendHistory(new ContextEntry("a", "echo", 1, Instant.now(), "done", 3));
        context.appendHistory(new ContextEntry("b", "echo", 1, Instant.now(), "done", 4));

        assertThat(context.history()).extracting(ContextEntry::stepId).containsExactly("a", "b");
        assertThat(context.metadata().entryCount()).isEqualTo(2);
    }

    @Test
    void views_shouldBeCopies() {
        WorkflowContext context = new WorkflowContext(Map.of("topic", TextNode.valueOf("birds")));

        Map<String, ?> data = context.data();
        context.putData("extra", IntNode.valueOf(1));

        assertThat(data).containsOnlyKeys("topic");
        assertThatThrownBy(() -> context.history().add(null))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void storedValues_shouldNotBeReachableByCallers() {
        ObjectNode output = JsonNodeFactory.instance.objectNode().put("color", "blue");
        WorkflowContext context = new WorkflowContext();
        context.putData("A", output);

        output.put("color", "changed by writer");
        ((ObjectNode) context.get("A").orElseThrow()).put("color", "changed by get");
        ((ObjectNode) context.data().get("A")).put("color", "changed by data");
        ((ObjectNode) context.snapshot().data().get("A")).put("color", "changed by snapshot");

        assertThat(context.get("A").orElseThrow().get("color").asText()).isEqualTo("blue");
        assertThat(context.snapshot().data().get("A").get("color").asText()).isEqualTo("blue");
    }

    @Test
    void size_shouldBeJsonLengthOfData() {
        WorkflowContext context = new WorkflowContext();
        context.putData("k", TextNode.valueOf("v"));

        // {"k":"v"}
        assertThat(context.metadata().size()).isEqualTo(9);
    }

    @Test
    void snapshotAndRestore_shouldPreserveEverything() {
        WorkflowContext context = new WorkflowContext(Map.of("input", TextNode.valueOf("x")));
        context.bindExecution("exec-1");
        context.putData("a", TextNode.valueOf("a-out"));
        context.appendHistory(new ContextEntry("a", "echo", 1, Instant.now(), "done", 3));
        context.addTokens(3);

        ContextSnapshot snapshot = context.snapshot();
        WorkflowContext restored = WorkflowContext.restore(snapshot);

        assertThat(restored.snapshot()).isEqualTo(snapshot);
        assertThat(restored.contextId()).isEqualTo(context.contextId());
        assertThat(restored.get("a")).contains(TextNode.valueOf("a-out"));
    }

    @Test
    void bindExecution_shouldOnlyBindOnce() {
        WorkflowContext context = new WorkflowContext();
        context.bindExecution("exec-1");
        context.bindExecution("exec-1");

        assertThat(context.executionId()).isEqualTo("exec-1");
        assertThatThrownBy(() -> context.bindExecution("exec-2"))
            .isInstanceOf(IllegalStateException.class);
    }
}
