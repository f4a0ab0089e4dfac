package com.agentflow.engine.loader;

import com.agentflow.core.exception.WorkflowLoadException;
import com.agentflow.core.model.BackoffStrategy;
import com.agentflow.core.model.Step;
import com.agentflow.core.model.Workflow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WorkflowLoaderTest {

    private static final String YAML = """
        id: site-build
        name: Site build
        description: Design, write and assemble a landing page
        config:
          maxConcurrent: 2
          failFast: true
          tokenBudget: 5000
        steps:
          - id: design
            agent: designer
            task:
              brief: bakery landing page
          - id: layout
            agent: frontend
            dependsOn: [design]
            parallel: true
            timeout: 30000
            retryPolicy:
              maxAttempts: 5
              delay: 200
              backoff: linear
          - id: seo
            agent: seo
            dependsOn: [design]
            optional: true
        """;

    private static final String JSON = """
        {"id": "minimal", "steps": [{"id": "only", "agent": "echo"}], "someFutureField": 1}
        """;

    @TempDir
    Path directory;

    private final WorkflowLoader loader = new WorkflowLoader();

    @Test
    @DisplayName("YAML definitions map onto steps, config and retry policies")
    void parse_yaml_shouldReadAllFields() {
        Workflow workflow = loader.parse(YAML, true);

        assertThat(workflow.id()).isEqualTo("site-build");
        assertThat(workflow.version()).isEqualTo(Workflow.DEFAULT_VERSION);
        assertThat(workflow.config().maxConcurrent()).isEqualTo(2);
        assertThat(workflow.config().failFast()).isTrue();
        assertThat(workflow.config().saveState()).isTrue();
        assertThat(workflow.config().tokenBudget()).isEqualTo(5000L);
        assertThat(workflow.steps()).extracting(Step::id).containsExactly("design", "layout", "seo");

        Step design = workflow.step("design").orElseThrow();
        assertThat(design.task().get("brief").asText()).isEqualTo("bakery landing page");
        assertThat(design.retryPolicy().maxAttempts()).isEqualTo(3);

        Step layout = workflow.step("layout").orElseThrow();
        assertThat(layout.dependsOn()).containsExactly("design");
        assertThat(layout.parallel()).isTrue();
        assertThat(layout.timeout()).isEqualTo(30_000L);
        assertThat(layout.retryPolicy().maxAttempts()).isEqualTo(5);
        assertThat(layout.retryPolicy().backoff()).isEqualTo(BackoffStrategy.LINEAR);

        assertThat(workflow.step("seo").orElseThrow().optional()).isTrue();
    }

    @Test
    @DisplayName("Missing fields take defaults and unknown fields are ignored")
    void parse_json_shouldApplyDefaults() {
        Workflow workflow = loader.parse(JSON, false);

        assertThat(workflow.name()).isNull();
        assertThat(workflow.config().maxConcurrent()).isEqualTo(3);
        Step only = workflow.steps().get(0);
        assertThat(only.name()).isEqualTo("only");
        assertThat(only.dependsOn()).isEmpty();
        assertThat(only.hasTimeout()).isFalse();
    }

    @Test
    @DisplayName("Files are parsed by extension and loaded in name order")
    void loadDirectory_shouldReadJsonAndYaml() throws Exception {
        Files.writeString(directory.resolve("b-site.yaml"), YAML);
        Files.writeString(directory.resolve("a-minimal.json"), JSON);
        Files.writeString(directory.resolve("notes.txt"), "ignored");

        List<Workflow> workflows = loader.loadDirectory(directory);

        assertThat(workflows).extracting(Workflow::id).containsExactly("minimal", "site-build");
    }

    @Test
    @DisplayName("Malformed content raises WorkflowLoadException")
    void load_malformed_shouldThrow() throws Exception {
        Path file = directory.resolve("broken.json");
        Files.writeString(file, "{\"id\": ");

        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(WorkflowLoadException.class)
            .hasMessageContaining("broken.json");
    }
}
