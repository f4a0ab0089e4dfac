package com.agentflow.engine.loader;

import com.agentflow.core.exception.WorkflowLoadException;
import com.agentflow.core.model.Workflow;
import com.agentflow.engine.json.ObjectMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads workflow definitions from JSON or YAML files, chosen by file extension.
 * Parsing only; validation happens when the workflow is registered with the engine.
 */
public class WorkflowLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public WorkflowLoader() {
        this(ObjectMappers.json(), ObjectMappers.yaml());
    }

    public WorkflowLoader(ObjectMapper jsonMapper, ObjectMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    /**
     * Parse one definition file.
     *
     * @throws WorkflowLoadException if the file cannot be read or parsed
     */
    public Workflow load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            Workflow workflow = mapperFor(file.getFileName().toString()).readValue(in, Workflow.class);
            log.debug("Loaded workflow {} from {}", workflow.id(), file);
            return workflow;
        } catch (IOException e) {
            throw new WorkflowLoadException("Failed to load workflow from " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a definition from a string.
     *
     * @param yaml true for YAML, false for JSON
     */
    public Workflow parse(String content, boolean yaml) {
        try {
            return (yaml ? yamlMapper : jsonMapper).readValue(content, Workflow.class);
        } catch (IOException e) {
            throw new WorkflowLoadException("Failed to parse workflow definition: " + e.getMessage(), e);
        }
    }

    /**
     * Parse every .json, .yaml and .yml file directly inside a directory, in file name order.
     */
    public List<Workflow> loadDirectory(Path directory) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.{json,yaml,yml}")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new WorkflowLoadException("Failed to list workflow directory " + directory, e);
        }
        files.sort(null);

        List<Workflow> workflows = new ArrayList<>();
        for (Path file : files) {
            workflows.add(load(file));
        }
        log.info("Loaded {} workflow definition(s) from {}", workflows.size(), directory);
        return workflows;
    }

    private ObjectMapper mapperFor(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml") ? yamlMapper : jsonMapper;
    }
}
