package com.agentflow.engine.persistence;

import com.agentflow.core.exception.ExecutionStoreException;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.repository.WorkflowRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * File-system implementation of WorkflowRepository: one JSON definition per
 * workflow, named {@code <workflowId>.json}. Same replace-by-move scheme as
 * {@link FileExecutionRepository}, so executions stored next to it can be
 * resumed after a restart.
 */
public class FileWorkflowRepository implements WorkflowRepository {

    private static final Logger log = LoggerFactory.getLogger(FileWorkflowRepository.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileWorkflowRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ExecutionStoreException("Cannot create definition directory " + directory, e);
        }
    }

    @Override
    public synchronized void save(Workflow workflow) {
        Path target = pathFor(workflow.id());
        Path temp = directory.resolve(workflow.id() + SUFFIX + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), workflow);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ExecutionStoreException("Failed to save workflow " + workflow.id(), e);
        }
        log.debug("Stored definition of workflow {} v{}", workflow.id(), workflow.version());
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        Path path = pathFor(workflowId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path));
    }

    @Override
    public List<Workflow> findAll() {
        List<Workflow> workflows = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    workflows.add(read(file));
                } catch (ExecutionStoreException e) {
                    log.warn("Skipping unreadable workflow file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ExecutionStoreException("Failed to list workflows in " + directory, e);
        }
        workflows.sort(Comparator.comparing(Workflow::id));
        return workflows;
    }

    private Workflow read(Path path) {
        try {
            return objectMapper.readValue(path.toFile(), Workflow.class);
        } catch (IOException e) {
            throw new ExecutionStoreException("Failed to read workflow from " + path, e);
        }
    }

    private Path pathFor(String workflowId) {
        if (workflowId == null || workflowId.isBlank()
                || workflowId.contains("/") || workflowId.contains("\\") || workflowId.contains("..")) {
            throw new IllegalArgumentException("Invalid workflow id: " + workflowId);
        }
        return directory.resolve(workflowId + SUFFIX);
    }
}
