package com.agentflow.engine.persistence;

import com.agentflow.core.exception.ExecutionStoreException;
import com.agentflow.core.model.Execution;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;
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
import java.util.stream.Collectors;

/**
 * File-system implementation of ExecutionRepository: one JSON document per
 * execution, named {@code <executionId>.json}.
 *
 * Writes go to a temporary file that is then moved over the target, so a crash
 * mid-write never leaves a truncated record behind.
 */
public class FileExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(FileExecutionRepository.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileExecutionRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ExecutionStoreException("Cannot create state directory " + directory, e);
        }
    }

    @Override
    public synchronized void save(Execution execution) {
        Path target = pathFor(execution.id());
        Path temp = directory.resolve(execution.id() + SUFFIX + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), execution);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ExecutionStoreException("Failed to save execution " + execution.id(), e);
        }
    }

    @Override
    public Optional<Execution> findById(String executionId) {
        Path path = pathFor(executionId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path));
    }

    @Override
    public List<Execution> findAll(ExecutionQuery query) {
        List<Execution> executions = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    executions.add(read(file));
                } catch (ExecutionStoreException e) {
                    log.warn("Skipping unreadable execution file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ExecutionStoreException("Failed to list executions in " + directory, e);
        }
        return executions.stream()
            .filter(query::matches)
            .sorted(Comparator.comparing(Execution::startedAt).reversed())
            .limit(query.limit())
            .collect(Collectors.toList());
    }

    public Path directory() {
        return directory;
    }

    private Execution read(Path path) {
        try {
            return objectMapper.readValue(path.toFile(), Execution.class);
        } catch (IOException e) {
            throw new ExecutionStoreException("Failed to read execution from " + path, e);
        }
    }

    private Path pathFor(String executionId) {
        if (executionId.contains("/") || executionId.contains("\\") || executionId.contains("..")) {
            throw new IllegalArgumentException("Invalid execution id: " + executionId);
        }
        return directory.resolve(executionId + SUFFIX);
    }
}
