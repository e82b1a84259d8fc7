package br.edu.ifba.storygraph.storage.impl;

import br.edu.ifba.storygraph.exception.GraphStorageException;
import br.edu.ifba.storygraph.exception.GraphValidationException;
import br.edu.ifba.storygraph.storage.GraphDocumentStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * File-based document store: one {@code <projectId>.json} file per project.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the target,
 * so a crash mid-write leaves the previous document intact.</p>
 */
public class JsonFileGraphDocumentStore implements GraphDocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileGraphDocumentStore.class);
    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final String EXTENSION = ".json";
    private static final Pattern PROJECT_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path directory;
    private volatile boolean initialized = false;

    /**
     * Creates a new store rooted at the given directory.
     *
     * @param directory directory holding one JSON file per project
     */
    public JsonFileGraphDocumentStore(@NotNull String directory) {
        this.directory = Paths.get(directory);
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (initialized) {
                return;
            }
            try {
                Files.createDirectories(directory);
                initialized = true;
                logger.info("Graph document store initialized at: {}", directory.toAbsolutePath());
            } catch (IOException e) {
                logger.error("Failed to initialize graph document store", e);
                throw new GraphStorageException("Cannot create storage directory: " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Optional<ObjectNode>> read(@NotNull String projectId) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = fileFor(projectId);
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            JsonNode node;
            try {
                node = mapper.readTree(file.toFile());
            } catch (JsonProcessingException e) {
                throw new GraphValidationException("$", "Document for project " + projectId + " is not valid JSON", e);
            } catch (IOException e) {
                logger.error("Failed to read graph document {}", file, e);
                throw new GraphStorageException("Failed to read graph document for project: " + projectId, e);
            }
            if (node == null || !node.isObject()) {
                throw new GraphValidationException("$", "Document for project " + projectId + " is not a JSON object");
            }
            return Optional.of((ObjectNode) node);
        });
    }

    @Override
    public CompletableFuture<Void> write(@NotNull String projectId, @NotNull ObjectNode document) {
        return CompletableFuture.runAsync(() -> {
            Path target = fileFor(projectId);
            Path temp = null;
            try {
                Files.createDirectories(directory);
                temp = Files.createTempFile(directory, projectId + "-", ".tmp");
                mapper.writeValue(temp.toFile(), document);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    logger.warn("Atomic move not supported in {}, falling back to replace", directory);
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
                logger.debug("Saved graph document for project {} to {}", projectId, target);
            } catch (IOException e) {
                logger.error("Failed to write graph document {}", target, e);
                deleteQuietly(temp);
                throw new GraphStorageException("Failed to write graph document for project: " + projectId, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(@NotNull String projectId) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                boolean deleted = Files.deleteIfExists(fileFor(projectId));
                if (deleted) {
                    logger.info("Deleted graph document for project {}", projectId);
                }
                return deleted;
            } catch (IOException e) {
                throw new GraphStorageException("Failed to delete graph document for project: " + projectId, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> projectIds() {
        return CompletableFuture.supplyAsync(() -> {
            if (!Files.isDirectory(directory)) {
                return List.of();
            }
            List<String> ids = new ArrayList<>();
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
                for (Path file : files) {
                    String name = file.getFileName().toString();
                    ids.add(name.substring(0, name.length() - EXTENSION.length()));
                }
            } catch (IOException e) {
                throw new GraphStorageException("Failed to list graph documents in: " + directory, e);
            }
            Collections.sort(ids);
            return ids;
        });
    }

    @Override
    public void close() {
        initialized = false;
    }

    Path fileFor(@NotNull String projectId) {
        if (!PROJECT_ID.matcher(projectId).matches() || projectId.contains("..")) {
            throw new IllegalArgumentException("Invalid project id for file storage: " + projectId);
        }
        return directory.resolve(projectId + EXTENSION);
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}", temp, e);
        }
    }
}
