package br.edu.ifba.storygraph.storage.impl;

import br.edu.ifba.storygraph.storage.GraphDocumentStore;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local document store for development and tests.
 * Documents are deep-copied on the way in and out.
 */
public class InMemoryGraphDocumentStore implements GraphDocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphDocumentStore.class);

    private final ConcurrentHashMap<String, ObjectNode> documents = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> initialize() {
        logger.info("In-memory graph document store initialized");
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Optional<ObjectNode>> read(@NotNull String projectId) {
        ObjectNode stored = documents.get(projectId);
        return CompletableFuture.completedFuture(Optional.ofNullable(stored).map(ObjectNode::deepCopy));
    }

    @Override
    public CompletableFuture<Void> write(@NotNull String projectId, @NotNull ObjectNode document) {
        documents.put(projectId, document.deepCopy());
        logger.debug("Stored graph document for project {}", projectId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Boolean> delete(@NotNull String projectId) {
        return CompletableFuture.completedFuture(documents.remove(projectId) != null);
    }

    @Override
    public CompletableFuture<List<String>> projectIds() {
        List<String> ids = new ArrayList<>(documents.keySet());
        Collections.sort(ids);
        return CompletableFuture.completedFuture(ids);
    }

    @Override
    public void close() {
        documents.clear();
    }
}
