package br.edu.ifba.storygraph.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Durable storage of graph documents, one document per project.
 *
 * <p>Implementations only move documents around. Validation and decoding belong to
 * {@link GraphDocumentCodec}.</p>
 *
 * Implementations: JsonFileGraphDocumentStore, InMemoryGraphDocumentStore
 */
public interface GraphDocumentStore extends AutoCloseable {

    /**
     * Prepares the backend (directories, connections).
     * Must be called before any other operation.
     */
    CompletableFuture<Void> initialize();

    /**
     * Reads the stored document of a project.
     *
     * @param projectId the project id
     * @return the document, or empty when the project has never been saved
     */
    CompletableFuture<Optional<ObjectNode>> read(@NotNull String projectId);

    /**
     * Replaces the stored document of a project. Readers never observe a partial write.
     *
     * @param projectId the project id
     * @param document the complete document
     */
    CompletableFuture<Void> write(@NotNull String projectId, @NotNull ObjectNode document);

    /**
     * Deletes the stored document of a project.
     *
     * @param projectId the project id
     * @return true if a document existed
     */
    CompletableFuture<Boolean> delete(@NotNull String projectId);

    /**
     * Lists the ids of all projects with a stored document.
     */
    CompletableFuture<List<String>> projectIds();
}
