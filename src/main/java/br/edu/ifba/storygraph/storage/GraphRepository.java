package br.edu.ifba.storygraph.storage;

import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.exception.GraphStorageException;
import br.edu.ifba.storygraph.exception.GraphValidationException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the one {@link KnowledgeGraph} instance per project.
 *
 * <p>Graphs are decoded lazily from the {@link GraphDocumentStore} and cached. A project with no
 * stored document gets a fresh empty graph, which is only written on the first {@link #save}.
 * Callers must hold the project's lock from {@code ProjectLockManager} around any
 * load-mutate-save cycle.</p>
 */
@ApplicationScoped
public class GraphRepository {

    private static final Logger logger = LoggerFactory.getLogger(GraphRepository.class);

    private GraphDocumentStore store;
    private GraphDocumentCodec codec;
    private final ConcurrentHashMap<String, KnowledgeGraph> cache = new ConcurrentHashMap<>();

    protected GraphRepository() {
        // CDI proxy
    }

    @Inject
    public GraphRepository(GraphDocumentStore store) {
        this(store, new GraphDocumentCodec());
    }

    public GraphRepository(@NotNull GraphDocumentStore store, @NotNull GraphDocumentCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    /**
     * Returns the project's graph, loading it from storage or creating an empty one.
     *
     * @throws GraphValidationException if the stored document is corrupt
     * @throws GraphStorageException if the document cannot be read
     */
    @NotNull
    public KnowledgeGraph load(@NotNull String projectId) {
        KnowledgeGraph cached = cache.get(projectId);
        if (cached != null) {
            return cached;
        }
        KnowledgeGraph graph = read(projectId).orElseGet(() -> {
            logger.info("No stored graph for project {}, starting an empty one", projectId);
            return new KnowledgeGraph(projectId);
        });
        KnowledgeGraph raced = cache.putIfAbsent(projectId, graph);
        return raced != null ? raced : graph;
    }

    /**
     * Returns the project's graph only if one is cached or stored.
     */
    @NotNull
    public Optional<KnowledgeGraph> find(@NotNull String projectId) {
        KnowledgeGraph cached = cache.get(projectId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<KnowledgeGraph> stored = read(projectId);
        stored.ifPresent(graph -> cache.putIfAbsent(projectId, graph));
        return stored.map(graph -> cache.get(projectId));
    }

    /**
     * Writes the graph's document. On failure the cached instance is dropped so the next load
     * starts again from the last durable state.
     */
    public void save(@NotNull KnowledgeGraph graph) {
        String projectId = graph.getProjectId();
        ObjectNode document = codec.save(graph);
        try {
            join(store.write(projectId, document), "write", projectId);
            cache.put(projectId, graph);
        } catch (RuntimeException e) {
            cache.remove(projectId);
            logger.error("Failed to persist graph for project {}, evicted cached copy", projectId, e);
            throw e;
        }
    }

    /**
     * Current document of the project, as it would be persisted.
     */
    @NotNull
    public ObjectNode document(@NotNull String projectId) {
        return codec.save(load(projectId));
    }

    public boolean delete(@NotNull String projectId) {
        cache.remove(projectId);
        return join(store.delete(projectId), "delete", projectId);
    }

    public void evict(@NotNull String projectId) {
        cache.remove(projectId);
    }

    @NotNull
    public List<String> projectIds() {
        return join(store.projectIds(), "list", "*");
    }

    @NotNull
    public GraphDocumentCodec codec() {
        return codec;
    }

    private Optional<KnowledgeGraph> read(String projectId) {
        Optional<ObjectNode> document = join(store.read(projectId), "read", projectId);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        KnowledgeGraph graph = codec.load(document.get());
        if (!graph.getProjectId().equals(projectId)) {
            throw new GraphValidationException("metadata.project_id",
                "document stored for project " + projectId + " belongs to " + graph.getProjectId());
        }
        return Optional.of(graph);
    }

    private static <T> T join(CompletableFuture<T> future, String operation, String projectId) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new GraphStorageException("Storage " + operation + " failed for project: " + projectId, cause);
        }
    }
}
