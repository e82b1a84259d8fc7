package br.edu.ifba.storygraph.service;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.EntityQuery;
import br.edu.ifba.storygraph.core.GraphAnalytics;
import br.edu.ifba.storygraph.core.GraphMetadata;
import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.core.RankedEntity;
import br.edu.ifba.storygraph.core.RelationType;
import br.edu.ifba.storygraph.core.Relationship;
import br.edu.ifba.storygraph.core.TraversalDirection;
import br.edu.ifba.storygraph.exception.EntityNotFoundException;
import br.edu.ifba.storygraph.export.ExportConfig;
import br.edu.ifba.storygraph.export.GraphExporterFactory;
import br.edu.ifba.storygraph.extraction.ExtractionStrategy;
import br.edu.ifba.storygraph.job.BatchExtractionRequest;
import br.edu.ifba.storygraph.job.BatchExtractionResponse;
import br.edu.ifba.storygraph.job.ExtractionJob;
import br.edu.ifba.storygraph.job.ExtractionJobService;
import br.edu.ifba.storygraph.notify.GraphChangeNotifier;
import br.edu.ifba.storygraph.notify.GraphEventListener;
import br.edu.ifba.storygraph.notify.GraphEventType;
import br.edu.ifba.storygraph.notify.Subscription;
import br.edu.ifba.storygraph.storage.GraphRepository;
import br.edu.ifba.storygraph.utils.ProjectLockManager;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Entry point for the route layer: graph CRUD, queries, analytics, export and extraction.
 *
 * <p>Every operation runs under the project's lock. Mutations load the graph, apply the change,
 * persist, and only then publish the change event; if persisting fails the cached graph is
 * dropped by the repository and the exception propagates.</p>
 */
@ApplicationScoped
public class StoryGraphService {

    private static final Logger LOG = Logger.getLogger(StoryGraphService.class);

    @Inject
    GraphRepository repository;

    @Inject
    ProjectLockManager locks;

    @Inject
    GraphChangeNotifier notifier;

    @Inject
    GraphExporterFactory exporters;

    @Inject
    ExtractionJobService jobService;

    protected StoryGraphService() {
        // CDI
    }

    public StoryGraphService(@NotNull GraphRepository repository, @NotNull ProjectLockManager locks,
                             @NotNull GraphChangeNotifier notifier, @NotNull GraphExporterFactory exporters,
                             @NotNull ExtractionJobService jobService) {
        this.repository = repository;
        this.locks = locks;
        this.notifier = notifier;
        this.exporters = exporters;
        this.jobService = jobService;
    }

    // ===== entities =====

    /**
     * Adds an entity, merging it into an existing one with the same id.
     *
     * @return the stored entity after the merge
     */
    @NotNull
    public Entity addEntity(@NotNull String projectId, @NotNull Entity entity) {
        boolean[] created = new boolean[1];
        Entity stored = mutate(projectId, graph -> {
            created[0] = graph.addEntity(entity);
            return graph.requireEntity(entity.getId());
        });
        publish(created[0] ? GraphEventType.ENTITY_ADDED : GraphEventType.ENTITY_UPDATED, projectId,
            entityPayload(stored));
        return stored;
    }

    @NotNull
    public Optional<Entity> getEntity(@NotNull String projectId, @NotNull String entityId) {
        return read(projectId, graph -> graph.getEntity(entityId));
    }

    @NotNull
    public Optional<Entity> findByName(@NotNull String projectId, @NotNull String name, boolean fuzzy) {
        return read(projectId, graph -> graph.findByName(name, fuzzy));
    }

    @NotNull
    public List<Entity> queryEntities(@NotNull String projectId, @NotNull EntityQuery query) {
        return read(projectId, graph -> graph.queryEntities(query));
    }

    /**
     * Edits named fields of an entity; unknown field names are stored as attributes.
     *
     * @throws EntityNotFoundException if the id is unknown
     */
    @NotNull
    public Entity updateEntity(@NotNull String projectId, @NotNull String entityId,
                               @NotNull Map<String, Object> fields) {
        Entity updated = mutate(projectId, graph -> graph.updateEntity(entityId, fields));
        Map<String, Object> payload = entityPayload(updated);
        payload.put("fields", List.copyOf(fields.keySet()));
        publish(GraphEventType.ENTITY_UPDATED, projectId, payload);
        return updated;
    }

    /**
     * Deletes an entity and every relationship touching it.
     *
     * @return the relationships removed with it
     * @throws EntityNotFoundException if the id is unknown
     */
    @NotNull
    public List<Relationship> deleteEntity(@NotNull String projectId, @NotNull String entityId) {
        List<Relationship> cascaded = mutate(projectId, graph -> graph.deleteEntity(entityId));
        LOG.infof("Deleted entity %s from project %s with %d relationships", entityId, projectId, cascaded.size());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("entity_id", entityId);
        payload.put("relationships_removed", cascaded.size());
        publish(GraphEventType.ENTITY_DELETED, projectId, payload);
        for (Relationship relationship : cascaded) {
            publish(GraphEventType.RELATIONSHIP_DELETED, projectId, relationshipPayload(relationship));
        }
        return cascaded;
    }

    // ===== relationships =====

    /**
     * @throws EntityNotFoundException if either endpoint is absent; the graph is not changed
     */
    @NotNull
    public Relationship addRelationship(@NotNull String projectId, @NotNull Relationship relationship) {
        boolean[] created = new boolean[1];
        Relationship stored = mutate(projectId, graph -> {
            created[0] = graph.addRelationship(relationship);
            return graph.getRelationship(relationship.getSourceId(), relationship.getTargetId(),
                relationship.getRelationType()).orElseThrow();
        });
        publish(created[0] ? GraphEventType.RELATIONSHIP_ADDED : GraphEventType.RELATIONSHIP_UPDATED, projectId,
            relationshipPayload(stored));
        return stored;
    }

    @NotNull
    public List<Relationship> getRelationships(@NotNull String projectId, @Nullable String sourceId,
                                               @Nullable String targetId, @Nullable RelationType relationType) {
        return read(projectId, graph -> graph.getRelationships(sourceId, targetId, relationType));
    }

    public boolean deleteRelationship(@NotNull String projectId, @NotNull String sourceId,
                                      @NotNull String targetId, @NotNull RelationType relationType) {
        boolean deleted = locks.withLock(projectId, () -> {
            KnowledgeGraph graph = repository.load(projectId);
            if (!graph.deleteRelationship(sourceId, targetId, relationType)) {
                return false;
            }
            repository.save(graph);
            return true;
        });
        if (deleted) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("source", sourceId);
            payload.put("target", targetId);
            payload.put("relation", relationType.getValue());
            publish(GraphEventType.RELATIONSHIP_DELETED, projectId, payload);
        }
        return deleted;
    }

    // ===== traversal and analytics =====

    @NotNull
    public List<Entity> connectedEntities(@NotNull String projectId, @NotNull String entityId, int maxDepth,
                                          @Nullable Set<RelationType> relationTypes,
                                          @NotNull TraversalDirection direction) {
        return read(projectId, graph -> graph.connectedEntities(entityId, maxDepth, relationTypes, direction));
    }

    @NotNull
    public Optional<List<String>> findPath(@NotNull String projectId, @NotNull String sourceId,
                                           @NotNull String targetId, @NotNull TraversalDirection direction) {
        return read(projectId, graph -> graph.findPath(sourceId, targetId, direction));
    }

    @NotNull
    public List<RankedEntity> centralEntities(@NotNull String projectId, int topN) {
        return read(projectId, graph -> graph.centralEntities(topN));
    }

    @NotNull
    public List<Set<String>> detectCommunities(@NotNull String projectId) {
        return read(projectId, KnowledgeGraph::detectCommunities);
    }

    @NotNull
    public GraphAnalytics.EntityStats entityStats(@NotNull String projectId, @NotNull String entityId) {
        return read(projectId, graph -> graph.entityStats(entityId));
    }

    @NotNull
    public GraphAnalytics.GraphStats stats(@NotNull String projectId) {
        return read(projectId, KnowledgeGraph::stats);
    }

    @NotNull
    public GraphMetadata metadata(@NotNull String projectId) {
        return read(projectId, KnowledgeGraph::metadata);
    }

    // ===== export =====

    /**
     * Writes the project graph in the configured format. The stream is left open.
     */
    public void export(@NotNull String projectId, @NotNull ExportConfig config, @NotNull OutputStream out)
            throws IOException {
        try {
            locks.withLock(projectId, () -> {
                try {
                    exporters.getExporter(config.format()).export(repository.load(projectId), config, out);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        LOG.debugf("Exported project %s as %s", projectId, config.format().getValue());
    }

    /**
     * The raw persisted document of a project.
     */
    @NotNull
    public ObjectNode document(@NotNull String projectId) {
        return read(projectId, graph -> repository.codec().save(graph));
    }

    // ===== extraction =====

    @NotNull
    public ExtractionJob extractScene(@NotNull String projectId, @NotNull String sceneId,
                                      @NotNull ExtractionStrategy strategy) {
        return jobService.submit(projectId, sceneId, strategy);
    }

    @NotNull
    public BatchExtractionResponse extractProject(@NotNull BatchExtractionRequest request) {
        return jobService.submitBatch(request);
    }

    @NotNull
    public Optional<ExtractionJob> getJob(@NotNull String jobId) {
        return jobService.getJob(jobId);
    }

    // ===== lifecycle and subscriptions =====

    /**
     * Deletes the project's graph document. Running jobs of the project are cancelled first.
     */
    public boolean deleteGraph(@NotNull String projectId) {
        jobService.listJobs(projectId).stream()
            .filter(job -> !job.getStatus().isTerminal())
            .forEach(job -> jobService.cancel(job.getId()));

        boolean deleted = locks.withLock(projectId, () -> repository.delete(projectId));
        locks.forget(projectId);
        jobService.purgeFinished(projectId);
        if (deleted) {
            LOG.infof("Deleted knowledge graph of project %s", projectId);
            publish(GraphEventType.GRAPH_DELETED, projectId, Map.of("project_id", projectId));
        }
        return deleted;
    }

    @NotNull
    public Subscription subscribe(@NotNull String projectId, @NotNull GraphEventListener listener) {
        return notifier.subscribe(projectId, listener);
    }

    // ===== internals =====

    private <T> T read(String projectId, Function<KnowledgeGraph, T> query) {
        return locks.withLock(projectId, () -> query.apply(repository.load(projectId)));
    }

    private <T> T mutate(String projectId, Function<KnowledgeGraph, T> change) {
        return locks.withLock(projectId, () -> {
            KnowledgeGraph graph = repository.load(projectId);
            T result = change.apply(graph);
            repository.save(graph);
            return result;
        });
    }

    private void publish(GraphEventType type, String projectId, Map<String, Object> payload) {
        notifier.publish(type, projectId, payload);
    }

    private static Map<String, Object> entityPayload(Entity entity) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("entity_id", entity.getId());
        payload.put("name", entity.getName());
        payload.put("type", entity.getType().getValue());
        return payload;
    }

    private static Map<String, Object> relationshipPayload(Relationship relationship) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", relationship.getSourceId());
        payload.put("target", relationship.getTargetId());
        payload.put("relation", relationship.getRelationType().getValue());
        return payload;
    }
}
