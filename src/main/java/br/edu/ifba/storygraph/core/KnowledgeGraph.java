package br.edu.ifba.storygraph.core;

import br.edu.ifba.storygraph.exception.EntityNotFoundException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory story graph of one project, a directed multigraph in the spirit of NetworkX.
 *
 * <p>Entities are nodes keyed by id; relationships are edges keyed by
 * (source, target, relation type), so the same ordered pair can carry several relation types.
 * Adjacency lists keep outgoing and incoming edge keys per node, and a secondary index maps
 * lowercase names and aliases to entity ids.</p>
 *
 * <p>Not thread-safe. Callers serialize access per project (see
 * {@code ProjectLockManager}). Each mutation updates the metadata within the same call.</p>
 */
public class KnowledgeGraph {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraph.class);

    private final String projectId;

    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final Map<Relationship.Key, Relationship> relationships = new LinkedHashMap<>();

    // entityId -> keys of edges leaving / entering the node
    private final Map<String, Set<Relationship.Key>> outgoing = new HashMap<>();
    private final Map<String, Set<Relationship.Key>> incoming = new HashMap<>();

    // lowercase name or alias -> entityId
    private final Map<String, String> nameIndex = new HashMap<>();

    private Instant createdAt;
    private Instant lastUpdated;
    private String lastExtractedScene;
    private int totalExtractions;
    private int successfulExtractions;
    private int failedExtractions;

    public KnowledgeGraph(@NotNull String projectId) {
        this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
        this.createdAt = Instant.now();
        this.lastUpdated = createdAt;
    }

    @NotNull
    public String getProjectId() {
        return projectId;
    }

    // ===== Entity operations =====

    /**
     * Adds an entity, or merges it into the existing entity with the same id.
     *
     * @return true if the entity was new, false if it was merged
     * @see Entity#mergeWith(Entity, Instant)
     */
    public boolean addEntity(@NotNull Entity entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        Instant now = Instant.now();
        Entity existing = entities.get(entity.getId());

        if (existing == null) {
            entities.put(entity.getId(), entity);
            outgoing.computeIfAbsent(entity.getId(), k -> new LinkedHashSet<>());
            incoming.computeIfAbsent(entity.getId(), k -> new LinkedHashSet<>());
            index(entity);
            touch(now);
            logger.debug("Added entity {} ({}) to project {}", entity.getName(), entity.getType().getValue(), projectId);
            return true;
        }

        Entity merged = existing.mergeWith(entity, now);
        entities.put(merged.getId(), merged);
        index(merged);
        touch(now);
        logger.debug("Merged entity {} in project {} (mentions {} -> {})",
            merged.getName(), projectId, existing.getMentionCount(), merged.getMentionCount());
        return false;
    }

    @NotNull
    public Optional<Entity> getEntity(@NotNull String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    @NotNull
    public Entity requireEntity(@NotNull String entityId) {
        Entity entity = entities.get(entityId);
        if (entity == null) {
            throw new EntityNotFoundException(entityId);
        }
        return entity;
    }

    public boolean containsEntity(@NotNull String entityId) {
        return entities.containsKey(entityId);
    }

    /**
     * Finds an entity by name or alias, ignoring case.
     *
     * @param name the name to look up
     * @param fuzzy when no exact match exists, fall back to substring containment
     */
    @NotNull
    public Optional<Entity> findByName(@NotNull String name, boolean fuzzy) {
        String needle = name.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return Optional.empty();
        }

        String id = nameIndex.get(needle);
        if (id != null && entities.containsKey(id)) {
            return Optional.of(entities.get(id));
        }

        if (fuzzy) {
            for (Entity entity : entities.values()) {
                if (entity.getName().toLowerCase(Locale.ROOT).contains(needle)) {
                    return Optional.of(entity);
                }
            }
            for (Entity entity : entities.values()) {
                for (String alias : entity.getAliases()) {
                    if (alias.toLowerCase(Locale.ROOT).contains(needle)) {
                        return Optional.of(entity);
                    }
                }
            }
        }
        return Optional.empty();
    }

    @NotNull
    public List<Entity> queryEntities(@NotNull EntityQuery query) {
        List<Entity> results = new ArrayList<>();
        for (Entity entity : entities.values()) {
            if (query.matches(entity)) {
                results.add(entity);
            }
        }
        return results;
    }

    /**
     * Applies field edits to an entity.
     *
     * <p>Recognized keys: {@code name}, {@code description}, {@code type}, {@code aliases},
     * {@code confidence}, {@code verified}, {@code first_appearance} and {@code attributes}
     * (a map merged per key). Any other key is stored as an attribute. The id never changes.</p>
     *
     * @return the updated entity
     * @throws EntityNotFoundException if the id is unknown
     * @throws IllegalArgumentException if a recognized field has a value of the wrong kind
     */
    @NotNull
    public Entity updateEntity(@NotNull String entityId, @NotNull Map<String, Object> fields) {
        Entity existing = requireEntity(entityId);
        Entity.Builder builder = existing.toBuilder();
        Map<String, Object> attributes = new LinkedHashMap<>(existing.getAttributes());

        for (Map.Entry<String, Object> field : fields.entrySet()) {
            Object value = field.getValue();
            switch (field.getKey()) {
                case "name" -> builder.name(requireString(field.getKey(), value));
                case "description" -> builder.description(value != null ? value.toString() : "");
                case "type" -> builder.type(value instanceof EntityType t
                    ? t
                    : EntityType.fromValue(requireString(field.getKey(), value)));
                case "aliases" -> builder.aliases(toStringList(field.getKey(), value));
                case "confidence" -> builder.confidence(requireNumber(field.getKey(), value).doubleValue());
                case "verified" -> builder.verified(requireBoolean(field.getKey(), value));
                case "first_appearance" -> builder.firstAppearance(value != null ? value.toString() : null);
                case "attributes" -> {
                    if (!(value instanceof Map<?, ?> map)) {
                        throw new IllegalArgumentException("attributes must be a map");
                    }
                    map.forEach((k, v) -> attributes.put(String.valueOf(k), v));
                }
                default -> attributes.put(field.getKey(), value);
            }
        }

        Instant now = Instant.now();
        Entity updated = builder.attributes(attributes).updatedAt(now).build();
        unindex(existing);
        entities.put(entityId, updated);
        index(updated);
        touch(now);
        logger.debug("Updated entity {} in project {}: {}", entityId, projectId, fields.keySet());
        return updated;
    }

    /**
     * Deletes an entity and every relationship that references it.
     *
     * @return the relationships removed by the cascade
     * @throws EntityNotFoundException if the id is unknown
     */
    @NotNull
    public List<Relationship> deleteEntity(@NotNull String entityId) {
        Entity existing = requireEntity(entityId);

        Set<Relationship.Key> touching = new LinkedHashSet<>(outgoing.getOrDefault(entityId, Set.of()));
        touching.addAll(incoming.getOrDefault(entityId, Set.of()));

        List<Relationship> removed = new ArrayList<>();
        for (Relationship.Key key : touching) {
            Relationship relationship = removeEdge(key);
            if (relationship != null) {
                removed.add(relationship);
            }
        }

        entities.remove(entityId);
        outgoing.remove(entityId);
        incoming.remove(entityId);
        unindex(existing);
        touch(Instant.now());

        logger.debug("Deleted entity {} from project {} with {} relationships", entityId, projectId, removed.size());
        return removed;
    }

    // ===== Relationship operations =====

    /**
     * Adds a relationship, or merges it into the existing one with the same identity triple.
     *
     * @return true if the relationship was new
     * @throws EntityNotFoundException if the source or target entity is absent; nothing is changed
     */
    public boolean addRelationship(@NotNull Relationship relationship) {
        Objects.requireNonNull(relationship, "relationship must not be null");
        if (!entities.containsKey(relationship.getSourceId())) {
            throw new EntityNotFoundException(relationship.getSourceId(),
                "Source entity not found: " + relationship.getSourceId());
        }
        if (!entities.containsKey(relationship.getTargetId())) {
            throw new EntityNotFoundException(relationship.getTargetId(),
                "Target entity not found: " + relationship.getTargetId());
        }

        Instant now = Instant.now();
        Relationship.Key key = relationship.key();
        Relationship existing = relationships.get(key);
        if (existing != null) {
            relationships.put(key, existing.mergeWith(relationship, now));
            touch(now);
            return false;
        }

        relationships.put(key, relationship);
        outgoing.computeIfAbsent(key.sourceId(), k -> new LinkedHashSet<>()).add(key);
        incoming.computeIfAbsent(key.targetId(), k -> new LinkedHashSet<>()).add(key);
        touch(now);
        logger.debug("Added relationship {} --[{}]--> {} to project {}",
            key.sourceId(), key.relationType().getValue(), key.targetId(), projectId);
        return true;
    }

    @NotNull
    public Optional<Relationship> getRelationship(@NotNull String sourceId, @NotNull String targetId,
                                                  @NotNull RelationType relationType) {
        return Optional.ofNullable(relationships.get(new Relationship.Key(sourceId, targetId, relationType)));
    }

    /**
     * Lists relationships matching every non-null filter.
     */
    @NotNull
    public List<Relationship> getRelationships(@Nullable String sourceId, @Nullable String targetId,
                                               @Nullable RelationType relationType) {
        Collection<Relationship.Key> candidates;
        if (sourceId != null) {
            candidates = outgoing.getOrDefault(sourceId, Set.of());
        } else if (targetId != null) {
            candidates = incoming.getOrDefault(targetId, Set.of());
        } else {
            candidates = relationships.keySet();
        }

        List<Relationship> results = new ArrayList<>();
        for (Relationship.Key key : candidates) {
            if (sourceId != null && !key.sourceId().equals(sourceId)) continue;
            if (targetId != null && !key.targetId().equals(targetId)) continue;
            if (relationType != null && key.relationType() != relationType) continue;
            results.add(relationships.get(key));
        }
        return results;
    }

    /**
     * @return true if the relationship existed
     */
    public boolean deleteRelationship(@NotNull String sourceId, @NotNull String targetId,
                                      @NotNull RelationType relationType) {
        Relationship removed = removeEdge(new Relationship.Key(sourceId, targetId, relationType));
        if (removed == null) {
            return false;
        }
        touch(Instant.now());
        return true;
    }

    // ===== Queries =====

    /**
     * Breadth-first traversal from an entity, following outgoing edges.
     *
     * @see #connectedEntities(String, int, Set, TraversalDirection)
     */
    @NotNull
    public List<Entity> connectedEntities(@NotNull String entityId, int maxDepth,
                                          @Nullable Set<RelationType> relationTypes) {
        return connectedEntities(entityId, maxDepth, relationTypes, TraversalDirection.OUTGOING);
    }

    /**
     * Entities reachable from {@code entityId} within {@code maxDepth} hops, in BFS order,
     * excluding the origin. When {@code relationTypes} is non-empty a hop is only taken over an
     * edge of one of those types. Unknown ids yield an empty list.
     */
    @NotNull
    public List<Entity> connectedEntities(@NotNull String entityId, int maxDepth,
                                          @Nullable Set<RelationType> relationTypes,
                                          @NotNull TraversalDirection direction) {
        if (!entities.containsKey(entityId) || maxDepth < 1) {
            return List.of();
        }

        Set<String> visited = new HashSet<>();
        visited.add(entityId);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(entityId);
        List<Entity> connected = new ArrayList<>();

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            Deque<String> next = new ArrayDeque<>();
            while (!frontier.isEmpty()) {
                String current = frontier.poll();
                for (String neighbor : neighbors(current, direction, relationTypes)) {
                    if (visited.add(neighbor)) {
                        connected.add(entities.get(neighbor));
                        next.add(neighbor);
                    }
                }
            }
            frontier = next;
        }
        return connected;
    }

    @NotNull
    public Optional<List<String>> findPath(@NotNull String sourceId, @NotNull String targetId) {
        return findPath(sourceId, targetId, TraversalDirection.OUTGOING);
    }

    /**
     * Unweighted shortest path by breadth-first search.
     *
     * @return ids from source to target inclusive, or empty when either id is unknown or the
     *         target is unreachable
     */
    @NotNull
    public Optional<List<String>> findPath(@NotNull String sourceId, @NotNull String targetId,
                                           @NotNull TraversalDirection direction) {
        if (!entities.containsKey(sourceId) || !entities.containsKey(targetId)) {
            return Optional.empty();
        }
        if (sourceId.equals(targetId)) {
            return Optional.of(List.of(sourceId));
        }

        Map<String, String> parents = new HashMap<>();
        parents.put(sourceId, null);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(sourceId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String neighbor : neighbors(current, direction, null)) {
                if (parents.containsKey(neighbor)) {
                    continue;
                }
                parents.put(neighbor, current);
                if (neighbor.equals(targetId)) {
                    List<String> path = new ArrayList<>();
                    for (String step = targetId; step != null; step = parents.get(step)) {
                        path.add(step);
                    }
                    Collections.reverse(path);
                    return Optional.of(path);
                }
                queue.add(neighbor);
            }
        }
        return Optional.empty();
    }

    /**
     * Most central entities by PageRank, highest first.
     */
    @NotNull
    public List<RankedEntity> centralEntities(int topN) {
        Map<String, Double> ranks = CentralityRanker.pageRank(this);
        return ranks.entrySet().stream()
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(Math.max(topN, 0))
            .map(e -> new RankedEntity(entities.get(e.getKey()), e.getValue()))
            .toList();
    }

    /**
     * Communities of densely connected entities, largest first.
     *
     * @see CommunityDetector
     */
    @NotNull
    public List<Set<String>> detectCommunities() {
        return CommunityDetector.greedyModularity(this);
    }

    @NotNull
    public GraphAnalytics.EntityStats entityStats(@NotNull String entityId) {
        requireEntity(entityId);
        return GraphAnalytics.entityStats(this, entityId);
    }

    @NotNull
    public GraphAnalytics.GraphStats stats() {
        return GraphAnalytics.graphStats(this);
    }

    /**
     * Distinct neighbor ids of a node.
     *
     * @param relationTypes when non-empty, only edges of these types are followed
     */
    @NotNull
    public Set<String> neighbors(@NotNull String entityId, @NotNull TraversalDirection direction,
                                 @Nullable Set<RelationType> relationTypes) {
        Set<String> result = new LinkedHashSet<>();
        for (Relationship.Key key : outgoing.getOrDefault(entityId, Set.of())) {
            if (relationTypes == null || relationTypes.isEmpty() || relationTypes.contains(key.relationType())) {
                result.add(key.targetId());
            }
        }
        if (direction == TraversalDirection.BOTH) {
            for (Relationship.Key key : incoming.getOrDefault(entityId, Set.of())) {
                if (relationTypes == null || relationTypes.isEmpty() || relationTypes.contains(key.relationType())) {
                    result.add(key.sourceId());
                }
            }
        }
        return result;
    }

    int outDegree(@NotNull String entityId) {
        return outgoing.getOrDefault(entityId, Set.of()).size();
    }

    int inDegree(@NotNull String entityId) {
        return incoming.getOrDefault(entityId, Set.of()).size();
    }

    // ===== Bulk access and metadata =====

    @NotNull
    public Collection<Entity> entities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    @NotNull
    public Collection<Relationship> relationships() {
        return Collections.unmodifiableCollection(relationships.values());
    }

    public int entityCount() {
        return entities.size();
    }

    public int relationshipCount() {
        return relationships.size();
    }

    /**
     * Records one extraction attempt against this graph.
     */
    public void recordExtraction(@NotNull String sceneId, boolean success) {
        totalExtractions++;
        if (success) {
            successfulExtractions++;
        } else {
            failedExtractions++;
        }
        lastExtractedScene = sceneId;
        touch(Instant.now());
    }

    @NotNull
    public GraphMetadata metadata() {
        return new GraphMetadata(
            projectId,
            entities.size(),
            relationships.size(),
            sceneReferences().size(),
            totalExtractions,
            successfulExtractions,
            failedExtractions,
            createdAt,
            lastUpdated,
            lastExtractedScene);
    }

    /**
     * Restores counters and timestamps read from a persisted document. Counts are always
     * derived from content and are not restored.
     */
    public void restoreMetadata(@NotNull GraphMetadata metadata) {
        if (!projectId.equals(metadata.projectId())) {
            throw new IllegalArgumentException(
                "Metadata belongs to project " + metadata.projectId() + ", not " + projectId);
        }
        this.totalExtractions = metadata.totalExtractions();
        this.successfulExtractions = metadata.successfulExtractions();
        this.failedExtractions = metadata.failedExtractions();
        this.lastExtractedScene = metadata.lastExtractedScene();
        this.createdAt = metadata.createdAt();
        this.lastUpdated = metadata.lastUpdated();
    }

    @NotNull
    public Set<String> sceneReferences() {
        Set<String> scenes = new LinkedHashSet<>();
        for (Entity entity : entities.values()) {
            scenes.addAll(entity.getAppearances());
        }
        for (Relationship relationship : relationships.values()) {
            scenes.addAll(relationship.getScenes());
        }
        return scenes;
    }

    // ===== Internals =====

    private Relationship removeEdge(Relationship.Key key) {
        Relationship removed = relationships.remove(key);
        if (removed != null) {
            Set<Relationship.Key> out = outgoing.get(key.sourceId());
            if (out != null) {
                out.remove(key);
            }
            Set<Relationship.Key> in = incoming.get(key.targetId());
            if (in != null) {
                in.remove(key);
            }
        }
        return removed;
    }

    private void index(Entity entity) {
        nameIndex.putIfAbsent(entity.getName().toLowerCase(Locale.ROOT), entity.getId());
        for (String alias : entity.getAliases()) {
            nameIndex.putIfAbsent(alias.toLowerCase(Locale.ROOT), entity.getId());
        }
    }

    private void unindex(Entity entity) {
        Set<String> released = new HashSet<>();
        nameIndex.entrySet().removeIf(entry -> {
            if (entry.getValue().equals(entity.getId())) {
                released.add(entry.getKey());
                return true;
            }
            return false;
        });
        // another entity may share a released name or alias
        for (Entity other : entities.values()) {
            if (other.getId().equals(entity.getId())) {
                continue;
            }
            if (released.contains(other.getName().toLowerCase(Locale.ROOT))) {
                nameIndex.putIfAbsent(other.getName().toLowerCase(Locale.ROOT), other.getId());
            }
            for (String alias : other.getAliases()) {
                if (released.contains(alias.toLowerCase(Locale.ROOT))) {
                    nameIndex.putIfAbsent(alias.toLowerCase(Locale.ROOT), other.getId());
                }
            }
        }
    }

    private void touch(Instant now) {
        this.lastUpdated = now;
    }

    private static String requireString(String field, Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException(field + " must be a non-blank string");
        }
        return s;
    }

    private static Number requireNumber(String field, Object value) {
        if (!(value instanceof Number n)) {
            throw new IllegalArgumentException(field + " must be a number");
        }
        return n;
    }

    private static boolean requireBoolean(String field, Object value) {
        if (!(value instanceof Boolean b)) {
            throw new IllegalArgumentException(field + " must be a boolean");
        }
        return b;
    }

    private static List<String> toStringList(String field, Object value) {
        if (!(value instanceof Collection<?> collection)) {
            throw new IllegalArgumentException(field + " must be a list of strings");
        }
        List<String> result = new ArrayList<>();
        for (Object item : collection) {
            result.add(String.valueOf(item));
        }
        return result;
    }
}
