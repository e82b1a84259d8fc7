package br.edu.ifba.storygraph.storage;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.GraphMetadata;
import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.core.Relationship;
import br.edu.ifba.storygraph.exception.GraphValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Converts a {@link KnowledgeGraph} to and from its persisted JSON document.
 *
 * <pre>
 * {
 *   "metadata": { "project_id", "entity_count", ..., "created_at", "last_updated" },
 *   "graph": { "directed": true, "multigraph": true, "nodes": [...], "edges": [...] },
 *   "entities": { "&lt;id&gt;": { full entity }, ... },
 *   "relationships": [ { full relationship }, ... ]
 * }
 * </pre>
 *
 * <p>The {@code graph} section is the node-link interchange view. {@code entities} and
 * {@code relationships} carry the full records and are what {@link #load(JsonNode)} rebuilds
 * from, after checking the two views agree.</p>
 */
public class GraphDocumentCodec {

    private static final Logger logger = LoggerFactory.getLogger(GraphDocumentCodec.class);

    public static final String METADATA = "metadata";
    public static final String GRAPH = "graph";
    public static final String ENTITIES = "entities";
    public static final String RELATIONSHIPS = "relationships";

    private final ObjectMapper mapper;

    public GraphDocumentCodec() {
        this(defaultMapper());
    }

    public GraphDocumentCodec(@NotNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Mapper configured for the document format: ISO-8601 instants, unknown fields ignored.
     */
    @NotNull
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @NotNull
    public ObjectMapper mapper() {
        return mapper;
    }

    // ===== save =====

    @NotNull
    public ObjectNode save(@NotNull KnowledgeGraph graph) {
        ObjectNode document = mapper.createObjectNode();
        document.set(METADATA, mapper.valueToTree(graph.metadata()));
        document.set(GRAPH, nodeLink(graph));

        ObjectNode entities = document.putObject(ENTITIES);
        for (Entity entity : graph.entities()) {
            entities.set(entity.getId(), mapper.valueToTree(entity));
        }

        ArrayNode relationships = document.putArray(RELATIONSHIPS);
        for (Relationship relationship : graph.relationships()) {
            relationships.add((JsonNode) mapper.valueToTree(relationship));
        }
        return document;
    }

    /**
     * Node-link view of the graph, the shape graph tools import.
     */
    @NotNull
    public ObjectNode nodeLink(@NotNull KnowledgeGraph graph) {
        ObjectNode view = mapper.createObjectNode();
        view.put("directed", true);
        view.put("multigraph", true);

        ArrayNode nodes = view.putArray("nodes");
        for (Entity entity : graph.entities()) {
            ObjectNode node = nodes.addObject();
            node.put("id", entity.getId());
            node.put("name", entity.getName());
            node.put("type", entity.getType().getValue());
            node.put("mention_count", entity.getMentionCount());
        }

        ArrayNode edges = view.putArray("edges");
        for (Relationship relationship : graph.relationships()) {
            ObjectNode edge = edges.addObject();
            edge.put("source", relationship.getSourceId());
            edge.put("target", relationship.getTargetId());
            edge.put("key", relationship.getRelationType().getValue());
            edge.put("strength", relationship.getStrength());
            edge.put("valence", relationship.getValence());
        }
        return view;
    }

    // ===== load =====

    /**
     * Rebuilds a graph from a persisted document.
     *
     * @throws GraphValidationException if any section is missing or malformed
     */
    @NotNull
    public KnowledgeGraph load(@NotNull JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new GraphValidationException("$", "document must be a JSON object");
        }

        JsonNode metadataNode = requireObject(document, METADATA, null);
        JsonNode graphNode = requireObject(document, GRAPH, null);
        JsonNode entitiesNode = requireObject(document, ENTITIES, null);
        JsonNode relationshipsNode = requireArray(document, RELATIONSHIPS, null);

        GraphMetadata metadata = readMetadata(metadataNode);
        Set<String> nodeIds = validateNodeLink(graphNode);

        KnowledgeGraph graph = new KnowledgeGraph(metadata.projectId());

        Iterator<Map.Entry<String, JsonNode>> fields = entitiesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = ENTITIES + "." + field.getKey();
            if (!field.getValue().isObject()) {
                throw new GraphValidationException(path, "entity record must be an object");
            }
            Entity entity = convert(field.getValue(), Entity.class, path);
            if (!entity.getId().equals(field.getKey())) {
                throw new GraphValidationException(path,
                    "entity key does not match its id '" + entity.getId() + "'");
            }
            if (!nodeIds.contains(entity.getId())) {
                throw new GraphValidationException(path, "entity has no node in graph.nodes");
            }
            graph.addEntity(entity);
        }
        if (graph.entityCount() != nodeIds.size()) {
            throw new GraphValidationException(GRAPH + ".nodes",
                "graph.nodes lists " + nodeIds.size() + " nodes but " + graph.entityCount() + " entities are present");
        }

        for (int i = 0; i < relationshipsNode.size(); i++) {
            String path = RELATIONSHIPS + "[" + i + "]";
            JsonNode item = relationshipsNode.get(i);
            if (!item.isObject()) {
                throw new GraphValidationException(path, "relationship record must be an object");
            }
            Relationship relationship = convert(item, Relationship.class, path);
            if (!graph.containsEntity(relationship.getSourceId())) {
                throw new GraphValidationException(path, "unknown source entity '" + relationship.getSourceId() + "'");
            }
            if (!graph.containsEntity(relationship.getTargetId())) {
                throw new GraphValidationException(path, "unknown target entity '" + relationship.getTargetId() + "'");
            }
            graph.addRelationship(relationship);
        }

        if (metadata.entityCount() != graph.entityCount()
                || metadata.relationshipCount() != graph.relationshipCount()) {
            logger.warn("Stored counts for project {} ({} entities, {} relationships) differ from content ({}, {})",
                metadata.projectId(), metadata.entityCount(), metadata.relationshipCount(),
                graph.entityCount(), graph.relationshipCount());
        }

        graph.restoreMetadata(metadata);
        logger.debug("Loaded graph for project {}: {} entities, {} relationships",
            metadata.projectId(), graph.entityCount(), graph.relationshipCount());
        return graph;
    }

    private GraphMetadata readMetadata(JsonNode node) {
        JsonNode projectId = node.get("project_id");
        if (projectId == null || !projectId.isTextual() || projectId.asText().isBlank()) {
            throw new GraphValidationException(METADATA + ".project_id", "missing or blank project id");
        }
        Instant lastUpdated = readInstant(node, "last_updated", true);
        Instant createdAt = readInstant(node, "created_at", false);
        JsonNode lastScene = node.get("last_extracted_scene");

        return new GraphMetadata(
            projectId.asText(),
            readCount(node, "entity_count"),
            readCount(node, "relationship_count"),
            readCount(node, "scene_count"),
            readCount(node, "total_extractions"),
            readCount(node, "successful_extractions"),
            readCount(node, "failed_extractions"),
            createdAt != null ? createdAt : lastUpdated,
            lastUpdated,
            lastScene != null && lastScene.isTextual() ? lastScene.asText() : null);
    }

    private static Instant readInstant(JsonNode node, String field, boolean required) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            if (required) {
                throw new GraphValidationException(METADATA + "." + field, "missing timestamp");
            }
            return null;
        }
        if (!value.isTextual()) {
            throw new GraphValidationException(METADATA + "." + field, "timestamp must be an ISO-8601 string");
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new GraphValidationException(METADATA + "." + field, "invalid ISO-8601 timestamp: " + value.asText(), e);
        }
    }

    private static int readCount(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return 0;
        }
        if (!value.canConvertToInt() || value.asInt() < 0) {
            throw new GraphValidationException(METADATA + "." + field, "must be a non-negative integer");
        }
        return value.asInt();
    }

    private static Set<String> validateNodeLink(JsonNode graph) {
        JsonNode nodes = requireArray(graph, "nodes", GRAPH);
        JsonNode edges = requireArray(graph, "edges", GRAPH);

        Set<String> nodeIds = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            String path = GRAPH + ".nodes[" + i + "]";
            JsonNode id = nodes.get(i).get("id");
            if (id == null || !id.isTextual() || id.asText().isBlank()) {
                throw new GraphValidationException(path, "node without id");
            }
            if (!nodeIds.add(id.asText())) {
                throw new GraphValidationException(path, "duplicate node id '" + id.asText() + "'");
            }
        }

        for (int i = 0; i < edges.size(); i++) {
            String path = GRAPH + ".edges[" + i + "]";
            JsonNode edge = edges.get(i);
            for (String end : new String[]{"source", "target"}) {
                JsonNode ref = edge.get(end);
                if (ref == null || !ref.isTextual()) {
                    throw new GraphValidationException(path, "edge without " + end);
                }
                if (!nodeIds.contains(ref.asText())) {
                    throw new GraphValidationException(path, "edge references unknown node '" + ref.asText() + "'");
                }
            }
        }
        return nodeIds;
    }

    private static JsonNode requireObject(JsonNode parent, String field, String parentPath) {
        String path = parentPath == null ? field : parentPath + "." + field;
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new GraphValidationException(path, "required section is missing");
        }
        if (!node.isObject()) {
            throw new GraphValidationException(path, "must be an object");
        }
        return node;
    }

    private static JsonNode requireArray(JsonNode parent, String field, String parentPath) {
        String path = parentPath == null ? field : parentPath + "." + field;
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new GraphValidationException(path, "required section is missing");
        }
        if (!node.isArray()) {
            throw new GraphValidationException(path, "must be an array");
        }
        return node;
    }

    private <T> T convert(JsonNode node, Class<T> type, String path) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new GraphValidationException(path, "malformed " + type.getSimpleName() + " record: "
                + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new GraphValidationException(path, "malformed " + type.getSimpleName() + " record: "
                + e.getMessage(), e);
        }
    }
}
