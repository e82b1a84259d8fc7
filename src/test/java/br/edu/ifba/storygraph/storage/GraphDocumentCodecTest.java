package br.edu.ifba.storygraph.storage;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.EntityType;
import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.core.RelationType;
import br.edu.ifba.storygraph.core.Relationship;
import br.edu.ifba.storygraph.exception.GraphValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphDocumentCodec save/load and document validation.
 */
class GraphDocumentCodecTest {

    private GraphDocumentCodec codec;
    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        codec = new GraphDocumentCodec();
        graph = new KnowledgeGraph("novel");
        graph.addEntity(Entity.builder()
            .name("Mickey")
            .type(EntityType.CHARACTER)
            .description("A drifter")
            .alias("Mick")
            .attribute("age", 42)
            .seenIn("scene-1")
            .confidence(0.9)
            .build());
        graph.addEntity(Entity.builder().name("Sarah").type(EntityType.CHARACTER).seenIn("scene-1").build());
        graph.addEntity(Entity.builder().name("warehouse").type(EntityType.LOCATION).seenIn("scene-2").build());
        graph.addRelationship(Relationship.builder()
            .source("entity_mickey").target("entity_sarah").relationType(RelationType.RELATED_TO)
            .evidence("He was looking for Sarah").seenIn("scene-1").strength(0.8).valence(0.5).build());
        graph.addRelationship(Relationship.builder()
            .source("entity_mickey").target("entity_sarah").relationType(RelationType.FEARS)
            .seenIn("scene-2").build());
        graph.addRelationship(Relationship.builder()
            .source("entity_sarah").target("entity_warehouse").relationType(RelationType.CONTROLS)
            .seenIn("scene-2").build());
        graph.recordExtraction("scene-1", true);
        graph.recordExtraction("scene-2", false);
    }

    @Test
    @DisplayName("save produces all four top-level sections")
    void testSaveSections() {
        // Act
        ObjectNode document = codec.save(graph);

        // Assert
        assertTrue(document.get("metadata").isObject());
        assertTrue(document.get("graph").isObject());
        assertTrue(document.get("entities").isObject());
        assertTrue(document.get("relationships").isArray());
        assertEquals("novel", document.get("metadata").get("project_id").asText());
        assertEquals(3, document.get("graph").get("nodes").size());
        assertEquals(3, document.get("graph").get("edges").size());
        assertTrue(document.get("graph").get("multigraph").asBoolean());
    }

    @Test
    @DisplayName("Timestamps serialize as ISO-8601 strings")
    void testTimestampsAreIsoStrings() {
        // Act
        ObjectNode document = codec.save(graph);

        // Assert
        JsonNode lastUpdated = document.get("metadata").get("last_updated");
        assertTrue(lastUpdated.isTextual());
        assertDoesNotThrow(() -> java.time.Instant.parse(lastUpdated.asText()));
        assertTrue(document.get("entities").get("entity_mickey").get("created_at").isTextual());
    }

    @Test
    @DisplayName("load(save(g)) preserves counts and identity tuples")
    void testRoundTrip() {
        // Act
        KnowledgeGraph loaded = codec.load(codec.save(graph));

        // Assert
        assertEquals(graph.entityCount(), loaded.entityCount());
        assertEquals(graph.relationshipCount(), loaded.relationshipCount());
        assertEquals(entityTuples(graph), entityTuples(loaded));
        assertEquals(relationshipTuples(graph), relationshipTuples(loaded));
    }

    @Test
    @DisplayName("Round trip keeps full records, counters and timestamps")
    void testRoundTripKeepsDetails() {
        // Act
        KnowledgeGraph loaded = codec.load(codec.save(graph));

        // Assert
        Entity mickey = loaded.requireEntity("entity_mickey");
        assertEquals(graph.requireEntity("entity_mickey"), mickey);
        assertEquals(graph.requireEntity("entity_mickey").getCreatedAt(), mickey.getCreatedAt());
        assertEquals(42, mickey.getAttributes().get("age"));
        assertEquals(graph.metadata(), loaded.metadata());
        assertEquals(2, loaded.metadata().totalExtractions());
        assertEquals(1, loaded.metadata().failedExtractions());
        assertEquals("scene-2", loaded.metadata().lastExtractedScene());
        assertEquals(loaded.findByName("mick", false).map(Entity::getId).orElseThrow(), "entity_mickey");
    }

    @Test
    @DisplayName("Empty graph round-trips")
    void testEmptyGraphRoundTrip() {
        // Arrange
        KnowledgeGraph empty = new KnowledgeGraph("empty");

        // Act
        KnowledgeGraph loaded = codec.load(codec.save(empty));

        // Assert
        assertEquals("empty", loaded.getProjectId());
        assertEquals(0, loaded.entityCount());
        assertEquals(0, loaded.relationshipCount());
    }

    @Test
    @DisplayName("Each missing top-level section is a validation error naming the section")
    void testMissingSections() {
        for (String section : new String[]{"metadata", "graph", "entities", "relationships"}) {
            // Arrange
            ObjectNode document = codec.save(graph);
            document.remove(section);

            // Act
            GraphValidationException error = assertThrows(GraphValidationException.class,
                () -> codec.load(document));

            // Assert
            assertEquals(section, error.getPath());
        }
    }

    @Test
    @DisplayName("Non-object document is rejected")
    void testNonObjectDocument() {
        // Arrange
        ArrayNode notAnObject = codec.mapper().createArrayNode();

        // Act & Assert
        assertThrows(GraphValidationException.class, () -> codec.load(notAnObject));
    }

    @Test
    @DisplayName("Section of the wrong shape is rejected")
    void testWrongSectionShape() {
        // Arrange
        ObjectNode document = codec.save(graph);
        document.putObject("relationships");

        // Act
        GraphValidationException error = assertThrows(GraphValidationException.class, () -> codec.load(document));

        // Assert
        assertEquals("relationships", error.getPath());
    }

    @Test
    @DisplayName("Node without id is rejected")
    void testNodeWithoutId() {
        // Arrange
        ObjectNode document = codec.save(graph);
        ((ObjectNode) document.get("graph").get("nodes").get(1)).remove("id");

        // Act
        GraphValidationException error = assertThrows(GraphValidationException.class, () -> codec.load(document));

        // Assert
        assertEquals("graph.nodes[1]", error.getPath());
    }

    @Test
    @DisplayName("Edge referencing an unknown node is rejected")
    void testEdgeToUnknownNode() {
        // Arrange
        ObjectNode document = codec.save(graph);
        ((ObjectNode) document.get("graph").get("edges").get(0)).put("target", "entity_ghost");

        // Act & Assert
        GraphValidationException error = assertThrows(GraphValidationException.class, () -> codec.load(document));
        assertEquals("graph.edges[0]", error.getPath());
    }

    @Test
    @DisplayName("Entity key that differs from the record id is rejected")
    void testEntityKeyMismatch() {
        // Arrange
        ObjectNode document = codec.save(graph);
        ((ObjectNode) document.get("entities").get("entity_sarah")).put("id", "entity_someone_else");

        // Act & Assert
        GraphValidationException error = assertThrows(GraphValidationException.class, () -> codec.load(document));
        assertEquals("entities.entity_sarah", error.getPath());
    }

    @Test
    @DisplayName("Relationship whose endpoint is not among the entities is rejected")
    void testRelationshipWithMissingEndpoint() {
        // Arrange
        ObjectNode document = codec.save(graph);
        ((ObjectNode) document.get("relationships").get(2)).put("target", "entity_ghost");

        // Act & Assert
        GraphValidationException error = assertThrows(GraphValidationException.class, () -> codec.load(document));
        assertEquals("relationships[2]", error.getPath());
    }

    @Test
    @DisplayName("Unknown enum value inside a record becomes a validation error")
    void testUnknownEntityType() {
        // Arrange
        ObjectNode document = codec.save(graph);
        ((ObjectNode) document.get("entities").get("entity_mickey")).put("type", "spaceship");

        // Act
        GraphValidationException error = assertThrows(GraphValidationException.class, () -> codec.load(document));

        // Assert
        assertEquals("entities.entity_mickey", error.getPath());
        assertNotNull(error.getCause());
    }

    @Test
    @DisplayName("Malformed timestamp in metadata is rejected")
    void testMalformedTimestamp() {
        // Arrange
        ObjectNode document = codec.save(graph);
        ((ObjectNode) document.get("metadata")).put("last_updated", "yesterday");

        // Act & Assert
        GraphValidationException error = assertThrows(GraphValidationException.class, () -> codec.load(document));
        assertEquals("metadata.last_updated", error.getPath());
    }

    @Test
    @DisplayName("Missing project id is rejected")
    void testMissingProjectId() {
        // Arrange
        ObjectNode document = codec.save(graph);
        ((ObjectNode) document.get("metadata")).remove("project_id");

        // Act & Assert
        GraphValidationException error = assertThrows(GraphValidationException.class, () -> codec.load(document));
        assertEquals("metadata.project_id", error.getPath());
    }

    private static Set<String> entityTuples(KnowledgeGraph g) {
        return g.entities().stream()
            .map(e -> e.getId() + "|" + e.getName() + "|" + e.getType())
            .collect(Collectors.toSet());
    }

    private static Set<String> relationshipTuples(KnowledgeGraph g) {
        return g.relationships().stream()
            .map(r -> r.getSourceId() + "|" + r.getTargetId() + "|" + r.getRelationType())
            .collect(Collectors.toSet());
    }
}
