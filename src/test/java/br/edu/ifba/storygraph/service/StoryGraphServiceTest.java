package br.edu.ifba.storygraph.service;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.EntityQuery;
import br.edu.ifba.storygraph.core.EntityType;
import br.edu.ifba.storygraph.core.GraphAnalytics;
import br.edu.ifba.storygraph.core.RelationType;
import br.edu.ifba.storygraph.core.Relationship;
import br.edu.ifba.storygraph.core.TraversalDirection;
import br.edu.ifba.storygraph.exception.EntityNotFoundException;
import br.edu.ifba.storygraph.export.DocumentGraphExporter;
import br.edu.ifba.storygraph.export.ExportConfig;
import br.edu.ifba.storygraph.export.ExportFormat;
import br.edu.ifba.storygraph.export.GraphExporterFactory;
import br.edu.ifba.storygraph.export.GraphMlGraphExporter;
import br.edu.ifba.storygraph.export.MarkdownGraphExporter;
import br.edu.ifba.storygraph.export.NodeLinkGraphExporter;
import br.edu.ifba.storygraph.extraction.ExtractionResponseParser;
import br.edu.ifba.storygraph.extraction.ExtractionStrategy;
import br.edu.ifba.storygraph.extraction.LightweightSceneExtractor;
import br.edu.ifba.storygraph.extraction.SceneExtractorRegistry;
import br.edu.ifba.storygraph.extraction.ScriptedLLM;
import br.edu.ifba.storygraph.extraction.SemanticSceneExtractor;
import br.edu.ifba.storygraph.extraction.ner.PatternEntityRecognizer;
import br.edu.ifba.storygraph.job.ExtractionJob;
import br.edu.ifba.storygraph.job.ExtractionJobService;
import br.edu.ifba.storygraph.job.InMemorySceneSource;
import br.edu.ifba.storygraph.job.JobStatus;
import br.edu.ifba.storygraph.job.Scene;
import br.edu.ifba.storygraph.notify.GraphChangeNotifier;
import br.edu.ifba.storygraph.notify.GraphEvent;
import br.edu.ifba.storygraph.notify.GraphEventType;
import br.edu.ifba.storygraph.storage.GraphRepository;
import br.edu.ifba.storygraph.storage.impl.InMemoryGraphDocumentStore;
import br.edu.ifba.storygraph.utils.ProjectLockManager;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static br.edu.ifba.storygraph.core.StoryFixtures.character;
import static br.edu.ifba.storygraph.core.StoryFixtures.location;
import static br.edu.ifba.storygraph.core.StoryFixtures.relation;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Tests for StoryGraphService wired against in-memory storage and synchronous event delivery.
 */
class StoryGraphServiceTest {

    private static final String PROJECT = "novel";

    private InMemoryGraphDocumentStore store;
    private InMemorySceneSource scenes;
    private ExtractionJobService jobService;
    private StoryGraphService service;
    private final List<GraphEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        StoryGraphConfig config = Mockito.mock(StoryGraphConfig.class, Mockito.RETURNS_DEEP_STUBS);
        when(config.extraction().timeout()).thenReturn(Duration.ofSeconds(5));
        when(config.batch().maxScenes()).thenReturn(500);
        when(config.batch().costConfirmationThreshold()).thenReturn(new BigDecimal("1.00"));
        when(config.batch().costPer1kTokens()).thenReturn(new BigDecimal("0.003"));
        when(config.batch().expectedOutputTokens()).thenReturn(1500);

        store = new InMemoryGraphDocumentStore();
        GraphRepository repository = new GraphRepository(store);
        ProjectLockManager locks = new ProjectLockManager(Duration.ofSeconds(5));
        GraphChangeNotifier notifier = new GraphChangeNotifier(Runnable::run);
        scenes = new InMemorySceneSource();
        SceneExtractorRegistry extractors = new SceneExtractorRegistry(List.of(
            new SemanticSceneExtractor(ScriptedLLM.mickey(), new ExtractionResponseParser(), "test-model", 20),
            new LightweightSceneExtractor(new PatternEntityRecognizer())));
        jobService = new ExtractionJobService(extractors, repository, locks, notifier, scenes, config,
            Executors.newFixedThreadPool(2));
        GraphExporterFactory exporters = new GraphExporterFactory(List.of(
            new NodeLinkGraphExporter(), new MarkdownGraphExporter(),
            new DocumentGraphExporter(), new GraphMlGraphExporter()));

        service = new StoryGraphService(repository, locks, notifier, exporters, jobService);
        service.subscribe(PROJECT, events::add);
    }

    @AfterEach
    void tearDown() {
        jobService.shutdown();
    }

    @Test
    @DisplayName("Adding an entity twice merges it and reports added then updated")
    void testAddEntityMerges() {
        // Act
        service.addEntity(PROJECT, character("Mickey", "scene-1"));
        Entity merged = service.addEntity(PROJECT, character("Mickey", "scene-2"));

        // Assert
        assertEquals(List.of("scene-1", "scene-2"), merged.getAppearances());
        assertEquals(2, merged.getMentionCount());
        assertEquals(List.of(GraphEventType.ENTITY_ADDED, GraphEventType.ENTITY_UPDATED),
            events.stream().map(GraphEvent::type).toList());
        assertTrue(store.read(PROJECT).join().isPresent(), "mutations are persisted");
    }

    @Test
    @DisplayName("Relationship to a missing entity is rejected and leaves the graph untouched")
    void testAddRelationshipMissingEndpoint() {
        // Arrange
        service.addEntity(PROJECT, character("Mickey", "scene-1"));
        events.clear();

        // Act & Assert
        assertThrows(EntityNotFoundException.class,
            () -> service.addRelationship(PROJECT, relation("entity_mickey", "entity_ghost", RelationType.FEARS)));
        assertEquals(0, service.metadata(PROJECT).relationshipCount());
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("Deleting an entity cascades to its relationships and publishes each removal")
    void testDeleteEntityCascade() {
        // Arrange
        seedMickeyGraph();
        events.clear();

        // Act
        List<Relationship> removed = service.deleteEntity(PROJECT, "entity_mickey");

        // Assert
        assertEquals(2, removed.size());
        assertEquals(0, service.metadata(PROJECT).relationshipCount());
        assertEquals(2, service.metadata(PROJECT).entityCount());
        assertEquals(GraphEventType.ENTITY_DELETED, events.get(0).type());
        assertEquals(2, events.stream().filter(e -> e.type() == GraphEventType.RELATIONSHIP_DELETED).count());
        assertThrows(EntityNotFoundException.class, () -> service.deleteEntity(PROJECT, "entity_mickey"));
    }

    @Test
    @DisplayName("Updating an entity publishes the changed field names")
    void testUpdateEntity() {
        // Arrange
        seedMickeyGraph();
        events.clear();

        // Act
        Entity updated = service.updateEntity(PROJECT, "entity_sarah",
            Map.of("description", "Mickey's older sister", "verified", true));

        // Assert
        assertEquals("Mickey's older sister", updated.getDescription());
        assertTrue(updated.isVerified());
        GraphEvent event = events.get(0);
        assertEquals(GraphEventType.ENTITY_UPDATED, event.type());
        assertTrue(((List<?>) event.payload().get("fields")).containsAll(List.of("description", "verified")));
    }

    @Test
    @DisplayName("Relationship queries and deletion by identity triple")
    void testRelationshipQueriesAndDelete() {
        // Arrange
        seedMickeyGraph();

        // Act
        List<Relationship> fromMickey = service.getRelationships(PROJECT, "entity_mickey", null, null);
        boolean deleted = service.deleteRelationship(PROJECT, "entity_mickey", "entity_sarah", RelationType.KNOWS);
        boolean deletedAgain = service.deleteRelationship(PROJECT, "entity_mickey", "entity_sarah", RelationType.KNOWS);

        // Assert
        assertEquals(2, fromMickey.size());
        assertTrue(deleted);
        assertFalse(deletedAgain);
        assertEquals(1, service.getRelationships(PROJECT, null, null, null).size());
        assertEquals(1, events.stream().filter(e -> e.type() == GraphEventType.RELATIONSHIP_DELETED).count());
    }

    @Test
    @DisplayName("Lookup, query, traversal and analytics go through the project graph")
    void testReadOperations() {
        // Arrange
        seedMickeyGraph();

        // Act & Assert
        assertEquals("entity_sarah", service.getEntity(PROJECT, "entity_sarah").orElseThrow().getId());
        assertEquals("entity_mickey", service.findByName(PROJECT, "MICKEY", false).orElseThrow().getId());
        assertEquals("entity_warehouse", service.findByName(PROJECT, "wareh", true).orElseThrow().getId());
        assertEquals(List.of("entity_warehouse"), service.queryEntities(PROJECT, EntityQuery.ofType(EntityType.LOCATION))
            .stream().map(Entity::getId).toList());

        List<Entity> connected = service.connectedEntities(PROJECT, "entity_mickey", 1, null, TraversalDirection.OUTGOING);
        assertEquals(Set.of("entity_sarah", "entity_warehouse"),
            Set.copyOf(connected.stream().map(Entity::getId).toList()));
        assertEquals(List.of("entity_sarah", "entity_mickey", "entity_warehouse"),
            service.findPath(PROJECT, "entity_sarah", "entity_warehouse", TraversalDirection.BOTH).orElseThrow());
        assertTrue(service.findPath(PROJECT, "entity_sarah", "entity_warehouse", TraversalDirection.OUTGOING).isEmpty());

        assertEquals(3, service.centralEntities(PROJECT, 10).size());
        assertEquals(3, service.detectCommunities(PROJECT).stream().mapToInt(Set::size).sum());
        GraphAnalytics.EntityStats stats = service.entityStats(PROJECT, "entity_mickey");
        assertEquals(2, stats.outDegree());
        assertEquals(0, stats.inDegree());
        assertEquals(3, service.stats(PROJECT).entityCount());
    }

    @Test
    @DisplayName("Export writes the requested format and the document mirrors storage")
    void testExportAndDocument() throws Exception {
        // Arrange
        seedMickeyGraph();
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        // Act
        service.export(PROJECT, ExportConfig.defaultFor(ExportFormat.MARKDOWN), out);
        ObjectNode document = service.document(PROJECT);

        // Assert
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("## Characters (2)"));
        assertTrue(document.has("graph"));
        assertTrue(document.has("entities"));
        assertTrue(document.has("relationships"));
        assertEquals(3, document.get("entities").size());
        assertEquals(PROJECT, document.get("metadata").get("project_id").asText());
    }

    @Test
    @DisplayName("Projects are isolated from each other")
    void testProjectIsolation() {
        // Arrange
        seedMickeyGraph();

        // Act
        service.addEntity("other", character("Ray", "scene-1"));

        // Assert
        assertEquals(3, service.metadata(PROJECT).entityCount());
        assertEquals(1, service.metadata("other").entityCount());
        assertTrue(service.getEntity("other", "entity_mickey").isEmpty());
        assertTrue(events.stream().allMatch(e -> e.projectId().equals(PROJECT)));
    }

    @Test
    @DisplayName("Deleting a graph removes the document and publishes once")
    void testDeleteGraph() {
        // Arrange
        seedMickeyGraph();
        events.clear();

        // Act
        boolean deleted = service.deleteGraph(PROJECT);
        boolean deletedAgain = service.deleteGraph(PROJECT);

        // Assert
        assertTrue(deleted);
        assertFalse(deletedAgain);
        assertTrue(store.read(PROJECT).join().isEmpty());
        assertEquals(0, service.metadata(PROJECT).entityCount());
        assertEquals(List.of(GraphEventType.GRAPH_DELETED), events.stream().map(GraphEvent::type).toList());
    }

    @Test
    @DisplayName("Scene extraction through the facade lands in the project graph")
    void testExtractScene() throws Exception {
        // Arrange
        scenes.put(new Scene("scene-1", PROJECT, "Arrival", ScriptedLLM.MICKEY_SCENE));

        // Act
        ExtractionJob job = service.extractScene(PROJECT, "scene-1", ExtractionStrategy.SEMANTIC);
        jobService.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(JobStatus.COMPLETED, service.getJob(job.getId()).orElseThrow().getStatus());
        assertEquals(3, service.metadata(PROJECT).entityCount());
        assertEquals(1, service.metadata(PROJECT).relationshipCount());
    }

    private void seedMickeyGraph() {
        service.addEntity(PROJECT, character("Mickey", "scene-1"));
        service.addEntity(PROJECT, character("Sarah", "scene-1"));
        service.addEntity(PROJECT, location("warehouse", "scene-1"));
        service.addRelationship(PROJECT, relation("entity_mickey", "entity_sarah", RelationType.KNOWS));
        service.addRelationship(PROJECT, relation("entity_mickey", "entity_warehouse", RelationType.LOCATED_IN));
    }
}
