package br.edu.ifba.storygraph.job;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.EntityQuery;
import br.edu.ifba.storygraph.core.EntityType;
import br.edu.ifba.storygraph.core.GraphMetadata;
import br.edu.ifba.storygraph.core.KnowledgeGraph;
import br.edu.ifba.storygraph.core.RelationType;
import br.edu.ifba.storygraph.core.StoryFixtures;
import br.edu.ifba.storygraph.exception.ExtractionException;
import br.edu.ifba.storygraph.extraction.ExtractionResponseParser;
import br.edu.ifba.storygraph.extraction.ExtractionResult;
import br.edu.ifba.storygraph.extraction.ExtractionStrategy;
import br.edu.ifba.storygraph.extraction.ExtractionUsage;
import br.edu.ifba.storygraph.extraction.LightweightSceneExtractor;
import br.edu.ifba.storygraph.extraction.SceneExtractor;
import br.edu.ifba.storygraph.extraction.SceneExtractorRegistry;
import br.edu.ifba.storygraph.extraction.ScriptedLLM;
import br.edu.ifba.storygraph.extraction.SemanticSceneExtractor;
import br.edu.ifba.storygraph.extraction.ner.PatternEntityRecognizer;
import br.edu.ifba.storygraph.notify.GraphChangeNotifier;
import br.edu.ifba.storygraph.notify.GraphEvent;
import br.edu.ifba.storygraph.notify.GraphEventType;
import br.edu.ifba.storygraph.storage.GraphRepository;
import br.edu.ifba.storygraph.storage.impl.InMemoryGraphDocumentStore;
import br.edu.ifba.storygraph.utils.ProjectLockManager;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Tests for ExtractionJobService: job lifecycle, merging into the project graph, batch cap and cost gate.
 */
class ExtractionJobServiceTest {

    private static final String PROJECT = "novel";

    private StoryGraphConfig config;
    private GraphRepository repository;
    private InMemorySceneSource scenes;
    private GraphChangeNotifier notifier;
    private ScriptedLLM llm;
    private ExtractionJobService service;
    private final List<GraphEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        config = Mockito.mock(StoryGraphConfig.class, Mockito.RETURNS_DEEP_STUBS);
        when(config.extraction().timeout()).thenReturn(Duration.ofSeconds(5));
        when(config.batch().maxScenes()).thenReturn(500);
        when(config.batch().costConfirmationThreshold()).thenReturn(new BigDecimal("1.00"));
        when(config.batch().costPer1kTokens()).thenReturn(new BigDecimal("0.003"));
        when(config.batch().expectedOutputTokens()).thenReturn(1500);

        repository = new GraphRepository(new InMemoryGraphDocumentStore());
        scenes = new InMemorySceneSource();
        notifier = new GraphChangeNotifier(Runnable::run);
        notifier.subscribe(PROJECT, events::add);
        llm = ScriptedLLM.mickey();

        service = newService(List.of(
            new SemanticSceneExtractor(llm, new ExtractionResponseParser(), "test-model", 20),
            new LightweightSceneExtractor(new PatternEntityRecognizer())));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    @DisplayName("Semantic job on the Mickey scene merges three entities and one relationship")
    void testMickeyScene() throws Exception {
        // Arrange
        scenes.put(new Scene("scene-1", PROJECT, "Arrival", ScriptedLLM.MICKEY_SCENE));

        // Act
        ExtractionJob job = service.submit(PROJECT, "scene-1", ExtractionStrategy.SEMANTIC);
        ExtractionJob done = service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(JobStatus.COMPLETED, done.getStatus());
        assertEquals(3, done.getEntitiesExtracted());
        assertEquals(1, done.getRelationshipsExtracted());
        assertEquals("test-model", done.getModelName());
        assertTrue(done.getTokensUsed() > 0);
        assertTrue(done.getCost().signum() > 0);
        assertNotNull(done.getDurationSeconds());

        KnowledgeGraph graph = repository.load(PROJECT);
        GraphMetadata metadata = graph.metadata();
        assertEquals(3, metadata.entityCount());
        assertEquals(1, metadata.relationshipCount());
        assertEquals(1, metadata.successfulExtractions());
        assertEquals(List.of("entity_warehouse"),
            graph.queryEntities(EntityQuery.ofType(EntityType.LOCATION)).stream().map(Entity::getId).toList());
        assertTrue(graph.getRelationship("entity_mickey", "entity_sarah", RelationType.RELATED_TO).isPresent());

        List<GraphEventType> types = events.stream().map(GraphEvent::type).toList();
        assertEquals(GraphEventType.EXTRACTION_STARTED, types.get(0));
        assertEquals(3, types.stream().filter(t -> t == GraphEventType.ENTITY_ADDED).count());
        assertEquals(1, types.stream().filter(t -> t == GraphEventType.RELATIONSHIP_ADDED).count());
        assertEquals(GraphEventType.EXTRACTION_COMPLETED, types.get(types.size() - 1));
    }

    @Test
    @DisplayName("Saved graph is durable: evicting the cache and reloading keeps the extraction")
    void testExtractionIsPersisted() throws Exception {
        // Arrange
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));
        ExtractionJob job = service.submit(PROJECT, "scene-1", ExtractionStrategy.SEMANTIC);
        service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Act
        repository.evict(PROJECT);
        KnowledgeGraph reloaded = repository.load(PROJECT);

        // Assert
        assertEquals(3, reloaded.entityCount());
        assertEquals(1, reloaded.relationshipCount());
    }

    @Test
    @DisplayName("Re-extracting the same scene does not inflate mention counts")
    void testReExtractionIsIdempotent() throws Exception {
        // Arrange
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));
        ExtractionJob first = service.submit(PROJECT, "scene-1", ExtractionStrategy.SEMANTIC);
        service.completion(first.getId()).get(10, TimeUnit.SECONDS);

        // Act
        ExtractionJob second = service.submit(PROJECT, "scene-1", ExtractionStrategy.SEMANTIC);
        service.completion(second.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        KnowledgeGraph graph = repository.load(PROJECT);
        assertEquals(JobStatus.COMPLETED, second.getStatus());
        assertEquals(3, graph.entityCount());
        assertEquals(1, graph.relationshipCount());
        assertEquals(1, graph.requireEntity("entity_mickey").getMentionCount());
        assertEquals(2, graph.metadata().totalExtractions());
        assertTrue(events.stream().anyMatch(e -> e.type() == GraphEventType.ENTITY_UPDATED));
    }

    @Test
    @DisplayName("A second scene adds appearances to known entities")
    void testSecondSceneMerges() throws Exception {
        // Arrange
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));
        scenes.put(new Scene("scene-2", PROJECT, null, "Mickey found Sarah in the warehouse."));

        // Act
        for (String sceneId : List.of("scene-1", "scene-2")) {
            ExtractionJob job = service.submit(PROJECT, sceneId, ExtractionStrategy.SEMANTIC);
            service.completion(job.getId()).get(10, TimeUnit.SECONDS);
        }

        // Assert
        Entity mickey = repository.load(PROJECT).requireEntity("entity_mickey");
        assertEquals(List.of("scene-1", "scene-2"), mickey.getAppearances());
        assertEquals(2, mickey.getMentionCount());
        assertEquals("scene-1", mickey.getFirstAppearance());
    }

    @Test
    @DisplayName("Lightweight job records entities only and costs nothing")
    void testLightweightJob() throws Exception {
        // Arrange
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));

        // Act
        ExtractionJob job = service.submit(PROJECT, "scene-1", ExtractionStrategy.LIGHTWEIGHT);
        ExtractionJob done = service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(JobStatus.COMPLETED, done.getStatus());
        assertEquals(0, done.getRelationshipsExtracted());
        assertEquals(0, BigDecimal.ZERO.compareTo(done.getCost()));
        assertNull(done.getModelName());
        assertEquals(0, repository.load(PROJECT).relationshipCount());
        assertEquals(0, llm.entityCalls());
    }

    @Test
    @DisplayName("Unknown scene fails the job and counts a failed extraction")
    void testMissingScene() throws Exception {
        // Act
        ExtractionJob job = service.submit(PROJECT, "scene-404", ExtractionStrategy.SEMANTIC);
        ExtractionJob done = service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(JobStatus.FAILED, done.getStatus());
        assertTrue(done.getErrorMessage().contains("scene-404"));
        assertEquals(1, repository.load(PROJECT).metadata().failedExtractions());
        assertEquals(GraphEventType.EXTRACTION_FAILED, events.get(events.size() - 1).type());
    }

    @Test
    @DisplayName("Model failure keeps its kind and leaves the graph unchanged")
    void testModelFailure() throws Exception {
        // Arrange
        service.shutdown();
        service = newService(List.of(new FixedExtractor(CompletableFuture.failedFuture(
            new ExtractionException(ExtractionException.Kind.AUTHENTICATION, "401 Unauthorized")))));
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));

        // Act
        ExtractionJob job = service.submit(PROJECT, "scene-1", ExtractionStrategy.SEMANTIC);
        ExtractionJob done = service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(JobStatus.FAILED, done.getStatus());
        assertEquals(ExtractionException.Kind.AUTHENTICATION, done.getErrorKind());
        assertEquals(0, repository.load(PROJECT).entityCount());
        GraphEvent failed = events.get(events.size() - 1);
        assertEquals("AUTHENTICATION", failed.payload().get("error_kind"));
        assertEquals(false, failed.payload().get("retryable"));
    }

    @Test
    @DisplayName("Extraction exceeding the timeout fails with TIMEOUT")
    void testTimeout() throws Exception {
        // Arrange
        when(config.extraction().timeout()).thenReturn(Duration.ofMillis(200));
        service.shutdown();
        service = newService(List.of(new FixedExtractor(new CompletableFuture<>())));
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));

        // Act
        ExtractionJob job = service.submit(PROJECT, "scene-1", ExtractionStrategy.SEMANTIC);
        ExtractionJob done = service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(JobStatus.FAILED, done.getStatus());
        assertEquals(ExtractionException.Kind.TIMEOUT, done.getErrorKind());
        assertTrue(done.getErrorMessage().startsWith("Extraction timed out"));
        assertEquals(1, repository.load(PROJECT).metadata().failedExtractions());
        assertEquals(true, events.get(events.size() - 1).payload().get("retryable"));
    }

    @Test
    @DisplayName("A cancel arriving while the result is being written is refused and the job completes")
    void testCancelDuringCommit() throws Exception {
        // Arrange
        AtomicReference<Boolean> cancelAccepted = new AtomicReference<>();
        repository = new GraphRepository(new InMemoryGraphDocumentStore() {
            @Override
            public CompletableFuture<Void> write(@NotNull String projectId, @NotNull ObjectNode document) {
                service.listJobs(projectId).forEach(job -> cancelAccepted.compareAndSet(null, service.cancel(job.getId())));
                return super.write(projectId, document);
            }
        });
        service.shutdown();
        service = newService(List.of(new LightweightSceneExtractor(new PatternEntityRecognizer())));
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));

        // Act
        ExtractionJob job = service.submit(PROJECT, "scene-1", ExtractionStrategy.LIGHTWEIGHT);
        ExtractionJob done = service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(Boolean.FALSE, cancelAccepted.get());
        assertEquals(JobStatus.COMPLETED, done.getStatus());
        repository.evict(PROJECT);
        GraphMetadata metadata = repository.load(PROJECT).metadata();
        assertEquals(done.getEntitiesExtracted(), metadata.entityCount());
        assertEquals(1, metadata.successfulExtractions());

        List<GraphEventType> types = events.stream().map(GraphEvent::type).toList();
        assertFalse(types.contains(GraphEventType.EXTRACTION_CANCELLED));
        assertEquals(done.getEntitiesExtracted(), types.stream().filter(t -> t == GraphEventType.ENTITY_ADDED).count());
        assertEquals(GraphEventType.EXTRACTION_COMPLETED, types.get(types.size() - 1));
    }

    @Test
    @DisplayName("A cancel that wins before the commit discards the result and leaves the graph untouched")
    void testCancelBeforeCommit() throws Exception {
        // Arrange
        CompletableFuture<ExtractionResult> pending = new CompletableFuture<>();
        FixedExtractor extractor = new FixedExtractor(pending);
        service.shutdown();
        service = newService(List.of(extractor));
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));
        ExtractionJob job = service.submit(PROJECT, "scene-1", ExtractionStrategy.SEMANTIC);
        assertTrue(extractor.called.await(5, TimeUnit.SECONDS));

        // Act
        assertTrue(job.cancel());
        ExtractionJob done = service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(JobStatus.CANCELLED, done.getStatus());
        assertFalse(job.beginCommit());
        repository.evict(PROJECT);
        assertEquals(0, repository.load(PROJECT).metadata().totalExtractions());
        assertTrue(events.stream().noneMatch(e -> e.type() == GraphEventType.ENTITY_ADDED));
    }

    @Test
    @DisplayName("Concurrent jobs on one project both land in the stored graph")
    void testConcurrentJobsOnOneProject() throws Exception {
        // Arrange
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SceneExtractor perScene = new SceneExtractor() {
            @Override
            @NotNull
            public CompletableFuture<ExtractionResult> extract(@NotNull String text, @NotNull String sceneId,
                                                               @NotNull Collection<Entity> existingEntities) {
                firstEntered.countDown();
                try {
                    if (!release.await(5, TimeUnit.SECONDS)) {
                        return CompletableFuture.failedFuture(new IllegalStateException("never released"));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return CompletableFuture.failedFuture(e);
                }
                Entity entity = sceneId.equals("scene-1")
                    ? StoryFixtures.character("Mickey", sceneId)
                    : StoryFixtures.location("Warehouse", sceneId);
                return CompletableFuture.completedFuture(
                    new ExtractionResult(List.of(entity), List.of(), ExtractionUsage.NONE));
            }

            @Override
            @NotNull
            public ExtractionStrategy getStrategy() {
                return ExtractionStrategy.LIGHTWEIGHT;
            }
        };
        service.shutdown();
        service = newService(List.of(perScene));
        scenes.put(new Scene("scene-1", PROJECT, null, "Mickey waited."));
        scenes.put(new Scene("scene-2", PROJECT, null, "The warehouse was dark."));

        // Act
        ExtractionJob first = service.submit(PROJECT, "scene-1", ExtractionStrategy.LIGHTWEIGHT);
        ExtractionJob second = service.submit(PROJECT, "scene-2", ExtractionStrategy.LIGHTWEIGHT);
        assertTrue(firstEntered.await(5, TimeUnit.SECONDS));
        release.countDown();
        ExtractionJob firstDone = service.completion(first.getId()).get(10, TimeUnit.SECONDS);
        ExtractionJob secondDone = service.completion(second.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(JobStatus.COMPLETED, firstDone.getStatus());
        assertEquals(JobStatus.COMPLETED, secondDone.getStatus());
        repository.evict(PROJECT);
        KnowledgeGraph stored = repository.load(PROJECT);
        assertTrue(stored.getEntity("entity_mickey").isPresent());
        assertTrue(stored.getEntity("entity_warehouse").isPresent());
        assertEquals(2, stored.entityCount());
        assertEquals(2, stored.metadata().successfulExtractions());
        assertEquals(0, stored.metadata().failedExtractions());
    }

    @Test
    @DisplayName("Cancelling a running job discards it without touching the graph")
    void testCancelRunningJob() throws Exception {
        // Arrange
        CompletableFuture<ExtractionResult> hanging = new CompletableFuture<>();
        FixedExtractor extractor = new FixedExtractor(hanging);
        service.shutdown();
        service = newService(List.of(extractor));
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));
        ExtractionJob job = service.submit(PROJECT, "scene-1", ExtractionStrategy.SEMANTIC);
        assertTrue(extractor.called.await(5, TimeUnit.SECONDS));
        assertEquals(JobStatus.RUNNING, job.getStatus());

        // Act
        boolean cancelled = service.cancel(job.getId());
        ExtractionJob done = service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertTrue(cancelled);
        assertEquals(JobStatus.CANCELLED, done.getStatus());
        assertTrue(hanging.isCancelled());
        assertFalse(service.cancel(job.getId()), "terminal jobs cannot be cancelled again");
        assertEquals(0, repository.load(PROJECT).metadata().totalExtractions());
        assertTrue(events.stream().anyMatch(e -> e.type() == GraphEventType.EXTRACTION_CANCELLED));
    }

    @Test
    @DisplayName("Batch over the cap without confirmation queues nothing and reports the estimate")
    void testBatchCapAndCostGate() {
        // Arrange
        String text = ScriptedLLM.MICKEY_SCENE.repeat(30);
        for (int i = 1; i <= 600; i++) {
            scenes.put(new Scene("scene-" + i, PROJECT, null, text));
        }

        // Act
        BatchExtractionResponse response = service.submitBatch(
            BatchExtractionRequest.allScenes(PROJECT, ExtractionStrategy.SEMANTIC, false));

        // Assert
        assertEquals(BatchExtractionResponse.Outcome.CONFIRMATION_REQUIRED, response.outcome());
        assertTrue(response.requiresConfirmation());
        assertTrue(response.jobs().isEmpty());
        assertEquals(100, response.skippedSceneIds().size());
        assertEquals("scene-501", response.skippedSceneIds().get(0));
        CostEstimate estimate = response.costEstimate();
        assertNotNull(estimate);
        assertEquals(500, estimate.sceneCount());
        assertTrue(estimate.estimatedCost().compareTo(estimate.threshold()) > 0);
        assertEquals(500L * 1500, estimate.estimatedOutputTokens());
        assertTrue(service.listJobs(PROJECT).isEmpty());
    }

    @Test
    @DisplayName("Confirmed batch queues one job per scene")
    void testConfirmedBatch() throws Exception {
        // Arrange
        when(config.batch().costConfirmationThreshold()).thenReturn(BigDecimal.ZERO);
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));
        scenes.put(new Scene("scene-2", PROJECT, null, ScriptedLLM.MICKEY_SCENE));

        // Act
        BatchExtractionResponse unconfirmed = service.submitBatch(
            BatchExtractionRequest.allScenes(PROJECT, ExtractionStrategy.SEMANTIC, false));
        BatchExtractionResponse confirmed = service.submitBatch(
            BatchExtractionRequest.allScenes(PROJECT, ExtractionStrategy.SEMANTIC, true));
        for (ExtractionJob job : confirmed.jobs()) {
            service.completion(job.getId()).get(10, TimeUnit.SECONDS);
        }

        // Assert
        assertEquals(BatchExtractionResponse.Outcome.CONFIRMATION_REQUIRED, unconfirmed.outcome());
        assertEquals(BatchExtractionResponse.Outcome.SUBMITTED, confirmed.outcome());
        assertEquals(2, confirmed.jobs().size());
        assertTrue(confirmed.skippedSceneIds().isEmpty());
        assertEquals(2, service.listJobs(PROJECT).size());
        assertTrue(service.listJobs(PROJECT).stream().allMatch(j -> j.getStatus() == JobStatus.COMPLETED));
        assertEquals(3, repository.load(PROJECT).entityCount());
    }

    @Test
    @DisplayName("Free strategy never asks for confirmation")
    void testFreeBatch() throws Exception {
        // Arrange
        when(config.batch().costConfirmationThreshold()).thenReturn(BigDecimal.ZERO);
        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));

        // Act
        BatchExtractionResponse response = service.submitBatch(
            new BatchExtractionRequest(PROJECT, ExtractionStrategy.LIGHTWEIGHT, List.of("scene-1"), false));
        service.completion(response.jobs().get(0).getId()).get(10, TimeUnit.SECONDS);

        // Assert
        assertEquals(BatchExtractionResponse.Outcome.SUBMITTED, response.outcome());
        assertFalse(response.costEstimate().requiresConfirmation());
        assertEquals(0, BigDecimal.ZERO.compareTo(response.costEstimate().estimatedCost()));
    }

    @Test
    @DisplayName("Batch over an empty project or unknown scene ids")
    void testBatchEdgeCases() {
        BatchExtractionResponse empty = service.submitBatch(
            BatchExtractionRequest.allScenes(PROJECT, ExtractionStrategy.SEMANTIC, false));
        assertEquals(BatchExtractionResponse.Outcome.NO_SCENES, empty.outcome());

        scenes.put(new Scene("scene-1", PROJECT, null, ScriptedLLM.MICKEY_SCENE));
        assertThrows(IllegalArgumentException.class, () -> service.submitBatch(
            new BatchExtractionRequest(PROJECT, ExtractionStrategy.SEMANTIC, List.of("scene-1", "scene-9"), true)));
    }

    @Test
    @DisplayName("estimateCost caps at the batch limit and scales with scene text")
    void testEstimateCost() {
        // Arrange
        scenes.put(new Scene("scene-1", PROJECT, null, "Short."));
        CostEstimate small = service.estimateCost(PROJECT, ExtractionStrategy.SEMANTIC);
        scenes.put(new Scene("scene-2", PROJECT, null, ScriptedLLM.MICKEY_SCENE.repeat(50)));

        // Act
        CostEstimate larger = service.estimateCost(PROJECT, ExtractionStrategy.HYBRID);

        // Assert
        assertEquals(1, small.sceneCount());
        assertEquals(2, larger.sceneCount());
        assertTrue(larger.estimatedInputTokens() > 2 * small.estimatedInputTokens());
        assertEquals(0, BigDecimal.ZERO.compareTo(
            service.estimateCost(PROJECT, ExtractionStrategy.LIGHTWEIGHT).estimatedCost()));
    }

    @Test
    @DisplayName("Unregistered strategy is rejected at submission")
    void testUnregisteredStrategy() {
        assertThrows(IllegalArgumentException.class,
            () -> service.submit(PROJECT, "scene-1", ExtractionStrategy.HYBRID));
    }

    @Test
    @DisplayName("purgeFinished forgets terminal jobs")
    void testPurgeFinished() throws Exception {
        ExtractionJob job = service.submit(PROJECT, "scene-404", ExtractionStrategy.LIGHTWEIGHT);
        service.completion(job.getId()).get(10, TimeUnit.SECONDS);

        assertEquals(1, service.purgeFinished(PROJECT));
        assertTrue(service.getJob(job.getId()).isEmpty());
        assertThrows(Exception.class, () -> service.completion(job.getId()).get(1, TimeUnit.SECONDS));
    }

    private ExtractionJobService newService(List<SceneExtractor> extractors) {
        return new ExtractionJobService(new SceneExtractorRegistry(extractors), repository,
            new ProjectLockManager(Duration.ofSeconds(5)), notifier, scenes, config,
            Executors.newFixedThreadPool(2));
    }

    /**
     * Semantic-strategy extractor that always hands back the same future.
     */
    private static final class FixedExtractor implements SceneExtractor {

        private final CompletableFuture<ExtractionResult> result;
        private final CountDownLatch called = new CountDownLatch(1);

        FixedExtractor(CompletableFuture<ExtractionResult> result) {
            this.result = result;
        }

        @Override
        @NotNull
        public CompletableFuture<ExtractionResult> extract(@NotNull String text, @NotNull String sceneId,
                                                           @NotNull Collection<Entity> existingEntities) {
            called.countDown();
            return result;
        }

        @Override
        @NotNull
        public ExtractionStrategy getStrategy() {
            return ExtractionStrategy.SEMANTIC;
        }
    }
}
