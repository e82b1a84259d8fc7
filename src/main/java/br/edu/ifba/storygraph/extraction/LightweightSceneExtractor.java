package br.edu.ifba.storygraph.extraction;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.EntityIds;
import br.edu.ifba.storygraph.core.EntityType;
import br.edu.ifba.storygraph.extraction.ner.EntityRecognizer;
import br.edu.ifba.storygraph.extraction.ner.RecognizedEntity;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named-entity recognition without any model call. Produces entities only; relationships are
 * always empty.
 *
 * <p>Recognition runs on the extractor's own pool, so callers can bound it with a timeout or
 * stop waiting on it.</p>
 *
 * <p>Recognizer labels map onto entity types as follows; other labels are dropped.</p>
 * <ul>
 *   <li>PERSON, PER - character</li>
 *   <li>GPE, LOC, LOCATION, FAC - location</li>
 *   <li>ORG, ORGANIZATION - organization</li>
 *   <li>EVENT - event</li>
 *   <li>PRODUCT, WORK_OF_ART - object</li>
 * </ul>
 */
@ApplicationScoped
public class LightweightSceneExtractor implements SceneExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LightweightSceneExtractor.class);

    /** Confidence assigned to recognizer entities. */
    public static final double ENTITY_CONFIDENCE = 0.7;

    private static final Map<String, EntityType> LABELS = Map.ofEntries(
        Map.entry("PERSON", EntityType.CHARACTER),
        Map.entry("PER", EntityType.CHARACTER),
        Map.entry("GPE", EntityType.LOCATION),
        Map.entry("LOC", EntityType.LOCATION),
        Map.entry("LOCATION", EntityType.LOCATION),
        Map.entry("FAC", EntityType.LOCATION),
        Map.entry("ORG", EntityType.ORGANIZATION),
        Map.entry("ORGANIZATION", EntityType.ORGANIZATION),
        Map.entry("EVENT", EntityType.EVENT),
        Map.entry("PRODUCT", EntityType.OBJECT),
        Map.entry("WORK_OF_ART", EntityType.OBJECT)
    );

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ThreadFactory THREAD_FACTORY = task -> {
        Thread thread = new Thread(task, "storygraph-ner-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };

    private EntityRecognizer recognizer;
    private ExecutorService executor;

    /**
     * Default constructor for CDI proxy.
     */
    protected LightweightSceneExtractor() {
    }

    @Inject
    public LightweightSceneExtractor(EntityRecognizer recognizer) {
        this(recognizer, Executors.newCachedThreadPool(THREAD_FACTORY));
    }

    public LightweightSceneExtractor(@NotNull EntityRecognizer recognizer, @NotNull ExecutorService executor) {
        this.recognizer = recognizer;
        this.executor = executor;
    }

    @Override
    @NotNull
    public CompletableFuture<ExtractionResult> extract(@NotNull String text, @NotNull String sceneId,
                                                       @NotNull Collection<Entity> existingEntities) {
        if (text.isBlank()) {
            return CompletableFuture.completedFuture(ExtractionResult.empty());
        }

        try {
            return CompletableFuture.supplyAsync(() -> recognize(text, sceneId), executor);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ExtractionResult recognize(String text, String sceneId) {
        Map<String, Entity> entities = new LinkedHashMap<>();
        for (RecognizedEntity mention : recognizer.recognize(text)) {
            Optional<EntityType> type = mapLabel(mention.label());
            String name = mention.text().trim();
            if (type.isEmpty() || EntityIds.normalize(name).isEmpty()) {
                continue;
            }
            String id = EntityIds.fromName(name);
            if (entities.containsKey(id)) {
                continue;
            }
            entities.put(id, Entity.builder()
                .id(id)
                .name(name)
                .type(type.get())
                .description(mention.sentence().trim())
                .confidence(ENTITY_CONFIDENCE)
                .seenIn(sceneId)
                .build());
        }

        logger.info("Recognized {} entities in scene {} with {} recognizer",
            entities.size(), sceneId, recognizer.getName());
        return new ExtractionResult(new ArrayList<>(entities.values()), List.of(), ExtractionUsage.NONE);
    }

    @Override
    @NotNull
    public ExtractionStrategy getStrategy() {
        return ExtractionStrategy.LIGHTWEIGHT;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    @NotNull
    static Optional<EntityType> mapLabel(@NotNull String label) {
        return Optional.ofNullable(LABELS.get(label.toUpperCase(Locale.ROOT)));
    }
}
