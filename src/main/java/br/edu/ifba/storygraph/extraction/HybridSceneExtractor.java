package br.edu.ifba.storygraph.extraction;

import br.edu.ifba.storygraph.core.Entity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Runs semantic and lightweight extraction on the same scene and combines them.
 *
 * <p>Entities are deduplicated by id: the semantic record wins and gains the aliases the
 * recognizer saw. Recognizer-only entities are kept. Relationships and usage come from the
 * semantic run.</p>
 */
@ApplicationScoped
public class HybridSceneExtractor implements SceneExtractor {

    private static final Logger logger = LoggerFactory.getLogger(HybridSceneExtractor.class);

    private SemanticSceneExtractor semantic;
    private LightweightSceneExtractor lightweight;

    /**
     * Default constructor for CDI proxy.
     */
    protected HybridSceneExtractor() {
    }

    @Inject
    public HybridSceneExtractor(SemanticSceneExtractor semantic, LightweightSceneExtractor lightweight) {
        this.semantic = semantic;
        this.lightweight = lightweight;
    }

    @Override
    @NotNull
    public CompletableFuture<ExtractionResult> extract(@NotNull String text, @NotNull String sceneId,
                                                       @NotNull Collection<Entity> existingEntities) {
        if (text.isBlank()) {
            return CompletableFuture.completedFuture(ExtractionResult.empty());
        }

        CompletableFuture<ExtractionResult> llmCall = semantic.extract(text, sceneId, existingEntities);
        CompletableFuture<ExtractionResult> nerCall = lightweight.extract(text, sceneId, existingEntities);
        CompletableFuture<ExtractionResult> combined = llmCall.thenCombine(nerCall, (llm, ner) -> {
            Map<String, Entity> merged = new LinkedHashMap<>();
            for (Entity entity : llm.entities()) {
                merged.put(entity.getId(), entity);
            }
            int added = 0;
            for (Entity entity : ner.entities()) {
                Entity existing = merged.get(entity.getId());
                if (existing == null) {
                    merged.put(entity.getId(), entity);
                    added++;
                } else {
                    Set<String> aliases = new LinkedHashSet<>(existing.getAliases());
                    for (String alias : entity.getAliases()) {
                        if (!existing.isKnownAs(alias)) {
                            aliases.add(alias);
                        }
                    }
                    if (!existing.isKnownAs(entity.getName())) {
                        aliases.add(entity.getName());
                    }
                    merged.put(entity.getId(), existing.toBuilder().aliases(aliases).build());
                }
            }
            logger.debug("Hybrid extraction for scene {}: {} semantic entities, {} recognizer-only entities",
                sceneId, llm.entities().size(), added);
            return new ExtractionResult(new ArrayList<>(merged.values()), llm.relationships(), llm.usage());
        });
        // a cancelled or timed out hybrid call stops both halves
        combined.whenComplete((result, error) -> {
            if (combined.isCancelled()) {
                llmCall.cancel(true);
                nerCall.cancel(true);
            }
        });
        return combined;
    }

    @Override
    @NotNull
    public ExtractionStrategy getStrategy() {
        return ExtractionStrategy.HYBRID;
    }

    @Override
    public String getModelName() {
        return semantic.getModelName();
    }
}
