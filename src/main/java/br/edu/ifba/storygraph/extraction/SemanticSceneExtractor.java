package br.edu.ifba.storygraph.extraction;

import br.edu.ifba.storygraph.config.StoryGraphConfig;
import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.Relationship;
import br.edu.ifba.storygraph.llm.LLMFunction;
import br.edu.ifba.storygraph.utils.TokenUtil;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Language-model extraction in two calls: entities first, then relationships among the
 * entities found. The relationship call is skipped when fewer than two entities were found.
 */
@ApplicationScoped
public class SemanticSceneExtractor implements SceneExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SemanticSceneExtractor.class);

    static final double TEMPERATURE = 0.3;
    static final int ENTITY_MAX_TOKENS = 4000;
    static final int RELATIONSHIP_MAX_TOKENS = 3000;

    private LLMFunction llmFunction;
    private ExtractionResponseParser parser;
    private String modelName;
    private int knownEntityLimit;

    /**
     * Default constructor for CDI proxy.
     */
    protected SemanticSceneExtractor() {
    }

    @Inject
    public SemanticSceneExtractor(LLMFunction llmFunction, StoryGraphConfig config) {
        this(llmFunction, new ExtractionResponseParser(), config.extraction().model(),
            config.extraction().knownEntityLimit());
    }

    public SemanticSceneExtractor(@NotNull LLMFunction llmFunction, @NotNull ExtractionResponseParser parser,
                                  @NotNull String modelName, int knownEntityLimit) {
        this.llmFunction = llmFunction;
        this.parser = parser;
        this.modelName = modelName;
        this.knownEntityLimit = knownEntityLimit;
    }

    @Override
    @NotNull
    public CompletableFuture<ExtractionResult> extract(@NotNull String text, @NotNull String sceneId,
                                                       @NotNull Collection<Entity> existingEntities) {
        if (text.isBlank()) {
            logger.debug("Scene {} is empty, skipping semantic extraction", sceneId);
            return CompletableFuture.completedFuture(ExtractionResult.empty());
        }

        String entityPrompt = ExtractionPrompts.entityPrompt(text, existingEntities, knownEntityLimit);

        return llmFunction.apply(entityPrompt, ExtractionPrompts.SYSTEM_PROMPT, kwargs(ENTITY_MAX_TOKENS))
            .thenCompose(entityResponse -> {
                ExtractionUsage entityUsage = usage(entityPrompt, entityResponse);
                List<Entity> entities = parser.parseEntities(entityResponse, sceneId);
                logger.info("Extracted {} entities from scene {}", entities.size(), sceneId);

                if (entities.size() < 2) {
                    return CompletableFuture.completedFuture(
                        new ExtractionResult(entities, List.of(), entityUsage));
                }

                String relationshipPrompt = ExtractionPrompts.relationshipPrompt(text, entities);
                return llmFunction.apply(relationshipPrompt, ExtractionPrompts.SYSTEM_PROMPT,
                        kwargs(RELATIONSHIP_MAX_TOKENS))
                    .thenApply(relationshipResponse -> {
                        List<Relationship> relationships =
                            parser.parseRelationships(relationshipResponse, sceneId, entities);
                        logger.info("Extracted {} relationships from scene {}", relationships.size(), sceneId);
                        return new ExtractionResult(entities, relationships,
                            entityUsage.plus(usage(relationshipPrompt, relationshipResponse)));
                    });
            });
    }

    @Override
    @NotNull
    public ExtractionStrategy getStrategy() {
        return ExtractionStrategy.SEMANTIC;
    }

    @Override
    @NotNull
    public String getModelName() {
        return modelName;
    }

    private Map<String, Object> kwargs(int maxTokens) {
        return Map.of("model", modelName, "temperature", TEMPERATURE, "max_tokens", maxTokens);
    }

    private static ExtractionUsage usage(String prompt, String response) {
        int promptTokens = TokenUtil.estimateTokens(ExtractionPrompts.SYSTEM_PROMPT) + TokenUtil.estimateTokens(prompt);
        return new ExtractionUsage(promptTokens, TokenUtil.estimateTokensSafe(response), 1);
    }
}
