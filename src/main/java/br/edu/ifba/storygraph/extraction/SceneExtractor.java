package br.edu.ifba.storygraph.extraction;

import br.edu.ifba.storygraph.core.Entity;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;

/**
 * Turns the text of one scene into entities and relationships.
 *
 * <h2>Contract:</h2>
 * <ul>
 *   <li>Empty or blank text completes with an empty result without calling any model</li>
 *   <li>Unparseable model output completes with an empty result</li>
 *   <li>Model call failures complete the future exceptionally with an
 *       {@link br.edu.ifba.storygraph.exception.ExtractionException}</li>
 *   <li>Every returned entity is seen in {@code sceneId}; every returned relationship links
 *       two returned entities</li>
 * </ul>
 *
 * @see SceneExtractorRegistry
 */
public interface SceneExtractor {

    /**
     * @param text scene prose
     * @param sceneId scene reference recorded on every extracted item
     * @param existingEntities entities already in the project graph, used as coreference hints
     */
    @NotNull
    CompletableFuture<ExtractionResult> extract(
        @NotNull String text,
        @NotNull String sceneId,
        @NotNull Collection<Entity> existingEntities
    );

    @NotNull
    ExtractionStrategy getStrategy();

    /**
     * Model identifier recorded on jobs, or null when no model is involved.
     */
    @Nullable
    default String getModelName() {
        return null;
    }
}
