package br.edu.ifba.storygraph.extraction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the {@link SceneExtractor} for an {@link ExtractionStrategy}.
 *
 * <p>Uses CDI to discover all available SceneExtractor implementations.</p>
 */
@ApplicationScoped
public class SceneExtractorRegistry {

    private final Map<ExtractionStrategy, SceneExtractor> extractors;

    /**
     * Default constructor for CDI proxy.
     */
    public SceneExtractorRegistry() {
        this.extractors = new EnumMap<>(ExtractionStrategy.class);
    }

    @Inject
    public SceneExtractorRegistry(Instance<SceneExtractor> extractorInstances) {
        this(extractorInstances.stream().toList());
    }

    public SceneExtractorRegistry(Iterable<? extends SceneExtractor> extractorInstances) {
        this.extractors = new EnumMap<>(ExtractionStrategy.class);
        for (SceneExtractor extractor : extractorInstances) {
            extractors.put(extractor.getStrategy(), extractor);
        }
    }

    /**
     * @throws IllegalArgumentException if no extractor is registered for the strategy
     */
    @NotNull
    public SceneExtractor get(@NotNull ExtractionStrategy strategy) {
        SceneExtractor extractor = extractors.get(strategy);
        if (extractor == null) {
            throw new IllegalArgumentException(
                "No extractor registered for strategy: " + strategy +
                ". Available strategies: " + extractors.keySet());
        }
        return extractor;
    }

    public boolean has(@NotNull ExtractionStrategy strategy) {
        return extractors.containsKey(strategy);
    }

    @NotNull
    public Set<ExtractionStrategy> available() {
        return extractors.keySet();
    }
}
