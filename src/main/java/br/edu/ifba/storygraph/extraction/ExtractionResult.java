package br.edu.ifba.storygraph.extraction;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.Relationship;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Entities and relationships extracted from one scene, with the tokens spent on them.
 */
public record ExtractionResult(
    @NotNull List<Entity> entities,
    @NotNull List<Relationship> relationships,
    @NotNull ExtractionUsage usage
) {
    public ExtractionResult {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
        usage = usage != null ? usage : ExtractionUsage.NONE;
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of(), ExtractionUsage.NONE);
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }
}
