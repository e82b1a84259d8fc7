package br.edu.ifba.storygraph.extraction;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.EntityType;
import br.edu.ifba.storygraph.core.RelationType;
import br.edu.ifba.storygraph.utils.TokenUtil;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompts for narrative entity and relationship extraction.
 *
 * <p>Both prompts ask for a bare JSON array so that {@link ExtractionResponseParser} can recover
 * the payload even when the model wraps it in prose or markdown fences.</p>
 */
public final class ExtractionPrompts {

    public static final String SYSTEM_PROMPT =
        "You are a meticulous literary analyst who builds knowledge graphs of fiction. " +
        "You answer with JSON only.";

    /** Tokens kept per known-entity description in the entity prompt. */
    static final int KNOWN_ENTITY_DESCRIPTION_TOKENS = 25;

    private static final String ENTITY_TEMPLATE = """
        Extract ALL entities from this scene. For each entity found:

        1. Identify the entity name
        2. Classify the type: %s
        3. Write a brief description (1-2 sentences)
        4. List any alternative names or aliases
        5. Extract key attributes (traits, properties, characteristics)
        %s
        Scene text:
        %s

        Return ONLY a valid JSON array with this exact structure:
        [
          {
            "name": "Entity Name",
            "type": "%s",
            "description": "Brief description",
            "aliases": ["alternative name 1", "alternative name 2"],
            "attributes": {
              "trait1": "value1",
              "trait2": "value2"
            }
          }
        ]

        Be thorough. Extract ALL meaningful entities, including:
        - All characters mentioned (even minor ones)
        - All locations (specific places, cities, buildings, rooms)
        - Important objects (weapons, devices, artifacts)
        - Concepts and themes discussed
        - Events that occur
        - Organizations or groups mentioned
        """;

    private static final String RELATIONSHIP_TEMPLATE = """
        Identify ALL relationships between entities in this scene.

        Entities found:
        %s

        Available relationship types:
        %s

        Scene text:
        %s

        For each relationship:
        1. Identify source entity (must be from the entities list)
        2. Identify target entity (must be from the entities list)
        3. Choose appropriate relationship type from the available types
        4. Provide context/evidence from the scene
        5. Estimate relationship strength (0.0 to 1.0)
        6. Estimate emotional valence (-1.0 negative to 1.0 positive)

        Return ONLY a valid JSON array:
        [
          {
            "source": "Entity 1 Name",
            "target": "Entity 2 Name",
            "relation": "relationship_type",
            "context": "Evidence from scene showing this relationship",
            "strength": 0.8,
            "valence": 0.5
          }
        ]

        Be thorough. Extract ALL relationships shown or implied in the scene.
        """;

    private ExtractionPrompts() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Entity prompt with up to {@code knownEntityLimit} known entities as coreference hints.
     */
    @NotNull
    public static String entityPrompt(@NotNull String sceneText, @NotNull Collection<Entity> knownEntities,
                                      int knownEntityLimit) {
        String context = "";
        if (!knownEntities.isEmpty() && knownEntityLimit > 0) {
            String entityList = knownEntities.stream()
                .limit(knownEntityLimit)
                .map(e -> "- " + e.getName() + " (" + e.getType().getValue() + "): " +
                    TokenUtil.truncateToTokenLimit(e.getDescription(), KNOWN_ENTITY_DESCRIPTION_TOKENS))
                .collect(Collectors.joining("\n"));
            context = "\nKnown entities from previous scenes:\n" + entityList + "\n";
        }

        return String.format(ENTITY_TEMPLATE, entityTypes(", "), context, sceneText, entityTypes("|"));
    }

    /**
     * Relationship prompt restricted to the entities found in the scene.
     */
    @NotNull
    public static String relationshipPrompt(@NotNull String sceneText, @NotNull List<Entity> sceneEntities) {
        String entityList = sceneEntities.stream()
            .map(e -> "- " + e.getName() + " (" + e.getType().getValue() + ")")
            .collect(Collectors.joining("\n"));
        return String.format(RELATIONSHIP_TEMPLATE, entityList, RelationType.valuesAsList(), sceneText);
    }

    private static String entityTypes(String separator) {
        return Arrays.stream(EntityType.values()).map(EntityType::getValue).collect(Collectors.joining(separator));
    }
}
