package br.edu.ifba.storygraph.extraction;

import br.edu.ifba.storygraph.core.Entity;
import br.edu.ifba.storygraph.core.EntityIds;
import br.edu.ifba.storygraph.core.EntityType;
import br.edu.ifba.storygraph.core.RelationType;
import br.edu.ifba.storygraph.core.Relationship;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses model output into entities and relationships.
 *
 * <p>The JSON array is located anywhere in the response, so markdown fences and surrounding
 * prose are tolerated. A response without a parseable array yields an empty list. Individual
 * items with a missing name, unknown type or unknown endpoint are skipped.</p>
 */
public class ExtractionResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionResponseParser.class);

    private static final Pattern JSON_ARRAY = Pattern.compile("\\[[\\s\\S]*\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Confidence assigned to model-extracted entities. */
    public static final double ENTITY_CONFIDENCE = 0.9;

    /** Confidence assigned to model-extracted relationships. */
    public static final double RELATIONSHIP_CONFIDENCE = 0.85;

    static final int MAX_NAME_LENGTH = 500;

    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ExtractionResponseParser() {
        this(new ObjectMapper());
    }

    public ExtractionResponseParser(@NotNull ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the entity array of a response. Entities with the same id are merged.
     */
    @NotNull
    public List<Entity> parseEntities(@Nullable String response, @NotNull String sceneId) {
        Optional<JsonNode> array = readArray(response, "entities", sceneId);
        if (array.isEmpty()) {
            return List.of();
        }

        Map<String, Entity> entities = new LinkedHashMap<>();
        for (JsonNode item : array.get()) {
            if (!item.isObject()) {
                logger.warn("Skipping non-object entity item in scene {}: {}", sceneId, item);
                continue;
            }

            String name = normalizeEntityName(text(item, "name"));
            if (name == null || name.isEmpty() || EntityIds.normalize(name).isEmpty()) {
                logger.warn("Skipping entity without a usable name in scene {}: {}", sceneId, item);
                continue;
            }

            Optional<EntityType> type = EntityType.parse(text(item, "type"));
            if (type.isEmpty()) {
                logger.warn("Skipping entity {} with unknown type '{}' in scene {}", name, text(item, "type"), sceneId);
                continue;
            }

            try {
                Entity.Builder builder = Entity.builder()
                    .name(name)
                    .type(type.get())
                    .description(text(item, "description"))
                    .confidence(ENTITY_CONFIDENCE)
                    .seenIn(sceneId);

                JsonNode aliases = item.get("aliases");
                if (aliases != null && aliases.isArray()) {
                    for (JsonNode alias : aliases) {
                        String value = normalizeEntityName(alias.asText(null));
                        if (value != null && !value.isEmpty() && !value.equalsIgnoreCase(name)) {
                            builder.alias(value);
                        }
                    }
                }

                JsonNode attributes = item.get("attributes");
                if (attributes != null && attributes.isObject()) {
                    builder.attributes(objectMapper.convertValue(attributes, ATTRIBUTES_TYPE));
                }

                Entity entity = builder.build();
                Entity existing = entities.get(entity.getId());
                entities.put(entity.getId(), existing == null ? entity : existing.mergeWith(entity, entity.getUpdatedAt()));
            } catch (IllegalArgumentException e) {
                logger.warn("Failed to create entity from {} in scene {}: {}", item, sceneId, e.getMessage());
            }
        }

        logger.debug("Parsed {} entities from scene {}", entities.size(), sceneId);
        return new ArrayList<>(entities.values());
    }

    /**
     * Parses the relationship array of a response. Endpoints are resolved against
     * {@code sceneEntities} by name, alias or derived id; unresolved endpoints skip the item.
     */
    @NotNull
    public List<Relationship> parseRelationships(@Nullable String response, @NotNull String sceneId,
                                                 @NotNull List<Entity> sceneEntities) {
        Optional<JsonNode> array = readArray(response, "relationships", sceneId);
        if (array.isEmpty()) {
            return List.of();
        }

        Map<String, String> idsByName = new HashMap<>();
        for (Entity entity : sceneEntities) {
            idsByName.put(entity.getId(), entity.getId());
            idsByName.putIfAbsent(entity.getName().toLowerCase(Locale.ROOT), entity.getId());
            for (String alias : entity.getAliases()) {
                idsByName.putIfAbsent(alias.toLowerCase(Locale.ROOT), entity.getId());
            }
        }

        Map<Relationship.Key, Relationship> relationships = new LinkedHashMap<>();
        for (JsonNode item : array.get()) {
            if (!item.isObject()) {
                continue;
            }

            String sourceId = resolve(idsByName, text(item, "source"));
            String targetId = resolve(idsByName, text(item, "target"));
            if (sourceId == null || targetId == null) {
                logger.warn("Relationship references unknown entity: {} or {} (scene {})",
                    text(item, "source"), text(item, "target"), sceneId);
                continue;
            }

            Optional<RelationType> type = RelationType.parse(text(item, "relation"));
            if (type.isEmpty()) {
                logger.warn("Skipping relationship with unknown type '{}' in scene {}", text(item, "relation"), sceneId);
                continue;
            }

            try {
                Relationship.Builder builder = Relationship.builder()
                    .source(sourceId)
                    .target(targetId)
                    .relationType(type.get())
                    .strength(clamp(number(item, "strength", 1.0), 0.0, 1.0))
                    .valence(clamp(number(item, "valence", 0.0), -1.0, 1.0))
                    .confidence(RELATIONSHIP_CONFIDENCE)
                    .seenIn(sceneId)
                    .endScene(sceneId);

                JsonNode context = item.get("context");
                if (context != null && context.isArray()) {
                    for (JsonNode snippet : context) {
                        if (!snippet.asText("").isBlank()) {
                            builder.evidence(snippet.asText());
                        }
                    }
                } else {
                    String snippet = text(item, "context");
                    if (snippet != null && !snippet.isBlank()) {
                        builder.evidence(snippet);
                        builder.description(snippet);
                    }
                }
                String description = text(item, "description");
                if (description != null && !description.isBlank()) {
                    builder.description(description);
                }

                Relationship relationship = builder.build();
                Relationship existing = relationships.get(relationship.key());
                relationships.put(relationship.key(), existing == null
                    ? relationship
                    : existing.mergeWith(relationship, relationship.getUpdatedAt()));
            } catch (IllegalArgumentException e) {
                logger.warn("Failed to create relationship from {} in scene {}: {}", item, sceneId, e.getMessage());
            }
        }

        logger.debug("Parsed {} relationships from scene {}", relationships.size(), sceneId);
        return new ArrayList<>(relationships.values());
    }

    /**
     * Locates the outermost JSON array in a model response.
     */
    @NotNull
    public static Optional<String> extractJsonArray(@Nullable String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = JSON_ARRAY.matcher(response);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    /**
     * Normalizes an entity name from model output.
     *
     * <ol>
     *   <li>Remove surrounding quotes (single and double)</li>
     *   <li>Trim leading/trailing whitespace</li>
     *   <li>Collapse multiple internal spaces to single space</li>
     *   <li>Truncate to 500 characters</li>
     * </ol>
     */
    @Nullable
    static String normalizeEntityName(@Nullable String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }

        String normalized = name.trim();
        if (normalized.length() >= 2 &&
            ((normalized.startsWith("\"") && normalized.endsWith("\"")) ||
             (normalized.startsWith("'") && normalized.endsWith("'")))) {
            normalized = normalized.substring(1, normalized.length() - 1);
        }
        normalized = WHITESPACE.matcher(normalized.trim()).replaceAll(" ");

        if (normalized.length() > MAX_NAME_LENGTH) {
            normalized = normalized.substring(0, MAX_NAME_LENGTH);
        }
        return normalized;
    }

    private Optional<JsonNode> readArray(@Nullable String response, String what, String sceneId) {
        Optional<String> json = extractJsonArray(response);
        if (json.isEmpty()) {
            logger.error("No JSON array found in {} extraction output for scene {}", what, sceneId);
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(json.get());
            return node != null && node.isArray() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            logger.error("Unparseable {} extraction output for scene {}: {}", what, sceneId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Nullable
    private static String resolve(Map<String, String> idsByName, @Nullable String name) {
        String normalized = normalizeEntityName(name);
        if (normalized == null || normalized.isEmpty()) {
            return null;
        }
        String id = idsByName.get(normalized.toLowerCase(Locale.ROOT));
        return id != null ? id : idsByName.get(EntityIds.fromName(normalized));
    }

    @Nullable
    private static String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static double number(JsonNode item, String field, double defaultValue) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
