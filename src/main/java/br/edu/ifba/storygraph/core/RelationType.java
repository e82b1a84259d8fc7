package br.edu.ifba.storygraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed set of relationship types, grouped by category.
 */
public enum RelationType {
    // Social
    KNOWS("knows", Category.SOCIAL),
    RELATED_TO("related_to", Category.SOCIAL),
    CONFLICTS_WITH("conflicts_with", Category.SOCIAL),
    LOVES("loves", Category.SOCIAL),
    FEARS("fears", Category.SOCIAL),
    WORKS_WITH("works_with", Category.SOCIAL),
    LEADS("leads", Category.SOCIAL),
    FOLLOWS("follows", Category.SOCIAL),

    // Spatial
    LOCATED_IN("located_in", Category.SPATIAL),
    TRAVELS_TO("travels_to", Category.SPATIAL),
    OWNS("owns", Category.SPATIAL),
    RESIDES_IN("resides_in", Category.SPATIAL),

    // Temporal / causal
    OCCURS_BEFORE("occurs_before", Category.TEMPORAL),
    OCCURS_DURING("occurs_during", Category.TEMPORAL),
    OCCURS_AFTER("occurs_after", Category.TEMPORAL),
    CAUSES("causes", Category.CAUSAL),
    RESULTS_IN("results_in", Category.CAUSAL),

    // Conceptual
    REPRESENTS("represents", Category.CONCEPTUAL),
    SYMBOLIZES("symbolizes", Category.CONCEPTUAL),
    RELATES_TO("relates_to", Category.CONCEPTUAL),
    OPPOSES("opposes", Category.CONCEPTUAL),
    SUPPORTS("supports", Category.CONCEPTUAL),

    // Event
    PARTICIPATES_IN("participates_in", Category.EVENT),
    WITNESSES("witnesses", Category.EVENT),
    TRIGGERS("triggers", Category.EVENT),

    // Organizational
    MEMBER_OF("member_of", Category.ORGANIZATIONAL),
    FOUNDED_BY("founded_by", Category.ORGANIZATIONAL),
    CONTROLS("controls", Category.ORGANIZATIONAL);

    public enum Category {
        SOCIAL, SPATIAL, TEMPORAL, CAUSAL, CONCEPTUAL, EVENT, ORGANIZATIONAL
    }

    private final String value;
    private final Category category;

    RelationType(String value, Category category) {
        this.value = value;
        this.category = category;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Category getCategory() {
        return category;
    }

    @JsonCreator
    public static RelationType fromValue(@NotNull String value) {
        return parse(value).orElseThrow(() ->
            new IllegalArgumentException("Unknown relation type: " + value));
    }

    public static Optional<RelationType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (RelationType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Wire values as a comma separated list, for prompts.
     */
    public static String valuesAsList() {
        return Arrays.stream(values()).map(RelationType::getValue).collect(Collectors.joining(", "));
    }

    public static List<RelationType> ofCategory(@NotNull Category category) {
        return Arrays.stream(values()).filter(t -> t.category == category).collect(Collectors.toList());
    }
}
