package br.edu.ifba.storygraph.extraction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * How scene text is turned into entities and relationships.
 */
public enum ExtractionStrategy {
    /** Language-model extraction of entities and relationships. Paid. */
    SEMANTIC("llm", true),
    /** Named-entity recognition only, no relationships. Free. */
    LIGHTWEIGHT("ner", false),
    /** Both, deduplicated, with relationships from the semantic run. Paid. */
    HYBRID("hybrid", true);

    private final String value;
    private final boolean paid;

    ExtractionStrategy(String value, boolean paid) {
        this.value = value;
        this.paid = paid;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether runs of this strategy spend model tokens and pass through the cost gate.
     */
    public boolean isPaid() {
        return paid;
    }

    /**
     * Accepts the enum name or the wire value, case-insensitive.
     *
     * @throws IllegalArgumentException if value doesn't match
     */
    @JsonCreator
    public static ExtractionStrategy fromString(@Nullable String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Extraction strategy must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExtractionStrategy strategy : values()) {
            if (strategy.value.equals(normalized) || strategy.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException(
            "Invalid extraction strategy: '" + value + "'. Valid values: semantic (llm), lightweight (ner), hybrid");
    }
}
