package br.edu.ifba.storygraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of narrative elements tracked in a story graph.
 */
public enum EntityType {
    CHARACTER("character"),
    LOCATION("location"),
    OBJECT("object"),
    CONCEPT("concept"),
    EVENT("event"),
    ORGANIZATION("organization"),
    THEME("theme");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses the wire value (case-insensitive).
     *
     * @throws IllegalArgumentException if the value is not a known type
     */
    @JsonCreator
    public static EntityType fromValue(@NotNull String value) {
        return parse(value).orElseThrow(() ->
            new IllegalArgumentException("Unknown entity type: " + value));
    }

    /**
     * Lenient variant used when reading model output.
     */
    public static Optional<EntityType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
