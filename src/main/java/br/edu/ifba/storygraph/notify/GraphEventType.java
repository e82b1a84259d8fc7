package br.edu.ifba.storygraph.notify;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of change published to project subscribers.
 */
public enum GraphEventType {
    ENTITY_ADDED,
    ENTITY_UPDATED,
    ENTITY_DELETED,
    RELATIONSHIP_ADDED,
    RELATIONSHIP_UPDATED,
    RELATIONSHIP_DELETED,
    EXTRACTION_STARTED,
    EXTRACTION_COMPLETED,
    EXTRACTION_FAILED,
    EXTRACTION_CANCELLED,
    GRAPH_DELETED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isExtraction() {
        return name().startsWith("EXTRACTION_");
    }
}
