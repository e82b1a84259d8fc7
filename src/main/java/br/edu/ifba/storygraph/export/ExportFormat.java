package br.edu.ifba.storygraph.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Supported export formats.
 */
public enum ExportFormat {
    /** Node/edge JSON for graph visualization and interchange tools. */
    NODE_LINK("node-link", "application/json", "json"),
    /** Narrative summary grouped by entity type, for knowledge-ingestion tools. */
    MARKDOWN("markdown", "text/markdown", "md"),
    /** The raw persisted graph document. */
    DOCUMENT("document", "application/json", "json"),
    /** GraphML for tools like Gephi. */
    GRAPHML("graphml", "application/graphml+xml", "graphml");

    private final String value;
    private final String mimeType;
    private final String extension;

    ExportFormat(String value, String mimeType, String extension) {
        this.value = value;
        this.mimeType = mimeType;
        this.extension = extension;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getExtension() {
        return extension;
    }

    @JsonCreator
    public static ExportFormat fromString(@NotNull String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ExportFormat format : values()) {
            if (format.value.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown export format: " + value);
    }
}
