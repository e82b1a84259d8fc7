package br.edu.ifba.storygraph.export;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Options for one export.
 *
 * @param format output format
 * @param includeEntities whether entities are written
 * @param includeRelationships whether relationships are written
 * @param maxItems cap on entities and on relationships written (null = unlimited)
 */
public record ExportConfig(
    @NotNull ExportFormat format,
    boolean includeEntities,
    boolean includeRelationships,
    @Nullable Integer maxItems
) {

    public ExportConfig {
        Objects.requireNonNull(format, "format must not be null");
        if (maxItems != null && maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be > 0 or null, got: " + maxItems);
        }
        if (!includeEntities && !includeRelationships) {
            throw new IllegalArgumentException("At least one of includeEntities or includeRelationships must be true");
        }
    }

    public static ExportConfig defaultFor(@NotNull ExportFormat format) {
        return new ExportConfig(format, true, true, null);
    }

    int limit() {
        return maxItems != null ? maxItems : Integer.MAX_VALUE;
    }
}
