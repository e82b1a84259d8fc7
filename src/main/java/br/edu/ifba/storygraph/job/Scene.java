package br.edu.ifba.storygraph.job;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Scene content as provided by the manuscript subsystem.
 *
 * @param id scene reference recorded on entities and relationships
 * @param projectId owning project
 * @param title display title, may be null
 * @param text scene prose, empty when the scene has no content yet
 */
public record Scene(
    @NotNull String id,
    @NotNull String projectId,
    @Nullable String title,
    @NotNull String text
) {
    public Scene {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        text = text != null ? text : "";
    }
}
