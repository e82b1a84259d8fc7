package br.edu.ifba.storygraph.job;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * Read access to scene text, implemented by the manuscript subsystem.
 */
public interface SceneSource {

    @NotNull
    Optional<Scene> findScene(@NotNull String projectId, @NotNull String sceneId);

    /**
     * All scenes of a project in manuscript order.
     */
    @NotNull
    List<Scene> listScenes(@NotNull String projectId);
}
