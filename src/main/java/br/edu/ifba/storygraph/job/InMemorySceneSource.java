package br.edu.ifba.storygraph.job;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fallback {@link SceneSource} used when no manuscript integration provides one.
 * Scenes are registered programmatically.
 */
@DefaultBean
@ApplicationScoped
public class InMemorySceneSource implements SceneSource {

    private final Map<String, Map<String, Scene>> scenes = new ConcurrentHashMap<>();

    public void put(@NotNull Scene scene) {
        scenes.computeIfAbsent(scene.projectId(), k -> new LinkedHashMap<>());
        Map<String, Scene> projectScenes = scenes.get(scene.projectId());
        synchronized (projectScenes) {
            projectScenes.put(scene.id(), scene);
        }
    }

    public void removeProject(@NotNull String projectId) {
        scenes.remove(projectId);
    }

    @Override
    @NotNull
    public Optional<Scene> findScene(@NotNull String projectId, @NotNull String sceneId) {
        Map<String, Scene> projectScenes = scenes.get(projectId);
        if (projectScenes == null) {
            return Optional.empty();
        }
        synchronized (projectScenes) {
            return Optional.ofNullable(projectScenes.get(sceneId));
        }
    }

    @Override
    @NotNull
    public List<Scene> listScenes(@NotNull String projectId) {
        Map<String, Scene> projectScenes = scenes.get(projectId);
        if (projectScenes == null) {
            return List.of();
        }
        synchronized (projectScenes) {
            return new ArrayList<>(projectScenes.values());
        }
    }
}
