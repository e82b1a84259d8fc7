package br.edu.ifba.storygraph.notify;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A change notification for one project.
 *
 * @param type what happened
 * @param projectId affected project
 * @param payload event details; keys depend on the type and are optional for consumers
 * @param timestamp when the change was published
 */
public record GraphEvent(
    @JsonProperty("type") @NotNull GraphEventType type,
    @JsonProperty("project_id") @NotNull String projectId,
    @JsonProperty("payload") @NotNull Map<String, Object> payload,
    @JsonProperty("timestamp") @NotNull Instant timestamp
) {
    public GraphEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static GraphEvent of(@NotNull GraphEventType type, @NotNull String projectId,
                                @NotNull Map<String, Object> payload) {
        return new GraphEvent(type, projectId, payload, Instant.now());
    }
}
