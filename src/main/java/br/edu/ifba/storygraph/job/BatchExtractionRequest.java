package br.edu.ifba.storygraph.job;

import br.edu.ifba.storygraph.extraction.ExtractionStrategy;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Whole-project (or scene subset) extraction request.
 *
 * @param projectId project to extract
 * @param strategy strategy for every scene
 * @param sceneIds scenes to extract in order; null or empty means every scene of the project
 * @param confirmCost caller accepts the estimated spend of a paid strategy
 */
public record BatchExtractionRequest(
    @JsonProperty("project_id") @NotNull String projectId,
    @JsonProperty("extractor_type") @NotNull ExtractionStrategy strategy,
    @JsonProperty("scene_ids") @Nullable List<String> sceneIds,
    @JsonProperty("confirm_cost") boolean confirmCost
) {
    public BatchExtractionRequest {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        sceneIds = sceneIds != null ? List.copyOf(sceneIds) : List.of();
    }

    public static BatchExtractionRequest allScenes(@NotNull String projectId, @NotNull ExtractionStrategy strategy,
                                                   boolean confirmCost) {
        return new BatchExtractionRequest(projectId, strategy, List.of(), confirmCost);
    }
}
