package br.edu.ifba.storygraph.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time snapshot of a graph's statistics and extraction counters.
 *
 * @param projectId owning project
 * @param entityCount number of entities
 * @param relationshipCount number of relationships
 * @param sceneCount distinct scene references across entities and relationships
 * @param totalExtractions extraction attempts recorded against the graph
 * @param successfulExtractions attempts that completed
 * @param failedExtractions attempts that failed
 * @param createdAt when the graph was first created
 * @param lastUpdated last mutation time
 * @param lastExtractedScene scene of the most recent extraction attempt
 */
public record GraphMetadata(
    @JsonProperty("project_id") @NotNull String projectId,
    @JsonProperty("entity_count") int entityCount,
    @JsonProperty("relationship_count") int relationshipCount,
    @JsonProperty("scene_count") int sceneCount,
    @JsonProperty("total_extractions") int totalExtractions,
    @JsonProperty("successful_extractions") int successfulExtractions,
    @JsonProperty("failed_extractions") int failedExtractions,
    @JsonProperty("created_at") @NotNull Instant createdAt,
    @JsonProperty("last_updated") @NotNull Instant lastUpdated,
    @JsonProperty("last_extracted_scene") @Nullable String lastExtractedScene
) {
    public GraphMetadata {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(lastUpdated, "lastUpdated must not be null");
    }

    /**
     * Ratio of successful to total extractions, 0 when nothing was extracted yet.
     */
    @JsonIgnore
    public double successRate() {
        return totalExtractions > 0 ? (double) successfulExtractions / totalExtractions : 0.0;
    }
}
