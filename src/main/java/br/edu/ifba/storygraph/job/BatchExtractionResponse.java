package br.edu.ifba.storygraph.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of a batch request: either the jobs created, or the estimate awaiting confirmation.
 *
 * @param outcome what the service did
 * @param jobs jobs created, empty unless {@code outcome} is SUBMITTED
 * @param skippedSceneIds scenes left out because they exceed the per-invocation cap
 * @param costEstimate estimate for the scenes that would be processed
 * @param message human-readable summary
 */
public record BatchExtractionResponse(
    @JsonProperty("outcome") @NotNull Outcome outcome,
    @JsonProperty("jobs") @NotNull List<ExtractionJob> jobs,
    @JsonProperty("skipped_scene_ids") @NotNull List<String> skippedSceneIds,
    @JsonProperty("cost_estimate") @Nullable CostEstimate costEstimate,
    @JsonProperty("message") @NotNull String message
) {

    public enum Outcome {
        SUBMITTED,
        CONFIRMATION_REQUIRED,
        NO_SCENES
    }

    public BatchExtractionResponse {
        jobs = List.copyOf(jobs);
        skippedSceneIds = List.copyOf(skippedSceneIds);
    }

    public boolean requiresConfirmation() {
        return outcome == Outcome.CONFIRMATION_REQUIRED;
    }
}
