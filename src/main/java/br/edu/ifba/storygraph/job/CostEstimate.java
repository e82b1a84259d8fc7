package br.edu.ifba.storygraph.job;

import br.edu.ifba.storygraph.extraction.ExtractionStrategy;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;

/**
 * Projected spend of extracting a set of scenes with a strategy.
 *
 * @param strategy strategy the estimate was made for
 * @param sceneCount scenes the estimate covers
 * @param estimatedInputTokens prompt tokens across all model calls
 * @param estimatedOutputTokens completion tokens across all model calls
 * @param estimatedCost projected spend in the configured currency
 * @param threshold spend above which confirmation is required
 * @param requiresConfirmation whether the caller must confirm before jobs are created
 */
public record CostEstimate(
    @JsonProperty("strategy") @NotNull ExtractionStrategy strategy,
    @JsonProperty("scene_count") int sceneCount,
    @JsonProperty("estimated_input_tokens") long estimatedInputTokens,
    @JsonProperty("estimated_output_tokens") long estimatedOutputTokens,
    @JsonProperty("estimated_cost") @NotNull BigDecimal estimatedCost,
    @JsonProperty("threshold") @NotNull BigDecimal threshold,
    @JsonProperty("requires_confirmation") boolean requiresConfirmation
) {

    public static CostEstimate free(@NotNull ExtractionStrategy strategy, int sceneCount,
                                    @NotNull BigDecimal threshold) {
        return new CostEstimate(strategy, sceneCount, 0, 0, BigDecimal.ZERO, threshold, false);
    }
}
