package br.edu.ifba.storygraph.extraction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

/**
 * Token usage of one extraction.
 *
 * @param promptTokens tokens sent to the model across all calls
 * @param completionTokens tokens received from the model across all calls
 * @param modelCalls number of model calls made
 */
public record ExtractionUsage(
    @JsonProperty("prompt_tokens") int promptTokens,
    @JsonProperty("completion_tokens") int completionTokens,
    @JsonProperty("model_calls") int modelCalls
) {
    public static final ExtractionUsage NONE = new ExtractionUsage(0, 0, 0);

    public ExtractionUsage {
        if (promptTokens < 0 || completionTokens < 0 || modelCalls < 0) {
            throw new IllegalArgumentException("Usage counts must be non-negative");
        }
    }

    @JsonIgnore
    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    @NotNull
    public ExtractionUsage plus(@NotNull ExtractionUsage other) {
        return new ExtractionUsage(
            promptTokens + other.promptTokens,
            completionTokens + other.completionTokens,
            modelCalls + other.modelCalls);
    }
}
