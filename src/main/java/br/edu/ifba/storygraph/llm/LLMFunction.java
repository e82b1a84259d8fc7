package br.edu.ifba.storygraph.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for Large Language Model completion.
 *
 * <p>Implementations complete the returned future exceptionally with an
 * {@link br.edu.ifba.storygraph.exception.ExtractionException} carrying the failure kind
 * (rate limited, timed out, authentication, provider) when the call fails.</p>
 */
@FunctionalInterface
public interface LLMFunction {

    /**
     * Generate a completion from the LLM.
     *
     * @param prompt The user prompt
     * @param systemPrompt Optional system prompt for context
     * @param kwargs Additional parameters (model, temperature, max_tokens)
     * @return CompletableFuture with the generated response text
     */
    CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt,
        @NotNull Map<String, Object> kwargs
    );

    /**
     * Convenience method for simple prompts without a system prompt.
     */
    default CompletableFuture<String> apply(@NotNull String prompt) {
        return apply(prompt, null, Map.of());
    }

    /**
     * Convenience method with system prompt and default parameters.
     */
    default CompletableFuture<String> apply(@NotNull String prompt, @Nullable String systemPrompt) {
        return apply(prompt, systemPrompt, Map.of());
    }
}
