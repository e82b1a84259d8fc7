package br.edu.ifba.storygraph.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of one extraction call. Extraction never streams, so there is no stream flag.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatCompletionRequest(
    String model,
    List<Message> messages,
    Double temperature,

    @JsonProperty("max_tokens")
    Integer maxTokens
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Message(String role, String content) {
    }

    /**
     * Builds the [system], user message sequence for a prompt.
     */
    @NotNull
    public static ChatCompletionRequest of(@NotNull String model, @Nullable String systemPrompt,
                                           @NotNull String prompt, @Nullable Double temperature,
                                           @Nullable Integer maxTokens) {
        List<Message> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new Message("system", systemPrompt));
        }
        messages.add(new Message("user", prompt));
        return new ChatCompletionRequest(model, List.copyOf(messages), temperature, maxTokens);
    }
}
