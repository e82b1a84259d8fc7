package br.edu.ifba.storygraph.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionResponse(
    String id,
    String model,
    List<Choice> choices,
    Usage usage
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(
        Integer index,
        ChatCompletionRequest.Message message,

        @JsonProperty("finish_reason")
        String finishReason
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(
        @JsonProperty("prompt_tokens")
        Integer promptTokens,

        @JsonProperty("completion_tokens")
        Integer completionTokens,

        @JsonProperty("total_tokens")
        Integer totalTokens
    ) {
    }

    /**
     * Text of the first choice, if the provider returned any.
     */
    public Optional<String> content() {
        if (choices == null || choices.isEmpty()) {
            return Optional.empty();
        }
        ChatCompletionRequest.Message message = choices.get(0).message();
        return message == null ? Optional.empty() : Optional.ofNullable(message.content());
    }

    /**
     * True when the first choice stopped on the token limit, which usually leaves the JSON unterminated.
     */
    public boolean truncated() {
        return choices != null && !choices.isEmpty() && "length".equals(choices.get(0).finishReason());
    }
}
