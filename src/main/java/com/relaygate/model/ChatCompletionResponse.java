package com.relaygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible chat completion response model, extended with the flat
 * {@code content} field and the {@code cache_hit} flag.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    private String object; // "chat.completion"

    @JsonProperty("created")
    private Long created;

    @JsonProperty("model")
    private String model;

    @JsonProperty("provider")
    private String provider;

    @JsonProperty("choices")
    private List<Choice> choices;

    @JsonProperty("usage")
    private Usage usage;

    @JsonProperty("content")
    private String content;

    @JsonProperty("cache_hit")
    private Boolean cacheHit;

    /**
     * Text of the first choice, falling back to the flat content field.
     */
    public String firstContent() {
        if (choices != null && !choices.isEmpty() && choices.get(0).getMessage() != null) {
            String text = choices.get(0).getMessage().getContent();
            if (text != null) {
                return text;
            }
        }
        return content != null ? content : "";
    }

    public String firstFinishReason() {
        if (choices != null && !choices.isEmpty() && choices.get(0).getFinishReason() != null) {
            return choices.get(0).getFinishReason();
        }
        return "stop";
    }
}
