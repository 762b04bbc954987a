package com.relaygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible streaming chat completion chunk.
 * Sent as SSE events during streaming responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionChunk {

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    private String object; // Always "chat.completion.chunk"

    @JsonProperty("created")
    private Long created;

    @JsonProperty("model")
    private String model;

    @JsonProperty("choices")
    private List<ChunkChoice> choices;

    // Only on the final chunk when the provider reports usage
    @JsonProperty("usage")
    private Usage usage;

    /**
     * Text carried by the first choice's delta, or empty.
     */
    public String deltaText() {
        if (choices == null || choices.isEmpty()) {
            return "";
        }
        Delta delta = choices.get(0).getDelta();
        return delta != null && delta.getContent() != null ? delta.getContent() : "";
    }

    /**
     * Choice for streaming chunk with delta instead of message.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChunkChoice {

        @JsonProperty("index")
        private Integer index;

        @JsonProperty("delta")
        private Delta delta;

        @JsonProperty("finish_reason")
        private String finishReason;  // null until final chunk
    }
}
