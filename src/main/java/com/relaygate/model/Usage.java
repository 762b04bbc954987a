package com.relaygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token usage block. Carries both the OpenAI names and the input/output names
 * so that clients of either convention can read it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Usage {

    @JsonProperty("prompt_tokens")
    private Integer promptTokens;

    @JsonProperty("completion_tokens")
    private Integer completionTokens;

    @JsonProperty("total_tokens")
    private Integer totalTokens;

    @JsonProperty("input_tokens")
    private Integer inputTokens;

    @JsonProperty("output_tokens")
    private Integer outputTokens;

    // Anthropic prompt caching; absent for providers without it
    @JsonProperty("cache_creation_input_tokens")
    private Integer cacheCreationInputTokens;

    @JsonProperty("cache_read_input_tokens")
    private Integer cacheReadInputTokens;

    public static Usage of(long inputTokens, long outputTokens) {
        return of(inputTokens, outputTokens, 0, 0);
    }

    /**
     * @throws ArithmeticException if a count does not fit the wire format
     */
    public static Usage of(long inputTokens, long outputTokens, long cacheWriteTokens, long cacheReadTokens) {
        int in = Math.toIntExact(inputTokens);
        int out = Math.toIntExact(outputTokens);
        return Usage.builder()
                .promptTokens(in)
                .completionTokens(out)
                .totalTokens(Math.addExact(in, out))
                .inputTokens(in)
                .outputTokens(out)
                .cacheCreationInputTokens(cacheWriteTokens > 0 ? Math.toIntExact(cacheWriteTokens) : null)
                .cacheReadInputTokens(cacheReadTokens > 0 ? Math.toIntExact(cacheReadTokens) : null)
                .build();
    }

    public long resolvedInputTokens() {
        if (inputTokens != null) {
            return inputTokens;
        }
        return promptTokens != null ? promptTokens : 0;
    }

    public long resolvedOutputTokens() {
        if (outputTokens != null) {
            return outputTokens;
        }
        return completionTokens != null ? completionTokens : 0;
    }

    public long resolvedCacheWriteTokens() {
        return cacheCreationInputTokens != null ? cacheCreationInputTokens : 0;
    }

    public long resolvedCacheReadTokens() {
        return cacheReadInputTokens != null ? cacheReadInputTokens : 0;
    }
}
