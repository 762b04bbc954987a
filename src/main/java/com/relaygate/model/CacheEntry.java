package com.relaygate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A stored response. The body is kept as serialized JSON so a reader always
 * gets its own copy; entries are replaced, never mutated.
 */
@Value
@Builder
@Jacksonized
public class CacheEntry {

    @JsonProperty("body")
    String body;

    @JsonProperty("model")
    String model;

    @JsonProperty("provider")
    String provider;

    @JsonProperty("input_tokens")
    long inputTokens;

    @JsonProperty("output_tokens")
    long outputTokens;

    @JsonProperty("cache_write_tokens")
    long cacheWriteTokens;

    @JsonProperty("cache_read_tokens")
    long cacheReadTokens;

    @JsonProperty("created_at")
    Instant createdAt;
}
