package com.relaygate.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Statistics of one rolling window at the moment it was read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowSnapshot {

    @JsonProperty("window_seconds")
    private long windowSeconds;

    @JsonProperty("as_of")
    private Instant asOf;

    @JsonProperty("total_calls")
    private long totalCalls;

    @JsonProperty("failed_calls")
    private long failedCalls;

    @JsonProperty("cache_hits")
    private long cacheHits;

    @JsonProperty("cache_hit_rate")
    private double cacheHitRate;

    @JsonProperty("cost_usd")
    private BigDecimal cost;

    @JsonProperty("would_be_cost_usd")
    private BigDecimal wouldBeCost;

    @JsonProperty("savings_usd")
    private BigDecimal savings;

    @JsonProperty("input_tokens")
    private long inputTokens;

    @JsonProperty("output_tokens")
    private long outputTokens;

    @JsonProperty("mean_latency_ms")
    private double meanLatencyMs;

    @JsonProperty("p95_latency_ms")
    private long p95LatencyMs;

    @JsonProperty("calls_per_minute")
    private double callsPerMinute;
}
