package com.relaygate.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Overall totals since startup or the last reset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSummary {

    private Instant since;

    private long calls;

    private long successes;

    private long failures;

    @JsonProperty("cache_hits")
    private long cacheHits;

    @JsonProperty("cache_misses")
    private long cacheMisses;

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

    @JsonProperty("unpriced_calls")
    private long unpricedCalls;
}
