package com.relaygate.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-model breakdown since the last reset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetrics {

    private String model;

    private String tier;

    private long requests;

    @JsonProperty("cache_hits")
    private long cacheHits;

    @JsonProperty("cache_misses")
    private long cacheMisses;

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
}
