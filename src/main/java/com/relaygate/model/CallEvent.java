package com.relaygate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One finished request, hit or miss, success or failure. Immutable; shared by the
 * metrics aggregator and the audit writer.
 */
@Value
@Builder(toBuilder = true)
public class CallEvent {

    @JsonProperty("event_id")
    String eventId;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("request_id")
    String requestId;

    @JsonProperty("source")
    String source;

    @JsonProperty("agent_type")
    String agentType;

    @JsonProperty("requested_model")
    String requestedModel;

    @JsonProperty("model")
    String model;

    @JsonProperty("provider")
    String provider;

    @JsonProperty("tier")
    String tier;

    @JsonProperty("input_tokens")
    long inputTokens;

    @JsonProperty("output_tokens")
    long outputTokens;

    @JsonProperty("cache_write_tokens")
    long cacheWriteTokens;

    @JsonProperty("cache_read_tokens")
    long cacheReadTokens;

    /**
     * Actual cost; null when the model is unpriced.
     */
    @JsonProperty("cost_usd")
    BigDecimal cost;

    @JsonProperty("would_be_cost_usd")
    BigDecimal wouldBeCost;

    @JsonProperty("savings_usd")
    BigDecimal savings;

    @JsonProperty("latency_ms")
    long latencyMs;

    @JsonProperty("ttfb_ms")
    Long ttfbMs;

    @JsonProperty("cache_hit")
    boolean cacheHit;

    @JsonProperty("streamed")
    boolean streamed;

    @JsonProperty("success")
    boolean success;

    @JsonProperty("error_code")
    String errorCode;

    @JsonIgnore
    public boolean isPriced() {
        return cost != null;
    }

    public BigDecimal costOrZero() {
        return cost != null ? cost : BigDecimal.ZERO;
    }

    public BigDecimal wouldBeCostOrZero() {
        return wouldBeCost != null ? wouldBeCost : BigDecimal.ZERO;
    }

    public BigDecimal savingsOrZero() {
        return savings != null ? savings : BigDecimal.ZERO;
    }

    public long totalTokens() {
        return inputTokens + outputTokens + cacheWriteTokens + cacheReadTokens;
    }
}
