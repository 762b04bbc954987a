package com.relaygate.repository;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-tier aggregate row from the audit table.
 */
@Data
@NoArgsConstructor
public class TierTotalsRow {

    private String tier;

    private long calls;

    @JsonProperty("cost_usd")
    private BigDecimal cost;

    @JsonProperty("savings_usd")
    private BigDecimal savings;

    @JsonProperty("input_tokens")
    private long inputTokens;

    @JsonProperty("output_tokens")
    private long outputTokens;

    /**
     * JPQL constructor expression target; sums over an all-null column arrive as null.
     */
    public TierTotalsRow(String tier, Long calls, BigDecimal cost, BigDecimal savings,
                         Long inputTokens, Long outputTokens) {
        this.tier = tier;
        this.calls = calls != null ? calls : 0;
        this.cost = cost != null ? cost : BigDecimal.ZERO;
        this.savings = savings != null ? savings : BigDecimal.ZERO;
        this.inputTokens = inputTokens != null ? inputTokens : 0;
        this.outputTokens = outputTokens != null ? outputTokens : 0;
    }
}
