package com.relaygate.service.pricing;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.model.Cost;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Prices calls from the pricing table. Pure and deterministic; arithmetic is exact
 * (rates are per million tokens, so a cost is a shift of six decimal places).
 */
@Slf4j
@Service
public class CostCalculator {

    private final PricingTable pricingTable;

    public CostCalculator(PricingTable pricingTable) {
        this.pricingTable = pricingTable;
    }

    /**
     * Live price of a call. Unknown models are unavailable, not free.
     */
    public Cost price(String model, long inputTokens, long outputTokens) {
        return price(model, inputTokens, outputTokens, 0, 0);
    }

    /**
     * Live price of a call that used prompt caching. {@code inputTokens} are the uncached
     * input tokens; cache writes and reads are billed at their own rates.
     */
    public Cost price(String model, long inputTokens, long outputTokens, long cacheWriteTokens, long cacheReadTokens) {
        if (inputTokens < 0 || outputTokens < 0 || cacheWriteTokens < 0 || cacheReadTokens < 0) {
            throw new IllegalArgumentException("Token counts must be non-negative");
        }
        Optional<RelaygateProperties.PricingEntry> pricing = pricingTable.find(model);
        if (pricing.isEmpty()) {
            return Cost.unavailable();
        }
        RelaygateProperties.PricingEntry entry = pricing.get();
        BigDecimal total = perMillion(inputTokens, entry.getInputPerMillion())
                .add(perMillion(outputTokens, entry.getOutputPerMillion()));
        if (cacheWriteTokens > 0) {
            total = total.add(perMillion(cacheWriteTokens, entry.resolvedCacheWritePerMillion()));
        }
        if (cacheReadTokens > 0) {
            total = total.add(perMillion(cacheReadTokens, entry.resolvedCacheReadPerMillion()));
        }
        return Cost.of(total);
    }

    public CallCost priceCall(String model, long inputTokens, long outputTokens, boolean cacheHit) {
        return priceCall(model, inputTokens, outputTokens, 0, 0, cacheHit);
    }

    /**
     * Attribute cost for a completed call. A cache hit costs nothing and saves
     * exactly what the call would have cost live.
     */
    public CallCost priceCall(String model, long inputTokens, long outputTokens,
                              long cacheWriteTokens, long cacheReadTokens, boolean cacheHit) {
        Cost live = price(model, inputTokens, outputTokens, cacheWriteTokens, cacheReadTokens);
        if (!live.isAvailable()) {
            log.warn("No pricing for model '{}', cost reported as unavailable", model);
            return new CallCost(cacheHit ? BigDecimal.ZERO : null, null, null);
        }
        if (cacheHit) {
            return new CallCost(BigDecimal.ZERO, live.getAmount(), live.getAmount());
        }
        return new CallCost(live.getAmount(), live.getAmount(), BigDecimal.ZERO);
    }

    private static BigDecimal perMillion(long tokens, BigDecimal rate) {
        return BigDecimal.valueOf(tokens).multiply(rate).movePointLeft(6);
    }
}
