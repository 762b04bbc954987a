package com.relaygate.service.metrics;

import com.relaygate.model.CallEvent;
import com.relaygate.model.dto.ModelMetrics;
import com.relaygate.model.dto.TierMetrics;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free running totals for one key (overall, a tier or a model).
 * Each field is individually atomic, so concurrent events never lose an increment.
 */
class UsageTotals {

    private final LongAdder calls = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder unpriced = new LongAdder();
    private final LongAdder inputTokens = new LongAdder();
    private final LongAdder outputTokens = new LongAdder();
    private final AtomicReference<BigDecimal> cost = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> wouldBeCost = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> savings = new AtomicReference<>(BigDecimal.ZERO);

    void add(CallEvent event) {
        calls.increment();
        if (!event.isSuccess()) {
            failures.increment();
        }
        if (event.isCacheHit()) {
            cacheHits.increment();
        }
        if (event.isSuccess() && !event.isPriced()) {
            unpriced.increment();
        }
        inputTokens.add(event.getInputTokens());
        outputTokens.add(event.getOutputTokens());
        cost.accumulateAndGet(event.costOrZero(), BigDecimal::add);
        wouldBeCost.accumulateAndGet(event.wouldBeCostOrZero(), BigDecimal::add);
        savings.accumulateAndGet(event.savingsOrZero(), BigDecimal::add);
    }

    long calls() {
        return calls.sum();
    }

    long failures() {
        return failures.sum();
    }

    long cacheHits() {
        return cacheHits.sum();
    }

    long unpriced() {
        return unpriced.sum();
    }

    long inputTokens() {
        return inputTokens.sum();
    }

    long outputTokens() {
        return outputTokens.sum();
    }

    BigDecimal cost() {
        return cost.get();
    }

    BigDecimal wouldBeCost() {
        return wouldBeCost.get();
    }

    BigDecimal savings() {
        return savings.get();
    }

    TierMetrics toTierMetrics(String tier) {
        return TierMetrics.builder()
                .tier(tier)
                .calls(calls())
                .cacheHits(cacheHits())
                .failedCalls(failures())
                .unpricedCalls(unpriced())
                .cost(cost())
                .wouldBeCost(wouldBeCost())
                .savings(savings())
                .inputTokens(inputTokens())
                .outputTokens(outputTokens())
                .build();
    }

    ModelMetrics toModelMetrics(String model, String tier) {
        long requests = calls();
        long hits = cacheHits();
        return ModelMetrics.builder()
                .model(model)
                .tier(tier)
                .requests(requests)
                .cacheHits(hits)
                .cacheMisses(requests - hits)
                .cost(cost())
                .wouldBeCost(wouldBeCost())
                .savings(savings())
                .inputTokens(inputTokens())
                .outputTokens(outputTokens())
                .build();
    }
}
