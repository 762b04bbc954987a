package com.relaygate.service.pricing;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Cost attribution for one call. {@code actual} is null when the model is unpriced;
 * {@code wouldBe} is the live price regardless of cache outcome.
 */
@Value
public class CallCost {

    BigDecimal actual;
    BigDecimal wouldBe;
    BigDecimal savings;

    public static CallCost free() {
        return new CallCost(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
