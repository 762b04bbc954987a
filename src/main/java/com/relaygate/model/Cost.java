package com.relaygate.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Monetary cost in USD. An unavailable cost means the model has no pricing entry,
 * which is not the same as a free model.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Cost {

    private static final Cost UNAVAILABLE = new Cost(null, false);
    private static final Cost ZERO = new Cost(BigDecimal.ZERO, true);

    BigDecimal amount;
    boolean available;

    public static Cost of(BigDecimal amount) {
        return new Cost(amount, true);
    }

    public static Cost zero() {
        return ZERO;
    }

    public static Cost unavailable() {
        return UNAVAILABLE;
    }
}
