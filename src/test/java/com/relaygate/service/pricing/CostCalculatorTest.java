package com.relaygate.service.pricing;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.model.Cost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CostCalculatorTest {

    private CostCalculator calculator;

    static RelaygateProperties.PricingEntry pricing(String model, String tier, String input, String output) {
        RelaygateProperties.PricingEntry entry = new RelaygateProperties.PricingEntry();
        entry.setModel(model);
        entry.setTier(tier);
        entry.setInputPerMillion(new BigDecimal(input));
        entry.setOutputPerMillion(new BigDecimal(output));
        return entry;
    }

    static RelaygateProperties.PricingEntry withCacheRates(RelaygateProperties.PricingEntry entry,
                                                         String write, String read) {
        entry.setCacheWritePerMillion(new BigDecimal(write));
        entry.setCacheReadPerMillion(new BigDecimal(read));
        return entry;
    }

    @BeforeEach
    void setUp() {
        RelaygateProperties properties = new RelaygateProperties();
        properties.setPricing(List.of(
                withCacheRates(pricing("opus", "premium", "15", "75"), "18.75", "1.5"),
                pricing("haiku", "cheap", "1", "5"),
                pricing("llama3", "local", "0", "0")));
        calculator = new CostCalculator(new PricingTable(properties));
    }

    @Test
    void testOpusCallPricesExactly() {
        Cost cost = calculator.price("opus", 5000, 2000);

        assertTrue(cost.isAvailable());
        assertEquals(0, new BigDecimal("0.225").compareTo(cost.getAmount()));
    }

    @Test
    void testModelLookupIgnoresCase() {
        assertEquals(0, new BigDecimal("0.225").compareTo(calculator.price("OPUS", 5000, 2000).getAmount()));
    }

    @Test
    void testLargeTokenCountsStayExact() {
        // 1,000,000 in + 500,000 out on opus = 15 + 37.5
        Cost cost = calculator.price("opus", 1_000_000, 500_000);

        assertEquals(0, new BigDecimal("52.5").compareTo(cost.getAmount()));
    }

    @Test
    void testPromptCacheReadsAreBilledAtReadRate() {
        // 900K cached at $1.5/M + 100K new at $15/M + 500K out at $75/M
        Cost withCache = calculator.price("opus", 100_000, 500_000, 0, 900_000);
        Cost withoutCache = calculator.price("opus", 1_000_000, 500_000);

        assertEquals(0, new BigDecimal("40.35").compareTo(withCache.getAmount()));
        assertEquals(0, new BigDecimal("12.15").compareTo(withoutCache.getAmount().subtract(withCache.getAmount())));
    }

    @Test
    void testPromptCacheWritesAreBilledAtWriteRate() {
        Cost cost = calculator.price("opus", 0, 0, 1_000_000, 0);

        assertEquals(0, new BigDecimal("18.75").compareTo(cost.getAmount()));
    }

    @Test
    void testPromptCacheRatesDefaultFromInputRate() {
        // haiku has no explicit cache rates: 1.25 x $1 write, 0.1 x $1 read
        Cost cost = calculator.price("haiku", 0, 0, 1_000_000, 1_000_000);

        assertEquals(0, new BigDecimal("1.35").compareTo(cost.getAmount()));
    }

    @Test
    void testGatewayHitOfPromptCachedCallSavesItsLivePrice() {
        CallCost cost = calculator.priceCall("opus", 100_000, 500_000, 200_000, 900_000, true);

        assertEquals(0, BigDecimal.ZERO.compareTo(cost.getActual()));
        assertEquals(0, new BigDecimal("44.10").compareTo(cost.getWouldBe()));
        assertEquals(cost.getWouldBe(), cost.getSavings());
    }

    @Test
    void testNegativeCacheTokensRejected() {
        assertThrows(IllegalArgumentException.class, () -> calculator.price("opus", 0, 0, 0, -5));
    }

    @Test
    void testUnknownModelIsUnavailableNotFree() {
        Cost cost = calculator.price("mystery-model", 100, 100);

        assertFalse(cost.isAvailable());
        assertNull(cost.getAmount());
    }

    @Test
    void testLocalModelIsFree() {
        Cost cost = calculator.price("llama3", 100_000, 100_000);

        assertTrue(cost.isAvailable());
        assertEquals(0, BigDecimal.ZERO.compareTo(cost.getAmount()));
    }

    @Test
    void testNegativeTokensRejected() {
        assertThrows(IllegalArgumentException.class, () -> calculator.price("opus", -1, 0));
    }

    @Test
    void testCacheHitReportsSavingsAndZeroCost() {
        CallCost cost = calculator.priceCall("opus", 1_000_000, 500_000, true);

        assertEquals(0, BigDecimal.ZERO.compareTo(cost.getActual()));
        assertEquals(0, new BigDecimal("52.50").compareTo(cost.getWouldBe()));
        assertEquals(0, new BigDecimal("52.50").compareTo(cost.getSavings()));
    }

    @Test
    void testLiveCallHasNoSavings() {
        CallCost cost = calculator.priceCall("opus", 5000, 2000, false);

        assertEquals(0, new BigDecimal("0.225").compareTo(cost.getActual()));
        assertEquals(0, new BigDecimal("0.225").compareTo(cost.getWouldBe()));
        assertEquals(0, BigDecimal.ZERO.compareTo(cost.getSavings()));
    }

    @Test
    void testUnpricedLiveCallHasNoCost() {
        CallCost cost = calculator.priceCall("mystery-model", 10, 10, false);

        assertNull(cost.getActual());
        assertNull(cost.getWouldBe());
        assertNull(cost.getSavings());
    }

    @Test
    void testUnpricedCacheHitStillCostsNothing() {
        CallCost cost = calculator.priceCall("mystery-model", 10, 10, true);

        assertEquals(0, BigDecimal.ZERO.compareTo(cost.getActual()));
        assertNull(cost.getSavings());
    }

    @Test
    void testNegativePriceRejectedAtStartup() {
        RelaygateProperties properties = new RelaygateProperties();
        properties.setPricing(List.of(pricing("bad", null, "-1", "1")));

        assertThrows(IllegalStateException.class, () -> new PricingTable(properties));
    }
}
