package com.relaygate.service.metrics;

import com.relaygate.model.CallEvent;
import com.relaygate.model.dto.WindowSnapshot;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RollingWindowTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    static CallEvent event(Instant at, long latencyMs, boolean cacheHit, String cost) {
        BigDecimal amount = new BigDecimal(cost);
        return CallEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .timestamp(at)
                .model("opus")
                .tier("premium")
                .inputTokens(100)
                .outputTokens(50)
                .cost(cacheHit ? BigDecimal.ZERO : amount)
                .wouldBeCost(amount)
                .savings(cacheHit ? amount : BigDecimal.ZERO)
                .latencyMs(latencyMs)
                .cacheHit(cacheHit)
                .success(true)
                .build();
    }

    @Test
    void testCountsEventsInsideWindow() {
        RollingWindow window = new RollingWindow(Duration.ofMinutes(1), 1000);
        window.record(event(T0, 100, false, "0.01"), T0);
        window.record(event(T0.plusSeconds(10), 200, true, "0.01"), T0.plusSeconds(10));

        WindowSnapshot snapshot = window.snapshot(T0.plusSeconds(20));

        assertEquals(2, snapshot.getTotalCalls());
        assertEquals(1, snapshot.getCacheHits());
        assertEquals(50.0, snapshot.getCacheHitRate(), 0.0001);
        assertEquals(0, new BigDecimal("0.01").compareTo(snapshot.getCost()));
        assertEquals(0, new BigDecimal("0.01").compareTo(snapshot.getSavings()));
        assertEquals(150.0, snapshot.getMeanLatencyMs(), 0.0001);
        assertEquals(200, snapshot.getInputTokens());
    }

    @Test
    void testOldEventsAreEvictedOnRead() {
        RollingWindow window = new RollingWindow(Duration.ofMinutes(1), 1000);
        window.record(event(T0, 100, false, "1"), T0);
        window.record(event(T0.plusSeconds(30), 100, false, "2"), T0.plusSeconds(30));

        WindowSnapshot later = window.snapshot(T0.plusSeconds(61));

        assertEquals(1, later.getTotalCalls());
        assertEquals(0, new BigDecimal("2").compareTo(later.getCost()));

        WindowSnapshot empty = window.snapshot(T0.plusSeconds(120));
        assertEquals(0, empty.getTotalCalls());
        assertEquals(0, BigDecimal.ZERO.compareTo(empty.getCost()));
        assertEquals(0.0, empty.getCacheHitRate());
        assertEquals(0, empty.getP95LatencyMs());
    }

    @Test
    void testLateArrivingOlderEventIsStillEvictedOnTime() {
        RollingWindow window = new RollingWindow(Duration.ofMinutes(1), 1000);
        Instant now = T0.plusSeconds(60);
        window.record(event(T0.plusSeconds(50), 100, false, "1"), now);
        // Stamped earlier by a slower writer, recorded after the newer one
        window.record(event(T0.plusSeconds(10), 300, false, "2"), now);
        window.record(event(T0.plusSeconds(30), 200, false, "4"), now);

        WindowSnapshot snapshot = window.snapshot(T0.plusSeconds(80));

        assertEquals(2, snapshot.getTotalCalls());
        assertEquals(0, new BigDecimal("5").compareTo(snapshot.getCost()));
        assertEquals(150.0, snapshot.getMeanLatencyMs(), 0.0001);

        assertEquals(1, window.snapshot(T0.plusSeconds(100)).getTotalCalls());
    }

    @Test
    void testEventAlreadyOutsideWindowIsIgnored() {
        RollingWindow window = new RollingWindow(Duration.ofMinutes(1), 1000);

        window.record(event(T0, 100, false, "1"), T0.plusSeconds(90));

        assertEquals(0, window.snapshot(T0.plusSeconds(90)).getTotalCalls());
    }

    @Test
    void testP95UsesNearestRank() {
        RollingWindow window = new RollingWindow(Duration.ofMinutes(5), 1000);
        for (int i = 1; i <= 100; i++) {
            window.record(event(T0, i * 10L, false, "0"), T0);
        }

        WindowSnapshot snapshot = window.snapshot(T0);

        assertEquals(950, snapshot.getP95LatencyMs());
        assertEquals(20.0, snapshot.getCallsPerMinute(), 0.0001);
    }

    @Test
    void testPercentileOfSingleValue() {
        assertEquals(42, RollingWindow.percentile(new long[]{42}, 95));
        assertEquals(0, RollingWindow.percentile(new long[0], 95));
    }

    @Test
    void testMaxEventsDropsOldest() {
        RollingWindow window = new RollingWindow(Duration.ofMinutes(10), 3);
        for (int i = 0; i < 5; i++) {
            window.record(event(T0.plusSeconds(i), 10, false, "1"), T0.plusSeconds(i));
        }

        WindowSnapshot snapshot = window.snapshot(T0.plusSeconds(5));
        assertEquals(3, snapshot.getTotalCalls());
        assertEquals(0, new BigDecimal("3").compareTo(snapshot.getCost()));
    }

    @Test
    void testClear() {
        RollingWindow window = new RollingWindow(Duration.ofMinutes(1), 100);
        window.record(event(T0, 10, false, "1"), T0);

        window.clear();

        assertEquals(0, window.snapshot(T0).getTotalCalls());
    }

    @Test
    void testNonPositiveDurationRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RollingWindow(Duration.ZERO, 10));
    }
}
