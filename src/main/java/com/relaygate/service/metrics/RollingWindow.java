package com.relaygate.service.metrics;

import com.relaygate.model.CallEvent;
import com.relaygate.model.dto.WindowSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Iterator;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Time-bounded buffer of recent call events with running sums.
 *
 * Every touch first evicts events older than the window, so the cost of a read
 * or write is proportional to what expired, not to history. The lock is fair so
 * neither pollers nor writers can starve the other, and it only guards the deque
 * and sums; percentile sorting happens outside it.
 */
@Slf4j
public class RollingWindow {

    private final Duration duration;
    private final int maxEvents;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final ArrayDeque<Sample> samples = new ArrayDeque<>();

    private long calls;
    private long failures;
    private long cacheHits;
    private long inputTokens;
    private long outputTokens;
    private long latencySum;
    private BigDecimal cost = BigDecimal.ZERO;
    private BigDecimal wouldBeCost = BigDecimal.ZERO;
    private BigDecimal savings = BigDecimal.ZERO;

    public RollingWindow(Duration duration, int maxEvents) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Window duration must be positive");
        }
        this.duration = duration;
        this.maxEvents = maxEvents;
    }

    public Duration getDuration() {
        return duration;
    }

    public void record(CallEvent event, Instant now) {
        Sample sample = new Sample(event);
        lock.lock();
        try {
            evictExpired(now);
            if (!sample.timestamp.isAfter(now.minus(duration))) {
                // Already outside the window
                return;
            }
            insertOrdered(sample);
            add(sample, 1);
            while (samples.size() > maxEvents) {
                subtract(samples.pollFirst());
                log.warn("Window {} exceeded {} events, dropping oldest", duration, maxEvents);
            }
        } finally {
            lock.unlock();
        }
    }

    public WindowSnapshot snapshot(Instant now) {
        long[] latencies;
        WindowSnapshot.WindowSnapshotBuilder builder = WindowSnapshot.builder()
                .windowSeconds(duration.getSeconds())
                .asOf(now);
        long count;
        long hits;
        long latencyTotal;
        lock.lock();
        try {
            evictExpired(now);
            count = calls;
            hits = cacheHits;
            latencyTotal = latencySum;
            builder.totalCalls(calls)
                    .failedCalls(failures)
                    .cacheHits(cacheHits)
                    .cost(cost)
                    .wouldBeCost(wouldBeCost)
                    .savings(savings)
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens);
            latencies = new long[samples.size()];
            int i = 0;
            for (Sample sample : samples) {
                latencies[i++] = sample.latencyMs;
            }
        } finally {
            lock.unlock();
        }

        double minutes = duration.toMillis() / 60_000.0;
        return builder
                .cacheHitRate(count == 0 ? 0.0 : (double) hits / count * 100.0)
                .meanLatencyMs(count == 0 ? 0.0 : (double) latencyTotal / count)
                .p95LatencyMs(percentile(latencies, 95))
                .callsPerMinute(count / minutes)
                .build();
    }

    public void clear() {
        lock.lock();
        try {
            samples.clear();
            calls = 0;
            failures = 0;
            cacheHits = 0;
            inputTokens = 0;
            outputTokens = 0;
            latencySum = 0;
            cost = BigDecimal.ZERO;
            wouldBeCost = BigDecimal.ZERO;
            savings = BigDecimal.ZERO;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Nearest-rank percentile; zero for an empty window.
     */
    static long percentile(long[] values, int percentile) {
        if (values.length == 0) {
            return 0;
        }
        long[] sorted = values.clone();
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(0, rank - 1)];
    }

    // Caller holds the lock
    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(duration);
        int evicted = 0;
        Iterator<Sample> it = samples.iterator();
        while (it.hasNext()) {
            Sample head = it.next();
            if (head.timestamp.isAfter(cutoff)) {
                break;
            }
            it.remove();
            subtract(head);
            evicted++;
        }
        if (evicted > 0 && log.isDebugEnabled()) {
            log.debug("Window {} evicted {} events", duration, evicted);
        }
    }

    // Caller holds the lock. Events are stamped before the lock is taken, so a late arrival can be older than the tail
    private void insertOrdered(Sample sample) {
        Sample tail = samples.peekLast();
        if (tail == null || !tail.timestamp.isAfter(sample.timestamp)) {
            samples.addLast(sample);
            return;
        }
        ArrayDeque<Sample> newer = new ArrayDeque<>();
        while (!samples.isEmpty() && samples.peekLast().timestamp.isAfter(sample.timestamp)) {
            newer.push(samples.pollLast());
        }
        samples.addLast(sample);
        while (!newer.isEmpty()) {
            samples.addLast(newer.pop());
        }
    }

    private void add(Sample s, int sign) {
        calls += sign;
        failures += s.success ? 0 : sign;
        cacheHits += s.cacheHit ? sign : 0;
        inputTokens += sign * s.inputTokens;
        outputTokens += sign * s.outputTokens;
        latencySum += sign * s.latencyMs;
        if (sign > 0) {
            cost = cost.add(s.cost);
            wouldBeCost = wouldBeCost.add(s.wouldBeCost);
            savings = savings.add(s.savings);
        } else {
            cost = cost.subtract(s.cost);
            wouldBeCost = wouldBeCost.subtract(s.wouldBeCost);
            savings = savings.subtract(s.savings);
        }
    }

    private void subtract(Sample s) {
        add(s, -1);
    }

    /**
     * The slice of a call event a window needs.
     */
    private static final class Sample {
        private final Instant timestamp;
        private final boolean success;
        private final boolean cacheHit;
        private final long inputTokens;
        private final long outputTokens;
        private final long latencyMs;
        private final BigDecimal cost;
        private final BigDecimal wouldBeCost;
        private final BigDecimal savings;

        private Sample(CallEvent event) {
            this.timestamp = event.getTimestamp();
            this.success = event.isSuccess();
            this.cacheHit = event.isCacheHit();
            this.inputTokens = event.getInputTokens();
            this.outputTokens = event.getOutputTokens();
            this.latencyMs = event.getLatencyMs();
            this.cost = event.costOrZero();
            this.wouldBeCost = event.wouldBeCostOrZero();
            this.savings = event.savingsOrZero();
        }
    }
}
