package com.relaygate.service.metrics;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.model.CallEvent;
import com.relaygate.model.dto.MetricsSummary;
import com.relaygate.model.dto.ModelMetrics;
import com.relaygate.model.dto.TierMetrics;
import com.relaygate.model.dto.WindowSnapshot;
import com.relaygate.service.cache.ResponseCacheService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory, real-time view of call events: rolling windows, per-tier and
 * per-model totals, overall totals and the recent-calls ring.
 *
 * There is no aggregator-wide lock. Each window has its own short lock and
 * totals are per-key atomic counters.
 */
@Slf4j
@Service
public class MetricsAggregator {

    private static final String UNKNOWN_TIER = "unknown";

    private final Clock clock;
    private final List<RollingWindow> windows;
    private final RecentCalls recent;

    private final AtomicReference<UsageTotals> overall = new AtomicReference<>(new UsageTotals());
    private final Map<String, UsageTotals> tiers = new ConcurrentHashMap<>();
    private final Map<String, UsageTotals> models = new ConcurrentHashMap<>();
    private final Map<String, String> modelTiers = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> since;

    public MetricsAggregator(RelaygateProperties properties, Clock clock) {
        this.clock = clock;
        RelaygateProperties.MetricsConfig config = properties.getMetrics();
        this.windows = config.getWindows().stream()
                .sorted()
                .distinct()
                .map(d -> new RollingWindow(d, config.getMaxWindowEvents()))
                .toList();
        this.recent = new RecentCalls(config.getRecentCalls());
        this.since = new AtomicReference<>(Instant.now(clock));
        log.info("Metrics aggregator with windows {} and recent-calls ring of {}",
                windowDurations(), recent.capacity());
    }

    /**
     * Account one event in every window, its tier, its model and the overall totals.
     */
    public void record(CallEvent event) {
        Instant now = Instant.now(clock);
        for (RollingWindow window : windows) {
            window.record(event, now);
        }
        overall.get().add(event);
        String tier = event.getTier() != null ? event.getTier() : UNKNOWN_TIER;
        tiers.computeIfAbsent(tier, t -> new UsageTotals()).add(event);
        if (event.getModel() != null) {
            models.computeIfAbsent(event.getModel(), m -> new UsageTotals()).add(event);
            modelTiers.putIfAbsent(event.getModel(), tier);
        }
        recent.add(event);
    }

    public List<WindowSnapshot> windowSnapshots() {
        Instant now = Instant.now(clock);
        return windows.stream().map(w -> w.snapshot(now)).toList();
    }

    public Optional<WindowSnapshot> windowSnapshot(Duration duration) {
        Instant now = Instant.now(clock);
        return windows.stream()
                .filter(w -> w.getDuration().equals(duration))
                .findFirst()
                .map(w -> w.snapshot(now));
    }

    public List<Duration> windowDurations() {
        return windows.stream().map(RollingWindow::getDuration).toList();
    }

    public List<TierMetrics> tierMetrics() {
        return tiers.entrySet().stream()
                .map(e -> e.getValue().toTierMetrics(e.getKey()))
                .sorted(Comparator.comparing(TierMetrics::getTier))
                .toList();
    }

    public List<ModelMetrics> modelMetrics() {
        return models.entrySet().stream()
                .map(e -> e.getValue().toModelMetrics(e.getKey(), modelTiers.get(e.getKey())))
                .sorted(Comparator.comparing(ModelMetrics::getRequests).reversed()
                        .thenComparing(ModelMetrics::getModel))
                .toList();
    }

    public MetricsSummary summary() {
        UsageTotals totals = overall.get();
        long calls = totals.calls();
        long hits = totals.cacheHits();
        long failures = totals.failures();
        return MetricsSummary.builder()
                .since(since.get())
                .calls(calls)
                .successes(calls - failures)
                .failures(failures)
                .cacheHits(hits)
                .cacheMisses(calls - hits)
                .cacheHitRate(ResponseCacheService.hitRate(hits, calls - hits))
                .cost(totals.cost())
                .wouldBeCost(totals.wouldBeCost())
                .savings(totals.savings())
                .inputTokens(totals.inputTokens())
                .outputTokens(totals.outputTokens())
                .unpricedCalls(totals.unpriced())
                .build();
    }

    /**
     * Last {@code limit} events, newest last.
     */
    public List<CallEvent> recentCalls(int limit) {
        return recent.latest(limit);
    }

    /**
     * Explicit clear of every total, window and the recent ring.
     */
    public void reset() {
        overall.set(new UsageTotals());
        tiers.clear();
        models.clear();
        modelTiers.clear();
        windows.forEach(RollingWindow::clear);
        recent.clear();
        since.set(Instant.now(clock));
        log.info("Metrics reset");
    }
}
