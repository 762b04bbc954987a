package com.relaygate.service.metrics;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.relaygate.config.RelaygateProperties;
import com.relaygate.model.CallEvent;
import com.relaygate.model.dto.MetricsSummary;
import com.relaygate.model.dto.ModelMetrics;
import com.relaygate.model.dto.TierMetrics;
import com.relaygate.model.dto.WindowSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Short-TTL memo in front of the aggregator so dashboards polling several times
 * a second share one computation per key.
 */
@Slf4j
@Service
public class MetricsQueryService {

    private static final String SUMMARY = "summary";
    private static final String WINDOWS = "windows";
    private static final String TIERS = "tiers";
    private static final String MODELS = "models";

    private final MetricsAggregator aggregator;
    private final Cache<String, Object> cache;

    @Autowired
    public MetricsQueryService(MetricsAggregator aggregator, RelaygateProperties properties) {
        this(aggregator, properties.getMetrics().getQueryCacheTtl(), Ticker.systemTicker());
    }

    MetricsQueryService(MetricsAggregator aggregator, Duration ttl, Ticker ticker) {
        this.aggregator = aggregator;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .maximumSize(256)
                .build();
    }

    public MetricsSummary summary() {
        return cached(SUMMARY, aggregator::summary);
    }

    public List<WindowSnapshot> windows() {
        return cached(WINDOWS, aggregator::windowSnapshots);
    }

    public Optional<WindowSnapshot> window(Duration duration) {
        return cached("window:" + duration.getSeconds(), () -> aggregator.windowSnapshot(duration));
    }

    public List<TierMetrics> tiers() {
        return cached(TIERS, aggregator::tierMetrics);
    }

    public List<ModelMetrics> models() {
        return cached(MODELS, aggregator::modelMetrics);
    }

    public List<CallEvent> recent(int limit) {
        return cached("recent:" + limit, () -> aggregator.recentCalls(limit));
    }

    /**
     * Clear the aggregator and drop every memoized answer.
     */
    public void reset() {
        aggregator.reset();
        cache.invalidateAll();
    }

    @SuppressWarnings("unchecked")
    private <T> T cached(String key, Supplier<T> loader) {
        return (T) cache.get(key, k -> {
            log.debug("Query cache miss: {}", k);
            return loader.get();
        });
    }
}
