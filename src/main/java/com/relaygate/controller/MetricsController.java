package com.relaygate.controller;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.model.CallEvent;
import com.relaygate.model.dto.MetricsSummary;
import com.relaygate.model.dto.ModelMetrics;
import com.relaygate.model.dto.TierMetrics;
import com.relaygate.model.dto.WindowSnapshot;
import com.relaygate.service.metrics.MetricsQueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregate statistics for dashboards. Answers are at most a second old
 * and say so in their Cache-Control header.
 */
@Slf4j
@RestController
@RequestMapping("/api/metrics")
public class MetricsController {

    private static final CacheControl ONE_SECOND = CacheControl.maxAge(Duration.ofSeconds(1));

    private final MetricsQueryService queryService;
    private final int maxRecent;

    public MetricsController(MetricsQueryService queryService, RelaygateProperties properties) {
        this.queryService = queryService;
        this.maxRecent = properties.getMetrics().getRecentCalls();
    }

    @GetMapping("/summary")
    public ResponseEntity<MetricsSummary> summary() {
        return ok(queryService.summary());
    }

    @GetMapping("/windows")
    public ResponseEntity<List<WindowSnapshot>> windows() {
        return ok(queryService.windows());
    }

    /**
     * One rolling window by its length in minutes; 404 for a window that is not configured.
     */
    @GetMapping("/windows/{minutes}")
    public ResponseEntity<WindowSnapshot> window(@PathVariable long minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Window length must be positive");
        }
        return queryService.window(Duration.ofMinutes(minutes))
                .map(MetricsController::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/tiers")
    public ResponseEntity<List<TierMetrics>> tiers() {
        return ok(queryService.tiers());
    }

    @GetMapping("/models")
    public ResponseEntity<List<ModelMetrics>> models() {
        return ok(queryService.models());
    }

    /**
     * Most recent call events, newest last.
     *
     * @param limit how many to return, capped at the ring size
     */
    @GetMapping("/recent")
    public ResponseEntity<List<CallEvent>> recent(@RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ok(queryService.recent(Math.min(limit, maxRecent)));
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, String>> reset() {
        log.warn("Metrics reset requested");
        queryService.reset();
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    private static <T> ResponseEntity<T> ok(T body) {
        return ResponseEntity.ok().cacheControl(ONE_SECOND).body(body);
    }
}
