package com.relaygate.controller;

import com.relaygate.service.audit.BatchAuditWriter;
import com.relaygate.service.cache.ResponseCacheService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness plus the state of the cache store and the audit backlog.
 * A degraded component does not fail the check: the gateway still serves traffic.
 */
@RestController
public class HealthController {

    private final ResponseCacheService cacheService;
    private final BatchAuditWriter auditWriter;

    public HealthController(ResponseCacheService cacheService, BatchAuditWriter auditWriter) {
        this.cacheService = cacheService;
        this.auditWriter = auditWriter;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("store", cacheService.getStoreName());
        cache.put("enabled", cacheService.isEnabled());
        long entries = cacheService.getStatistics().getEntries();
        cache.put("status", entries >= 0 ? "up" : "degraded");
        cache.put("entries", entries);

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("backlog", auditWriter.backlog());
        audit.put("written", auditWriter.getWrittenCount());
        audit.put("failed_flushes", auditWriter.getFailedFlushCount());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "up");
        body.put("cache", cache);
        body.put("audit", audit);
        return ResponseEntity.ok(body);
    }
}
