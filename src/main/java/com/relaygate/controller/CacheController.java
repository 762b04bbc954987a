package com.relaygate.controller;

import com.relaygate.model.dto.CacheStatistics;
import com.relaygate.service.GatewayService;
import com.relaygate.service.cache.ResponseCacheService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Response cache management.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final ResponseCacheService cacheService;
    private final GatewayService gatewayService;

    public CacheController(ResponseCacheService cacheService, GatewayService gatewayService) {
        this.cacheService = cacheService;
        this.gatewayService = gatewayService;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(cacheService.getStatistics());
    }

    /**
     * Clear the response cache.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        gatewayService.clearCache();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Cache cleared (" + cacheService.getStoreName() + ")"
        ));
    }
}
