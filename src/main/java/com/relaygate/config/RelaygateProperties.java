package com.relaygate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Relaygate.
 * Read once at startup; the gateway never reloads them.
 */
@Data
@Component
@ConfigurationProperties(prefix = "relaygate")
public class RelaygateProperties {

    private List<ProviderConfig> providers = new ArrayList<>();
    private RoutingConfig routing = new RoutingConfig();
    private List<PricingEntry> pricing = new ArrayList<>();
    private TierConfig tiers = new TierConfig();
    private CacheConfig cache = new CacheConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private AuditConfig audit = new AuditConfig();

    @Data
    public static class ProviderConfig {
        private String name;
        /**
         * Wire protocol: "openai" (also Ollama, vLLM, LocalAI) or "anthropic".
         */
        private String type = "openai";
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 0;
        /**
         * Model id patterns (regex, whole id, case-insensitive) this provider serves.
         * Empty means any model not priced against another provider.
         */
        private List<String> models = new ArrayList<>();
        /**
         * Model id to send this provider in place of another vendor's model, e.g. when it is a fallback.
         */
        private Map<String, String> modelMap = new LinkedHashMap<>();
    }

    @Data
    public static class RoutingConfig {
        private List<String> defaultChain = new ArrayList<>();
        private int maxAttempts = 3;
        private String agentHeader = "x-agent-type";
        private Map<String, List<String>> agentKeywords = new LinkedHashMap<>();
        private List<RoutingRuleConfig> rules = new ArrayList<>();
    }

    @Data
    public static class RoutingRuleConfig {
        /**
         * "agent", "tier" or "model".
         */
        private String kind;
        private String pattern;
        private List<String> providers = new ArrayList<>();
        private String model;
        private int priority = 100;
    }

    @Data
    public static class PricingEntry {
        private static final BigDecimal CACHE_WRITE_MULTIPLIER = new BigDecimal("1.25");
        private static final BigDecimal CACHE_READ_MULTIPLIER = new BigDecimal("0.1");

        private String model;
        private String provider;
        private String tier;
        private BigDecimal inputPerMillion = BigDecimal.ZERO;
        private BigDecimal outputPerMillion = BigDecimal.ZERO;
        /**
         * Prompt-cache write rate; defaults to 1.25x the input rate.
         */
        private BigDecimal cacheWritePerMillion;
        /**
         * Prompt-cache read rate; defaults to 0.1x the input rate.
         */
        private BigDecimal cacheReadPerMillion;

        public BigDecimal resolvedCacheWritePerMillion() {
            return cacheWritePerMillion != null ? cacheWritePerMillion
                    : inputPerMillion.multiply(CACHE_WRITE_MULTIPLIER);
        }

        public BigDecimal resolvedCacheReadPerMillion() {
            return cacheReadPerMillion != null ? cacheReadPerMillion
                    : inputPerMillion.multiply(CACHE_READ_MULTIPLIER);
        }
    }

    @Data
    public static class TierConfig {
        private String defaultTier = "other";
        private Map<String, List<String>> keywords = new LinkedHashMap<>();
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        /**
         * "memory" or "redis".
         */
        private String store = "memory";
        private long maxSize = 10000;
        private Duration ttl = Duration.ofHours(24);
        private boolean cacheStreamedResponses = true;
    }

    @Data
    public static class MetricsConfig {
        private List<Duration> windows = new ArrayList<>(List.of(
                Duration.ofMinutes(1), Duration.ofMinutes(5), Duration.ofMinutes(10)));
        private int recentCalls = 100;
        private Duration queryCacheTtl = Duration.ofSeconds(1);
        private int maxWindowEvents = 200_000;
    }

    @Data
    public static class AuditConfig {
        private boolean enabled = true;
        private int batchSize = 100;
        private Duration flushInterval = Duration.ofSeconds(5);
        private int queueCapacity = 10_000;
        private Duration enqueueTimeout = Duration.ofMillis(250);
        private int maxFlushRetries = 5;
        private Duration retryBackoff = Duration.ofSeconds(1);
        private Duration retention = Duration.ofDays(30);
        private Duration retentionSweepInterval = Duration.ofHours(1);
    }
}
