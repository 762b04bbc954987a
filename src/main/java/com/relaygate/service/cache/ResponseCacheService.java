package com.relaygate.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.CacheStoreException;
import com.relaygate.model.CacheEntry;
import com.relaygate.model.CacheKey;
import com.relaygate.model.CachedLookup;
import com.relaygate.model.ChatCompletionResponse;
import com.relaygate.model.Usage;
import com.relaygate.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Response cache in front of the configured store. Store failures are
 * downgraded to a miss (on read) or a skipped write, never an error.
 */
@Slf4j
@Service
public class ResponseCacheService {

    private final ResponseCacheStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean enabled;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder writes = new LongAdder();
    private final LongAdder errors = new LongAdder();

    public ResponseCacheService(ResponseCacheStore store,
                                ObjectMapper objectMapper,
                                Clock clock,
                                RelaygateProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.enabled = properties.getCache().isEnabled();
        log.info("Response cache {} (store={})", enabled ? "enabled" : "disabled", store.getName());
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Look up a cached response. A read never touches the stored entry.
     */
    public Optional<CachedLookup> lookup(CacheKey key) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            Optional<CachedLookup> result = store.get(key);
            if (result.isPresent()) {
                hits.increment();
                log.debug("Cache hit: key={}, hits={}", key, result.get().getHitCount());
            } else {
                misses.increment();
                log.debug("Cache miss: key={}", key);
            }
            return result;
        } catch (CacheStoreException e) {
            errors.increment();
            misses.increment();
            log.warn("Cache lookup failed, treating as miss: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Store a successful response under its key.
     *
     * @param model the model id the gateway sent, used later for pricing hits
     */
    public void store(CacheKey key, ChatCompletionResponse response, String model, String provider,
                      long inputTokens, long outputTokens) {
        if (!enabled) {
            return;
        }
        Usage usage = response.getUsage();
        try {
            CacheEntry entry = CacheEntry.builder()
                    .body(objectMapper.writeValueAsString(response))
                    .model(model)
                    .provider(provider)
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .cacheWriteTokens(usage != null ? usage.resolvedCacheWriteTokens() : 0)
                    .cacheReadTokens(usage != null ? usage.resolvedCacheReadTokens() : 0)
                    .createdAt(Instant.now(clock))
                    .build();
            store.put(key, entry);
            writes.increment();
            log.debug("Cached response: key={}, provider={}", key, provider);
        } catch (JsonProcessingException e) {
            errors.increment();
            log.warn("Could not serialize response for key {}: {}", key, e.getMessage());
        } catch (CacheStoreException e) {
            errors.increment();
            log.warn("Cache store failed, response not cached: {}", e.getMessage());
        }
    }

    /**
     * Rebuild a response from a cached entry. Each call returns a fresh object.
     */
    public ChatCompletionResponse materialize(CacheEntry entry) {
        try {
            return objectMapper.readValue(entry.getBody(), ChatCompletionResponse.class);
        } catch (JsonProcessingException e) {
            throw new CacheStoreException("Corrupt cache entry body", e);
        }
    }

    /**
     * Age of an entry in whole seconds.
     */
    public long ageSeconds(CacheEntry entry) {
        if (entry.getCreatedAt() == null) {
            return 0;
        }
        return Math.max(0, Instant.now(clock).getEpochSecond() - entry.getCreatedAt().getEpochSecond());
    }

    /**
     * Clear the cache.
     */
    public void clear() {
        try {
            store.clear();
            log.info("Response cache cleared");
        } catch (CacheStoreException e) {
            errors.increment();
            log.warn("Cache clear failed: {}", e.getMessage());
            throw e;
        }
    }

    public String getStoreName() {
        return store.getName();
    }

    public CacheStatistics getStatistics() {
        long entries;
        try {
            entries = store.size();
        } catch (CacheStoreException e) {
            log.warn("Cache size unavailable: {}", e.getMessage());
            entries = -1;
        }
        long h = hits.sum();
        long m = misses.sum();
        return CacheStatistics.builder()
                .store(store.getName())
                .enabled(enabled)
                .entries(entries)
                .hits(h)
                .misses(m)
                .hitRate(hitRate(h, m))
                .writes(writes.sum())
                .errors(errors.sum())
                .build();
    }

    /**
     * Hit rate in percent; zero when there were no lookups.
     */
    public static double hitRate(long hits, long misses) {
        long total = hits + misses;
        if (total == 0) {
            return 0.0;
        }
        return (double) hits / total * 100.0;
    }
}
