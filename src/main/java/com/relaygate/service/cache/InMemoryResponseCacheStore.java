package com.relaygate.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.relaygate.model.CacheEntry;
import com.relaygate.model.CacheKey;
import com.relaygate.model.CachedLookup;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed store. Size-bounded with W-TinyLFU eviction and expire-after-write TTL.
 */
@Slf4j
public class InMemoryResponseCacheStore implements ResponseCacheStore {

    private final Cache<String, Slot> cache;

    public InMemoryResponseCacheStore(long maxSize, Duration ttl) {
        this(maxSize, ttl, Ticker.systemTicker());
    }

    public InMemoryResponseCacheStore(long maxSize, Duration ttl, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("In-memory response cache: maxSize={}, ttl={}", maxSize, ttl);
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public Optional<CachedLookup> get(CacheKey key) {
        Slot slot = cache.getIfPresent(key.getDigest());
        if (slot == null) {
            return Optional.empty();
        }
        slot.hits.increment();
        return Optional.of(new CachedLookup(key, slot.entry, slot.hits.sum()));
    }

    @Override
    public void put(CacheKey key, CacheEntry entry) {
        // A fresh slot replaces the old one in a single map write
        cache.put(key.getDigest(), new Slot(entry));
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    /**
     * Immutable entry plus its own hit counter.
     */
    private static final class Slot {
        private final CacheEntry entry;
        private final LongAdder hits = new LongAdder();

        private Slot(CacheEntry entry) {
            this.entry = entry;
        }
    }
}
