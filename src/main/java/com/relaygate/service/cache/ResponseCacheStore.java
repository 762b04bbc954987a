package com.relaygate.service.cache;

import com.relaygate.exception.CacheStoreException;
import com.relaygate.model.CacheKey;
import com.relaygate.model.CacheEntry;
import com.relaygate.model.CachedLookup;

import java.util.Optional;

/**
 * Storage backend for cached responses. Implementations replace entries
 * atomically and keep hit counters outside the entry itself.
 */
public interface ResponseCacheStore {

    /**
     * Backend name for logs and stats ("memory", "redis").
     */
    String getName();

    /**
     * Look up an entry and count the hit.
     *
     * @throws CacheStoreException when the backend cannot be read
     */
    Optional<CachedLookup> get(CacheKey key);

    /**
     * Store or replace an entry.
     *
     * @throws CacheStoreException when the backend cannot be written
     */
    void put(CacheKey key, CacheEntry entry);

    /**
     * Approximate number of live entries.
     */
    long size();

    /**
     * Remove every entry.
     */
    void clear();
}
