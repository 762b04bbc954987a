package com.relaygate.model;

import lombok.Value;

/**
 * Result of a successful cache lookup: the entry plus the hit count after this read.
 */
@Value
public class CachedLookup {

    CacheKey key;
    CacheEntry entry;
    long hitCount;
}
