package com.relaygate.model;

import lombok.Value;

/**
 * Deterministic fingerprint of a {@link NormalizedRequest}: SHA-256 as 64 hex chars.
 */
@Value
public class CacheKey {

    String digest;

    public static CacheKey of(String digest) {
        if (digest == null || digest.length() != 64) {
            throw new IllegalArgumentException("Cache key must be a 64 char hex digest");
        }
        return new CacheKey(digest);
    }

    @Override
    public String toString() {
        return digest;
    }
}
