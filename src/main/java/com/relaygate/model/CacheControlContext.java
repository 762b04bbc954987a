package com.relaygate.model;

import lombok.Builder;
import lombok.Data;

/**
 * Context for cache control preferences from request headers.
 */
@Data
@Builder
public class CacheControlContext {

    /**
     * Whether to bypass cache lookup entirely.
     * If true, always forward to provider (cache miss).
     */
    @Builder.Default
    private boolean bypass = false;

    /**
     * Whether to store the response in cache.
     * Use case: sensitive queries that shouldn't be cached.
     */
    @Builder.Default
    private boolean store = true;

    /**
     * Create default context (no overrides).
     */
    public static CacheControlContext defaults() {
        return CacheControlContext.builder().build();
    }

    public boolean shouldLookup() {
        return !bypass;
    }
}
