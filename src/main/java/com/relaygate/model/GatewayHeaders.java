package com.relaygate.model;

/**
 * HTTP headers understood and emitted by the gateway.
 */
public class GatewayHeaders {

    // ========== Request Headers ==========

    /**
     * Bypass cache lookup (always forward to provider).
     * Example: x-cache-bypass: true
     */
    public static final String CACHE_BYPASS = "x-cache-bypass";

    /**
     * Control whether response should be cached.
     * Example: x-cache-store: false
     */
    public static final String CACHE_STORE = "x-cache-store";

    /**
     * Source identifier recorded on the call event.
     */
    public static final String SOURCE = "x-source";

    /**
     * Correlation id, generated when absent and echoed back.
     */
    public static final String REQUEST_ID = "x-request-id";

    // ========== Response Headers ==========

    public static final String CACHE_HIT = "x-cache-hit";

    /**
     * Fingerprint of the request. Only present for cache hits.
     */
    public static final String CACHE_KEY = "x-cache-key";

    /**
     * Age of cached entry in seconds. Only present for cache hits.
     */
    public static final String CACHE_AGE = "x-cache-age";

    /**
     * Provider that actually produced the answer.
     */
    public static final String PROVIDER = "x-relaygate-provider";

    private GatewayHeaders() {
        // Utility class, no instantiation
    }
}
