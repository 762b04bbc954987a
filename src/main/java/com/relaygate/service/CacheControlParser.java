package com.relaygate.service;

import com.relaygate.model.CacheControlContext;
import com.relaygate.model.GatewayHeaders;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Parses cache control headers from HTTP requests.
 *
 * Allows clients to control cache behavior per request using headers like:
 * - x-cache-bypass: Skip cache lookup
 * - x-cache-store: Control response storage
 */
@Slf4j
@Service
public class CacheControlParser {

    /**
     * Parse cache control context from HTTP headers.
     *
     * @param headers HTTP request headers
     * @return parsed cache control context (never null)
     */
    public CacheControlContext parse(HttpHeaders headers) {
        CacheControlContext.CacheControlContextBuilder builder = CacheControlContext.builder();

        String bypass = headers.getFirst(GatewayHeaders.CACHE_BYPASS);
        if (bypass != null) {
            boolean value = parseBoolean(bypass, false);
            builder.bypass(value);
            if (value) {
                log.debug("Cache bypass requested via header");
            }
        }

        String store = headers.getFirst(GatewayHeaders.CACHE_STORE);
        if (store != null) {
            boolean value = parseBoolean(store, true);
            builder.store(value);
            if (!value) {
                log.debug("Cache storage disabled via header");
            }
        }

        return builder.build();
    }

    /**
     * Parse boolean from string.
     * Accepts: true/false, 1/0, yes/no, on/off (case-insensitive)
     */
    private boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        String normalized = value.trim().toLowerCase();

        return switch (normalized) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> {
                log.warn("Invalid boolean value: {}, using default: {}", value, defaultValue);
                yield defaultValue;
            }
        };
    }
}
