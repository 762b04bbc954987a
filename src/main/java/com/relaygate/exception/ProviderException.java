package com.relaygate.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A single provider call failed. Retryable failures advance the fallback chain,
 * terminal ones abort it.
 */
@Getter
public class ProviderException extends GatewayException {

    private final String provider;
    private final Integer upstreamStatus;
    private final boolean retryable;

    public ProviderException(String provider, Integer upstreamStatus, boolean retryable, String message) {
        this(provider, upstreamStatus, retryable, message, null);
    }

    public ProviderException(String provider, Integer upstreamStatus, boolean retryable, String message,
                             Throwable cause) {
        super(clientStatus(upstreamStatus), codeFor(upstreamStatus, retryable),
                "Provider '" + provider + "' failed: " + message, cause);
        this.provider = provider;
        this.upstreamStatus = upstreamStatus;
        this.retryable = retryable;
    }

    /**
     * Whether an upstream HTTP status should move on to the next provider.
     */
    public static boolean isRetryableStatus(int status) {
        return status == 408 || status == 425 || status == 429 || status >= 500;
    }

    public static ProviderException timeout(String provider, Throwable cause) {
        return new ProviderException(provider, null, true, "timeout", cause);
    }

    public static ProviderException connection(String provider, Throwable cause) {
        return new ProviderException(provider, null, true, "connection failure: " + cause.getMessage(), cause);
    }

    public static ProviderException malformed(String provider, String detail) {
        return new ProviderException(provider, null, false, "malformed response: " + detail);
    }

    @Override
    public String getType() {
        return "upstream_error";
    }

    private static HttpStatus clientStatus(Integer upstreamStatus) {
        // Terminal 4xx from upstream is surfaced as-is, everything else is a bad gateway
        if (upstreamStatus != null && upstreamStatus >= 400 && upstreamStatus < 500) {
            HttpStatus resolved = HttpStatus.resolve(upstreamStatus);
            if (resolved != null) {
                return resolved;
            }
        }
        return HttpStatus.BAD_GATEWAY;
    }

    private static String codeFor(Integer upstreamStatus, boolean retryable) {
        if (upstreamStatus == null) {
            return retryable ? "provider_unreachable" : "provider_malformed_response";
        }
        return "provider_http_" + upstreamStatus;
    }
}
