package com.relaygate.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Every target of the fallback chain failed, or the retry budget ran out.
 */
@Getter
public class ProviderChainExhaustedException extends GatewayException {

    private final List<Attempt> attempts;

    public ProviderChainExhaustedException(List<Attempt> attempts) {
        super(HttpStatus.BAD_GATEWAY, "provider_chain_exhausted",
                "All providers failed after " + attempts.size() + " attempt(s): " + summarize(attempts));
        this.attempts = List.copyOf(attempts);
    }

    @Override
    public String getType() {
        return "upstream_error";
    }

    private static String summarize(List<Attempt> attempts) {
        return String.join("; ", attempts.stream()
                .map(a -> a.getProvider() + " (" + a.getModel() + "): " + a.getReason())
                .toList());
    }

    /**
     * One failed attempt.
     */
    @lombok.Value
    public static class Attempt {
        String provider;
        String model;
        String reason;
    }
}
