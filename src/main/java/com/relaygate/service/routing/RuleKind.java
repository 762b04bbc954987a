package com.relaygate.service.routing;

import java.util.Locale;

/**
 * What a routing rule's pattern is matched against.
 */
public enum RuleKind {
    AGENT,
    TIER,
    MODEL;

    public static RuleKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Routing rule without kind");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "agent" -> AGENT;
            case "tier" -> TIER;
            case "model" -> MODEL;
            default -> throw new IllegalStateException("Unknown routing rule kind: " + value);
        };
    }
}
