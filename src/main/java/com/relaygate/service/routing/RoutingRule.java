package com.relaygate.service.routing;

import lombok.Value;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiled routing rule. Lower priority values are evaluated first; ties keep
 * configuration order.
 */
@Value
public class RoutingRule {

    RuleKind kind;
    Pattern pattern;
    List<String> providers;
    /**
     * Model id to send instead of the requested one, or null.
     */
    String model;
    int priority;
    int order;

    public boolean matches(String value) {
        return value != null && pattern.matcher(value).matches();
    }

    public String describe() {
        return kind.name().toLowerCase() + ":" + pattern.pattern();
    }
}
