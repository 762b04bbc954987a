package com.relaygate.service.routing;

import com.relaygate.model.ProviderTarget;
import lombok.Value;

import java.util.List;

/**
 * Fallback chain for one request, in attempt order.
 */
@Value
public class RoutePlan {

    List<ProviderTarget> targets;
    /**
     * Which rule produced the chain, "default" when none matched.
     */
    String matchedBy;
}
