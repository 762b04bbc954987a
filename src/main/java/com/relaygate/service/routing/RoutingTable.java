package com.relaygate.service.routing;

import com.relaygate.config.RelaygateProperties;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable routing snapshot. Built once at startup and only read afterwards.
 */
@Value
public class RoutingTable {

    List<RoutingRule> agentRules;
    /**
     * Tier and model rules together, ordered by priority.
     */
    List<RoutingRule> modelRules;
    List<String> defaultChain;
    Map<String, RelaygateProperties.ProviderConfig> enabledProviders;
    Map<String, ProviderModels> providerModels;
    /**
     * Lower-cased model id → provider named by its pricing entry.
     */
    Map<String, String> pricedProviders;
}
