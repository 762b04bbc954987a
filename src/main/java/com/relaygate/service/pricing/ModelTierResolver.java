package com.relaygate.service.pricing;

import com.relaygate.config.RelaygateProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a model id to its reporting tier: the pricing entry's tier if set,
 * else the first tier whose keyword occurs in the model name, else the default tier.
 */
@Component
public class ModelTierResolver {

    private final PricingTable pricingTable;
    private final Map<String, List<String>> keywords;
    private final String defaultTier;

    public ModelTierResolver(PricingTable pricingTable, RelaygateProperties properties) {
        this.pricingTable = pricingTable;
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(properties.getTiers().getKeywords()));
        this.defaultTier = properties.getTiers().getDefaultTier();
    }

    public String resolve(String model) {
        if (model == null) {
            return defaultTier;
        }
        String configured = pricingTable.find(model)
                .map(RelaygateProperties.PricingEntry::getTier)
                .orElse(null);
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String lower = model.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> tier : keywords.entrySet()) {
            for (String keyword : tier.getValue()) {
                if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return tier.getKey();
                }
            }
        }
        return defaultTier;
    }
}
