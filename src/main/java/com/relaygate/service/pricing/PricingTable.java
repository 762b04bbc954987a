package com.relaygate.service.pricing;

import com.relaygate.config.RelaygateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable model → price lookup built once from configuration.
 * Model ids match exactly, ignoring case.
 */
@Slf4j
@Component
public class PricingTable {

    private final Map<String, RelaygateProperties.PricingEntry> entries;

    public PricingTable(RelaygateProperties properties) {
        Map<String, RelaygateProperties.PricingEntry> byModel = new LinkedHashMap<>();
        for (RelaygateProperties.PricingEntry entry : properties.getPricing()) {
            if (entry.getModel() == null || entry.getModel().isBlank()) {
                throw new IllegalStateException("Pricing entry without model id");
            }
            if (entry.getInputPerMillion().signum() < 0 || entry.getOutputPerMillion().signum() < 0
                    || entry.resolvedCacheWritePerMillion().signum() < 0
                    || entry.resolvedCacheReadPerMillion().signum() < 0) {
                throw new IllegalStateException("Negative price for model " + entry.getModel());
            }
            byModel.put(key(entry.getModel()), entry);
        }
        this.entries = Collections.unmodifiableMap(byModel);
        log.info("Loaded pricing for {} models", entries.size());
    }

    public Optional<RelaygateProperties.PricingEntry> find(String model) {
        if (model == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key(model)));
    }

    public Collection<RelaygateProperties.PricingEntry> all() {
        return entries.values();
    }

    private static String key(String model) {
        return model.trim().toLowerCase(Locale.ROOT);
    }
}
