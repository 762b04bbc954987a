package com.relaygate.service.routing;

import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Which model ids one provider accepts, and under which name it is sent each one.
 *
 * An explicit model-map entry always wins. Otherwise a provider with model patterns
 * takes only matching ids, and one without takes any id the pricing table does not
 * attribute to a different provider.
 */
@Value
public class ProviderModels {

    String provider;
    List<Pattern> patterns;
    /**
     * Lower-cased requested model → model id this provider is sent.
     */
    Map<String, String> modelMap;

    /**
     * @param pricedProviders lower-cased model id → provider named by its pricing entry
     * @return the model id to send, or empty when this provider cannot serve the model
     */
    public Optional<String> resolve(String model, Map<String, String> pricedProviders) {
        String key = model.toLowerCase(Locale.ROOT);
        String mapped = modelMap.get(key);
        if (mapped != null) {
            return Optional.of(mapped);
        }
        if (!patterns.isEmpty()) {
            return patterns.stream().anyMatch(p -> p.matcher(model).matches())
                    ? Optional.of(model)
                    : Optional.empty();
        }
        String owner = pricedProviders.get(key);
        if (owner != null && !owner.equals(provider)) {
            return Optional.empty();
        }
        return Optional.of(model);
    }
}
