package com.relaygate.service.routing;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.NoRouteException;
import com.relaygate.model.ProviderTarget;
import com.relaygate.model.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves a request to an ordered fallback chain.
 *
 * Resolution order: agent rules, then tier/model rules, then the default chain.
 * The matched rule's providers come first, followed by the default chain as
 * fallback; disabled providers and duplicates are dropped, and so is any provider
 * that cannot serve the model. Each target carries the model id its provider is sent.
 */
@Slf4j
@Service
public class ModelRouter {

    private final RoutingTable table;

    public ModelRouter(RelaygateProperties properties) {
        this.table = buildTable(properties);
        log.info("Routing table: {} agent rules, {} model rules, default chain {}, enabled providers {}",
                table.getAgentRules().size(), table.getModelRules().size(),
                table.getDefaultChain(), table.getEnabledProviders().keySet());
    }

    /**
     * Build the fallback chain for a request.
     *
     * @throws NoRouteException when no enabled provider remains
     */
    public RoutePlan route(RequestContext context) {
        Optional<RoutingRule> rule = firstMatch(table.getAgentRules(), context.getAgentType());
        if (rule.isEmpty()) {
            rule = table.getModelRules().stream()
                    .filter(r -> r.getKind() == RuleKind.TIER
                            ? r.matches(context.getTier())
                            : r.matches(context.getRequestedModel()))
                    .findFirst();
        }

        Set<String> providers = new LinkedHashSet<>();
        String model = context.getRequestedModel();
        String matchedBy = "default";
        if (rule.isPresent()) {
            providers.addAll(rule.get().getProviders());
            if (rule.get().getModel() != null) {
                model = rule.get().getModel();
            }
            matchedBy = rule.get().describe();
        }
        providers.addAll(table.getDefaultChain());

        List<ProviderTarget> targets = new ArrayList<>();
        for (String provider : providers) {
            if (!table.getEnabledProviders().containsKey(provider)) {
                continue;
            }
            Optional<String> sent = table.getProviderModels().get(provider).resolve(model, table.getPricedProviders());
            if (sent.isPresent()) {
                targets.add(new ProviderTarget(provider, sent.get()));
            } else {
                log.debug("Provider {} cannot serve model '{}', left out of the chain", provider, model);
            }
        }

        if (targets.isEmpty()) {
            log.error("No enabled provider can serve model '{}' (agent={}, tier={})",
                    model, context.getAgentType(), context.getTier());
            throw new NoRouteException(context.getRequestedModel());
        }

        if (!model.equals(context.getRequestedModel())) {
            log.info("Rule {} rewrote model {} -> {}", matchedBy, context.getRequestedModel(), model);
        }
        log.debug("Routing model '{}' via {} to chain {}", context.getRequestedModel(), matchedBy, targets);
        return new RoutePlan(List.copyOf(targets), matchedBy);
    }

    public Optional<RelaygateProperties.ProviderConfig> getProviderConfig(String name) {
        return Optional.ofNullable(table.getEnabledProviders().get(name));
    }

    private Optional<RoutingRule> firstMatch(List<RoutingRule> rules, String value) {
        if (value == null) {
            return Optional.empty();
        }
        return rules.stream().filter(r -> r.matches(value)).findFirst();
    }

    private static RoutingTable buildTable(RelaygateProperties properties) {
        Map<String, RelaygateProperties.ProviderConfig> all = new LinkedHashMap<>();
        for (RelaygateProperties.ProviderConfig provider : properties.getProviders()) {
            if (provider.getName() == null || provider.getName().isBlank()) {
                throw new IllegalStateException("Provider without name");
            }
            if (all.put(provider.getName(), provider) != null) {
                throw new IllegalStateException("Duplicate provider name: " + provider.getName());
            }
        }

        Map<String, RelaygateProperties.ProviderConfig> enabled = new LinkedHashMap<>();
        Map<String, ProviderModels> providerModels = new LinkedHashMap<>();
        all.forEach((name, config) -> {
            if (config.isEnabled()) {
                enabled.put(name, config);
                providerModels.put(name, compileModels(config));
            }
        });

        Map<String, String> pricedProviders = new LinkedHashMap<>();
        for (RelaygateProperties.PricingEntry entry : properties.getPricing()) {
            if (entry.getModel() != null && entry.getProvider() != null && !entry.getProvider().isBlank()) {
                pricedProviders.put(entry.getModel().trim().toLowerCase(Locale.ROOT), entry.getProvider());
            }
        }

        List<String> defaultChain = properties.getRouting().getDefaultChain();
        requireKnown(all, defaultChain, "default chain");

        List<RoutingRule> agentRules = new ArrayList<>();
        List<RoutingRule> modelRules = new ArrayList<>();
        List<RelaygateProperties.RoutingRuleConfig> configured = properties.getRouting().getRules();
        for (int i = 0; i < configured.size(); i++) {
            RelaygateProperties.RoutingRuleConfig config = configured.get(i);
            RuleKind kind = RuleKind.parse(config.getKind());
            if (config.getPattern() == null) {
                throw new IllegalStateException("Routing rule #" + i + " without pattern");
            }
            requireKnown(all, config.getProviders(), "rule " + config.getPattern());
            RoutingRule rule = new RoutingRule(
                    kind,
                    Pattern.compile(config.getPattern(), Pattern.CASE_INSENSITIVE),
                    List.copyOf(config.getProviders()),
                    config.getModel() != null && !config.getModel().isBlank() ? config.getModel() : null,
                    config.getPriority(),
                    i);
            if (kind == RuleKind.AGENT) {
                agentRules.add(rule);
            } else {
                modelRules.add(rule);
            }
        }

        Comparator<RoutingRule> byPriority = Comparator.comparingInt(RoutingRule::getPriority)
                .thenComparingInt(RoutingRule::getOrder);
        agentRules.sort(byPriority);
        modelRules.sort(byPriority);

        return new RoutingTable(
                List.copyOf(agentRules),
                List.copyOf(modelRules),
                List.copyOf(defaultChain),
                Collections.unmodifiableMap(enabled),
                Collections.unmodifiableMap(providerModels),
                Collections.unmodifiableMap(pricedProviders));
    }

    private static ProviderModels compileModels(RelaygateProperties.ProviderConfig config) {
        List<Pattern> patterns = new ArrayList<>();
        for (String pattern : config.getModels()) {
            patterns.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
        }
        Map<String, String> modelMap = new LinkedHashMap<>();
        config.getModelMap().forEach((from, to) -> {
            if (to == null || to.isBlank()) {
                throw new IllegalStateException("Empty model-map target for '" + from + "' on " + config.getName());
            }
            modelMap.put(from.trim().toLowerCase(Locale.ROOT), to.trim());
        });
        return new ProviderModels(config.getName(), List.copyOf(patterns), Collections.unmodifiableMap(modelMap));
    }

    private static void requireKnown(Map<String, RelaygateProperties.ProviderConfig> providers,
                                     List<String> names, String where) {
        for (String name : names) {
            if (!providers.containsKey(name)) {
                throw new IllegalStateException("Unknown provider '" + name + "' in " + where);
            }
        }
    }
}
