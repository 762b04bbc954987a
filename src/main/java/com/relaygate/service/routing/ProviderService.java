package com.relaygate.service.routing;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.ProviderChainExhaustedException;
import com.relaygate.exception.ProviderException;
import com.relaygate.model.ChatCompletionRequest;
import com.relaygate.model.ProviderTarget;
import com.relaygate.provider.ChatProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes a fallback chain against the provider adapters.
 *
 * Retryable failures advance to the next target, terminal failures abort at once.
 * Each attempt consumes one unit of the per-request budget; running out of targets
 * or budget yields a single aggregated failure.
 */
@Slf4j
@Service
public class ProviderService {

    private final Map<String, ChatProvider> providersByType;
    private final ModelRouter router;
    private final int maxAttempts;

    public ProviderService(List<ChatProvider> providers, ModelRouter router, RelaygateProperties properties) {
        Map<String, ChatProvider> byType = new LinkedHashMap<>();
        providers.forEach(p -> byType.put(p.getType(), p));
        this.providersByType = Collections.unmodifiableMap(byType);
        this.router = router;
        this.maxAttempts = Math.max(1, properties.getRouting().getMaxAttempts());
        log.info("Initialized ProviderService with wire protocols {} and attempt budget {}",
                providersByType.keySet(), maxAttempts);
    }

    /**
     * Run a buffered request through the chain.
     */
    public Mono<ChainResult> execute(ChatCompletionRequest request, RoutePlan plan) {
        return Mono.defer(() -> attempt(request, plan.getTargets(), 0, new ArrayList<>()));
    }

    /**
     * Run a streaming request through the chain. Falls back only while nothing has
     * been emitted; once a chunk is out the stream is committed to that provider.
     */
    public Flux<RoutedChunk> executeStream(ChatCompletionRequest request, RoutePlan plan) {
        return Flux.defer(() -> attemptStream(request, plan.getTargets(), 0, new ArrayList<>()));
    }

    private Mono<ChainResult> attempt(ChatCompletionRequest request, List<ProviderTarget> targets, int index,
                                      List<ProviderChainExhaustedException.Attempt> failures) {
        if (index >= targets.size() || index >= maxAttempts) {
            return Mono.error(exhausted(failures));
        }
        ProviderTarget target = targets.get(index);
        RelaygateProperties.ProviderConfig config = configFor(target);
        ChatProvider provider = adapterFor(config);

        log.info("Routing model '{}' to provider '{}' (attempt {}/{})",
                target.getModel(), target.getProvider(), index + 1, Math.min(targets.size(), maxAttempts));

        return provider.complete(withModel(request, target), config)
                .map(response -> new ChainResult(response, target, index + 1))
                .onErrorResume(error -> {
                    ProviderException failure = asProviderException(error, target);
                    failures.add(new ProviderChainExhaustedException.Attempt(
                            target.getProvider(), target.getModel(), failure.getMessage()));
                    if (!failure.isRetryable()) {
                        log.error("Terminal error from provider {}: {}", target.getProvider(), failure.getMessage());
                        return Mono.error(failure);
                    }
                    log.warn("Retryable error from provider {}, advancing chain: {}",
                            target.getProvider(), failure.getMessage());
                    return attempt(request, targets, index + 1, failures);
                });
    }

    private Flux<RoutedChunk> attemptStream(ChatCompletionRequest request, List<ProviderTarget> targets, int index,
                                            List<ProviderChainExhaustedException.Attempt> failures) {
        if (index >= targets.size() || index >= maxAttempts) {
            return Flux.error(exhausted(failures));
        }
        ProviderTarget target = targets.get(index);
        RelaygateProperties.ProviderConfig config = configFor(target);
        ChatProvider provider = adapterFor(config);
        AtomicBoolean emitted = new AtomicBoolean();

        log.info("Streaming model '{}' from provider '{}' (attempt {}/{})",
                target.getModel(), target.getProvider(), index + 1, Math.min(targets.size(), maxAttempts));

        return provider.stream(withModel(request, target), config)
                .doOnNext(chunk -> emitted.set(true))
                .map(chunk -> new RoutedChunk(target, chunk))
                .onErrorResume(error -> {
                    ProviderException failure = asProviderException(error, target);
                    if (emitted.get()) {
                        log.error("Provider {} failed mid-stream: {}", target.getProvider(), failure.getMessage());
                        return Flux.error(failure);
                    }
                    failures.add(new ProviderChainExhaustedException.Attempt(
                            target.getProvider(), target.getModel(), failure.getMessage()));
                    if (!failure.isRetryable()) {
                        log.error("Terminal error from provider {}: {}", target.getProvider(), failure.getMessage());
                        return Flux.error(failure);
                    }
                    log.warn("Retryable error from provider {} before first chunk, advancing chain: {}",
                            target.getProvider(), failure.getMessage());
                    return attemptStream(request, targets, index + 1, failures);
                });
    }

    private ProviderChainExhaustedException exhausted(List<ProviderChainExhaustedException.Attempt> failures) {
        log.error("Provider chain exhausted after {} attempt(s)", failures.size());
        return new ProviderChainExhaustedException(failures);
    }

    private RelaygateProperties.ProviderConfig configFor(ProviderTarget target) {
        return router.getProviderConfig(target.getProvider())
                .orElseThrow(() -> new IllegalStateException("Provider not enabled: " + target.getProvider()));
    }

    private ChatProvider adapterFor(RelaygateProperties.ProviderConfig config) {
        ChatProvider provider = providersByType.get(config.getType());
        if (provider == null) {
            throw new IllegalStateException("No adapter for provider type '" + config.getType()
                    + "' (provider " + config.getName() + ")");
        }
        return provider;
    }

    private ChatCompletionRequest withModel(ChatCompletionRequest request, ProviderTarget target) {
        if (target.getModel().equals(request.getModel())) {
            return request;
        }
        return request.toBuilder().model(target.getModel()).build();
    }

    private ProviderException asProviderException(Throwable error, ProviderTarget target) {
        if (error instanceof ProviderException) {
            return (ProviderException) error;
        }
        return new ProviderException(target.getProvider(), null, false, String.valueOf(error.getMessage()), error);
    }
}
