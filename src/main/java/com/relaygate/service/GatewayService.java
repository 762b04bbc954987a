package com.relaygate.service;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.CacheStoreException;
import com.relaygate.exception.GatewayException;
import com.relaygate.exception.InvalidRequestException;
import com.relaygate.exception.ProviderException;
import com.relaygate.model.CacheControlContext;
import com.relaygate.model.CacheEntry;
import com.relaygate.model.CacheKey;
import com.relaygate.model.CachedLookup;
import com.relaygate.model.CallEvent;
import com.relaygate.model.ChatCompletionChunk;
import com.relaygate.model.ChatCompletionRequest;
import com.relaygate.model.ChatCompletionResponse;
import com.relaygate.model.Choice;
import com.relaygate.model.Message;
import com.relaygate.model.ProviderTarget;
import com.relaygate.model.RequestContext;
import com.relaygate.model.Usage;
import com.relaygate.service.cache.ResponseCacheService;
import com.relaygate.service.canonicalization.RequestCanonicalizer;
import com.relaygate.service.metrics.CallRecorder;
import com.relaygate.service.pricing.CallCost;
import com.relaygate.service.pricing.CostCalculator;
import com.relaygate.service.pricing.ModelTierResolver;
import com.relaygate.service.routing.AgentDetector;
import com.relaygate.service.routing.ChainResult;
import com.relaygate.service.routing.ModelRouter;
import com.relaygate.service.routing.ProviderService;
import com.relaygate.service.routing.RoutePlan;
import com.relaygate.service.routing.RoutedChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Main gateway service: cache lookup, routing with fallback, pricing and recording.
 *
 * Provider calls run detached from the client subscription, so a client that goes
 * away never prevents the call event from being recorded once the provider resolves.
 */
@Slf4j
@Service
public class GatewayService {

    private static final String DEFAULT_SOURCE = "client";

    private final RequestCanonicalizer canonicalizer;
    private final ResponseCacheService cacheService;
    private final ModelRouter router;
    private final ProviderService providerService;
    private final CostCalculator costCalculator;
    private final ModelTierResolver tierResolver;
    private final AgentDetector agentDetector;
    private final CallRecorder recorder;
    private final StreamingService streamingService;
    private final Clock clock;
    private final boolean cacheStreamedResponses;

    public GatewayService(RequestCanonicalizer canonicalizer,
                          ResponseCacheService cacheService,
                          ModelRouter router,
                          ProviderService providerService,
                          CostCalculator costCalculator,
                          ModelTierResolver tierResolver,
                          AgentDetector agentDetector,
                          CallRecorder recorder,
                          StreamingService streamingService,
                          Clock clock,
                          RelaygateProperties properties) {
        this.canonicalizer = canonicalizer;
        this.cacheService = cacheService;
        this.router = router;
        this.providerService = providerService;
        this.costCalculator = costCalculator;
        this.tierResolver = tierResolver;
        this.agentDetector = agentDetector;
        this.recorder = recorder;
        this.streamingService = streamingService;
        this.clock = clock;
        this.cacheStreamedResponses = properties.getCache().isCacheStreamedResponses();
    }

    /**
     * Validate the request and work out who is calling and for which tier.
     */
    public RequestContext prepare(ChatCompletionRequest request, String requestId, String source, String agentHeader) {
        validate(request);
        String agentType = agentDetector.detect(agentHeader, request.getMessages());
        String resolvedSource = notBlank(source) ? source.trim() : agentType != null ? agentType : DEFAULT_SOURCE;
        return RequestContext.builder()
                .requestId(notBlank(requestId) ? requestId.trim() : UUID.randomUUID().toString())
                .source(resolvedSource)
                .agentType(agentType)
                .requestedModel(request.getModel())
                .tier(tierResolver.resolve(request.getModel()))
                .streaming(request.isStreaming())
                .build();
    }

    /**
     * Reject requests no provider could answer.
     */
    public void validate(ChatCompletionRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        if (!notBlank(request.getModel())) {
            throw new InvalidRequestException("Model must be specified");
        }
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new InvalidRequestException("Messages cannot be empty");
        }
        for (Message message : request.getMessages()) {
            if (message == null || !notBlank(message.getRole())) {
                throw new InvalidRequestException("Every message needs a role");
            }
        }
        if (request.getMaxTokens() != null && request.getMaxTokens() < 0) {
            throw new InvalidRequestException("max_tokens must not be negative");
        }
        if (request.getTemperature() != null && (request.getTemperature() < 0 || request.getTemperature() > 2)) {
            throw new InvalidRequestException("temperature must be between 0 and 2");
        }
        if (request.getTopP() != null && (request.getTopP() < 0 || request.getTopP() > 1)) {
            throw new InvalidRequestException("top_p must be between 0 and 1");
        }
    }

    /**
     * Buffered completion.
     */
    public Mono<GatewayResponse> complete(ChatCompletionRequest request,
                                          RequestContext context,
                                          CacheControlContext cacheControl) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            CacheKey key = canonicalizer.generateKey(request);

            Optional<ServedHit> hit = serveFromCache(key, context, cacheControl, startNanos);
            if (hit.isPresent()) {
                ServedHit served = hit.get();
                return Mono.just(GatewayResponse.builder()
                        .response(served.response)
                        .cacheHit(true)
                        .cacheKey(key.getDigest())
                        .cacheAgeSeconds(served.ageSeconds)
                        .provider(served.provider)
                        .requestId(context.getRequestId())
                        .build());
            }

            log.info("Cache miss for model {} - forwarding to provider", request.getModel());
            RoutePlan plan = routeOrRecord(context, startNanos);

            Sinks.One<GatewayResponse> result = Sinks.one();
            providerService.execute(request, plan)
                    .map(chain -> onLiveResponse(chain, key, context, cacheControl, startNanos))
                    .subscribe(
                            result::tryEmitValue,
                            error -> {
                                recordFailure(context, error, startNanos, TokenCounts.NONE, null);
                                result.tryEmitError(error);
                            });
            return result.asMono();
        });
    }

    /**
     * Streaming completion. The returned Mono resolves once the first chunk is
     * available, so failures before that still surface as ordinary HTTP errors;
     * later chunks are forwarded as they arrive.
     */
    public Mono<GatewayStream> stream(ChatCompletionRequest request,
                                      RequestContext context,
                                      CacheControlContext cacheControl) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            CacheKey key = canonicalizer.generateKey(request);

            Optional<ServedHit> hit = serveFromCache(key, context, cacheControl, startNanos);
            if (hit.isPresent()) {
                ServedHit served = hit.get();
                return Mono.just(GatewayStream.builder()
                        .events(streamingService.replay(served.response))
                        .cacheHit(true)
                        .cacheKey(key.getDigest())
                        .cacheAgeSeconds(served.ageSeconds)
                        .provider(served.provider)
                        .requestId(context.getRequestId())
                        .build());
            }

            log.info("Cache miss for streaming model {} - forwarding to provider", request.getModel());
            RoutePlan plan = routeOrRecord(context, startNanos);

            StreamAccumulator accumulator = new StreamAccumulator(startNanos);
            Sinks.Many<ChatCompletionChunk> body = Sinks.many().unicast().onBackpressureBuffer();
            Sinks.One<ProviderTarget> firstChunk = Sinks.one();

            providerService.executeStream(request, plan).subscribe(
                    routed -> {
                        if (accumulator.accept(routed)) {
                            firstChunk.tryEmitValue(routed.getTarget());
                        }
                        body.tryEmitNext(routed.getChunk());
                    },
                    error -> {
                        recordFailure(context, error, startNanos, accumulator.tokens(), accumulator.ttfbMs());
                        if (accumulator.isStarted()) {
                            body.tryEmitError(error);
                        } else {
                            firstChunk.tryEmitError(error);
                        }
                    },
                    () -> {
                        if (!accumulator.isStarted()) {
                            ProviderException empty = ProviderException.malformed(
                                    plan.getTargets().get(0).getProvider(), "empty stream");
                            recordFailure(context, empty, startNanos, TokenCounts.NONE, null);
                            firstChunk.tryEmitError(empty);
                            return;
                        }
                        onStreamComplete(accumulator, key, context, cacheControl, startNanos);
                        body.tryEmitComplete();
                    });

            return firstChunk.asMono().map(target -> GatewayStream.builder()
                    .events(body.asFlux()
                            .map(streamingService::toEvent)
                            .concatWith(Mono.fromSupplier(streamingService::done))
                            .onErrorResume(GatewayException.class,
                                    e -> Flux.just(streamingService.errorEvent(e))))
                    .cacheHit(false)
                    .provider(target.getProvider())
                    .requestId(context.getRequestId())
                    .build());
        });
    }

    /**
     * Clear the response cache.
     */
    public void clearCache() {
        cacheService.clear();
    }

    private Optional<ServedHit> serveFromCache(CacheKey key, RequestContext context,
                                               CacheControlContext cacheControl, long startNanos) {
        if (!cacheControl.shouldLookup()) {
            log.debug("Cache lookup bypassed for request {}", context.getRequestId());
            return Optional.empty();
        }
        Optional<CachedLookup> lookup = cacheService.lookup(key);
        if (lookup.isEmpty()) {
            return Optional.empty();
        }

        CacheEntry entry = lookup.get().getEntry();
        ChatCompletionResponse response;
        try {
            response = cacheService.materialize(entry).toBuilder().cacheHit(true).build();
        } catch (CacheStoreException e) {
            log.warn("Unreadable cache entry {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }

        TokenCounts tokens = new TokenCounts(entry.getInputTokens(), entry.getOutputTokens(),
                entry.getCacheWriteTokens(), entry.getCacheReadTokens());
        CallCost cost = price(entry.getModel(), tokens, true);
        recorder.record(buildEvent(context, entry.getModel(), entry.getProvider(), tokens, cost,
                elapsedMs(startNanos), null, true, true, null));

        long age = cacheService.ageSeconds(entry);
        log.info("Serving cached response for model {} (key={}, hits={}, age={}s)",
                entry.getModel(), key, lookup.get().getHitCount(), age);
        return Optional.of(new ServedHit(response, entry.getProvider(), age));
    }

    private RoutePlan routeOrRecord(RequestContext context, long startNanos) {
        try {
            return router.route(context);
        } catch (GatewayException e) {
            recordFailure(context, e, startNanos, TokenCounts.NONE, null);
            throw e;
        }
    }

    private GatewayResponse onLiveResponse(ChainResult chain, CacheKey key, RequestContext context,
                                           CacheControlContext cacheControl, long startNanos) {
        ProviderTarget target = chain.getTarget();
        ChatCompletionResponse upstream = chain.getResponse();
        TokenCounts tokens = TokenCounts.from(upstream.getUsage());

        ChatCompletionResponse response = upstream.toBuilder()
                .provider(target.getProvider())
                .content(upstream.firstContent())
                .usage(tokens.toUsage())
                .cacheHit(false)
                .build();

        if (cacheControl.isStore()) {
            cacheService.store(key, response, target.getModel(), target.getProvider(),
                    tokens.input, tokens.output);
        }

        CallCost cost = price(target.getModel(), tokens, false);
        recorder.record(buildEvent(context, target.getModel(), target.getProvider(), tokens,
                cost, elapsedMs(startNanos), null, false, true, null));

        log.info("Provider {} answered model {} after {} attempt(s): {} in / {} out tokens, cost={}",
                target.getProvider(), target.getModel(), chain.getAttempts(), tokens.input, tokens.output,
                cost.getActual() != null ? cost.getActual().toPlainString() : "unavailable");

        return GatewayResponse.builder()
                .response(response)
                .cacheHit(false)
                .provider(target.getProvider())
                .requestId(context.getRequestId())
                .build();
    }

    private void onStreamComplete(StreamAccumulator accumulator, CacheKey key, RequestContext context,
                                  CacheControlContext cacheControl, long startNanos) {
        ProviderTarget target = accumulator.getTarget();
        TokenCounts tokens = accumulator.tokens();

        if (cacheControl.isStore() && cacheStreamedResponses) {
            cacheService.store(key, accumulator.toResponse(target), target.getModel(), target.getProvider(),
                    tokens.input, tokens.output);
        }

        CallCost cost = price(target.getModel(), tokens, false);
        recorder.record(buildEvent(context, target.getModel(), target.getProvider(), tokens,
                cost, elapsedMs(startNanos), accumulator.ttfbMs(), false, true, null));

        log.info("Stream from {} completed for model {}: {} in / {} out tokens, ttfb={}ms",
                target.getProvider(), target.getModel(), tokens.input, tokens.output, accumulator.ttfbMs());
    }

    private void recordFailure(RequestContext context, Throwable error, long startNanos,
                               TokenCounts tokens, Long ttfbMs) {
        String provider = error instanceof ProviderException ? ((ProviderException) error).getProvider() : null;
        String code = error instanceof GatewayException ? ((GatewayException) error).getCode() : "internal_error";
        recorder.record(buildEvent(context, context.getRequestedModel(), provider, tokens,
                CallCost.free(), elapsedMs(startNanos), ttfbMs, false, false, code));
        log.warn("Request {} for model {} failed: {}", context.getRequestId(), context.getRequestedModel(),
                error.getMessage());
    }

    private CallEvent buildEvent(RequestContext context, String model, String provider,
                                 TokenCounts tokens, CallCost cost,
                                 long latencyMs, Long ttfbMs, boolean cacheHit, boolean success, String errorCode) {
        return CallEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .timestamp(Instant.now(clock))
                .requestId(context.getRequestId())
                .source(context.getSource())
                .agentType(context.getAgentType())
                .requestedModel(context.getRequestedModel())
                .model(model)
                .provider(provider)
                .tier(tierResolver.resolve(model))
                .inputTokens(tokens.input)
                .outputTokens(tokens.output)
                .cacheWriteTokens(tokens.cacheWrite)
                .cacheReadTokens(tokens.cacheRead)
                .cost(cost.getActual())
                .wouldBeCost(cost.getWouldBe())
                .savings(cost.getSavings())
                .latencyMs(latencyMs)
                .ttfbMs(ttfbMs)
                .cacheHit(cacheHit)
                .streamed(context.isStreaming())
                .success(success)
                .errorCode(errorCode)
                .build();
    }

    private CallCost price(String model, TokenCounts tokens, boolean cacheHit) {
        return costCalculator.priceCall(model, tokens.input, tokens.output, tokens.cacheWrite, tokens.cacheRead,
                cacheHit);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static final class ServedHit {
        private final ChatCompletionResponse response;
        private final String provider;
        private final long ageSeconds;

        private ServedHit(ChatCompletionResponse response, String provider, long ageSeconds) {
            this.response = response;
            this.provider = provider;
            this.ageSeconds = ageSeconds;
        }
    }

    /**
     * Token counts of one call; cache write/read are provider prompt-cache tokens.
     */
    static final class TokenCounts {
        static final TokenCounts NONE = new TokenCounts(0, 0, 0, 0);

        private final long input;
        private final long output;
        private final long cacheWrite;
        private final long cacheRead;

        TokenCounts(long input, long output, long cacheWrite, long cacheRead) {
            this.input = input;
            this.output = output;
            this.cacheWrite = cacheWrite;
            this.cacheRead = cacheRead;
        }

        static TokenCounts from(Usage usage) {
            if (usage == null) {
                return NONE;
            }
            return new TokenCounts(usage.resolvedInputTokens(), usage.resolvedOutputTokens(),
                    usage.resolvedCacheWriteTokens(), usage.resolvedCacheReadTokens());
        }

        Usage toUsage() {
            return Usage.of(input, output, cacheWrite, cacheRead);
        }
    }

    /**
     * Running state of one forwarded stream: who answered, when the first chunk
     * came, the text so far and the usage reported on the last chunk.
     * Only touched from the upstream subscriber, which is serial.
     */
    static final class StreamAccumulator {
        private final long startNanos;
        private final StringBuilder content = new StringBuilder();
        private ProviderTarget target;
        private Long ttfbMs;
        private String id;
        private Long created;
        private String finishReason;
        private Usage usage;

        StreamAccumulator(long startNanos) {
            this.startNanos = startNanos;
        }

        /**
         * @return true for the first chunk of the stream
         */
        boolean accept(RoutedChunk routed) {
            boolean first = target == null;
            if (first) {
                target = routed.getTarget();
                ttfbMs = elapsedMs(startNanos);
            }
            ChatCompletionChunk chunk = routed.getChunk();
            if (id == null) {
                id = chunk.getId();
                created = chunk.getCreated();
            }
            content.append(chunk.deltaText());
            if (chunk.getChoices() != null && !chunk.getChoices().isEmpty()
                    && chunk.getChoices().get(0).getFinishReason() != null) {
                finishReason = chunk.getChoices().get(0).getFinishReason();
            }
            if (chunk.getUsage() != null) {
                usage = chunk.getUsage();
            }
            return first;
        }

        boolean isStarted() {
            return target != null;
        }

        ProviderTarget getTarget() {
            return target;
        }

        Long ttfbMs() {
            return ttfbMs;
        }

        TokenCounts tokens() {
            return TokenCounts.from(usage);
        }

        ChatCompletionResponse toResponse(ProviderTarget answeredBy) {
            String text = content.toString();
            return ChatCompletionResponse.builder()
                    .id(id)
                    .object("chat.completion")
                    .created(created)
                    .model(answeredBy.getModel())
                    .provider(answeredBy.getProvider())
                    .choices(List.of(Choice.builder()
                            .index(0)
                            .message(Message.builder().role("assistant").content(text).build())
                            .finishReason(finishReason != null ? finishReason : "stop")
                            .build()))
                    .usage(tokens().toUsage())
                    .content(text)
                    .cacheHit(false)
                    .build();
        }
    }

    /**
     * Buffered gateway response with cache metadata.
     */
    @lombok.Data
    @lombok.Builder
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    public static class GatewayResponse {
        private ChatCompletionResponse response;
        private boolean cacheHit;
        private String cacheKey;          // Only for cache hits
        private Long cacheAgeSeconds;     // Only for cache hits
        private String provider;
        private String requestId;
    }

    /**
     * Streaming gateway response: SSE events plus the same metadata.
     */
    @lombok.Data
    @lombok.Builder
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    public static class GatewayStream {
        private Flux<ServerSentEvent<String>> events;
        private boolean cacheHit;
        private String cacheKey;
        private Long cacheAgeSeconds;
        private String provider;
        private String requestId;
    }
}
