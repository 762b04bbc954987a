package com.relaygate.controller;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.model.CacheControlContext;
import com.relaygate.model.ChatCompletionRequest;
import com.relaygate.model.ChatCompletionResponse;
import com.relaygate.model.GatewayHeaders;
import com.relaygate.model.RequestContext;
import com.relaygate.service.CacheControlParser;
import com.relaygate.service.GatewayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * OpenAI-compatible chat completions controller with cache and routing headers.
 * Supports both regular and SSE streaming responses.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class ChatController {

    private final GatewayService gatewayService;
    private final CacheControlParser cacheControlParser;
    private final String agentHeader;

    public ChatController(GatewayService gatewayService,
                          CacheControlParser cacheControlParser,
                          RelaygateProperties properties) {
        this.gatewayService = gatewayService;
        this.cacheControlParser = cacheControlParser;
        this.agentHeader = properties.getRouting().getAgentHeader();
    }

    /**
     * Chat completions endpoint.
     * Supports both regular JSON responses and SSE streaming.
     */
    @PostMapping(value = "/chat/completions",
                 consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<? extends ResponseEntity<?>> createChatCompletion(
            @RequestBody ChatCompletionRequest request,
            @RequestHeader HttpHeaders headers) {

        log.info("Received chat completion request for model: {}, stream: {}",
                request.getModel(), request.getStream());

        CacheControlContext cacheContext = cacheControlParser.parse(headers);
        log.debug("Parsed cache control context: bypass={}, store={}",
                cacheContext.isBypass(), cacheContext.isStore());

        RequestContext context;
        try {
            context = gatewayService.prepare(request,
                    headers.getFirst(GatewayHeaders.REQUEST_ID),
                    headers.getFirst(GatewayHeaders.SOURCE),
                    headers.getFirst(agentHeader));
        } catch (RuntimeException e) {
            return Mono.error(e);
        }

        if (context.isStreaming()) {
            return handleStreamingRequest(request, context, cacheContext);
        }
        return handleRegularRequest(request, context, cacheContext);
    }

    /**
     * Handle regular (non-streaming) request.
     */
    private Mono<ResponseEntity<ChatCompletionResponse>> handleRegularRequest(
            ChatCompletionRequest request,
            RequestContext context,
            CacheControlContext cacheContext) {
        return gatewayService.complete(request, context, cacheContext)
                .map(result -> {
                    HttpHeaders headers = gatewayHeaders(result.isCacheHit(), result.getCacheKey(),
                            result.getCacheAgeSeconds(), result.getProvider(), result.getRequestId());
                    return ResponseEntity.ok()
                            .headers(headers)
                            .body(result.getResponse());
                });
    }

    /**
     * Handle streaming request with SSE.
     */
    private Mono<ResponseEntity<Flux<ServerSentEvent<String>>>> handleStreamingRequest(
            ChatCompletionRequest request,
            RequestContext context,
            CacheControlContext cacheContext) {
        return gatewayService.stream(request, context, cacheContext)
                .map(result -> {
                    HttpHeaders headers = gatewayHeaders(result.isCacheHit(), result.getCacheKey(),
                            result.getCacheAgeSeconds(), result.getProvider(), result.getRequestId());
                    headers.setContentType(MediaType.TEXT_EVENT_STREAM);
                    headers.setCacheControl("no-cache");
                    return ResponseEntity.ok()
                            .headers(headers)
                            .body(result.getEvents());
                });
    }

    private HttpHeaders gatewayHeaders(boolean cacheHit, String cacheKey, Long cacheAgeSeconds,
                                       String provider, String requestId) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(GatewayHeaders.CACHE_HIT, String.valueOf(cacheHit));

        if (cacheHit) {
            if (cacheKey != null) {
                headers.add(GatewayHeaders.CACHE_KEY, cacheKey);
            }
            if (cacheAgeSeconds != null) {
                headers.add(GatewayHeaders.CACHE_AGE, String.valueOf(cacheAgeSeconds));
            }
        }

        if (provider != null) {
            headers.add(GatewayHeaders.PROVIDER, provider);
        }
        headers.add(GatewayHeaders.REQUEST_ID, requestId);
        return headers;
    }
}
