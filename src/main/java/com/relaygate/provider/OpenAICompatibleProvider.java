package com.relaygate.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.ProviderException;
import com.relaygate.model.ChatCompletionChunk;
import com.relaygate.model.ChatCompletionRequest;
import com.relaygate.model.ChatCompletionResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * OpenAI chat completion wire protocol.
 * Serves OpenAI itself and compatible servers (Ollama, vLLM, LocalAI).
 */
@Slf4j
@Component
public class OpenAICompatibleProvider extends AbstractChatProvider {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final ObjectMapper objectMapper;

    public OpenAICompatibleProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getType() {
        return "openai";
    }

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request,
                                                 RelaygateProperties.ProviderConfig config) {
        log.info("Forwarding request to {}: model={}", config.getName(), request.getModel());

        ChatCompletionRequest upstream = request.toBuilder()
                .stream(false)
                .streamOptions(null)
                .build();

        Mono<ChatCompletionResponse> responseMono = webClient.post()
                .uri(config.getBaseUrl() + "/chat/completions")
                .headers(headers -> applyHeaders(headers, config))
                .bodyValue(upstream)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .map(response -> validate(response, config.getName()));

        return executeWithRetry(responseMono, config);
    }

    @Override
    public Flux<ChatCompletionChunk> stream(ChatCompletionRequest request,
                                            RelaygateProperties.ProviderConfig config) {
        log.info("Streaming request to {}: model={}", config.getName(), request.getModel());

        ChatCompletionRequest upstream = request.toBuilder()
                .stream(true)
                .streamOptions(Map.of("include_usage", true))
                .build();

        Flux<ChatCompletionChunk> chunks = webClient.post()
                .uri(config.getBaseUrl() + "/chat/completions")
                .headers(headers -> applyHeaders(headers, config))
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(upstream)
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .map(ServerSentEvent::data)
                .filter(data -> data != null && !data.isBlank())
                .takeWhile(data -> !"[DONE]".equals(data.trim()))
                .map(data -> parseChunk(data, config.getName()));

        return executeStream(chunks, config);
    }

    private void applyHeaders(HttpHeaders headers, RelaygateProperties.ProviderConfig config) {
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (hasApiKey(config)) {
            headers.set(HttpHeaders.AUTHORIZATION, bearer(config));
        }
    }

    private ChatCompletionResponse validate(ChatCompletionResponse response, String provider) {
        if (response.getChoices() == null || response.getChoices().isEmpty()) {
            throw ProviderException.malformed(provider, "no choices in response");
        }
        return response;
    }

    private ChatCompletionChunk parseChunk(String data, String provider) {
        try {
            return objectMapper.readValue(data, ChatCompletionChunk.class);
        } catch (JsonProcessingException e) {
            throw ProviderException.malformed(provider, "unparseable stream chunk");
        }
    }
}
