package com.relaygate.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.ProviderException;
import com.relaygate.model.ChatCompletionChunk;
import com.relaygate.model.ChatCompletionRequest;
import com.relaygate.model.ChatCompletionResponse;
import com.relaygate.model.Choice;
import com.relaygate.model.Delta;
import com.relaygate.model.Message;
import com.relaygate.model.Usage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Anthropic (Claude) Messages API provider.
 * Requests and responses, including stream events, are translated to and from
 * the OpenAI shape.
 */
@Slf4j
@Component
public class AnthropicProvider extends AbstractChatProvider {

    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final ObjectMapper objectMapper;

    public AnthropicProvider(WebClient webClient, ObjectMapper objectMapper) {
        super(webClient);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getType() {
        return "anthropic";
    }

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request,
                                                 RelaygateProperties.ProviderConfig config) {
        log.info("Forwarding request to {}: model={}", config.getName(), request.getModel());

        JsonNode anthropicRequest = convertToAnthropicFormat(request, false);

        Mono<ChatCompletionResponse> responseMono = webClient.post()
                .uri(config.getBaseUrl() + "/v1/messages")
                .headers(headers -> applyHeaders(headers, config))
                .bodyValue(anthropicRequest.toString())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> convertToOpenAIFormat(response, request.getModel(), config.getName()));

        return executeWithRetry(responseMono, config);
    }

    @Override
    public Flux<ChatCompletionChunk> stream(ChatCompletionRequest request,
                                            RelaygateProperties.ProviderConfig config) {
        log.info("Streaming request to {}: model={}", config.getName(), request.getModel());

        JsonNode anthropicRequest = convertToAnthropicFormat(request, true);

        Flux<ChatCompletionChunk> chunks = Flux.defer(() -> {
            StreamState state = new StreamState(request.getModel());
            return webClient.post()
                    .uri(config.getBaseUrl() + "/v1/messages")
                    .headers(headers -> applyHeaders(headers, config))
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(anthropicRequest.toString())
                    .retrieve()
                    .bodyToFlux(SSE_TYPE)
                    .filter(event -> event.data() != null && !event.data().isBlank())
                    .takeWhile(event -> !"message_stop".equals(event.event()))
                    .<ChatCompletionChunk>handle((event, sink) -> {
                        ChatCompletionChunk chunk = convertStreamEvent(event, state, config.getName());
                        if (chunk != null) {
                            sink.next(chunk);
                        }
                    });
        });

        return executeStream(chunks, config);
    }

    private void applyHeaders(HttpHeaders headers, RelaygateProperties.ProviderConfig config) {
        if (hasApiKey(config)) {
            headers.set("x-api-key", config.getApiKey());
        }
        headers.set("anthropic-version", ANTHROPIC_VERSION);
        headers.setContentType(MediaType.APPLICATION_JSON);
    }

    /**
     * Convert OpenAI request to Anthropic format.
     */
    private JsonNode convertToAnthropicFormat(ChatCompletionRequest request, boolean stream) {
        ObjectNode anthropicRequest = objectMapper.createObjectNode();
        anthropicRequest.put("model", request.getModel());

        // System messages go to the top-level "system" field
        List<String> systemParts = new ArrayList<>();
        ArrayNode messagesArray = objectMapper.createArrayNode();
        for (Message msg : request.getMessages()) {
            if ("system".equals(msg.getRole())) {
                systemParts.add(msg.getContent());
                continue;
            }
            ObjectNode anthropicMsg = objectMapper.createObjectNode();
            anthropicMsg.put("role", msg.getRole());

            ArrayNode contentArray = objectMapper.createArrayNode();
            ObjectNode textContent = objectMapper.createObjectNode();
            textContent.put("type", "text");
            textContent.put("text", msg.getContent());
            contentArray.add(textContent);

            anthropicMsg.set("content", contentArray);
            messagesArray.add(anthropicMsg);
        }
        anthropicRequest.set("messages", messagesArray);

        if (!systemParts.isEmpty()) {
            anthropicRequest.put("system", String.join("\n\n", systemParts));
        }

        anthropicRequest.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_MAX_TOKENS);

        if (request.getTemperature() != null) {
            anthropicRequest.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            anthropicRequest.put("top_p", request.getTopP());
        }
        if (request.getStop() != null) {
            anthropicRequest.set("stop_sequences", objectMapper.valueToTree(
                    request.getStop() instanceof String ? List.of(request.getStop()) : request.getStop()));
        }
        if (stream) {
            anthropicRequest.put("stream", true);
        }

        return anthropicRequest;
    }

    /**
     * Convert Anthropic response to OpenAI format.
     */
    private ChatCompletionResponse convertToOpenAIFormat(JsonNode anthropicResponse, String model, String provider) {
        JsonNode content = anthropicResponse.get("content");
        if (content == null || !content.isArray()) {
            throw ProviderException.malformed(provider, "missing content array");
        }

        StringBuilder contentBuilder = new StringBuilder();
        for (JsonNode item : content) {
            if ("text".equals(item.path("type").asText())) {
                contentBuilder.append(item.path("text").asText());
            }
        }

        String finishReason = anthropicResponse.has("stop_reason")
                ? mapStopReason(anthropicResponse.get("stop_reason").asText())
                : "stop";

        Message assistantMessage = Message.builder()
                .role("assistant")
                .content(contentBuilder.toString())
                .build();

        Choice choice = Choice.builder()
                .index(0)
                .message(assistantMessage)
                .finishReason(finishReason)
                .build();

        Usage usage = null;
        JsonNode usageNode = anthropicResponse.get("usage");
        if (usageNode != null) {
            usage = usage(provider, usageNode.path("input_tokens").asLong(0),
                    usageNode.path("output_tokens").asLong(0), usageNode);
        }

        return ChatCompletionResponse.builder()
                .id(anthropicResponse.has("id")
                        ? "chatcmpl-" + anthropicResponse.get("id").asText()
                        : "chatcmpl-" + UUID.randomUUID().toString().substring(0, 8))
                .object("chat.completion")
                .created(Instant.now().getEpochSecond())
                .model(model)
                .choices(List.of(choice))
                .usage(usage)
                .build();
    }

    /**
     * Translate one Messages API stream event. Returns null for events with no OpenAI counterpart.
     */
    private ChatCompletionChunk convertStreamEvent(ServerSentEvent<String> event, StreamState state, String provider) {
        JsonNode data;
        try {
            data = objectMapper.readTree(event.data());
        } catch (JsonProcessingException e) {
            throw ProviderException.malformed(provider, "unparseable stream event");
        }

        String type = event.event() != null ? event.event() : data.path("type").asText();
        return switch (type) {
            case "message_start" -> {
                JsonNode message = data.path("message");
                if (message.has("id")) {
                    state.id = "chatcmpl-" + message.get("id").asText();
                }
                state.usage = message.path("usage");
                yield state.chunk(Delta.builder().role("assistant").build(), null, null);
            }
            case "content_block_delta" -> {
                JsonNode delta = data.path("delta");
                if (!"text_delta".equals(delta.path("type").asText())) {
                    yield null;
                }
                yield state.chunk(Delta.builder().content(delta.path("text").asText()).build(), null, null);
            }
            case "message_delta" -> {
                long outputTokens = data.path("usage").path("output_tokens").asLong(0);
                String stopReason = mapStopReason(data.path("delta").path("stop_reason").asText("end_turn"));
                yield state.chunk(Delta.builder().build(), stopReason, usage(provider,
                        state.usage.path("input_tokens").asLong(0), outputTokens, state.usage));
            }
            case "error" -> {
                String errorType = data.path("error").path("type").asText();
                boolean retryable = "overloaded_error".equals(errorType) || "api_error".equals(errorType);
                throw new ProviderException(provider, null, retryable,
                        "stream error: " + data.path("error").path("message").asText(errorType));
            }
            default -> null;
        };
    }

    /**
     * Usage including prompt-cache tokens, which Anthropic reports apart from input_tokens.
     */
    private static Usage usage(String provider, long inputTokens, long outputTokens, JsonNode usageNode) {
        try {
            return Usage.of(inputTokens, outputTokens,
                    usageNode.path("cache_creation_input_tokens").asLong(0),
                    usageNode.path("cache_read_input_tokens").asLong(0));
        } catch (ArithmeticException e) {
            throw ProviderException.malformed(provider, "token count out of range");
        }
    }

    /**
     * Map Claude stop reasons to OpenAI finish reasons.
     */
    private String mapStopReason(String claudeStopReason) {
        return switch (claudeStopReason) {
            case "max_tokens" -> "length";
            case "tool_use" -> "tool_calls";
            default -> "stop";
        };
    }

    /**
     * Per-subscription stream bookkeeping.
     */
    private static final class StreamState {
        private final String model;
        private final long created = Instant.now().getEpochSecond();
        private String id = "chatcmpl-" + UUID.randomUUID().toString().substring(0, 8);
        private JsonNode usage = MissingNode.getInstance();

        private StreamState(String model) {
            this.model = model;
        }

        private ChatCompletionChunk chunk(Delta delta, String finishReason, Usage usage) {
            return ChatCompletionChunk.builder()
                    .id(id)
                    .object("chat.completion.chunk")
                    .created(created)
                    .model(model)
                    .choices(List.of(ChatCompletionChunk.ChunkChoice.builder()
                            .index(0)
                            .delta(delta)
                            .finishReason(finishReason)
                            .build()))
                    .usage(usage)
                    .build();
        }
    }
}
