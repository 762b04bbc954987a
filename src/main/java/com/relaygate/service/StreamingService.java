package com.relaygate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.exception.GatewayException;
import com.relaygate.model.ChatCompletionChunk;
import com.relaygate.model.ChatCompletionResponse;
import com.relaygate.model.Delta;
import com.relaygate.model.dto.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * SSE formatting for streamed responses, and deterministic replay of cached
 * responses as chunk streams: the same response always produces the same chunks.
 */
@Slf4j
@Service
public class StreamingService {

    public static final String DONE = "[DONE]";

    // Characters per replayed chunk
    private static final int DEFAULT_CHUNK_SIZE = 8;

    private final ObjectMapper objectMapper;

    public StreamingService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Replay a complete response as SSE chunks, terminated by [DONE].
     *
     * @param response cached completion response
     * @return Flux of SSE events
     */
    public Flux<ServerSentEvent<String>> replay(ChatCompletionResponse response) {
        return Flux.fromIterable(chunkResponse(response))
                .map(this::toEvent)
                .concatWith(Flux.just(done()))
                .doOnComplete(() -> log.debug("Replay completed for response {}", response.getId()));
    }

    /**
     * One chunk as an SSE event.
     */
    public ServerSentEvent<String> toEvent(ChatCompletionChunk chunk) {
        return ServerSentEvent.builder(serializeToJson(chunk)).build();
    }

    public ServerSentEvent<String> done() {
        return ServerSentEvent.builder(DONE).build();
    }

    /**
     * In-band error for a stream that already started; the status line is gone by then.
     */
    public ServerSentEvent<String> errorEvent(GatewayException error) {
        return ServerSentEvent.builder(serializeToJson(
                ApiErrorResponse.of(error.getType(), error.getCode(), error.getMessage()))).build();
    }

    /**
     * Chunk a complete response into streaming chunks.
     * Deterministic chunking based on content length.
     */
    List<ChatCompletionChunk> chunkResponse(ChatCompletionResponse response) {
        List<ChatCompletionChunk> chunks = new ArrayList<>();

        String content = response.firstContent();
        chunks.add(createChunk(response, Delta.builder().role("assistant").build(), null, false));

        for (String piece : splitContentDeterministically(content)) {
            chunks.add(createChunk(response, Delta.builder().content(piece).build(), null, false));
        }

        // Final chunk carries finish_reason and usage
        chunks.add(createChunk(response, Delta.builder().build(), response.firstFinishReason(), true));
        return chunks;
    }

    /**
     * Split content into deterministic chunks.
     * Uses word boundaries to avoid splitting words when possible.
     */
    List<String> splitContentDeterministically(String content) {
        List<String> chunks = new ArrayList<>();

        if (content.isEmpty()) {
            return chunks;
        }

        int pos = 0;
        while (pos < content.length()) {
            int endPos = Math.min(pos + DEFAULT_CHUNK_SIZE, content.length());

            // Try to split at word boundary
            if (endPos < content.length()) {
                // Look for space within next 3 characters
                for (int i = endPos; i < Math.min(endPos + 3, content.length()); i++) {
                    if (Character.isWhitespace(content.charAt(i))) {
                        endPos = i + 1;
                        break;
                    }
                }
            }

            // Never cut a surrogate pair, each chunk is encoded on its own
            if (endPos < content.length() && Character.isHighSurrogate(content.charAt(endPos - 1))
                    && Character.isLowSurrogate(content.charAt(endPos))) {
                endPos++;
            }

            chunks.add(content.substring(pos, endPos));
            pos = endPos;
        }

        return chunks;
    }

    private ChatCompletionChunk createChunk(ChatCompletionResponse response, Delta delta,
                                            String finishReason, boolean last) {
        return ChatCompletionChunk.builder()
                .id(response.getId())
                .object("chat.completion.chunk")
                .created(response.getCreated())
                .model(response.getModel())
                .choices(List.of(
                        ChatCompletionChunk.ChunkChoice.builder()
                                .index(0)
                                .delta(delta)
                                .finishReason(finishReason)
                                .build()
                ))
                .usage(last ? response.getUsage() : null)
                .build();
    }

    private String serializeToJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("JSON serialization error", e);
            return "{\"error\":{\"type\":\"serialization_error\"}}";
        }
    }
}
