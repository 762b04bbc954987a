package com.relaygate.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.exception.InvalidRequestException;
import com.relaygate.model.ChatCompletionChunk;
import com.relaygate.model.ChatCompletionResponse;
import com.relaygate.model.Choice;
import com.relaygate.model.Message;
import com.relaygate.model.Usage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamingServiceTest {

    private ObjectMapper objectMapper;
    private StreamingService streamingService;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        streamingService = new StreamingService(objectMapper);
    }

    private static ChatCompletionResponse response(String text) {
        return ChatCompletionResponse.builder()
                .id("chatcmpl-42")
                .object("chat.completion")
                .created(1700000000L)
                .model("claude-sonnet-4")
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(Message.builder().role("assistant").content(text).build())
                        .finishReason("stop")
                        .build()))
                .usage(Usage.of(12, 6))
                .build();
    }

    @Test
    void testSplitReassemblesContent() {
        String text = "The quick brown fox jumps over the lazy dog";

        List<String> pieces = streamingService.splitContentDeterministically(text);

        assertEquals(text, String.join("", pieces));
        assertTrue(pieces.size() > 1);
        for (String piece : pieces) {
            assertTrue(piece.length() <= 11, "piece too long: '" + piece + "'");
        }
    }

    @Test
    void testSplitPrefersWordBoundary() {
        List<String> pieces = streamingService.splitContentDeterministically("abcdefgh ijklmnop");

        assertEquals("abcdefgh ", pieces.get(0));
        assertEquals("ijklmnop", pieces.get(1));
    }

    @Test
    void testSplitKeepsSurrogatePairsTogether() {
        String text = "1234567\uD83D\uDE00abcdefghij";

        List<String> pieces = streamingService.splitContentDeterministically(text);

        StringBuilder reencoded = new StringBuilder();
        for (String piece : pieces) {
            assertFalse(Character.isLowSurrogate(piece.charAt(0)), "piece starts mid-pair: '" + piece + "'");
            assertFalse(Character.isHighSurrogate(piece.charAt(piece.length() - 1)),
                    "piece ends mid-pair: '" + piece + "'");
            reencoded.append(new String(piece.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));
        }
        assertEquals(text, reencoded.toString());
        assertEquals("1234567\uD83D\uDE00", pieces.get(0));
    }

    @Test
    void testReplayOfEmojiMatchesLiveContent() throws Exception {
        String text = "ok 1234\uD83D\uDE80\uD83D\uDE80\uD83D\uDE80 launched";

        StringBuilder streamed = new StringBuilder();
        for (ChatCompletionChunk chunk : streamingService.chunkResponse(response(text))) {
            byte[] wire = objectMapper.writeValueAsBytes(chunk);
            streamed.append(objectMapper.readValue(wire, ChatCompletionChunk.class).deltaText());
        }

        assertEquals(text, streamed.toString());
    }

    @Test
    void testSplitEmptyContent() {
        assertTrue(streamingService.splitContentDeterministically("").isEmpty());
    }

    @Test
    void testChunkingIsDeterministic() {
        ChatCompletionResponse response = response("Deterministic replay of the same cached answer");

        List<ChatCompletionChunk> first = streamingService.chunkResponse(response);
        List<ChatCompletionChunk> second = streamingService.chunkResponse(response);

        assertEquals(first, second);
    }

    @Test
    void testChunkShape() {
        List<ChatCompletionChunk> chunks = streamingService.chunkResponse(response("Hello world"));

        ChatCompletionChunk roleChunk = chunks.get(0);
        assertEquals("assistant", roleChunk.getChoices().get(0).getDelta().getRole());
        assertNull(roleChunk.getUsage());

        ChatCompletionChunk last = chunks.get(chunks.size() - 1);
        assertEquals("stop", last.getChoices().get(0).getFinishReason());
        assertEquals(18, last.getUsage().getTotalTokens());

        for (ChatCompletionChunk chunk : chunks) {
            assertEquals("chatcmpl-42", chunk.getId());
            assertEquals("chat.completion.chunk", chunk.getObject());
            assertEquals("claude-sonnet-4", chunk.getModel());
        }
    }

    @Test
    void testReplayEndsWithDone() {
        StepVerifier.create(streamingService.replay(response("Hi")))
                .assertNext(event -> assertTrue(event.data().contains("\"role\":\"assistant\"")))
                .assertNext(event -> assertTrue(event.data().contains("\"content\":\"Hi\"")))
                .assertNext(event -> assertTrue(event.data().contains("\"finish_reason\":\"stop\"")))
                .assertNext(event -> assertEquals(StreamingService.DONE, event.data()))
                .verifyComplete();
    }

    @Test
    void testReplayOfEmptyContent() {
        StepVerifier.create(streamingService.replay(response("")))
                .expectNextCount(2)
                .assertNext(event -> assertEquals(StreamingService.DONE, event.data()))
                .verifyComplete();
    }

    @Test
    void testErrorEvent() throws Exception {
        ServerSentEvent<String> event = streamingService.errorEvent(
                new InvalidRequestException("model is required"));

        JsonNode error = objectMapper.readTree(event.data()).get("error");
        assertEquals("invalid_request_error", error.get("type").asText());
        assertEquals("invalid_request", error.get("code").asText());
        assertEquals("model is required", error.get("message").asText());
    }
}
