package com.relaygate.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.config.JacksonConfiguration;
import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.ProviderException;
import com.relaygate.model.ChatCompletionRequest;
import com.relaygate.model.Message;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OpenAICompatibleProviderTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private MockWebServer mockServer;
    private ObjectMapper objectMapper;
    private OpenAICompatibleProvider provider;
    private RelaygateProperties.ProviderConfig config;

    private final ChatCompletionRequest request = ChatCompletionRequest.builder()
            .model("gpt-4")
            .messages(List.of(Message.builder().role("user").content("Capital of France?").build()))
            .temperature(0.2)
            .build();

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        config = new RelaygateProperties.ProviderConfig();
        config.setName("openai");
        config.setBaseUrl(mockServer.url("/v1").toString());
        config.setApiKey("sk-test");
        config.setTimeout(Duration.ofSeconds(2));

        objectMapper = new JacksonConfiguration().objectMapper();
        provider = new OpenAICompatibleProvider(WebClient.builder().build(), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void testCompleteParsesResponseAndSendsAuth() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setHeader(CONTENT_TYPE, APPLICATION_JSON)
                .setBody("{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion\",\"created\":1,\"model\":\"gpt-4\","
                        + "\"system_fingerprint\":\"fp\","
                        + "\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"Paris\"},"
                        + "\"finish_reason\":\"stop\"}],"
                        + "\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":3,\"total_tokens\":15}}"));

        StepVerifier.create(provider.complete(request, config))
                .assertNext(response -> {
                    assertEquals("Paris", response.firstContent());
                    assertEquals(12, response.getUsage().resolvedInputTokens());
                    assertEquals(3, response.getUsage().resolvedOutputTokens());
                })
                .verifyComplete();

        RecordedRequest recorded = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("/v1/chat/completions", recorded.getPath());
        assertEquals("Bearer sk-test", recorded.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertEquals("gpt-4", body.get("model").asText());
        assertFalse(body.get("stream").asBoolean());
    }

    @Test
    void testRateLimitIsRetryable() {
        mockServer.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"slow down\"}"));

        StepVerifier.create(provider.complete(request, config))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ProviderException);
                    ProviderException failure = (ProviderException) error;
                    assertTrue(failure.isRetryable());
                    assertEquals(429, failure.getUpstreamStatus());
                    assertEquals("openai", failure.getProvider());
                })
                .verify();
    }

    @Test
    void testServerErrorIsRetryable() {
        mockServer.enqueue(new MockResponse().setResponseCode(503));

        StepVerifier.create(provider.complete(request, config))
                .expectErrorSatisfies(error -> assertTrue(((ProviderException) error).isRetryable()))
                .verify();
    }

    @Test
    void testBadRequestIsTerminal() {
        mockServer.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"bad model\"}"));

        StepVerifier.create(provider.complete(request, config))
                .expectErrorSatisfies(error -> {
                    ProviderException failure = (ProviderException) error;
                    assertFalse(failure.isRetryable());
                    assertEquals(400, failure.getStatus().value());
                    assertTrue(failure.getMessage().contains("bad model"));
                })
                .verify();
    }

    @Test
    void testSlowProviderTimesOut() {
        config.setTimeout(Duration.ofMillis(200));
        mockServer.enqueue(new MockResponse()
                .setHeader(CONTENT_TYPE, APPLICATION_JSON)
                .setBody("{\"choices\":[]}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        StepVerifier.create(provider.complete(request, config))
                .expectErrorSatisfies(error -> {
                    ProviderException failure = (ProviderException) error;
                    assertTrue(failure.isRetryable());
                    assertEquals("provider_unreachable", failure.getCode());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testDroppedConnectionIsRetryable() {
        mockServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        StepVerifier.create(provider.complete(request, config))
                .expectErrorSatisfies(error -> assertTrue(((ProviderException) error).isRetryable()))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testResponseWithoutChoicesIsMalformed() {
        mockServer.enqueue(new MockResponse()
                .setHeader(CONTENT_TYPE, APPLICATION_JSON)
                .setBody("{\"id\":\"x\",\"choices\":[]}"));

        StepVerifier.create(provider.complete(request, config))
                .expectErrorSatisfies(error -> {
                    ProviderException failure = (ProviderException) error;
                    assertFalse(failure.isRetryable());
                    assertEquals("provider_malformed_response", failure.getCode());
                })
                .verify();
    }

    @Test
    void testRetriesWithinProviderBeforeGivingUp() {
        config.setMaxRetries(1);
        mockServer.enqueue(new MockResponse().setResponseCode(500));
        mockServer.enqueue(new MockResponse()
                .setHeader(CONTENT_TYPE, APPLICATION_JSON)
                .setBody("{\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"ok\"}}]}"));

        StepVerifier.create(provider.complete(request, config))
                .assertNext(response -> assertEquals("ok", response.firstContent()))
                .verifyComplete();

        assertEquals(2, mockServer.getRequestCount());
    }

    @Test
    void testStreamParsesChunksUntilDone() throws Exception {
        String sse = "data: {\"id\":\"c1\",\"object\":\"chat.completion.chunk\",\"choices\":[{\"index\":0,"
                + "\"delta\":{\"role\":\"assistant\"}}]}\n\n"
                + "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Par\"}}]}\n\n"
                + "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\"is\"},"
                + "\"finish_reason\":\"stop\"}]}\n\n"
                + "data: {\"id\":\"c1\",\"choices\":[],\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":2}}\n\n"
                + "data: [DONE]\n\n";
        mockServer.enqueue(new MockResponse()
                .setHeader(CONTENT_TYPE, "text/event-stream")
                .setBody(sse));

        StepVerifier.create(provider.stream(request, config))
                .assertNext(chunk -> assertEquals("", chunk.deltaText()))
                .assertNext(chunk -> assertEquals("Par", chunk.deltaText()))
                .assertNext(chunk -> assertEquals("stop", chunk.getChoices().get(0).getFinishReason()))
                .assertNext(chunk -> assertEquals(2, chunk.getUsage().resolvedOutputTokens()))
                .verifyComplete();

        JsonNode body = objectMapper.readTree(mockServer.takeRequest().getBody().readUtf8());
        assertTrue(body.get("stream").asBoolean());
        assertTrue(body.get("stream_options").get("include_usage").asBoolean());
    }

    @Test
    void testStreamWithGarbageChunkIsMalformed() {
        mockServer.enqueue(new MockResponse()
                .setHeader(CONTENT_TYPE, "text/event-stream")
                .setBody("data: {not json\n\n"));

        StepVerifier.create(provider.stream(request, config))
                .expectErrorSatisfies(error -> assertFalse(((ProviderException) error).isRetryable()))
                .verify();
    }
}
