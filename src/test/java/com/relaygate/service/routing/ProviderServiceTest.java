package com.relaygate.service.routing;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.ProviderChainExhaustedException;
import com.relaygate.exception.ProviderException;
import com.relaygate.model.ChatCompletionChunk;
import com.relaygate.model.ChatCompletionRequest;
import com.relaygate.model.ChatCompletionResponse;
import com.relaygate.model.Delta;
import com.relaygate.model.Message;
import com.relaygate.model.ProviderTarget;
import com.relaygate.provider.ChatProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProviderServiceTest {

    private final List<String> called = new CopyOnWriteArrayList<>();
    private RelaygateProperties properties;
    private ChatProvider adapter;

    private final ChatCompletionRequest request = ChatCompletionRequest.builder()
            .model("opus")
            .messages(List.of(Message.builder().role("user").content("hi").build()))
            .build();

    @BeforeEach
    void setUp() {
        properties = new RelaygateProperties();
        properties.setProviders(List.of(
                ModelRouterTest.provider("a", true),
                ModelRouterTest.provider("b", true),
                ModelRouterTest.provider("c", true)));
        properties.getRouting().setDefaultChain(List.of("a", "b", "c"));
        adapter = mock(ChatProvider.class);
        when(adapter.getType()).thenReturn("openai");
    }

    private ProviderService service() {
        return new ProviderService(List.of(adapter), new ModelRouter(properties), properties);
    }

    private static RoutePlan plan(String... providers) {
        List<ProviderTarget> targets = new ArrayList<>();
        for (String provider : providers) {
            targets.add(new ProviderTarget(provider, "opus"));
        }
        return new RoutePlan(targets, "default");
    }

    private static ChatCompletionResponse answer(String provider) {
        return ChatCompletionResponse.builder().id(provider).content("from " + provider).build();
    }

    private void completeBy(Map<String, Function<String, Mono<ChatCompletionResponse>>> behaviour) {
        when(adapter.complete(any(), any())).thenAnswer(inv -> {
            RelaygateProperties.ProviderConfig config = inv.getArgument(1);
            called.add(config.getName());
            return behaviour.get(config.getName()).apply(config.getName());
        });
    }

    @Test
    void testTimeoutFallsBackToNextProvider() {
        completeBy(Map.of(
                "a", name -> Mono.error(ProviderException.timeout(name, new TimeoutException())),
                "b", name -> Mono.just(answer(name)),
                "c", name -> Mono.just(answer(name))));

        StepVerifier.create(service().execute(request, plan("a", "b", "c")))
                .assertNext(result -> {
                    assertEquals("b", result.getTarget().getProvider());
                    assertEquals("from b", result.getResponse().getContent());
                    assertEquals(2, result.getAttempts());
                })
                .verifyComplete();

        assertEquals(List.of("a", "b"), called);
    }

    @Test
    void testRateLimitAndServerErrorsAreRetryable() {
        completeBy(Map.of(
                "a", name -> Mono.error(new ProviderException(name, 429, true, "rate limited")),
                "b", name -> Mono.error(new ProviderException(name, 503, true, "overloaded")),
                "c", name -> Mono.just(answer(name))));

        StepVerifier.create(service().execute(request, plan("a", "b", "c")))
                .assertNext(result -> assertEquals("c", result.getTarget().getProvider()))
                .verifyComplete();
    }

    @Test
    void testTerminalErrorAbortsChain() {
        completeBy(Map.of(
                "a", name -> Mono.error(new ProviderException(name, 400, false, "bad request")),
                "b", name -> Mono.just(answer(name)),
                "c", name -> Mono.just(answer(name))));

        StepVerifier.create(service().execute(request, plan("a", "b", "c")))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ProviderException);
                    assertEquals(400, ((ProviderException) error).getStatus().value());
                })
                .verify();

        assertEquals(List.of("a"), called);
    }

    @Test
    void testExhaustedChainListsEveryAttempt() {
        completeBy(Map.of(
                "a", name -> Mono.error(ProviderException.timeout(name, new TimeoutException())),
                "b", name -> Mono.error(new ProviderException(name, 500, true, "boom")),
                "c", name -> Mono.error(new ProviderException(name, 502, true, "bad gateway"))));

        StepVerifier.create(service().execute(request, plan("a", "b", "c")))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ProviderChainExhaustedException);
                    List<ProviderChainExhaustedException.Attempt> attempts =
                            ((ProviderChainExhaustedException) error).getAttempts();
                    assertEquals(3, attempts.size());
                    assertEquals("a", attempts.get(0).getProvider());
                    assertEquals("c", attempts.get(2).getProvider());
                })
                .verify();
    }

    @Test
    void testAttemptBudgetCapsChain() {
        properties.getRouting().setMaxAttempts(2);
        completeBy(Map.of(
                "a", name -> Mono.error(ProviderException.timeout(name, new TimeoutException())),
                "b", name -> Mono.error(ProviderException.timeout(name, new TimeoutException())),
                "c", name -> Mono.just(answer(name))));

        StepVerifier.create(service().execute(request, plan("a", "b", "c")))
                .expectError(ProviderChainExhaustedException.class)
                .verify();

        assertEquals(List.of("a", "b"), called);
    }

    @Test
    void testRewrittenModelIsSentToProvider() {
        completeBy(Map.of("a", name -> Mono.just(answer(name))));

        RoutePlan rewritten = new RoutePlan(List.of(new ProviderTarget("a", "claude-opus-4")), "agent:x");
        StepVerifier.create(service().execute(request, rewritten))
                .expectNextCount(1)
                .verifyComplete();

        verify(adapter).complete(argThat(r -> "claude-opus-4".equals(r.getModel())), any());
    }

    private static ChatCompletionChunk chunk(String text) {
        return ChatCompletionChunk.builder()
                .choices(List.of(ChatCompletionChunk.ChunkChoice.builder()
                        .index(0)
                        .delta(Delta.builder().content(text).build())
                        .build()))
                .build();
    }

    @Test
    void testStreamFallsBackBeforeFirstChunk() {
        when(adapter.stream(any(), any())).thenAnswer(inv -> {
            RelaygateProperties.ProviderConfig config = inv.getArgument(1);
            called.add(config.getName());
            if ("a".equals(config.getName())) {
                return Flux.error(ProviderException.connection("a", new RuntimeException("refused")));
            }
            return Flux.just(chunk("Hel"), chunk("lo"));
        });

        StepVerifier.create(service().executeStream(request, plan("a", "b")))
                .assertNext(routed -> {
                    assertEquals("b", routed.getTarget().getProvider());
                    assertEquals("Hel", routed.getChunk().deltaText());
                })
                .assertNext(routed -> assertEquals("lo", routed.getChunk().deltaText()))
                .verifyComplete();
    }

    @Test
    void testStreamNeverFallsBackAfterFirstChunk() {
        when(adapter.stream(any(), any())).thenAnswer(inv -> {
            RelaygateProperties.ProviderConfig config = inv.getArgument(1);
            called.add(config.getName());
            return Flux.just(chunk("partial"))
                    .concatWith(Flux.error(new ProviderException(config.getName(), 503, true, "dropped")));
        });

        StepVerifier.create(service().executeStream(request, plan("a", "b")))
                .expectNextCount(1)
                .expectError(ProviderException.class)
                .verify();

        assertEquals(List.of("a"), called);
    }
}
