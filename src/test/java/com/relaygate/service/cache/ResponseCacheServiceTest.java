package com.relaygate.service.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.CacheStoreException;
import com.relaygate.model.CacheEntry;
import com.relaygate.model.CacheKey;
import com.relaygate.model.CachedLookup;
import com.relaygate.model.ChatCompletionResponse;
import com.relaygate.model.Choice;
import com.relaygate.model.Message;
import com.relaygate.model.Usage;
import com.relaygate.model.dto.CacheStatistics;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResponseCacheServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final CacheKey KEY = CacheKey.of(DigestUtils.sha256Hex("request"));

    private RelaygateProperties properties;
    private ObjectMapper objectMapper;
    private ResponseCacheService cacheService;

    @BeforeEach
    void setUp() {
        properties = new RelaygateProperties();
        objectMapper = new ObjectMapper();
        cacheService = new ResponseCacheService(
                new InMemoryResponseCacheStore(100, Duration.ofHours(1)),
                objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC),
                properties);
    }

    private static ChatCompletionResponse response(String text) {
        return ChatCompletionResponse.builder()
                .id("chatcmpl-1")
                .object("chat.completion")
                .model("opus")
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(Message.builder().role("assistant").content(text).build())
                        .finishReason("stop")
                        .build()))
                .usage(Usage.of(5000, 2000))
                .content(text)
                .build();
    }

    @Test
    void testStoreThenLookup() {
        cacheService.store(KEY, response("Paris"), "opus", "anthropic", 5000, 2000);

        Optional<CachedLookup> lookup = cacheService.lookup(KEY);

        assertTrue(lookup.isPresent());
        CacheEntry entry = lookup.get().getEntry();
        assertEquals("opus", entry.getModel());
        assertEquals("anthropic", entry.getProvider());
        assertEquals(5000, entry.getInputTokens());
        assertEquals(2000, entry.getOutputTokens());
        assertEquals(NOW, entry.getCreatedAt());
        assertEquals("Paris", cacheService.materialize(entry).firstContent());
    }

    @Test
    void testMaterializeReturnsIndependentCopies() {
        cacheService.store(KEY, response("Paris"), "opus", "anthropic", 1, 1);
        CacheEntry entry = cacheService.lookup(KEY).get().getEntry();

        ChatCompletionResponse first = cacheService.materialize(entry);
        first.setContent("tampered");
        first.getChoices().get(0).getMessage().setContent("tampered");

        ChatCompletionResponse second = cacheService.materialize(entry);
        assertEquals("Paris", second.getContent());
        assertEquals("Paris", second.firstContent());
    }

    @Test
    void testCorruptBodyRaisesStoreException() {
        CacheEntry corrupt = CacheEntry.builder().body("{not json").model("opus").build();

        assertThrows(CacheStoreException.class, () -> cacheService.materialize(corrupt));
    }

    @Test
    void testStatisticsTrackHitsAndMisses() {
        cacheService.lookup(KEY);
        cacheService.store(KEY, response("x"), "opus", "anthropic", 1, 1);
        cacheService.lookup(KEY);
        cacheService.lookup(KEY);
        cacheService.lookup(KEY);

        CacheStatistics stats = cacheService.getStatistics();
        assertEquals("memory", stats.getStore());
        assertEquals(3, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(75.0, stats.getHitRate(), 0.0001);
        assertEquals(1, stats.getEntries());
        assertEquals(1, stats.getWrites());
    }

    @Test
    void testHitRateIsZeroWithoutCalls() {
        assertEquals(0.0, ResponseCacheService.hitRate(0, 0));
        assertEquals(0.0, cacheService.getStatistics().getHitRate());
    }

    @Test
    void testHitRateStaysWithinBounds() {
        assertEquals(100.0, ResponseCacheService.hitRate(10, 0));
        assertEquals(0.0, ResponseCacheService.hitRate(0, 10));
        assertEquals(99.0, ResponseCacheService.hitRate(99, 1), 0.0001);
    }

    @Test
    void testStoreFailureBecomesMiss() {
        ResponseCacheStore failing = mock(ResponseCacheStore.class);
        when(failing.getName()).thenReturn("redis");
        when(failing.get(any())).thenThrow(new CacheStoreException("connection refused"));
        doThrow(new CacheStoreException("connection refused")).when(failing).put(any(), any());
        when(failing.size()).thenThrow(new CacheStoreException("connection refused"));

        ResponseCacheService service = new ResponseCacheService(failing, objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC), properties);

        assertTrue(service.lookup(KEY).isEmpty());
        assertDoesNotThrow(() -> service.store(KEY, response("x"), "opus", "redis", 1, 1));

        CacheStatistics stats = service.getStatistics();
        assertEquals(1, stats.getMisses());
        assertEquals(2, stats.getErrors());
        assertEquals(-1, stats.getEntries());
    }

    @Test
    void testDisabledCacheNeverStoresOrHits() {
        properties.getCache().setEnabled(false);
        ResponseCacheStore store = mock(ResponseCacheStore.class);
        when(store.getName()).thenReturn("memory");
        ResponseCacheService disabled = new ResponseCacheService(store, objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC), properties);

        disabled.store(KEY, response("x"), "opus", "anthropic", 1, 1);

        assertTrue(disabled.lookup(KEY).isEmpty());
        verify(store, never()).put(any(), any());
        verify(store, never()).get(any());
    }

    @Test
    void testAgeSeconds() {
        CacheEntry entry = CacheEntry.builder().body("{}").createdAt(NOW.minusSeconds(42)).build();

        assertEquals(42, cacheService.ageSeconds(entry));
    }
}
