package com.relaygate.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UsageTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testOfFillsBothNamingConventions() {
        Usage usage = Usage.of(120, 30);

        assertEquals(120, usage.getPromptTokens());
        assertEquals(120, usage.getInputTokens());
        assertEquals(30, usage.getCompletionTokens());
        assertEquals(30, usage.getOutputTokens());
        assertEquals(150, usage.getTotalTokens());
    }

    @Test
    void testCountTooLargeForWireFormatIsRejected() {
        long tooLarge = Integer.MAX_VALUE + 1L;

        assertThrows(ArithmeticException.class, () -> Usage.of(tooLarge, 0));
        assertThrows(ArithmeticException.class, () -> Usage.of(0, tooLarge));
        assertThrows(ArithmeticException.class, () -> Usage.of(0, 0, tooLarge, 0));
    }

    @Test
    void testTotalThatOverflowsIsRejected() {
        assertThrows(ArithmeticException.class, () -> Usage.of(Integer.MAX_VALUE, 1));
    }

    @Test
    void testPromptCacheTokensOmittedWhenUnused() {
        JsonNode json = objectMapper.valueToTree(Usage.of(10, 5));

        assertFalse(json.has("cache_creation_input_tokens"));
        assertFalse(json.has("cache_read_input_tokens"));
        assertEquals(0, Usage.of(10, 5).resolvedCacheReadTokens());
    }

    @Test
    void testPromptCacheTokensSerialized() {
        JsonNode json = objectMapper.valueToTree(Usage.of(10, 5, 200, 900));

        assertEquals(200, json.get("cache_creation_input_tokens").asInt());
        assertEquals(900, json.get("cache_read_input_tokens").asInt());
        assertEquals(15, json.get("total_tokens").asInt());
    }
}
