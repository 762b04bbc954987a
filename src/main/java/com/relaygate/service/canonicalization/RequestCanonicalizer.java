package com.relaygate.service.canonicalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relaygate.model.CacheKey;
import com.relaygate.model.ChatCompletionRequest;
import com.relaygate.model.Message;
import com.relaygate.model.NormalizedRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Canonicalizes chat completion requests for stable cache keys.
 *
 * Steps:
 * 1. Keep only the fields that change the answer (model, messages, sampling params)
 * 2. Drop absent values, keep explicit ones even when they equal a provider default
 * 3. Format numbers canonically (0.7 == 0.70, 1 == 1.0)
 * 4. Sort JSON keys recursively
 * 5. Generate SHA-256 hash
 *
 * Message content is hashed exactly as sent.
 */
@Slf4j
@Service
public class RequestCanonicalizer {

    private final ObjectMapper objectMapper;

    public RequestCanonicalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Generate the cache key for a request.
     *
     * @param request chat completion request
     * @return SHA-256 based key (64 hex chars)
     */
    public CacheKey generateKey(ChatCompletionRequest request) {
        String canonical = canonicalize(normalize(request));
        CacheKey key = CacheKey.of(DigestUtils.sha256Hex(canonical));
        log.debug("Generated cache key {} for model {}", key, request.getModel());
        return key;
    }

    /**
     * Reduce a request to its answer-relevant fields.
     */
    public NormalizedRequest normalize(ChatCompletionRequest request) {
        List<Message> messages = request.getMessages() == null
                ? List.of()
                : request.getMessages().stream()
                        .map(m -> Message.builder()
                                .role(m.getRole())
                                .content(m.getContent())
                                .name(m.getName())
                                .build())
                        .toList();

        return NormalizedRequest.builder()
                .model(request.getModel())
                .messages(messages)
                .temperature(decimal(request.getTemperature()))
                .topP(decimal(request.getTopP()))
                .maxTokens(request.getMaxTokens())
                .stop(stopSequences(request.getStop()))
                .presencePenalty(decimal(request.getPresencePenalty()))
                .frequencyPenalty(decimal(request.getFrequencyPenalty()))
                .build();
    }

    /**
     * Generate canonical JSON string for a normalized request.
     *
     * @param request normalized request
     * @return canonical JSON string
     */
    public String canonicalize(NormalizedRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", request.getModel());

        ArrayNode messages = root.putArray("messages");
        for (Message message : request.getMessages()) {
            ObjectNode node = messages.addObject();
            node.put("role", message.getRole());
            // Null content and empty content are different requests
            if (message.getContent() == null) {
                node.putNull("content");
            } else {
                node.put("content", message.getContent());
            }
            if (message.getName() != null) {
                node.put("name", message.getName());
            }
        }

        putIfPresent(root, "temperature", request.getTemperature());
        putIfPresent(root, "top_p", request.getTopP());
        putIfPresent(root, "presence_penalty", request.getPresencePenalty());
        putIfPresent(root, "frequency_penalty", request.getFrequencyPenalty());
        if (request.getMaxTokens() != null) {
            root.put("max_tokens", request.getMaxTokens());
        }
        if (request.getStop() != null) {
            ArrayNode stop = root.putArray("stop");
            request.getStop().forEach(stop::add);
        }

        StringBuilder sb = new StringBuilder();
        serializeNode(root, sb);
        return sb.toString();
    }

    private void putIfPresent(ObjectNode node, String field, BigDecimal value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    /**
     * Canonical decimal: trailing zeros stripped so 0.7, 0.70 and 7E-1 agree.
     */
    private BigDecimal decimal(Double value) {
        if (value == null) {
            return null;
        }
        BigDecimal stripped = BigDecimal.valueOf(value).stripTrailingZeros();
        return stripped.signum() == 0 ? BigDecimal.ZERO : stripped;
    }

    private List<String> stopSequences(Object stop) {
        if (stop == null) {
            return null;
        }
        if (stop instanceof String) {
            return List.of((String) stop);
        }
        if (stop instanceof Collection) {
            Collection<?> values = (Collection<?>) stop;
            List<String> sequences = new ArrayList<>(values.size());
            for (Object value : values) {
                sequences.add(String.valueOf(value));
            }
            return sequences;
        }
        return List.of(String.valueOf(stop));
    }

    private void serializeNode(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull()) {
            sb.append("null");
        } else if (node.isObject()) {
            sb.append("{");
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            boolean first = true;
            for (String fieldName : fieldNames) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                sb.append("\"").append(escapeJson(fieldName)).append("\":");
                serializeNode(node.get(fieldName), sb);
            }
            sb.append("}");
        } else if (node.isArray()) {
            sb.append("[");
            boolean first = true;
            for (JsonNode element : node) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                serializeNode(element, sb);
            }
            sb.append("]");
        } else if (node.isTextual()) {
            sb.append("\"").append(escapeJson(node.asText())).append("\"");
        } else if (node.isBigDecimal()) {
            sb.append(node.decimalValue().toPlainString());
        } else if (node.isNumber()) {
            sb.append(node.asText());
        } else if (node.isBoolean()) {
            sb.append(node.asBoolean());
        }
    }

    private String escapeJson(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
