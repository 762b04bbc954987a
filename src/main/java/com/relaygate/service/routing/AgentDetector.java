package com.relaygate.service.routing;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Works out which agent sent a request: the explicit header wins, otherwise the
 * first agent whose keyword appears in the system message.
 */
@Slf4j
@Component
public class AgentDetector {

    private final Map<String, List<String>> agentKeywords;

    public AgentDetector(RelaygateProperties properties) {
        this.agentKeywords = Collections.unmodifiableMap(
                new LinkedHashMap<>(properties.getRouting().getAgentKeywords()));
    }

    /**
     * @param headerValue value of the agent header, may be null
     * @param messages    request messages
     * @return agent type, or null when unknown
     */
    public String detect(String headerValue, List<Message> messages) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        if (messages == null) {
            return null;
        }
        String system = messages.stream()
                .filter(m -> "system".equalsIgnoreCase(m.getRole()))
                .map(Message::getContent)
                .filter(c -> c != null && !c.isBlank())
                .findFirst()
                .orElse(null);
        if (system == null) {
            return null;
        }

        String lower = system.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> agent : agentKeywords.entrySet()) {
            for (String keyword : agent.getValue()) {
                if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                    log.debug("Detected agent '{}' from system message keyword '{}'", agent.getKey(), keyword);
                    return agent.getKey();
                }
            }
        }
        return null;
    }
}
