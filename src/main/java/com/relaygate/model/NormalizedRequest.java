package com.relaygate.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Canonical form of an inbound chat call: only the fields that change the answer.
 * Request id, user and metadata are deliberately absent.
 */
@Value
@Builder
public class NormalizedRequest {

    String model;
    List<Message> messages;
    BigDecimal temperature;
    BigDecimal topP;
    Integer maxTokens;
    List<String> stop;
    BigDecimal presencePenalty;
    BigDecimal frequencyPenalty;
}
