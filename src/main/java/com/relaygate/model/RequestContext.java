package com.relaygate.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-request facts the router and recorder need besides the body itself.
 */
@Value
@Builder
public class RequestContext {

    String requestId;
    String source;
    String agentType;
    String requestedModel;
    String tier;
    boolean streaming;
}
