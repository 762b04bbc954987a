package com.relaygate.service.routing;

import com.relaygate.model.ChatCompletionResponse;
import com.relaygate.model.ProviderTarget;
import lombok.Value;

/**
 * Successful buffered chain execution: the response and who actually answered.
 */
@Value
public class ChainResult {

    ChatCompletionResponse response;
    ProviderTarget target;
    int attempts;
}
