package com.relaygate.service.routing;

import com.relaygate.model.ChatCompletionChunk;
import com.relaygate.model.ProviderTarget;
import lombok.Value;

/**
 * A streamed chunk tagged with the provider that produced it.
 */
@Value
public class RoutedChunk {

    ProviderTarget target;
    ChatCompletionChunk chunk;
}
