package com.relaygate.provider;

import com.relaygate.config.RelaygateProperties;
import com.relaygate.model.ChatCompletionChunk;
import com.relaygate.model.ChatCompletionRequest;
import com.relaygate.model.ChatCompletionResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Interface for chat completion wire protocols.
 * One implementation serves every configured provider of its type; connection
 * facts come from the {@link RelaygateProperties.ProviderConfig} passed on each call.
 * Failures are signalled as {@link com.relaygate.exception.ProviderException}.
 */
public interface ChatProvider {

    /**
     * Get wire protocol type (e.g., "openai", "anthropic").
     *
     * @return provider type
     */
    String getType();

    /**
     * Complete a chat request.
     *
     * @param request OpenAI-compatible request, model already resolved
     * @param config  provider connection facts
     * @return provider response (normalized to OpenAI format)
     */
    Mono<ChatCompletionResponse> complete(ChatCompletionRequest request, RelaygateProperties.ProviderConfig config);

    /**
     * Stream a chat request chunk by chunk as the provider produces it.
     * The last chunk carries usage when the provider reports it.
     *
     * @param request OpenAI-compatible request, model already resolved
     * @param config  provider connection facts
     * @return chunks normalized to OpenAI format, without the [DONE] marker
     */
    Flux<ChatCompletionChunk> stream(ChatCompletionRequest request, RelaygateProperties.ProviderConfig config);
}
