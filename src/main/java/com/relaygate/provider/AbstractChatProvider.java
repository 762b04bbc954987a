package com.relaygate.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.relaygate.config.RelaygateProperties;
import com.relaygate.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for chat providers with common functionality:
 * per-provider timeout, error classification and same-provider retries.
 */
@Slf4j
public abstract class AbstractChatProvider implements ChatProvider {

    private static final Duration RETRY_BACKOFF = Duration.ofMillis(250);
    private static final Duration MAX_RETRY_BACKOFF = Duration.ofSeconds(5);
    private static final int MAX_ERROR_DETAIL = 500;

    protected final WebClient webClient;

    protected AbstractChatProvider(WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Execute request with timeout, classification and retry logic.
     */
    protected <T> Mono<T> executeWithRetry(Mono<T> request, RelaygateProperties.ProviderConfig config) {
        return request
                .timeout(config.getTimeout())
                .onErrorMap(error -> classify(error, config.getName()))
                .retryWhen(retrySpec(config))
                .doOnSuccess(response -> log.debug("Request succeeded for provider: {}", config.getName()))
                .doOnError(error -> log.debug("Request failed for provider {}: {}", config.getName(), error.getMessage()));
    }

    /**
     * Streaming variant. The timeout bounds the wait for each chunk; retries only
     * happen before the first chunk, since the subscriber would otherwise see duplicates.
     */
    protected <T> Flux<T> executeStream(Flux<T> stream, RelaygateProperties.ProviderConfig config) {
        return stream
                .timeout(config.getTimeout())
                .onErrorMap(error -> classify(error, config.getName()));
    }

    /**
     * Map any failure to a {@link ProviderException} with a retryable flag.
     */
    protected ProviderException classify(Throwable error, String provider) {
        if (error instanceof ProviderException) {
            return (ProviderException) error;
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            int status = response.getStatusCode().value();
            return new ProviderException(provider, status, ProviderException.isRetryableStatus(status),
                    "HTTP " + status + " " + truncate(response.getResponseBodyAsString()), error);
        }
        if (error instanceof TimeoutException) {
            return ProviderException.timeout(provider, error);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return ProviderException.connection(provider, error);
        }
        if (error instanceof CodecException || error instanceof JsonProcessingException) {
            return new ProviderException(provider, null, false, "malformed response: " + error.getMessage(), error);
        }
        return new ProviderException(provider, null, false, String.valueOf(error.getMessage()), error);
    }

    /**
     * Check if an error is retryable.
     */
    protected boolean isRetryable(Throwable throwable) {
        return throwable instanceof ProviderException && ((ProviderException) throwable).isRetryable();
    }

    protected String bearer(RelaygateProperties.ProviderConfig config) {
        return "Bearer " + config.getApiKey();
    }

    protected boolean hasApiKey(RelaygateProperties.ProviderConfig config) {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    private Retry retrySpec(RelaygateProperties.ProviderConfig config) {
        return Retry.backoff(config.getMaxRetries(), RETRY_BACKOFF)
                .maxBackoff(MAX_RETRY_BACKOFF)
                .filter(this::isRetryable)
                .doBeforeRetry(signal -> log.warn("Retrying provider {} (attempt {}): {}",
                        config.getName(), signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_DETAIL ? body.substring(0, MAX_ERROR_DETAIL) + "..." : body;
    }
}
