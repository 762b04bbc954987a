package com.relaygate.controller;

import com.relaygate.exception.InvalidRequestException;
import com.relaygate.exception.NoRouteException;
import com.relaygate.exception.ProviderChainExhaustedException;
import com.relaygate.exception.ProviderException;
import com.relaygate.model.dto.ApiErrorResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebInputException;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapInvalidRequestToBadRequest() {
        StepVerifier.create(handler.handleGateway(new InvalidRequestException("Model must be specified")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("invalid_request_error", body.getError().getType());
                    assertEquals("invalid_request", body.getError().getCode());
                    assertEquals("Model must be specified", body.getError().getMessage());
                    assertNull(body.getError().getAttempts());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapNoRouteToServiceUnavailable() {
        StepVerifier.create(handler.handleGateway(new NoRouteException("opus")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
                    assertEquals("no_route", response.getBody().getError().getCode());
                })
                .verifyComplete();
    }

    @Test
    void shouldListAttemptsWhenChainIsExhausted() {
        ProviderChainExhaustedException ex = new ProviderChainExhaustedException(List.of(
                new ProviderChainExhaustedException.Attempt("anthropic", "claude-opus-4", "timeout"),
                new ProviderChainExhaustedException.Attempt("openai", "claude-opus-4", "HTTP 503")));

        StepVerifier.create(handler.handleGateway(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
                    List<ApiErrorResponse.AttemptView> attempts = response.getBody().getError().getAttempts();
                    assertEquals(2, attempts.size());
                    assertEquals("anthropic", attempts.get(0).getProvider());
                    assertEquals("HTTP 503", attempts.get(1).getReason());
                })
                .verifyComplete();
    }

    @Test
    void shouldSurfaceTerminalUpstreamClientError() {
        ProviderException ex = new ProviderException("openai", 400, false, "HTTP 400: bad schema");

        StepVerifier.create(handler.handleGateway(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("upstream_error", response.getBody().getError().getType());
                    assertEquals("provider_http_400", response.getBody().getError().getCode());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleUnreadableBody() {
        StepVerifier.create(handler.handleUnreadableInput(new ServerWebInputException("Failed to read HTTP message")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("Failed to read HTTP message", response.getBody().getError().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalArgumentException() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("limit must be positive")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("limit must be positive", response.getBody().getError().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("database password is hunter2")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getError().getMessage());
                    assertEquals("internal_error", response.getBody().getError().getCode());
                })
                .verifyComplete();
    }
}
