package com.relaygate.controller;

import com.relaygate.exception.GatewayException;
import com.relaygate.exception.ProviderChainExhaustedException;
import com.relaygate.model.dto.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Maps exceptions to the OpenAI-style error envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGateway(GatewayException ex) {
        log.warn("[API] {} {}: {}", ex.getStatus().value(), ex.getCode(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.of(ex.getType(), ex.getCode(), ex.getMessage());
        if (ex instanceof ProviderChainExhaustedException) {
            body.getError().setAttempts(((ProviderChainExhaustedException) ex).getAttempts().stream()
                    .map(a -> new ApiErrorResponse.AttemptView(a.getProvider(), a.getModel(), a.getReason()))
                    .collect(Collectors.toList()));
        }
        return Mono.just(ResponseEntity.status(ex.getStatus()).body(body));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUnreadableInput(ServerWebInputException ex) {
        log.warn("[API] Unreadable request: {}", ex.getReason());
        return badRequest(ex.getReason() != null ? ex.getReason() : "Malformed request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.of("server_error", "internal_error", "Internal server error");
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> badRequest(String message) {
        ApiErrorResponse body = ApiErrorResponse.of("invalid_request_error", "invalid_request", message);
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }
}
