package com.relaygate.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base for every failure the gateway reports to a client.
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected GatewayException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected GatewayException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    /**
     * OpenAI-style error type for the response body.
     */
    public abstract String getType();
}
